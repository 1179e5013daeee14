package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.property.PropertyDescriptor;
import eu.okaeri.datatables.property.PropertyResolver;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.DataTablesRequest;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the sort keys of all sorted columns, ordered by sort priority.
 * <p>
 * Boxed primitive properties produce two keys: presence first, then the value.
 * The value key only breaks ties between records that both have or both lack a value.
 */
public class SortExpressionBuilder<T> {

    private final Class<T> modelType;
    private final PropertyResolver resolver;

    public SortExpressionBuilder(@NonNull Class<T> modelType, @NonNull PropertyResolver resolver) {
        this.modelType = modelType;
        this.resolver = resolver;
    }

    /**
     * @param request the grid request
     * @return sort keys in application order, possibly empty
     */
    public List<OrderExpression<T>> build(@NonNull DataTablesRequest request) {
        // List.sort is stable, equal priorities keep column order
        List<Column> sortingColumns = request.getColumns().stream()
            .filter(Column::hasSort)
            .collect(Collectors.toCollection(ArrayList::new));
        sortingColumns.sort(Comparator.comparingInt(column -> column.getSort().getOrder()));

        List<OrderExpression<T>> expressions = new ArrayList<>();
        for (Column column : sortingColumns) {
            PropertyDescriptor<T> property = this.resolver.resolve(this.modelType, column);

            if (property.isNullableValueType()) {
                expressions.add(new OrderExpression<>(column, column.getSort(), record -> property.read(record) != null));
                expressions.add(new OrderExpression<>(column, column.getSort(), property::read));
                continue;
            }

            // primitives arrive boxed and never null, references may be null and sort first
            expressions.add(new OrderExpression<>(column, column.getSort(), property::read));
        }

        return expressions;
    }
}
