package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.config.ColumnFilterDeclinePolicy;
import eu.okaeri.datatables.creator.CreatorDeclinedException;
import eu.okaeri.datatables.creator.CreatorRegistry;
import eu.okaeri.datatables.property.PropertyDescriptor;
import eu.okaeri.datatables.property.PropertyResolver;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.DataTablesRequest;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Builds one predicate per column carrying its own filter value.
 * The caller AND-combines the result.
 * <p>
 * The searchable flag is not consulted, a filter value alone selects the column.
 */
public class ColumnFilterExpressionBuilder<T> extends FilterExpressionBuilder<T> {

    private static final Logger LOGGER = Logger.getLogger(ColumnFilterExpressionBuilder.class.getSimpleName());

    private final ColumnFilterDeclinePolicy declinePolicy;

    public ColumnFilterExpressionBuilder(@NonNull Class<T> modelType, @NonNull PropertyResolver resolver,
                                         @NonNull CreatorRegistry creators, @NonNull ColumnFilterDeclinePolicy declinePolicy) {
        super(modelType, resolver, creators);
        this.declinePolicy = declinePolicy;
    }

    @Override
    public Optional<List<FilterExpression<T>>> build(@NonNull DataTablesRequest request) {
        List<Column> filteredColumns = request.getColumns().stream()
            .filter(Column::hasFilter)
            .collect(Collectors.toList());

        if (filteredColumns.isEmpty()) {
            return Optional.empty();
        }

        List<FilterExpression<T>> expressions = new ArrayList<>(filteredColumns.size());

        for (Column column : filteredColumns) {
            PropertyDescriptor<T> property = this.resolve(column);
            Optional<Predicate<T>> predicate = this.createPredicate(column, column.getSearch(), property);

            if (predicate.isPresent()) {
                expressions.add(new FilterExpression<>(column, column.getSearch(), predicate.get()));
                continue;
            }

            if (this.declinePolicy == ColumnFilterDeclinePolicy.FAIL) {
                throw new CreatorDeclinedException(property, column.getSearch().getValue());
            }

            LOGGER.fine("Skipping filter '" + column.getSearch().getValue() + "' of column '" + column.getName()
                + "': creator for " + property.getType().getName() + " declined");
        }

        return Optional.of(expressions);
    }
}
