package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.creator.CreatorRegistry;
import eu.okaeri.datatables.property.PropertyDescriptor;
import eu.okaeri.datatables.property.PropertyResolver;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.DataTablesRequest;
import eu.okaeri.datatables.request.Search;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Builds one predicate per searchable column for the global search value.
 * The caller OR-combines the result.
 * <p>
 * A creator declining the value only drops its column from the result.
 */
public class SearchExpressionBuilder<T> extends FilterExpressionBuilder<T> {

    private static final Logger LOGGER = Logger.getLogger(SearchExpressionBuilder.class.getSimpleName());

    public SearchExpressionBuilder(@NonNull Class<T> modelType, @NonNull PropertyResolver resolver, @NonNull CreatorRegistry creators) {
        super(modelType, resolver, creators);
    }

    @Override
    public Optional<List<FilterExpression<T>>> build(@NonNull DataTablesRequest request) {
        if (!request.hasSearch()) {
            return Optional.empty();
        }

        List<Column> searchableColumns = request.getColumns().stream()
            .filter(Column::isSearchable)
            .collect(Collectors.toList());

        if (searchableColumns.isEmpty()) {
            return Optional.empty();
        }

        Search search = request.getSearch();
        List<FilterExpression<T>> expressions = new ArrayList<>(searchableColumns.size());

        for (Column column : searchableColumns) {
            PropertyDescriptor<T> property = this.resolve(column);
            Optional<Predicate<T>> predicate = this.createPredicate(column, search, property);

            if (predicate.isPresent()) {
                expressions.add(new FilterExpression<>(column, search, predicate.get()));
            } else {
                LOGGER.fine("Skipping column '" + column.getName() + "' for search '" + search.getValue()
                    + "': creator for " + property.getType().getName() + " declined");
            }
        }

        return Optional.of(expressions);
    }
}
