package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.creator.CreatorNotFoundException;
import eu.okaeri.datatables.creator.CreatorRegistry;
import eu.okaeri.datatables.creator.PropertyExpressionCreator;
import eu.okaeri.datatables.property.PropertyDescriptor;
import eu.okaeri.datatables.property.PropertyResolver;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.DataTablesRequest;
import eu.okaeri.datatables.request.Search;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Shared column dispatch of the search and column filter builders.
 *
 * @param <T> record type
 */
public abstract class FilterExpressionBuilder<T> {

    @Getter
    private final Class<T> modelType;
    private final PropertyResolver resolver;
    private final CreatorRegistry creators;

    protected FilterExpressionBuilder(@NonNull Class<T> modelType, @NonNull PropertyResolver resolver, @NonNull CreatorRegistry creators) {
        this.modelType = modelType;
        this.resolver = resolver;
        this.creators = creators;
    }

    /**
     * Build the filter expressions for the request.
     *
     * @param request the grid request
     * @return expressions in column order, or empty if no criteria of this kind were given
     */
    public abstract Optional<List<FilterExpression<T>>> build(@NonNull DataTablesRequest request);

    protected PropertyDescriptor<T> resolve(Column column) {
        return this.resolver.resolve(this.modelType, column);
    }

    /**
     * Dispatch to the creator registered for the property type.
     *
     * @return the predicate, or empty if the creator declined
     * @throws CreatorNotFoundException if no creator handles the property type
     */
    protected Optional<Predicate<T>> createPredicate(Column column, Search search, PropertyDescriptor<T> property) {
        PropertyExpressionCreator creator = this.creators.find(property)
            .orElseThrow(() -> new CreatorNotFoundException(property));
        return creator.createPredicate(column, search, property);
    }
}
