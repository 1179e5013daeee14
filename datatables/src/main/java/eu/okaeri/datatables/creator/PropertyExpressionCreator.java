package eu.okaeri.datatables.creator;

import eu.okaeri.datatables.property.PropertyDescriptor;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.Search;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Builds record predicates for properties of one declared type.
 * <p>
 * Implementations are registered in a {@link CreatorRegistry} and must be stateless.
 */
public interface PropertyExpressionCreator {

    /**
     * Declared property type handled by this creator. Boxed properties are also
     * matched by creators targeting the corresponding primitive type.
     */
    Class<?> getTargetType();

    /**
     * Build a predicate matching records whose property satisfies the search value.
     *
     * @param column   the column the search applies to
     * @param search   the criterion, never blank
     * @param property the resolved property, used to read values from records
     * @return the predicate, or empty to decline (e.g., the value does not parse for this type)
     */
    <T> Optional<Predicate<T>> createPredicate(Column column, Search search, PropertyDescriptor<T> property);
}
