package eu.okaeri.datatables.creators;

import eu.okaeri.datatables.creator.PropertyExpressionCreator;
import eu.okaeri.datatables.property.PropertyDescriptor;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.Search;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Base of creators that turn the search value into a {@link ValuePredicate}.
 * Records with a null property value never match.
 */
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class ValuePropertyCreator implements PropertyExpressionCreator {

    @Getter
    @NonNull
    private final Class<?> targetType;

    /**
     * Interpret the trimmed search value.
     *
     * @param value the search value, never blank
     * @return the value check, or empty if the value means nothing for this type
     */
    protected abstract Optional<ValuePredicate> createValuePredicate(String value);

    @Override
    public <T> Optional<Predicate<T>> createPredicate(@NonNull Column column, @NonNull Search search, @NonNull PropertyDescriptor<T> property) {
        Optional<ValuePredicate> valuePredicate = this.createValuePredicate(search.getValue().strip());
        if (!valuePredicate.isPresent()) {
            return Optional.empty();
        }

        ValuePredicate check = valuePredicate.get();
        Predicate<T> predicate = record -> {
            Object value = property.read(record);
            return (value != null) && check.check(value);
        };
        return Optional.of(predicate);
    }
}
