package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.Search;
import lombok.Data;
import lombok.NonNull;
import lombok.ToString;

import java.util.function.Predicate;

/**
 * Predicate built for one column from one search criterion.
 *
 * @param <T> record type
 */
@Data
public class FilterExpression<T> {

    @NonNull
    private final Column column;

    @NonNull
    private final Search search;

    @NonNull
    @ToString.Exclude
    private final Predicate<T> predicate;

    public boolean test(@NonNull T record) {
        return this.predicate.test(record);
    }
}
