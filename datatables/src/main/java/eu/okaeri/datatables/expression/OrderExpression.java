package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.Sort;
import eu.okaeri.datatables.request.SortDirection;
import lombok.Data;
import lombok.NonNull;
import lombok.ToString;

import java.util.Comparator;
import java.util.function.Function;

import static eu.okaeri.datatables.util.ValueUtils.compareForSort;

/**
 * Sort key built for one column. A column may contribute more than one key,
 * later keys only break ties of earlier ones.
 *
 * @param <T> record type
 */
@Data
public class OrderExpression<T> {

    @NonNull
    private final Column column;

    @NonNull
    private final Sort sort;

    @NonNull
    @ToString.Exclude
    private final Function<T, Object> keyExtractor;

    public SortDirection getDirection() {
        return this.sort.getDirection();
    }

    public Object extractKey(@NonNull T record) {
        return this.keyExtractor.apply(record);
    }

    /**
     * Comparator ordering records by this key in the sort direction.
     * Keys are compared with {@link eu.okaeri.datatables.util.ValueUtils#compareForSort(Object, Object)},
     * null keys go first when ascending, like absent values of boxed properties.
     */
    public Comparator<T> toComparator() {
        Comparator<T> comparator = (r1, r2) -> compareForSort(this.extractKey(r1), this.extractKey(r2));
        return (this.getDirection() == SortDirection.DESC) ? comparator.reversed() : comparator;
    }
}
