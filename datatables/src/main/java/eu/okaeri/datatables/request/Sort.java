package eu.okaeri.datatables.request;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Sort directive of a column. Lower {@link #getOrder()} values are applied first.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Sort {

    private final int order;
    private final SortDirection direction;

    public static Sort asc(int order) {
        return new Sort(order, SortDirection.ASC);
    }

    public static Sort desc(int order) {
        return new Sort(order, SortDirection.DESC);
    }

    public static Sort of(int order, @NonNull SortDirection direction) {
        return new Sort(order, direction);
    }
}
