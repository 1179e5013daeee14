package eu.okaeri.datatables.config;

/**
 * What happens when a creator declines to build a predicate for a column filter value.
 */
public enum ColumnFilterDeclinePolicy {

    /**
     * Abort the call with {@link eu.okaeri.datatables.creator.CreatorDeclinedException}.
     */
    FAIL,

    /**
     * Skip the column, same as the global search does.
     */
    OMIT
}
