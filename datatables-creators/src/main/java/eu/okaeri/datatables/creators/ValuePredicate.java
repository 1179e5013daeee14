package eu.okaeri.datatables.creators;

/**
 * Check of a single, non-null property value.
 */
@FunctionalInterface
public interface ValuePredicate {

    boolean check(Object value);
}
