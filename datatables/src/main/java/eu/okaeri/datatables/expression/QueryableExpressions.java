package eu.okaeri.datatables.expression;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Result of {@link ExpressionCreator#createExpressions(eu.okaeri.datatables.request.DataTablesRequest)}.
 * <p>
 * Search and column filter expressions are empty when no criteria of that kind were
 * given, which is different from a present but empty list (criteria given, nothing built).
 *
 * @param <T> record type
 */
@ToString
public class QueryableExpressions<T> {

    @Getter(AccessLevel.NONE)
    private final List<FilterExpression<T>> searchExpressions;

    @Getter(AccessLevel.NONE)
    private final List<FilterExpression<T>> columnFilterExpressions;

    @Getter
    private final List<OrderExpression<T>> sortExpressions;

    public QueryableExpressions(@NonNull Optional<List<FilterExpression<T>>> searchExpressions,
                                @NonNull Optional<List<FilterExpression<T>>> columnFilterExpressions,
                                @NonNull List<OrderExpression<T>> sortExpressions) {
        this.searchExpressions = searchExpressions.map(Collections::unmodifiableList).orElse(null);
        this.columnFilterExpressions = columnFilterExpressions.map(Collections::unmodifiableList).orElse(null);
        this.sortExpressions = Collections.unmodifiableList(sortExpressions);
    }

    /**
     * Expressions to OR-combine, empty if no global search was given.
     */
    public Optional<List<FilterExpression<T>>> getSearchExpressions() {
        return Optional.ofNullable(this.searchExpressions);
    }

    /**
     * Expressions to AND-combine, empty if no column filter was given.
     */
    public Optional<List<FilterExpression<T>>> getColumnFilterExpressions() {
        return Optional.ofNullable(this.columnFilterExpressions);
    }

    public boolean hasSearchExpressions() {
        return this.searchExpressions != null;
    }

    public boolean hasColumnFilterExpressions() {
        return this.columnFilterExpressions != null;
    }

    public boolean hasSortExpressions() {
        return !this.sortExpressions.isEmpty();
    }

    /**
     * Single predicate matching records that satisfy any search expression.
     * Empty when there are no search expressions to combine.
     */
    public Optional<Predicate<T>> getSearchPredicate() {
        if ((this.searchExpressions == null) || this.searchExpressions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ExpressionCreator.combine(predicatesOf(this.searchExpressions)));
    }

    /**
     * Single predicate matching records that satisfy every column filter expression.
     * Empty when there are no column filter expressions.
     */
    public Optional<Predicate<T>> getColumnFilterPredicate() {
        if ((this.columnFilterExpressions == null) || this.columnFilterExpressions.isEmpty()) {
            return Optional.empty();
        }
        List<Predicate<T>> predicates = predicatesOf(this.columnFilterExpressions);
        Predicate<T> combined = predicates.get(0);
        for (Predicate<T> predicate : predicates.subList(1, predicates.size())) {
            combined = combined.and(predicate);
        }
        return Optional.of(combined);
    }

    /**
     * Comparator applying the sort expressions in order, each one breaking ties of the previous.
     * Empty when nothing is sorted.
     */
    public Optional<Comparator<T>> getSortComparator() {
        Comparator<T> comparator = null;
        for (OrderExpression<T> expression : this.sortExpressions) {
            comparator = (comparator == null)
                ? expression.toComparator()
                : comparator.thenComparing(expression.toComparator());
        }
        return Optional.ofNullable(comparator);
    }

    private static <T> List<Predicate<T>> predicatesOf(List<FilterExpression<T>> expressions) {
        return expressions.stream()
            .map(FilterExpression::getPredicate)
            .collect(Collectors.toList());
    }
}
