package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.config.ExpressionCreatorConfig;
import eu.okaeri.datatables.creator.CreatorRegistry;
import eu.okaeri.datatables.property.PropertyResolver;
import eu.okaeri.datatables.request.DataTablesRequest;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Creates search, column filter and sort expressions of a grid request for one model type.
 * <p>
 * Instances hold no per-call state and can be shared between threads.
 *
 * @param <T> record type
 */
public class ExpressionCreator<T> {

    private static final Logger LOGGER = Logger.getLogger(ExpressionCreator.class.getSimpleName());

    @Getter
    private final Class<T> modelType;
    private final SearchExpressionBuilder<T> searchBuilder;
    private final ColumnFilterExpressionBuilder<T> columnFilterBuilder;
    private final SortExpressionBuilder<T> sortBuilder;

    protected ExpressionCreator(@NonNull Class<T> modelType, @NonNull CreatorRegistry searchCreators,
                                @NonNull CreatorRegistry columnFilterCreators, @NonNull ExpressionCreatorConfig config) {
        PropertyResolver resolver = new PropertyResolver(config.isIgnorePropertyCase());
        this.modelType = modelType;
        this.searchBuilder = new SearchExpressionBuilder<>(modelType, resolver, searchCreators);
        this.columnFilterBuilder = new ColumnFilterExpressionBuilder<>(modelType, resolver, columnFilterCreators, config.getColumnFilterDeclinePolicy());
        this.sortBuilder = new SortExpressionBuilder<>(modelType, resolver);
    }

    public static <T> ExpressionCreator<T> of(@NonNull Class<T> modelType, @NonNull CreatorRegistry creators) {
        return of(modelType, creators, creators);
    }

    public static <T> ExpressionCreator<T> of(@NonNull Class<T> modelType, @NonNull CreatorRegistry searchCreators,
                                              @NonNull CreatorRegistry columnFilterCreators) {
        return of(modelType, searchCreators, columnFilterCreators, ExpressionCreatorConfig.defaults());
    }

    public static <T> ExpressionCreator<T> of(@NonNull Class<T> modelType, @NonNull CreatorRegistry searchCreators,
                                              @NonNull CreatorRegistry columnFilterCreators, @NonNull ExpressionCreatorConfig config) {
        return new ExpressionCreator<>(modelType, searchCreators, columnFilterCreators, config);
    }

    /**
     * Create all expressions of the request.
     *
     * @param request the grid request
     * @return search, column filter and sort expressions
     * @throws eu.okaeri.datatables.DataTablesException if a column cannot be resolved or has no creator
     */
    public QueryableExpressions<T> createExpressions(@NonNull DataTablesRequest request) {
        Optional<List<FilterExpression<T>>> searchExpressions = this.createSearchExpressions(request);
        Optional<List<FilterExpression<T>>> columnFilterExpressions = this.createColumnFilterExpressions(request);
        List<OrderExpression<T>> sortExpressions = this.createSortExpressions(request);

        LOGGER.fine(() -> "Created expressions for " + this.modelType.getSimpleName() + ": "
            + searchExpressions.map(List::size).map(String::valueOf).orElse("no") + " search, "
            + columnFilterExpressions.map(List::size).map(String::valueOf).orElse("no") + " column filter, "
            + sortExpressions.size() + " sort");

        return new QueryableExpressions<>(searchExpressions, columnFilterExpressions, sortExpressions);
    }

    public Optional<List<FilterExpression<T>>> createSearchExpressions(@NonNull DataTablesRequest request) {
        return this.searchBuilder.build(request);
    }

    public Optional<List<FilterExpression<T>>> createColumnFilterExpressions(@NonNull DataTablesRequest request) {
        return this.columnFilterBuilder.build(request);
    }

    public List<OrderExpression<T>> createSortExpressions(@NonNull DataTablesRequest request) {
        return this.sortBuilder.build(request);
    }

    /**
     * OR-combine predicates, folding from the first one.
     *
     * @param predicates one or more predicates
     * @return predicate matching records matched by any of the given predicates
     * @throws IllegalArgumentException if the list is empty
     */
    public static <T> Predicate<T> combine(@NonNull List<Predicate<T>> predicates) {
        if (predicates.isEmpty()) throw new IllegalArgumentException("one or more predicate is required");
        Predicate<T> combined = predicates.get(0);
        for (Predicate<T> predicate : predicates.subList(1, predicates.size())) {
            combined = combined.or(predicate);
        }
        return combined;
    }
}
