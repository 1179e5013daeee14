package eu.okaeri.datatables.creators;

import eu.okaeri.datatables.creator.CreatorRegistry;
import eu.okaeri.datatables.creator.PropertyExpressionCreator;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.Arrays;

/**
 * Ready-made registries for common scalar property types.
 * <p>
 * Application types (enums in particular) are passed as {@code extra} creators:
 * <pre>{@code
 * ExpressionCreator<Order> creator = ExpressionCreator.of(Order.class,
 *     DefaultCreators.search(EnumCreator.startingWith(Status.class)),
 *     DefaultCreators.columnFilter(EnumCreator.equalTo(Status.class)));
 * }</pre>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DefaultCreators {

    /**
     * Global search: substring match for strings, exact match for everything else.
     *
     * @param extra additional creators, must not repeat a default target type
     * @return search registry
     */
    public static CreatorRegistry search(@NonNull PropertyExpressionCreator... extra) {
        return base(false)
            .registerAll(Arrays.asList(extra))
            .build();
    }

    /**
     * Column filters: like {@link #search(PropertyExpressionCreator...)} with
     * {@code >}, {@code >=}, {@code <} and {@code <=} accepted for numbers.
     *
     * @param extra additional creators, must not repeat a default target type
     * @return column filter registry
     */
    public static CreatorRegistry columnFilter(@NonNull PropertyExpressionCreator... extra) {
        return base(true)
            .registerAll(Arrays.asList(extra))
            .build();
    }

    private static CreatorRegistry.Builder base(boolean numberComparisons) {
        return CreatorRegistry.builder()
            .register(StringCreator.contains())
            .registerAll(Arrays.asList(NumberCreator.allOf(numberComparisons)))
            .register(new BooleanCreator())
            .register(new UuidCreator())
            .register(new LocalDateCreator());
    }
}
