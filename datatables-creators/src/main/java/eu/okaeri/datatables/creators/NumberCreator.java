package eu.okaeri.datatables.creators;

import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Numeric properties, compared by value whatever their boxed type. Declines values that are not numbers.
 * <p>
 * With comparisons enabled the value may start with a {@link NumberOperator}:
 * {@code >10}, {@code >=10}, {@code <10}, {@code <=10} or {@code =10}.
 */
@Getter
public class NumberCreator extends ValuePropertyCreator {

    /**
     * Types handled by {@link #allOf(boolean)}. Boxed properties are matched through their primitive type.
     */
    public static final List<Class<?>> NUMBER_TYPES = Collections.unmodifiableList(Arrays.asList(
        byte.class, short.class, int.class, long.class, float.class, double.class, BigInteger.class, BigDecimal.class
    ));

    private final boolean comparisons;

    public NumberCreator(@NonNull Class<?> targetType, boolean comparisons) {
        super(targetType);
        this.comparisons = comparisons;
    }

    public static NumberCreator[] allOf(boolean comparisons) {
        return NUMBER_TYPES.stream()
            .map(type -> new NumberCreator(type, comparisons))
            .toArray(NumberCreator[]::new);
    }

    @Override
    protected Optional<ValuePredicate> createValuePredicate(String value) {
        Optional<NumberOperator> prefix = this.comparisons ? NumberOperator.prefixOf(value) : Optional.empty();
        String number = prefix
            .map(operator -> value.substring(operator.getSymbol().length()).strip())
            .orElse(value);

        BigDecimal operand = parse(number);
        if (operand == null) {
            return Optional.empty();
        }

        return Optional.of(prefix.orElse(NumberOperator.EQUAL).predicate(operand));
    }

    private static BigDecimal parse(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException exception) {
            return null;
        }
    }
}
