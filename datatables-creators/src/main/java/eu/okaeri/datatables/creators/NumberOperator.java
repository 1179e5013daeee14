package eu.okaeri.datatables.creators;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.IntPredicate;

import static eu.okaeri.datatables.util.ValueUtils.compareNumbers;

/**
 * Comparison written in front of a numeric column filter, e.g. {@code >=10}.
 */
@Getter
@RequiredArgsConstructor
public enum NumberOperator {

    // two-character symbols first, so ">=" is not read as ">"
    GREATER_OR_EQUAL(">=", result -> result >= 0),
    LESS_OR_EQUAL("<=", result -> result <= 0),
    GREATER(">", result -> result > 0),
    LESS("<", result -> result < 0),
    EQUAL("=", result -> result == 0);

    private final String symbol;
    @Getter(AccessLevel.NONE)
    private final IntPredicate accepts;

    /**
     * Operator the value starts with.
     *
     * @param value the filter value
     * @return the operator or empty for a plain number
     */
    public static Optional<NumberOperator> prefixOf(@NonNull String value) {
        for (NumberOperator operator : values()) {
            if (value.startsWith(operator.symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the property value relates to the operand as this operator requires.
     */
    public boolean test(@NonNull Number value, @NonNull BigDecimal operand) {
        return this.accepts.test(compareNumbers(value, operand));
    }

    /**
     * @param operand the number on the right-hand side
     * @return predicate over numeric property values
     */
    public ValuePredicate predicate(@NonNull BigDecimal operand) {
        return value -> this.test((Number) value, operand);
    }
}
