package eu.okaeri.datatables.util;

import java.math.BigDecimal;

/**
 * Utility methods for comparing property values.
 */
public final class ValueUtils {

    private ValueUtils() {
    }

    /**
     * Compare two values for sorting with type coercion.
     * Handles nulls (sort first, like absent values of boxed properties), numbers,
     * same-type comparables and falls back to string form.
     *
     * @param value1 first value
     * @param value2 second value
     * @return negative if value1 < value2, 0 if equal, positive if value1 > value2
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareForSort(Object value1, Object value2) {
        // Nulls sort first
        if ((value1 == null) && (value2 == null)) return 0;
        if (value1 == null) return -1;
        if (value2 == null) return 1;

        // Both numbers
        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return compareNumbers((Number) value1, (Number) value2);
        }

        // Same comparable type - use natural ordering
        if ((value1 instanceof Comparable) && (value2 instanceof Comparable) && (value1.getClass() == value2.getClass())) {
            return ((Comparable) value1).compareTo(value2);
        }

        // Fallback - string comparison
        return String.valueOf(value1).compareTo(String.valueOf(value2));
    }

    /**
     * Compare two numbers by value regardless of their boxed type.
     * NaN and infinities fall back to {@link Double#compare(double, double)}.
     *
     * @param number1 first number
     * @param number2 second number
     * @return comparison result
     */
    public static int compareNumbers(Number number1, Number number2) {
        if (isNonFinite(number1) || isNonFinite(number2)) {
            return Double.compare(number1.doubleValue(), number2.doubleValue());
        }
        return toBigDecimal(number1).compareTo(toBigDecimal(number2));
    }

    /**
     * Convert a finite number to its exact decimal form.
     *
     * @param number the number
     * @return decimal value
     * @throws NumberFormatException for NaN and infinite values
     */
    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return new BigDecimal(String.valueOf(number));
    }

    private static boolean isNonFinite(Number number) {
        if ((number instanceof Double) || (number instanceof Float)) {
            return !Double.isFinite(number.doubleValue());
        }
        return false;
    }
}
