package eu.okaeri.datatables.property;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.function.Function;

/**
 * Readable property of a model type, as resolved by {@link PropertyResolver}.
 *
 * @param <T> model type
 */
@Getter
@ToString(exclude = "accessor")
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class PropertyDescriptor<T> {

    private final Class<T> modelType;

    /**
     * Resolved path, dot separated for nested properties.
     */
    private final String path;

    /**
     * Declared type of the (last) accessor.
     */
    private final Class<?> type;

    /**
     * Primitive type wrapped by {@link #type} when it is a boxed primitive, otherwise null.
     */
    private final Class<?> nullableUnderlyingType;

    @Getter(AccessLevel.NONE)
    private final Function<T, Object> accessor;

    /**
     * Reads the property value from a record.
     * Nested paths yield null when an intermediate value is null.
     *
     * @param record the record to read from
     * @return the value, may be null
     * @throws PropertyAccessException if the accessor fails
     */
    public Object read(@NonNull T record) {
        return this.accessor.apply(record);
    }

    public boolean isNullableValueType() {
        return this.nullableUnderlyingType != null;
    }
}
