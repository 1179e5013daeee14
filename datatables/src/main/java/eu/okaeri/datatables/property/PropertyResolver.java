package eu.okaeri.datatables.property;

import eu.okaeri.datatables.request.Column;
import lombok.NonNull;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves column names to readable properties of a model type.
 * <p>
 * Supported accessors, in order of precedence:
 * - {@code getName()}
 * - {@code isName()} for boolean properties
 * - {@code name()} (records and fluent accessors)
 * <p>
 * Nested properties use dot notation (e.g., "address.city").
 * The first letter of every segment is matched ignoring case, so "Age" and "age" both resolve to {@code getAge()}.
 * Methods of {@link Object} ({@code getClass()}, {@code hashCode()}, {@code toString()}) are never properties.
 */
public class PropertyResolver {

    private static final Map<Class<?>, Class<?>> NULLABLE_WRAPPERS;
    private static final Set<String> OBJECT_METHODS = Arrays.stream(Object.class.getMethods())
        .filter(method -> method.getParameterCount() == 0)
        .map(Method::getName)
        .collect(Collectors.toSet());

    static {
        Map<Class<?>, Class<?>> wrappers = new HashMap<>();
        wrappers.put(Boolean.class, boolean.class);
        wrappers.put(Byte.class, byte.class);
        wrappers.put(Character.class, char.class);
        wrappers.put(Short.class, short.class);
        wrappers.put(Integer.class, int.class);
        wrappers.put(Long.class, long.class);
        wrappers.put(Float.class, float.class);
        wrappers.put(Double.class, double.class);
        NULLABLE_WRAPPERS = Collections.unmodifiableMap(wrappers);
    }

    private final boolean ignoreCase;

    public PropertyResolver() {
        this(false);
    }

    /**
     * @param ignoreCase whether whole accessor names are matched ignoring case
     */
    public PropertyResolver(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    /**
     * Resolve the property of a column, using its field override when present.
     *
     * @param modelType the model class
     * @param column    the column to resolve
     * @return resolved property
     * @throws PropertyNotFoundException if no readable property matches
     */
    public <T> PropertyDescriptor<T> resolve(@NonNull Class<T> modelType, @NonNull Column column) {
        return this.resolve(modelType, column.getPropertyName());
    }

    /**
     * Resolve a property path on the model type.
     *
     * @param modelType the model class
     * @param path      the property name or dot separated path
     * @return resolved property
     * @throws PropertyNotFoundException if no readable property matches
     */
    public <T> PropertyDescriptor<T> resolve(@NonNull Class<T> modelType, @NonNull String path) {
        String[] parts = path.split("\\.", -1);
        List<Method> chain = new ArrayList<>(parts.length);
        Class<?> current = modelType;

        for (String part : parts) {
            Method accessor = part.isEmpty() ? null : this.findAccessor(current, part);
            if (accessor == null) {
                throw new PropertyNotFoundException(path, modelType);
            }
            chain.add(accessor);
            current = accessor.getReturnType();
        }

        return new PropertyDescriptor<>(modelType, path, current, NULLABLE_WRAPPERS.get(current),
            record -> readChain(chain, record, path));
    }

    private Method findAccessor(Class<?> type, String name) {
        String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        String decapitalized = Character.toLowerCase(name.charAt(0)) + name.substring(1);

        Method getter = this.findReadable(type, "get" + capitalized);
        if (getter != null) {
            return getter;
        }

        Method booleanGetter = this.findReadable(type, "is" + capitalized);
        if ((booleanGetter != null) && ((booleanGetter.getReturnType() == boolean.class) || (booleanGetter.getReturnType() == Boolean.class))) {
            return booleanGetter;
        }

        return this.findReadable(type, decapitalized);
    }

    private Method findReadable(Class<?> type, String methodName) {
        for (Method method : type.getMethods()) {
            if (!isReadable(method)) {
                continue;
            }
            boolean matches = this.ignoreCase
                ? method.getName().equalsIgnoreCase(methodName)
                : method.getName().equals(methodName);
            if (matches) {
                method.trySetAccessible();
                return method;
            }
        }
        return null;
    }

    private static boolean isReadable(Method method) {
        return (method.getParameterCount() == 0)
            && (method.getReturnType() != void.class)
            && !Modifier.isStatic(method.getModifiers())
            && !method.isBridge()
            && !OBJECT_METHODS.contains(method.getName());
    }

    private static Object readChain(List<Method> chain, Object record, String path) {
        Object current = record;
        for (Method method : chain) {
            if (current == null) {
                return null;
            }
            try {
                current = method.invoke(current);
            } catch (InvocationTargetException exception) {
                throw new PropertyAccessException("Failed to read property '" + path + "' via " + method.getName() + "()", exception.getCause());
            } catch (IllegalAccessException exception) {
                throw new PropertyAccessException("Cannot access property '" + path + "' via " + method.getName() + "()", exception);
            }
        }
        return current;
    }
}
