package eu.okaeri.datatables.creators;

import java.util.Optional;

/**
 * Boolean properties, accepts {@code true} and {@code false} ignoring case.
 */
public class BooleanCreator extends ValuePropertyCreator {

    public BooleanCreator() {
        super(boolean.class);
    }

    @Override
    protected Optional<ValuePredicate> createValuePredicate(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Optional.of(Boolean.TRUE::equals);
        }
        if ("false".equalsIgnoreCase(value)) {
            return Optional.of(Boolean.FALSE::equals);
        }
        return Optional.empty();
    }
}
