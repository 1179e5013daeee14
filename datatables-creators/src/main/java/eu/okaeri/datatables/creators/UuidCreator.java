package eu.okaeri.datatables.creators;

import java.util.Optional;
import java.util.UUID;

public class UuidCreator extends ValuePropertyCreator {

    public UuidCreator() {
        super(UUID.class);
    }

    @Override
    protected Optional<ValuePredicate> createValuePredicate(String value) {
        UUID expected;
        try {
            expected = UUID.fromString(value);
        } catch (IllegalArgumentException exception) {
            return Optional.empty();
        }
        return Optional.of(expected::equals);
    }
}
