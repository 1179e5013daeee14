package eu.okaeri.datatables.creators;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Date properties, matches ISO dates ({@code 2024-01-31}).
 */
public class LocalDateCreator extends ValuePropertyCreator {

    public LocalDateCreator() {
        super(LocalDate.class);
    }

    @Override
    protected Optional<ValuePredicate> createValuePredicate(String value) {
        LocalDate expected;
        try {
            expected = LocalDate.parse(value);
        } catch (DateTimeParseException exception) {
            return Optional.empty();
        }
        return Optional.of(expected::equals);
    }
}
