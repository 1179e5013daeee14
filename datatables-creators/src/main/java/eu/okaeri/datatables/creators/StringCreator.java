package eu.okaeri.datatables.creators;

import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * String properties, never declines.
 */
@Getter
public class StringCreator extends ValuePropertyCreator {

    private final MatchMode mode;
    private final boolean ignoreCase;

    public StringCreator(@NonNull MatchMode mode, boolean ignoreCase) {
        super(String.class);
        this.mode = mode;
        this.ignoreCase = ignoreCase;
    }

    /**
     * Case-insensitive substring match.
     */
    public static StringCreator contains() {
        return new StringCreator(MatchMode.CONTAINS, true);
    }

    @Override
    protected Optional<ValuePredicate> createValuePredicate(String value) {
        return Optional.of(this.mode.textPredicate(value, this.ignoreCase));
    }
}
