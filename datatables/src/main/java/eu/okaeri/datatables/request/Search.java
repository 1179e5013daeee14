package eu.okaeri.datatables.request;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Search criterion, either global or attached to a single column.
 * A {@code null} or whitespace-only value means no criterion, Unicode spaces included.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Search {

    private final String value;

    public static Search of(String value) {
        return new Search(value);
    }

    public boolean hasValue() {
        return (this.value != null) && !this.value.isBlank();
    }

    /**
     * Checks if the given criterion carries a usable value.
     *
     * @param search the criterion, may be null
     * @return true if the criterion is present and not blank
     */
    public static boolean isSpecified(Search search) {
        return (search != null) && search.hasValue();
    }
}
