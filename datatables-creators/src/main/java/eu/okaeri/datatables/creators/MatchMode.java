package eu.okaeri.datatables.creators;

import lombok.NonNull;

import java.util.Locale;

/**
 * How a text property value is matched against the search term.
 */
public enum MatchMode {

    EQUALS {
        @Override
        public boolean matches(String text, String term) {
            return text.equals(term);
        }
    },
    CONTAINS {
        @Override
        public boolean matches(String text, String term) {
            return text.contains(term);
        }
    },
    STARTS_WITH {
        @Override
        public boolean matches(String text, String term) {
            return text.startsWith(term);
        }
    },
    ENDS_WITH {
        @Override
        public boolean matches(String text, String term) {
            return text.endsWith(term);
        }
    };

    /**
     * Case-sensitive match of the text against the term.
     */
    public abstract boolean matches(String text, String term);

    /**
     * Text check for the given term.
     *
     * @param term       the search term
     * @param ignoreCase whether letter case is ignored
     * @return predicate over text values
     */
    public ValuePredicate textPredicate(@NonNull String term, boolean ignoreCase) {
        if (!ignoreCase) {
            return value -> this.matches((String) value, term);
        }
        String lowerTerm = term.toLowerCase(Locale.ROOT);
        return value -> this.matches(((String) value).toLowerCase(Locale.ROOT), lowerTerm);
    }
}
