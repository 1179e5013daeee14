package eu.okaeri.datatables.config;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Locale;

/**
 * Configuration for {@link eu.okaeri.datatables.expression.ExpressionCreator}.
 * <p>
 * Global defaults can be configured via system properties:
 * <ul>
 *   <li>{@code okaeri.datatables.ignorePropertyCase} - match accessor names case-insensitively (default: false)</li>
 *   <li>{@code okaeri.datatables.columnFilterDeclinePolicy} - FAIL or OMIT (default: FAIL)</li>
 * </ul>
 */
@Builder
@Getter
public class ExpressionCreatorConfig {

    /**
     * Whether property names are matched against accessor names ignoring case.
     * The first letter is always matched ignoring case.
     */
    @Builder.Default
    private final boolean ignorePropertyCase =
        Boolean.parseBoolean(System.getProperty("okaeri.datatables.ignorePropertyCase", "false"));

    /**
     * Handling of creators declining a column filter value.
     */
    @NonNull
    @Builder.Default
    private final ColumnFilterDeclinePolicy columnFilterDeclinePolicy = ColumnFilterDeclinePolicy.valueOf(
        System.getProperty("okaeri.datatables.columnFilterDeclinePolicy", "FAIL").toUpperCase(Locale.ROOT));

    public static ExpressionCreatorConfig defaults() {
        return builder().build();
    }
}
