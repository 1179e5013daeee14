package eu.okaeri.datatables.request;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
public class Column {

    /**
     * Column name as sent by the grid.
     */
    @NonNull
    private final String name;

    /**
     * Optional model property path, takes precedence over {@link #name}.
     */
    private final String field;

    private final boolean searchable;
    private final boolean sortable;

    /**
     * Per-column filter value, independent of {@link #searchable}.
     */
    private final Search search;

    private final Sort sort;

    public static ColumnBuilder named(@NonNull String name) {
        return builder().name(name);
    }

    /**
     * Name used to look up the model property.
     */
    public String getPropertyName() {
        return (this.field != null) ? this.field : this.name;
    }

    public boolean hasFilter() {
        return Search.isSpecified(this.search);
    }

    public boolean hasSort() {
        return this.sortable && (this.sort != null);
    }
}
