package eu.okaeri.datatables.request;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;

/**
 * Already parsed grid request: the ordered columns and the global search.
 */
@Data
@Builder
public class DataTablesRequest {

    @NonNull
    @Singular
    private final List<Column> columns;

    private final Search search;

    public boolean hasSearch() {
        return Search.isSpecified(this.search);
    }
}
