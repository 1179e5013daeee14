package eu.okaeri.datatables.creator;

import eu.okaeri.datatables.DataTablesException;
import eu.okaeri.datatables.property.PropertyDescriptor;
import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a creator declines a column filter value and the decline policy is
 * {@link eu.okaeri.datatables.config.ColumnFilterDeclinePolicy#FAIL}.
 */
@Getter
public class CreatorDeclinedException extends DataTablesException {

    private final String propertyName;
    private final String value;

    public CreatorDeclinedException(@NonNull PropertyDescriptor<?> property, String value) {
        super("Expression creator for type '" + property.getType().getName() + "' declined filter value '"
            + value + "' of property '" + property.getPath() + "' on type '" + property.getModelType().getName() + "'");
        this.propertyName = property.getPath();
        this.value = value;
    }
}
