package eu.okaeri.datatables.property;

import eu.okaeri.datatables.DataTablesException;
import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a column does not match any readable property of the model.
 */
@Getter
public class PropertyNotFoundException extends DataTablesException {

    private final String propertyName;
    private final Class<?> modelType;

    public PropertyNotFoundException(@NonNull String propertyName, @NonNull Class<?> modelType) {
        super("Cannot find a readable property with the name '" + propertyName + "' on type '" + modelType.getName() + "'");
        this.propertyName = propertyName;
        this.modelType = modelType;
    }
}
