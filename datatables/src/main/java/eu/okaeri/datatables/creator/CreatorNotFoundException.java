package eu.okaeri.datatables.creator;

import eu.okaeri.datatables.DataTablesException;
import eu.okaeri.datatables.property.PropertyDescriptor;
import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when no creator is registered for a property type or its nullable-underlying type.
 */
@Getter
public class CreatorNotFoundException extends DataTablesException {

    private final String propertyName;
    private final Class<?> propertyType;
    private final Class<?> modelType;

    public CreatorNotFoundException(@NonNull PropertyDescriptor<?> property) {
        super("Cannot find an expression creator for type '" + property.getType().getName() + "' (property '"
            + property.getPath() + "' on type '" + property.getModelType().getName() + "')");
        this.propertyName = property.getPath();
        this.propertyType = property.getType();
        this.modelType = property.getModelType();
    }
}
