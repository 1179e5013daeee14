package eu.okaeri.datatables.creator;

import eu.okaeri.datatables.property.PropertyDescriptor;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping of declared property types to their creators.
 */
public final class CreatorRegistry {

    private final Map<Class<?>, PropertyExpressionCreator> creators;

    private CreatorRegistry(Map<Class<?>, PropertyExpressionCreator> creators) {
        this.creators = Collections.unmodifiableMap(new LinkedHashMap<>(creators));
    }

    public static CreatorRegistry of(@NonNull PropertyExpressionCreator... creators) {
        return of(Arrays.asList(creators));
    }

    public static CreatorRegistry of(@NonNull Collection<? extends PropertyExpressionCreator> creators) {
        Builder builder = builder();
        creators.forEach(builder::register);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find the creator for the declared property type, falling back to the
     * nullable-underlying type for boxed properties.
     *
     * @param property the resolved property
     * @return matching creator or empty
     */
    public Optional<PropertyExpressionCreator> find(@NonNull PropertyDescriptor<?> property) {
        PropertyExpressionCreator creator = this.creators.get(property.getType());
        if ((creator == null) && property.isNullableValueType()) {
            creator = this.creators.get(property.getNullableUnderlyingType());
        }
        return Optional.ofNullable(creator);
    }

    public Collection<PropertyExpressionCreator> getCreators() {
        return this.creators.values();
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Builder {

        private final Map<Class<?>, PropertyExpressionCreator> creators = new LinkedHashMap<>();

        /**
         * @throws IllegalArgumentException if a creator for the same target type is already registered
         */
        public Builder register(@NonNull PropertyExpressionCreator creator) {
            Class<?> targetType = creator.getTargetType();
            if (targetType == null) {
                throw new IllegalArgumentException("creator " + creator.getClass().getName() + " declares no target type");
            }
            PropertyExpressionCreator existing = this.creators.putIfAbsent(targetType, creator);
            if (existing != null) {
                throw new IllegalArgumentException("duplicate creator for type " + targetType.getName() + ": "
                    + existing.getClass().getName() + " and " + creator.getClass().getName());
            }
            return this;
        }

        public Builder registerAll(@NonNull Collection<? extends PropertyExpressionCreator> creators) {
            creators.forEach(this::register);
            return this;
        }

        public CreatorRegistry build() {
            return new CreatorRegistry(this.creators);
        }
    }
}
