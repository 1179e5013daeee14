package eu.okaeri.datatables.creators;

import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Optional;

/**
 * Properties of one enum type, matched against constant names ignoring case.
 * Declines values that match no constant.
 */
@Getter
public class EnumCreator<E extends Enum<E>> extends ValuePropertyCreator {

    private final Class<E> enumType;
    private final MatchMode mode;

    public EnumCreator(@NonNull Class<E> enumType, @NonNull MatchMode mode) {
        super(enumType);
        this.enumType = enumType;
        this.mode = mode;
    }

    public static <E extends Enum<E>> EnumCreator<E> equalTo(@NonNull Class<E> enumType) {
        return new EnumCreator<>(enumType, MatchMode.EQUALS);
    }

    public static <E extends Enum<E>> EnumCreator<E> startingWith(@NonNull Class<E> enumType) {
        return new EnumCreator<>(enumType, MatchMode.STARTS_WITH);
    }

    @Override
    protected Optional<ValuePredicate> createValuePredicate(String value) {
        ValuePredicate nameCheck = this.mode.textPredicate(value, true);
        boolean anyMatches = Arrays.stream(this.enumType.getEnumConstants())
            .anyMatch(constant -> nameCheck.check(constant.name()));
        if (!anyMatches) {
            return Optional.empty();
        }
        return Optional.of(constant -> nameCheck.check(((Enum<?>) constant).name()));
    }
}
