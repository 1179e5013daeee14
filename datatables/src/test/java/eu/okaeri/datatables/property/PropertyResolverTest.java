package eu.okaeri.datatables.property;

import eu.okaeri.datatables.fixtures.Address;
import eu.okaeri.datatables.fixtures.Person;
import eu.okaeri.datatables.request.Column;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyResolverTest {

    private final PropertyResolver resolver = new PropertyResolver();

    public static class Coordinates {

        private final int x;

        public Coordinates(int x) {
            this.x = x;
        }

        public int x() {
            return this.x;
        }
    }

    public static class Exploding {

        public String getValue() {
            throw new IllegalStateException("boom");
        }
    }

    @Nested
    class Resolve {

        @Test
        void resolves_getter_by_property_name() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "name");
            assertThat(property.getType()).isEqualTo(String.class);
            assertThat(property.getPath()).isEqualTo("name");
            assertThat(property.getModelType()).isEqualTo(Person.class);
            assertThat(property.read(Person.builder().name("alice").build())).isEqualTo("alice");
        }

        @Test
        void resolves_capitalized_name() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "Age");
            assertThat(property.getType()).isEqualTo(Integer.class);
            assertThat(property.read(Person.builder().age(42).build())).isEqualTo(42);
        }

        @Test
        void resolves_boolean_is_getter() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "active");
            assertThat(property.getType()).isEqualTo(boolean.class);
            assertThat(property.read(Person.builder().active(true).build())).isEqualTo(true);
        }

        @Test
        void resolves_fluent_accessor() {
            PropertyDescriptor<Coordinates> property = resolver.resolve(Coordinates.class, "x");
            assertThat(property.getType()).isEqualTo(int.class);
            assertThat(property.read(new Coordinates(7))).isEqualTo(7);
        }

        @Test
        void resolves_nested_path() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "address.city");
            assertThat(property.getType()).isEqualTo(String.class);
            assertThat(property.read(Person.builder().address(new Address("Warsaw")).build())).isEqualTo("Warsaw");
        }

        @Test
        void nested_path_reads_null_through_null_intermediate() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "address.city");
            assertThat(property.read(Person.builder().build())).isNull();
        }

        @Test
        void field_override_takes_precedence_over_name() {
            Column column = Column.named("Contact").field("email").build();
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, column);
            assertThat(property.getPath()).isEqualTo("email");
        }

        @Test
        void name_is_used_without_field_override() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, Column.named("score").build());
            assertThat(property.getPath()).isEqualTo("score");
            assertThat(property.getType()).isEqualTo(int.class);
        }
    }

    @Nested
    class Types {

        @Test
        void boxed_primitive_is_nullable_value_type() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "age");
            assertThat(property.isNullableValueType()).isTrue();
            assertThat(property.getType()).isEqualTo(Integer.class);
            assertThat(property.getNullableUnderlyingType()).isEqualTo(int.class);
        }

        @Test
        void primitive_is_value_type() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "score");
            assertThat(property.isNullableValueType()).isFalse();
            assertThat(property.getType()).isEqualTo(int.class);
        }

        @Test
        void string_is_reference_type() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "name");
            assertThat(property.isNullableValueType()).isFalse();
            assertThat(property.getType()).isEqualTo(String.class);
        }

        @Test
        void reference_type_has_no_underlying_type() {
            PropertyDescriptor<Person> property = resolver.resolve(Person.class, "address");
            assertThat(property.getType()).isEqualTo(Address.class);
            assertThat(property.getNullableUnderlyingType()).isNull();
        }
    }

    @Nested
    class Failures {

        @Test
        void unknown_property_throws_with_name_and_type() {
            assertThatThrownBy(() -> resolver.resolve(Person.class, "missing"))
                .isInstanceOf(PropertyNotFoundException.class)
                .hasMessageContaining("missing")
                .hasMessageContaining(Person.class.getName())
                .satisfies(exception -> {
                    PropertyNotFoundException notFound = (PropertyNotFoundException) exception;
                    assertThat(notFound.getPropertyName()).isEqualTo("missing");
                    assertThat(notFound.getModelType()).isEqualTo(Person.class);
                });
        }

        @Test
        void unknown_nested_property_throws_with_full_path() {
            assertThatThrownBy(() -> resolver.resolve(Person.class, "address.zip"))
                .isInstanceOf(PropertyNotFoundException.class)
                .hasMessageContaining("address.zip");
        }

        @Test
        void object_methods_are_not_properties() {
            assertThatThrownBy(() -> resolver.resolve(Person.class, "class"))
                .isInstanceOf(PropertyNotFoundException.class);
            assertThatThrownBy(() -> resolver.resolve(Person.class, "hashCode"))
                .isInstanceOf(PropertyNotFoundException.class);
        }

        @Test
        void empty_segment_throws() {
            assertThatThrownBy(() -> resolver.resolve(Person.class, "address."))
                .isInstanceOf(PropertyNotFoundException.class);
        }

        @Test
        void case_sensitive_by_default() {
            assertThatThrownBy(() -> resolver.resolve(Person.class, "EMAIL"))
                .isInstanceOf(PropertyNotFoundException.class);
        }

        @Test
        void ignore_case_matches_whole_name() {
            PropertyResolver ignoreCase = new PropertyResolver(true);
            assertThat(ignoreCase.resolve(Person.class, "EMAIL").getType()).isEqualTo(String.class);
        }

        @Test
        void accessor_failure_is_wrapped() {
            PropertyDescriptor<Exploding> property = resolver.resolve(Exploding.class, "value");
            assertThatThrownBy(() -> property.read(new Exploding()))
                .isInstanceOf(PropertyAccessException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("value");
        }
    }
}
