package eu.okaeri.datatables.expression;

import eu.okaeri.datatables.config.ColumnFilterDeclinePolicy;
import eu.okaeri.datatables.creator.CreatorDeclinedException;
import eu.okaeri.datatables.creator.CreatorNotFoundException;
import eu.okaeri.datatables.creator.CreatorRegistry;
import eu.okaeri.datatables.fixtures.Person;
import eu.okaeri.datatables.fixtures.TestCreators;
import eu.okaeri.datatables.property.PropertyResolver;
import eu.okaeri.datatables.request.Column;
import eu.okaeri.datatables.request.DataTablesRequest;
import eu.okaeri.datatables.request.Search;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.okaeri.datatables.fixtures.Requests.filtered;
import static eu.okaeri.datatables.fixtures.Requests.plain;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnFilterExpressionBuilderTest {

    private static final CreatorRegistry CREATORS = CreatorRegistry.of(TestCreators.stringEquals(), TestCreators.intEquals());

    private static ColumnFilterExpressionBuilder<Person> builder(ColumnFilterDeclinePolicy policy) {
        return new ColumnFilterExpressionBuilder<>(Person.class, new PropertyResolver(), CREATORS, policy);
    }

    @Test
    void no_filter_values_yield_no_criteria() {
        DataTablesRequest request = DataTablesRequest.builder()
            .column(plain("name"))
            .column(filtered("email", " "))
            .column(Column.named("age").search(Search.of(null)).build())
            .search(Search.of("global search is ignored"))
            .build();

        assertThat(builder(ColumnFilterDeclinePolicy.FAIL).build(request)).isEmpty();
    }

    @Test
    void unicode_whitespace_filter_values_yield_no_criteria() {
        DataTablesRequest request = DataTablesRequest.builder()
            .column(filtered("name", "\u2003"))
            .column(filtered("score", "\u3000"))
            .build();

        // would decline on the int column and fail if treated as a value
        assertThat(builder(ColumnFilterDeclinePolicy.FAIL).build(request)).isEmpty();
    }

    @Test
    void filter_applies_regardless_of_searchable_flag() {
        DataTablesRequest request = DataTablesRequest.builder()
            .column(filtered("name", "alice"))
            .column(plain("email"))
            .column(filtered("age", "30"))
            .build();

        List<FilterExpression<Person>> expressions = builder(ColumnFilterDeclinePolicy.FAIL).build(request).orElseThrow();

        assertThat(expressions).extracting(expression -> expression.getColumn().getName())
            .containsExactly("name", "age");
        assertThat(expressions.get(0).getSearch().getValue()).isEqualTo("alice");
        assertThat(expressions.get(1).getSearch().getValue()).isEqualTo("30");

        Person alice = Person.builder().name("alice").age(30).build();
        Person older = Person.builder().name("alice").age(31).build();
        assertThat(expressions).allSatisfy(expression -> assertThat(expression.test(alice)).isTrue());
        assertThat(expressions.get(1).test(older)).isFalse();
    }

    @Test
    void decline_fails_by_policy() {
        DataTablesRequest request = DataTablesRequest.builder()
            .column(filtered("name", "alice"))
            .column(filtered("score", "lots"))
            .build();

        assertThatThrownBy(() -> builder(ColumnFilterDeclinePolicy.FAIL).build(request))
            .isInstanceOf(CreatorDeclinedException.class)
            .hasMessageContaining("lots")
            .hasMessageContaining("score");
    }

    @Test
    void decline_omits_column_by_policy() {
        DataTablesRequest request = DataTablesRequest.builder()
            .column(filtered("name", "alice"))
            .column(filtered("score", "lots"))
            .build();

        List<FilterExpression<Person>> expressions = builder(ColumnFilterDeclinePolicy.OMIT).build(request).orElseThrow();

        assertThat(expressions).extracting(expression -> expression.getColumn().getName())
            .containsExactly("name");
    }

    @Test
    void missing_creator_is_fatal() {
        DataTablesRequest request = DataTablesRequest.builder()
            .column(filtered("active", "true"))
            .build();

        assertThatThrownBy(() -> builder(ColumnFilterDeclinePolicy.OMIT).build(request))
            .isInstanceOf(CreatorNotFoundException.class);
    }
}
