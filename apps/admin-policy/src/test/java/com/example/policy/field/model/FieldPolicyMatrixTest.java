package com.example.policy.field.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FieldPolicyMatrix")
class FieldPolicyMatrixTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should read the three column array form")
    void shouldReadColumns() throws Exception {
        String json = "[[{\"label\":\"Email\",\"rol\":\"users#page:list#email\",\"col\":\"default\",\"checked\":false}],"
                + "[{\"label\":\"Email\",\"rol\":\"users#page:list#email\",\"col\":\"allow\",\"checked\":true}],"
                + "[{\"label\":\"Email\",\"rol\":\"users#page:list#email\",\"col\":\"deny\",\"checked\":false}]]";

        FieldPolicyMatrix matrix = objectMapper.readValue(json, FieldPolicyMatrix.class);

        assertThat(matrix.allow()).containsExactly(
                new FieldPolicyRow("Email", "users#page:list#email", "allow", true));
        assertThat(matrix.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("should write rows without a column name omitting the col property")
    void shouldOmitMissingColumn() throws Exception {
        FieldPolicyMatrix matrix = new FieldPolicyMatrix(
                List.of(FieldPolicyRow.of("Email", "users#page:list#email")), List.of(), List.of());

        assertThat(objectMapper.writeValueAsString(matrix))
                .isEqualTo("[[{\"label\":\"Email\",\"rol\":\"users#page:list#email\",\"checked\":false}],[],[]]");
    }

    @Test
    @DisplayName("should treat an empty array as an empty matrix and reject other sizes")
    void shouldValidateColumnCount() {
        assertThat(FieldPolicyMatrix.fromColumns(List.of()).isEmpty()).isTrue();
        assertThatThrownBy(() -> FieldPolicyMatrix.fromColumns(List.of(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
