package com.qcollector.backend.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlIdentifiersTest {

    @Test
    @DisplayName("Plain snake_case names are accepted and quoted")
    void acceptsSimpleIdentifiers() {
        assertThat(SqlIdentifiers.isValid("form_123_answers")).isTrue();
        assertThat(SqlIdentifiers.isValid("_hidden")).isTrue();
        assertThat(SqlIdentifiers.quote("customer_name")).isEqualTo("\"customer_name\"");
    }

    @Test
    @DisplayName("Names that could break out of the statement are rejected")
    void rejectsInjectionAttempts() {
        assertThat(SqlIdentifiers.isValid("name; DROP TABLE users")).isFalse();
        assertThat(SqlIdentifiers.isValid("a\"b")).isFalse();
        assertThat(SqlIdentifiers.isValid("1column")).isFalse();
        assertThat(SqlIdentifiers.isValid("")).isFalse();
        assertThat(SqlIdentifiers.isValid(null)).isFalse();
        assertThatThrownBy(() -> SqlIdentifiers.requireValid("bad-name"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bad-name");
    }

    @Test
    @DisplayName("Upper-case letters are rejected so quoted and unquoted uses name the same column")
    void rejectsMixedCase() {
        assertThat(SqlIdentifiers.isValid("Email")).isFalse();
        assertThat(SqlIdentifiers.isValid("FORM_ANSWERS")).isFalse();
        assertThat(SqlIdentifiers.isValid("email")).isTrue();
        assertThatThrownBy(() -> SqlIdentifiers.quote("Email"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Identifiers longer than 63 characters are rejected")
    void rejectsOverlongIdentifiers() {
        assertThat(SqlIdentifiers.isValid("a".repeat(63))).isTrue();
        assertThat(SqlIdentifiers.isValid("a".repeat(64))).isFalse();
    }

    @Test
    @DisplayName("Column types allow precision and array suffixes only")
    void validatesDataTypes() {
        assertThat(SqlIdentifiers.isValidType("TEXT")).isTrue();
        assertThat(SqlIdentifiers.isValidType("VARCHAR(255)")).isTrue();
        assertThat(SqlIdentifiers.isValidType("NUMERIC(10, 2)")).isTrue();
        assertThat(SqlIdentifiers.isValidType("timestamp with time zone")).isTrue();
        assertThat(SqlIdentifiers.isValidType("TEXT[]")).isTrue();
        assertThat(SqlIdentifiers.isValidType("TEXT; DROP TABLE x")).isFalse();
        assertThat(SqlIdentifiers.isValidType(null)).isFalse();
    }
}
