package com.instorm.scorecard.model.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RoleTest {

    @ParameterizedTest
    @CsvSource({
            "SALES_DIRECTOR, Sales Director",
            "REGIONAL_SALES_MANAGER, Regional Sales Manager",
            "SALES_LEAD, Sales Lead",
            "SALESPERSON, Salesperson",
            "ADMIN, Administrator"
    })
    void displayLabelCoversEveryKnownRole(String code, String expected) {
        assertThat(Role.displayLabel(code)).isEqualTo(expected);
        assertThat(Role.displayLabel(code)).isEqualTo(Role.displayLabel(code));
    }

    @Test
    void displayLabelReturnsUnknownRoleUnchanged() {
        assertThat(Role.displayLabel("REGIONAL_MANAGER")).isEqualTo("REGIONAL_MANAGER");
        assertThat(Role.displayLabel("sales_director")).isEqualTo("sales_director");
        assertThat(Role.displayLabel("")).isEmpty();
    }

    @Test
    void displayLabelOfNullIsEmpty() {
        assertThat(Role.displayLabel(null)).isEmpty();
    }

    @Test
    void userRoleCheckUsesExactCode() {
        User director = new User("u-1", "d@instorm.io", "Diana", "SALES_DIRECTOR");

        assertThat(director.hasRole(Role.SALES_DIRECTOR)).isTrue();
        assertThat(director.hasRole(Role.SALESPERSON)).isFalse();
        assertThat(Role.fromCode("SALES_LEAD")).contains(Role.SALES_LEAD);
        assertThat(Role.fromCode("UNKNOWN")).isEmpty();
    }
}
