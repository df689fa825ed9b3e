package org.eventbus.rabbitmq.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamingPolicyTypeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "PASCAL_CASE, OrderCreated",
            "CAMEL_CASE, orderCreated",
            "SNAKE_CASE_LOWER, order_created",
            "SNAKE_CASE_UPPER, ORDER_CREATED",
            "KEBAB_CASE_LOWER, order-created",
            "KEBAB_CASE_UPPER, ORDER-CREATED"
    })
    @DisplayName("convertName applies the policy to a class name")
    void convertName(NamingPolicyType policy, String expected) {
        assertThat(policy.convertName("OrderCreated")).isEqualTo(expected);
    }

    @Test
    @DisplayName("fromName accepts wire names and constant names")
    void fromName() {
        assertThat(NamingPolicyType.fromName("SnakeCaseLower")).isEqualTo(NamingPolicyType.SNAKE_CASE_LOWER);
        assertThat(NamingPolicyType.fromName("SNAKE_CASE_LOWER")).isEqualTo(NamingPolicyType.SNAKE_CASE_LOWER);
        assertThat(NamingPolicyType.fromName("kebab-case-upper")).isEqualTo(NamingPolicyType.KEBAB_CASE_UPPER);
        assertThat(NamingPolicyType.fromName("PascalCase")).isEqualTo(NamingPolicyType.PASCAL_CASE);
    }

    @Test
    @DisplayName("fromName rejects unknown policies")
    void fromNameUnknown() {
        assertThatThrownBy(() -> NamingPolicyType.fromName("ScreamingCase"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ScreamingCase");
        assertThatThrownBy(() -> NamingPolicyType.fromName(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wireNameIsWhatTravelsInTheHeader() {
        assertThat(NamingPolicyType.SNAKE_CASE_LOWER.wireName()).isEqualTo("SnakeCaseLower");
        assertThat(NamingPolicyType.PASCAL_CASE.wireName()).isEqualTo("PascalCase");
    }
}
