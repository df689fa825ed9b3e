package org.eventbus.rabbitmq.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;

/**
 * Naming policies applied to serialized property names and to event type names.
 *
 * <p>The {@link #wireName()} of a policy is what travels in the naming policy
 * header of a message, e.g. {@code "SnakeCaseLower"}.</p>
 */
public enum NamingPolicyType {

    PASCAL_CASE("PascalCase", PropertyNamingStrategies.UPPER_CAMEL_CASE),
    CAMEL_CASE("CamelCase", PropertyNamingStrategies.LOWER_CAMEL_CASE),
    SNAKE_CASE_LOWER("SnakeCaseLower", PropertyNamingStrategies.SNAKE_CASE),
    SNAKE_CASE_UPPER("SnakeCaseUpper", PropertyNamingStrategies.UPPER_SNAKE_CASE),
    KEBAB_CASE_LOWER("KebabCaseLower", PropertyNamingStrategies.KEBAB_CASE),
    KEBAB_CASE_UPPER("KebabCaseUpper", new UpperKebabCaseStrategy());

    private final String wireName;
    private final PropertyNamingStrategies.NamingBase strategy;

    NamingPolicyType(String wireName, PropertyNamingStrategy strategy) {
        this.wireName = wireName;
        this.strategy = (PropertyNamingStrategies.NamingBase) strategy;
    }

    public String wireName() {
        return wireName;
    }

    public PropertyNamingStrategy strategy() {
        return strategy;
    }

    /**
     * Convert a name (typically a class simple name) with this policy.
     * {@link #PASCAL_CASE} leaves Java type names untouched.
     */
    public String convertName(String name) {
        if (name == null || name.isEmpty() || this == PASCAL_CASE) {
            return name;
        }
        return strategy.translate(name);
    }

    /**
     * Parse a policy from its wire name ({@code "SnakeCaseLower"}) or its
     * constant name ({@code "SNAKE_CASE_LOWER"}), ignoring case, dashes and underscores.
     *
     * @throws IllegalArgumentException if the value matches no policy
     */
    public static NamingPolicyType fromName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Naming policy must not be null");
        }
        String normalized = normalize(value);
        for (NamingPolicyType type : values()) {
            if (normalize(type.wireName).equals(normalized) || normalize(type.name()).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown naming policy: " + value);
    }

    private static String normalize(String value) {
        return value.replace("_", "").replace("-", "").trim().toLowerCase();
    }

    private static final class UpperKebabCaseStrategy extends PropertyNamingStrategies.NamingBase {
        @Override
        public String translate(String input) {
            String lower = translateLowerCaseWithSeparator(input, '-');
            return lower == null ? null : lower.toUpperCase();
        }
    }
}
