package io.github.flameyossnowy.naturaldb.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Comparison operators accepted by field filters.
 */
public enum Operator {
    EQ("eq", "="),
    NE("ne", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    CONTAINS("contains", null);

    private final String label;
    private final String symbol;

    Operator(String label, String symbol) {
        this.label = label;
        this.symbol = symbol;
    }

    /**
     * Resolves an operator by its name ({@code "gte"}) or symbol ({@code ">="}), ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static @NotNull Operator fromName(@NotNull String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator.label.equals(normalized) || normalized.equals(operator.symbol)) {
                return operator;
            }
        }
        if (normalized.equals("==")) {
            return EQ;
        }
        throw new IllegalArgumentException("Unknown operator: " + value);
    }
}
