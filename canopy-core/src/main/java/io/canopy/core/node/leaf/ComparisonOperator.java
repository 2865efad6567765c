package io.canopy.core.node.leaf;

import io.canopy.core.util.Values;
import java.util.Arrays;

/// Operators understood by {@link Compare}.
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /// Applies the operator.
    ///
    /// Ordering operators yield `false` when the operands have no common ordering.
    ///
    /// @param left stored value, may be null
    /// @param right reference value, may be null
    /// @return the comparison result
    public boolean test(Object left, Object right) {
        if (this == EQ) {
            return Values.looselyEquals(left, right);
        }
        if (this == NE) {
            return !Values.looselyEquals(left, right);
        }
        int order;
        try {
            order = Values.compare(left, right);
        } catch (IllegalArgumentException | ClassCastException e) {
            // incomparable values never satisfy an ordering
            return false;
        }
        return switch (this) {
            case GT -> order > 0;
            case LT -> order < 0;
            case GE -> order >= 0;
            case LE -> order <= 0;
            default -> throw new IllegalStateException("Unexpected operator: " + this);
        };
    }

    /// Looks an operator up by symbol (`>=`) or by name (`GE`).
    ///
    /// @throws IllegalArgumentException if nothing matches
    public static ComparisonOperator fromSymbol(String text) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(text) || op.name().equalsIgnoreCase(text))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + text));
    }
}
