package com.sparkify.rowset;

import java.util.Objects;

/**
 * Equality condition between a left-side column and a right-side column.
 */
public final class JoinKey {

    private final String leftColumn;
    private final String rightColumn;

    private JoinKey(String leftColumn, String rightColumn) {
        this.leftColumn = Objects.requireNonNull(leftColumn, "leftColumn");
        this.rightColumn = Objects.requireNonNull(rightColumn, "rightColumn");
    }

    public static JoinKey on(String leftColumn, String rightColumn) {
        return new JoinKey(leftColumn, rightColumn);
    }

    public String getLeftColumn() {
        return leftColumn;
    }

    public String getRightColumn() {
        return rightColumn;
    }

    @Override
    public String toString() {
        return "left." + leftColumn + " = right." + rightColumn;
    }
}
