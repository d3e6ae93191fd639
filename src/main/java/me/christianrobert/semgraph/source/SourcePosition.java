package me.christianrobert.semgraph.source;

import java.util.Objects;

/**
 * Source location (line, column) attached to a {@link SourceNode} by the upstream parser.
 * Column is optional; lines start at 1.
 */
public final class SourcePosition {

    private final int line;
    private final Integer column;

    public SourcePosition(int line, Integer column) {
        if (line < 1) {
            throw new IllegalArgumentException("Line must be >= 1, was " + line);
        }
        this.line = line;
        this.column = column;
    }

    public static SourcePosition of(int line) {
        return new SourcePosition(line, null);
    }

    public static SourcePosition of(int line, int column) {
        return new SourcePosition(line, column);
    }

    public int getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }

    public boolean hasColumn() {
        return column != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourcePosition that = (SourcePosition) o;
        return line == that.line && Objects.equals(column, that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return column != null ? line + ":" + column : String.valueOf(line);
    }
}
