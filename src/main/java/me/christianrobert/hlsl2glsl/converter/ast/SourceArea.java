package me.christianrobert.hlsl2glsl.converter.ast;

import java.util.Objects;

/**
 * Location of a node in the shader source, used for diagnostics.
 */
public class SourceArea {

    public static final SourceArea IGNORE = new SourceArea(null, 0, 0, 0);

    private final String sourceName;
    private final int row;
    private final int column;
    private final int length;

    public SourceArea(String sourceName, int row, int column, int length) {
        this.sourceName = sourceName;
        this.row = row;
        this.column = column;
        this.length = length;
    }

    public static SourceArea at(int row, int column) {
        return new SourceArea(null, row, column, 0);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public int getLength() {
        return length;
    }

    public boolean isValid() {
        return row > 0 && column > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceArea that = (SourceArea) o;
        return row == that.row && column == that.column && length == that.length
                && Objects.equals(sourceName, that.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, row, column, length);
    }

    @Override
    public String toString() {
        if (!isValid()) {
            return "<unknown>";
        }
        String prefix = sourceName != null ? sourceName + ":" : "";
        return prefix + row + ":" + column;
    }
}
