package com.saika.ast;

/**
 * A point in a source file. Lines and columns are 1-based; columns count code points.
 */
public record Position(int line, int column, String file) {

    public Position {
        if (file == null) {
            file = "";
        }
    }

    public Position(int line, int column) {
        this(line, column, "");
    }

    @Override
    public String toString() {
        if (!file.isEmpty()) {
            return file + ":" + line + ":" + column;
        }
        return "line " + line + ", column " + column;
    }
}
