package com.codeprint.runtime;

/** Holder of one variable shared between a function and the closures it creates. */
public final class Cell {
    private Object contents;

    public Cell(Object contents) {
        this.contents = contents;
    }

    public Object getContents() {
        return contents;
    }

    public void setContents(Object contents) {
        this.contents = contents;
    }

    @Override
    public String toString() {
        return "<cell: " + contents + ">";
    }
}
