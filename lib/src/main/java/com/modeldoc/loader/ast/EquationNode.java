package com.modeldoc.loader.ast;

/** One {@code name: left = right} entry exactly as written in the model file. */
public final class EquationNode {
    private final String name;
    private final String leftSide;
    private final String rightSide;
    private final SourceLocation location;

    public EquationNode(String name, String leftSide, String rightSide, SourceLocation location) {
        this.name = name;
        this.leftSide = leftSide;
        this.rightSide = rightSide;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public String getLeftSide() {
        return leftSide;
    }

    public String getRightSide() {
        return rightSide;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
