package com.modeldoc.loader.ast;

import java.util.List;

/** Equations grouped under a {@code --region} marker, or the unmarked run between markers. */
public final class RegionNode {
    private final String name;
    private final List<EquationNode> equations;
    private final SourceLocation location;

    public RegionNode(String name, List<EquationNode> equations, SourceLocation location) {
        this.name = name;
        this.equations = List.copyOf(equations);
        this.location = location;
    }

    /** Region label, empty for an unmarked region. */
    public String getName() {
        return name;
    }

    public List<EquationNode> getEquations() {
        return equations;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
