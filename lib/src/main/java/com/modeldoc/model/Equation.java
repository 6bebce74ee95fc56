package com.modeldoc.model;

import com.modeldoc.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

/**
 * One equation of the model. Instances are immutable; each pipeline stage derives a new value
 * through the {@code with*} methods.
 */
public final class Equation {
    private final String name;
    private final String leftSide;
    private final String rightSide;
    private final String wholeEquation;
    private final List<String> variables;
    private final List<String> appearsIn;
    private final String legend;
    private final SourceLocation location;

    public Equation(
            String name,
            String leftSide,
            String rightSide,
            String wholeEquation,
            List<String> variables,
            List<String> appearsIn,
            String legend,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.leftSide = Objects.requireNonNull(leftSide, "leftSide");
        this.rightSide = Objects.requireNonNull(rightSide, "rightSide");
        this.wholeEquation = Objects.requireNonNull(wholeEquation, "wholeEquation");
        this.variables = List.copyOf(variables);
        this.appearsIn = List.copyOf(appearsIn);
        this.legend = legend == null ? "" : legend;
        this.location = location == null ? SourceLocation.unknown() : location;
    }

    /** Equation as produced by the parser, before any cross-referencing. */
    public static Equation of(String name, String leftSide, String rightSide, SourceLocation location) {
        return new Equation(
                name, leftSide, rightSide, leftSide + " = " + rightSide, List.of(), List.of(), "", location);
    }

    /** Lower-case identifier, the key used by links, parameters and legends. */
    public String getName() {
        return name;
    }

    public String getLeftSide() {
        return leftSide;
    }

    public String getRightSide() {
        return rightSide;
    }

    /** Display text; carries hyperlink markup once the model is linked. */
    public String getWholeEquation() {
        return wholeEquation;
    }

    /** Names of the other equations referenced by this one, in model order. */
    public List<String> getVariables() {
        return variables;
    }

    /** Names of the equations referencing this one, in model order. */
    public List<String> getAppearsIn() {
        return appearsIn;
    }

    public String getLegend() {
        return legend;
    }

    public boolean hasLegend() {
        return !legend.isEmpty();
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Equation withWholeEquation(String text) {
        return new Equation(name, leftSide, rightSide, text, variables, appearsIn, legend, location);
    }

    public Equation withVariables(List<String> names) {
        return new Equation(name, leftSide, rightSide, wholeEquation, names, appearsIn, legend, location);
    }

    public Equation withAppearsIn(List<String> names) {
        return new Equation(name, leftSide, rightSide, wholeEquation, variables, names, legend, location);
    }

    public Equation withLegend(String text) {
        return new Equation(name, leftSide, rightSide, wholeEquation, variables, appearsIn, text, location);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Equation)) {
            return false;
        }
        Equation other = (Equation) obj;
        return name.equals(other.name)
                && leftSide.equals(other.leftSide)
                && rightSide.equals(other.rightSide)
                && wholeEquation.equals(other.wholeEquation)
                && variables.equals(other.variables)
                && appearsIn.equals(other.appearsIn)
                && legend.equals(other.legend);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, leftSide, rightSide, wholeEquation, variables, appearsIn, legend);
    }

    @Override
    public String toString() {
        return name + ": " + wholeEquation;
    }
}
