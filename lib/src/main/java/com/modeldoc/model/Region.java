package com.modeldoc.model;

import java.util.List;
import java.util.Objects;

public final class Region {
    private final String name;
    private final List<Equation> equations;

    public Region(String name, List<Equation> equations) {
        this.name = name == null ? "" : name;
        this.equations = List.copyOf(equations);
    }

    /** Label from the {@code --region} marker, empty for an unmarked region. */
    public String getName() {
        return name;
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }

    public List<Equation> getEquations() {
        return equations;
    }

    public Region withEquations(List<Equation> replacement) {
        return new Region(name, replacement);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Region)) {
            return false;
        }
        Region other = (Region) obj;
        return name.equals(other.name) && equations.equals(other.equations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, equations);
    }
}
