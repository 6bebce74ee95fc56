package com.modeldoc.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** Ordered regions covering a whole model file. */
public final class Model {
    private final List<Region> regions;

    public Model(List<Region> regions) {
        this.regions = List.copyOf(regions);
    }

    public List<Region> getRegions() {
        return regions;
    }

    /** Every equation, in region order then equation order. */
    public List<Equation> getEquations() {
        List<Equation> equations = new ArrayList<>();
        for (Region region : regions) {
            equations.addAll(region.getEquations());
        }
        return List.copyOf(equations);
    }

    public int getEquationCount() {
        int count = 0;
        for (Region region : regions) {
            count += region.getEquations().size();
        }
        return count;
    }

    /** New model with {@code transform} applied to every equation, keeping the grouping. */
    public Model mapEquations(UnaryOperator<Equation> transform) {
        List<Region> mapped = new ArrayList<>(regions.size());
        for (Region region : regions) {
            List<Equation> equations = new ArrayList<>(region.getEquations().size());
            for (Equation equation : region.getEquations()) {
                equations.add(transform.apply(equation));
            }
            mapped.add(region.withEquations(equations));
        }
        return new Model(mapped);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Model && regions.equals(((Model) obj).regions);
    }

    @Override
    public int hashCode() {
        return regions.hashCode();
    }
}
