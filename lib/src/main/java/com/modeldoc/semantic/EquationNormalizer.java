package com.modeldoc.semantic;

import com.modeldoc.loader.ast.EquationNode;
import com.modeldoc.loader.ast.ModelFileNode;
import com.modeldoc.loader.ast.RegionNode;
import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;
import com.modeldoc.model.Region;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns parsed equations into their canonical form: sides trimmed, reassembled as
 * {@code left = right}, and everything lower-cased. Original casing is not kept.
 */
public final class EquationNormalizer {

    public Model normalize(ModelFileNode modelFile) {
        List<Region> regions = new ArrayList<>();
        for (RegionNode region : modelFile.getRegions()) {
            List<Equation> equations = new ArrayList<>(region.getEquations().size());
            for (EquationNode node : region.getEquations()) {
                equations.add(normalize(node));
            }
            regions.add(new Region(region.getName(), equations));
        }
        return new Model(regions);
    }

    public Equation normalize(EquationNode node) {
        return Equation.of(
                lower(node.getName().trim()),
                lower(node.getLeftSide().trim()),
                lower(node.getRightSide().trim()),
                node.getLocation());
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
