package com.modeldoc.semantic;

import com.modeldoc.loader.ModelAstBuilder;
import com.modeldoc.loader.ModelParseException;
import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;

final class ModelFixtures {

    private ModelFixtures() {}

    /** Parsed and normalized, not linked. */
    static Model normalized(String input) throws ModelParseException {
        return new EquationNormalizer().normalize(new ModelAstBuilder().parse("test.inp", input));
    }

    static Model linked(String input) throws ModelParseException {
        return new CrossReferenceLinker().link(normalized(input));
    }

    static Equation equation(Model model, String name) {
        return model.getEquations().stream()
                .filter(equation -> equation.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No equation " + name));
    }
}
