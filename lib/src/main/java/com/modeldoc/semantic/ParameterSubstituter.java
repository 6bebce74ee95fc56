package com.modeldoc.semantic;

import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;
import com.modeldoc.table.KeyValueTable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Replaces parameter names in equation text by their values, taken literally.
 *
 * <p>Parameters are applied one after the other, in table order, each on the output of the
 * previous one. A value that contains the name of a parameter applied later is therefore
 * substituted again. Anchor markup from the linker is left untouched; the link text is not.</p>
 */
public final class ParameterSubstituter {
    private static final Logger LOGGER = Logger.getLogger(ParameterSubstituter.class.getName());

    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final KeyValueTable parameters;

    public ParameterSubstituter(KeyValueTable parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        for (String name : parameters.keys()) {
            patterns.put(name, HyperlinkMarkup.boundaryPattern(name));
        }
    }

    public Model substitute(Model model) {
        LOGGER.info("Replacing parameter names by their values...");
        return model.mapEquations(this::substitute);
    }

    public Equation substitute(Equation equation) {
        String text = equation.getWholeEquation();
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            String name = entry.getKey();
            if (!HyperlinkMarkup.containsOutsideMarkup(text, entry.getValue())) {
                continue;
            }
            String value = parameters.get(name);
            text = HyperlinkMarkup.replaceOutsideMarkup(text, entry.getValue(), match -> value);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Replacing the parameter " + name + " in " + equation.getName() + ": " + text);
            }
        }
        return equation.withWholeEquation(text);
    }
}
