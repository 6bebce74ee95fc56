package com.modeldoc.validation;

import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Warns when two equations share a name once lower-cased. Links and legends are keyed by name, so
 * the second equation's anchor is unreachable in the rendered document.
 */
public final class DuplicateEquationNameRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(Model model) {
        List<LoaderMessage> messages = new ArrayList<>();
        Map<String, Equation> seen = new HashMap<>();
        for (Equation equation : model.getEquations()) {
            Equation first = seen.putIfAbsent(equation.getName(), equation);
            if (first != null) {
                messages.add(
                        new LoaderMessage(
                                LoaderMessage.Level.WARNING,
                                "Duplicate equation name '"
                                        + equation.getName()
                                        + "' (first defined at "
                                        + first.getLocation()
                                        + ")",
                                equation.getLocation().getSourceName(),
                                equation.getLocation().getLine()));
            }
        }
        return messages;
    }
}
