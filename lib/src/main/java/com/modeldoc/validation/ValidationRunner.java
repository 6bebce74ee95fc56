package com.modeldoc.validation;

import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.model.Model;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Runs a fixed list of rules and concatenates their diagnostics in rule order. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static ValidationRunner defaultRules() {
        return new ValidationRunner(List.of(new DuplicateEquationNameRule()));
    }

    public List<LoaderMessage> run(Model model) {
        List<LoaderMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(model));
        }
        return diagnostics;
    }
}
