package com.modeldoc.semantic;

import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Computes forward ({@code variables}) and reverse ({@code appearsIn}) references between
 * equations and turns every referenced name into an anchor.
 *
 * <p>Names are identifiers, so a name occurs at an identifier boundary exactly when some maximal
 * run of identifier characters in the text equals it. Each equation is tokenized once against an
 * index of all names. Variables are reported in model order (region order, then equation order),
 * not in text order.</p>
 */
public final class CrossReferenceLinker {
    private static final Logger LOGGER = Logger.getLogger(CrossReferenceLinker.class.getName());
    private static final Pattern IDENTIFIER = HyperlinkMarkup.identifierPattern();

    public Model link(Model model) {
        LOGGER.info("Linking: making html links on variables in equations...");
        Map<String, Integer> nameIndex = indexNames(model.getEquations());
        Model linked = model.mapEquations(equation -> linkEquation(equation, nameIndex));

        LOGGER.info("Reverse linking: finding in which equations variables appear...");
        Map<String, Set<String>> referrers = new LinkedHashMap<>();
        for (Equation equation : linked.getEquations()) {
            for (String variable : equation.getVariables()) {
                referrers.computeIfAbsent(variable, key -> new LinkedHashSet<>()).add(equation.getName());
            }
        }
        return linked.mapEquations(
                equation -> {
                    Set<String> appearsIn = referrers.getOrDefault(equation.getName(), Set.of());
                    return equation.withAppearsIn(new ArrayList<>(appearsIn));
                });
    }

    private static Map<String, Integer> indexNames(List<Equation> equations) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (Equation equation : equations) {
            index.putIfAbsent(equation.getName(), index.size());
        }
        return index;
    }

    private Equation linkEquation(Equation equation, Map<String, Integer> nameIndex) {
        String self = equation.getName();
        // position in model order -> name, so variables come out in model order
        TreeMap<Integer, String> referenced = new TreeMap<>();
        String text =
                HyperlinkMarkup.replaceOutsideMarkup(
                        equation.getWholeEquation(),
                        IDENTIFIER,
                        match -> {
                            String token = match.group();
                            Integer position = nameIndex.get(token);
                            if (position == null) {
                                return token;
                            }
                            if (token.equals(self)) {
                                return HyperlinkMarkup.selfLink(token);
                            }
                            referenced.put(position, token);
                            return HyperlinkMarkup.link(token);
                        });
        if (LOGGER.isLoggable(Level.FINE)) {
            for (String name : referenced.values()) {
                LOGGER.fine("Making a link on " + name + " in " + self + ": " + text);
            }
        }
        return equation.withWholeEquation(text).withVariables(new ArrayList<>(referenced.values()));
    }
}
