package com.modeldoc.semantic;

import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;
import com.modeldoc.table.KeyValueTable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Attaches a label to each equation whose name contains a legend key at an identifier boundary.
 * When several keys match, the one enumerated last in the table wins.
 */
public final class LegendAnnotator {
    private static final Logger LOGGER = Logger.getLogger(LegendAnnotator.class.getName());

    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final KeyValueTable legends;

    public LegendAnnotator(KeyValueTable legends) {
        this.legends = Objects.requireNonNull(legends, "legends");
        for (String key : legends.keys()) {
            patterns.put(key, HyperlinkMarkup.boundaryPattern(key));
        }
    }

    public Model annotate(Model model) {
        LOGGER.info("Inserting legends...");
        return model.mapEquations(this::annotate);
    }

    public Equation annotate(Equation equation) {
        String name = equation.getName();
        String legend = equation.getLegend();
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            String key = entry.getKey();
            if (entry.getValue().matcher(name).find()) {
                legend = legends.get(key);
                LOGGER.fine("Inserting legend " + key + " corresponding to " + name);
            }
        }
        return equation.withLegend(legend);
    }
}
