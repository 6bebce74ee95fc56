package com.modeldoc.render.html;

import com.modeldoc.model.DocumentModel;
import com.modeldoc.model.Equation;
import com.modeldoc.model.Region;
import com.modeldoc.render.ModelRenderer;
import com.modeldoc.semantic.HyperlinkMarkup;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Single-page HTML documentation: one section per region, one entry per equation with its
 * legend, linked text, dependencies and reverse dependencies.
 */
public final class HtmlModelRenderer implements ModelRenderer {

    private static final Pattern SPECIAL_CHARS = Pattern.compile("[&<>\"]");

    private final String title;

    public HtmlModelRenderer() {
        this("Model documentation");
    }

    public HtmlModelRenderer(String title) {
        this.title = title;
    }

    @Override
    public void render(DocumentModel document, Writer out) throws IOException {
        out.write("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n");
        out.write("<title>" + escape(title) + "</title>\n");
        out.write("<style>\n");
        out.write(".equation { margin-bottom: 1.5em; }\n");
        out.write(".whole_equation { font-family: monospace; }\n");
        out.write("a.main_variable { font-weight: bold; }\n");
        out.write("</style>\n</head>\n<body>\n");
        out.write("<h1>" + escape(title) + "</h1>\n");
        out.write(
                "<p class=\"summary\">"
                        + document.getModel().getEquationCount()
                        + " equations. Generated on "
                        + escape(document.getGeneratedAt())
                        + ".</p>\n");
        for (Region region : document.getModel().getRegions()) {
            writeRegion(region, out);
        }
        out.write("</body>\n</html>\n");
    }

    private static void writeRegion(Region region, Writer out) throws IOException {
        out.write("<section class=\"region\">\n");
        if (region.isNamed()) {
            out.write("<h2>" + escape(region.getName()) + "</h2>\n");
        }
        for (Equation equation : region.getEquations()) {
            writeEquation(equation, out);
        }
        out.write("</section>\n");
    }

    private static void writeEquation(Equation equation, Writer out) throws IOException {
        String name = escape(equation.getName());
        out.write("<div class=\"equation\" id=\"" + name + "\">\n");
        out.write("<h3>" + name + "</h3>\n");
        if (equation.hasLegend()) {
            out.write("<p class=\"legend\">" + escape(equation.getLegend()) + "</p>\n");
        }
        out.write("<p class=\"whole_equation\">" + escapeOutsideAnchors(equation.getWholeEquation()) + "</p>\n");
        writeLinks("Variables", equation.getVariables(), out);
        writeLinks("Appears in", equation.getAppearsIn(), out);
        out.write("</div>\n");
    }

    private static void writeLinks(String label, List<String> names, Writer out) throws IOException {
        if (names.isEmpty()) {
            return;
        }
        out.write("<p class=\"links\">" + label + ": ");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                out.write(", ");
            }
            String name = escape(names.get(i));
            out.write("<a href=\"#" + name + "\">" + name + "</a>");
        }
        out.write("</p>\n");
    }

    /** Escapes equation text while keeping the linker's anchor tags. */
    static String escapeOutsideAnchors(String text) {
        return HyperlinkMarkup.replaceOutsideMarkup(text, SPECIAL_CHARS, match -> escape(match.group()));
    }

    static String escape(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    builder.append("&amp;");
                    break;
                case '<':
                    builder.append("&lt;");
                    break;
                case '>':
                    builder.append("&gt;");
                    break;
                case '"':
                    builder.append("&quot;");
                    break;
                default:
                    builder.append(c);
            }
        }
        return builder.toString();
    }
}
