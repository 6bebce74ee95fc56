package com.modeldoc.render.html;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.modeldoc.loader.ast.SourceLocation;
import com.modeldoc.model.DocumentModel;
import com.modeldoc.model.Equation;
import com.modeldoc.model.Model;
import com.modeldoc.model.Region;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

class HtmlModelRendererTest {

    private static String render(Model model) throws Exception {
        StringWriter out = new StringWriter();
        new HtmlModelRenderer("R&D <model>").render(new DocumentModel(model, "01/02/2024 - 10h30"), out);
        return out.toString();
    }

    @Test
    void writesRegionsAndEquations() throws Exception {
        Equation y =
                Equation.of("y", "y", "x", SourceLocation.unknown())
                        .withWholeEquation("<a href=\"#y\" class=\"main_variable\">y</a> = <a href=\"#x\">x</a>")
                        .withVariables(List.of("x"))
                        .withLegend("Output & more");
        Equation x = Equation.of("x", "x", "1", SourceLocation.unknown()).withAppearsIn(List.of("y"));
        Model model = new Model(List.of(new Region("Supply", List.of(y)), new Region("", List.of(x))));

        String html = render(model);

        assertTrue(html.contains("<title>R&amp;D &lt;model&gt;</title>"));
        assertTrue(html.contains("2 equations. Generated on 01/02/2024 - 10h30."));
        assertTrue(html.contains("<h2>Supply</h2>"));
        assertEquals(1, html.split("<h2>", -1).length - 1);
        assertTrue(html.contains("<div class=\"equation\" id=\"y\">"));
        assertTrue(html.contains("<p class=\"legend\">Output &amp; more</p>"));
        assertTrue(
                html.contains(
                        "<p class=\"whole_equation\"><a href=\"#y\" class=\"main_variable\">y</a>"
                                + " = <a href=\"#x\">x</a></p>"));
        assertTrue(html.contains("Variables: <a href=\"#x\">x</a>"));
        assertTrue(html.contains("Appears in: <a href=\"#y\">y</a>"));
        assertTrue(html.indexOf("id=\"y\"") < html.indexOf("id=\"x\""));
    }

    @Test
    void omitsEmptySections() throws Exception {
        Model model = new Model(List.of(new Region("", List.of(Equation.of("z", "z", "1", SourceLocation.unknown())))));

        String html = render(model);

        assertFalse(html.contains("class=\"legend\""));
        assertFalse(html.contains("class=\"links\""));
        assertTrue(html.trim().endsWith("</html>"));
    }

    @Test
    void escapesEquationTextButKeepsAnchors() throws Exception {
        Equation x =
                Equation.of("x", "x", "a<b & c", SourceLocation.unknown())
                        .withWholeEquation(
                                "<a href=\"#x\" class=\"main_variable\">x</a> = a<b & <a href=\"#c\">\"c\"</a>");
        Model model = new Model(List.of(new Region("", List.of(x))));

        String html = render(model);

        assertTrue(
                html.contains(
                        "<p class=\"whole_equation\"><a href=\"#x\" class=\"main_variable\">x</a>"
                                + " = a&lt;b &amp; <a href=\"#c\">&quot;c&quot;</a></p>"),
                html);
    }

    @Test
    void escapesMarkupCharacters() {
        assertEquals("a &lt;b&gt; &amp; &quot;c&quot;", HtmlModelRenderer.escape("a <b> & \"c\""));
    }
}
