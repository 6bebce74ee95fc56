package com.modeldoc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.loader.ModelAstBuilder;
import com.modeldoc.model.Model;
import com.modeldoc.semantic.EquationNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class DuplicateEquationNameRuleTest {

    private static Model model(String input) throws Exception {
        return new EquationNormalizer().normalize(new ModelAstBuilder().parse("dup.inp", input));
    }

    @Test
    void acceptsDistinctNames() throws Exception {
        assertTrue(new DuplicateEquationNameRule().validate(model("ADDEQ, a: a = 1, b: b = a;")).isEmpty());
    }

    @Test
    void warnsOnNamesDifferingOnlyInCase() throws Exception {
        List<LoaderMessage> messages =
                new DuplicateEquationNameRule().validate(model("ADDEQ,\ngdp: gdp = 1,\nGDP: GDP = 2;"));

        assertEquals(1, messages.size());
        LoaderMessage message = messages.get(0);
        assertEquals(LoaderMessage.Level.WARNING, message.getLevel());
        assertEquals("dup.inp", message.getSourceFilename());
        assertEquals(3, message.getSourceLineno());
        assertTrue(message.getMessage().startsWith("Duplicate equation name 'gdp'"), message.getMessage());
        assertTrue(message.getMessage().contains("dup.inp:2:1"), message.getMessage());
    }

    @Test
    void runnerConcatenatesRulesInOrder() throws Exception {
        ValidationRule extra =
                model -> List.of(new LoaderMessage(LoaderMessage.Level.INFO, "checked", null, 0));
        ValidationRunner runner = new ValidationRunner(List.of(new DuplicateEquationNameRule(), extra));

        List<LoaderMessage> messages = runner.run(model("ADDEQ, a: a = 1, a: a = 2;"));

        assertEquals(2, messages.size());
        assertEquals(LoaderMessage.Level.WARNING, messages.get(0).getLevel());
        assertEquals("checked", messages.get(1).getMessage());
    }
}
