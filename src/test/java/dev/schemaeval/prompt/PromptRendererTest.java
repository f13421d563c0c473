package dev.schemaeval.prompt;

import static dev.schemaeval.TestHarness.json;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PromptRendererTest {
    private final PromptRenderer renderer = new PromptRenderer();

    @Test
    void replacesEveryOccurrenceWithCompactJson() {
        var item = json("{\n  \"first_name\": \"Ann\",\n  \"tags\": [1, 2]\n}");
        var rendered = renderer.render("A: {{INPUT_DATA}}\nB: {{INPUT_DATA}}", item);
        assertEquals(
                "A: {\"first_name\":\"Ann\",\"tags\":[1,2]}\n"
                        + "B: {\"first_name\":\"Ann\",\"tags\":[1,2]}",
                rendered);
    }

    @Test
    void leavesEverythingElseUntouched() {
        var rendered = renderer.render("{{OTHER}} {{ INPUT_DATA }} {{INPUT_DATA}}", json("\"x\""));
        assertEquals("{{OTHER}} {{ INPUT_DATA }} \"x\"", rendered);
    }

    @Test
    void missingPlaceholderFails() {
        var e =
                assertThrows(
                        PromptRenderException.class,
                        () -> renderer.render("no placeholder here", json("{}")));
        assertTrue(e.getMessage().contains("{{INPUT_DATA}}"));
        assertFalse(renderer.hasPlaceholder("no placeholder here"));
    }

    @Test
    void customPlaceholder() {
        var custom = new PromptRenderer("<<ITEM>>");
        assertEquals("<<ITEM>>", custom.placeholder());
        assertEquals("in: [true]", custom.render("in: <<ITEM>>", json("[true]")));
        assertThrows(IllegalArgumentException.class, () -> new PromptRenderer(""));
    }
}
