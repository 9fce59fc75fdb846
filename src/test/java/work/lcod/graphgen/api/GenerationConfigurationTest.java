package work.lcod.graphgen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.graphgen.emit.EmitterOptions;
import work.lcod.graphgen.ir.GraphInfo;

class GenerationConfigurationTest {
    @Test
    void derivesPascalCaseClassName() {
        assertEquals("CustomerSupportV2", GenerationConfiguration.pascalCase("customer-support v2"));
        assertEquals("", GenerationConfiguration.pascalCase("---"));
    }

    @Test
    void fallsBackToDefaultClassName() {
        var unnamed = GraphInfo.builder().node("a").edge("a", GraphInfo.TERMINAL).entryPoint("a").build();
        assertEquals(EmitterOptions.DEFAULT_CLASS_NAME, GenerationConfiguration.defaults().emitterOptions(unnamed).className());
    }

    @Test
    void avoidsClashWithStateTypeName() {
        var graph = GraphInfo.builder().name("graph state").node("a").edge("a", GraphInfo.TERMINAL).entryPoint("a").build();
        assertEquals("GraphStateWorkflow", GenerationConfiguration.defaults().emitterOptions(graph).className());
    }

    @Test
    void rejectsNonPositiveGraphLimit() {
        assertThrows(IllegalArgumentException.class, () -> GenerationConfiguration.builder().maxGraphSize(0).build());
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.TRACE, LogLevel.from("Trace"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("verbose"));
        assertEquals(LogLevel.ERROR, LogLevel.firstOf(null, " ", "error", "debug").orElseThrow());
        assertTrue(LogLevel.firstOf(null, "").isEmpty());
    }
}
