package info.isaksson.erland.reacttoangular.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonTest {

    @Test
    void roundTripsThroughJson() throws Exception {
        IrComponent original = IrFixtures.counter();
        String json = IrJson.toJsonString(original);
        IrComponent read = IrJson.readFromString(json);
        assertEquals(original, read);
        assertEquals(IrEffectClassification.ONE_TIME, read.effects.get(0).classification());
    }

    @Test
    void writesDeterministicallyWithTrailingNewline() throws Exception {
        String first = IrJson.toJsonString(IrFixtures.counter());
        String second = IrJson.toJsonString(IrJson.readFromString(first));
        assertEquals(first, second);
        assertTrue(first.endsWith("}\n"));
    }

    @Test
    void followsDeclaredPropertyOrder() throws Exception {
        String json = IrJson.toJsonString(IrFixtures.counter());
        assertTrue(json.indexOf("\"schemaVersion\"") < json.indexOf("\"name\""));
        assertTrue(json.indexOf("\"states\"") < json.indexOf("\"effects\""));
        assertTrue(json.indexOf("\"template\"") < json.indexOf("\"styles\""));
        assertFalse(json.contains("\"classification\""));
    }
}
