package info.isaksson.erland.reacttoangular.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TranspileOptionsTest {

    @Test
    void jsonKeysOverrideDefaults() {
        TranspileOptions o = new TranspileOptions().applyJson("{\"indentWidth\": 4, \"emitSpec\": true}", "test.json");
        assertEquals(4, o.indentWidth);
        assertTrue(o.emitSpec);
        assertEquals(4, o.toEmitterOptions().indentWidth);
    }

    @Test
    void absentKeysKeepCurrentValues() {
        TranspileOptions o = new TranspileOptions();
        o.indentWidth = 3;
        o.applyJson("{\"emitSpec\": true}", "test.json");
        assertEquals(3, o.indentWidth);
    }

    @Test
    void unknownKeysAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new TranspileOptions().applyJson("{\"indent\": 4}", "bad.json"));
        assertTrue(e.getMessage().contains("bad.json"), e.getMessage());
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TranspileOptions().applyJson("{indentWidth:", "bad.json"));
        assertThrows(IllegalArgumentException.class, () -> new TranspileOptions().applyJson("null", "bad.json"));
    }

    @Test
    void outOfRangeIndentFailsWhenConverted() {
        TranspileOptions o = new TranspileOptions().applyJson("{\"indentWidth\": 12}", "test.json");
        assertThrows(IllegalArgumentException.class, o::toEmitterOptions);
    }
}
