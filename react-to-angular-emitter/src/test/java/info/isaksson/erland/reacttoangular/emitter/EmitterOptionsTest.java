package info.isaksson.erland.reacttoangular.emitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterOptionsTest {

    @Test
    void defaultsAndCopies() {
        EmitterOptions d = EmitterOptions.defaults();
        assertEquals(2, d.indentWidth);
        assertFalse(d.emitSpec);

        EmitterOptions changed = d.withIndentWidth(4).withEmitSpec(true);
        assertEquals(4, changed.indentWidth);
        assertTrue(changed.emitSpec);
        assertEquals(2, d.indentWidth);
    }

    @Test
    void indentOutsideRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EmitterOptions(0, false));
        assertThrows(IllegalArgumentException.class, () -> EmitterOptions.defaults().withIndentWidth(9));
    }
}
