package info.isaksson.erland.reacttoangular.emitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StyleEmitterTest {

    @Test
    void collectedStylesAreCopiedUnchanged() {
        assertEquals(".todo { margin: 0; }\n",
                new StyleEmitter().emit(EmitterFixtures.todoBox(), "TodoBox", EmitterOptions.defaults()));
    }

    @Test
    void missingStylesGiveAPlaceholder() {
        assertEquals("/* No styles collected for Timer. */\n",
                new StyleEmitter().emit(EmitterFixtures.timer(), "Timer", EmitterOptions.defaults()));
    }
}
