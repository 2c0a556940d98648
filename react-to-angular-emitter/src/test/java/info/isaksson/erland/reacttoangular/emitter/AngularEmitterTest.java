package info.isaksson.erland.reacttoangular.emitter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AngularEmitterTest {

    @Test
    void emitsThreeArtifactsByDefault() {
        AngularEmitter.EmittedComponent out = new AngularEmitter().emit(EmitterFixtures.todoBox(), EmitterOptions.defaults());

        assertEquals("TodoBoxComponent", out.className);
        assertNull(out.spec);
        assertEquals(List.of("TodoBox.component.ts", "TodoBox.component.html", "TodoBox.component.css"),
                List.copyOf(out.asMap().keySet()));
    }

    @Test
    void specScaffoldWhenEnabled() {
        AngularEmitter.EmittedComponent out = new AngularEmitter()
                .emit(EmitterFixtures.timer(), EmitterOptions.defaults().withEmitSpec(true));

        assertNotNull(out.spec);
        assertEquals("Timer.component.spec.ts", out.spec.fileName);
        assertEquals(4, out.artifacts().size());
        String spec = out.spec.content;
        assertTrue(spec.contains("import { TimerComponent } from './Timer.component';\n"), spec);
        assertTrue(spec.contains("imports: [TimerComponent]"), spec);
        assertTrue(spec.contains("it('should create', () => {"), spec);
        assertTrue(spec.contains("expect(typeof component.toggle).toBe('function');"), spec);
        assertFalse(spec.contains("component.label"), "getters are not checked as functions");
    }

    @Test
    void emissionIsIdempotent() {
        AngularEmitter emitter = new AngularEmitter();
        EmitterOptions options = EmitterOptions.defaults().withEmitSpec(true);
        assertEquals(emitter.emit(EmitterFixtures.todoBox(), options).asMap(),
                emitter.emit(EmitterFixtures.todoBox(), options).asMap());
    }
}
