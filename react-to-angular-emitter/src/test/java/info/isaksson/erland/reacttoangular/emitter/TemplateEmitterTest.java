package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrAttributeKind;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrControlFlow;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateEmitterTest {

    private final TemplateEmitter emitter = new TemplateEmitter();

    @Test
    void todoBoxTemplate() {
        String expected = """
                <div>
                  <input type="text" [(ngModel)]="text">
                  <button [disabled]="!text" (click)="onButtonClick()">Add</button>
                  <ul>
                    <li *ngFor="let item of items; let i = index">{{ item }}</li>
                  </ul>
                  <p *ngIf="items.length === 0" title="say &quot;hi&quot;">Nothing &lt;yet&gt; &amp; counting</p>
                </div>
                """;
        assertEquals(expected, emitter.emit(EmitterFixtures.todoBox(), "TodoBox", EmitterOptions.defaults()));
    }

    @Test
    void timerTemplate() {
        String expected = """
                <div class="timer">
                  <button (click)="toggle()">{{ label }}</button>
                  <p>Seconds: {{ seconds }}</p>
                </div>
                """;
        assertEquals(expected, emitter.emit(EmitterFixtures.timer(), "Timer", EmitterOptions.defaults()));
    }

    @Test
    void containersBareAttributesAndInterpolatedValues() {
        IrTemplateNode img = IrTemplateNode.element("n2", "img", List.of(
                new IrAttribute("alt", IrAttributeKind.INTERPOLATED, "Avatar of {{ user.name }}"),
                IrAttribute.staticValue("hidden", null)), List.of());
        IrTemplateNode section = IrTemplateNode.container("n1", List.of(img, IrTemplateNode.element("n3", "span",
                        List.of(IrAttribute.property("ngStyle", "{ color: \"red\" }")), List.of())))
                .withControlFlow(IrControlFlow.conditional("user"));
        IrTemplateNode root = IrTemplateNode.container("n0", List.of(section, IrTemplateNode.text("n4", "done")));

        String html = emitter.emit(component(root), "Profile", EmitterOptions.defaults());
        String expected = """
                <ng-container>
                  <ng-container *ngIf="user">
                    <img alt="Avatar of {{ user.name }}" hidden>
                    <span [ngStyle]="{ color: &quot;red&quot; }"></span>
                  </ng-container>
                  done
                </ng-container>
                """;
        assertEquals(expected, html);
    }

    @Test
    void decodedTextIsEscapedOnce() {
        IrTemplateNode h1 = IrTemplateNode.element("n0", "h1",
                List.of(IrAttribute.staticValue("title", "Tom & Jerry")),
                List.of(IrTemplateNode.text("n1", "Tom & Jerry\u00A0!")));

        assertEquals("<h1 title=\"Tom &amp; Jerry\">Tom &amp; Jerry\u00A0!</h1>\n",
                emitter.emit(component(h1), "Profile", EmitterOptions.defaults()));
    }

    @Test
    void literalBracesInTextAreNotInterpolated() {
        IrTemplateNode p = IrTemplateNode.element("n0", "p", List.of(), List.of(
                IrTemplateNode.text("n1", "{"), IrTemplateNode.interpolation("n2", "x"), IrTemplateNode.text("n3", "}")));
        IrTemplateNode code = IrTemplateNode.element("n4", "code", List.of(), List.of(
                IrTemplateNode.text("n5", "{{x}}")));
        IrTemplateNode root = IrTemplateNode.container("n6", List.of(p, code));

        String expected = """
                <ng-container>
                  <p>{{ '{' }}{{ x }}{{ '}' }}</p>
                  <code>{{ '{' }}{{ '{' }}x{{ '}' }}{{ '}' }}</code>
                </ng-container>
                """;
        assertEquals(expected, emitter.emit(component(root), "Profile", EmitterOptions.defaults()));
    }

    @Test
    void emptyTemplateRendersPlaceholderComment() {
        assertEquals("<!-- Profile renders nothing -->\n",
                emitter.emit(component(null), "Profile", EmitterOptions.defaults()));
    }

    private static IrComponent component(IrTemplateNode template) {
        return new IrComponent(null, "Profile", "app-profile", List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), template, List.of(), List.of(), "");
    }
}
