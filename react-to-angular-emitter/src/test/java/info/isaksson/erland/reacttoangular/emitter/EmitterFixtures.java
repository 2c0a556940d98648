package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrAttributeKind;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrControlFlow;
import info.isaksson.erland.reacttoangular.ir.IrEffect;
import info.isaksson.erland.reacttoangular.ir.IrEventBinding;
import info.isaksson.erland.reacttoangular.ir.IrEventKind;
import info.isaksson.erland.reacttoangular.ir.IrLine;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.ir.IrPassthrough;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.ir.IrPropertyKind;
import info.isaksson.erland.reacttoangular.ir.IrSourceRef;
import info.isaksson.erland.reacttoangular.ir.IrStateBinding;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;

import java.util.List;

final class EmitterFixtures {

    private EmitterFixtures() {}

    /** A ticking timer: one mount effect, one recurring effect with cleanup, a getter. */
    static IrComponent timer() {
        IrTemplateNode button = IrTemplateNode.element("n1", "button", List.of(),
                List.of(IrTemplateNode.interpolation("n2", "label")));
        IrTemplateNode p = IrTemplateNode.element("n3", "p", List.of(),
                List.of(IrTemplateNode.text("n4", "Seconds: "), IrTemplateNode.interpolation("n5", "seconds")));
        IrTemplateNode root = IrTemplateNode.element("n0", "div",
                List.of(IrAttribute.staticValue("class", "timer")), List.of(button, p));

        return new IrComponent(null, "Timer", "app-timer",
                List.of(),
                List.of(new IrStateBinding("seconds", "setSeconds", "number", "0", false, new IrSourceRef(4, 3)),
                        new IrStateBinding("running", "setRunning", "boolean", "false", false, new IrSourceRef(5, 3))),
                List.of(new IrProperty("intervalId", IrPropertyKind.EFFECT_HANDLE, "any", null, null)),
                List.of(new IrMethod("toggle", IrMethodKind.DECLARED, List.of(), false,
                                List.of(IrLine.of("this.running = !this.running;")), null),
                        new IrMethod("label", IrMethodKind.GETTER, List.of(), false,
                                List.of(IrLine.of("return this.running ? 'Stop' : 'Start';")), null)),
                List.of(new IrEffect(0, true, List.of(), List.of(IrLine.of("console.log('mounted');")),
                                List.of(), List.of(), new IrSourceRef(7, 3)),
                        new IrEffect(1, true, List.of("this.running"),
                                List.of(IrLine.of("if (!this.running) {"), new IrLine(1, "return;"), IrLine.of("}"),
                                        IrLine.of("this.intervalId = setInterval(() => {"),
                                        new IrLine(1, "this.seconds = this.seconds + 1;"), IrLine.of("}, 1000);")),
                                List.of(IrLine.of("clearInterval(this.intervalId);")),
                                List.of("intervalId"), new IrSourceRef(10, 3))),
                List.of(new IrEventBinding("n1", "click", IrEventKind.DIRECT_CALL, "toggle()", "toggle", null)),
                root,
                List.of(),
                List.of(),
                "");
    }

    /** Input, list rendering, conditional and a two-way bound text field. */
    static IrComponent todoBox() {
        IrTemplateNode input = IrTemplateNode.element("n1", "input", List.of(
                IrAttribute.staticValue("type", "text"),
                new IrAttribute("ngModel", IrAttributeKind.TWO_WAY, "text")), List.of()).withTwoWayProperty("text");
        IrTemplateNode add = IrTemplateNode.element("n2", "button", List.of(IrAttribute.property("disabled", "!text")),
                List.of(IrTemplateNode.text("n3", "Add")));
        IrTemplateNode li = IrTemplateNode.element("n5", "li", List.of(),
                List.of(IrTemplateNode.interpolation("n6", "item"))).withControlFlow(IrControlFlow.repeat("items", "item", "i"));
        IrTemplateNode ul = IrTemplateNode.element("n4", "ul", List.of(), List.of(li));
        IrTemplateNode empty = IrTemplateNode.element("n7", "p", List.of(IrAttribute.staticValue("title", "say \"hi\"")),
                List.of(IrTemplateNode.text("n8", "Nothing <yet> & counting")))
                .withControlFlow(IrControlFlow.conditional("items.length === 0"));
        IrTemplateNode root = IrTemplateNode.element("n0", "div", List.of(), List.of(input, add, ul, empty));

        return new IrComponent(null, "TodoBox", "app-todo-box",
                List.of(new IrProperty("title", IrPropertyKind.INPUT, "string", "'Todo'", null),
                        new IrProperty("owner", IrPropertyKind.INPUT, "any", null, null)),
                List.of(new IrStateBinding("items", "setItems", "string[]", "[]", false, null),
                        new IrStateBinding("text", "setText", "string", "''", true, null)),
                List.of(),
                List.of(new IrMethod("onButtonClick", IrMethodKind.GENERATED_HANDLER, List.of(), false,
                        List.of(IrLine.of("this.items.push(this.text);")), null)),
                List.of(),
                List.of(new IrEventBinding("n2", "click", IrEventKind.SETTER_CALL, "onButtonClick()", "onButtonClick", null)),
                root,
                List.of(new IrPassthrough("unsupported hook useTheme", "const theme = useTheme(); /* dark */", new IrSourceRef(6, 3))),
                List.of("./TodoBox.css"),
                ".todo { margin: 0; }\n");
    }
}
