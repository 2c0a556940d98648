package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrAttributeKind;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrControlFlowKind;
import info.isaksson.erland.reacttoangular.ir.IrEffect;
import info.isaksson.erland.reacttoangular.ir.IrEffectClassification;
import info.isaksson.erland.reacttoangular.ir.IrEventBinding;
import info.isaksson.erland.reacttoangular.ir.IrEventKind;
import info.isaksson.erland.reacttoangular.ir.IrLine;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.ir.IrPropertyKind;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNodeKind;
import info.isaksson.erland.reacttoangular.ir.ModelValidator;
import info.isaksson.erland.reacttoangular.parse.JsxParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class RuleEngineTest {

    private static RuleResult run(String source) throws Exception {
        RuleResult result = RuleEngine.standard().run(new JsxParser().parse(source));
        assertEquals(List.of(), ModelValidator.check(result.component), "model should validate");
        return result;
    }

    private static List<String> texts(List<IrLine> lines) {
        return lines.stream().map(l -> "  ".repeat(l.depth) + l.text).collect(Collectors.toList());
    }

    private static final String COUNTER = String.join("\n",
            "import React, { useState } from 'react';",
            "export default function Counter() {",
            "  const [count, setCount] = useState(0);",
            "  return (",
            "    <div>",
            "      <p>Count: {count}</p>",
            "      <button onClick={() => setCount(count + 1)}>Increment</button>",
            "      <button onClick={() => setCount(c => c - 1)}>Decrement</button>",
            "    </div>",
            "  );",
            "}",
            "");

    @Test
    void passesRunInFixedOrder() {
        assertEquals(List.of("structure", "state-effect", "template", "event"), RuleEngine.standard().passNames());
    }

    @Test
    void counterBecomesStateAndSetterHandlers() throws Exception {
        IrComponent c = run(COUNTER).component;

        assertEquals("Counter", c.name);
        assertEquals("app-counter", c.selector);
        assertEquals(1, c.states.size());
        assertEquals("count", c.states.get(0).name);
        assertEquals("setCount", c.states.get(0).setter);
        assertEquals("number", c.states.get(0).type);
        assertEquals("0", c.states.get(0).initializer);

        IrTemplateNode div = c.template;
        assertEquals("n0", div.id);
        assertEquals("div", div.tag);
        assertEquals(3, div.children.size());
        IrTemplateNode p = div.children.get(0);
        assertEquals("Count: ", p.children.get(0).text);
        assertEquals(IrTemplateNodeKind.INTERPOLATION, p.children.get(1).kind);
        assertEquals("count", p.children.get(1).text);

        assertEquals(2, c.events.size());
        IrEventBinding inc = c.events.get(0);
        assertEquals("n4", inc.elementId);
        assertEquals("click", inc.event);
        assertEquals(IrEventKind.SETTER_CALL, inc.kind);
        assertEquals("onButtonClick()", inc.handler);
        assertEquals(List.of("this.count = this.count + 1;"), texts(c.method("onButtonClick").body));

        IrEventBinding dec = c.events.get(1);
        assertEquals("onButtonClick2", dec.targetMethod);
        assertEquals(List.of("this.count = this.count - 1;"), texts(c.method("onButtonClick2").body));
        assertEquals(IrMethodKind.GENERATED_HANDLER, c.method("onButtonClick2").kind);
    }

    @Test
    void intervalEffectHoistsItsHandleAndKeepsCleanup() throws Exception {
        String source = String.join("\n",
                "import React, { useState, useEffect } from 'react';",
                "function Timer() {",
                "  const [time, setTime] = useState(0);",
                "  useEffect(() => {",
                "    const id = setInterval(() => setTime((t) => t + 1), 1000);",
                "    return () => clearInterval(id);",
                "  }, []);",
                "  return <h1>{time}</h1>;",
                "}",
                "export default Timer;",
                "");
        RuleResult result = run(source);
        IrComponent c = result.component;

        assertTrue(result.warnings.isEmpty(), "unexpected warnings: " + result.warnings);
        assertEquals(1, c.effects.size());
        IrEffect effect = c.effects.get(0);
        assertEquals(IrEffectClassification.ONE_TIME, effect.classification());
        assertEquals(List.of("this.id = setInterval(() => this.time = this.time + 1, 1000);"), texts(effect.setup));
        assertEquals(List.of("clearInterval(this.id);"), texts(effect.cleanup));
        assertEquals(List.of("id"), effect.hoisted);
        assertEquals(1, c.properties.size());
        assertEquals(IrPropertyKind.EFFECT_HANDLE, c.properties.get(0).kind);
        assertEquals("h1", c.template.tag);
        assertEquals("time", c.template.children.get(0).text);
    }

    @Test
    void matchingChangeHandlerBecomesTwoWayBinding() throws Exception {
        String source = String.join("\n",
                "import React, { useState } from \"react\";",
                "function TodoBox() {",
                "  const [todos, setTodos] = useState([]);",
                "  const [text, setText] = useState(\"\");",
                "  const add = () => {",
                "    if (text.trim()) {",
                "      setTodos([...todos, text]);",
                "      setText(\"\");",
                "    }",
                "  };",
                "  return (",
                "    <div>",
                "      <input value={text} onChange={(e) => setText(e.target.value)} />",
                "      <button onClick={add}>Add</button>",
                "      <ul>",
                "        {todos.map((t, i) => (",
                "          <li key={i}>{t}</li>",
                "        ))}",
                "      </ul>",
                "    </div>",
                "  );",
                "}",
                "");
        IrComponent c = run(source).component;

        IrTemplateNode input = c.template.children.get(0);
        assertEquals("input", input.tag);
        assertEquals("text", input.twoWayProperty);
        assertEquals(List.of(new IrAttribute("ngModel", IrAttributeKind.TWO_WAY, "text")), input.attributes);
        assertTrue(c.state("text").twoWay);
        assertFalse(c.state("todos").twoWay);
        assertEquals("any[]", c.state("todos").type);
        assertEquals("\"\"", c.state("text").initializer);

        assertEquals(1, c.events.size());
        IrEventBinding click = c.events.get(0);
        assertEquals(IrEventKind.DIRECT_CALL, click.kind);
        assertEquals("add()", click.handler);
        assertEquals("add", click.targetMethod);

        assertEquals(List.of(
                "if (this.text.trim()) {",
                "  this.todos.push(this.text);",
                "  this.text = \"\";",
                "}"), texts(c.method("add").body));

        IrTemplateNode li = c.template.children.get(2).children.get(0);
        assertEquals("li", li.tag);
        assertEquals(IrControlFlowKind.REPEAT, li.controlFlow.kind);
        assertEquals("todos", li.controlFlow.source);
        assertEquals("t", li.controlFlow.item);
        assertEquals("i", li.controlFlow.index);
        assertTrue(li.attributes.isEmpty(), "key must be dropped");
        assertEquals("t", li.children.get(0).text);
    }

    @Test
    void nonMatchingChangeHandlerStaysOneWay() throws Exception {
        String source = String.join("\n",
                "function Upper() {",
                "  const [text, setText] = useState('');",
                "  return <input value={text} onChange={(e) => setText(e.target.value.toUpperCase())} />;",
                "}",
                "");
        IrComponent c = run(source).component;

        assertFalse(c.state("text").twoWay);
        assertNull(c.template.twoWayProperty);
        assertEquals(List.of(IrAttribute.property("value", "text")), c.template.attributes);
        IrEventBinding change = c.events.get(0);
        assertEquals("input", change.event);
        assertEquals(IrEventKind.SETTER_CALL, change.kind);
        assertEquals("onInputChange($event)", change.handler);
        IrMethod handler = c.method("onInputChange");
        assertEquals(List.of("e: any"), handler.params);
        assertEquals(List.of("this.text = e.target.value.toUpperCase();"), texts(handler.body));
    }

    @Test
    void customHookIsPassedThroughWithWarning() throws Exception {
        String source = String.join("\n",
                "function Themed() {",
                "  const theme = useTheme();",
                "  return <div className={theme}>hi</div>;",
                "}",
                "");
        RuleResult result = run(source);

        assertEquals(1, result.warnings.size());
        UnsupportedConstructWarning w = result.warnings.get(0);
        assertEquals(UnsupportedConstructWarning.UNSUPPORTED_HOOK, w.code);
        assertEquals(2, w.line);
        assertEquals(1, result.component.passthroughs.size());
        assertEquals("const theme = useTheme();", result.component.passthroughs.get(0).text);
        assertEquals(List.of(IrAttribute.property("class", "theme")), result.component.template.attributes);
    }

    @Test
    void dependencyEffectsAreRecurring() throws Exception {
        String source = String.join("\n",
                "function Title({ title }) {",
                "  const [count, setCount] = useState(0);",
                "  useEffect(() => { document.title = title + count; }, [title, count]);",
                "  useEffect(() => { console.log('render'); });",
                "  return <span>{count}</span>;",
                "}",
                "");
        IrComponent c = run(source).component;

        IrEffect withDeps = c.effects.get(0);
        assertTrue(withDeps.hasDependencyArray);
        assertEquals(List.of("this.title", "this.count"), withDeps.dependencies);
        assertEquals(IrEffectClassification.RECURRING, withDeps.classification());
        assertEquals(List.of("document.title = this.title + this.count;"), texts(withDeps.setup));

        IrEffect everyRender = c.effects.get(1);
        assertFalse(everyRender.hasDependencyArray);
        assertEquals(IrEffectClassification.RECURRING, everyRender.classification());
        assertEquals(1, everyRender.index);
    }

    @Test
    void propsBecomeInputsWithDefaultsAndRenames() throws Exception {
        String source = String.join("\n",
                "const Greeting = ({ name, title: heading, size = 2 }) => (",
                "  <h2 data-size={size}>{heading}: {name}</h2>",
                ");",
                "export default Greeting;",
                "");
        IrComponent c = run(source).component;

        assertEquals(List.of("name", "title", "size"),
                c.inputs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals("number", c.inputs.get(2).type);
        assertEquals("2", c.inputs.get(2).initializer);
        assertEquals("title", c.template.children.get(0).text);
        assertEquals("name", c.template.children.get(2).text);
        assertEquals(IrAttribute.property("data-size", "size"), c.template.attributes.get(0));
    }

    @Test
    void propsIdentifierReadsBecomeInputs() throws Exception {
        String source = String.join("\n",
                "function Badge(props) {",
                "  const caption = props.label.toUpperCase();",
                "  return <b onClick={props.onSelect}>{caption}</b>;",
                "}",
                "");
        IrComponent c = run(source).component;

        assertEquals(List.of("label", "onSelect"), c.inputs.stream().map(p -> p.name).collect(Collectors.toList()));
        IrMethod getter = c.methods.get(0);
        assertEquals(IrMethodKind.GETTER, getter.kind);
        assertEquals("caption", getter.name);
        assertEquals(List.of("return this.label.toUpperCase();"), texts(getter.body));
        assertEquals(IrEventKind.INLINE_EXPRESSION, c.events.get(0).kind);
        assertEquals("this.onSelect($event)", c.events.get(0).handler);
    }

    @Test
    void earlyReturnsBecomeGuardedSiblings() throws Exception {
        String source = String.join("\n",
                "const Status = () => {",
                "  const [loading, setLoading] = useState(true);",
                "  const [error, setError] = useState(null);",
                "  if (loading) return <div>Loading...</div>;",
                "  if (error) return <div>Error: {error}</div>;",
                "  return <main>ready</main>;",
                "};",
                "");
        IrComponent c = run(source).component;

        IrTemplateNode root = c.template;
        assertEquals(IrTemplateNodeKind.CONTAINER, root.kind);
        assertEquals("n0", root.id);
        assertEquals(3, root.children.size());
        assertEquals("loading", root.children.get(0).controlFlow.guard);
        assertEquals("!loading && error", root.children.get(1).controlFlow.guard);
        assertEquals("!loading && !error", root.children.get(2).controlFlow.guard);
        assertEquals("main", root.children.get(2).tag);
    }

    @Test
    void conditionalsAndTernariesBecomeGuards() throws Exception {
        String source = String.join("\n",
                "function Panel({ user }) {",
                "  const [open, setOpen] = useState(false);",
                "  return (",
                "    <section>",
                "      {open && <p>Details</p>}",
                "      {user ? <span>{user.name}</span> : <em>anonymous</em>}",
                "      <button onClick={() => setOpen(!open)}>Toggle</button>",
                "    </section>",
                "  );",
                "}",
                "");
        IrComponent c = run(source).component;

        List<IrTemplateNode> kids = c.template.children;
        assertEquals("p", kids.get(0).tag);
        assertEquals("open", kids.get(0).controlFlow.guard);
        assertEquals("user", kids.get(1).controlFlow.guard);
        assertEquals("!user", kids.get(2).controlFlow.guard);
        assertEquals("user.name", kids.get(1).children.get(0).text);
        assertEquals(List.of("this.open = !this.open;"), texts(c.method("onButtonClick").body));
    }

    @Test
    void loopHandlersCallMethodsWithTemplateScope() throws Exception {
        String source = String.join("\n",
                "const Grid = ({ widgets }) => {",
                "  const pick = (id) => { console.log(id); };",
                "  return (",
                "    <div>",
                "      {widgets.map(widget => (",
                "        <div key={widget.id} className=\"widget\" onClick={() => pick(widget.id)}>",
                "          <h3>{widget.title}</h3>",
                "        </div>",
                "      ))}",
                "    </div>",
                "  );",
                "};",
                "");
        IrComponent c = run(source).component;

        IrTemplateNode item = c.template.children.get(0);
        assertEquals(IrControlFlowKind.REPEAT, item.controlFlow.kind);
        assertNull(item.controlFlow.index);
        assertEquals(List.of(IrAttribute.staticValue("class", "widget")), item.attributes);
        IrEventBinding click = c.events.get(0);
        assertEquals(IrEventKind.DIRECT_CALL, click.kind);
        assertEquals("pick(widget.id)", click.handler);
        assertEquals(item.id, click.elementId);
        assertEquals(List.of("id: any"), c.method("pick").params);
    }

    @Test
    void blockHandlersMoveIntoGeneratedMethods() throws Exception {
        String source = String.join("\n",
                "function List({ items }) {",
                "  const [last, setLast] = useState(null);",
                "  return (",
                "    <ul>",
                "      {items.map((item) => (",
                "        <li onDoubleClick={(e) => { e.preventDefault(); setLast(item); }}>{item}</li>",
                "      ))}",
                "    </ul>",
                "  );",
                "}",
                "");
        IrComponent c = run(source).component;

        IrEventBinding dbl = c.events.get(0);
        assertEquals("dblclick", dbl.event);
        assertEquals(IrEventKind.INLINE_EXPRESSION, dbl.kind);
        assertEquals("onLiDoubleClick($event, item)", dbl.handler);
        IrMethod m = c.method("onLiDoubleClick");
        assertEquals(List.of("e: any", "item: any"), m.params);
        assertEquals(List.of("e.preventDefault();", "this.last = item;"), texts(m.body));
    }

    @Test
    void refsMemosAndCallbacksBecomeMembers() throws Exception {
        String source = String.join("\n",
                "function Search() {",
                "  const box = useRef(null);",
                "  const [q, setQ] = useState('');",
                "  const upper = useMemo(() => q.toUpperCase(), [q]);",
                "  const clear = useCallback(() => setQ(''), []);",
                "  return <p onClick={clear}>{upper}</p>;",
                "}",
                "");
        IrComponent c = run(source).component;

        assertEquals(IrPropertyKind.REF, c.properties.get(0).kind);
        assertEquals("{ current: null }", c.properties.get(0).initializer);
        assertEquals(IrMethodKind.GETTER, c.method("upper").kind);
        assertEquals(List.of("return this.q.toUpperCase();"), texts(c.method("upper").body));
        assertEquals(List.of("this.q = '';"), texts(c.method("clear").body));
        assertEquals("clear()", c.events.get(0).handler);
    }

    @Test
    void propsMemberAliasIsReadThroughTheInput() throws Exception {
        String source = String.join("\n",
                "function Card(props) {",
                "  const title = props.title;",
                "  const sub = props.subtitle;",
                "  return <h1 title={sub}>{title}</h1>;",
                "}",
                "");
        IrComponent c = run(source).component;

        assertEquals(List.of("title", "subtitle"), c.inputs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertTrue(c.methods.isEmpty(), "an alias of a prop is not a getter");
        assertEquals("title", c.template.children.get(0).text);
        assertEquals(IrAttribute.property("title", "subtitle"), c.template.attributes.get(0));
    }

    @Test
    void stateSeededFromSameNamedPropGetsItsOwnMember() throws Exception {
        String source = String.join("\n",
                "function Drawer(props) {",
                "  const [open, setOpen] = useState(props.open);",
                "  const label = props.label.toUpperCase();",
                "  return <div onClick={() => setOpen(!open)}>{open ? label : props.label}</div>;",
                "}",
                "");
        IrComponent c = run(source).component;

        assertEquals(List.of("open", "label"), c.inputs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals("open2", c.states.get(0).name);
        assertEquals("setOpen", c.states.get(0).setter);
        assertEquals("this.open", c.states.get(0).initializer);
        assertTrue(c.states.get(0).readsInputs);
        assertEquals(List.of("return this.label.toUpperCase();"), texts(c.method("label2").body));
        assertEquals("onDivClick()", c.events.get(0).handler);
        assertEquals(List.of("this.open2 = !this.open2;"), texts(c.method("onDivClick").body));
        IrTemplateNode branch = c.template.children.get(0);
        assertEquals("open2 ? label2 : label", branch.text);
    }

    @Test
    void stateSeededFromPropIsMarkedForInit() throws Exception {
        String source = String.join("\n",
                "function Counter({ count }) {",
                "  const [count2, setCount2] = useState(count);",
                "  const [step] = useState(1);",
                "  return <p>{count2 + step}</p>;",
                "}",
                "");
        IrComponent c = run(source).component;

        assertEquals("this.count", c.state("count2").initializer);
        assertTrue(c.state("count2").readsInputs);
        assertFalse(c.state("step").readsInputs);
        assertEquals("1", c.state("step").initializer);
    }

    @Test
    void nameOverrideAndAnonymousFallback() throws Exception {
        String source = "export default () => <div/>;\n";
        assertEquals("Widget", RuleEngine.standard().run(new JsxParser().parse(source), null, "Widget").component.name);
        assertEquals("Other", RuleEngine.standard().run(new JsxParser().parse(COUNTER), "Other", null).component.name);
        assertEquals("Component", RuleEngine.standard().run(new JsxParser().parse(source)).component.name);
    }

    @Test
    void missingComponentFailsFast() throws Exception {
        String source = "const x = 1;\n";
        assertThrows(IllegalStateException.class, () -> RuleEngine.standard().run(new JsxParser().parse(source)));
    }

    @Test
    void repeatedRunsProduceEqualModels() throws Exception {
        assertEquals(run(COUNTER).component, run(COUNTER).component);
    }
}
