package info.isaksson.erland.reacttoangular.syntax;

import info.isaksson.erland.reacttoangular.parse.JsxParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JsPrinterTest {

    private static FunctionDeclaration firstFunction(Program program) {
        return (FunctionDeclaration) program.body.get(0);
    }

    private static String render(List<JsPrinter.Line> lines) {
        return lines.stream().map(JsPrinter.Line::toString).collect(Collectors.joining("\n"));
    }

    /** Qualifies the given member names with {@code this.}. */
    private static JsPrinter.Hook members(Set<String> names) {
        return new JsPrinter.Hook() {
            @Override public String identifier(String name) {
                return names.contains(name) ? "this." + name : null;
            }
        };
    }

    @Test
    void printsStatementsWithRelativeDepth() throws Exception {
        Program program = new JsxParser().parse(String.join("\n",
                "function f() {",
                "  if (ready) { start() } else if (waiting) wait(); else { stop(); }",
                "  for (let i = 0; i < n; i++) total += i;",
                "}"));
        FunctionDeclaration fn = firstFunction(program);
        String out = render(new JsPrinter(program, null).functionBody(fn.params, fn.body));
        assertEquals(String.join("\n",
                "if (ready) {",
                "  start();",
                "} else if (waiting) {",
                "  wait();",
                "} else {",
                "  stop();",
                "}",
                "for (let i = 0; i < n; i++) {",
                "  total += i;",
                "}"), out);
    }

    @Test
    void qualifiesFreeIdentifiersButNotShadowedLocals() throws Exception {
        Program program = new JsxParser().parse(String.join("\n",
                "function f(step) {",
                "  const count = 10;",
                "  total = total + count + step;",
                "  items.forEach((total) => log(total));",
                "}"));
        FunctionDeclaration fn = firstFunction(program);
        JsPrinter printer = new JsPrinter(program, members(Set.of("total", "count", "items", "step")));
        String out = render(printer.functionBody(fn.params, fn.body));
        assertEquals(String.join("\n",
                "const count = 10;",
                "this.total = this.total + count + step;",
                "this.items.forEach((total) => log(total));"), out);
    }

    @Test
    void expandsShorthandPropertiesWhenRenamed() throws Exception {
        Program program = new JsxParser().parse("function f() { send({ count, label: 'x' }); }");
        FunctionDeclaration fn = firstFunction(program);
        String out = render(new JsPrinter(program, members(Set.of("count"))).functionBody(fn.params, fn.body));
        assertEquals("send({ count: this.count, label: 'x' });", out);
    }

    @Test
    void embedsBlockBodiedCallbacksAsNestedLines() throws Exception {
        Program program = new JsxParser().parse(String.join("\n",
                "function f() {",
                "  const id = setInterval(() => {",
                "    tick();",
                "  }, 1000);",
                "}"));
        FunctionDeclaration fn = firstFunction(program);
        List<JsPrinter.Line> lines = new JsPrinter(program, null).functionBody(fn.params, fn.body);
        assertEquals(3, lines.size());
        assertEquals("const id = setInterval(() => {", lines.get(0).text);
        assertEquals(1, lines.get(1).depth);
        assertEquals("tick();", lines.get(1).text);
        assertEquals(0, lines.get(2).depth);
        assertEquals("}, 1000);", lines.get(2).text);
    }

    @Test
    void callHookSeesStatementPosition() throws Exception {
        Program program = new JsxParser().parse("function f() { setX(1); ok && setX(2); }");
        FunctionDeclaration fn = firstFunction(program);
        JsPrinter.Hook hook = new JsPrinter.Hook() {
            @Override public String call(CallExpression call, JsPrinter printer, boolean statementPosition) {
                if (!"setX".equals(call.calleeName())) return null;
                String assignment = "this.x = " + printer.expression(call.arguments.get(0));
                return statementPosition ? assignment : "(" + assignment + ")";
            }
        };
        String out = render(new JsPrinter(program, hook).functionBody(fn.params, fn.body));
        assertEquals("this.x = 1;\nok && (this.x = 2);", out);
    }

    @Test
    void valueBodyReturnsExpressionBodies() throws Exception {
        Program program = new JsxParser().parse("const f = (a) => a * factor;");
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) ((VariableDeclaration) program.body.get(0)).declarations.get(0).init;
        List<JsPrinter.Line> lines = new JsPrinter(program, members(Set.of("factor", "a"))).valueBody(arrow.params, arrow.body);
        assertEquals("return a * this.factor;", render(lines));
    }

    @Test
    void collectsBoundNamesFromPatterns() throws Exception {
        Program program = new JsxParser().parse("const [{ a, b: c = 1 }, ...rest] = value;");
        VariableDeclaration decl = (VariableDeclaration) program.body.get(0);
        assertEquals(Set.of("a", "c", "rest"), JsPrinter.boundNames(decl.declarations.get(0).id));
    }
}
