package info.isaksson.erland.reacttoangular.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints syntax trees back to JavaScript/TypeScript source, one statement per line.
 *
 * <p>Free identifiers, member reads and calls are offered to a {@link Hook} first, which lets the
 * rewrite passes qualify component members or replace setter calls while the printer keeps track of
 * which names are shadowed by locals. Names bound in an enclosing scope are never offered to
 * {@link Hook#identifier(String)}.</p>
 *
 * <p>Output is a list of {@link Line}s with relative depths; indentation width is left to the
 * emitters. JSX embedded in bodies is copied verbatim from the source.</p>
 */
public final class JsPrinter {

    /** Rewrite callbacks; each returns null to keep the default rendering. */
    public interface Hook {

        /** Replacement for a free (non-local) identifier reference. */
        default String identifier(String name) {
            return null;
        }

        /** Replacement for a member expression, e.g. {@code props.title}. */
        default String member(MemberExpression member, JsPrinter printer) {
            return null;
        }

        /**
         * Replacement for a call. {@code statementPosition} is true when the call is a whole
         * expression statement or an arrow body, where an assignment needs no parentheses.
         */
        default String call(CallExpression call, JsPrinter printer, boolean statementPosition) {
            return null;
        }
    }

    public static final Hook IDENTITY = new Hook() { };

    /** One output line at a depth relative to the printed body. */
    public static final class Line {
        public final int depth;
        public final String text;

        public Line(int depth, String text) {
            this.depth = depth;
            this.text = text;
        }

        @Override public String toString() {
            return "  ".repeat(Math.max(0, depth)) + text;
        }
    }

    /** Marks one level of relative indentation inside multi-line expression text. */
    private static final char INDENT_MARK = '\u0001';

    private static final Set<String> WORD_OPERATORS = Set.of("typeof", "void", "delete");

    private final Program program;
    private final Hook hook;
    private final Deque<Set<String>> scopes = new ArrayDeque<>();
    private Expression statementExpression;

    public JsPrinter(Program program, Hook hook) {
        this.program = program;
        this.hook = hook == null ? IDENTITY : hook;
    }

    // ------------------------------------------------------------------
    // Scope
    // ------------------------------------------------------------------

    public void pushScope(Collection<String> names) {
        scopes.push(new LinkedHashSet<>(names));
    }

    public void popScope() {
        scopes.pop();
    }

    public boolean isLocal(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }

    /** Names bound by a parameter or declaration pattern. */
    public static Set<String> boundNames(Expression pattern) {
        Set<String> out = new LinkedHashSet<>();
        collectBound(pattern, out);
        return out;
    }

    private static void collectBound(Node pattern, Set<String> out) {
        if (pattern == null) return;
        if (pattern instanceof Identifier) {
            out.add(((Identifier) pattern).name);
        } else if (pattern instanceof ArrayPattern) {
            for (Expression e : ((ArrayPattern) pattern).elements) collectBound(e, out);
        } else if (pattern instanceof ObjectPattern) {
            for (Node p : ((ObjectPattern) pattern).properties) {
                if (p instanceof Property) collectBound(((Property) p).value, out);
                else collectBound(p, out);
            }
        } else if (pattern instanceof AssignmentPattern) {
            collectBound(((AssignmentPattern) pattern).left, out);
        } else if (pattern instanceof RestElement) {
            collectBound(((RestElement) pattern).argument, out);
        }
    }

    /** Names declared directly in a statement list (variables and function declarations). */
    public static Set<String> declaredNames(List<Statement> statements) {
        Set<String> out = new LinkedHashSet<>();
        for (Statement s : statements) {
            if (s instanceof VariableDeclaration) {
                for (VariableDeclarator d : ((VariableDeclaration) s).declarations) collectBound(d.id, out);
            } else if (s instanceof FunctionDeclaration && ((FunctionDeclaration) s).id != null) {
                out.add(((FunctionDeclaration) s).id);
            }
        }
        return out;
    }

    private static Set<String> paramNames(List<Expression> params) {
        Set<String> out = new LinkedHashSet<>();
        for (Expression p : params) collectBound(p, out);
        return out;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    /** Prints a statement list in its own block scope. */
    public List<Line> statements(List<Statement> body) {
        pushScope(declaredNames(body));
        try {
            List<Line> out = new ArrayList<>();
            for (Statement s : body) statement(s, 0, out);
            return out;
        } finally {
            popScope();
        }
    }

    /** Prints a function body: parameters are in scope for the statements. */
    public List<Line> functionBody(List<Expression> params, Node body) {
        pushScope(paramNames(params));
        try {
            if (body instanceof BlockStatement) {
                return statements(((BlockStatement) body).body);
            }
            List<Line> out = new ArrayList<>();
            Expression e = (Expression) body;
            addFlattened(out, 0, expressionInStatementPosition(e) + ";");
            return out;
        } finally {
            popScope();
        }
    }

    /** Prints one statement in the current scope; the caller manages declarations. */
    public List<Line> statement(Statement s) {
        List<Line> out = new ArrayList<>();
        statement(s, 0, out);
        return out;
    }

    /** Like {@link #functionBody} but an expression body becomes {@code return expr;}. */
    public List<Line> valueBody(List<Expression> params, Node body) {
        if (body instanceof BlockStatement) {
            return functionBody(params, body);
        }
        pushScope(paramNames(params));
        try {
            List<Line> out = new ArrayList<>();
            addFlattened(out, 0, "return " + expression((Expression) body) + ";");
            return out;
        } finally {
            popScope();
        }
    }

    private void statement(Statement s, int depth, List<Line> out) {
        if (s instanceof EmptyStatement) return;
        if (s instanceof ExpressionStatement) {
            Expression e = ((ExpressionStatement) s).expression;
            addFlattened(out, depth, expressionInStatementPosition(e) + ";");
        } else if (s instanceof VariableDeclaration) {
            addFlattened(out, depth, declaration((VariableDeclaration) s) + ";");
        } else if (s instanceof ReturnStatement) {
            Expression arg = ((ReturnStatement) s).argument;
            addFlattened(out, depth, arg == null ? "return;" : "return " + expression(arg) + ";");
        } else if (s instanceof BlockStatement) {
            out.add(new Line(depth, "{"));
            nestedBlock(((BlockStatement) s).body, depth + 1, out);
            out.add(new Line(depth, "}"));
        } else if (s instanceof IfStatement) {
            ifStatement((IfStatement) s, depth, out, "");
        } else if (s instanceof ForStatement) {
            forStatement((ForStatement) s, depth, out);
        } else if (s instanceof ForInOfStatement) {
            forInOf((ForInOfStatement) s, depth, out);
        } else if (s instanceof WhileStatement) {
            whileStatement((WhileStatement) s, depth, out);
        } else if (s instanceof TryStatement) {
            tryStatement((TryStatement) s, depth, out);
        } else if (s instanceof ThrowStatement) {
            addFlattened(out, depth, "throw " + expression(((ThrowStatement) s).argument) + ";");
        } else if (s instanceof JumpStatement) {
            JumpStatement j = (JumpStatement) s;
            out.add(new Line(depth, j.keyword + (j.label == null ? "" : " " + j.label) + ";"));
        } else if (s instanceof SwitchStatement) {
            switchStatement((SwitchStatement) s, depth, out);
        } else if (s instanceof FunctionDeclaration) {
            FunctionDeclaration f = (FunctionDeclaration) s;
            String head = (f.async ? "async " : "") + "function " + (f.id == null ? "" : f.id)
                    + "(" + params(f.params) + ") {";
            out.add(new Line(depth, head));
            appendLines(out, depth + 1, functionBody(f.params, f.body));
            out.add(new Line(depth, "}"));
        } else {
            for (String raw : program.textOf(s).split("\n", -1)) {
                out.add(new Line(depth, raw.strip()));
            }
        }
    }

    private void nestedBlock(List<Statement> body, int depth, List<Line> out) {
        appendLines(out, depth, statements(body));
    }

    private void body(Statement s, int depth, List<Line> out) {
        if (s instanceof BlockStatement) {
            nestedBlock(((BlockStatement) s).body, depth, out);
        } else {
            nestedBlock(List.of(s), depth, out);
        }
    }

    private void ifStatement(IfStatement s, int depth, List<Line> out, String prefix) {
        addFlattened(out, depth, prefix + "if (" + expression(s.test) + ") {");
        body(s.consequent, depth + 1, out);
        if (s.alternate == null) {
            out.add(new Line(depth, "}"));
        } else if (s.alternate instanceof IfStatement) {
            ifStatement((IfStatement) s.alternate, depth, out, "} else ");
        } else {
            out.add(new Line(depth, "} else {"));
            body(s.alternate, depth + 1, out);
            out.add(new Line(depth, "}"));
        }
    }

    private void forStatement(ForStatement s, int depth, List<Line> out) {
        Set<String> names = new LinkedHashSet<>();
        if (s.init instanceof VariableDeclaration) {
            names.addAll(declaredNames(List.of((Statement) s.init)));
        }
        pushScope(names);
        try {
            String init = s.init == null ? ""
                    : s.init instanceof VariableDeclaration ? declaration((VariableDeclaration) s.init)
                    : expression((Expression) s.init);
            String test = s.test == null ? "" : " " + expression(s.test);
            String update = s.update == null ? "" : " " + expression(s.update);
            addFlattened(out, depth, "for (" + init + ";" + test + ";" + update + ") {");
            body(s.body, depth + 1, out);
            out.add(new Line(depth, "}"));
        } finally {
            popScope();
        }
    }

    private void forInOf(ForInOfStatement s, int depth, List<Line> out) {
        Set<String> names = new LinkedHashSet<>();
        if (s.left instanceof VariableDeclaration) {
            names.addAll(declaredNames(List.of((Statement) s.left)));
        }
        String right = expression(s.right);
        pushScope(names);
        try {
            String left = s.left instanceof VariableDeclaration ? declaration((VariableDeclaration) s.left)
                    : expression((Expression) s.left);
            addFlattened(out, depth, "for (" + left + (s.of ? " of " : " in ") + right + ") {");
            body(s.body, depth + 1, out);
            out.add(new Line(depth, "}"));
        } finally {
            popScope();
        }
    }

    private void whileStatement(WhileStatement s, int depth, List<Line> out) {
        if (s.doWhile) {
            out.add(new Line(depth, "do {"));
            body(s.body, depth + 1, out);
            addFlattened(out, depth, "} while (" + expression(s.test) + ");");
        } else {
            addFlattened(out, depth, "while (" + expression(s.test) + ") {");
            body(s.body, depth + 1, out);
            out.add(new Line(depth, "}"));
        }
    }

    private void tryStatement(TryStatement s, int depth, List<Line> out) {
        out.add(new Line(depth, "try {"));
        nestedBlock(s.block.body, depth + 1, out);
        if (s.handler != null) {
            Set<String> names = s.param == null ? Set.of() : boundNames(s.param);
            out.add(new Line(depth, s.param == null ? "} catch {" : "} catch (" + pattern(s.param) + ") {"));
            pushScope(names);
            try {
                nestedBlock(s.handler.body, depth + 1, out);
            } finally {
                popScope();
            }
        }
        if (s.finalizer != null) {
            out.add(new Line(depth, "} finally {"));
            nestedBlock(s.finalizer.body, depth + 1, out);
        }
        out.add(new Line(depth, "}"));
    }

    private void switchStatement(SwitchStatement s, int depth, List<Line> out) {
        addFlattened(out, depth, "switch (" + expression(s.discriminant) + ") {");
        for (SwitchCase c : s.cases) {
            addFlattened(out, depth + 1, c.test == null ? "default:" : "case " + expression(c.test) + ":");
            nestedBlock(c.consequent, depth + 2, out);
        }
        out.add(new Line(depth, "}"));
    }

    private String declaration(VariableDeclaration d) {
        List<String> parts = new ArrayList<>();
        for (VariableDeclarator v : d.declarations) {
            String text = pattern(v.id);
            if (v.init != null) text += " = " + expression(v.init);
            parts.add(text);
        }
        return d.kind + " " + String.join(", ", parts);
    }

    private static void appendLines(List<Line> out, int depth, List<Line> inner) {
        for (Line l : inner) out.add(new Line(depth + l.depth, l.text));
    }

    /** Splits text containing embedded multi-line expressions into separate lines. */
    private static void addFlattened(List<Line> out, int depth, String text) {
        for (String segment : text.split("\n", -1)) {
            int marks = 0;
            while (marks < segment.length() && segment.charAt(marks) == INDENT_MARK) marks++;
            out.add(new Line(depth + marks, segment.substring(marks)));
        }
    }

    /** Embeds a block of lines into expression text; inverse of {@link #addFlattened}. */
    private static String embedBlock(List<Line> lines) {
        StringBuilder sb = new StringBuilder("{");
        for (Line l : lines) {
            sb.append('\n').append(String.valueOf(INDENT_MARK).repeat(l.depth + 1)).append(l.text);
        }
        sb.append('\n').append('}');
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    /** Parameter list without the surrounding parentheses. */
    public String params(List<Expression> params) {
        List<String> out = new ArrayList<>();
        for (Expression p : params) out.add(pattern(p));
        return String.join(", ", out);
    }

    private String pattern(Expression p) {
        if (p == null) return "";
        if (p instanceof Identifier) return ((Identifier) p).name;
        if (p instanceof ArrayPattern) {
            List<String> parts = new ArrayList<>();
            for (Expression e : ((ArrayPattern) p).elements) parts.add(pattern(e));
            return "[" + String.join(", ", parts) + "]";
        }
        if (p instanceof ObjectPattern) {
            List<String> parts = new ArrayList<>();
            for (Node n : ((ObjectPattern) p).properties) {
                if (n instanceof Property) {
                    Property prop = (Property) n;
                    if (prop.shorthand) {
                        parts.add(pattern(prop.value));
                    } else {
                        String key = prop.computed ? "[" + expression(prop.key) + "]" : propertyKey(prop.key);
                        parts.add(key + ": " + pattern(prop.value));
                    }
                } else if (n instanceof Expression) {
                    parts.add(pattern((Expression) n));
                }
            }
            return parts.isEmpty() ? "{}" : "{ " + String.join(", ", parts) + " }";
        }
        if (p instanceof AssignmentPattern) {
            AssignmentPattern a = (AssignmentPattern) p;
            return pattern(a.left) + " = " + expression(a.right);
        }
        if (p instanceof RestElement) {
            return "..." + pattern(((RestElement) p).argument);
        }
        return expression(p);
    }

    private String propertyKey(Expression key) {
        if (key instanceof Identifier) return ((Identifier) key).name;
        if (key instanceof Literal) return ((Literal) key).raw;
        return expression(key);
    }

    private String expressionInStatementPosition(Expression e) {
        Expression saved = statementExpression;
        statementExpression = e;
        try {
            return expression(e);
        } finally {
            statementExpression = saved;
        }
    }

    /** Prints an expression; multi-line function bodies are kept as embedded lines. */
    public String expression(Expression e) {
        if (e == null) return "";
        boolean statementPosition = e == statementExpression;
        if (e instanceof Identifier) {
            return identifier(((Identifier) e).name);
        }
        if (e instanceof Literal) {
            return ((Literal) e).raw;
        }
        if (e instanceof TemplateLiteral) {
            TemplateLiteral t = (TemplateLiteral) e;
            StringBuilder sb = new StringBuilder("`");
            for (int i = 0; i < t.quasis.size(); i++) {
                sb.append(t.quasis.get(i));
                if (i < t.expressions.size()) {
                    sb.append("${").append(expression(t.expressions.get(i))).append('}');
                }
            }
            return sb.append('`').toString();
        }
        if (e instanceof ArrayExpression) {
            List<String> parts = new ArrayList<>();
            for (Expression el : ((ArrayExpression) e).elements) parts.add(el == null ? "" : expression(el));
            return "[" + String.join(", ", parts) + "]";
        }
        if (e instanceof ObjectExpression) {
            return objectExpression((ObjectExpression) e);
        }
        if (e instanceof SpreadElement) {
            return "..." + expression(((SpreadElement) e).argument);
        }
        if (e instanceof ArrowFunctionExpression) {
            ArrowFunctionExpression a = (ArrowFunctionExpression) e;
            String head = (a.async ? "async " : "") + "(" + params(a.params) + ") => ";
            if (a.body instanceof BlockStatement) {
                return head + embedBlock(functionBody(a.params, a.body));
            }
            pushScope(paramNames(a.params));
            try {
                Expression body = (Expression) a.body;
                String text = expressionInStatementPosition(body);
                return head + (ParenthesizedExpression.unwrap(body) instanceof ObjectExpression
                        && !(body instanceof ParenthesizedExpression) ? "(" + text + ")" : text);
            } finally {
                popScope();
            }
        }
        if (e instanceof FunctionExpression) {
            FunctionExpression f = (FunctionExpression) e;
            Set<String> names = new LinkedHashSet<>();
            if (f.id != null) names.add(f.id);
            pushScope(names);
            try {
                return (f.async ? "async " : "") + "function" + (f.id == null ? "" : " " + f.id)
                        + "(" + params(f.params) + ") " + embedBlock(functionBody(f.params, f.body));
            } finally {
                popScope();
            }
        }
        if (e instanceof CallExpression) {
            CallExpression c = (CallExpression) e;
            String replaced = hook.call(c, this, statementPosition);
            if (replaced != null) return replaced;
            return expression(c.callee) + (c.optional ? "?.(" : "(") + arguments(c.arguments) + ")";
        }
        if (e instanceof NewExpression) {
            NewExpression n = (NewExpression) e;
            return "new " + expression(n.callee) + "(" + arguments(n.arguments) + ")";
        }
        if (e instanceof MemberExpression) {
            MemberExpression m = (MemberExpression) e;
            String replaced = hook.member(m, this);
            if (replaced != null) return replaced;
            String object = expression(m.object);
            if (m.computed) {
                return object + (m.optional ? "?.[" : "[") + expression(m.property) + "]";
            }
            return object + (m.optional ? "?." : ".") + m.propertyName();
        }
        if (e instanceof UnaryExpression) {
            UnaryExpression u = (UnaryExpression) e;
            return u.operator + (WORD_OPERATORS.contains(u.operator) ? " " : "") + expression(u.argument);
        }
        if (e instanceof UpdateExpression) {
            UpdateExpression u = (UpdateExpression) e;
            return u.prefix ? u.operator + expression(u.argument) : expression(u.argument) + u.operator;
        }
        if (e instanceof BinaryExpression) {
            BinaryExpression b = (BinaryExpression) e;
            return expression(b.left) + " " + b.operator + " " + expression(b.right);
        }
        if (e instanceof ConditionalExpression) {
            ConditionalExpression c = (ConditionalExpression) e;
            return expression(c.test) + " ? " + expression(c.consequent) + " : " + expression(c.alternate);
        }
        if (e instanceof AssignmentExpression) {
            AssignmentExpression a = (AssignmentExpression) e;
            return expression(a.target) + " " + a.operator + " " + expression(a.value);
        }
        if (e instanceof SequenceExpression) {
            List<String> parts = new ArrayList<>();
            for (Expression x : ((SequenceExpression) e).expressions) parts.add(expression(x));
            return String.join(", ", parts);
        }
        if (e instanceof AwaitExpression) {
            return "await " + expression(((AwaitExpression) e).argument);
        }
        if (e instanceof ParenthesizedExpression) {
            return "(" + expression(((ParenthesizedExpression) e).expression) + ")";
        }
        if (e instanceof ArrayPattern || e instanceof ObjectPattern || e instanceof AssignmentPattern
                || e instanceof RestElement) {
            return pattern(e);
        }
        return program.textOf(e);
    }

    private String identifier(String name) {
        if (isLocal(name)) return name;
        String replaced = hook.identifier(name);
        return replaced == null ? name : replaced;
    }

    private String arguments(List<Expression> args) {
        List<String> parts = new ArrayList<>();
        for (Expression a : args) parts.add(expression(a));
        return String.join(", ", parts);
    }

    private String objectExpression(ObjectExpression o) {
        if (o.properties.isEmpty()) return "{}";
        List<String> parts = new ArrayList<>();
        for (Node n : o.properties) {
            if (n instanceof SpreadElement) {
                parts.add(expression((SpreadElement) n));
                continue;
            }
            if (!(n instanceof Property)) {
                parts.add(program.textOf(n));
                continue;
            }
            Property p = (Property) n;
            String key = p.computed ? "[" + expression(p.key) + "]" : propertyKey(p.key);
            if (p.method) {
                FunctionExpression f = (FunctionExpression) p.value;
                String prefix = "get".equals(p.kind) || "set".equals(p.kind) ? p.kind + " " : (f.async ? "async " : "");
                parts.add(prefix + key + "(" + params(f.params) + ") " + embedBlock(functionBody(f.params, f.body)));
            } else if (p.shorthand) {
                String value = expression(p.value);
                parts.add(value.equals(key) ? key : key + ": " + value);
            } else {
                parts.add(key + ": " + expression(p.value));
            }
        }
        return "{ " + String.join(", ", parts) + " }";
    }
}
