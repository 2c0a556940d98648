package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrAttributeKind;
import info.isaksson.erland.reacttoangular.ir.IrControlFlow;
import info.isaksson.erland.reacttoangular.ir.IrControlFlowKind;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNodeKind;
import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.BinaryExpression;
import info.isaksson.erland.reacttoangular.syntax.BlockStatement;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.ConditionalExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.IfStatement;
import info.isaksson.erland.reacttoangular.syntax.JsPrinter;
import info.isaksson.erland.reacttoangular.syntax.JsxAttribute;
import info.isaksson.erland.reacttoangular.syntax.JsxElement;
import info.isaksson.erland.reacttoangular.syntax.JsxExpressionContainer;
import info.isaksson.erland.reacttoangular.syntax.JsxFragment;
import info.isaksson.erland.reacttoangular.syntax.JsxSpreadAttribute;
import info.isaksson.erland.reacttoangular.syntax.JsxText;
import info.isaksson.erland.reacttoangular.syntax.Literal;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.ReturnStatement;
import info.isaksson.erland.reacttoangular.syntax.Statement;
import info.isaksson.erland.reacttoangular.syntax.TemplateLiteral;
import info.isaksson.erland.reacttoangular.syntax.UnaryExpression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_ATTRIBUTE;
import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_PATTERN;

/**
 * Third pass: turns the returned JSX into the template tree.
 *
 * <p>Top-level {@code if (c) return <jsx/>} statements before the final return become sibling
 * branches guarded by {@code c} and by the negation of every earlier guard. Event attributes are
 * queued for the event pass against temporary element ids; ids are renumbered in pre-order
 * ({@code n0}, {@code n1}, ...) once the tree is complete.</p>
 */
final class TemplatePass {

    private static final Map<String, String> ATTRIBUTE_NAMES = Map.of(
            "className", "class",
            "htmlFor", "for"
    );

    private TemplatePass() {}

    static void apply(TranspileContext ctx) {
        Renderer renderer = new Renderer(ctx);
        List<IrTemplateNode> roots = new ArrayList<>();

        if (ctx.expressionBody != null) {
            roots.addAll(renderer.expressionChild(ctx.expressionBody));
        } else {
            List<String> earlierGuards = new ArrayList<>();
            for (Statement s : ctx.body) {
                if (isEarlyReturn(s)) {
                    IfStatement branch = (IfStatement) s;
                    List<String> guard = negations(earlierGuards);
                    guard.add(renderer.guardOperand(branch.test));
                    roots.addAll(withFlow(ctx, renderer.expressionChild(returnedBy(branch.consequent)),
                            IrControlFlow.conditional(String.join(" && ", guard))));
                    earlierGuards.add(renderer.guardOperand(branch.test));
                } else if (s instanceof ReturnStatement) {
                    List<IrTemplateNode> nodes = renderer.expressionChild(((ReturnStatement) s).argument);
                    if (!earlierGuards.isEmpty()) {
                        nodes = withFlow(ctx, nodes, IrControlFlow.conditional(String.join(" && ", negations(earlierGuards))));
                    }
                    roots.addAll(nodes);
                    break;
                }
            }
        }

        IrTemplateNode root;
        if (roots.isEmpty()) {
            root = null;
        } else if (roots.size() == 1) {
            root = roots.get(0);
        } else {
            root = IrTemplateNode.container(ctx.nextTempId(), roots);
        }
        ctx.template = renumber(ctx, root);
    }

    /** {@code if (c) return x;} without an else branch. */
    static boolean isEarlyReturn(Statement s) {
        if (!(s instanceof IfStatement)) return false;
        IfStatement i = (IfStatement) s;
        return i.alternate == null && returnStatementOf(i.consequent) != null;
    }

    private static ReturnStatement returnStatementOf(Statement s) {
        if (s instanceof ReturnStatement) return (ReturnStatement) s;
        if (s instanceof BlockStatement) {
            List<Statement> body = ((BlockStatement) s).body;
            if (body.size() == 1 && body.get(0) instanceof ReturnStatement) return (ReturnStatement) body.get(0);
        }
        return null;
    }

    private static Expression returnedBy(Statement s) {
        return returnStatementOf(s).argument;
    }

    private static List<String> negations(List<String> guards) {
        List<String> out = new ArrayList<>();
        for (String g : guards) out.add("!" + g);
        return out;
    }

    /** Attaches control flow to a single element or container, wrapping anything else. */
    private static List<IrTemplateNode> withFlow(TranspileContext ctx, List<IrTemplateNode> nodes, IrControlFlow flow) {
        if (nodes.isEmpty()) return nodes;
        if (nodes.size() == 1) {
            IrTemplateNode only = nodes.get(0);
            boolean holdsFlow = only.kind == IrTemplateNodeKind.ELEMENT || only.kind == IrTemplateNodeKind.CONTAINER;
            if (holdsFlow && only.controlFlow.kind == IrControlFlowKind.NONE) {
                return List.of(only.withControlFlow(flow));
            }
        }
        return List.of(IrTemplateNode.container(ctx.nextTempId(), nodes).withControlFlow(flow));
    }

    /** JSX whitespace: lines are trimmed at their joins, blank lines vanish, the rest join with a space. */
    static String jsxText(String raw) {
        String[] lines = raw.split("\r?\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].replace('\t', ' ');
            if (i > 0) line = line.stripLeading();
            if (i < lines.length - 1) line = line.stripTrailing();
            if (line.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(line);
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Renumbering
    // ------------------------------------------------------------------

    private static IrTemplateNode renumber(TranspileContext ctx, IrTemplateNode root) {
        if (root == null) return null;
        Map<String, String> ids = new HashMap<>();
        IrTemplateNode renumbered = renumber(root, ids, new int[1]);
        for (TranspileContext.PendingHandler h : ctx.pendingHandlers) {
            h.elementId = ids.getOrDefault(h.elementId, h.elementId);
        }
        return renumbered;
    }

    private static IrTemplateNode renumber(IrTemplateNode node, Map<String, String> ids, int[] counter) {
        String id = "n" + (counter[0]++);
        ids.put(node.id, id);
        List<IrTemplateNode> children = new ArrayList<>();
        for (IrTemplateNode child : node.children) children.add(renumber(child, ids, counter));
        return new IrTemplateNode(id, node.kind, node.tag, node.text, node.controlFlow, node.twoWayProperty,
                node.attributes, children);
    }

    // ------------------------------------------------------------------
    // JSX conversion
    // ------------------------------------------------------------------

    private static final class Renderer {
        private final TranspileContext ctx;
        private final JsPrinter printer;
        private final Deque<Set<String>> loopScopes = new ArrayDeque<>();

        Renderer(TranspileContext ctx) {
            this.ctx = ctx;
            this.printer = MemberQualifier.forTemplate(ctx).printer();
        }

        String print(Expression e) {
            return printer.expression(e);
        }

        /** Printed test, parenthesized unless it is a single operand. */
        String guardOperand(Expression test) {
            Expression e = ParenthesizedExpression.unwrap(test);
            String text = print(e);
            boolean simple = e instanceof Identifier || e instanceof MemberExpression || e instanceof CallExpression
                    || e instanceof Literal || e instanceof UnaryExpression;
            return simple ? text : "(" + text + ")";
        }

        private boolean isLoopLocal(String name) {
            for (Set<String> scope : loopScopes) {
                if (scope.contains(name)) return true;
            }
            return false;
        }

        private List<String> loopLocals() {
            List<String> out = new ArrayList<>();
            List<Set<String>> outerFirst = new ArrayList<>(loopScopes);
            Collections.reverse(outerFirst);
            for (Set<String> scope : outerFirst) out.addAll(scope);
            return out;
        }

        List<IrTemplateNode> expressionChild(Expression raw) {
            Expression e = ParenthesizedExpression.unwrap(raw);
            if (e == null) return List.of();
            if (e instanceof JsxElement) return List.of(element((JsxElement) e));
            if (e instanceof JsxFragment) {
                String id = ctx.nextTempId();
                return List.of(IrTemplateNode.container(id, children(((JsxFragment) e).children)));
            }
            if (e instanceof Literal) {
                Literal l = (Literal) e;
                switch (l.kind) {
                    case STRING: return List.of(IrTemplateNode.text(ctx.nextTempId(), l.stringValue()));
                    case NUMBER: return List.of(IrTemplateNode.text(ctx.nextTempId(), l.raw));
                    default: return List.of();
                }
            }
            if (e instanceof Identifier && "undefined".equals(((Identifier) e).name)) return List.of();
            if (e instanceof TemplateLiteral) return templateLiteral((TemplateLiteral) e);
            if (e instanceof BinaryExpression && "&&".equals(((BinaryExpression) e).operator)
                    && isRenderable(((BinaryExpression) e).right)) {
                BinaryExpression b = (BinaryExpression) e;
                return withFlow(ctx, expressionChild(b.right), IrControlFlow.conditional(print(b.left)));
            }
            if (e instanceof ConditionalExpression) {
                ConditionalExpression c = (ConditionalExpression) e;
                if (isRenderable(c.consequent) || isRenderable(c.alternate)) {
                    List<IrTemplateNode> out = new ArrayList<>();
                    out.addAll(withFlow(ctx, expressionChild(c.consequent), IrControlFlow.conditional(print(c.test))));
                    out.addAll(withFlow(ctx, expressionChild(c.alternate),
                            IrControlFlow.conditional("!" + guardOperand(c.test))));
                    return out;
                }
            }
            if (isMapCall(e)) {
                List<IrTemplateNode> repeated = repeat((CallExpression) e);
                if (repeated != null) return repeated;
            }
            return List.of(IrTemplateNode.interpolation(ctx.nextTempId(), print(e)));
        }

        private boolean isRenderable(Expression raw) {
            Expression e = ParenthesizedExpression.unwrap(raw);
            if (e instanceof JsxElement || e instanceof JsxFragment) return true;
            if (isMapCall(e)) return true;
            if (e instanceof BinaryExpression && "&&".equals(((BinaryExpression) e).operator)) {
                return isRenderable(((BinaryExpression) e).right);
            }
            if (e instanceof ConditionalExpression) {
                ConditionalExpression c = (ConditionalExpression) e;
                return isRenderable(c.consequent) || isRenderable(c.alternate);
            }
            return false;
        }

        private boolean isMapCall(Expression e) {
            if (!(e instanceof CallExpression)) return false;
            CallExpression c = (CallExpression) e;
            if (!(c.callee instanceof MemberExpression) || c.arguments.isEmpty()) return false;
            Expression fn = ParenthesizedExpression.unwrap(c.arguments.get(0));
            return "map".equals(((MemberExpression) c.callee).propertyName())
                    && (fn instanceof ArrowFunctionExpression || fn instanceof FunctionExpression);
        }

        /** {@code source.map((item, i) => <jsx/>)}; null when the callback shape is not supported. */
        private List<IrTemplateNode> repeat(CallExpression call) {
            Expression fn = ParenthesizedExpression.unwrap(call.arguments.get(0));
            List<Expression> params = fn instanceof ArrowFunctionExpression
                    ? ((ArrowFunctionExpression) fn).params : ((FunctionExpression) fn).params;
            Node body = fn instanceof ArrowFunctionExpression
                    ? ((ArrowFunctionExpression) fn).body : ((FunctionExpression) fn).body;

            if (params.isEmpty() || params.size() > 2 || !(params.get(0) instanceof Identifier)
                    || (params.size() == 2 && !(params.get(1) instanceof Identifier))) {
                ctx.warn(UNSUPPORTED_PATTERN, "map callback parameters must be plain names", fn);
                return null;
            }
            Expression rendered = ExpressionShapes.returnedValue(body);
            if (rendered == null) {
                ctx.warn(UNSUPPORTED_PATTERN, "map callback must return JSX directly", fn);
                return null;
            }
            String item = ((Identifier) params.get(0)).name;
            String index = params.size() == 2 ? ((Identifier) params.get(1)).name : null;
            String source = print(((MemberExpression) call.callee).object);

            Set<String> locals = new LinkedHashSet<>();
            locals.add(item);
            if (index != null) locals.add(index);
            loopScopes.push(locals);
            printer.pushScope(locals);
            List<IrTemplateNode> nodes;
            try {
                nodes = expressionChild(rendered);
            } finally {
                printer.popScope();
                loopScopes.pop();
            }
            return withFlow(ctx, nodes, IrControlFlow.repeat(source, item, index));
        }

        private List<IrTemplateNode> templateLiteral(TemplateLiteral t) {
            List<IrTemplateNode> out = new ArrayList<>();
            for (int i = 0; i < t.quasis.size(); i++) {
                if (!t.quasis.get(i).isEmpty()) out.add(IrTemplateNode.text(ctx.nextTempId(), t.quasis.get(i)));
                if (i < t.expressions.size()) {
                    out.add(IrTemplateNode.interpolation(ctx.nextTempId(), print(t.expressions.get(i))));
                }
            }
            return out;
        }

        private List<IrTemplateNode> children(List<Node> kids) {
            List<IrTemplateNode> out = new ArrayList<>();
            for (Node kid : kids) {
                if (kid instanceof JsxText) {
                    String text = jsxText(((JsxText) kid).value);
                    if (!text.isEmpty()) out.add(IrTemplateNode.text(ctx.nextTempId(), text));
                } else if (kid instanceof JsxExpressionContainer) {
                    JsxExpressionContainer c = (JsxExpressionContainer) kid;
                    if (!c.isEmpty()) out.addAll(expressionChild(c.expression));
                } else if (kid instanceof Expression) {
                    out.addAll(expressionChild((Expression) kid));
                }
            }
            return out;
        }

        private IrTemplateNode element(JsxElement el) {
            String id = ctx.nextTempId();
            TwoWay twoWay = twoWay(el);
            List<IrAttribute> attributes = new ArrayList<>();

            for (Node n : el.attributes) {
                if (n instanceof JsxSpreadAttribute) {
                    ctx.warn(UNSUPPORTED_ATTRIBUTE, "spread attributes on <" + el.name + "> are not converted", n);
                    continue;
                }
                JsxAttribute a = (JsxAttribute) n;
                if ("key".equals(a.name)) continue;
                if ("ref".equals(a.name)) {
                    ctx.warn(UNSUPPORTED_ATTRIBUTE, "ref on <" + el.name + "> is not converted", a);
                    continue;
                }
                if (twoWay != null && a.name.equals(twoWay.handlerAttribute)) continue;
                if (twoWay != null && a.name.equals(twoWay.property)) {
                    attributes.add(new IrAttribute("ngModel", IrAttributeKind.TWO_WAY, twoWay.state));
                    continue;
                }
                if (isEventAttribute(a.name)) {
                    Expression handler = a.expression();
                    if (handler == null) {
                        ctx.warn(UNSUPPORTED_ATTRIBUTE, a.name + " on <" + el.name + "> needs an expression handler", a);
                    } else {
                        ctx.pendingHandlers.add(new TranspileContext.PendingHandler(
                                id, el.name, a.name, handler, loopLocals(), TranspileContext.sourceRef(a)));
                    }
                    continue;
                }
                IrAttribute converted = attribute(el, a);
                if (converted != null) attributes.add(converted);
            }

            List<IrTemplateNode> kids = children(el.children);
            IrTemplateNode node = IrTemplateNode.element(id, angularTag(el.name), attributes, kids);
            if (twoWay != null) {
                node = node.withTwoWayProperty(twoWay.state);
                ctx.markTwoWay(twoWay.state);
            }
            return node;
        }

        private IrAttribute attribute(JsxElement el, JsxAttribute a) {
            String name = ATTRIBUTE_NAMES.getOrDefault(a.name, a.name);
            if (a.value == null) return IrAttribute.staticValue(name, null);
            if (a.value instanceof Literal) return IrAttribute.staticValue(name, ((Literal) a.value).stringValue());
            if (!(a.value instanceof JsxExpressionContainer)) {
                ctx.warn(UNSUPPORTED_ATTRIBUTE, "JSX value of '" + a.name + "' on <" + el.name + "> is not converted", a);
                return null;
            }
            Expression e = ParenthesizedExpression.unwrap(a.expression());
            if (e == null) return null;
            if (e instanceof Literal && ((Literal) e).kind == Literal.Kind.STRING) {
                return IrAttribute.staticValue(name, ((Literal) e).stringValue());
            }
            if (e instanceof TemplateLiteral) {
                return new IrAttribute(name, IrAttributeKind.INTERPOLATED, interpolated((TemplateLiteral) e));
            }
            if ("style".equals(a.name)) return IrAttribute.property("ngStyle", print(e));
            return IrAttribute.property(name, print(e));
        }

        private String interpolated(TemplateLiteral t) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < t.quasis.size(); i++) {
                sb.append(t.quasis.get(i));
                if (i < t.expressions.size()) sb.append("{{ ").append(print(t.expressions.get(i))).append(" }}");
            }
            return sb.toString();
        }

        /** Two-way candidate: {@code value}/{@code checked} bound to a state plus a matching change handler. */
        private TwoWay twoWay(JsxElement el) {
            for (String property : List.of("value", "checked")) {
                JsxAttribute bound = el.attribute(property);
                if (bound == null) continue;
                Expression value = ParenthesizedExpression.unwrap(bound.expression());
                if (!(value instanceof Identifier)) continue;
                String local = ((Identifier) value).name;
                if (isLoopLocal(local)) continue;
                String state = ctx.renames.getOrDefault(local, local);
                if (!ctx.isState(state)) continue;
                String setter = ctx.aliases.setterFor(state);
                for (String handlerName : List.of("onChange", "onInput")) {
                    JsxAttribute handler = el.attribute(handlerName);
                    if (handler != null && ExpressionShapes.isTwoWayHandler(handler.expression(), setter, property)) {
                        return new TwoWay(state, property, handlerName);
                    }
                }
            }
            return null;
        }
    }

    private static final class TwoWay {
        final String state;
        final String property;
        final String handlerAttribute;

        TwoWay(String state, String property, String handlerAttribute) {
            this.state = state;
            this.property = property;
            this.handlerAttribute = handlerAttribute;
        }
    }

    static boolean isEventAttribute(String name) {
        return name.length() > 2 && name.startsWith("on") && Character.isUpperCase(name.charAt(2));
    }

    /** {@code div -> div}, {@code TodoItem -> app-todo-item}. */
    static String angularTag(String jsxName) {
        if (NameUtil.isComponentName(jsxName)) return "app-" + NameUtil.kebab(jsxName);
        return jsxName;
    }
}
