package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrEventBinding;
import info.isaksson.erland.reacttoangular.ir.IrEventKind;
import info.isaksson.erland.reacttoangular.ir.IrLine;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.JsPrinter;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.SourceRange;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fourth pass: resolves the event attributes queued by the template pass into event bindings.
 *
 * <ul>
 *   <li>a setter, or a handler made only of setter calls, gets a generated method
 *       ({@code SETTER_CALL});</li>
 *   <li>a known method, or a handler that only calls one, is called directly ({@code DIRECT_CALL});</li>
 *   <li>anything else is carried inline with the event parameter renamed {@code $event}
 *       ({@code INLINE_EXPRESSION}); block bodies move into a generated method.</li>
 * </ul>
 * A name that is both a method and a setter resolves as a setter.
 */
final class EventPass {

    static final String EVENT = "$event";

    private EventPass() {}

    static void apply(TranspileContext ctx) {
        for (TranspileContext.PendingHandler h : ctx.pendingHandlers) {
            ctx.events.add(resolve(ctx, h));
        }
        ctx.pendingHandlers.clear();
    }

    /** {@code onClick -> click}; {@code onChange -> input} on text fields, {@code change} elsewhere. */
    static String eventName(String reactEvent, String tag) {
        String base = reactEvent.substring(2);
        if ("Change".equals(base)) {
            return "input".equals(tag) || "textarea".equals(tag) ? "input" : "change";
        }
        if ("DoubleClick".equals(base)) return "dblclick";
        return base.toLowerCase(Locale.ROOT);
    }

    private static IrEventBinding resolve(TranspileContext ctx, TranspileContext.PendingHandler h) {
        String event = eventName(h.reactEvent, h.tag);
        Expression handler = ParenthesizedExpression.unwrap(h.handler);

        if (handler instanceof Identifier && !h.loopLocals.contains(((Identifier) handler).name)) {
            String name = ((Identifier) handler).name;
            if (ctx.aliases.isSetter(name)) {
                MemberQualifier q = MemberQualifier.forClass(ctx);
                String method = handlerName(ctx, h);
                List<IrLine> body = List.of(new IrLine(0, q.qualify(ctx.aliases.stateFor(name)) + " = event;"));
                ctx.methods.add(new IrMethod(method, IrMethodKind.GENERATED_HANDLER, List.of("event: any"), false, body, h.source));
                return new IrEventBinding(h.elementId, event, IrEventKind.SETTER_CALL, method + "(" + EVENT + ")", method, h.source);
            }
            if (ctx.isCallableMethod(name)) {
                boolean takesEvent = !ctx.method(name).params.isEmpty();
                String call = name + (takesEvent ? "(" + EVENT + ")" : "()");
                return new IrEventBinding(h.elementId, event, IrEventKind.DIRECT_CALL, call, name, h.source);
            }
        }

        if (handler instanceof ArrowFunctionExpression || handler instanceof FunctionExpression) {
            return functionHandler(ctx, h, event, handler);
        }

        String inline = inlinePrinted(ctx, h, handler, null) + "(" + EVENT + ")";
        return new IrEventBinding(h.elementId, event, IrEventKind.INLINE_EXPRESSION, inline, null, h.source);
    }

    private static IrEventBinding functionHandler(TranspileContext ctx, TranspileContext.PendingHandler h,
                                                  String event, Expression fn) {
        List<Expression> params = fn instanceof ArrowFunctionExpression
                ? ((ArrowFunctionExpression) fn).params : ((FunctionExpression) fn).params;
        Node body = fn instanceof ArrowFunctionExpression
                ? ((ArrowFunctionExpression) fn).body : ((FunctionExpression) fn).body;
        boolean async = fn instanceof ArrowFunctionExpression
                ? ((ArrowFunctionExpression) fn).async : ((FunctionExpression) fn).async;
        String eventParam = !params.isEmpty() && params.get(0) instanceof Identifier
                ? ((Identifier) params.get(0)).name : null;

        Expression single = ExpressionShapes.singleExpression(body);
        List<Expression> statements = ExpressionShapes.expressionStatements(body);

        if (isSetterOnly(ctx, single, statements)) {
            String method = generateMethod(ctx, h, params, body, async);
            return new IrEventBinding(h.elementId, event, IrEventKind.SETTER_CALL,
                    bindingCall(method, params, loopLocalsUsed(h, fn, params)), method, h.source);
        }

        if (single instanceof CallExpression) {
            String callee = ((CallExpression) single).calleeName();
            Set<String> paramNames = JsPrinter.boundNames(params.isEmpty() ? null : params.get(0));
            if (callee != null && ctx.isCallableMethod(callee)
                    && !h.loopLocals.contains(callee) && !paramNames.contains(callee)) {
                String call = templatePrinted(ctx, h, single, eventParam);
                return new IrEventBinding(h.elementId, event, IrEventKind.DIRECT_CALL, call, callee, h.source);
            }
        }

        if (fn instanceof ArrowFunctionExpression && ((ArrowFunctionExpression) fn).hasExpressionBody()) {
            String inline = inlinePrinted(ctx, h, (Expression) body, eventParam);
            return new IrEventBinding(h.elementId, event, IrEventKind.INLINE_EXPRESSION, inline, null, h.source);
        }

        String method = generateMethod(ctx, h, params, body, async);
        return new IrEventBinding(h.elementId, event, IrEventKind.INLINE_EXPRESSION,
                bindingCall(method, params, loopLocalsUsed(h, fn, params)), method, h.source);
    }

    private static boolean isSetterOnly(TranspileContext ctx, Expression single, List<Expression> statements) {
        if (single != null && ExpressionShapes.setterCall(single, ctx.aliases) != null) return true;
        if (statements == null || statements.isEmpty()) return false;
        for (Expression e : statements) {
            if (ExpressionShapes.setterCall(e, ctx.aliases) == null) return false;
        }
        return true;
    }

    /** {@code on<Tag><Event>}, numbered when taken. */
    private static String handlerName(TranspileContext ctx, TranspileContext.PendingHandler h) {
        String base = "on" + NameUtil.pascal(h.tag) + h.reactEvent.substring(2);
        return NameUtil.unique(base, ctx.memberNames());
    }

    /** Loop variables the handler reads; they become extra parameters of a generated method. */
    private static List<String> loopLocalsUsed(TranspileContext.PendingHandler h, Expression fn, List<Expression> params) {
        Set<String> refs = ReferencedNames.of(fn);
        Set<String> own = params.isEmpty() ? Set.of() : JsPrinter.boundNames(params.get(0));
        List<String> out = new ArrayList<>();
        for (String local : h.loopLocals) {
            if (refs.contains(local) && !own.contains(local)) out.add(local);
        }
        return out;
    }

    private static String generateMethod(TranspileContext ctx, TranspileContext.PendingHandler h,
                                         List<Expression> params, Node body, boolean async) {
        String name = handlerName(ctx, h);
        List<Expression> methodParams = new ArrayList<>();
        if (!params.isEmpty()) methodParams.add(params.get(0));
        Expression fn = ParenthesizedExpression.unwrap(h.handler);
        for (String local : loopLocalsUsed(h, fn, params)) {
            methodParams.add(new Identifier(SourceRange.NONE, local));
        }
        JsPrinter printer = MemberQualifier.forClass(ctx).printer();
        List<String> typed = StateEffectPass.typedParams(printer, methodParams);
        List<IrLine> lines = StateEffectPass.toIr(printer.functionBody(methodParams, body));
        ctx.methods.add(new IrMethod(name, IrMethodKind.GENERATED_HANDLER, typed, async, lines, h.source));
        return name;
    }

    private static String bindingCall(String method, List<Expression> params, List<String> loopLocals) {
        List<String> args = new ArrayList<>();
        if (!params.isEmpty()) args.add(EVENT);
        args.addAll(loopLocals);
        return method + "(" + String.join(", ", args) + ")";
    }

    /** Template-scope print: members unqualified, loop variables kept, event parameter as {@code $event}. */
    private static String templatePrinted(TranspileContext ctx, TranspileContext.PendingHandler h,
                                          Expression e, String eventParam) {
        return printWith(MemberQualifier.forTemplate(ctx), h, e, eventParam);
    }

    /** Inline print: state and members {@code this.}-qualified, event parameter as {@code $event}. */
    private static String inlinePrinted(TranspileContext ctx, TranspileContext.PendingHandler h,
                                        Expression e, String eventParam) {
        return printWith(MemberQualifier.forClass(ctx), h, e, eventParam);
    }

    private static String printWith(MemberQualifier qualifier, TranspileContext.PendingHandler h,
                                    Expression e, String eventParam) {
        JsPrinter printer = qualifier.printer();
        Set<String> locals = new LinkedHashSet<>(h.loopLocals);
        if (eventParam != null) {
            locals.remove(eventParam);
            qualifier.pushSubstitution(eventParam, EVENT);
        }
        printer.pushScope(locals);
        try {
            return printer.expression(e);
        } finally {
            printer.popScope();
            if (eventParam != null) qualifier.popSubstitution();
        }
    }
}
