package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrEffect;
import info.isaksson.erland.reacttoangular.ir.IrLine;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.ir.IrPropertyKind;
import info.isaksson.erland.reacttoangular.ir.IrStateBinding;
import info.isaksson.erland.reacttoangular.syntax.ArrayExpression;
import info.isaksson.erland.reacttoangular.syntax.ArrayPattern;
import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.AssignmentExpression;
import info.isaksson.erland.reacttoangular.syntax.AssignmentPattern;
import info.isaksson.erland.reacttoangular.syntax.BlockStatement;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.ExpressionStatement;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.JsPrinter;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.RestElement;
import info.isaksson.erland.reacttoangular.syntax.ReturnStatement;
import info.isaksson.erland.reacttoangular.syntax.Statement;
import info.isaksson.erland.reacttoangular.syntax.UpdateExpression;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclaration;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclarator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_EFFECT;
import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_HOOK;
import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_PATTERN;

/**
 * Second pass: hook calls become state bindings, ref properties, methods, getters and effects.
 * Once the alias map is complete, all method, getter and effect bodies are lowered to class code.
 */
final class StateEffectPass {

    private StateEffectPass() {}

    static void apply(TranspileContext ctx) {
        for (Statement s : ctx.body) {
            if (s instanceof VariableDeclaration) {
                VariableDeclaration vd = (VariableDeclaration) s;
                for (VariableDeclarator d : vd.declarations) {
                    String hook = HookCalls.hookName(d.init);
                    if (hook != null) hookDeclarator(ctx, vd, d, hook);
                }
            } else if (s instanceof ExpressionStatement) {
                String hook = HookCalls.hookName(s);
                if (hook == null) continue;
                CallExpression call = (CallExpression) ParenthesizedExpression.unwrap(((ExpressionStatement) s).expression);
                if (HookCalls.isEffect(hook)) {
                    effect(ctx, call, s);
                } else {
                    ctx.passthrough("hook " + hook, s);
                    ctx.warn(UNSUPPORTED_HOOK, hook + "() is not supported; the call is passed through", s);
                }
            }
        }
        lowerMethods(ctx);
        lowerEffects(ctx);
    }

    // ------------------------------------------------------------------
    // Hook declarations
    // ------------------------------------------------------------------

    private static void hookDeclarator(TranspileContext ctx, VariableDeclaration vd, VariableDeclarator d, String hook) {
        CallExpression call = (CallExpression) ParenthesizedExpression.unwrap(d.init);
        Expression arg = call.arguments.isEmpty() ? null : ParenthesizedExpression.unwrap(call.arguments.get(0));
        String text = vd.kind + " " + ctx.program.textOf(d) + ";";

        switch (hook) {
            case HookCalls.USE_STATE:
                if (!state(ctx, d, arg)) {
                    ctx.passthrough("useState pattern", text, d);
                    ctx.warn(UNSUPPORTED_PATTERN, "useState result must be destructured as [value, setter]", d);
                }
                return;
            case HookCalls.USE_REF:
                if (d.name() != null) {
                    String value = arg == null ? "undefined" : initializerText(ctx, arg);
                    ctx.properties.add(new IrProperty(ctx.claimMember(d.name()), IrPropertyKind.REF, "{ current: any }",
                            "{ current: " + value + " }", TranspileContext.sourceRef(d)));
                    return;
                }
                break;
            case HookCalls.USE_CALLBACK:
                if (d.name() != null && arg instanceof ArrowFunctionExpression) {
                    ArrowFunctionExpression a = (ArrowFunctionExpression) arg;
                    ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                            ctx.claimMember(d.name()), IrMethodKind.DECLARED, a.params, a.body, a.async, TranspileContext.sourceRef(d)));
                    return;
                }
                if (d.name() != null && arg instanceof FunctionExpression) {
                    FunctionExpression f = (FunctionExpression) arg;
                    ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                            ctx.claimMember(d.name()), IrMethodKind.DECLARED, f.params, f.body, f.async, TranspileContext.sourceRef(d)));
                    return;
                }
                break;
            case HookCalls.USE_MEMO:
                if (d.name() != null && arg instanceof ArrowFunctionExpression
                        && ((ArrowFunctionExpression) arg).params.isEmpty()) {
                    ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                            ctx.claimMember(d.name()), IrMethodKind.GETTER, List.of(), ((ArrowFunctionExpression) arg).body,
                            false, TranspileContext.sourceRef(d)));
                    return;
                }
                break;
            default:
                break;
        }
        ctx.passthrough("hook " + hook, text, d);
        ctx.warn(UNSUPPORTED_HOOK, hook + "() is not supported; the declaration is passed through", d);
    }

    private static boolean state(TranspileContext ctx, VariableDeclarator d, Expression arg) {
        if (!(d.id instanceof ArrayPattern)) return false;
        List<Expression> elements = ((ArrayPattern) d.id).elements;
        if (elements.isEmpty() || elements.size() > 2 || !(elements.get(0) instanceof Identifier)) return false;
        if (elements.size() == 2 && elements.get(1) != null && !(elements.get(1) instanceof Identifier)) return false;
        String name = ctx.claimMember(((Identifier) elements.get(0)).name);
        String setter = elements.size() == 2 && elements.get(1) != null ? ((Identifier) elements.get(1)).name : null;

        Expression value = arg;
        boolean invoke = arg instanceof FunctionExpression;
        if (arg instanceof ArrowFunctionExpression) {
            ArrowFunctionExpression lazy = (ArrowFunctionExpression) arg;
            if (lazy.params.isEmpty() && lazy.hasExpressionBody()) {
                value = ParenthesizedExpression.unwrap((Expression) lazy.body);
            } else {
                invoke = true;
            }
        }
        String init = value == null ? "undefined" : initializerText(ctx, value);
        String type = TypeInference.ANY;
        if (invoke) {
            init = "(" + init + ")()";
        } else {
            type = TypeInference.infer(value);
        }
        boolean deferred = value != null && readsInputs(ctx, value);
        ctx.states.add(new IrStateBinding(name, setter, type, init, deferred, false, TranspileContext.sourceRef(d)));
        if (setter != null) ctx.aliases.put(setter, name);
        return true;
    }

    /** Source text of an initializer; qualified only when it reads props or inputs. */
    private static String initializerText(TranspileContext ctx, Expression value) {
        if (!readsInputs(ctx, value)) return ctx.program.textOf(value);
        return MemberQualifier.forClass(ctx).printer().expression(value);
    }

    private static boolean readsInputs(TranspileContext ctx, Expression value) {
        Set<String> refs = ReferencedNames.of(value);
        if (ctx.propsName != null && refs.contains(ctx.propsName)) return true;
        for (String r : refs) {
            if (ctx.inputs.containsKey(ctx.renames.getOrDefault(r, r))) return true;
        }
        return false;
    }

    private static void effect(TranspileContext ctx, CallExpression call, Statement s) {
        Expression fn = call.arguments.isEmpty() ? null : ParenthesizedExpression.unwrap(call.arguments.get(0));
        if (!(fn instanceof ArrowFunctionExpression) && !(fn instanceof FunctionExpression)) {
            ctx.passthrough("effect", s);
            ctx.warn(UNSUPPORTED_EFFECT, "effect callback must be a function literal", s);
            return;
        }
        Expression deps = call.arguments.size() > 1 ? call.arguments.get(1) : null;
        ctx.pendingEffects.add(new TranspileContext.PendingEffect(
                ctx.pendingEffects.size(), fn, deps, TranspileContext.sourceRef(s)));
    }

    // ------------------------------------------------------------------
    // Lowering
    // ------------------------------------------------------------------

    private static void lowerMethods(TranspileContext ctx) {
        for (TranspileContext.PendingMethod pm : ctx.pendingMethods) {
            JsPrinter printer = MemberQualifier.forClass(ctx).printer();
            List<String> params = typedParams(printer, pm.params);
            List<JsPrinter.Line> lines;
            if (pm.kind == IrMethodKind.GETTER) {
                lines = printer.valueBody(List.of(), pm.body);
            } else if (pm.body instanceof BlockStatement || isStatementLike((Expression) pm.body, ctx)) {
                lines = printer.functionBody(pm.params, pm.body);
            } else {
                lines = printer.valueBody(pm.params, pm.body);
            }
            ctx.methods.add(new IrMethod(pm.name, pm.kind, params, pm.async, toIr(lines), pm.source));
        }
        ctx.pendingMethods.clear();
    }

    /** Parameter list with {@code any} annotations, e.g. {@code e: any}, {@code ...rest: any[]}. */
    static List<String> typedParams(JsPrinter printer, List<Expression> params) {
        List<String> out = new ArrayList<>();
        for (Expression p : params) {
            String text = printer.params(List.of(p));
            if (p instanceof RestElement) {
                out.add(text + ": any[]");
            } else if (p instanceof AssignmentPattern) {
                out.add(text);
            } else {
                out.add(text + ": any");
            }
        }
        return out;
    }

    private static boolean isStatementLike(Expression body, TranspileContext ctx) {
        Expression e = ParenthesizedExpression.unwrap(body);
        return e instanceof AssignmentExpression || e instanceof UpdateExpression
                || ExpressionShapes.setterCall(e, ctx.aliases) != null;
    }

    static List<IrLine> toIr(List<JsPrinter.Line> lines) {
        List<IrLine> out = new ArrayList<>();
        for (JsPrinter.Line l : lines) out.add(new IrLine(l.depth, l.text));
        return out;
    }

    private static void lowerEffects(TranspileContext ctx) {
        for (TranspileContext.PendingEffect pe : ctx.pendingEffects) {
            ctx.effects.add(lowerEffect(ctx, pe));
        }
        ctx.pendingEffects.clear();
    }

    private static IrEffect lowerEffect(TranspileContext ctx, TranspileContext.PendingEffect pe) {
        MemberQualifier qualifier = MemberQualifier.forClass(ctx);
        JsPrinter printer = qualifier.printer();
        Node body = pe.function instanceof ArrowFunctionExpression
                ? ((ArrowFunctionExpression) pe.function).body
                : ((FunctionExpression) pe.function).body;

        List<Statement> setup = new ArrayList<>();
        Node cleanup = null;
        if (body instanceof BlockStatement) {
            setup.addAll(((BlockStatement) body).body);
            Statement last = setup.isEmpty() ? null : setup.get(setup.size() - 1);
            if (last instanceof ReturnStatement && ((ReturnStatement) last).argument != null) {
                Expression returned = ParenthesizedExpression.unwrap(((ReturnStatement) last).argument);
                if (returned instanceof ArrowFunctionExpression || returned instanceof FunctionExpression
                        || returned instanceof Identifier || returned instanceof MemberExpression) {
                    cleanup = returned;
                    setup.remove(setup.size() - 1);
                } else {
                    ctx.warn(UNSUPPORTED_EFFECT, "effect returns a value that is not a cleanup function", last);
                }
            }
        }

        List<String> hoisted = new ArrayList<>();
        Set<String> hoistedLocals = new LinkedHashSet<>();
        if (cleanup != null) {
            Set<String> refs = ReferencedNames.of(cleanup);
            Set<String> taken = ctx.memberNames();
            for (String local : variableNames(setup)) {
                if (!refs.contains(local)) continue;
                String handle = NameUtil.unique(local, taken);
                taken.add(handle);
                hoistedLocals.add(local);
                hoisted.add(handle);
                qualifier.hoist(local, handle);
                ctx.properties.add(new IrProperty(handle, IrPropertyKind.EFFECT_HANDLE, TypeInference.ANY, null, pe.source));
            }
        }

        List<JsPrinter.Line> setupLines;
        if (body instanceof BlockStatement) {
            setupLines = setupLines(printer, setup, hoistedLocals);
        } else {
            setupLines = printer.functionBody(List.of(), body);
        }

        List<JsPrinter.Line> cleanupLines = List.of();
        if (cleanup instanceof ArrowFunctionExpression) {
            ArrowFunctionExpression a = (ArrowFunctionExpression) cleanup;
            cleanupLines = printer.functionBody(a.params, a.body);
        } else if (cleanup instanceof FunctionExpression) {
            FunctionExpression f = (FunctionExpression) cleanup;
            cleanupLines = printer.functionBody(f.params, f.body);
        } else if (cleanup != null) {
            cleanupLines = List.of(new JsPrinter.Line(0, printer.expression((Expression) cleanup) + "();"));
        }

        boolean hasArray = false;
        List<String> deps = new ArrayList<>();
        if (pe.dependencies != null) {
            Expression d = ParenthesizedExpression.unwrap(pe.dependencies);
            if (d instanceof ArrayExpression) {
                hasArray = true;
                for (Expression e : ((ArrayExpression) d).elements) {
                    if (e != null) deps.add(printer.expression(e));
                }
            } else {
                ctx.warn(UNSUPPORTED_EFFECT, "dependency list is not an array literal; the effect runs on every check", d);
            }
        }
        return new IrEffect(pe.index, hasArray, deps, toIr(setupLines), toIr(cleanupLines), hoisted, pe.source);
    }

    private static Set<String> variableNames(List<Statement> statements) {
        Set<String> out = new LinkedHashSet<>();
        for (Statement s : statements) {
            if (!(s instanceof VariableDeclaration)) continue;
            for (VariableDeclarator d : ((VariableDeclaration) s).declarations) {
                if (d.id instanceof Identifier) out.add(((Identifier) d.id).name);
            }
        }
        return out;
    }

    /** Setup statements with hoisted declarations turned into handle assignments. */
    private static List<JsPrinter.Line> setupLines(JsPrinter printer, List<Statement> setup, Set<String> hoisted) {
        Set<String> locals = new LinkedHashSet<>(JsPrinter.declaredNames(setup));
        locals.removeAll(hoisted);
        List<JsPrinter.Line> out = new ArrayList<>();
        printer.pushScope(locals);
        try {
            for (Statement s : setup) {
                if (!(s instanceof VariableDeclaration) || hoisted.isEmpty()) {
                    out.addAll(printer.statement(s));
                    continue;
                }
                VariableDeclaration vd = (VariableDeclaration) s;
                for (VariableDeclarator d : vd.declarations) {
                    String name = d.id instanceof Identifier ? ((Identifier) d.id).name : null;
                    Statement single;
                    if (name != null && hoisted.contains(name)) {
                        Expression value = d.init != null ? d.init : new Identifier(d.range, "undefined");
                        single = new ExpressionStatement(d.range,
                                new AssignmentExpression(d.range, "=", new Identifier(d.id.range, name), value));
                    } else {
                        single = new VariableDeclaration(vd.range, vd.kind, List.of(d));
                    }
                    out.addAll(printer.statement(single));
                }
            }
        } finally {
            printer.popScope();
        }
        return out;
    }
}
