package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.ir.IrPropertyKind;
import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.AssignmentPattern;
import info.isaksson.erland.reacttoangular.syntax.BlockStatement;
import info.isaksson.erland.reacttoangular.syntax.EmptyStatement;
import info.isaksson.erland.reacttoangular.syntax.ExportDeclaration;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.ExpressionStatement;
import info.isaksson.erland.reacttoangular.syntax.FunctionDeclaration;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.ImportDeclaration;
import info.isaksson.erland.reacttoangular.syntax.Literal;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ObjectPattern;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.Property;
import info.isaksson.erland.reacttoangular.syntax.RestElement;
import info.isaksson.erland.reacttoangular.syntax.ReturnStatement;
import info.isaksson.erland.reacttoangular.syntax.Statement;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclaration;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclarator;

import java.util.List;

import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_PATTERN;
import static info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning.UNSUPPORTED_STATEMENT;

/**
 * First pass: locates the component, records its name and inputs, registers local functions and
 * derived constants, and collects stylesheet imports. Statements no later pass understands are
 * passed through with a warning.
 */
final class StructurePass {

    private StructurePass() {}

    static void apply(TranspileContext ctx) {
        ComponentLocator.Located located = ComponentLocator.find(ctx.program)
                .orElseThrow(() -> new IllegalStateException("No React function component found"));

        String override = NameUtil.pascal(ctx.nameOverride);
        if (!override.isEmpty()) {
            ctx.name = override;
        } else {
            ctx.name = located.name != null ? located.name : ctx.fallbackName;
        }
        ctx.params = located.params;
        ctx.componentNode = located.node;
        if (located.body instanceof BlockStatement) {
            ctx.body = ((BlockStatement) located.body).body;
        } else {
            ctx.expressionBody = (Expression) located.body;
        }

        moduleStatements(ctx, located);
        parameterInputs(ctx);
        propsMemberInputs(ctx);
        bodyStatements(ctx);
    }

    // ------------------------------------------------------------------
    // Module level
    // ------------------------------------------------------------------

    private static void moduleStatements(TranspileContext ctx, ComponentLocator.Located located) {
        for (Statement s : ctx.program.body) {
            if (s == located.statement || s instanceof EmptyStatement) continue;
            if (s instanceof ImportDeclaration) {
                ImportDeclaration imp = (ImportDeclaration) s;
                if (imp.isSideEffectOnly() && imp.source.endsWith(".css")) {
                    ctx.styleImports.add(imp.source);
                } else if (!isReactModule(imp.source)) {
                    ctx.passthrough("import", s);
                    ctx.warn(UNSUPPORTED_STATEMENT, "import from '" + imp.source + "' is not converted", s);
                }
                continue;
            }
            if (isDefaultExportOf(s, located.name)) continue;
            ctx.passthrough("module-level statement", s);
            ctx.warn(UNSUPPORTED_STATEMENT, "module-level statement is not converted", s);
        }
    }

    private static boolean isReactModule(String source) {
        return "react".equals(source) || source.startsWith("react/") || source.startsWith("react-dom");
    }

    private static boolean isDefaultExportOf(Statement s, String name) {
        if (!(s instanceof ExportDeclaration) || name == null) return false;
        ExportDeclaration e = (ExportDeclaration) s;
        return e.isDefault && e.declaration instanceof Identifier && name.equals(((Identifier) e.declaration).name);
    }

    // ------------------------------------------------------------------
    // Inputs
    // ------------------------------------------------------------------

    private static void parameterInputs(TranspileContext ctx) {
        if (ctx.params.isEmpty()) return;
        Expression first = ctx.params.get(0);
        if (first instanceof AssignmentPattern) first = ((AssignmentPattern) first).left;
        if (first instanceof Identifier) {
            ctx.propsName = ((Identifier) first).name;
        } else if (first instanceof ObjectPattern) {
            destructuredInputs(ctx, (ObjectPattern) first);
        } else {
            ctx.warn(UNSUPPORTED_PATTERN, "component parameter pattern is not converted", first);
        }
        for (Expression extra : ctx.params.subList(1, ctx.params.size())) {
            ctx.warn(UNSUPPORTED_PATTERN, "component parameter '" + ctx.program.textOf(extra) + "' is ignored", extra);
        }
    }

    private static void destructuredInputs(TranspileContext ctx, ObjectPattern pattern) {
        for (Node n : pattern.properties) {
            if (n instanceof RestElement) {
                ctx.warn(UNSUPPORTED_PATTERN, "rest props are not converted", n);
                continue;
            }
            if (!(n instanceof Property)) continue;
            Property p = (Property) n;
            String key = propertyName(p);
            if (key == null) {
                ctx.warn(UNSUPPORTED_PATTERN, "computed prop name is not converted", p);
                continue;
            }
            Expression value = p.value;
            Expression defaultValue = null;
            if (value instanceof AssignmentPattern) {
                defaultValue = ((AssignmentPattern) value).right;
                value = ((AssignmentPattern) value).left;
            }
            if (value instanceof Identifier) {
                String local = ((Identifier) value).name;
                if (!local.equals(key)) ctx.renames.put(local, key);
            } else {
                ctx.warn(UNSUPPORTED_PATTERN, "nested destructuring of prop '" + key + "' is not converted", p);
            }
            addInput(ctx, key, defaultValue, p);
        }
    }

    private static String propertyName(Property p) {
        if (p.computed) return null;
        if (p.key instanceof Identifier) return ((Identifier) p.key).name;
        if (p.key instanceof Literal) return ((Literal) p.key).stringValue();
        return null;
    }

    private static void addInput(TranspileContext ctx, String name, Expression defaultValue, Node at) {
        if (ctx.inputs.containsKey(name)) return;
        String type = defaultValue == null ? TypeInference.ANY : TypeInference.infer(defaultValue);
        String init = defaultValue == null ? null : ctx.program.textOf(defaultValue);
        ctx.inputs.put(name, new IrProperty(name, IrPropertyKind.INPUT, type, init, TranspileContext.sourceRef(at)));
    }

    /** {@code props.x} reads anywhere in the component. */
    private static void propsMemberInputs(TranspileContext ctx) {
        if (ctx.propsName == null) return;
        SyntaxWalk.preorder(ctx.componentNode, n -> {
            if (!(n instanceof MemberExpression)) return;
            String prop = propsMember(ctx, (Expression) n);
            if (prop != null) addInput(ctx, prop, null, n);
        });
    }

    /** Input name read by a plain {@code props.x}, otherwise null. */
    private static String propsMember(TranspileContext ctx, Expression e) {
        if (ctx.propsName == null || !(e instanceof MemberExpression)) return null;
        MemberExpression m = (MemberExpression) e;
        if (m.computed || !(m.object instanceof Identifier)) return null;
        return ctx.propsName.equals(((Identifier) m.object).name) ? m.propertyName() : null;
    }

    // ------------------------------------------------------------------
    // Component body
    // ------------------------------------------------------------------

    private static void bodyStatements(TranspileContext ctx) {
        for (Statement s : ctx.body) {
            if (s instanceof EmptyStatement || s instanceof ReturnStatement || TemplatePass.isEarlyReturn(s)) continue;
            if (s instanceof VariableDeclaration) {
                VariableDeclaration vd = (VariableDeclaration) s;
                for (VariableDeclarator d : vd.declarations) declarator(ctx, vd, d);
            } else if (s instanceof FunctionDeclaration && ((FunctionDeclaration) s).id != null) {
                FunctionDeclaration f = (FunctionDeclaration) s;
                ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                        ctx.claimMember(f.id), IrMethodKind.DECLARED, f.params, f.body, f.async, TranspileContext.sourceRef(f)));
            } else if (s instanceof ExpressionStatement && HookCalls.hookName(s) != null) {
                continue;
            } else {
                ctx.passthrough("statement", s);
                ctx.warn(UNSUPPORTED_STATEMENT, "statement in component body is not converted", s);
            }
        }
    }

    private static void declarator(TranspileContext ctx, VariableDeclaration vd, VariableDeclarator d) {
        if (HookCalls.hookName(d.init) != null) return;
        Expression init = ParenthesizedExpression.unwrap(d.init);

        if (d.id instanceof ObjectPattern && init instanceof Identifier
                && ((Identifier) init).name.equals(ctx.propsName)) {
            destructuredInputs(ctx, (ObjectPattern) d.id);
            return;
        }
        String local = d.name();
        String text = vd.kind + " " + ctx.program.textOf(d) + ";";
        if (local == null) {
            ctx.passthrough("destructuring declaration", text, d);
            ctx.warn(UNSUPPORTED_PATTERN, "destructuring declaration is not converted", d);
            return;
        }
        String prop = "const".equals(vd.kind) ? propsMember(ctx, init) : null;
        if (prop != null) {
            addInput(ctx, prop, null, init);
            if (!local.equals(prop)) ctx.renames.put(local, prop);
            return;
        }
        String name = ctx.claimMember(local);
        if (init instanceof ArrowFunctionExpression) {
            ArrowFunctionExpression a = (ArrowFunctionExpression) init;
            ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                    name, IrMethodKind.DECLARED, a.params, a.body, a.async, TranspileContext.sourceRef(d)));
            return;
        }
        if (init instanceof FunctionExpression) {
            FunctionExpression f = (FunctionExpression) init;
            ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                    name, IrMethodKind.DECLARED, f.params, f.body, f.async, TranspileContext.sourceRef(d)));
            return;
        }
        if (!"const".equals(vd.kind) || init == null) {
            ctx.passthrough("mutable local", text, d);
            ctx.warn(UNSUPPORTED_STATEMENT, "mutable local '" + name + "' is not converted", d);
            return;
        }
        if (SyntaxWalk.containsJsx(init)) {
            ctx.passthrough("JSX value", text, d);
            ctx.warn(UNSUPPORTED_PATTERN, "JSX stored in '" + name + "' is not converted", d);
            return;
        }
        ctx.pendingMethods.add(new TranspileContext.PendingMethod(
                name, IrMethodKind.GETTER, List.of(), init, false, TranspileContext.sourceRef(d)));
    }
}
