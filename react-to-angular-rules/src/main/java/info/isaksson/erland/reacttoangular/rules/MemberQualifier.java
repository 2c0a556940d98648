package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.ArrayExpression;
import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.JsPrinter;
import info.isaksson.erland.reacttoangular.syntax.Literal;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.SpreadElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Printer hook that rewrites component-scope references into member access.
 *
 * <p>In class code the prefix is {@code this.}; in template expressions it is empty. Setter calls
 * become assignments to the aliased state, {@code props.x} becomes the input {@code x}, renamed
 * props resolve to their input, and hoisted effect locals resolve to their handle property.
 * Names shadowed by locals are never rewritten (the printer does not offer them).</p>
 */
final class MemberQualifier implements JsPrinter.Hook {

    static final String CLASS_PREFIX = "this.";
    static final String TEMPLATE_PREFIX = "";

    private final TranspileContext ctx;
    private final String prefix;
    private final Deque<Map<String, String>> substitutions = new ArrayDeque<>();
    private final Map<String, String> hoisted = new HashMap<>();

    private MemberQualifier(TranspileContext ctx, String prefix) {
        this.ctx = ctx;
        this.prefix = prefix;
    }

    static MemberQualifier forClass(TranspileContext ctx) {
        return new MemberQualifier(ctx, CLASS_PREFIX);
    }

    static MemberQualifier forTemplate(TranspileContext ctx) {
        return new MemberQualifier(ctx, TEMPLATE_PREFIX);
    }

    JsPrinter printer() {
        return new JsPrinter(ctx.program, this);
    }

    /** Replaces free occurrences of {@code name} until the matching {@link #popSubstitution()}. */
    void pushSubstitution(String name, String replacement) {
        Map<String, String> frame = new HashMap<>();
        frame.put(name, replacement);
        substitutions.push(frame);
    }

    void popSubstitution() {
        substitutions.pop();
    }

    void hoist(String local, String member) {
        hoisted.put(local, member);
    }

    String qualify(String name) {
        return prefix + name;
    }

    @Override
    public String identifier(String name) {
        for (Map<String, String> frame : substitutions) {
            String replacement = frame.get(name);
            if (replacement != null) return replacement;
        }
        String handle = hoisted.get(name);
        if (handle != null) return qualify(handle);
        String input = ctx.renames.get(name);
        if (input != null) return qualify(input);
        if (ctx.isMember(name)) return qualify(name);
        return null;
    }

    @Override
    public String member(MemberExpression m, JsPrinter printer) {
        if (m.computed || ctx.propsName == null) return null;
        if (!(m.object instanceof Identifier) || !ctx.propsName.equals(((Identifier) m.object).name)) return null;
        if (printer.isLocal(ctx.propsName) || m.propertyName() == null) return null;
        return qualify(m.propertyName());
    }

    @Override
    public String call(CallExpression call, JsPrinter printer, boolean statementPosition) {
        String setter = call.calleeName();
        if (setter == null || printer.isLocal(setter) || !ctx.aliases.isSetter(setter)) return null;
        String state = ctx.aliases.stateFor(setter);
        String target = qualify(state);

        String assignment;
        if (call.arguments.isEmpty()) {
            assignment = target + " = undefined";
        } else {
            Expression arg = ParenthesizedExpression.unwrap(call.arguments.get(0));
            if (isUpdater(arg)) {
                assignment = target + " = " + updatedValue(arg, target, printer);
            } else if (statementPosition && isAppend(arg, state, printer)) {
                List<String> tail = new ArrayList<>();
                List<Expression> elements = ((ArrayExpression) arg).elements;
                for (Expression e : elements.subList(1, elements.size())) tail.add(printer.expression(e));
                return target + ".push(" + String.join(", ", tail) + ")";
            } else {
                assignment = target + " = " + printer.expression(call.arguments.get(0));
            }
        }
        return statementPosition ? assignment : "(" + assignment + ")";
    }

    private static boolean isUpdater(Expression arg) {
        List<Expression> params;
        if (arg instanceof ArrowFunctionExpression) {
            params = ((ArrowFunctionExpression) arg).params;
        } else if (arg instanceof FunctionExpression) {
            params = ((FunctionExpression) arg).params;
        } else {
            return false;
        }
        return params.size() == 1 && params.get(0) instanceof Identifier;
    }

    private String updatedValue(Expression updater, String target, JsPrinter printer) {
        if (updater instanceof ArrowFunctionExpression && ((ArrowFunctionExpression) updater).hasExpressionBody()) {
            ArrowFunctionExpression arrow = (ArrowFunctionExpression) updater;
            pushSubstitution(((Identifier) arrow.params.get(0)).name, target);
            try {
                return printer.expression((Expression) arrow.body);
            } finally {
                popSubstitution();
            }
        }
        return "(" + printer.expression(updater) + ")(" + target + ")";
    }

    /** {@code [...state, a, b]} where every appended element is an identifier or literal. */
    private static boolean isAppend(Expression arg, String state, JsPrinter printer) {
        if (!(arg instanceof ArrayExpression)) return false;
        List<Expression> elements = ((ArrayExpression) arg).elements;
        if (elements.size() < 2 || !(elements.get(0) instanceof SpreadElement)) return false;
        Expression spread = ParenthesizedExpression.unwrap(((SpreadElement) elements.get(0)).argument);
        if (!(spread instanceof Identifier) || !state.equals(((Identifier) spread).name) || printer.isLocal(state)) {
            return false;
        }
        for (Expression e : elements.subList(1, elements.size())) {
            if (!(e instanceof Identifier) && !(e instanceof Literal)) return false;
        }
        return true;
    }
}
