package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.BlockStatement;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.ExpressionStatement;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.ReturnStatement;
import info.isaksson.erland.reacttoangular.syntax.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural matchers over syntax trees. Matching compares node shapes and names, never source
 * text, so formatting and parentheses do not matter.
 */
public final class ExpressionShapes {

    private ExpressionShapes() {}

    /**
     * True when {@code handler} has the shape {@code (p) => setter(p.target.<property>)}.
     * A block body holding exactly that call as its only statement matches as well.
     */
    public static boolean isTwoWayHandler(Expression handler, String setter, String property) {
        if (setter == null) return false;
        Expression h = ParenthesizedExpression.unwrap(handler);
        List<Expression> params;
        Node body;
        if (h instanceof ArrowFunctionExpression) {
            params = ((ArrowFunctionExpression) h).params;
            body = ((ArrowFunctionExpression) h).body;
        } else if (h instanceof FunctionExpression) {
            params = ((FunctionExpression) h).params;
            body = ((FunctionExpression) h).body;
        } else {
            return false;
        }
        if (params.size() != 1 || !(params.get(0) instanceof Identifier)) return false;
        String param = ((Identifier) params.get(0)).name;

        Expression call = singleExpression(body);
        if (!(call instanceof CallExpression)) return false;
        CallExpression c = (CallExpression) call;
        if (c.optional || !setter.equals(c.calleeName()) || c.arguments.size() != 1) return false;

        Expression arg = ParenthesizedExpression.unwrap(c.arguments.get(0));
        if (!isPlainMember(arg, property)) return false;
        Expression target = ParenthesizedExpression.unwrap(((MemberExpression) arg).object);
        if (!isPlainMember(target, "target")) return false;
        Expression root = ParenthesizedExpression.unwrap(((MemberExpression) target).object);
        return root instanceof Identifier && param.equals(((Identifier) root).name);
    }

    /** The expression of an arrow expression body, or of a block holding one expression statement. */
    public static Expression singleExpression(Node body) {
        if (body instanceof BlockStatement) {
            List<Statement> statements = ((BlockStatement) body).body;
            if (statements.size() != 1 || !(statements.get(0) instanceof ExpressionStatement)) return null;
            return ParenthesizedExpression.unwrap(((ExpressionStatement) statements.get(0)).expression);
        }
        return body instanceof Expression ? ParenthesizedExpression.unwrap((Expression) body) : null;
    }

    /**
     * The value of a function body: the expression body itself, or the argument of a block whose
     * only statement is a return.
     */
    public static Expression returnedValue(Node body) {
        if (body instanceof BlockStatement) {
            List<Statement> statements = ((BlockStatement) body).body;
            if (statements.size() != 1 || !(statements.get(0) instanceof ReturnStatement)) return null;
            return ParenthesizedExpression.unwrap(((ReturnStatement) statements.get(0)).argument);
        }
        return body instanceof Expression ? ParenthesizedExpression.unwrap((Expression) body) : null;
    }

    /** Expressions of a block made only of expression statements, or null. */
    public static List<Expression> expressionStatements(Node body) {
        if (!(body instanceof BlockStatement)) return null;
        List<Expression> out = new ArrayList<>();
        for (Statement s : ((BlockStatement) body).body) {
            if (!(s instanceof ExpressionStatement)) return null;
            out.add(ParenthesizedExpression.unwrap(((ExpressionStatement) s).expression));
        }
        return out;
    }

    /** Setter name when {@code e} is a direct call to a known setter, otherwise null. */
    public static String setterCall(Expression e, AliasMap aliases) {
        Expression x = ParenthesizedExpression.unwrap(e);
        if (!(x instanceof CallExpression)) return null;
        String name = ((CallExpression) x).calleeName();
        return aliases.isSetter(name) ? name : null;
    }

    private static boolean isPlainMember(Expression e, String property) {
        if (!(e instanceof MemberExpression)) return false;
        MemberExpression m = (MemberExpression) e;
        return !m.computed && !m.optional && property.equals(m.propertyName());
    }
}
