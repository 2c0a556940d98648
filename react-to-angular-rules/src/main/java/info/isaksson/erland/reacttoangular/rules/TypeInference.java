package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.ArrayExpression;
import info.isaksson.erland.reacttoangular.syntax.BinaryExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.Literal;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.TemplateLiteral;
import info.isaksson.erland.reacttoangular.syntax.UnaryExpression;

import java.util.Set;

/**
 * Infers a TypeScript type from an initializer expression.
 *
 * <p>Only literal shapes are recognised; anything else is {@code any}.</p>
 */
public final class TypeInference {

    public static final String ANY = "any";

    private static final Set<String> COMPARISONS = Set.of("==", "!=", "===", "!==", "<", ">", "<=", ">=", "in", "instanceof");

    private TypeInference() {}

    public static String infer(Expression init) {
        Expression e = ParenthesizedExpression.unwrap(init);
        if (e == null) return ANY;
        if (e instanceof Literal) {
            switch (((Literal) e).kind) {
                case NUMBER: return "number";
                case STRING: return "string";
                case BOOLEAN: return "boolean";
                default: return ANY;
            }
        }
        if (e instanceof TemplateLiteral) return "string";
        if (e instanceof UnaryExpression) {
            UnaryExpression u = (UnaryExpression) e;
            if ("!".equals(u.operator)) return "boolean";
            if (("-".equals(u.operator) || "+".equals(u.operator)) && "number".equals(infer(u.argument))) return "number";
            return ANY;
        }
        if (e instanceof BinaryExpression && COMPARISONS.contains(((BinaryExpression) e).operator)) {
            return "boolean";
        }
        if (e instanceof ArrayExpression) {
            return arrayType((ArrayExpression) e);
        }
        return ANY;
    }

    private static String arrayType(ArrayExpression array) {
        if (array.elements.isEmpty()) return "any[]";
        String common = null;
        for (Expression element : array.elements) {
            String t = element == null ? ANY : infer(element);
            if (common == null) {
                common = t;
            } else if (!common.equals(t)) {
                return "any[]";
            }
        }
        if ("number".equals(common) || "string".equals(common)) return common + "[]";
        return "any[]";
    }
}
