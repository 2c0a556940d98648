package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.ExpressionStatement;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.Statement;

/** Recognises hook calls: {@code useXxx(...)} and {@code React.useXxx(...)}. */
final class HookCalls {

    static final String USE_STATE = "useState";
    static final String USE_EFFECT = "useEffect";
    static final String USE_LAYOUT_EFFECT = "useLayoutEffect";
    static final String USE_REF = "useRef";
    static final String USE_CALLBACK = "useCallback";
    static final String USE_MEMO = "useMemo";

    private HookCalls() {}

    static boolean isHookName(String name) {
        return name != null && name.length() > 3 && name.startsWith("use") && Character.isUpperCase(name.charAt(3));
    }

    /** Hook name when {@code e} is a hook call, otherwise null. */
    static String hookName(Expression e) {
        Expression x = ParenthesizedExpression.unwrap(e);
        if (!(x instanceof CallExpression)) return null;
        Expression callee = ((CallExpression) x).callee;
        String name = null;
        if (callee instanceof Identifier) {
            name = ((Identifier) callee).name;
        } else if (callee instanceof MemberExpression) {
            MemberExpression m = (MemberExpression) callee;
            if (m.object instanceof Identifier && "React".equals(((Identifier) m.object).name)) {
                name = m.propertyName();
            }
        }
        return isHookName(name) ? name : null;
    }

    static String hookName(Statement s) {
        return s instanceof ExpressionStatement ? hookName(((ExpressionStatement) s).expression) : null;
    }

    static boolean isEffect(String hook) {
        return USE_EFFECT.equals(hook) || USE_LAYOUT_EFFECT.equals(hook);
    }
}
