package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.ExportDeclaration;
import info.isaksson.erland.reacttoangular.syntax.FunctionDeclaration;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.Program;
import info.isaksson.erland.reacttoangular.syntax.Statement;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclaration;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclarator;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the React function component in a program: the first upper-case function declaration,
 * default-exported function, or upper-case {@code const} bound to an arrow or function expression.
 * {@code memo(...)} and {@code forwardRef(...)} wrappers are looked through.
 */
public final class ComponentLocator {

    private static final Set<String> WRAPPERS = Set.of("memo", "forwardRef");

    private ComponentLocator() {}

    /** A located component. {@code name} is null for an anonymous default export. */
    public static final class Located {
        public final String name;
        public final List<Expression> params;
        /** {@code BlockStatement} or an expression body. */
        public final Node body;
        /** Top-level program statement holding the component. */
        public final Statement statement;
        public final Node node;

        Located(String name, List<Expression> params, Node body, Statement statement, Node node) {
            this.name = name;
            this.params = params;
            this.body = body;
            this.statement = statement;
            this.node = node;
        }
    }

    public static Optional<Located> find(Program program) {
        if (program == null) return Optional.empty();
        for (Statement s : program.body) {
            Located found = fromStatement(s, s, false);
            if (found != null) return Optional.of(found);
        }
        return Optional.empty();
    }

    private static Located fromStatement(Node node, Statement top, boolean defaultExport) {
        if (node instanceof FunctionDeclaration) {
            FunctionDeclaration f = (FunctionDeclaration) node;
            if (defaultExport || NameUtil.isComponentName(f.id)) {
                return new Located(f.id, f.params, f.body, top, f);
            }
            return null;
        }
        if (node instanceof VariableDeclaration) {
            for (VariableDeclarator d : ((VariableDeclaration) node).declarations) {
                String name = d.name();
                if (!NameUtil.isComponentName(name)) continue;
                Located found = fromFunction(name, d.init, top);
                if (found != null) return found;
            }
            return null;
        }
        if (node instanceof ExportDeclaration) {
            ExportDeclaration e = (ExportDeclaration) node;
            if (e.declaration instanceof Expression) {
                return e.isDefault ? fromFunction(null, (Expression) e.declaration, top) : null;
            }
            return fromStatement(e.declaration, top, e.isDefault);
        }
        return null;
    }

    private static Located fromFunction(String name, Expression init, Statement top) {
        Expression e = unwrapWrappers(init);
        if (e instanceof ArrowFunctionExpression) {
            ArrowFunctionExpression a = (ArrowFunctionExpression) e;
            return new Located(name, a.params, a.body, top, a);
        }
        if (e instanceof FunctionExpression) {
            FunctionExpression f = (FunctionExpression) e;
            return new Located(name != null ? name : f.id, f.params, f.body, top, f);
        }
        return null;
    }

    private static Expression unwrapWrappers(Expression init) {
        Expression e = ParenthesizedExpression.unwrap(init);
        while (e instanceof CallExpression && ((CallExpression) e).arguments.size() >= 1) {
            CallExpression c = (CallExpression) e;
            String callee = c.calleeName();
            if (callee == null && c.callee instanceof MemberExpression) {
                callee = ((MemberExpression) c.callee).propertyName();
            }
            if (!WRAPPERS.contains(callee)) break;
            e = ParenthesizedExpression.unwrap(c.arguments.get(0));
        }
        return e;
    }
}
