package info.isaksson.erland.reacttoangular.parse;

import com.caoccao.javet.swc4j.ast.clazz.Swc4jAstComputedPropName;
import com.caoccao.javet.swc4j.ast.clazz.Swc4jAstFunction;
import com.caoccao.javet.swc4j.ast.clazz.Swc4jAstKeyValueProp;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstArrayLit;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstArrowExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstAssignExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstAwaitExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstBinExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstCallExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstCondExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstFnExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstIdent;
import com.caoccao.javet.swc4j.ast.miscs.Swc4jAstJsxAttr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstJsxElement;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstJsxEmptyExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstJsxExprContainer;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstJsxFragment;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstMemberExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstNewExpr;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstObjectLit;
import com.caoccao.javet.swc4j.ast.miscs.Swc4jAstOptCall;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstOptChainExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstParenExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstSeqExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstSpreadElement;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstThisExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstTpl;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstUnaryExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstUpdateExpr;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstBigInt;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstBool;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstJsxText;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstNull;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstNumber;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstRegex;
import com.caoccao.javet.swc4j.ast.expr.lit.Swc4jAstStr;
import com.caoccao.javet.swc4j.ast.interfaces.ISwc4jAst;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstExportDecl;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstExportDefaultDecl;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstExportDefaultExpr;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstImportDecl;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstImportDefaultSpecifier;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstImportNamedSpecifier;
import com.caoccao.javet.swc4j.ast.module.Swc4jAstImportStarAsSpecifier;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstArrayPat;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstAssignPat;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstAssignPatProp;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstBindingIdent;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstKeyValuePatProp;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstObjectPat;
import com.caoccao.javet.swc4j.ast.pat.Swc4jAstRestPat;
import com.caoccao.javet.swc4j.ast.program.Swc4jAstModule;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstBlockStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstBreakStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstContinueStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstDoWhileStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstEmptyStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstExprStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstFnDecl;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstForInStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstForOfStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstForStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstIfStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstReturnStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstSwitchStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstThrowStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstTryStmt;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstVarDecl;
import com.caoccao.javet.swc4j.ast.stmt.Swc4jAstWhileStmt;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstTsAsExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstTsConstAssertion;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstTsNonNullExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstTsSatisfiesExpr;
import com.caoccao.javet.swc4j.ast.expr.Swc4jAstTsTypeAssertion;
import info.isaksson.erland.reacttoangular.syntax.ArrayExpression;
import info.isaksson.erland.reacttoangular.syntax.ArrayPattern;
import info.isaksson.erland.reacttoangular.syntax.ArrowFunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.AssignmentExpression;
import info.isaksson.erland.reacttoangular.syntax.AssignmentPattern;
import info.isaksson.erland.reacttoangular.syntax.AwaitExpression;
import info.isaksson.erland.reacttoangular.syntax.BinaryExpression;
import info.isaksson.erland.reacttoangular.syntax.BlockStatement;
import info.isaksson.erland.reacttoangular.syntax.CallExpression;
import info.isaksson.erland.reacttoangular.syntax.ConditionalExpression;
import info.isaksson.erland.reacttoangular.syntax.EmptyStatement;
import info.isaksson.erland.reacttoangular.syntax.ExportDeclaration;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.ExpressionStatement;
import info.isaksson.erland.reacttoangular.syntax.ForInOfStatement;
import info.isaksson.erland.reacttoangular.syntax.ForStatement;
import info.isaksson.erland.reacttoangular.syntax.FunctionDeclaration;
import info.isaksson.erland.reacttoangular.syntax.FunctionExpression;
import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.IfStatement;
import info.isaksson.erland.reacttoangular.syntax.ImportDeclaration;
import info.isaksson.erland.reacttoangular.syntax.JsxAttribute;
import info.isaksson.erland.reacttoangular.syntax.JsxElement;
import info.isaksson.erland.reacttoangular.syntax.JsxExpressionContainer;
import info.isaksson.erland.reacttoangular.syntax.JsxFragment;
import info.isaksson.erland.reacttoangular.syntax.JsxSpreadAttribute;
import info.isaksson.erland.reacttoangular.syntax.JsxText;
import info.isaksson.erland.reacttoangular.syntax.JumpStatement;
import info.isaksson.erland.reacttoangular.syntax.Literal;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.NewExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.ObjectExpression;
import info.isaksson.erland.reacttoangular.syntax.ObjectPattern;
import info.isaksson.erland.reacttoangular.syntax.OpaqueExpression;
import info.isaksson.erland.reacttoangular.syntax.OpaqueStatement;
import info.isaksson.erland.reacttoangular.syntax.ParenthesizedExpression;
import info.isaksson.erland.reacttoangular.syntax.Program;
import info.isaksson.erland.reacttoangular.syntax.Property;
import info.isaksson.erland.reacttoangular.syntax.RestElement;
import info.isaksson.erland.reacttoangular.syntax.ReturnStatement;
import info.isaksson.erland.reacttoangular.syntax.SequenceExpression;
import info.isaksson.erland.reacttoangular.syntax.SourceRange;
import info.isaksson.erland.reacttoangular.syntax.SpreadElement;
import info.isaksson.erland.reacttoangular.syntax.Statement;
import info.isaksson.erland.reacttoangular.syntax.SwitchCase;
import info.isaksson.erland.reacttoangular.syntax.SwitchStatement;
import info.isaksson.erland.reacttoangular.syntax.TemplateLiteral;
import info.isaksson.erland.reacttoangular.syntax.ThrowStatement;
import info.isaksson.erland.reacttoangular.syntax.TryStatement;
import info.isaksson.erland.reacttoangular.syntax.UnaryExpression;
import info.isaksson.erland.reacttoangular.syntax.UpdateExpression;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclaration;
import info.isaksson.erland.reacttoangular.syntax.VariableDeclarator;
import info.isaksson.erland.reacttoangular.syntax.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps the swc4j module tree onto the ESTree-shaped {@code syntax} model the rule engine reads.
 *
 * <p>TypeScript-only syntax (annotations, type arguments, {@code as}, {@code satisfies}, non-null
 * assertions) is dropped from the model; the verbatim text stays reachable through
 * {@link Program#textOf}. Constructs the model has no node for become {@link OpaqueStatement} or
 * {@link OpaqueExpression}. Operators are read back from the source between the operand spans,
 * which keeps the mapping independent of swc4j's operator enums.</p>
 */
final class SwcTreeMapper {

    private final String source;
    private final int[] lineStarts;

    SwcTreeMapper(String source) {
        this.source = source;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') starts.add(i + 1);
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    Program program(Swc4jAstModule module) {
        List<Statement> body = new ArrayList<>();
        for (ISwc4jAst item : module.getBody()) {
            body.add(statement(item));
        }
        return new Program(range(0, source.length()), body, source);
    }

    // ------------------------------------------------------------------
    // Source positions
    // ------------------------------------------------------------------

    private int start(ISwc4jAst node) {
        return clamp(node.getSpan().getStart());
    }

    private int end(ISwc4jAst node) {
        return clamp(node.getSpan().getEnd());
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(source.length(), offset));
    }

    private SourceRange range(ISwc4jAst node) {
        return range(start(node), end(node));
    }

    private SourceRange range(int start, int end) {
        int line = lineOf(start);
        return new SourceRange(start, Math.max(start, end), line, start - lineStarts[line - 1] + 1);
    }

    private int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) lo = mid; else hi = mid - 1;
        }
        return lo + 1;
    }

    private String text(ISwc4jAst node) {
        return text(start(node), end(node));
    }

    private String text(int start, int end) {
        return start >= end ? "" : source.substring(start, end);
    }

    /** The punctuation or keyword written between two operands, e.g. {@code +=} or {@code instanceof}. */
    private String between(ISwc4jAst left, ISwc4jAst right) {
        return text(end(left), start(right)).strip();
    }

    private boolean followedBy(int offset, String token) {
        int i = offset;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;
        return source.startsWith(token, i);
    }

    /** Offset of a {@code ...} written directly before {@code offset}, or -1. */
    private int spreadStart(int offset) {
        int i = offset - 1;
        while (i >= 0 && Character.isWhitespace(source.charAt(i))) i--;
        return i >= 2 && source.startsWith("...", i - 2) ? i - 2 : -1;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private List<Statement> statements(List<? extends ISwc4jAst> nodes) {
        List<Statement> out = new ArrayList<>();
        for (ISwc4jAst n : nodes) out.add(statement(n));
        return out;
    }

    private Statement statement(ISwc4jAst node) {
        if (node instanceof Swc4jAstImportDecl) return importDeclaration((Swc4jAstImportDecl) node);
        if (node instanceof Swc4jAstExportDecl) {
            return new ExportDeclaration(range(node), false, statement(((Swc4jAstExportDecl) node).getDecl()));
        }
        if (node instanceof Swc4jAstExportDefaultDecl) {
            ISwc4jAst decl = ((Swc4jAstExportDefaultDecl) node).getDecl();
            Node inner = decl instanceof Swc4jAstFnExpr
                    ? functionDeclaration(decl, ((Swc4jAstFnExpr) decl).getIdent().map(Swc4jAstIdent::getSym).orElse(null),
                            ((Swc4jAstFnExpr) decl).getFunction())
                    : opaqueStatement(decl);
            return new ExportDeclaration(range(node), true, inner);
        }
        if (node instanceof Swc4jAstExportDefaultExpr) {
            return new ExportDeclaration(range(node), true, expression(((Swc4jAstExportDefaultExpr) node).getExpr()));
        }
        if (node instanceof Swc4jAstFnDecl) {
            Swc4jAstFnDecl fn = (Swc4jAstFnDecl) node;
            return functionDeclaration(fn, fn.getIdent().getSym(), fn.getFunction());
        }
        if (node instanceof Swc4jAstVarDecl) return variableDeclaration((Swc4jAstVarDecl) node);
        if (node instanceof Swc4jAstBlockStmt) return block((Swc4jAstBlockStmt) node);
        if (node instanceof Swc4jAstEmptyStmt) return new EmptyStatement(range(node));
        if (node instanceof Swc4jAstExprStmt) {
            return new ExpressionStatement(range(node), expression(((Swc4jAstExprStmt) node).getExpr()));
        }
        if (node instanceof Swc4jAstReturnStmt) {
            return new ReturnStatement(range(node), ((Swc4jAstReturnStmt) node).getArg().map(this::expression).orElse(null));
        }
        if (node instanceof Swc4jAstIfStmt) {
            Swc4jAstIfStmt s = (Swc4jAstIfStmt) node;
            return new IfStatement(range(node), expression(s.getTest()), statement(s.getCons()),
                    s.getAlt().map(this::statement).orElse(null));
        }
        if (node instanceof Swc4jAstForStmt) {
            Swc4jAstForStmt s = (Swc4jAstForStmt) node;
            Node init = s.getInit().map(this::forHead).orElse(null);
            return new ForStatement(range(node), init, s.getTest().map(this::expression).orElse(null),
                    s.getUpdate().map(this::expression).orElse(null), statement(s.getBody()));
        }
        if (node instanceof Swc4jAstForOfStmt) {
            Swc4jAstForOfStmt s = (Swc4jAstForOfStmt) node;
            return new ForInOfStatement(range(node), forHead(s.getLeft()), expression(s.getRight()),
                    statement(s.getBody()), true);
        }
        if (node instanceof Swc4jAstForInStmt) {
            Swc4jAstForInStmt s = (Swc4jAstForInStmt) node;
            return new ForInOfStatement(range(node), forHead(s.getLeft()), expression(s.getRight()),
                    statement(s.getBody()), false);
        }
        if (node instanceof Swc4jAstWhileStmt) {
            Swc4jAstWhileStmt s = (Swc4jAstWhileStmt) node;
            return new WhileStatement(range(node), expression(s.getTest()), statement(s.getBody()), false);
        }
        if (node instanceof Swc4jAstDoWhileStmt) {
            Swc4jAstDoWhileStmt s = (Swc4jAstDoWhileStmt) node;
            return new WhileStatement(range(node), expression(s.getTest()), statement(s.getBody()), true);
        }
        if (node instanceof Swc4jAstTryStmt) return tryStatement((Swc4jAstTryStmt) node);
        if (node instanceof Swc4jAstThrowStmt) {
            return new ThrowStatement(range(node), expression(((Swc4jAstThrowStmt) node).getArg()));
        }
        if (node instanceof Swc4jAstBreakStmt) {
            return new JumpStatement(range(node), "break",
                    ((Swc4jAstBreakStmt) node).getLabel().map(Swc4jAstIdent::getSym).orElse(null));
        }
        if (node instanceof Swc4jAstContinueStmt) {
            return new JumpStatement(range(node), "continue",
                    ((Swc4jAstContinueStmt) node).getLabel().map(Swc4jAstIdent::getSym).orElse(null));
        }
        if (node instanceof Swc4jAstSwitchStmt) {
            Swc4jAstSwitchStmt s = (Swc4jAstSwitchStmt) node;
            List<SwitchCase> cases = new ArrayList<>();
            s.getCases().forEach(c -> cases.add(new SwitchCase(range(c),
                    c.getTest().map(this::expression).orElse(null), statements(c.getCons()))));
            return new SwitchStatement(range(node), expression(s.getDiscriminant()), cases);
        }
        return opaqueStatement(node);
    }

    /** Class declarations, TypeScript declarations, labels and the like: kept verbatim. */
    private OpaqueStatement opaqueStatement(ISwc4jAst node) {
        String text = text(node).strip();
        int space = 0;
        while (space < text.length() && Character.isJavaIdentifierPart(text.charAt(space))) space++;
        return new OpaqueStatement(range(node), space == 0 ? "statement" : text.substring(0, space));
    }

    private ImportDeclaration importDeclaration(Swc4jAstImportDecl decl) {
        List<String> locals = new ArrayList<>();
        for (ISwc4jAst specifier : decl.getSpecifiers()) {
            if (specifier instanceof Swc4jAstImportDefaultSpecifier) {
                locals.add(((Swc4jAstImportDefaultSpecifier) specifier).getLocal().getSym());
            } else if (specifier instanceof Swc4jAstImportNamedSpecifier) {
                locals.add(((Swc4jAstImportNamedSpecifier) specifier).getLocal().getSym());
            } else if (specifier instanceof Swc4jAstImportStarAsSpecifier) {
                locals.add(((Swc4jAstImportStarAsSpecifier) specifier).getLocal().getSym());
            }
        }
        return new ImportDeclaration(range(decl), decl.getSrc().getValue(), locals);
    }

    private FunctionDeclaration functionDeclaration(ISwc4jAst at, String id, Swc4jAstFunction fn) {
        return new FunctionDeclaration(range(at), id, params(fn), functionBody(fn), fn.isAsync());
    }

    private List<Expression> params(Swc4jAstFunction fn) {
        List<Expression> params = new ArrayList<>();
        fn.getParams().forEach(p -> params.add(pattern(p.getPat())));
        return params;
    }

    /** Overload signatures and {@code declare function} have no body; they map to an empty block. */
    private BlockStatement functionBody(Swc4jAstFunction fn) {
        return fn.getBody().map(this::block).orElseGet(() -> new BlockStatement(range(end(fn), end(fn)), List.of()));
    }

    private BlockStatement block(Swc4jAstBlockStmt block) {
        return new BlockStatement(range(block), statements(block.getStmts()));
    }

    /** Statement-level declarations end before their semicolon, like the declarators they hold. */
    private VariableDeclaration variableDeclaration(Swc4jAstVarDecl decl) {
        List<VariableDeclarator> declarators = new ArrayList<>();
        decl.getDecls().forEach(d -> declarators.add(new VariableDeclarator(range(d),
                pattern(d.getName()), d.getInit().map(this::expression).orElse(null))));
        int end = end(decl);
        if (end > start(decl) && source.charAt(end - 1) == ';') end--;
        String kind = decl.getKind().name().toLowerCase(Locale.ROOT);
        return new VariableDeclaration(range(start(decl), end), kind, declarators);
    }

    private Node forHead(ISwc4jAst head) {
        if (head instanceof Swc4jAstVarDecl) return variableDeclaration((Swc4jAstVarDecl) head);
        return pattern(head);
    }

    private TryStatement tryStatement(Swc4jAstTryStmt s) {
        Expression param = s.getHandler().flatMap(h -> h.getParam()).map(this::pattern).orElse(null);
        BlockStatement handler = s.getHandler().map(h -> block(h.getBody())).orElse(null);
        BlockStatement finalizer = s.getFinalizer().map(this::block).orElse(null);
        return new TryStatement(range(s), block(s.getBlock()), param, handler, finalizer);
    }

    // ------------------------------------------------------------------
    // Bindings
    // ------------------------------------------------------------------

    private Expression pattern(ISwc4jAst node) {
        if (node instanceof Swc4jAstBindingIdent) {
            Swc4jAstIdent id = ((Swc4jAstBindingIdent) node).getId();
            return new Identifier(range(id), id.getSym());
        }
        if (node instanceof Swc4jAstArrayPat) {
            List<Expression> elements = new ArrayList<>();
            ((Swc4jAstArrayPat) node).getElems().forEach(e -> elements.add(e.map(this::pattern).orElse(null)));
            return new ArrayPattern(range(node), elements);
        }
        if (node instanceof Swc4jAstObjectPat) {
            List<Node> properties = new ArrayList<>();
            for (ISwc4jAst p : ((Swc4jAstObjectPat) node).getProps()) {
                properties.add(patternProperty(p));
            }
            return new ObjectPattern(range(node), properties);
        }
        if (node instanceof Swc4jAstAssignPat) {
            Swc4jAstAssignPat a = (Swc4jAstAssignPat) node;
            return new AssignmentPattern(range(node), pattern(a.getLeft()), expression(a.getRight()));
        }
        if (node instanceof Swc4jAstRestPat) {
            return new RestElement(range(node), pattern(((Swc4jAstRestPat) node).getArg()));
        }
        return expression(node);
    }

    private Node patternProperty(ISwc4jAst node) {
        if (node instanceof Swc4jAstKeyValuePatProp) {
            Swc4jAstKeyValuePatProp p = (Swc4jAstKeyValuePatProp) node;
            return new Property(range(node), propertyKey(p.getKey()), pattern(p.getValue()),
                    p.getKey() instanceof Swc4jAstComputedPropName, false, false, "init");
        }
        if (node instanceof Swc4jAstAssignPatProp) {
            Swc4jAstAssignPatProp p = (Swc4jAstAssignPatProp) node;
            Expression key = pattern(p.getKey());
            Expression value = p.getValue()
                    .<Expression>map(def -> new AssignmentPattern(range(node), key, expression(def)))
                    .orElse(key);
            return new Property(range(node), key, value, false, true, false, "init");
        }
        return pattern(node);
    }

    private Expression propertyKey(ISwc4jAst key) {
        if (key instanceof Swc4jAstComputedPropName) return expression(((Swc4jAstComputedPropName) key).getExpr());
        if (key instanceof Swc4jAstStr || key instanceof Swc4jAstNumber || key instanceof Swc4jAstBigInt) {
            return expression(key);
        }
        return new Identifier(range(key), text(key));
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    Expression expression(ISwc4jAst node) {
        if (node instanceof Swc4jAstIdent) return new Identifier(range(node), ((Swc4jAstIdent) node).getSym());
        if (node instanceof Swc4jAstThisExpr) return new Identifier(range(node), "this");
        if (node instanceof Swc4jAstStr) {
            return new Literal(range(node), Literal.Kind.STRING, text(node), ((Swc4jAstStr) node).getValue());
        }
        if (node instanceof Swc4jAstNumber || node instanceof Swc4jAstBigInt) {
            return new Literal(range(node), Literal.Kind.NUMBER, text(node));
        }
        if (node instanceof Swc4jAstBool) return new Literal(range(node), Literal.Kind.BOOLEAN, text(node));
        if (node instanceof Swc4jAstNull) return new Literal(range(node), Literal.Kind.NULL, text(node));
        if (node instanceof Swc4jAstRegex) return new Literal(range(node), Literal.Kind.REGEX, text(node));
        if (node instanceof Swc4jAstTpl) return template((Swc4jAstTpl) node);
        if (node instanceof Swc4jAstParenExpr) {
            return new ParenthesizedExpression(range(node), expression(((Swc4jAstParenExpr) node).getExpr()));
        }
        if (node instanceof Swc4jAstArrayLit) {
            List<Expression> elements = new ArrayList<>();
            ((Swc4jAstArrayLit) node).getElems().forEach(e -> elements.add(e.map(a -> argument(a.getExpr())).orElse(null)));
            return new ArrayExpression(range(node), elements);
        }
        if (node instanceof Swc4jAstObjectLit) return object((Swc4jAstObjectLit) node);
        if (node instanceof Swc4jAstSpreadElement) {
            return new SpreadElement(range(node), expression(((Swc4jAstSpreadElement) node).getExpr()));
        }
        if (node instanceof Swc4jAstArrowExpr) return arrow((Swc4jAstArrowExpr) node);
        if (node instanceof Swc4jAstFnExpr) {
            Swc4jAstFnExpr f = (Swc4jAstFnExpr) node;
            Swc4jAstFunction fn = f.getFunction();
            return new FunctionExpression(range(node), f.getIdent().map(Swc4jAstIdent::getSym).orElse(null),
                    params(fn), functionBody(fn), fn.isAsync());
        }
        if (node instanceof Swc4jAstCallExpr) {
            Swc4jAstCallExpr c = (Swc4jAstCallExpr) node;
            List<Expression> args = new ArrayList<>();
            c.getArgs().forEach(a -> args.add(argument(a.getExpr())));
            return new CallExpression(range(node), expression(c.getCallee()), args, false);
        }
        if (node instanceof Swc4jAstOptChainExpr) return optionalChain((Swc4jAstOptChainExpr) node);
        if (node instanceof Swc4jAstNewExpr) {
            Swc4jAstNewExpr n = (Swc4jAstNewExpr) node;
            List<Expression> args = new ArrayList<>();
            n.getArgs().ifPresent(list -> list.forEach(a -> args.add(argument(a.getExpr()))));
            return new NewExpression(range(node), expression(n.getCallee()), args);
        }
        if (node instanceof Swc4jAstMemberExpr) return member((Swc4jAstMemberExpr) node);
        if (node instanceof Swc4jAstBinExpr) {
            Swc4jAstBinExpr b = (Swc4jAstBinExpr) node;
            return new BinaryExpression(range(node), between(b.getLeft(), b.getRight()),
                    expression(b.getLeft()), expression(b.getRight()));
        }
        if (node instanceof Swc4jAstUnaryExpr) {
            Swc4jAstUnaryExpr u = (Swc4jAstUnaryExpr) node;
            return new UnaryExpression(range(node), text(start(u), start(u.getArg())).strip(), expression(u.getArg()));
        }
        if (node instanceof Swc4jAstUpdateExpr) {
            Swc4jAstUpdateExpr u = (Swc4jAstUpdateExpr) node;
            boolean prefix = start(u) < start(u.getArg());
            String operator = prefix ? text(start(u), start(u.getArg())) : text(end(u.getArg()), end(u));
            return new UpdateExpression(range(node), operator.strip(), prefix, expression(u.getArg()));
        }
        if (node instanceof Swc4jAstAssignExpr) {
            Swc4jAstAssignExpr a = (Swc4jAstAssignExpr) node;
            return new AssignmentExpression(range(node), between(a.getLeft(), a.getRight()),
                    pattern(a.getLeft()), expression(a.getRight()));
        }
        if (node instanceof Swc4jAstCondExpr) {
            Swc4jAstCondExpr c = (Swc4jAstCondExpr) node;
            return new ConditionalExpression(range(node), expression(c.getTest()), expression(c.getCons()),
                    expression(c.getAlt()));
        }
        if (node instanceof Swc4jAstSeqExpr) {
            List<Expression> items = new ArrayList<>();
            for (ISwc4jAst e : ((Swc4jAstSeqExpr) node).getExprs()) items.add(expression(e));
            return new SequenceExpression(range(node), items);
        }
        if (node instanceof Swc4jAstAwaitExpr) {
            return new AwaitExpression(range(node), expression(((Swc4jAstAwaitExpr) node).getArg()));
        }
        if (node instanceof Swc4jAstTsAsExpr) return expression(((Swc4jAstTsAsExpr) node).getExpr());
        if (node instanceof Swc4jAstTsSatisfiesExpr) return expression(((Swc4jAstTsSatisfiesExpr) node).getExpr());
        if (node instanceof Swc4jAstTsNonNullExpr) return expression(((Swc4jAstTsNonNullExpr) node).getExpr());
        if (node instanceof Swc4jAstTsTypeAssertion) return expression(((Swc4jAstTsTypeAssertion) node).getExpr());
        if (node instanceof Swc4jAstTsConstAssertion) return expression(((Swc4jAstTsConstAssertion) node).getExpr());
        if (node instanceof Swc4jAstJsxElement) return jsxElement((Swc4jAstJsxElement) node);
        if (node instanceof Swc4jAstJsxFragment) {
            return new JsxFragment(range(node), jsxChildren(((Swc4jAstJsxFragment) node).getChildren()));
        }
        if (node instanceof Swc4jAstBindingIdent || node instanceof Swc4jAstObjectPat
                || node instanceof Swc4jAstArrayPat) {
            return pattern(node);
        }
        return new OpaqueExpression(range(node));
    }

    /** Call argument or array element; a leading {@code ...} makes it a spread. */
    private Expression argument(ISwc4jAst expr) {
        Expression value = expression(expr);
        int dots = spreadStart(start(expr));
        return dots < 0 ? value : new SpreadElement(range(dots, end(expr)), value);
    }

    private Expression arrow(Swc4jAstArrowExpr a) {
        List<Expression> params = new ArrayList<>();
        for (ISwc4jAst p : a.getParams()) params.add(pattern(p));
        ISwc4jAst body = a.getBody();
        Node mapped = body instanceof Swc4jAstBlockStmt ? block((Swc4jAstBlockStmt) body) : expression(body);
        return new ArrowFunctionExpression(range(a), params, mapped, a.isAsync());
    }

    private Expression member(Swc4jAstMemberExpr m) {
        Expression object = expression(m.getObj());
        ISwc4jAst prop = m.getProp();
        boolean optional = followedBy(end(m.getObj()), "?.");
        if (prop instanceof Swc4jAstComputedPropName) {
            Expression key = expression(((Swc4jAstComputedPropName) prop).getExpr());
            return new MemberExpression(range(m), object, key, true, optional);
        }
        return new MemberExpression(range(m), object, new Identifier(range(prop), text(prop)), false, optional);
    }

    private Expression optionalChain(Swc4jAstOptChainExpr chain) {
        ISwc4jAst base = chain.getBase();
        if (base instanceof Swc4jAstOptCall) {
            Swc4jAstOptCall call = (Swc4jAstOptCall) base;
            List<Expression> args = new ArrayList<>();
            call.getArgs().forEach(a -> args.add(argument(a.getExpr())));
            boolean optional = followedBy(end(call.getCallee()), "?.");
            return new CallExpression(range(chain), expression(call.getCallee()), args, optional);
        }
        return expression(base);
    }

    private ObjectExpression object(Swc4jAstObjectLit o) {
        List<Node> properties = new ArrayList<>();
        for (ISwc4jAst p : o.getProps()) {
            if (p instanceof Swc4jAstSpreadElement) {
                properties.add(expression(p));
            } else if (p instanceof Swc4jAstIdent) {
                Identifier name = new Identifier(range(p), ((Swc4jAstIdent) p).getSym());
                properties.add(new Property(range(p), name, name, false, true, false, "init"));
            } else if (p instanceof Swc4jAstKeyValueProp) {
                Swc4jAstKeyValueProp kv = (Swc4jAstKeyValueProp) p;
                properties.add(new Property(range(p), propertyKey(kv.getKey()), expression(kv.getValue()),
                        kv.getKey() instanceof Swc4jAstComputedPropName, false, false, "init"));
            } else {
                properties.add(new OpaqueExpression(range(p)));
            }
        }
        return new ObjectExpression(range(o), properties);
    }

    /**
     * Quasis are sliced from the source between the substitutions so they keep their raw escapes.
     * Each substitution sits between the nearest {@code ${} before it and the first {@code }} after.
     */
    private TemplateLiteral template(Swc4jAstTpl tpl) {
        List<String> quasis = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        int cursor = start(tpl) + 1;
        for (ISwc4jAst e : tpl.getExprs()) {
            int open = source.lastIndexOf("${", start(e));
            quasis.add(text(cursor, Math.max(cursor, open)));
            expressions.add(expression(e));
            int close = source.indexOf('}', end(e));
            cursor = close < 0 ? end(e) : close + 1;
        }
        quasis.add(text(cursor, Math.max(cursor, end(tpl) - 1)));
        return new TemplateLiteral(range(tpl), quasis, expressions);
    }

    // ------------------------------------------------------------------
    // JSX
    // ------------------------------------------------------------------

    private JsxElement jsxElement(Swc4jAstJsxElement element) {
        List<Node> attributes = new ArrayList<>();
        element.getOpening().getAttrs().forEach(a -> attributes.add(jsxAttribute(a)));
        String name = text(element.getOpening().getName());
        return new JsxElement(range(element), name, attributes, jsxChildren(element.getChildren()),
                element.getOpening().isSelfClosing());
    }

    private Node jsxAttribute(ISwc4jAst node) {
        if (node instanceof Swc4jAstSpreadElement) {
            return new JsxSpreadAttribute(range(node), expression(((Swc4jAstSpreadElement) node).getExpr()));
        }
        Swc4jAstJsxAttr attr = (Swc4jAstJsxAttr) node;
        Expression value = attr.getValue().map(this::jsxAttributeValue).orElse(null);
        return new JsxAttribute(range(attr), text(attr.getName()), value);
    }

    /** Attribute strings have no escapes, only HTML character references. */
    private Expression jsxAttributeValue(ISwc4jAst node) {
        if (node instanceof Swc4jAstStr) {
            String raw = text(node);
            String inner = raw.length() < 2 ? raw : raw.substring(1, raw.length() - 1);
            return new Literal(range(node), Literal.Kind.STRING, raw, HtmlEntities.decode(inner));
        }
        if (node instanceof Swc4jAstJsxExprContainer) return jsxContainer((Swc4jAstJsxExprContainer) node);
        return expression(node);
    }

    private List<Node> jsxChildren(List<? extends ISwc4jAst> children) {
        List<Node> out = new ArrayList<>();
        for (ISwc4jAst child : children) {
            if (child instanceof Swc4jAstJsxText) {
                out.add(new JsxText(range(child), HtmlEntities.decode(text(child))));
            } else if (child instanceof Swc4jAstJsxExprContainer) {
                out.add(jsxContainer((Swc4jAstJsxExprContainer) child));
            } else {
                out.add(expression(child));
            }
        }
        return out;
    }

    private JsxExpressionContainer jsxContainer(Swc4jAstJsxExprContainer container) {
        ISwc4jAst inner = container.getExpr();
        Expression expression = inner instanceof Swc4jAstJsxEmptyExpr ? null : expression(inner);
        return new JsxExpressionContainer(range(container), expression);
    }
}
