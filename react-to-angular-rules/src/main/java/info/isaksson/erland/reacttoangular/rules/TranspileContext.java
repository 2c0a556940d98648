package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrEffect;
import info.isaksson.erland.reacttoangular.ir.IrEventBinding;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.ir.IrPassthrough;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.ir.IrSourceRef;
import info.isaksson.erland.reacttoangular.ir.IrStateBinding;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;
import info.isaksson.erland.reacttoangular.syntax.Expression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.Program;
import info.isaksson.erland.reacttoangular.syntax.SourceRange;
import info.isaksson.erland.reacttoangular.syntax.Statement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-run state shared by the rule passes: the syntax tree being converted, the component
 * model under construction, the alias map and the warnings.
 *
 * <p>One context per input file; never shared between runs.</p>
 */
public final class TranspileContext {

    public final Program program;
    public final AliasMap aliases = new AliasMap();
    public final TranspileWarnings warnings = new TranspileWarnings();

    final String nameOverride;
    final String fallbackName;

    // Located component
    String name;
    List<Expression> params = List.of();
    /** Statements of a block-bodied component, empty for an expression body. */
    List<Statement> body = List.of();
    /** Returned expression of an expression-bodied component, otherwise null. */
    Expression expressionBody;
    Node componentNode;
    String propsName;
    /** Local alias to input name, e.g. {@code heading -> title} for {@code { title: heading }}. */
    final Map<String, String> renames = new LinkedHashMap<>();

    // Model under construction
    final Map<String, IrProperty> inputs = new LinkedHashMap<>();
    final List<IrStateBinding> states = new ArrayList<>();
    final List<IrProperty> properties = new ArrayList<>();
    final List<PendingMethod> pendingMethods = new ArrayList<>();
    final List<IrMethod> methods = new ArrayList<>();
    final List<PendingEffect> pendingEffects = new ArrayList<>();
    final List<IrEffect> effects = new ArrayList<>();
    final List<PendingHandler> pendingHandlers = new ArrayList<>();
    final List<IrEventBinding> events = new ArrayList<>();
    final List<IrPassthrough> passthroughs = new ArrayList<>();
    final List<String> styleImports = new ArrayList<>();
    IrTemplateNode template;

    private int tempIds;

    public TranspileContext(Program program, String nameOverride, String fallbackName) {
        this.program = program;
        this.nameOverride = nameOverride;
        this.fallbackName = fallbackName == null || fallbackName.isBlank() ? "Component" : fallbackName;
    }

    /** Local function, callback or derived value waiting for the alias map to be complete. */
    static final class PendingMethod {
        final String name;
        final IrMethodKind kind;
        final List<Expression> params;
        final Node body;
        final boolean async;
        final IrSourceRef source;

        PendingMethod(String name, IrMethodKind kind, List<Expression> params, Node body, boolean async, IrSourceRef source) {
            this.name = name;
            this.kind = kind;
            this.params = params == null ? List.of() : List.copyOf(params);
            this.body = body;
            this.async = async;
            this.source = source;
        }
    }

    static final class PendingEffect {
        final int index;
        final Expression function;
        /** Second argument of the effect call, null when absent. */
        final Expression dependencies;
        final IrSourceRef source;

        PendingEffect(int index, Expression function, Expression dependencies, IrSourceRef source) {
            this.index = index;
            this.function = function;
            this.dependencies = dependencies;
            this.source = source;
        }
    }

    /** An {@code on*} attribute queued by the template pass. */
    static final class PendingHandler {
        String elementId;
        final String tag;
        final String reactEvent;
        final Expression handler;
        final List<String> loopLocals;
        final IrSourceRef source;

        PendingHandler(String elementId, String tag, String reactEvent, Expression handler, List<String> loopLocals, IrSourceRef source) {
            this.elementId = elementId;
            this.tag = tag;
            this.reactEvent = reactEvent;
            this.handler = handler;
            this.loopLocals = List.copyOf(loopLocals);
            this.source = source;
        }
    }

    public String name() {
        return name;
    }

    /** Every class member name claimed so far: inputs, states, properties and methods. */
    Set<String> memberNames() {
        Set<String> out = new LinkedHashSet<>(inputs.keySet());
        for (IrStateBinding s : states) out.add(s.name);
        for (IrProperty p : properties) out.add(p.name);
        for (PendingMethod m : pendingMethods) out.add(m.name);
        for (IrMethod m : methods) out.add(m.name);
        return out;
    }

    /**
     * Class member name for a component-scope local. A local that collides with an input keeps the
     * input's name free: it gets a numbered name and is resolved through {@link #renames}.
     */
    String claimMember(String local) {
        if (!inputs.containsKey(local)) return local;
        String member = NameUtil.unique(local, memberNames());
        renames.put(local, member);
        return member;
    }

    boolean isMember(String name) {
        return memberNames().contains(name);
    }

    boolean isState(String name) {
        for (IrStateBinding s : states) {
            if (s.name.equals(name)) return true;
        }
        return false;
    }

    IrMethod method(String name) {
        for (IrMethod m : methods) {
            if (m.name.equals(name)) return m;
        }
        return null;
    }

    /** Callable members: declared methods and generated handlers, not getters. */
    boolean isCallableMethod(String name) {
        IrMethod m = method(name);
        return m != null && m.kind != IrMethodKind.GETTER;
    }

    void markTwoWay(String stateName) {
        for (int i = 0; i < states.size(); i++) {
            IrStateBinding s = states.get(i);
            if (s.name.equals(stateName) && !s.twoWay) states.set(i, s.withTwoWay(true));
        }
    }

    String nextTempId() {
        return "t" + (tempIds++);
    }

    void passthrough(String reason, Node node) {
        passthroughs.add(new IrPassthrough(reason, program.textOf(node), sourceRef(node)));
    }

    void passthrough(String reason, String text, Node node) {
        passthroughs.add(new IrPassthrough(reason, text, sourceRef(node)));
    }

    void warn(String code, String message, Node at) {
        warnings.warn(code, message, at == null ? SourceRange.NONE : at.range);
    }

    static IrSourceRef sourceRef(Node node) {
        if (node == null || node.range == null || !node.range.isKnown()) return null;
        return new IrSourceRef(node.range.line, node.range.column);
    }

    /** Component model as built so far. */
    public IrComponent build() {
        return new IrComponent(
                null,
                name,
                NameUtil.selector(name),
                new ArrayList<>(inputs.values()),
                states,
                properties,
                methods,
                effects,
                events,
                template,
                passthroughs,
                styleImports,
                null
        );
    }
}
