package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.syntax.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the rewrite passes, in order, over one per-run {@link TranspileContext}.
 *
 * <p>The standard order is structure, state/effect, template, event. Each pass relies on what the
 * earlier ones recorded (the event pass needs the alias map and the template element ids), so the
 * list is fixed.</p>
 */
public final class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<NamedPass> passes;

    private static final class NamedPass {
        final String name;
        final RulePass pass;

        NamedPass(String name, RulePass pass) {
            this.name = name;
            this.pass = pass;
        }
    }

    private RuleEngine(List<NamedPass> passes) {
        this.passes = List.copyOf(passes);
    }

    public static RuleEngine standard() {
        return new RuleEngine(List.of(
                new NamedPass("structure", StructurePass::apply),
                new NamedPass("state-effect", StateEffectPass::apply),
                new NamedPass("template", TemplatePass::apply),
                new NamedPass("event", EventPass::apply)
        ));
    }

    public List<String> passNames() {
        return passes.stream().map(p -> p.name).collect(Collectors.toList());
    }

    public RuleResult run(Program program) {
        return run(program, null, null);
    }

    /**
     * @param nameOverride component name to use instead of the declared one, or null
     * @param fallbackName name for an anonymous default export, or null for {@code Component}
     */
    public RuleResult run(Program program, String nameOverride, String fallbackName) {
        TranspileContext context = new TranspileContext(program, nameOverride, fallbackName);
        for (NamedPass p : passes) {
            int before = context.warnings.size();
            p.pass.apply(context);
            log.debug("pass '{}' done for {} ({} new warnings)", p.name, context.name, context.warnings.size() - before);
        }
        IrComponent component = context.build();
        log.debug("component {}: {} inputs, {} states, {} methods, {} effects, {} events",
                component.name, component.inputs.size(), component.states.size(),
                component.methods.size(), component.effects.size(), component.events.size());
        return new RuleResult(component, context.warnings.toDeterministicList());
    }
}
