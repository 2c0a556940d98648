package info.isaksson.erland.reacttoangular.rules;

/** One rule-engine stage; mutates the shared context. */
@FunctionalInterface
public interface RulePass {
    void apply(TranspileContext context);
}
