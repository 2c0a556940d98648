package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.ir.IrComponent;

import java.util.List;

/** Output of a rule-engine run: the component model plus warnings in deterministic order. */
public final class RuleResult {
    public final IrComponent component;
    public final List<UnsupportedConstructWarning> warnings;

    public RuleResult(IrComponent component, List<UnsupportedConstructWarning> warnings) {
        this.component = component;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
