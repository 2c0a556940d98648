package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class SwitchStatement extends Statement {
    public final Expression discriminant;
    public final List<SwitchCase> cases;

    public SwitchStatement(SourceRange range, Expression discriminant, List<SwitchCase> cases) {
        super(range);
        this.discriminant = discriminant;
        this.cases = List.copyOf(cases);
    }

    @Override public String type() {
        return "SwitchStatement";
    }

    @Override public List<Node> children() {
        return nodes(discriminant, cases);
    }
}
