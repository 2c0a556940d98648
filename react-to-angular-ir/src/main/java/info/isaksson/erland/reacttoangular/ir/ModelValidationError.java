package info.isaksson.erland.reacttoangular.ir;

import java.util.List;

/**
 * The model broke one of its invariants after all passes ran. This is an internal inconsistency,
 * not a problem with the input.
 */
public class ModelValidationError extends RuntimeException {

    private final List<String> problems;

    public ModelValidationError(List<String> problems) {
        super(buildMessage(problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(List<String> problems) {
        if (problems.size() == 1) return "Invalid component model: " + problems.get(0);
        return "Invalid component model (" + problems.size() + " problems): " + String.join("; ", problems);
    }
}
