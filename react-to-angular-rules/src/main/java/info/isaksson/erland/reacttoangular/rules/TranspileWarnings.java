package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Collects warnings during one run.
 *
 * <p>Warnings are deterministic: final output is sorted by (line, code, message, column).</p>
 */
public final class TranspileWarnings {

    private final List<UnsupportedConstructWarning> warnings = new ArrayList<>();

    public void warn(String code, String message, SourceRange at) {
        SourceRange r = at == null ? SourceRange.NONE : at;
        warnings.add(new UnsupportedConstructWarning(code, message, r.line, r.column));
    }

    public void addAll(List<UnsupportedConstructWarning> more) {
        if (more != null) warnings.addAll(more);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    public List<UnsupportedConstructWarning> toDeterministicList() {
        List<UnsupportedConstructWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparingInt((UnsupportedConstructWarning w) -> w.line)
                .thenComparing(w -> w.code)
                .thenComparing(w -> w.message)
                .thenComparingInt(w -> w.column));
        return Collections.unmodifiableList(out);
    }
}
