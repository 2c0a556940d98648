package info.isaksson.erland.reacttoangular.emitter;

/**
 * Line-oriented text builder with fixed-width indentation. Consecutive blank lines collapse into
 * one and the result always ends with a single newline.
 */
final class CodeWriter {

    private final StringBuilder out = new StringBuilder();
    private final String unit;
    private boolean lastBlank = true;

    CodeWriter(int indentWidth) {
        this.unit = " ".repeat(indentWidth);
    }

    CodeWriter line(int depth, String text) {
        if (text.isEmpty()) return blank();
        out.append(unit.repeat(Math.max(0, depth))).append(text).append('\n');
        lastBlank = false;
        return this;
    }

    CodeWriter blank() {
        if (!lastBlank) {
            out.append('\n');
            lastBlank = true;
        }
        return this;
    }

    @Override
    public String toString() {
        String s = out.toString();
        while (s.endsWith("\n\n")) s = s.substring(0, s.length() - 1);
        return s.isEmpty() || s.endsWith("\n") ? s : s + "\n";
    }
}
