package info.isaksson.erland.reacttoangular.emitter;

/** Options for emitting Angular sources from a component model. */
public final class EmitterOptions {

    public static final int DEFAULT_INDENT = 2;
    public static final int MIN_INDENT = 1;
    public static final int MAX_INDENT = 8;

    /** Spaces per indentation level in every emitted file. */
    public final int indentWidth;

    /** When true, a Jasmine/TestBed {@code .spec.ts} scaffold is emitted as well. */
    public final boolean emitSpec;

    public EmitterOptions(int indentWidth, boolean emitSpec) {
        if (indentWidth < MIN_INDENT || indentWidth > MAX_INDENT) {
            throw new IllegalArgumentException("indentWidth must be between " + MIN_INDENT + " and " + MAX_INDENT + " but was " + indentWidth);
        }
        this.indentWidth = indentWidth;
        this.emitSpec = emitSpec;
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions(DEFAULT_INDENT, false);
    }

    public EmitterOptions withIndentWidth(int width) {
        return new EmitterOptions(width, emitSpec);
    }

    public EmitterOptions withEmitSpec(boolean emit) {
        return new EmitterOptions(indentWidth, emit);
    }

    @Override
    public String toString() {
        return "EmitterOptions{" +
                "indentWidth=" + indentWidth +
                ", emitSpec=" + emitSpec +
                '}';
    }
}
