package info.isaksson.erland.reacttoangular.core;

import info.isaksson.erland.reacttoangular.emitter.AngularEmitter;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning;

import java.nio.file.Path;
import java.util.List;

/** Conversion result container for programmatic usage. */
public final class TranspileResult {
    /** Validated component model. */
    public final IrComponent component;

    /** Generated file texts. */
    public final AngularEmitter.EmittedComponent emitted;

    /** Deterministically ordered. */
    public final List<UnsupportedConstructWarning> warnings;

    /** Files written, in write order. Empty for in-memory conversions. */
    public final List<Path> writtenFiles;

    TranspileResult(
            IrComponent component,
            AngularEmitter.EmittedComponent emitted,
            List<UnsupportedConstructWarning> warnings,
            List<Path> writtenFiles
    ) {
        this.component = component;
        this.emitted = emitted;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.writtenFiles = writtenFiles == null ? List.of() : List.copyOf(writtenFiles);
    }

    TranspileResult withWrittenFiles(List<Path> files) {
        return new TranspileResult(component, emitted, warnings, files);
    }
}
