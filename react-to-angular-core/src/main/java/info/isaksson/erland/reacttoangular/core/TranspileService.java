package info.isaksson.erland.reacttoangular.core;

import info.isaksson.erland.reacttoangular.emitter.AngularEmitter;
import info.isaksson.erland.reacttoangular.emitter.ComponentNames;
import info.isaksson.erland.reacttoangular.emitter.EmitterOptions;
import info.isaksson.erland.reacttoangular.io.FileSystemHelper;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrJson;
import info.isaksson.erland.reacttoangular.ir.ModelValidator;
import info.isaksson.erland.reacttoangular.parse.JsxParser;
import info.isaksson.erland.reacttoangular.parse.ParseError;
import info.isaksson.erland.reacttoangular.parse.SourceParser;
import info.isaksson.erland.reacttoangular.rules.ComponentLocator;
import info.isaksson.erland.reacttoangular.rules.RuleEngine;
import info.isaksson.erland.reacttoangular.rules.RuleResult;
import info.isaksson.erland.reacttoangular.rules.TranspileWarnings;
import info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning;
import info.isaksson.erland.reacttoangular.syntax.Program;
import info.isaksson.erland.reacttoangular.syntax.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Core API for converting one React function component into an Angular standalone component.
 *
 * <p>Pipeline: read, parse, rule engine, stylesheet collection, validation, emission, writes. The
 * service keeps no per-run state, so one instance may convert several files concurrently.
 * CLI and other wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class TranspileService {

    private static final Logger log = LoggerFactory.getLogger(TranspileService.class);

    private final SourceParser parser;
    private final FileSystemHelper files;
    private final RuleEngine engine = RuleEngine.standard();
    private final AngularEmitter emitter = new AngularEmitter();

    public TranspileService() {
        this(new JsxParser(), new FileSystemHelper());
    }

    public TranspileService(SourceParser parser, FileSystemHelper files) {
        if (parser == null) throw new IllegalArgumentException("parser must not be null");
        if (files == null) throw new IllegalArgumentException("files must not be null");
        this.parser = parser;
        this.files = files;
    }

    /**
     * Converts {@code input} and writes the generated files into {@code outDir}, creating it when
     * missing.
     *
     * @throws ParseError when the input is malformed or holds no function component; nothing is written
     * @throws info.isaksson.erland.reacttoangular.ir.ModelValidationError on an inconsistent model; nothing is written
     * @throws IOException when the input cannot be read, or a {@link info.isaksson.erland.reacttoangular.io.WriteError}
     *         when an output cannot be written
     */
    public TranspileResult transpile(Path input, Path outDir, TranspileOptions options) throws ParseError, IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (outDir == null) throw new IllegalArgumentException("outDir must not be null");
        if (options == null) options = new TranspileOptions();

        String source = files.read(input);
        Path baseDir = input.toAbsolutePath().getParent();
        TranspileResult result = convert(source, fallbackName(input), baseDir, options);

        List<Path> written = new ArrayList<>();
        files.ensureDirectory(outDir);
        for (AngularEmitter.Artifact a : result.emitted.artifacts()) {
            Path target = outDir.resolve(a.fileName);
            files.write(target, a.content);
            written.add(target);
        }
        if (options.irOutput != null) {
            files.write(options.irOutput, IrJson.toJsonString(result.component));
            written.add(options.irOutput);
        }

        log.info("Transpiled {} -> {} ({} files, {} warnings)",
                input, outDir, written.size(), result.warnings.size());
        return result.withWrittenFiles(written);
    }

    /**
     * In-memory conversion; nothing is written.
     *
     * @param fallbackName name for an anonymous default export, or null
     * @param baseDir directory that relative stylesheet imports resolve against, or null to skip them
     */
    public TranspileResult convert(String source, String fallbackName, Path baseDir, TranspileOptions options)
            throws ParseError, IOException {
        if (options == null) options = new TranspileOptions();
        EmitterOptions emitterOptions = options.toEmitterOptions();

        Program program = parser.parse(source);
        if (ComponentLocator.find(program).isEmpty()) {
            throw new ParseError("No React function component found", 1, 1);
        }

        RuleResult rules = engine.run(program, blankToNull(options.name), fallbackName);
        TranspileWarnings warnings = new TranspileWarnings();
        warnings.addAll(rules.warnings);

        IrComponent component = rules.component.withStyles(collectStyles(rules.component, baseDir, warnings));
        ModelValidator.validate(component);

        AngularEmitter.EmittedComponent emitted = emitter.emit(component, emitterOptions);
        List<UnsupportedConstructWarning> ordered = warnings.toDeterministicList();
        log.debug("converted {}: {} artifacts, {} warnings", component.name, emitted.artifacts().size(), ordered.size());
        return new TranspileResult(component, emitted, ordered, List.of());
    }

    /** Concatenates the imported stylesheets in import order. */
    private String collectStyles(IrComponent component, Path baseDir, TranspileWarnings warnings) throws IOException {
        if (component.styleImports.isEmpty() || baseDir == null) return "";
        StringBuilder css = new StringBuilder();
        for (String imp : component.styleImports) {
            Path sheet = baseDir.resolve(imp).normalize();
            if (!files.exists(sheet)) {
                warnings.warn(UnsupportedConstructWarning.MISSING_STYLESHEET,
                        "Stylesheet " + imp + " not found; no styles copied from it", SourceRange.NONE);
                continue;
            }
            String text = files.read(sheet);
            if (css.length() > 0 && css.charAt(css.length() - 1) != '\n') css.append('\n');
            css.append(text);
        }
        return css.toString();
    }

    /** {@code todo-box.jsx -> TodoBox}. */
    static String fallbackName(Path input) {
        Path fileName = input.getFileName();
        if (fileName == null) return null;
        String base = fileName.toString();
        int dot = base.indexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        return ComponentNames.baseName(base);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
