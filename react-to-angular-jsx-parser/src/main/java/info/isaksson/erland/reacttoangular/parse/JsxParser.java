package info.isaksson.erland.reacttoangular.parse;

import com.caoccao.javet.swc4j.Swc4j;
import com.caoccao.javet.swc4j.ast.program.Swc4jAstModule;
import com.caoccao.javet.swc4j.enums.Swc4jMediaType;
import com.caoccao.javet.swc4j.enums.Swc4jParseMode;
import com.caoccao.javet.swc4j.exceptions.Swc4jCoreException;
import com.caoccao.javet.swc4j.options.Swc4jParseOptions;
import com.caoccao.javet.swc4j.outputs.Swc4jParseOutput;
import info.isaksson.erland.reacttoangular.syntax.Program;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SourceParser} backed by swc4j. Sources are parsed as TSX modules, which accepts plain
 * JavaScript + JSX as well as TypeScript components; the swc tree is then mapped onto the
 * {@code syntax} model by {@link SwcTreeMapper}.
 */
public final class JsxParser implements SourceParser {

    /** swc diagnostics read {@code <message> at <specifier>:<line>:<column>}. */
    private static final Pattern DIAGNOSTIC = Pattern.compile("^(.*?)\\s+at\\s+\\S*?:(\\d+):(\\d+)");

    private final Swc4j swc4j = new Swc4j();

    @Override
    public Program parse(String source) throws ParseError {
        if (source == null) {
            throw new ParseError("No source text", 0, 0);
        }
        Swc4jParseOptions options = new Swc4jParseOptions()
                .setMediaType(Swc4jMediaType.Tsx)
                .setParseMode(Swc4jParseMode.Module)
                .setCaptureAst(true);
        Swc4jParseOutput output;
        try {
            output = swc4j.parse(source, options);
        } catch (Swc4jCoreException e) {
            throw toParseError(e);
        }
        if (!(output.getProgram() instanceof Swc4jAstModule)) {
            throw new ParseError("Source did not parse as a module", 0, 0);
        }
        return new SwcTreeMapper(source).program((Swc4jAstModule) output.getProgram());
    }

    static ParseError toParseError(Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage().strip();
        String firstLine = message.lines().findFirst().orElse(message);
        Matcher m = DIAGNOSTIC.matcher(firstLine);
        if (m.find()) {
            return new ParseError(m.group(1), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)), e);
        }
        return new ParseError(firstLine, 0, 0, e);
    }
}
