package info.isaksson.erland.reacttoangular.parse;

import info.isaksson.erland.reacttoangular.syntax.Program;

/** Parser collaborator contract consumed by the pipeline driver. */
public interface SourceParser {

    /** Parse source text into a syntax tree. */
    Program parse(String source) throws ParseError;

    /** True when {@link #parse(String)} would succeed. */
    default boolean validate(String source) {
        try {
            parse(source);
            return true;
        } catch (ParseError e) {
            return false;
        }
    }
}
