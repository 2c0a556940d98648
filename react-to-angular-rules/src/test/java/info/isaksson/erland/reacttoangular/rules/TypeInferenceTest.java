package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.parse.JsxParser;
import info.isaksson.erland.reacttoangular.syntax.ExpressionStatement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TypeInferenceTest {

    private static String infer(String source) throws Exception {
        return TypeInference.infer(((ExpressionStatement) new JsxParser().parse("(" + source + ");").body.get(0)).expression);
    }

    @Test
    void infersLiteralTypes() throws Exception {
        assertEquals("number", infer("0"));
        assertEquals("number", infer("-1.5"));
        assertEquals("string", infer("\"\""));
        assertEquals("string", infer("`x`"));
        assertEquals("boolean", infer("true"));
        assertEquals("boolean", infer("!x"));
        assertEquals("any", infer("null"));
        assertEquals("any", infer("compute()"));
    }

    @Test
    void infersArrayTypes() throws Exception {
        assertEquals("any[]", infer("[]"));
        assertEquals("string[]", infer("['a', 'b']"));
        assertEquals("number[]", infer("[1, 2]"));
        assertEquals("any[]", infer("[1, 'b']"));
        assertEquals("any[]", infer("[{ id: 1 }]"));
    }
}
