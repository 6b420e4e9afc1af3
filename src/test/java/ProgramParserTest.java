import org.junit.jupiter.api.Test;

import com.algoscript.script.parser.AlgorithmDefinition;
import com.algoscript.script.parser.ParseError;
import com.algoscript.script.parser.ProgramParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramParserTest {

    @Test
    void headers_withAndWithoutColon() {
        List<AlgorithmDefinition> defs = ProgramParser.parse(
                "\uFEFFnotes before any block are ignored\n" +
                "Algorithm: First(a, b)\n" +
                "    return a + b\n" +
                "\n" +
                "Algorithm Second()\n" +
                "    return 2\n");

        assertEquals(2, defs.size());
        assertEquals("First", defs.get(0).name);
        assertEquals(List.of("a", "b"), defs.get(0).params);
        assertEquals(2, defs.get(0).line);
        assertEquals(1, defs.get(0).body.size());
        assertEquals("Second", defs.get(1).name);
        assertEquals(0, defs.get(1).arity());
        assertEquals(5, defs.get(1).line);
    }

    @Test
    void emptyProgram_hasNoAlgorithms() {
        assertTrue(ProgramParser.parse("").isEmpty());
        assertTrue(ProgramParser.parse("just prose\n").isEmpty());
    }

    @Test
    void badHeaders_areParseErrors() {
        ParseError dup = assertThrows(ParseError.class, () -> ProgramParser.parse("Algorithm: F(x, x)\n"));
        assertTrue(dup.getMessage().contains("Duplicate parameter name 'x'"));

        assertThrows(ParseError.class, () -> ProgramParser.parse("Algorithm: F(1x)\n"));
        ParseError noParens = assertThrows(ParseError.class, () -> ProgramParser.parse("\nAlgorithm: F\n"));
        assertEquals(2, noParens.line());
    }

    @Test
    void bodyErrors_reportFileLines() {
        ParseError e = assertThrows(ParseError.class, () -> ProgramParser.parse(
                "Algorithm: A()\n" +
                "    return 1\n" +
                "Algorithm: B()\n" +
                "    endfor\n"));
        assertEquals(4, e.line());
    }
}
