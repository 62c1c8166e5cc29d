package io.github.eutro.qdebug.test;

import io.github.eutro.qdebug.parsing.ParsingErrorLocation;
import io.github.eutro.qdebug.parsing.ParsingException;
import io.github.eutro.qdebug.parsing.SourceLocator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceLocatorTest {
    @Test
    void plainOffsets() {
        SourceLocator locator = new SourceLocator("ab\ncd\n");
        assertEquals(new ParsingErrorLocation(1, 1, "x"), locator.locate(0, "x"));
        assertEquals(new ParsingErrorLocation(1, 3, "x"), locator.locate(2, "x"));
        assertEquals(new ParsingErrorLocation(2, 2, "x"), locator.locate(4, "x"));
        assertEquals(new ParsingErrorLocation(3, 1, "x"), locator.locate(6, "x"));
    }

    @Test
    void targetsAreFoundOnTheirLine() {
        SourceLocator locator = new SourceLocator("qreg q[2];\n  x q[5]; y q[0];\n");
        assertEquals(new ParsingErrorLocation(2, 5, "d"), locator.locate(13, "q[5]", "d"));
        assertEquals(new ParsingErrorLocation(2, 13, "d"), locator.locate(13, "q[0]", "d"));
    }

    @Test
    void missingTargetsFallBackToTheFirstNonBlank() {
        SourceLocator locator = new SourceLocator("qreg q[2];\n \tx a[0];\n");
        assertEquals(new ParsingErrorLocation(2, 3, "d"), locator.locate(13, "b[0]", "d"));
    }

    @Test
    void columnsCountCharactersNotBytes() {
        SourceLocator locator = new SourceLocator("// \u00e9\n\u00e9\u00e9 foo;");
        assertEquals(new ParsingErrorLocation(2, 4, "d"), locator.locate(8, "d"));
        assertEquals(new ParsingErrorLocation(2, 4, "d"), locator.locate(5, "foo", "d"));

        ParsingException e = PreprocessorTest.fails("qreg q[2];\n/* \u00e9\u00e9 */ x q[5];\n");
        assertEquals(new ParsingErrorLocation(2, 12, "Invalid target qubit q[5]."), e.getLocation());
    }

    @Test
    void formattedMessage() {
        ParsingException e = new SourceLocator("\n  foo;")
                .error(ParsingException.Kind.EMPTY_TARGET, 3, null, "Empty target.");
        assertEquals("<input>:2:3: Empty target.", e.getMessage());
        assertEquals("Empty target.", e.getDetail());
        assertEquals(ParsingException.Kind.EMPTY_TARGET, e.getKind());
    }
}
