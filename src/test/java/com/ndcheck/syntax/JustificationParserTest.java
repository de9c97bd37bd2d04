package com.ndcheck.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JustificationParserTest {

    private final JustificationParser parser = new JustificationParser();

    @Test
    void parsesRuleAndLineCitations() {
        Justification justification = parser.parse("→E, 1,2");
        assertEquals("→E", justification.getRule());
        assertEquals(List.of(new Citation.LineRef(1), new Citation.LineRef(2)), justification.getCitations());
        assertEquals("→E, 1, 2", justification.toString());
    }

    @Test
    void parsesRangesAlongsideLines() {
        Justification justification = parser.parse("∨E, 1, 2-3, 4 – 5");
        assertEquals(List.of(new Citation.LineRef(1)), justification.lineRefs());
        assertEquals(List.of(new Citation.RangeRef(2, 3), new Citation.RangeRef(4, 5)), justification.rangeRefs());
    }

    @Test
    void acceptsRuleWithoutCitations() {
        Justification justification = parser.parse("=I");
        assertEquals("=I", justification.getRule());
        assertTrue(justification.getCitations().isEmpty());
    }

    @Test
    void acceptsWhitespaceAfterRule() {
        assertEquals(parser.parse("→E, 1, 2"), parser.parse("→E 1,2"));
    }

    @Test
    void normalizesDiamondGlyph() {
        assertEquals("♢E", parser.parse("◇E, 1, 2-4").getRule());
    }

    @Test
    void rejectsBadCitations() {
        assertThrows(SyntaxException.class, () -> parser.parse("IP, 4-2"));
        assertThrows(SyntaxException.class, () -> parser.parse("IP, 3-3"));
        assertThrows(SyntaxException.class, () -> parser.parse("→E, 1,,2"));
        assertThrows(SyntaxException.class, () -> parser.parse("R, x"));
        assertThrows(SyntaxException.class, () -> parser.parse("R, 0"));
    }

    @Test
    void rejectsMissingOrInvalidRule() {
        assertThrows(SyntaxException.class, () -> parser.parse(""));
        assertThrows(SyntaxException.class, () -> parser.parse("   "));
        assertThrows(SyntaxException.class, () -> parser.parse("$$, 1"));
    }

    @Test
    void splitsStepLineAtFirstSeparator() {
        assertEquals(new JustificationParser.StepText("Q", "→E, 1,2"), parser.splitStepLine("Q; →E, 1,2"));
        assertEquals(new JustificationParser.StepText("Q", "R, 1"), parser.splitStepLine(" Q | R, 1"));
        assertEquals(new JustificationParser.StepText("P", null), parser.splitStepLine("P"));
    }
}
