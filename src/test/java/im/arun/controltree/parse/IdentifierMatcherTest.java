package im.arun.controltree.parse;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class IdentifierMatcherTest {

    @Test
    void matchesSingleSegmentIdentifier() {
        assertEquals(Optional.of("1"), IdentifierMatcher.match("1 Install and maintain network security controls."));
    }

    @Test
    void matchesNestedIdentifier() {
        assertEquals(Optional.of("12.10.7"), IdentifierMatcher.match("12.10.7 Incident response procedures"));
    }

    @Test
    void matchesLetterPrefixedIdentifier() {
        assertEquals(Optional.of("A1.2.3"), IdentifierMatcher.match("A1.2.3 Multi-tenant service providers"));
    }

    @Test
    void acceptsLineBreakAsSeparator() {
        assertEquals(Optional.of("3.4"), IdentifierMatcher.match("3.4\nAccess to displays of full PAN"));
    }

    @Test
    void rejectsLeadingWhitespaceOrPunctuation() {
        assertTrue(IdentifierMatcher.match(" 1.1 Indented").isEmpty());
        assertTrue(IdentifierMatcher.match("(1.1) Parenthesized").isEmpty());
        assertTrue(IdentifierMatcher.match("• 2 Bullet").isEmpty());
    }

    @Test
    void rejectsIdentifierWithoutTrailingWhitespace() {
        assertTrue(IdentifierMatcher.match("1.1").isEmpty());
        assertTrue(IdentifierMatcher.match("1.1.").isEmpty());
        assertTrue(IdentifierMatcher.match("1.1: Colon").isEmpty());
    }

    @Test
    void rejectsLowercaseOrDoubleLetterPrefix() {
        assertFalse(IdentifierMatcher.startsWithIdentifier("a1 lowercase"));
        assertFalse(IdentifierMatcher.startsWithIdentifier("AB1 two letters"));
    }

    @Test
    void rejectsProse() {
        assertFalse(IdentifierMatcher.startsWithIdentifier("Examine documentation"));
        assertFalse(IdentifierMatcher.startsWithIdentifier(""));
        assertFalse(IdentifierMatcher.startsWithIdentifier(null));
    }

    @Test
    void depthCountsSegments() {
        assertEquals(1, IdentifierMatcher.depthOf("1"));
        assertEquals(2, IdentifierMatcher.depthOf("1.1"));
        assertEquals(3, IdentifierMatcher.depthOf("A1.2.3"));
    }
}
