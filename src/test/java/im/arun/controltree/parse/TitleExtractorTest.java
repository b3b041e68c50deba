package im.arun.controltree.parse;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TitleExtractorTest {
    private final TitleExtractor extractor = new TitleExtractor();

    @Test
    void titleIsTextAfterIdentifier() {
        ParsedBlob parsed = extractor.extract("1 Install and maintain network security controls.");

        assertEquals("1", parsed.getIdentifier());
        assertEquals("Install and maintain network security controls.", parsed.getTitle());
        assertNull(parsed.getAppliedRule());
    }

    @Test
    void cutsAtNotLimitedToPhraseOnSameLine() {
        ParsedBlob parsed = extractor.extract("2 Do the thing, including, but not limited to: sub-detail here");

        assertEquals("2", parsed.getIdentifier());
        assertEquals("Do the thing", parsed.getTitle());
        assertEquals(CutRule.NOT_LIMITED_TO, parsed.getAppliedRule());
    }

    @Test
    void specificPhraseWinsOverGenericColon() {
        String blob = "5.2.3 Periodic evaluations include the following:\n"
            + "system components including, but not limited to:\n"
            + "• Identification: of evolving threats";

        ParsedBlob parsed = extractor.extract(blob);

        assertEquals(CutRule.NOT_LIMITED_TO, parsed.getAppliedRule());
        assertEquals("Periodic evaluations include the following: system components", parsed.getTitle());
    }

    @Test
    void failureOfPhraseOutranksShorterPhrase() {
        ParsedBlob parsed = extractor.extract(
            "10.7.2 Failures of critical security control systems are detected, including but not limited to failure of:\n"
                + "• Network security controls.");

        assertEquals(CutRule.NOT_LIMITED_TO_FAILURE_OF, parsed.getAppliedRule());
        assertEquals("Failures of critical security control systems are detected", parsed.getTitle());
    }

    @Test
    void asFollowsCutsBeforeEnumeration() {
        ParsedBlob parsed = extractor.extract("8.3.6 If passwords are used, they meet the minimum level of complexity as follows:\n"
            + "• A minimum length of 12 characters.");

        assertEquals(CutRule.AS_FOLLOWS, parsed.getAppliedRule());
        assertEquals("If passwords are used, they meet the minimum level of complexity", parsed.getTitle());
    }

    @Test
    void genericColonRequiresLineBreak() {
        ParsedBlob inline = extractor.extract("1.2.1 Note: configuration standards are defined.");
        assertNull(inline.getAppliedRule());
        assertEquals("Note: configuration standards are defined.", inline.getTitle());

        ParsedBlob multiline = extractor.extract("1.2.1 Configuration standards for NSC rulesets:\nAre defined.");
        assertEquals(CutRule.GENERIC_COLON, multiline.getAppliedRule());
        assertEquals("Configuration standards for NSC rulesets", multiline.getTitle());
    }

    @Test
    void crossReferenceMarkerCutsTrailingReference() {
        ParsedBlob parsed = extractor.extract("A1.1.1 Logical separation is implemented. PCI DSS Reference: Requirement 1");

        assertEquals(CutRule.CROSS_REFERENCE, parsed.getAppliedRule());
        assertEquals("Logical separation is implemented.", parsed.getTitle());
    }

    @Test
    void phraseInsideAWordDoesNotCut() {
        ParsedBlob malware = extractor.extract("5.3 Anti-malware: mechanisms are active and maintained.");
        assertNull(malware.getAppliedRule());
        assertEquals("Anti-malware: mechanisms are active and maintained.", malware.getTitle());

        ParsedBlob analysis = extractor.extract("12.3 Perform a targeted risk analysis: at least annually.");
        assertNull(analysis.getAppliedRule());
        assertEquals("Perform a targeted risk analysis: at least annually.", analysis.getTitle());
    }

    @Test
    void standalonePhraseStillCutsInline() {
        ParsedBlob parsed = extractor.extract("10.2.1.2 Audit logs for hardware and software are: retained");

        assertEquals(CutRule.ARE, parsed.getAppliedRule());
        assertEquals("Audit logs for hardware and software", parsed.getTitle());
    }

    @Test
    void collapsesLineBreaksAndWhitespaceRuns() {
        ParsedBlob parsed = extractor.extract("  3.1  Processes   and mechanisms\nfor protecting\n\n stored data.  ");

        assertEquals("3.1", parsed.getIdentifier());
        assertEquals("Processes and mechanisms for protecting stored data.", parsed.getTitle());
        assertFalse(parsed.getTitle().contains("\n"));
    }

    @Test
    void trailingCommaBecomesPeriod() {
        ParsedBlob parsed = extractor.extract("4.2 Strong cryptography is used,");

        assertEquals("Strong cryptography is used.", parsed.getTitle());
    }

    @Test
    void blobWithoutIdentifierKeepsTitleOnly() {
        ParsedBlob parsed = extractor.extract("Examine system configurations.");

        assertFalse(parsed.hasIdentifier());
        assertEquals("Examine system configurations.", parsed.getTitle());
    }

    @Test
    void emptyBlobYieldsEmptyTitle() {
        ParsedBlob parsed = extractor.extract("   \n ");

        assertNull(parsed.getIdentifier());
        assertEquals("", parsed.getTitle());
    }
}
