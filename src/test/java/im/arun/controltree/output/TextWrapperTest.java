package im.arun.controltree.output;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextWrapperTest {

    @Test
    void shortTextStaysOnOneLine() {
        assertEquals(List.of("Protect stored account data."), TextWrapper.wrap("Protect stored account data.", 40));
    }

    @Test
    void wrapsAtWordBoundaries() {
        List<String> lines = TextWrapper.wrap("Network security controls are configured and maintained", 20);

        assertEquals(List.of("Network security", "controls are", "configured and", "maintained"), lines);
        lines.forEach(line -> assertTrue(line.length() <= 20, line));
    }

    @Test
    void lineMayFillWidthExactly() {
        assertEquals(List.of("aaaa bbbb", "cc"), TextWrapper.wrap("aaaa bbbb cc", 9));
    }

    @Test
    void longWordIsNeverSplit() {
        List<String> lines = TextWrapper.wrap("see https://www.pcisecuritystandards.org/document_library today", 12);

        assertEquals(List.of("see", "https://www.pcisecuritystandards.org/document_library", "today"), lines);
    }

    @Test
    void hyphenatedWordsStayWhole() {
        assertEquals(List.of("multi-factor", "authentication"), TextWrapper.wrap("multi-factor authentication", 14));
    }

    @Test
    void blankTextHasNoLines() {
        assertTrue(TextWrapper.wrap("   ", 10).isEmpty());
        assertTrue(TextWrapper.wrap(null, 10).isEmpty());
    }
}
