package im.arun.controltree.parse;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Identifier and cleaned title recovered from one blob. The identifier is null when the blob has none.
 */
@Data
@AllArgsConstructor
public class ParsedBlob {
    private String identifier;
    private String title;
    private CutRule appliedRule;

    public boolean hasIdentifier() {
        return identifier != null;
    }
}
