package im.arun.controltree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-fatal findings of a tree build: blobs without an identifier and identifiers seen more than once.
 */
@Getter
public class BuildDiagnostics {
    private final List<String> unparseableBlobs;
    private final List<String> duplicateIdentifiers;

    public BuildDiagnostics(List<String> unparseableBlobs, List<String> duplicateIdentifiers) {
        this.unparseableBlobs = Collections.unmodifiableList(new ArrayList<>(unparseableBlobs));
        this.duplicateIdentifiers = Collections.unmodifiableList(new ArrayList<>(duplicateIdentifiers));
    }

    public int unparseableCount() {
        return unparseableBlobs.size();
    }

    public int duplicateCount() {
        return duplicateIdentifiers.size();
    }

    public boolean isClean() {
        return unparseableBlobs.isEmpty() && duplicateIdentifiers.isEmpty();
    }
}
