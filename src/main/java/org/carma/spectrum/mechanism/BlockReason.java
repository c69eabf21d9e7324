package org.carma.spectrum.mechanism;

/**
 * Why a demand could not be placed. Every reason counts as blocked; none of
 * them stops the batch.
 */
public enum BlockReason {
    NO_PATH("No path", "Origin and destination are not connected"),
    UNRESOLVED_LINK("Unresolved link", "A path hop does not map to a ledger link"),
    NO_SPECTRUM("No spectrum", "No contiguous window is free on every link of any candidate path"),
    COMMIT_CONFLICT("Commit conflict", "The chosen window was taken between query and commit");

    private final String displayName;
    private final String description;

    BlockReason(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
