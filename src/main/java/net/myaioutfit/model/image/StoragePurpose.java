package net.myaioutfit.model.image;

/**
 * The two storage path classes for wardrobe assets.
 */
public enum StoragePurpose {
    /** Pre-removal upload; timestamped, never overwritten, deleted once processed exists. */
    ORIGINAL("original", false),
    /** Final asset keyed by owner and asset id; regeneration overwrites in place. */
    PROCESSED("processed", true);

    private final String prefix;
    private final boolean overwrite;

    StoragePurpose(String prefix, boolean overwrite) {
        this.prefix = prefix;
        this.overwrite = overwrite;
    }

    public String prefix() {
        return prefix;
    }

    public boolean overwrite() {
        return overwrite;
    }
}
