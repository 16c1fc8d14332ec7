package org.mongomaint.confirm;

public enum ConfirmationPoint {
    /** Before orphaned covering indexes are dropped. YES or NO. */
    ORPHAN_CLEANUP,
    /** Before the list of target collections is processed. YES, NO or SPECIFY. */
    COLLECTION_LIST,
    /** Per collection after SPECIFY at {@link #COLLECTION_LIST}. YES, NO or END. */
    COLLECTION,
    /** Before a collection's index list is processed. YES, NO, SPECIFY or SKIP. */
    INDEX_LIST,
    /** Per index after SPECIFY at {@link #INDEX_LIST}. YES or NO. */
    INDEX,
    /**
     * Collection filters were given but node-level auto compaction ignores them.
     * YES falls back to manual per-collection compaction, NO keeps auto compaction. ABORT ends
     * the run.
     */
    AUTO_COMPACT_FALLBACK
}
