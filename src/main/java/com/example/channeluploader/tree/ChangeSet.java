package com.example.channeluploader.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classification of every relative path seen in either of two trees.
 * <p>
 * {@code added} holds entries from the current tree. {@code removed}, {@code modified}
 * and {@code unchanged} hold entries from the previous tree, so they still carry the
 * remote identifiers needed to delete or reuse the old objects.
 */
public record ChangeSet(
        Map<String, FileEntry> added,
        Map<String, FileEntry> removed,
        Map<String, FileEntry> modified,
        Map<String, FileEntry> unchanged,
        int previousCount,
        int currentCount
) {
    public ChangeSet {
        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        modified = Collections.unmodifiableMap(new LinkedHashMap<>(modified));
        unchanged = Collections.unmodifiableMap(new LinkedHashMap<>(unchanged));
    }

    public int addedCount() {
        return added.size();
    }

    public int removedCount() {
        return removed.size();
    }

    public int modifiedCount() {
        return modified.size();
    }

    public int unchangedCount() {
        return unchanged.size();
    }

    public int changedCount() {
        return added.size() + removed.size() + modified.size();
    }
}
