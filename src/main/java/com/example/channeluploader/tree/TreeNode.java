package com.example.channeluploader.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A folder: its files in scan order plus its named subfolders.
 */
public final class TreeNode {
    private final List<FileEntry> files = new ArrayList<>();
    private final Map<String, TreeNode> subfolders = new LinkedHashMap<>();

    public List<FileEntry> files() {
        return Collections.unmodifiableList(files);
    }

    public Map<String, TreeNode> subfolders() {
        return Collections.unmodifiableMap(subfolders);
    }

    public void addFile(FileEntry entry) {
        files.add(entry);
    }

    public void putSubfolder(String name, TreeNode child) {
        subfolders.put(name, child);
    }

    boolean removeFile(FileEntry entry) {
        return files.remove(entry);
    }
}
