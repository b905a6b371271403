package com.example.channeluploader.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diffs a previously persisted tree against a fresh scan and merges the two.
 * <p>
 * Paths are matched by relative path; a file counts as modified only when its size
 * differs. A file rewritten in place with the same size is reported as unchanged.
 */
public final class TreeDiffer {

    private TreeDiffer() {
    }

    public static ChangeSet diff(TreeNode previous, TreeNode current) {
        Map<String, FileEntry> oldFiles = TreeCodec.extractPathMap(previous);
        Map<String, FileEntry> newFiles = TreeCodec.extractPathMap(current);

        Map<String, FileEntry> added = new LinkedHashMap<>();
        Map<String, FileEntry> removed = new LinkedHashMap<>();
        Map<String, FileEntry> modified = new LinkedHashMap<>();
        Map<String, FileEntry> unchanged = new LinkedHashMap<>();

        for (Map.Entry<String, FileEntry> entry : newFiles.entrySet()) {
            FileEntry old = oldFiles.get(entry.getKey());
            if (old == null) {
                added.put(entry.getKey(), entry.getValue());
            } else if (old.size() != entry.getValue().size()) {
                modified.put(entry.getKey(), old);
            } else {
                unchanged.put(entry.getKey(), old);
            }
        }
        for (Map.Entry<String, FileEntry> entry : oldFiles.entrySet()) {
            if (!newFiles.containsKey(entry.getKey())) {
                removed.put(entry.getKey(), entry.getValue());
            }
        }
        return new ChangeSet(added, removed, modified, unchanged, oldFiles.size(), newFiles.size());
    }

    /**
     * Copies {@code current} into a new tree in which every unchanged path that had remote
     * identifiers in {@code previous} reuses them and is flagged to skip transfer.
     */
    public static TreeNode mergeWithPrevious(TreeNode previous, ChangeSet changes, TreeNode current) {
        Map<String, FileEntry> oldFiles = TreeCodec.extractPathMap(previous);
        return mergeNode(current, "", 0, changes, oldFiles);
    }

    /**
     * Entries of {@code merged} that still need a transfer, keyed by relative path in scan order.
     */
    public static Map<String, FileEntry> filesPendingTransfer(TreeNode merged) {
        Map<String, FileEntry> pending = new LinkedHashMap<>();
        TreeCodec.extractPathMap(merged).forEach((path, entry) -> {
            if (!entry.skipTransfer()) {
                pending.put(path, entry);
            }
        });
        return pending;
    }

    /**
     * Old remote objects to delete: removed paths plus the previous version of modified paths.
     */
    public static Map<String, FileEntry> filesPendingDeletion(ChangeSet changes) {
        Map<String, FileEntry> pending = new LinkedHashMap<>(changes.removed());
        pending.putAll(changes.modified());
        return pending;
    }

    public static double changePercentage(ChangeSet changes) {
        int base = Math.max(Math.max(changes.previousCount(), changes.currentCount()), 1);
        double percentage = 100.0 * changes.changedCount() / base;
        return Math.min(percentage, 100.0);
    }

    /**
     * Writes transfer identifiers onto the entry at {@code relativePath}.
     *
     * @throws TreeFormatException when no entry exists at that path
     */
    public static void writeBack(TreeNode tree, String relativePath, String objectId, long messageId) {
        String[] segments = relativePath.split("/");
        TreeNode node = tree;
        for (int i = 0; i < segments.length - 1; i++) {
            TreeCodec.checkDepth(i + 1, relativePath);
            node = node.subfolders().get(segments[i]);
            if (node == null) {
                throw new TreeFormatException("No folder '" + segments[i] + "' on the way to '" + relativePath + "'");
            }
        }
        String fileName = segments[segments.length - 1];
        for (FileEntry file : node.files()) {
            if (file.name().equals(fileName)) {
                file.assignRemote(objectId, messageId);
                return;
            }
        }
        throw new TreeFormatException("No file at '" + relativePath + "' to record transfer on");
    }

    /**
     * Drops every file without remote identifiers and returns their relative paths.
     */
    public static List<String> pruneUntransferred(TreeNode tree) {
        List<String> pruned = new ArrayList<>();
        pruneNode(tree, "", 0, pruned);
        return pruned;
    }

    private static TreeNode mergeNode(TreeNode node,
                                      String path,
                                      int depth,
                                      ChangeSet changes,
                                      Map<String, FileEntry> oldFiles) {
        TreeCodec.checkDepth(depth, path);
        TreeNode merged = new TreeNode();
        for (FileEntry file : node.files()) {
            String filePath = TreeCodec.childPath(path, file.name());
            FileEntry copy = new FileEntry(file.name(), file.size(), file.localPath());
            FileEntry old = oldFiles.get(filePath);
            if (changes.unchanged().containsKey(filePath) && old != null && old.hasRemote()) {
                copy.assignRemote(old.remoteObjectId(), old.remoteMessageId());
                copy.markSkipTransfer();
            }
            merged.addFile(copy);
        }
        for (Map.Entry<String, TreeNode> sub : node.subfolders().entrySet()) {
            String subPath = TreeCodec.childPath(path, sub.getKey());
            merged.putSubfolder(sub.getKey(), mergeNode(sub.getValue(), subPath, depth + 1, changes, oldFiles));
        }
        return merged;
    }

    private static void pruneNode(TreeNode node, String path, int depth, List<String> pruned) {
        TreeCodec.checkDepth(depth, path);
        for (FileEntry file : new ArrayList<>(node.files())) {
            if (!file.hasRemote()) {
                node.removeFile(file);
                pruned.add(TreeCodec.childPath(path, file.name()));
            }
        }
        for (Map.Entry<String, TreeNode> sub : node.subfolders().entrySet()) {
            pruneNode(sub.getValue(), TreeCodec.childPath(path, sub.getKey()), depth + 1, pruned);
        }
    }
}
