package com.example.channeluploader.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeCodecTest {
    private final TreeCodec codec = new TreeCodec();

    @Test
    void roundTripDropsLocalFields() {
        TreeNode tree = new TreeNode();
        FileEntry a = new FileEntry("a.txt", 100, Path.of("/tmp/a.txt"));
        a.assignRemote("BQACAgIAAxkBAAIB", 7);
        tree.addFile(a);
        TreeNode sub = new TreeNode();
        sub.addFile(new FileEntry("b.txt", 50, Path.of("/tmp/sub/b.txt")));
        tree.putSubfolder("sub", sub);

        TreeNode copy = codec.fromJson(codec.toJson(tree));

        FileEntry restored = copy.files().get(0);
        assertEquals("a.txt", restored.name());
        assertEquals(100L, restored.size());
        assertEquals("BQACAgIAAxkBAAIB", restored.remoteObjectId());
        assertEquals(7L, restored.remoteMessageId());
        assertNull(restored.localPath());
        FileEntry pending = copy.subfolders().get("sub").files().get(0);
        assertFalse(pending.hasRemote());
        assertNull(pending.remoteMessageId());
    }

    @Test
    void serializedFormHasOnlyFilesAndSubfolders() {
        TreeNode tree = new TreeNode();
        tree.addFile(new FileEntry("a.txt", 3, Path.of("a.txt")));
        tree.putSubfolder("empty", new TreeNode());

        JsonNode json = codec.serialize(tree);

        assertEquals(List.of("files", "subfolders"), iterableToList(json.fieldNames()));
        JsonNode file = json.get("files").get(0);
        assertEquals(List.of("fileName", "fileSize", "fileId", "messageId"), iterableToList(file.fieldNames()));
        assertTrue(file.get("fileId").isNull());
        assertTrue(json.get("subfolders").get("empty").get("files").isEmpty());
    }

    @Test
    void rejectsFolderWithoutBothKeys() {
        TreeFormatException error = assertThrows(TreeFormatException.class,
                () -> codec.fromJson("{\"files\": []}"));
        assertTrue(error.getMessage().contains("must contain both"));
    }

    @Test
    void rejectsMalformedIdentifiers() {
        assertThrows(TreeFormatException.class, () -> codec.fromJson(
                "{\"files\":[{\"fileName\":\"a\",\"fileId\":\"short\",\"messageId\":1}],\"subfolders\":{}}"));
        assertThrows(TreeFormatException.class, () -> codec.fromJson(
                "{\"files\":[{\"fileName\":\"a\",\"fileId\":\"has spaces in it\",\"messageId\":1}],\"subfolders\":{}}"));
        assertThrows(TreeFormatException.class, () -> codec.fromJson(
                "{\"files\":[{\"fileName\":\"a\",\"fileId\":\"AgADBAADbqcxG\",\"messageId\":0}],\"subfolders\":{}}"));
        assertThrows(TreeFormatException.class, () -> codec.fromJson(
                "{\"files\":[{\"fileName\":\"a\",\"fileId\":\"AgADBAADbqcxG\",\"messageId\":null}],\"subfolders\":{}}"));
    }

    @Test
    void rejectsStoredNamesWithSeparatorsAndNegativeSizes() {
        TreeFormatException nested = assertThrows(TreeFormatException.class, () -> codec.fromJson(
                "{\"files\":[{\"fileName\":\"sub/a.txt\",\"fileSize\":4}],\"subfolders\":{}}"));
        assertTrue(nested.getMessage().contains("Path traversal"));
        assertThrows(TreeFormatException.class, () -> codec.fromJson(
                "{\"files\":[{\"fileName\":\"a.txt\",\"fileSize\":-1}],\"subfolders\":{}}"));
    }

    @Test
    void serializeRefusesInvalidIdentifierOnEntry() {
        TreeNode tree = new TreeNode();
        FileEntry entry = new FileEntry("a.txt", 1, null);
        entry.assignRemote("bad id!", 5);
        tree.addFile(entry);

        assertThrows(TreeFormatException.class, () -> codec.serialize(tree));
    }

    @Test
    void legacyEntriesWithoutSizeDefaultToZero() {
        TreeNode tree = codec.fromJson(
                "{\"files\":[{\"fileName\":\"a\",\"fileId\":\"AgADBAADbqcxG\",\"messageId\":3}],\"subfolders\":{}}");

        assertEquals(0L, tree.files().get(0).size());
        assertTrue(tree.files().get(0).hasRemote());
    }

    @Test
    void depthCeilingAppliesToEveryWalk() throws Exception {
        TreeNode root = new TreeNode();
        TreeNode current = root;
        for (int i = 0; i <= TreeCodec.MAX_DEPTH; i++) {
            TreeNode child = new TreeNode();
            current.putSubfolder("d", child);
            current = child;
        }

        assertThrows(TreeFormatException.class, () -> codec.serialize(root));
        assertThrows(TreeFormatException.class, () -> TreeCodec.extractPathMap(root));

        String nested = "{\"files\":[],\"subfolders\":{}}";
        for (int i = 0; i <= TreeCodec.MAX_DEPTH; i++) {
            nested = "{\"files\":[],\"subfolders\":{\"d\":" + nested + "}}";
        }
        JsonNode deep = new ObjectMapper().readTree(nested);
        assertThrows(TreeFormatException.class, () -> codec.deserialize(deep));
    }

    @Test
    void pathMapUsesForwardSlashes() {
        TreeNode tree = new TreeNode();
        TreeNode sub = new TreeNode();
        TreeNode inner = new TreeNode();
        inner.addFile(new FileEntry("c.txt", 1, null));
        sub.putSubfolder("inner", inner);
        tree.putSubfolder("sub", sub);
        tree.addFile(new FileEntry("a.txt", 1, null));

        Map<String, FileEntry> paths = TreeCodec.extractPathMap(tree);

        assertEquals(List.of("a.txt", "sub/inner/c.txt"), List.copyOf(paths.keySet()));
    }

    @Test
    void validatesIdentifierShapes() {
        assertTrue(TreeCodec.isValidObjectId("AgAD_BAAD-bqc"));
        assertFalse(TreeCodec.isValidObjectId("AgAD"));
        assertFalse(TreeCodec.isValidObjectId(null));
        assertTrue(TreeCodec.isValidMessageId(1L));
        assertFalse(TreeCodec.isValidMessageId(-4L));
        assertFalse(TreeCodec.isValidMessageId(null));
    }

    private static List<String> iterableToList(Iterator<String> names) {
        List<String> list = new ArrayList<>();
        names.forEachRemaining(list::add);
        return list;
    }
}
