package com.example.channeluploader.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts trees to and from the exchange form stored by the index server:
 * <pre>
 * {"files": [{"fileName", "fileSize", "fileId", "messageId"}], "subfolders": {"name": {...}}}
 * </pre>
 * Local paths and transient flags never leave the process. Every recursive walk stops at
 * {@link #MAX_DEPTH} with a {@link TreeFormatException}.
 */
public final class TreeCodec {
    public static final int MAX_DEPTH = 50;
    static final int MIN_OBJECT_ID_LENGTH = 10;

    private static final String FILES = "files";
    private static final String SUBFOLDERS = "subfolders";
    private static final String FILE_NAME = "fileName";
    private static final String FILE_SIZE = "fileSize";
    private static final String FILE_ID = "fileId";
    private static final String MESSAGE_ID = "messageId";
    private static final Pattern OBJECT_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final ObjectMapper mapper;

    public TreeCodec() {
        this(new ObjectMapper());
    }

    public TreeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode serialize(TreeNode tree) {
        return serializeNode(tree, "", 0);
    }

    public String toJson(TreeNode tree) {
        try {
            return mapper.writeValueAsString(serialize(tree));
        } catch (JsonProcessingException ex) {
            throw new TreeFormatException("Failed to write tree as JSON", ex);
        }
    }

    public TreeNode deserialize(JsonNode node) {
        return deserializeNode(node, "", 0);
    }

    public TreeNode fromJson(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new TreeFormatException("Tree is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        return deserialize(node);
    }

    /**
     * Flattens a tree into relative path to entry, in scan order. Paths use '/' as the
     * separator regardless of platform.
     */
    public static Map<String, FileEntry> extractPathMap(TreeNode tree) {
        Map<String, FileEntry> paths = new LinkedHashMap<>();
        collectPaths(tree, "", 0, paths);
        return paths;
    }

    public static String childPath(String parent, String name) {
        return parent.isEmpty() ? name : parent + "/" + name;
    }

    public static boolean isValidObjectId(String objectId) {
        return objectId != null
                && objectId.length() >= MIN_OBJECT_ID_LENGTH
                && OBJECT_ID.matcher(objectId).matches();
    }

    public static boolean isValidMessageId(Long messageId) {
        return messageId != null && messageId > 0;
    }

    static void checkDepth(int depth, String path) {
        if (depth > MAX_DEPTH) {
            throw new TreeFormatException("Tree exceeds maximum depth of " + MAX_DEPTH + " at '" + path + "'");
        }
    }

    private static void collectPaths(TreeNode node, String path, int depth, Map<String, FileEntry> paths) {
        checkDepth(depth, path);
        for (FileEntry file : node.files()) {
            paths.put(childPath(path, file.name()), file);
        }
        for (Map.Entry<String, TreeNode> sub : node.subfolders().entrySet()) {
            collectPaths(sub.getValue(), childPath(path, sub.getKey()), depth + 1, paths);
        }
    }

    private ObjectNode serializeNode(TreeNode node, String path, int depth) {
        checkDepth(depth, path);
        ObjectNode json = mapper.createObjectNode();
        ArrayNode files = json.putArray(FILES);
        for (FileEntry file : node.files()) {
            String filePath = childPath(path, file.name());
            ObjectNode item = files.addObject();
            item.put(FILE_NAME, file.name());
            item.put(FILE_SIZE, file.size());
            if (file.hasRemote()) {
                if (!isValidObjectId(file.remoteObjectId())) {
                    throw new TreeFormatException("Invalid fileId for '" + filePath + "'");
                }
                if (!isValidMessageId(file.remoteMessageId())) {
                    throw new TreeFormatException("Invalid messageId for '" + filePath + "'");
                }
                item.put(FILE_ID, file.remoteObjectId());
                item.put(MESSAGE_ID, file.remoteMessageId());
            } else {
                item.putNull(FILE_ID);
                item.putNull(MESSAGE_ID);
            }
        }
        ObjectNode subfolders = json.putObject(SUBFOLDERS);
        for (Map.Entry<String, TreeNode> sub : node.subfolders().entrySet()) {
            subfolders.set(sub.getKey(), serializeNode(sub.getValue(), childPath(path, sub.getKey()), depth + 1));
        }
        return json;
    }

    private TreeNode deserializeNode(JsonNode json, String path, int depth) {
        checkDepth(depth, path);
        String where = path.isEmpty() ? "root" : "'" + path + "'";
        if (json == null || !json.isObject()) {
            throw new TreeFormatException("Folder at " + where + " is not an object");
        }
        JsonNode files = json.get(FILES);
        JsonNode subfolders = json.get(SUBFOLDERS);
        if (files == null || subfolders == null) {
            throw new TreeFormatException("Folder at " + where + " must contain both 'files' and 'subfolders'");
        }
        if (!files.isArray()) {
            throw new TreeFormatException("'files' at " + where + " must be an array");
        }
        if (!subfolders.isObject()) {
            throw new TreeFormatException("'subfolders' at " + where + " must be an object");
        }

        TreeNode node = new TreeNode();
        for (JsonNode item : files) {
            node.addFile(deserializeFile(item, where));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = subfolders.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> sub = fields.next();
            node.putSubfolder(sub.getKey(), deserializeNode(sub.getValue(), childPath(path, sub.getKey()), depth + 1));
        }
        return node;
    }

    private FileEntry deserializeFile(JsonNode item, String where) {
        if (!item.isObject()) {
            throw new TreeFormatException("File entry at " + where + " is not an object");
        }
        JsonNode name = item.get(FILE_NAME);
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            throw new TreeFormatException("File entry at " + where + " has no fileName");
        }
        String fileName = name.asText();
        Optional<String> problem = NameValidator.validateFileName(fileName);
        if (problem.isPresent()) {
            throw new TreeFormatException("Invalid fileName '" + fileName + "' at " + where + ": " + problem.get());
        }

        JsonNode size = item.get(FILE_SIZE);
        long fileSize = 0;
        if (size != null && !size.isNull()) {
            if (!size.canConvertToLong() || !size.isIntegralNumber() || size.asLong() < 0) {
                throw new TreeFormatException("Invalid fileSize for '" + fileName + "'");
            }
            fileSize = size.asLong();
        }

        String objectId = null;
        JsonNode fileId = item.get(FILE_ID);
        if (fileId != null && !fileId.isNull()) {
            if (!fileId.isTextual() || !isValidObjectId(fileId.asText())) {
                throw new TreeFormatException("Invalid fileId for '" + fileName + "'");
            }
            objectId = fileId.asText();
        }

        Long messageId = null;
        JsonNode message = item.get(MESSAGE_ID);
        if (message != null && !message.isNull()) {
            if (!message.isIntegralNumber() || !message.canConvertToLong() || !isValidMessageId(message.asLong())) {
                throw new TreeFormatException("Invalid messageId for '" + fileName + "'");
            }
            messageId = message.asLong();
        }
        return FileEntry.remote(fileName, fileSize, objectId, messageId);
    }
}
