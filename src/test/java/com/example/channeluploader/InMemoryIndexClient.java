package com.example.channeluploader;

import com.example.channeluploader.remote.BotStatus;
import com.example.channeluploader.remote.IndexClient;
import com.example.channeluploader.remote.PersistReceipt;
import com.example.channeluploader.remote.RemoteResult;
import com.example.channeluploader.tree.TreeCodec;
import com.example.channeluploader.tree.TreeNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Index server double that stores trees in their exchange form, keyed by token.
 */
final class InMemoryIndexClient implements IndexClient {
    private final TreeCodec codec = new TreeCodec();
    private final Map<String, String> stored = new HashMap<>();
    private int persistCalls;

    @Override
    public RemoteResult<Boolean> probeConnectivity() {
        return RemoteResult.success(Boolean.TRUE);
    }

    @Override
    public RemoteResult<BotStatus> fetchStatus(String identityToken) {
        if (!stored.containsKey(identityToken)) {
            return RemoteResult.notFound("No bot registered for this token");
        }
        return RemoteResult.success(new BotStatus("active", "bot_1", null, false));
    }

    @Override
    public RemoteResult<TreeNode> fetchTree(String identityToken) {
        String json = stored.get(identityToken);
        if (json == null) {
            return RemoteResult.notFound("No existing metadata found");
        }
        return RemoteResult.success(codec.fromJson(json));
    }

    @Override
    public RemoteResult<PersistReceipt> persistTree(String identityToken, String destinationId, String identity, TreeNode tree) {
        persistCalls++;
        boolean update = stored.containsKey(identityToken);
        stored.put(identityToken, codec.toJson(tree));
        return RemoteResult.success(new PersistReceipt("bot_1", "active", update ? "Metadata updated" : "Metadata stored", update, null));
    }

    void store(String identityToken, TreeNode tree) {
        stored.put(identityToken, codec.toJson(tree));
    }

    TreeNode storedTree(String identityToken) {
        return codec.fromJson(stored.get(identityToken));
    }

    int persistCalls() {
        return persistCalls;
    }

    @Override
    public void close() {
    }
}
