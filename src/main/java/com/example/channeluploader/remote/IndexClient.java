package com.example.channeluploader.remote;

import com.example.channeluploader.tree.TreeNode;

/**
 * Metadata index server that stores the tree of each bot between runs. Methods report
 * failures through {@link RemoteResult} and do not throw.
 */
public interface IndexClient extends AutoCloseable {

    RemoteResult<Boolean> probeConnectivity();

    RemoteResult<BotStatus> fetchStatus(String identityToken);

    /**
     * Returns the persisted tree, or {@link RemoteResult.Kind#NOT_FOUND} when nothing has
     * been stored yet for this token.
     */
    RemoteResult<TreeNode> fetchTree(String identityToken);

    RemoteResult<PersistReceipt> persistTree(String identityToken, String destinationId, String identity, TreeNode tree);

    @Override
    void close();
}
