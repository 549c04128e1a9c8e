package com.quikdb.api.node;

import java.util.Optional;

/**
 * Lookup of registered nodes. Registration itself lives elsewhere.
 */
public interface NodeDirectory {

    boolean nodeExists(String nodeId);

    Optional<NodeInfo> getNodeInfo(String nodeId);
}
