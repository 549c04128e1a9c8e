package com.quikdb.api.node;

import com.quikdb.blockchain.service.BlockchainNodeRegistryService;
import com.quikdb.blockchain.service.BlockchainNodeRegistryService.OnChainNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Node directory backed by the on-chain node registry.
 */
@Component
public class BlockchainNodeDirectory implements NodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(BlockchainNodeDirectory.class);

    private final BlockchainNodeRegistryService registryService;

    public BlockchainNodeDirectory(BlockchainNodeRegistryService registryService) {
        this.registryService = registryService;
        if (!registryService.isEnabled()) {
            log.warn("Node registry not connected; every node lookup will miss");
        }
    }

    @Override
    public boolean nodeExists(String nodeId) {
        return registryService.nodeExists(nodeId).orElse(false);
    }

    @Override
    public Optional<NodeInfo> getNodeInfo(String nodeId) {
        return registryService.getNode(nodeId).map(BlockchainNodeDirectory::toNodeInfo);
    }

    private static NodeInfo toNodeInfo(OnChainNode node) {
        return new NodeInfo(node.nodeId(), NodeStatus.valueOf(node.status().name()),
                node.operator(), node.capacity());
    }
}
