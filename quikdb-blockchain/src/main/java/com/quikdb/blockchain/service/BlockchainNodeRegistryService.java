package com.quikdb.blockchain.service;

import com.quikdb.blockchain.contract.NodeRegistryContract;
import com.quikdb.blockchain.contract.NodeRegistryContract.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the on-chain node registry.
 */
@Service
public class BlockchainNodeRegistryService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainNodeRegistryService.class);
    private final BlockchainConfig config;
    private NodeRegistryContract contract;
    private Web3j web3j;

    public BlockchainNodeRegistryService(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeContract();
        }
    }

    private void initializeContract() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            this.contract = NodeRegistryContract.load(
                    config.getNodeRegistryAddress(), web3j, credentials, gasProvider);
            log.info("Node registry contract initialized at {}", config.getNodeRegistryAddress());
        } catch (Exception e) {
            log.error("Failed to initialize node registry contract", e);
        }
    }

    public Optional<Boolean> nodeExists(String nodeId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(contract.nodeExists(nodeId).send());
        } catch (Exception e) {
            log.error("Failed to check node {} on blockchain", nodeId, e);
            return Optional.empty();
        }
    }

    public Optional<OnChainNode> getNode(String nodeId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            List<Type> values = contract.getNodeStatus(nodeId).send();
            return Optional.of(decode(nodeId, values));
        } catch (Exception e) {
            log.error("Failed to read node {} from blockchain", nodeId, e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    public static OnChainNode decode(String nodeId, List<Type> values) {
        if (values.size() < 4) {
            throw new IllegalArgumentException("Unexpected node status tuple of size " + values.size());
        }
        String operator = (String) values.get(0).getValue();
        BigInteger status = (BigInteger) values.get(1).getValue();
        BigInteger capacity = (BigInteger) values.get(2).getValue();
        BigInteger registeredAt = (BigInteger) values.get(3).getValue();
        return new OnChainNode(nodeId, operator, NodeStatus.fromValue(status), capacity, registeredAt.longValue());
    }

    public record OnChainNode(String nodeId, String operator, NodeStatus status,
                              BigInteger capacity, long registeredAt) {}
}
