package com.quikdb.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Node registry - Web3j wrapper for the read side of the node directory.
 *
 * Solidity equivalent:
 * contract NodeLogic {
 *     function nodeExists(string nodeId) external view returns (bool);
 *     function getNodeStatus(string nodeId) external view
 *         returns (address operator, uint8 status, uint256 capacity, uint256 registeredAt);
 * }
 */
public class NodeRegistryContract extends Contract {

    public static final String BINARY = "";

    public static final String FUNC_NODEEXISTS = "nodeExists";
    public static final String FUNC_GETNODESTATUS = "getNodeStatus";

    protected NodeRegistryContract(String contractAddress, Web3j web3j, Credentials credentials,
                                   ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<Boolean> nodeExists(String nodeId) {
        final Function function = new Function(
                FUNC_NODEEXISTS,
                Arrays.asList(new Utf8String(nodeId)),
                Arrays.asList(new TypeReference<Bool>() {}));
        return executeRemoteCallSingleValueReturn(function, Boolean.class);
    }

    /**
     * Raw status tuple: operator address, status code, capacity, registration time.
     */
    public RemoteFunctionCall<List<Type>> getNodeStatus(String nodeId) {
        final Function function = new Function(
                FUNC_GETNODESTATUS,
                Arrays.asList(new Utf8String(nodeId)),
                Arrays.asList(
                        new TypeReference<Address>() {},   // operator
                        new TypeReference<Uint8>() {},     // status
                        new TypeReference<Uint256>() {},   // capacity
                        new TypeReference<Uint256>() {}    // registeredAt
                ));
        return executeRemoteCallMultipleValueReturn(function);
    }

    public static NodeRegistryContract load(String contractAddress, Web3j web3j,
                                            Credentials credentials, ContractGasProvider gasProvider) {
        return new NodeRegistryContract(contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Node status codes matching the registry enum.
     */
    public enum NodeStatus {
        PENDING(0),
        ACTIVE(1),
        INACTIVE(2),
        MAINTENANCE(3),
        SUSPENDED(4),
        DEREGISTERED(5),
        LISTED(6),
        OFFLINE(7);

        private final int value;

        NodeStatus(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }

        public static NodeStatus fromValue(BigInteger value) {
            int intValue = value.intValue();
            for (NodeStatus status : values()) {
                if (status.value == intValue) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown node status: " + value);
        }
    }
}
