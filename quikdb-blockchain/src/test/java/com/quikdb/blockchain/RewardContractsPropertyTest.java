package com.quikdb.blockchain;

import com.quikdb.blockchain.contract.NodeRegistryContract.NodeStatus;
import com.quikdb.blockchain.service.BlockchainConfig;
import com.quikdb.blockchain.service.BlockchainNodeRegistryService;
import com.quikdb.blockchain.service.BlockchainRewardTokenService;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the reward token and node registry bindings.
 */
class RewardContractsPropertyTest {

    private static final String OPERATOR = "0x00000000000000000000000000000000000000a1";

    @Property(tries = 50)
    void nodeStatusRoundTripsThroughContractValue(@ForAll NodeStatus status) {
        assertThat(NodeStatus.fromValue(BigInteger.valueOf(status.getValue()))).isEqualTo(status);
    }

    @Property(tries = 50)
    void unknownNodeStatusValuesAreRejected(@ForAll @IntRange(min = 8, max = 255) int value) {
        assertThatThrownBy(() -> NodeStatus.fromValue(BigInteger.valueOf(value)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Property(tries = 50)
    void nodeTupleDecodesIntoOnChainNode(
            @ForAll @IntRange(min = 0, max = 7) int statusValue,
            @ForAll @LongRange(min = 0, max = 1_000_000_000L) long capacity,
            @ForAll @LongRange(min = 1, max = 4_000_000_000L) long registeredAt) {

        List<Type> values = List.of(
                new Address(OPERATOR),
                new Uint8(BigInteger.valueOf(statusValue)),
                new Uint256(BigInteger.valueOf(capacity)),
                new Uint256(BigInteger.valueOf(registeredAt)));

        BlockchainNodeRegistryService.OnChainNode node =
                BlockchainNodeRegistryService.decode("node-1", values);

        assertThat(node.nodeId()).isEqualTo("node-1");
        assertThat(node.operator()).isEqualToIgnoringCase(OPERATOR);
        assertThat(node.status().getValue()).isEqualTo(statusValue);
        assertThat(node.capacity()).isEqualTo(BigInteger.valueOf(capacity));
        assertThat(node.registeredAt()).isEqualTo(registeredAt);
    }

    @Example
    void truncatedNodeTupleIsRejected() {
        List<Type> values = List.of(new Address(OPERATOR), new Uint8(BigInteger.ONE));
        assertThatThrownBy(() -> BlockchainNodeRegistryService.decode("node-1", values))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void disabledServicesReturnEmptyResults() {
        BlockchainConfig config = new BlockchainConfig();
        assertThat(config.isEnabled()).isFalse();

        BlockchainRewardTokenService token = new BlockchainRewardTokenService(config);
        BlockchainNodeRegistryService registry = new BlockchainNodeRegistryService(config);

        assertThat(token.isEnabled()).isFalse();
        assertThat(token.mint(OPERATOR, BigInteger.TEN)).isEmpty();
        assertThat(token.transfer(OPERATOR, BigInteger.TEN)).isEmpty();
        assertThat(token.treasuryBalance()).isEmpty();
        assertThat(registry.isEnabled()).isFalse();
        assertThat(registry.nodeExists("node-1")).isEmpty();
        assertThat(registry.getNode("node-1")).isEmpty();
    }
}
