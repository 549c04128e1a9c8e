package com.quikdb.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Reward token (ERC-20 with a minter role) - Web3j wrapper.
 *
 * Solidity equivalent:
 * contract QuikDBToken is ERC20, AccessControl {
 *     bytes32 public constant MINTER_ROLE = keccak256("MINTER_ROLE");
 *     function mint(address to, uint256 amount) external onlyRole(MINTER_ROLE);
 *     function transfer(address to, uint256 amount) public returns (bool);
 *     function balanceOf(address account) public view returns (uint256);
 *     event Transfer(address indexed from, address indexed to, uint256 value);
 * }
 */
public class RewardTokenContract extends Contract {

    /**
     * The token is deployed separately; this wrapper only loads it by address.
     */
    public static final String BINARY = "";

    public static final String FUNC_MINT = "mint";
    public static final String FUNC_TRANSFER = "transfer";
    public static final String FUNC_BALANCEOF = "balanceOf";
    public static final String FUNC_DECIMALS = "decimals";

    public static final Event TRANSFER_EVENT = new Event("Transfer",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // from
                    new TypeReference<Address>(true) {},  // to
                    new TypeReference<Uint256>() {}       // value
            ));

    protected RewardTokenContract(String contractAddress, Web3j web3j, Credentials credentials,
                                  ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Mints new tokens to a recipient. Caller must hold the minter role.
     */
    public RemoteFunctionCall<TransactionReceipt> mint(String to, BigInteger amount) {
        final Function function = new Function(
                FUNC_MINT,
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Transfers tokens from the signing account to a recipient.
     */
    public RemoteFunctionCall<TransactionReceipt> transfer(String to, BigInteger amount) {
        final Function function = new Function(
                FUNC_TRANSFER,
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<BigInteger> balanceOf(String account) {
        final Function function = new Function(
                FUNC_BALANCEOF,
                Arrays.asList(new Address(account)),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public static RewardTokenContract load(String contractAddress, Web3j web3j,
                                           Credentials credentials, ContractGasProvider gasProvider) {
        return new RewardTokenContract(contractAddress, web3j, credentials, gasProvider);
    }
}
