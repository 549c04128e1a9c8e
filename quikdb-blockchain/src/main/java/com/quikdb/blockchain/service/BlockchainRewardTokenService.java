package com.quikdb.blockchain.service;

import com.quikdb.blockchain.contract.RewardTokenContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Service for paying rewards through the reward token contract.
 * Rewards are minted when the signer holds the minter role, otherwise
 * transferred out of the treasury account that signs the transactions.
 */
@Service
public class BlockchainRewardTokenService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainRewardTokenService.class);
    private final BlockchainConfig config;
    private RewardTokenContract contract;
    private Web3j web3j;

    public BlockchainRewardTokenService(BlockchainConfig config) {
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
            this.contract = RewardTokenContract.load(
                    config.getRewardTokenAddress(), web3j, credentials, gasProvider);
            log.info("Reward token contract initialized at {}", config.getRewardTokenAddress());
        } catch (Exception e) {
            log.error("Failed to initialize reward token contract", e);
        }
    }

    /**
     * Mints reward tokens to an operator.
     */
    public Optional<BlockchainTxResult> mint(String operator, BigInteger amount) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.mint(operator, amount).send();
            return Optional.of(toResult(receipt));
        } catch (Exception e) {
            log.error("Failed to mint {} reward tokens to {}", amount, operator, e);
            return Optional.empty();
        }
    }

    /**
     * Transfers reward tokens from the treasury to an operator.
     */
    public Optional<BlockchainTxResult> transfer(String operator, BigInteger amount) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.transfer(operator, amount).send();
            return Optional.of(toResult(receipt));
        } catch (Exception e) {
            log.error("Failed to transfer {} reward tokens to {}", amount, operator, e);
            return Optional.empty();
        }
    }

    /**
     * Token balance of the treasury account.
     */
    public Optional<BigInteger> treasuryBalance() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(contract.balanceOf(config.getTreasuryAddress()).send());
        } catch (Exception e) {
            log.error("Failed to read treasury balance for {}", config.getTreasuryAddress(), e);
            return Optional.empty();
        }
    }

    public boolean isMintRewards() {
        return config.isMintRewards();
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    private BlockchainTxResult toResult(TransactionReceipt receipt) {
        return new BlockchainTxResult(
                receipt.getTransactionHash(),
                receipt.getBlockNumber(),
                receipt.isStatusOK()
        );
    }

    public record BlockchainTxResult(String txHash, BigInteger blockNumber, boolean success) {}
}
