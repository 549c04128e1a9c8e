package com.quikdb.api.token;

import com.quikdb.blockchain.service.BlockchainRewardTokenService;
import com.quikdb.blockchain.service.BlockchainRewardTokenService.BlockchainTxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Pays rewards through the reward token contract.
 */
@Component
public class BlockchainRewardTokenGateway implements RewardTokenGateway {

    private static final Logger log = LoggerFactory.getLogger(BlockchainRewardTokenGateway.class);

    private final BlockchainRewardTokenService tokenService;

    public BlockchainRewardTokenGateway(BlockchainRewardTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public boolean isMintable() {
        return tokenService.isMintRewards();
    }

    @Override
    public BigInteger availableBalance() {
        return tokenService.treasuryBalance()
                .orElseThrow(() -> new TokenPayoutException("Treasury balance unavailable"));
    }

    @Override
    public String payout(String operator, BigInteger amount) {
        if (!tokenService.isEnabled()) {
            throw new TokenPayoutException("Reward token contract not connected");
        }
        Optional<BlockchainTxResult> result = isMintable()
                ? tokenService.mint(operator, amount)
                : tokenService.transfer(operator, amount);
        BlockchainTxResult tx = result
                .orElseThrow(() -> new TokenPayoutException("Payout of " + amount + " to " + operator + " failed"));
        if (!tx.success()) {
            throw new TokenPayoutException("Payout transaction reverted: " + tx.txHash());
        }
        log.info("Paid {} to {} in tx {}", amount, operator, tx.txHash());
        return tx.txHash();
    }
}
