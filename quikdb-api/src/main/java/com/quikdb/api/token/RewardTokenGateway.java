package com.quikdb.api.token;

import java.math.BigInteger;

/**
 * Moves reward tokens to operators.
 */
public interface RewardTokenGateway {

    /**
     * Mint-based assets have no balance to check before paying out.
     */
    boolean isMintable();

    /**
     * Balance of the paying account.
     *
     * @throws TokenPayoutException if the balance cannot be read
     */
    BigInteger availableBalance();

    /**
     * Mints or transfers {@code amount} to the operator.
     *
     * @return transaction reference of the payout
     * @throws TokenPayoutException if the payout did not succeed
     */
    String payout(String operator, BigInteger amount);
}
