package com.quikdb.api.token;

import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;

/**
 * The reward token could not be paid out or its balance could not be read.
 */
public class TokenPayoutException extends RewardException {

    public TokenPayoutException(String message) {
        super(ErrorCategory.PRECONDITION, message);
    }

    public TokenPayoutException(String message, Throwable cause) {
        super(ErrorCategory.PRECONDITION, message, cause);
    }
}
