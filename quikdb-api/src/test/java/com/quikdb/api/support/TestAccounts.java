package com.quikdb.api.support;

/**
 * Account identifiers used across the service tests.
 */
public final class TestAccounts {

    /** Both admins are listed under quikdb.rewards.admins in application-test.yml. */
    public static final String ADMIN = "admin";
    public static final String SECOND_ADMIN = "admin2";
    public static final String STRANGER = "stranger";

    private TestAccounts() {}

    public static String operator(int n) {
        return String.format("0x%040x", n);
    }
}
