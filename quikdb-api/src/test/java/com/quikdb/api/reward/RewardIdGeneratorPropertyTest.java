package com.quikdb.api.reward;

import com.quikdb.core.domain.RewardType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for content-derived reward identifiers.
 */
class RewardIdGeneratorPropertyTest {

    private static final String OPERATOR = "0x00000000000000000000000000000000000000a1";
    private static final Instant AT = Instant.ofEpochSecond(1_700_006_400L);

    private final RewardIdGenerator generator = new RewardIdGenerator();

    @Property(tries = 100)
    void identicalContentYieldsIdenticalId(
            @ForAll @LongRange(min = 1, max = 1_000_000_000L) long amount,
            @ForAll RewardType type) {

        String first = generator.generate(OPERATOR, "node-1", BigInteger.valueOf(amount), AT, type, "2024-01");
        String second = generator.generate(OPERATOR, "node-1", BigInteger.valueOf(amount), AT, type, "2024-01");

        assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]{64}");
    }

    @Property(tries = 100)
    void anyContentChangeYieldsDifferentId(
            @ForAll @LongRange(min = 1, max = 1_000_000_000L) long amount,
            @ForAll @LongRange(min = 1, max = 86_400) long laterBy) {

        BigInteger value = BigInteger.valueOf(amount);
        String base = generator.generate(OPERATOR, "node-1", value, AT, RewardType.UPTIME, "p");

        assertThat(generator.generate(OPERATOR, "node-1", value.add(BigInteger.ONE), AT, RewardType.UPTIME, "p"))
                .isNotEqualTo(base);
        assertThat(generator.generate(OPERATOR, "node-1", value, AT.plusSeconds(laterBy), RewardType.UPTIME, "p"))
                .isNotEqualTo(base);
        assertThat(generator.generate(OPERATOR, "node-2", value, AT, RewardType.UPTIME, "p"))
                .isNotEqualTo(base);
        assertThat(generator.generate(OPERATOR, "node-1", value, AT, RewardType.BONUS, "p"))
                .isNotEqualTo(base);
        assertThat(generator.generate(OPERATOR, "node-1", value, AT, RewardType.UPTIME, "q"))
                .isNotEqualTo(base);
    }

    @Example
    void operatorCaseDoesNotChangeId() {
        String lower = generator.generate(OPERATOR, "node-1", BigInteger.TEN, AT, RewardType.UPTIME, null);
        String upper = generator.generate(OPERATOR.toUpperCase().replace("0X", "0x"), "node-1",
                BigInteger.TEN, AT, RewardType.UPTIME, null);
        assertThat(upper).isEqualTo(lower);
    }
}
