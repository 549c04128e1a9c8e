package com.quikdb.api.reward;

import com.quikdb.api.QuikdbApiApplication;
import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.governance.RewardPolicyService;
import com.quikdb.api.node.NodeStatus;
import com.quikdb.api.resilience.CircuitBreakerService;
import com.quikdb.api.resilience.RateLimiterService;
import com.quikdb.api.reward.RewardCalculatorService.CalculationRequest;
import com.quikdb.api.support.DatabaseCleaner;
import com.quikdb.api.support.InMemoryNodeDirectory;
import com.quikdb.api.support.MutableClock;
import com.quikdb.api.support.RewardTestConfiguration;
import com.quikdb.core.domain.RewardRecord;
import com.quikdb.core.domain.RewardType;
import com.quikdb.core.repository.RewardRecordRepository;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;
import java.util.Locale;

import static com.quikdb.api.support.TestAccounts.ADMIN;
import static com.quikdb.api.support.TestAccounts.STRANGER;
import static com.quikdb.api.support.TestAccounts.operator;
import static org.assertj.core.api.Assertions.*;

/**
 * Reward calculation against the test profile policy:
 * amounts in [1, 10000], daily cap 25000, monthly cap 60000, 60s interval.
 */
@SpringBootTest(classes = QuikdbApiApplication.class)
@Import(RewardTestConfiguration.class)
@ActiveProfiles("test")
class RewardCalculatorServiceTest {

    private static final String OPERATOR = operator(1);
    private static final String NODE = "node-1";

    @Autowired
    private RewardCalculatorService calculator;

    @Autowired
    private RewardStatisticsService statistics;

    @Autowired
    private RewardRecordRepository recordRepository;

    @Autowired
    private RewardPolicyService policyService;

    @Autowired
    private RateLimiterService rateLimiter;

    @Autowired
    private CircuitBreakerService circuitBreaker;

    @Autowired
    private InMemoryNodeDirectory nodeDirectory;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
        clock.reset();
        nodeDirectory.clear();
        nodeDirectory.register(NODE, NodeStatus.ACTIVE, OPERATOR);
        nodeDirectory.register("node-listed", NodeStatus.LISTED, OPERATOR);
        nodeDirectory.register("node-inactive", NodeStatus.INACTIVE, OPERATOR);
    }

    @Test
    void calculatedRecordReadsBackUnsettled() {
        String rewardId = calculator.calculate(ADMIN, OPERATOR, NODE, BigInteger.valueOf(1_000),
                RewardType.UPTIME, 90, 80, 70, "2023-11");

        RewardRecord record = statistics.reward(rewardId).orElseThrow();
        // (90*40 + 80*35 + 70*25) / 100 = 81
        assertThat(record.getOverallScore()).isEqualTo(81);
        assertThat(record.getBaseAmount()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(record.getAmount()).isEqualTo(BigInteger.valueOf(810));
        assertThat(record.getUptimeScore()).isEqualTo(90);
        assertThat(record.getPerformanceScore()).isEqualTo(80);
        assertThat(record.getQualityScore()).isEqualTo(70);
        assertThat(record.getRewardType()).isEqualTo(RewardType.UPTIME);
        assertThat(record.getOperator()).isEqualTo(OPERATOR);
        assertThat(record.getNodeId()).isEqualTo(NODE);
        assertThat(record.getPeriod()).isEqualTo("2023-11");
        assertThat(record.getCalculatedAt()).isEqualTo(MutableClock.START);
        assertThat(record.isDistributed()).isFalse();
        assertThat(record.getDistributionTimestamp()).isZero();

        assertThat(statistics.operatorSummary(OPERATOR).accruedToday()).isEqualTo(BigInteger.valueOf(810));
        assertThat(statistics.operatorSummary(OPERATOR).pendingAmount()).isEqualTo(BigInteger.valueOf(810));
    }

    @Test
    void listedNodesEarnRewards() {
        assertThatCode(() -> calculator.calculate(ADMIN, OPERATOR, "node-listed", BigInteger.valueOf(100),
                RewardType.STORAGE_PROVIDED, 100, 100, 100, null)).doesNotThrowAnyException();
    }

    @Test
    void invalidInputsAreRejectedAsValidationErrors() {
        expectValidation(() -> calculate("not-an-address", NODE, 100, 0, 50), "operator");
        expectValidation(() -> calculate(OPERATOR, "unknown-node", 100, 0, 50), "Node not found");
        expectValidation(() -> calculate(OPERATOR, "node-inactive", 100, 0, 50), "Node not active");
        expectValidation(() -> calculate(OPERATOR, NODE, 100, 0, 101), "uptime");
        expectValidation(() -> calculate(OPERATOR, NODE, 100, 6, 50), "reward type");
        expectValidation(() -> calculate(OPERATOR, NODE, 0, 0, 50), "Base amount");
        expectValidation(() -> calculate(OPERATOR, NODE, 10_001, 0, 50), "Base amount");
        // base 1 at score 80 truncates to 0, below the minimum
        expectValidation(() -> calculate(OPERATOR, NODE, 1, 0, 50), "Adjusted amount");

        assertThat(recordRepository.count()).isZero();
    }

    @Test
    void identifiersAreCheckedBeforeScores() {
        expectValidation(() -> calculate("bad", "unknown-node", 100, 9, 500), "operator");
        expectValidation(() -> calculate(OPERATOR, "unknown-node", 100, 9, 500), "Node not found");
        expectValidation(() -> calculate(OPERATOR, NODE, 100, 9, 500), "uptime");
        expectValidation(() -> calculate(OPERATOR, NODE, 0, 9, 50), "reward type");
    }

    @Test
    void secondRewardWithinIntervalIsTooRecent() {
        calculate(OPERATOR, NODE, 100, 1, 100);
        clock.advanceSeconds(59);

        assertThatThrownBy(() -> calculate(OPERATOR, NODE, 100, 1, 100))
                .isInstanceOfSatisfying(RewardException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.PRECONDITION);
                    assertThat(e.getMessage()).contains("too recent");
                });

        clock.advanceSeconds(1);
        assertThatCode(() -> calculate(OPERATOR, NODE, 100, 1, 100)).doesNotThrowAnyException();
        assertThat(recordRepository.count()).isEqualTo(2);
    }

    @Test
    void dailyCapIsNeverExceededAndRejectionLeavesBucketUnchanged() {
        calculate(OPERATOR, NODE, 10_000, 1, 100);
        clock.advanceSeconds(60);
        calculate(OPERATOR, NODE, 10_000, 1, 100);
        clock.advanceSeconds(60);

        assertThatThrownBy(() -> calculate(OPERATOR, NODE, 10_000, 1, 100))
                .isInstanceOfSatisfying(RewardException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.CAPACITY);
                    assertThat(e.getMessage()).contains("Daily reward cap exceeded");
                });
        assertThat(statistics.operatorSummary(OPERATOR).accruedToday()).isEqualTo(BigInteger.valueOf(20_000));

        // exactly filling the cap is allowed
        calculate(OPERATOR, NODE, 5_000, 1, 100);
        assertThat(statistics.operatorSummary(OPERATOR).accruedToday()).isEqualTo(BigInteger.valueOf(25_000));

        clock.advanceSeconds(86_400);
        assertThatCode(() -> calculate(OPERATOR, NODE, 10_000, 1, 100)).doesNotThrowAnyException();
        assertThat(statistics.operatorSummary(OPERATOR).accruedToday()).isEqualTo(BigInteger.valueOf(10_000));
    }

    @Test
    void addressCasingsShareOneLedger() {
        String lower = operator(0xabcdef);
        String upper = "0x" + lower.substring(2).toUpperCase(Locale.ROOT);
        String mixed = lower.substring(0, 36) + "AbCdEf";

        calculate(lower, NODE, 10_000, 1, 100);
        assertThatThrownBy(() -> calculate(upper, NODE, 10_000, 1, 100))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getMessage()).contains("Reward too recent"));

        clock.advanceSeconds(60);
        calculate(upper, NODE, 10_000, 1, 100);
        clock.advanceSeconds(60);
        assertThatThrownBy(() -> calculate(mixed, NODE, 10_000, 1, 100))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getMessage()).contains("Daily reward cap exceeded"));

        assertThat(statistics.operatorSummary(mixed).accruedToday()).isEqualTo(BigInteger.valueOf(20_000));
        assertThat(statistics.rewardHistory(upper))
                .hasSize(2)
                .allSatisfy(r -> assertThat(r.getOperator()).isEqualTo(lower));
    }

    @Test
    void monthlyCapSpansDays() {
        for (int day = 0; day < 3; day++) {
            clock.set(MutableClock.START.plusSeconds(day * 86_400L));
            calculate(OPERATOR, NODE, 10_000, 1, 100);
            clock.advanceSeconds(60);
            calculate(OPERATOR, NODE, 10_000, 1, 100);
        }
        assertThat(statistics.operatorSummary(OPERATOR).accruedThisMonth()).isEqualTo(BigInteger.valueOf(60_000));

        clock.set(MutableClock.START.plusSeconds(3 * 86_400L));
        assertThatThrownBy(() -> calculate(OPERATOR, NODE, 10_000, 1, 100))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getMessage()).contains("Monthly reward cap exceeded"));
        assertThat(statistics.operatorSummary(OPERATOR).accruedToday()).isZero();
    }

    @Test
    void identicalContentCollidesInsteadOfOverwriting() {
        policyService.updateRewardInterval(0, ADMIN);
        String first = calculate(OPERATOR, NODE, 100, 1, 100);

        assertThatThrownBy(() -> calculate(OPERATOR, NODE, 100, 1, 100))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.COLLISION));

        assertThat(recordRepository.count()).isEqualTo(1);
        assertThat(statistics.operatorSummary(OPERATOR).accruedToday()).isEqualTo(BigInteger.valueOf(100));
        assertThat(statistics.reward(first)).isPresent();
    }

    @Test
    void callerWithoutCapabilityIsRejected() {
        assertThatThrownBy(() -> calculator.calculate(STRANGER, OPERATOR, NODE, BigInteger.valueOf(100),
                RewardType.UPTIME, 100, 100, 100, null))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.AUTHORIZATION));
        assertThat(recordRepository.count()).isZero();
    }

    @Test
    void failedCallReleasesRateLimitSlotAndCountsAsBreakerFailure() {
        calculate(OPERATOR, NODE, 100, 1, 100);
        assertThatThrownBy(() -> calculate(OPERATOR, NODE, 100, 1, 100))
                .isInstanceOf(RewardException.class);

        assertThat(rateLimiter.remaining(ADMIN, RewardCalculatorService.OPERATION, 1_000, 3_600))
                .isEqualTo(999);
        CircuitBreakerService.BreakerStatus status = circuitBreaker.status(RewardCalculatorService.OPERATION);
        assertThat(status.successCount()).isEqualTo(1);
        assertThat(status.failureCount()).isEqualTo(1);
        assertThat(status.tripped()).isFalse();
    }

    private String calculate(String operator, String nodeId, long baseAmount, int rewardType, int uptime) {
        return calculator.calculate(ADMIN, new CalculationRequest(operator, nodeId, BigInteger.valueOf(baseAmount),
                rewardType, uptime, 100, 100, null));
    }

    private static void expectValidation(ThrowingCallable call, String messagePart) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(RewardException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.VALIDATION);
                    assertThat(e.getMessage()).containsIgnoringCase(messagePart);
                });
    }
}
