package com.quikdb.api.reward;

import com.quikdb.api.QuikdbApiApplication;
import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.node.NodeStatus;
import com.quikdb.api.reward.SlashingService.SlashResult;
import com.quikdb.api.support.DatabaseCleaner;
import com.quikdb.api.support.InMemoryNodeDirectory;
import com.quikdb.api.support.InMemoryRewardTokenGateway;
import com.quikdb.api.support.MutableClock;
import com.quikdb.api.support.RewardTestConfiguration;
import com.quikdb.core.domain.RewardType;
import com.quikdb.core.domain.SlashingRecord;
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

@SpringBootTest(classes = QuikdbApiApplication.class)
@Import(RewardTestConfiguration.class)
@ActiveProfiles("test")
class SlashingServiceTest {

    private static final String OPERATOR = operator(11);
    private static final String NODE = "node-11";

    @Autowired
    private SlashingService slashingService;

    @Autowired
    private RewardCalculatorService calculator;

    @Autowired
    private RewardDistributorService distributor;

    @Autowired
    private RewardStatisticsService statistics;

    @Autowired
    private InMemoryNodeDirectory nodeDirectory;

    @Autowired
    private InMemoryRewardTokenGateway tokenGateway;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
        clock.reset();
        nodeDirectory.clear();
        tokenGateway.reset();
        nodeDirectory.register(NODE, NodeStatus.ACTIVE, OPERATOR);

        // 1000 distributed, so at most 500 can be slashed under the default 50%
        String rewardId = calculator.calculate(ADMIN, OPERATOR, NODE, BigInteger.valueOf(1_000),
                RewardType.UPTIME, 100, 100, 100, null);
        distributor.distribute(ADMIN, rewardId);
        clock.advanceSeconds(10);
    }

    @Test
    void slashAboveShareOfDistributedIsExcessive() {
        assertThatThrownBy(() -> slash(BigInteger.valueOf(501)))
                .isInstanceOfSatisfying(RewardException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.CAPACITY);
                    assertThat(e.getMessage()).contains("Excessive slashing");
                });
        assertThat(statistics.operatorSummary(OPERATOR).totalSlashed()).isZero();
        assertThat(slashingService.slashingHistory(OPERATOR)).isEmpty();
    }

    @Test
    void slashReducesEntitlementAndStartsCooldown() {
        SlashResult result = slash(BigInteger.valueOf(500));

        assertThat(result.totalSlashed()).isEqualTo(BigInteger.valueOf(500));
        assertThat(result.overallScore()).isEqualTo(30);
        assertThat(result.eligibleAgainAt()).isEqualTo(MutableClock.START.plusSeconds(10 + 86_400));

        RewardStatisticsService.OperatorSummary summary = statistics.operatorSummary(OPERATOR);
        assertThat(summary.totalDistributed()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(summary.totalSlashed()).isEqualTo(BigInteger.valueOf(500));
        assertThat(summary.netEntitlement()).isEqualTo(BigInteger.valueOf(500));
        assertThat(summary.slashCount()).isEqualTo(1);
        assertThat(statistics.globalStatistics().totalSlashed()).isEqualTo(BigInteger.valueOf(500));

        assertThat(slashingService.slashingHistory(OPERATOR)).singleElement()
                .satisfies(r -> {
                    assertThat(r.getAmount()).isEqualTo(BigInteger.valueOf(500));
                    assertThat(r.getSlashedBy()).isEqualTo(ADMIN);
                    assertThat(r.getReason()).isEqualTo("missed heartbeats");
                });
        // no funds move
        assertThat(tokenGateway.payouts()).hasSize(1);
    }

    @Test
    void repeatedSlashInCooldownIsAllowedWithinTheCap() {
        slash(BigInteger.valueOf(500));
        clock.advanceSeconds(60);

        SlashResult second = slash(BigInteger.valueOf(100));

        assertThat(second.totalSlashed()).isEqualTo(BigInteger.valueOf(600));
        assertThat(slashingService.slashingHistory(OPERATOR))
                .extracting(SlashingRecord::getAmount)
                .containsExactly(BigInteger.valueOf(100), BigInteger.valueOf(500));
    }

    @Test
    void operatorIsIneligibleUntilCooldownElapses() {
        assertThat(slashingService.isEligibleForRewards(OPERATOR)).isTrue();

        slash(BigInteger.valueOf(200));
        assertThat(slashingService.isEligibleForRewards(OPERATOR)).isFalse();

        clock.advanceSeconds(86_399);
        assertThat(slashingService.isEligibleForRewards(OPERATOR)).isFalse();

        clock.advanceSeconds(1);
        assertThat(slashingService.isEligibleForRewards(OPERATOR)).isTrue();
    }

    @Test
    void calculationIsRefusedDuringCooldown() {
        slash(BigInteger.valueOf(200));
        clock.advanceSeconds(3_600);

        assertThatThrownBy(() -> calculator.calculate(ADMIN, OPERATOR, NODE, BigInteger.valueOf(100),
                RewardType.UPTIME, 100, 100, 100, null))
                .isInstanceOfSatisfying(RewardException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.PRECONDITION);
                    assertThat(e.getMessage()).contains("slashing cooldown");
                });

        clock.advanceSeconds(86_400);
        assertThatCode(() -> calculator.calculate(ADMIN, OPERATOR, NODE, BigInteger.valueOf(100),
                RewardType.UPTIME, 100, 100, 100, null)).doesNotThrowAnyException();
    }

    @Test
    void slashUnderAnotherCasingStartsTheSameCooldown() {
        String upper = "0x" + OPERATOR.substring(2).toUpperCase(Locale.ROOT);

        SlashResult result = slashingService.slash(ADMIN, upper, BigInteger.valueOf(200),
                "missed heartbeats", 30, 30, 30);

        assertThat(result.operator()).isEqualTo(OPERATOR);
        assertThat(slashingService.isEligibleForRewards(OPERATOR)).isFalse();
        assertThat(slashingService.isEligibleForRewards(upper)).isFalse();
        assertThat(slashingService.slashingHistory(OPERATOR)).hasSize(1);

        clock.advanceSeconds(3_600);
        assertThatThrownBy(() -> calculator.calculate(ADMIN, upper, NODE, BigInteger.valueOf(100),
                RewardType.UPTIME, 100, 100, 100, null))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getMessage()).contains("slashing cooldown"));
    }

    @Test
    void wellPerformingOperatorCannotBeSlashed() {
        // 70/70/70 scores exactly the threshold
        assertThatThrownBy(() -> slashingService.slash(ADMIN, OPERATOR, BigInteger.valueOf(10),
                "borderline", 70, 70, 70))
                .isInstanceOfSatisfying(RewardException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.PRECONDITION);
                    assertThat(e.getMessage()).contains("Slashing threshold not met");
                });
        assertThatCode(() -> slashingService.slash(ADMIN, OPERATOR, BigInteger.valueOf(10),
                "just below", 69, 70, 70)).doesNotThrowAnyException();
    }

    @Test
    void operatorWithoutDistributionsCannotBeSlashed() {
        assertThatThrownBy(() -> slashingService.slash(ADMIN, operator(12), BigInteger.ONE,
                "never paid", 0, 0, 0))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.CAPACITY));
    }

    @Test
    void invalidSlashInputsAreRejected() {
        assertThatThrownBy(() -> slashingService.slash(ADMIN, OPERATOR, BigInteger.ZERO, "r", 0, 0, 0))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.VALIDATION));
        assertThatThrownBy(() -> slashingService.slash(ADMIN, OPERATOR, BigInteger.TEN, " ", 0, 0, 0))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.VALIDATION));
        assertThatThrownBy(() -> slashingService.slash(ADMIN, "not-an-address", BigInteger.TEN, "r", 0, 0, 0))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.VALIDATION));
        assertThatThrownBy(() -> slashingService.slash(ADMIN, OPERATOR, BigInteger.TEN, "r", 101, 0, 0))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.VALIDATION));
    }

    @Test
    void callerWithoutCapabilityIsRejected() {
        assertThatThrownBy(() -> slashingService.slash(STRANGER, OPERATOR, BigInteger.TEN, "r", 0, 0, 0))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.AUTHORIZATION));
    }

    private SlashResult slash(BigInteger amount) {
        // 30/30/30 scores 30
        return slashingService.slash(ADMIN, OPERATOR, amount, "missed heartbeats", 30, 30, 30);
    }
}
