package com.quikdb.api.resilience;

import com.quikdb.api.QuikdbApiApplication;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.CircuitOpenException;
import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.node.NodeStatus;
import com.quikdb.api.reward.RewardCalculatorService;
import com.quikdb.api.support.DatabaseCleaner;
import com.quikdb.api.support.InMemoryNodeDirectory;
import com.quikdb.api.support.MutableClock;
import com.quikdb.api.support.RewardTestConfiguration;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.RewardType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;

import static com.quikdb.api.support.TestAccounts.ADMIN;
import static com.quikdb.api.support.TestAccounts.STRANGER;
import static com.quikdb.api.support.TestAccounts.operator;
import static org.assertj.core.api.Assertions.*;

/**
 * Anomalous reward amounts trip the calculation breaker.
 */
@SpringBootTest(classes = QuikdbApiApplication.class)
@Import(RewardTestConfiguration.class)
@ActiveProfiles("test")
class AnomalyDetectionTest {

    @Autowired
    private AnomalyDetectorService anomalyDetector;

    @Autowired
    private CircuitBreakerService circuitBreaker;

    @Autowired
    private RewardCalculatorService calculator;

    @Autowired
    private AuditService auditService;

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
        nodeDirectory.register("node-1", NodeStatus.ACTIVE, operator(1));
        nodeDirectory.register("node-2", NodeStatus.ACTIVE, operator(2));
        anomalyDetector.recalibrate(ADMIN, RewardCalculatorService.AMOUNT_METRIC,
                BigInteger.valueOf(1_000), RewardCalculatorService.OPERATION);
    }

    @Test
    void rewardWithinThresholdLeavesBreakerClosed() {
        // exactly 50% over is not anomalous
        calculate(1, 1_500);

        assertThat(circuitBreaker.isTripped(RewardCalculatorService.OPERATION)).isFalse();
        assertThat(anomalyDetector.baseline(RewardCalculatorService.AMOUNT_METRIC).orElseThrow()
                .getLastIncreasePercent()).isEqualTo(50L);
    }

    @Test
    void anomalousRewardCompletesThenTripsBreaker() {
        String rewardId = calculate(1, 2_000);

        assertThat(rewardId).hasSize(64);
        assertThat(circuitBreaker.isTripped(RewardCalculatorService.OPERATION)).isTrue();
        assertThat(circuitBreaker.status(RewardCalculatorService.OPERATION).reason()).contains("100%");
        assertThat(auditService.eventsOfType(EventType.ANOMALY_DETECTED)).hasSize(1);
        assertThat(auditService.eventsOfType(EventType.CIRCUIT_TRIPPED)).singleElement()
                .satisfies(e -> assertThat(e.getActor()).isEqualTo(CircuitBreakerService.ANOMALY_DETECTOR));

        assertThatThrownBy(() -> calculate(2, 100)).isInstanceOf(CircuitOpenException.class);

        // the baseline only moves on recalibration
        assertThat(anomalyDetector.baseline(RewardCalculatorService.AMOUNT_METRIC).orElseThrow()
                .getBaselineValue()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(anomalyDetector.detectedAnomalies()).hasSize(1);
    }

    @Test
    void zeroBaselineNeverDetects() {
        anomalyDetector.recalibrate(ADMIN, RewardCalculatorService.AMOUNT_METRIC,
                BigInteger.ZERO, RewardCalculatorService.OPERATION);

        calculate(1, 9_000);

        assertThat(circuitBreaker.isTripped(RewardCalculatorService.OPERATION)).isFalse();
    }

    @Test
    void unknownMetricNeverDetects() {
        AnomalyDetectorService.AnomalyDetection detection =
                anomalyDetector.update("unknown.metric", BigInteger.valueOf(1_000_000));

        assertThat(detection.detected()).isFalse();
        assertThat(detection.baseline()).isNull();
    }

    @Test
    void increaseBeyondLongRangeStillDetects() {
        anomalyDetector.recalibrate(ADMIN, "treasury.outflow", BigInteger.ONE, RewardCalculatorService.OPERATION);

        AnomalyDetectorService.AnomalyDetection detection =
                anomalyDetector.update("treasury.outflow", new BigInteger("138350580552821633"));

        assertThat(detection.detected()).isTrue();
        assertThat(detection.increasePercent()).isEqualTo(Long.MAX_VALUE);
        assertThat(anomalyDetector.baseline("treasury.outflow").orElseThrow().isDetected()).isTrue();
    }

    @Test
    void recalibrationIsAdminOnly() {
        assertThatThrownBy(() -> anomalyDetector.recalibrate(STRANGER, RewardCalculatorService.AMOUNT_METRIC,
                BigInteger.ONE, RewardCalculatorService.OPERATION))
                .isInstanceOfSatisfying(RewardException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.AUTHORIZATION));
    }

    private String calculate(int operatorIndex, long amount) {
        return calculator.calculate(ADMIN, operator(operatorIndex), "node-" + operatorIndex,
                BigInteger.valueOf(amount), RewardType.UPTIME, 100, 100, 100, null);
    }
}
