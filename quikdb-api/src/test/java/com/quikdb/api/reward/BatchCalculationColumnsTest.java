package com.quikdb.api.reward;

import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.reward.BatchCoordinatorService.BatchCalculationColumns;
import com.quikdb.api.reward.RewardCalculatorService.CalculationRequest;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BatchCalculationColumnsTest {

    @Test
    void matchingColumnsBecomeRequestsInOrder() {
        BatchCalculationColumns columns = new BatchCalculationColumns(
                List.of("0xa", "0xb"),
                List.of("node-a", "node-b"),
                List.of(BigInteger.valueOf(100), BigInteger.valueOf(200)),
                List.of(0, 5),
                List.of(90, 80),
                List.of(70, 60),
                List.of(50, 40),
                List.of("p1", "p2"));

        List<CalculationRequest> requests = columns.toRequests();

        assertThat(requests).containsExactly(
                new CalculationRequest("0xa", "node-a", BigInteger.valueOf(100), 0, 90, 70, 50, "p1"),
                new CalculationRequest("0xb", "node-b", BigInteger.valueOf(200), 5, 80, 60, 40, "p2"));
    }

    @Test
    void anyShortColumnRejectsTheWholeBatch() {
        BatchCalculationColumns columns = new BatchCalculationColumns(
                List.of("0xa", "0xb"),
                List.of("node-a", "node-b"),
                List.of(BigInteger.valueOf(100), BigInteger.valueOf(200)),
                List.of(0, 5),
                List.of(90),
                List.of(70, 60),
                List.of(50, 40),
                List.of("p1", "p2"));

        assertThatThrownBy(columns::toRequests)
                .isInstanceOf(RewardException.class)
                .hasMessageContaining("length mismatch")
                .satisfies(e -> assertThat(((RewardException) e).getCategory()).isEqualTo(ErrorCategory.VALIDATION));
    }

    @Test
    void missingColumnCountsAsMismatch() {
        BatchCalculationColumns columns = new BatchCalculationColumns(
                List.of("0xa"), List.of("node-a"), List.of(BigInteger.ONE),
                List.of(0), List.of(90), List.of(70), List.of(50), null);

        assertThatThrownBy(columns::toRequests).hasMessageContaining("length mismatch");
    }
}
