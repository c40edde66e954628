package com.clauselens.infrastructure.analysis.risk;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskAggregatorTest {

    private RiskAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new RiskAggregator();
    }

    @Test
    @DisplayName("no scores aggregate to zero")
    void empty() {
        assertThat(aggregator.aggregate(List.of())).isZero();
        assertThat(aggregator.aggregate(null)).isZero();
    }

    @Test
    @DisplayName("equal scores aggregate to themselves")
    void uniform() {
        assertThat(aggregator.aggregate(List.of(80, 80))).isEqualTo(80);
        assertThat(aggregator.aggregate(List.of(0, 0, 0))).isZero();
    }

    @Test
    @DisplayName("a critical clause weighs double")
    void severityWeighting() {
        // (10 * 1.0 + 90 * 2.0) / 3.0 = 63.33
        assertThat(aggregator.aggregate(List.of(10, 90))).isEqualTo(63);
    }

    @Test
    @DisplayName("missing scores are ignored")
    void ignoresNulls() {
        assertThat(aggregator.aggregate(Arrays.asList(null, 40, null))).isEqualTo(40);
    }

    @Test
    @DisplayName("result stays within the input range")
    void bounded() {
        List<Integer> scores = List.of(5, 49, 50, 74, 75, 100);
        int result = aggregator.aggregate(scores);

        assertThat(result).isBetween(5, 100);
    }

    @Test
    @DisplayName("weight tiers start at 50 and 75")
    void weights() {
        assertThat(RiskAggregator.weightOf(49)).isEqualTo(1.0);
        assertThat(RiskAggregator.weightOf(50)).isEqualTo(1.5);
        assertThat(RiskAggregator.weightOf(74)).isEqualTo(1.5);
        assertThat(RiskAggregator.weightOf(75)).isEqualTo(2.0);
    }
}
