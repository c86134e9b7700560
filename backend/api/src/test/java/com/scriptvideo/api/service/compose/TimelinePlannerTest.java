package com.scriptvideo.api.service.compose;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelinePlannerTest {

    @Test
    void equalWeightsSplitEvenly() {
        assertThat(TimelinePlanner.allocate(List.of(1.0, 1.0, 1.0), 30_000))
                .containsExactly(10_000L, 10_000L, 10_000L);
    }

    @Test
    void remainderIsDistributedSoTotalIsExact() {
        List<Long> durations = TimelinePlanner.allocate(List.of(1.0, 1.0, 1.0), 10_000);

        assertThat(durations.stream().mapToLong(Long::longValue).sum()).isEqualTo(10_000);
        assertThat(durations).containsExactly(3_334L, 3_333L, 3_333L);
    }

    @Test
    void weightsAreProportional() {
        List<Long> durations = TimelinePlanner.allocate(List.of(1.0, 2.0, 3.0), 60_000);

        assertThat(durations).containsExactly(10_000L, 20_000L, 30_000L);
    }

    @Test
    void tinyWeightsAreRaisedToMinimumSceneLength() {
        List<Long> durations = TimelinePlanner.allocate(List.of(0.01, 10.0), 5_000);

        assertThat(durations.get(0)).isGreaterThanOrEqualTo(TimelinePlanner.MIN_SCENE_MILLIS);
        assertThat(durations.stream().mapToLong(Long::longValue).sum()).isEqualTo(5_000);
    }

    @Test
    void rejectsNonPositiveWeights() {
        assertThatThrownBy(() -> TimelinePlanner.allocate(List.of(1.0, 0.0), 1_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyInputGivesEmptyTimeline() {
        assertThat(TimelinePlanner.allocate(List.of(), 1_000)).isEmpty();
    }
}
