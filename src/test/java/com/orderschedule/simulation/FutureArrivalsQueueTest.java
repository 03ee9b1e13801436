package com.orderschedule.simulation;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FutureArrivalsQueueTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 10);

    @Test
    void seed_ignoresZeroQuantityOrMissingDate() {
        FutureArrivalsQueue queue = new FutureArrivalsQueue();

        queue.seed(0.0, DAY);
        queue.seed(50.0, null);

        assertThat(queue.matureOn(DAY)).isEmpty();
        assertThat(queue.hasPendingAfter(DAY.minusDays(1))).isFalse();
    }

    @Test
    void matureOn_returnsEntriesOnceInInsertionOrder() {
        FutureArrivalsQueue queue = new FutureArrivalsQueue();
        queue.seed(200.0, DAY);
        queue.schedule(350.0, DAY);
        queue.schedule(100.0, DAY.plusDays(5));

        List<PendingArrival> matured = queue.matureOn(DAY);

        assertThat(matured).extracting(PendingArrival::quantity).containsExactly(200.0, 350.0);
        assertThat(matured).extracting(PendingArrival::source)
            .containsExactly(PendingArrival.Source.IN_TRANSIT, PendingArrival.Source.ORDER);
        assertThat(queue.matureOn(DAY)).isEmpty();
        assertThat(queue.hasPendingAfter(DAY)).isTrue();
    }

    @Test
    void hasPendingAfter_isStrictlyAfterTheGivenDate() {
        FutureArrivalsQueue queue = new FutureArrivalsQueue();
        queue.schedule(10.0, DAY);

        assertThat(queue.hasPendingAfter(DAY.minusDays(1))).isTrue();
        assertThat(queue.hasPendingAfter(DAY)).isFalse();
        assertThat(queue.hasPendingAfter(DAY.plusDays(1))).isFalse();
    }
}
