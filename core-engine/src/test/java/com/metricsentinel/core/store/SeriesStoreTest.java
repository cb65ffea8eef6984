package com.metricsentinel.core.store;

import com.metricsentinel.core.MutableClock;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesStore}.
 */
class SeriesStoreTest {

    private static final SeriesKey KEY = SeriesKey.of("org-1", "api-gateway", "response_time");

    private MutableClock clock;
    private SeriesStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new SeriesStore(1000, clock);
    }

    @Test
    @DisplayName("Should keep only the most recent points once capacity is reached")
    void shouldEvictOldestFirst() {
        for (int i = 0; i < 1005; i++) {
            store.addDataPoint(KEY, i, null);
        }

        List<DataPoint> series = store.snapshot(KEY);
        assertThat(series).hasSize(1000);
        assertThat(series.get(0).getValue()).isEqualTo(5);
        assertThat(series.get(999).getValue()).isEqualTo(1004);
    }

    @Test
    @DisplayName("Should stamp points with the clock and keep metadata")
    void shouldStampAndKeepMetadata() {
        store.addDataPoint(KEY, 12.5, Map.of("region", "eu-west-1"));

        DataPoint point = store.snapshot(KEY).get(0);
        assertThat(point.getTimestamp()).isEqualTo(clock.instant());
        assertThat(point.getMetadata()).containsEntry("region", "eu-west-1");
    }

    @Test
    @DisplayName("Should drop non-finite values")
    void shouldDropNonFiniteValues() {
        assertThat(store.addDataPoint(KEY, Double.NaN, null)).isFalse();
        assertThat(store.addDataPoint(KEY, Double.POSITIVE_INFINITY, null)).isFalse();

        assertThat(store.size(KEY)).isZero();
    }

    @Test
    @DisplayName("Should hand out immutable snapshots")
    void shouldReturnImmutableSnapshot() {
        store.addDataPoint(KEY, 1, null);
        List<DataPoint> snapshot = store.snapshot(KEY);

        store.addDataPoint(KEY, 2, null);

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(snapshot::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should return an empty snapshot for an unknown series")
    void shouldReturnEmptyForUnknownKey() {
        assertThat(store.snapshot(SeriesKey.of("org-1", "db", "cpu"))).isEmpty();
        assertThat(store.keys()).isEmpty();
    }

    @Test
    @DisplayName("Should remove points older than the retention age")
    void shouldApplyRetention() {
        store.addDataPoint(KEY, 1, null);
        clock.advance(Duration.ofDays(2));
        store.addDataPoint(KEY, 2, null);
        clock.advance(Duration.ofDays(29));

        int removed = store.retentionSweep(Duration.ofDays(30));

        assertThat(removed).isEqualTo(1);
        assertThat(store.snapshot(KEY)).extracting(DataPoint::getValue).containsExactly(2.0);
        assertThat(store.totalPoints()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new SeriesStore(0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should never exceed capacity under concurrent appends")
    void shouldStayBoundedUnderConcurrentAppends() throws InterruptedException {
        SeriesStore small = new SeriesStore(100, clock);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 500; i++) {
                    small.addDataPoint(KEY, i, null);
                    assertThat(small.snapshot(KEY).size()).isLessThanOrEqualTo(100);
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(small.size(KEY)).isEqualTo(100);
    }
}
