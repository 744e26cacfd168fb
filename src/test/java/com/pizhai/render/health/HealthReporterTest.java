package com.pizhai.render.health;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.pizhai.render.pool.BrowserInstancePool;
import com.pizhai.render.pool.PoolStatistics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class HealthReporterTest {

    @Mock
    private BrowserInstancePool pool;

    private static PoolStatistics stats(int total, int inUse, int waiting, boolean shutdown) {
        return new PoolStatistics(total, inUse, waiting, 0, 1, 5, total, shutdown);
    }

    @Test
    public void statusFollowsPoolState() {
        assertThat(HealthReporter.statusOf(stats(2, 1, 0, false))).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthReporter.statusOf(stats(0, 0, 0, false))).isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthReporter.statusOf(stats(5, 5, 3, false))).isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthReporter.statusOf(stats(2, 0, 0, true))).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    public void reportSerializesPoolAndMemory() {
        when(pool.statistics()).thenReturn(stats(3, 2, 0, false));
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

        HealthReport report = new HealthReporter(pool, clock).report();

        assertThat(report.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.getTimestamp()).isEqualTo(1_700_000_000_000L);
        assertThat(report.getUptimeMillis()).isPositive();

        JsonObject json = JsonParser.parseString(report.toJson()).getAsJsonObject();
        assertThat(json.get("status").getAsString()).isEqualTo("healthy");
        assertThat(json.get("timestamp").getAsLong()).isEqualTo(1_700_000_000_000L);

        JsonObject browserPool = json.getAsJsonObject("browserPool");
        assertThat(browserPool.get("total").getAsInt()).isEqualTo(3);
        assertThat(browserPool.get("inUse").getAsInt()).isEqualTo(2);
        assertThat(browserPool.get("available").getAsInt()).isEqualTo(1);
        assertThat(browserPool.get("max").getAsInt()).isEqualTo(5);

        JsonObject memory = json.getAsJsonObject("memory");
        assertThat(memory.has("heapUsedMb")).isTrue();
        assertThat(memory.get("heapTotalMb").getAsLong()).isGreaterThanOrEqualTo(memory.get("heapUsedMb").getAsLong());
    }

    @Test
    public void shutDownPoolReportsUnhealthy() {
        when(pool.statistics()).thenReturn(stats(0, 0, 0, true));

        assertThat(new HealthReporter(pool).report().getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    }
}
