package com.sitecam.timelapse.metrics;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsTest {
  private static final List<Tag> TAGS =
      Arrays.asList(Tag.of("config_version", "V1"), Tag.of("job_run_mode", "ONCE"));

  private PrometheusMeterRegistry meterRegistry;
  private Metrics metrics;

  @BeforeEach
  void setUp() {
    meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    metrics = new Metrics(meterRegistry, new ConcurrentHashMap<>());
  }

  @Test
  void testGetInstance() {
    assertSame(Metrics.getInstance(), Metrics.getInstance());
    assertNotNull(Metrics.getInstance().getCollectorRegistry());
  }

  @Test
  void testIncrement() {
    metrics.increment("timelapse_artifact_built", TAGS);
    metrics.increment("timelapse_artifact_built", TAGS);

    assertEquals(2.0, meterRegistry.get("timelapse_artifact_built").tags(TAGS).counter().count());
  }

  @Test
  void testTimer() {
    metrics.timer("timelapse_run_duration", Duration.ofSeconds(4), TAGS);

    assertEquals(1, meterRegistry.get("timelapse_run_duration").timer().count());
  }

  @Test
  void testGaugeIsRegisteredOnce() {
    Metrics.Gauge gauge = metrics.gauge("timelapse_discovered_partitions", "Partitions", TAGS);
    assertEquals(0, gauge.get().intValue());
    gauge.setValue(11);

    assertSame(gauge, metrics.gauge("timelapse_discovered_partitions", "Partitions", TAGS));
    assertEquals(11.0, meterRegistry.get("timelapse_discovered_partitions").gauge().value());
  }

  @Test
  void testGaugeMeterIdCanOnlyBeSetOnce() {
    Metrics.Gauge gauge = metrics.gauge("timelapse_discovered_partitions", "Partitions", TAGS);

    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> gauge.setMeterId(mock(Meter.Id.class)));
    assertEquals("MeterId cannot be set more than once", exception.getMessage());
  }
}
