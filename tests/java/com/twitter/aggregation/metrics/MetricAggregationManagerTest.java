// =================================================================================================
// Copyright 2013 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.aggregation.metrics;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MetricAggregationManagerTest {

  private static final double EPS = 1e-8;

  private static final long T0 = 60000L;
  private static final long T1 = 120000L;
  private static final long T2 = 180000L;

  private MetricAggregationManager manager;
  private MetricSeries requests;
  private MetricSeries errors;

  @Before
  public void setUp() {
    manager = new MetricAggregationManager();
    requests = new MetricSeries(manager, "requests", ImmutableMap.<String, String>of());
    errors = new MetricSeries(manager, "errors", ImmutableMap.<String, String>of());
  }

  @Test
  public void testStartOnlyOnce() {
    assertTrue(manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all()));
    requests.trackValue(1);
    assertFalse(manager.startAggregators(MetricConsumerKind.DEFAULT, T1,
        MetricSeriesFilters.none()));

    // The rejected start must not have replaced the period, its start or its filter.
    assertSame(MetricSeriesFilters.all(), manager.getFilter(MetricConsumerKind.DEFAULT));
    assertEquals(1, manager.getActiveAggregatorCount(MetricConsumerKind.DEFAULT));
    AggregationPeriodSummary summary = manager.stopAggregators(MetricConsumerKind.DEFAULT, T2);
    assertEquals(T0, summary.getPeriodStartMillis());
    assertEquals(1, summary.getAggregates().size());

    assertTrue(manager.startAggregators(MetricConsumerKind.DEFAULT, T2, MetricSeriesFilters.all()));
  }

  @Test
  public void testStopNeverStarted() {
    AggregationPeriodSummary summary = manager.stopAggregators(MetricConsumerKind.DIAGNOSTIC, T1);

    assertTrue(summary.isEmpty());
    assertEquals(T1, summary.getPeriodStartMillis());
    assertEquals(T1, summary.getPeriodEndMillis());
    assertFalse(manager.isRunning(MetricConsumerKind.DIAGNOSTIC));
  }

  @Test
  public void testStopTwice() {
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all());
    requests.trackValue(5);

    assertEquals(1, manager.stopAggregators(MetricConsumerKind.DEFAULT, T1).getAggregates().size());
    AggregationPeriodSummary second = manager.stopAggregators(MetricConsumerKind.DEFAULT, T2);
    assertTrue(second.isEmpty());
    assertEquals(T2, second.getPeriodStartMillis());
  }

  @Test
  public void testPeriodScenario() {
    assertTrue(manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all()));
    requests.trackValue(10);
    requests.trackValue(20);
    requests.trackValue(30);

    AggregationPeriodSummary first =
        manager.cycleAggregators(MetricConsumerKind.DEFAULT, T1, MetricSeriesFilters.all());
    assertEquals(T0, first.getPeriodStartMillis());
    assertEquals(T1, first.getPeriodEndMillis());
    assertEquals(1, first.getAggregates().size());
    MetricAggregate aggregate = first.getAggregates().get(0);
    assertEquals("requests", aggregate.getMetricId());
    assertEquals(3L, aggregate.getDataValue(MeasurementAggregator.COUNT));
    assertEquals(60.0, aggregate.getDataValue(MeasurementAggregator.SUM).doubleValue(), EPS);
    assertEquals(T0, aggregate.getPeriodStartMillis());
    assertEquals(T1 - T0, aggregate.getPeriodDurationMillis());

    AggregationPeriodSummary second = manager.stopAggregators(MetricConsumerKind.DEFAULT, T2);
    assertEquals(T1, second.getPeriodStartMillis());
    assertEquals(T2, second.getPeriodEndMillis());
    assertTrue(second.isEmpty());
    assertFalse(manager.isRunning(MetricConsumerKind.DEFAULT));
  }

  @Test
  public void testCycleAppliesUpdatedFilterToNextPeriod() {
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all());
    requests.trackValue(1);
    errors.trackValue(1);

    MetricSeriesFilter onlyErrors = MetricSeriesFilters.forMetricIds("errors");
    AggregationPeriodSummary first =
        manager.cycleAggregators(MetricConsumerKind.DEFAULT, T1, onlyErrors);
    assertEquals(2, first.getAggregates().size());
    assertSame(onlyErrors, manager.getFilter(MetricConsumerKind.DEFAULT));

    requests.trackValue(2);
    errors.trackValue(2);

    AggregationPeriodSummary second = manager.stopAggregators(MetricConsumerKind.DEFAULT, T2);
    assertEquals(T1, second.getPeriodStartMillis());
    assertEquals(1, second.getAggregates().size());
    assertEquals("errors", second.getAggregates().get(0).getMetricId());
  }

  @Test
  public void testCycleStoppedKindStartsIt() {
    AggregationPeriodSummary summary =
        manager.cycleAggregators(MetricConsumerKind.CUSTOM, T1, MetricSeriesFilters.all());
    assertTrue(summary.isEmpty());
    assertEquals(T1, summary.getPeriodStartMillis());
    assertEquals(T1, summary.getPeriodEndMillis());
    assertTrue(manager.isRunning(MetricConsumerKind.CUSTOM));

    requests.trackValue(4);
    AggregationPeriodSummary next = manager.stopAggregators(MetricConsumerKind.CUSTOM, T2);
    assertEquals(T1, next.getPeriodStartMillis());
    assertEquals(1, next.getAggregates().size());
  }

  @Test
  public void testKindsAreIndependent() {
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all());
    manager.startAggregators(MetricConsumerKind.DIAGNOSTIC, T0,
        MetricSeriesFilters.forMetricIds("errors"));

    requests.trackValue(1);
    errors.trackValue(1);

    AggregationPeriodSummary diagnostic =
        manager.stopAggregators(MetricConsumerKind.DIAGNOSTIC, T1);
    assertEquals(1, diagnostic.getAggregates().size());
    assertTrue(manager.isRunning(MetricConsumerKind.DEFAULT));

    errors.trackValue(2);
    AggregationPeriodSummary defaults = manager.stopAggregators(MetricConsumerKind.DEFAULT, T2);
    assertEquals(2, defaults.getAggregates().size());
    assertEquals(2L, findAggregate(defaults, "errors").getDataValue(MeasurementAggregator.COUNT));
  }

  @Test
  public void testNothingTrackedWhileStopped() {
    requests.trackValue(1);
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all());
    assertEquals(0, manager.getActiveAggregatorCount(MetricConsumerKind.DEFAULT));
    assertTrue(manager.stopAggregators(MetricConsumerKind.DEFAULT, T1).isEmpty());
  }

  @Test
  public void testFilterConsultedOncePerSeriesPerPeriod() {
    final AtomicInteger calls = new AtomicInteger();
    MetricSeriesFilter countingFilter = new MetricSeriesFilter() {
      @Override public boolean includes(MetricSeries series) {
        calls.incrementAndGet();
        return series.getMetricId().equals("requests");
      }
    };

    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, countingFilter);
    for (int i = 0; i < 5; i++) {
      requests.trackValue(i);
      errors.trackValue(i);
    }
    assertEquals(2, calls.get());
    assertEquals(1, manager.getActiveAggregatorCount(MetricConsumerKind.DEFAULT));

    manager.cycleAggregators(MetricConsumerKind.DEFAULT, T1, countingFilter);
    requests.trackValue(1);
    assertEquals(3, calls.get());
  }

  @Test
  public void testAggregatesOrderedBySeries() {
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all());
    MetricSeries east = new MetricSeries(manager, "latency", ImmutableMap.of("dc", "east"));
    MetricSeries west = new MetricSeries(manager, "latency", ImmutableMap.of("dc", "west"));

    west.trackValue(1);
    requests.trackValue(1);
    east.trackValue(1);
    errors.trackValue(1);

    List<String> order = Lists.newArrayList();
    for (MetricAggregate aggregate
        : manager.stopAggregators(MetricConsumerKind.DEFAULT, T1).getAggregates()) {
      order.add(aggregate.getMetricId() + aggregate.getDimensions());
    }
    assertEquals(
        Lists.newArrayList("errors{}", "latency{dc=east}", "latency{dc=west}", "requests{}"),
        order);
  }

  @Test
  public void testGetFilterOfStoppedKind() {
    assertNull(manager.getFilter(MetricConsumerKind.DEFAULT));
  }

  @Test(expected = NullPointerException.class)
  public void testStartRequiresFilter() {
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, null);
  }

  @Test(expected = NullPointerException.class)
  public void testCycleRequiresFilter() {
    manager.cycleAggregators(MetricConsumerKind.DEFAULT, T0, null);
  }

  @Test(expected = NullPointerException.class)
  public void testStopRequiresKind() {
    manager.stopAggregators(null, T0);
  }

  @Test
  public void testRejectedCycleLeavesStateUntouched() {
    manager.startAggregators(MetricConsumerKind.DEFAULT, T0, MetricSeriesFilters.all());
    try {
      manager.cycleAggregators(MetricConsumerKind.DEFAULT, T1, null);
      fail("A null filter should be rejected.");
    } catch (NullPointerException e) {
      // expected
    }
    assertEquals(T0,
        manager.stopAggregators(MetricConsumerKind.DEFAULT, T2).getPeriodStartMillis());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSeriesOfOtherManagerRejected() {
    MetricSeries foreign =
        new MetricSeries(new MetricAggregationManager(), "requests",
            ImmutableMap.<String, String>of());
    manager.trackValue(foreign, 1);
  }

  @Test
  public void testConcurrentStartAcceptedOnce() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final CountDownLatch go = new CountDownLatch(1);
      List<Future<Boolean>> results = Lists.newArrayList();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(new Callable<Boolean>() {
          @Override public Boolean call() throws InterruptedException {
            go.await();
            return manager.startAggregators(MetricConsumerKind.DIAGNOSTIC, T0,
                MetricSeriesFilters.all());
          }
        }));
      }
      go.countDown();

      int accepted = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          accepted++;
        }
      }
      assertEquals(1, accepted);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testNoValuesLostAcrossConcurrentCycles() throws Exception {
    final int writers = 4;
    final int valuesPerWriter = 5000;
    manager.startAggregators(MetricConsumerKind.DEFAULT, 0, MetricSeriesFilters.all());

    ExecutorService executor = Executors.newFixedThreadPool(writers);
    try {
      List<Future<?>> done = Lists.newArrayList();
      for (int i = 0; i < writers; i++) {
        done.add(executor.submit(new Runnable() {
          @Override public void run() {
            for (int v = 0; v < valuesPerWriter; v++) {
              requests.trackValue(1);
            }
          }
        }));
      }

      long total = 0;
      long boundary = 0;
      while (!allDone(done)) {
        boundary++;
        total += countOf(manager.cycleAggregators(MetricConsumerKind.DEFAULT, boundary,
            MetricSeriesFilters.all()));
      }
      for (Future<?> writer : done) {
        writer.get(10, TimeUnit.SECONDS);
      }
      total += countOf(manager.stopAggregators(MetricConsumerKind.DEFAULT, boundary + 1));

      assertEquals((long) writers * valuesPerWriter, total);
    } finally {
      executor.shutdownNow();
    }
  }

  private static boolean allDone(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      if (!future.isDone()) {
        return false;
      }
    }
    return true;
  }

  private static long countOf(AggregationPeriodSummary summary) {
    long count = 0;
    for (MetricAggregate aggregate : summary.getAggregates()) {
      count += aggregate.getDataValue(MeasurementAggregator.COUNT).longValue();
    }
    return count;
  }

  private static MetricAggregate findAggregate(AggregationPeriodSummary summary, String metricId) {
    for (MetricAggregate aggregate : summary.getAggregates()) {
      if (aggregate.getMetricId().equals(metricId)) {
        return aggregate;
      }
    }
    throw new AssertionError("No aggregate for " + metricId + " in " + summary);
  }
}
