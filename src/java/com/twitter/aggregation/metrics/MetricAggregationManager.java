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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

/**
 * Owns the active aggregators of every {@link MetricConsumerKind} and moves each kind through its
 * aggregation periods.
 *
 * <p>A kind is either stopped, with no active aggregators, or running, with exactly one set of
 * aggregators and one filter.  {@link #startAggregators}, {@link #stopAggregators} and
 * {@link #cycleAggregators} are mutually exclusive per kind; values written concurrently with a
 * transition land wholly in the period that is closing or wholly in the one that is opening.
 * Different kinds never block each other.
 */
public class MetricAggregationManager {

  private static final Logger LOG = Logger.getLogger(MetricAggregationManager.class.getName());

  private static final Ordering<MetricAggregate> AGGREGATE_ORDER =
      new Ordering<MetricAggregate>() {
        @Override public int compare(MetricAggregate left, MetricAggregate right) {
          return ComparisonChain.start()
              .compare(left.getMetricId(), right.getMetricId())
              .compare(left.getDimensions().toString(), right.getDimensions().toString())
              .result();
        }
      };

  private final MetricSeriesAggregator.Factory aggregatorFactory;
  private final ImmutableMap<MetricConsumerKind, ConsumerState> consumers;

  /**
   * Creates a manager that aggregates every series as a measurement.
   */
  public MetricAggregationManager() {
    this(MeasurementAggregator.FACTORY);
  }

  /**
   * Creates a manager with a custom aggregator factory.
   *
   * @param aggregatorFactory Creates the aggregator of a series when it first becomes eligible in
   *     a period.
   */
  public MetricAggregationManager(MetricSeriesAggregator.Factory aggregatorFactory) {
    this.aggregatorFactory = Preconditions.checkNotNull(aggregatorFactory);
    Map<MetricConsumerKind, ConsumerState> states =
        new EnumMap<MetricConsumerKind, ConsumerState>(MetricConsumerKind.class);
    for (MetricConsumerKind kind : MetricConsumerKind.values()) {
      states.put(kind, new ConsumerState());
    }
    this.consumers = ImmutableMap.copyOf(states);
  }

  /**
   * Starts a new aggregation period for a stopped consumer kind.
   *
   * @param consumerKind Kind to start.
   * @param periodStartMillis Start of the period, in milliseconds since the epoch.
   * @param filter Decides which series take part in the period.
   * @return {@code true} if the kind was started, {@code false} if it was already running, in
   *     which case nothing changes.
   */
  public boolean startAggregators(MetricConsumerKind consumerKind, long periodStartMillis,
      MetricSeriesFilter filter) {
    Preconditions.checkNotNull(consumerKind);
    Preconditions.checkNotNull(filter);

    ConsumerState state = consumers.get(consumerKind);
    state.lock.writeLock().lock();
    try {
      if (state.active != null) {
        LOG.fine("Aggregators for " + consumerKind + " are already running, start ignored.");
        return false;
      }
      state.active = new AggregatorSet(periodStartMillis, filter);
      LOG.fine("Started aggregators for " + consumerKind + " at " + periodStartMillis);
      return true;
    } finally {
      state.lock.writeLock().unlock();
    }
  }

  /**
   * Closes the current period of a consumer kind and leaves it stopped.
   *
   * @param consumerKind Kind to stop.
   * @param periodEndMillis End of the period, in milliseconds since the epoch.
   * @return The summary of the closed period, or an empty zero-length summary at
   *     {@code periodEndMillis} if the kind was not running.
   */
  public AggregationPeriodSummary stopAggregators(MetricConsumerKind consumerKind,
      long periodEndMillis) {
    Preconditions.checkNotNull(consumerKind);

    ConsumerState state = consumers.get(consumerKind);
    state.lock.writeLock().lock();
    try {
      AggregatorSet closing = state.active;
      if (closing == null) {
        return AggregationPeriodSummary.empty(periodEndMillis);
      }
      state.active = null;
      LOG.fine("Stopped aggregators for " + consumerKind + " at " + periodEndMillis);
      return closing.complete(periodEndMillis);
    } finally {
      state.lock.writeLock().unlock();
    }
  }

  /**
   * Closes the current period of a consumer kind and immediately opens the next one.  The kind is
   * running with {@code updatedFilter} afterwards, whether or not it was running before.
   *
   * @param consumerKind Kind to cycle.
   * @param periodEndMillis End of the closing period and start of the next one.
   * @param updatedFilter Filter for the next period.
   * @return The summary of the closed period, or an empty zero-length summary at
   *     {@code periodEndMillis} if the kind was not running.
   */
  public AggregationPeriodSummary cycleAggregators(MetricConsumerKind consumerKind,
      long periodEndMillis, MetricSeriesFilter updatedFilter) {
    Preconditions.checkNotNull(consumerKind);
    Preconditions.checkNotNull(updatedFilter);

    ConsumerState state = consumers.get(consumerKind);
    state.lock.writeLock().lock();
    try {
      AggregatorSet closing = state.active;
      state.active = new AggregatorSet(periodEndMillis, updatedFilter);
      return closing == null
          ? AggregationPeriodSummary.empty(periodEndMillis)
          : closing.complete(periodEndMillis);
    } finally {
      state.lock.writeLock().unlock();
    }
  }

  /**
   * Cycles a consumer kind with its current filter, but only if it is running.
   *
   * @param consumerKind Kind to cycle.
   * @param periodEndMillis End of the closing period and start of the next one.
   * @return The summary of the closed period, or absent if the kind was stopped.
   */
  Optional<AggregationPeriodSummary> cycleRunningAggregators(MetricConsumerKind consumerKind,
      long periodEndMillis) {
    Preconditions.checkNotNull(consumerKind);

    ConsumerState state = consumers.get(consumerKind);
    state.lock.writeLock().lock();
    try {
      AggregatorSet closing = state.active;
      if (closing == null) {
        return Optional.absent();
      }
      state.active = new AggregatorSet(periodEndMillis, closing.filter);
      return Optional.of(closing.complete(periodEndMillis));
    } finally {
      state.lock.writeLock().unlock();
    }
  }

  /**
   * Tests whether a consumer kind currently has an open period.
   */
  public boolean isRunning(MetricConsumerKind consumerKind) {
    return getFilter(consumerKind) != null;
  }

  /**
   * Returns the filter of the open period of a consumer kind, or {@code null} if it is stopped.
   */
  @Nullable
  public MetricSeriesFilter getFilter(MetricConsumerKind consumerKind) {
    Preconditions.checkNotNull(consumerKind);

    ConsumerState state = consumers.get(consumerKind);
    state.lock.readLock().lock();
    try {
      return state.active == null ? null : state.active.filter;
    } finally {
      state.lock.readLock().unlock();
    }
  }

  /**
   * Routes a value to the aggregators of every running consumer kind that includes the series.
   *
   * @param series Series the value was written to.
   * @param value Observed value.
   */
  void trackValue(MetricSeries series, double value) {
    Preconditions.checkNotNull(series);
    Preconditions.checkArgument(series.getAggregationManager() == this,
        "Series %s belongs to a different metric manager.", series);

    for (ConsumerState state : consumers.values()) {
      state.lock.readLock().lock();
      try {
        if (state.active != null) {
          state.active.trackValue(series, value);
        }
      } finally {
        state.lock.readLock().unlock();
      }
    }
  }

  @VisibleForTesting
  int getActiveAggregatorCount(MetricConsumerKind consumerKind) {
    ConsumerState state = consumers.get(consumerKind);
    state.lock.readLock().lock();
    try {
      return state.active == null ? 0 : state.active.size();
    } finally {
      state.lock.readLock().unlock();
    }
  }

  private static final class ConsumerState {
    // The write lock serializes period transitions, the read lock admits concurrent writes.
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Nullable private AggregatorSet active;
  }

  private final class AggregatorSet {
    private final long periodStartMillis;
    private final MetricSeriesFilter filter;

    // Absent marks a series the filter excluded for this period.
    private final ConcurrentMap<MetricSeries, Optional<MetricSeriesAggregator>> aggregators =
        Maps.newConcurrentMap();

    AggregatorSet(long periodStartMillis, MetricSeriesFilter filter) {
      this.periodStartMillis = periodStartMillis;
      this.filter = filter;
    }

    void trackValue(MetricSeries series, double value) {
      Optional<MetricSeriesAggregator> aggregator = aggregators.get(series);
      if (aggregator == null) {
        Optional<MetricSeriesAggregator> created = filter.includes(series)
            ? Optional.of(aggregatorFactory.create(series, periodStartMillis))
            : Optional.<MetricSeriesAggregator>absent();
        aggregator = aggregators.putIfAbsent(series, created);
        if (aggregator == null) {
          aggregator = created;
        }
      }
      if (aggregator.isPresent()) {
        aggregator.get().trackValue(value);
      }
    }

    int size() {
      int count = 0;
      for (Optional<MetricSeriesAggregator> aggregator : aggregators.values()) {
        if (aggregator.isPresent()) {
          count++;
        }
      }
      return count;
    }

    AggregationPeriodSummary complete(long periodEndMillis) {
      List<MetricAggregate> results = Lists.newArrayList();
      for (Optional<MetricSeriesAggregator> aggregator : aggregators.values()) {
        if (aggregator.isPresent()) {
          MetricAggregate aggregate = aggregator.get().complete(periodEndMillis);
          if (aggregate != null) {
            results.add(aggregate);
          }
        }
      }
      return new AggregationPeriodSummary(AGGREGATE_ORDER.sortedCopy(results), periodStartMillis,
          periodEndMillis);
    }
  }
}
