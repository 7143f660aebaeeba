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

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Uninterruptibles;

import com.twitter.aggregation.application.ShutdownRegistry;
import com.twitter.aggregation.base.ExceptionalCommand;
import com.twitter.aggregation.quantity.Amount;
import com.twitter.aggregation.quantity.Time;
import com.twitter.aggregation.util.Clock;

/**
 * The entry point applications hold to aggregate metrics.  A manager owns a
 * {@link MetricAggregationManager} and the {@link AggregationCycle} that periodically closes its
 * periods, and exposes their lifecycle operations directly.
 *
 * <p>On construction the {@link MetricConsumerKind#DEFAULT} consumer is started with a filter that
 * includes every series, and the background cycle starts ticking.  Explicitly created managers
 * should be stopped with {@link #stopAsync()} when no longer needed.
 *
 * <p>If the background cycle fails, periods are no longer closed periodically while values keep
 * accumulating.  The failure surfaces from the next {@link #flush()} and through the future
 * returned by {@link #stopAsync()}.
 */
public class MetricManager {

  private static final Logger LOG = Logger.getLogger(MetricManager.class.getName());

  private final MetricAggregationManager aggregationManager;
  private final AggregationCycle aggregationCycle;
  private final ExtensionCache<MetricManager> extensionCache;
  private boolean stopRequested = false;

  /**
   * Creates a new metric manager and starts its aggregation cycle.
   *
   * @param listener Receives the summary of every period closed by the cycle or a flush.
   * @param aggregationPeriod Time between cycle ticks.
   * @param clock Source of period boundaries.
   */
  public MetricManager(
      AggregationSummaryListener listener,
      Amount<Long, Time> aggregationPeriod,
      Clock clock) {
    this(new MetricAggregationManager(), listener, aggregationPeriod, clock);
  }

  @VisibleForTesting
  MetricManager(MetricAggregationManager aggregationManager, AggregationSummaryListener listener,
      Amount<Long, Time> aggregationPeriod, Clock clock) {
    this.aggregationManager = Preconditions.checkNotNull(aggregationManager);
    this.aggregationCycle =
        new AggregationCycle(aggregationManager, listener, aggregationPeriod, clock);
    this.extensionCache = new ExtensionCache<MetricManager>(this);

    aggregationManager.startAggregators(
        MetricConsumerKind.DEFAULT, clock.nowMillis(), MetricSeriesFilters.all());
    aggregationCycle.start();
  }

  /**
   * Creates a series without dimensions.
   *
   * @see #createNewSeries(String, Map)
   */
  public MetricSeries createNewSeries(String metricId) {
    return createNewSeries(metricId, ImmutableMap.<String, String>of());
  }

  /**
   * Creates a series whose values are aggregated by this manager.
   *
   * @param metricId Id of the metric.  Must not be blank.
   * @param dimensions Dimension names and values of the series.
   * @return A new series.
   */
  public MetricSeries createNewSeries(String metricId, Map<String, String> dimensions) {
    return new MetricSeries(aggregationManager, metricId, dimensions);
  }

  /**
   * Starts aggregation for a consumer kind.
   *
   * @see MetricAggregationManager#startAggregators(MetricConsumerKind, long, MetricSeriesFilter)
   */
  public boolean startAggregators(MetricConsumerKind consumerKind, long periodStartMillis,
      MetricSeriesFilter filter) {
    return aggregationManager.startAggregators(consumerKind, periodStartMillis, filter);
  }

  /**
   * Stops aggregation for a consumer kind.
   *
   * @see MetricAggregationManager#stopAggregators(MetricConsumerKind, long)
   */
  public AggregationPeriodSummary stopAggregators(MetricConsumerKind consumerKind,
      long periodEndMillis) {
    return aggregationManager.stopAggregators(consumerKind, periodEndMillis);
  }

  /**
   * Closes the current period of a consumer kind and starts the next.
   *
   * @see MetricAggregationManager#cycleAggregators(MetricConsumerKind, long, MetricSeriesFilter)
   */
  public AggregationPeriodSummary cycleAggregators(MetricConsumerKind consumerKind,
      long periodEndMillis, MetricSeriesFilter updatedFilter) {
    return aggregationManager.cycleAggregators(consumerKind, periodEndMillis, updatedFilter);
  }

  /**
   * Closes the current period of every running consumer kind now and hands the summaries to the
   * listener.  Returns once the listener has received them.
   *
   * @throws IllegalStateException if the background cycle has failed.  The periods are still
   *     flushed before the failure is reported.
   */
  public void flush() {
    aggregationCycle.flushNow();
    Throwable failure = aggregationCycle.getFailure();
    if (failure != null) {
      throw new IllegalStateException(
          "Aggregation cycle failed, periods are no longer closed periodically.", failure);
    }
  }

  /**
   * Flushes, then asks the background cycle to exit.  The cycle is not interrupted; it completes
   * its ongoing cycle and exits instead of waiting for the next one.
   *
   * <p>Only the first call flushes.  Concurrent callers wait until that flush has completed and the
   * background cycle was signalled.  Every call returns the same future.
   *
   * @return A future that completes once the background thread has exited.  Wait on it to be sure
   *     the thread completed; ignore it to only signal the thread.
   */
  public synchronized ListenableFuture<Void> stopAsync() {
    if (!stopRequested) {
      stopRequested = true;
      aggregationCycle.flushNow();
    } else {
      LOG.fine("Metric manager is already stopping, flush skipped.");
    }
    return aggregationCycle.stopAsync();
  }

  /**
   * Returns the extension cache of this manager, creating it if needed.
   *
   * @param type Type the caller expects the cache to have.
   * @param factory Creates the cache from this manager if it does not exist yet.
   * @param <T> Cache type.
   * @return The cache instance.
   * @throws CacheTypeMismatchException if a cache of an incompatible type already exists.
   * @throws IllegalStateException if {@code factory} returns {@code null}; the cache then remains
   *     empty.
   * @see ExtensionCache#getOrCreate(Class, Function)
   */
  public <T> T getOrCreateCache(Class<T> type,
      Function<? super MetricManager, ? extends T> factory) {
    return extensionCache.getOrCreate(type, factory);
  }

  /**
   * Arranges for this manager to be stopped, and for the stop to complete, when the given
   * registry executes its shutdown actions.
   *
   * @param shutdownRegistry Shutdown hook registry.
   */
  public void registerShutdown(ShutdownRegistry shutdownRegistry) {
    Preconditions.checkNotNull(shutdownRegistry);
    shutdownRegistry.addAction(new ExceptionalCommand<ExecutionException>() {
      @Override public void execute() throws ExecutionException {
        Uninterruptibles.getUninterruptibly(stopAsync());
        LOG.info("Metric manager shut down");
      }
    });
  }

  @VisibleForTesting
  MetricAggregationManager getAggregationManager() {
    return aggregationManager;
  }

  @VisibleForTesting
  AggregationCycle getAggregationCycle() {
    return aggregationCycle;
  }
}
