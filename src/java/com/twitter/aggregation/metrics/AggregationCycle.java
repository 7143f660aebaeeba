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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import com.twitter.aggregation.base.MorePreconditions;
import com.twitter.aggregation.quantity.Amount;
import com.twitter.aggregation.quantity.Time;
import com.twitter.aggregation.util.Clock;

/**
 * A background loop that closes the period of every running consumer kind at fixed, aligned
 * boundaries and hands the resulting summaries to an {@link AggregationSummaryListener}.
 *
 * <p>Boundaries fall on whole multiples of the interval since the epoch, so a one minute interval
 * ticks at the top of every minute.
 *
 * <p>The loop is never interrupted mid-cycle.  {@link #stopAsync()} only raises a flag; the loop
 * finishes any cycle in progress and exits without closing further periods, so no summary reaches
 * the listener once a stop was requested.  Values accumulated since the last tick are only
 * delivered if the caller flushes with {@link #flushNow()} before stopping.
 *
 * <p>If a cycle fails, the loop exits.  The failure is available from {@link #getFailure()} and
 * is reported through the future returned by {@link #stopAsync()}.
 */
public class AggregationCycle {

  private static final Logger LOG = Logger.getLogger(AggregationCycle.class.getName());

  /**
   * Lifecycle of the background loop.
   */
  public enum State {
    RUNNING,
    STOP_REQUESTED,
    STOPPED
  }

  private final MetricAggregationManager aggregationManager;
  private final AggregationSummaryListener listener;
  private final Clock clock;
  private final long intervalMillis;

  private final ThreadFactory threadFactory =
      new ThreadFactoryBuilder().setNameFormat("AggregationCycle-%d").setDaemon(true).build();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final SettableFuture<Void> completion = SettableFuture.create();

  private volatile State state = State.RUNNING;
  @Nullable private volatile Throwable failure;
  private boolean started = false;

  /**
   * Creates a new aggregation cycle.  The loop does not run until {@link #start()} is called.
   *
   * @param aggregationManager Manager whose running consumer kinds are cycled.
   * @param listener Receives the summary of every closed period.
   * @param interval Time between ticks.
   * @param clock Source of period boundaries.
   */
  public AggregationCycle(MetricAggregationManager aggregationManager,
      AggregationSummaryListener listener, Amount<Long, Time> interval, Clock clock) {
    this.aggregationManager = Preconditions.checkNotNull(aggregationManager);
    this.listener = Preconditions.checkNotNull(listener);
    this.clock = Preconditions.checkNotNull(clock);
    Preconditions.checkNotNull(interval);
    this.intervalMillis =
        MorePreconditions.checkPositive(interval.as(Time.MILLISECONDS), "Aggregation interval");
  }

  /**
   * Starts the background loop.  A cycle may only be started once, and not after it was stopped.
   */
  public synchronized void start() {
    Preconditions.checkState(!started, "Aggregation cycle is already started.");
    Preconditions.checkState(state == State.RUNNING, "Aggregation cycle was stopped.");
    started = true;

    threadFactory.newThread(new Runnable() {
      @Override public void run() {
        runLoop();
      }
    }).start();
    LOG.info("Aggregation cycle started, ticking every " + intervalMillis + " ms");
  }

  /**
   * Asks the loop to exit once any cycle in progress completes.  Does not block.  Subsequent calls
   * have no further effect and return the same future.
   *
   * @return A future that completes once the loop has exited, or fails with the error that
   *     terminated it.
   */
  public synchronized ListenableFuture<Void> stopAsync() {
    if (state == State.RUNNING) {
      state = State.STOP_REQUESTED;
      stopSignal.countDown();
      if (!started) {
        state = State.STOPPED;
        completion.set(null);
      }
      LOG.info("Aggregation cycle stop requested");
    } else {
      LOG.fine("Aggregation cycle is already stopping, subsequent stop requests ignored.");
    }
    return completion;
  }

  /**
   * Cycles every running consumer kind now, on the calling thread.
   */
  public void flushNow() {
    cycleAll(clock.nowMillis());
  }

  public State getState() {
    return state;
  }

  /**
   * Returns the error that terminated the loop, or {@code null} if it has not failed.
   */
  @Nullable
  public Throwable getFailure() {
    return failure;
  }

  @VisibleForTesting
  static long millisUntilNextTick(long nowMillis, long intervalMillis) {
    return intervalMillis - (nowMillis % intervalMillis);
  }

  /**
   * Returns the aligned boundary following both {@code nowMillis} and the last boundary cycled, so
   * that a clock reading slightly behind the last boundary never yields the same boundary twice.
   */
  @VisibleForTesting
  static long nextTickMillis(long nowMillis, long lastTickMillis, long intervalMillis) {
    long from = Math.max(nowMillis, lastTickMillis);
    return from + millisUntilNextTick(from, intervalMillis);
  }

  @VisibleForTesting
  void cycleAll(long boundaryMillis) {
    for (MetricConsumerKind kind : MetricConsumerKind.values()) {
      Optional<AggregationPeriodSummary> summary =
          aggregationManager.cycleRunningAggregators(kind, boundaryMillis);
      if (summary.isPresent()) {
        listener.summaryReady(kind, summary.get());
      }
    }
  }

  private void runLoop() {
    // SUPPRESS CHECKSTYLE:OFF IllegalCatch
    try {
      long lastTickMillis = Long.MIN_VALUE;
      while (true) {
        long tickMillis = nextTickMillis(clock.nowMillis(), lastTickMillis, intervalMillis);
        if (awaitStopUntil(tickMillis)) {
          break;
        }
        cycleAll(tickMillis);
        lastTickMillis = tickMillis;
      }

      state = State.STOPPED;
      completion.set(null);
      LOG.info("Aggregation cycle stopped");
    } catch (RuntimeException e) {
      fail(e);
    } catch (Error e) {
      fail(e);
      throw e;
    }
    // SUPPRESS CHECKSTYLE:ON IllegalCatch
  }

  /**
   * Waits until the given boundary or for a stop request, whichever comes first.
   *
   * @return {@code true} if a stop was requested and the loop should exit.
   */
  private boolean awaitStopUntil(long tickMillis) {
    if (state != State.RUNNING) {
      return true;
    }
    try {
      boolean stopped = stopSignal.await(
          Math.max(0L, tickMillis - clock.nowMillis()), TimeUnit.MILLISECONDS);
      return stopped || state != State.RUNNING;
    } catch (InterruptedException e) {
      LOG.warning("Aggregation cycle interrupted, exiting.");
      Thread.currentThread().interrupt();
      return true;
    }
  }

  private void fail(Throwable t) {
    LOG.log(Level.SEVERE, "Aggregation cycle failed, no further periods will be closed.", t);
    failure = t;
    state = State.STOPPED;
    completion.setException(t);
  }
}
