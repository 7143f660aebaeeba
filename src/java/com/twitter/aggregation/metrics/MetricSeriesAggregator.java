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

import javax.annotation.Nullable;

/**
 * Accumulates the values written to one series during one aggregation period, for one consumer
 * kind.  Implementations must tolerate concurrent {@link #trackValue(double)} calls.
 */
public interface MetricSeriesAggregator {

  /**
   * Accumulates one observation.
   *
   * @param value Observed value.
   */
  void trackValue(double value);

  /**
   * Closes the period and extracts the accumulated result.
   *
   * @param periodEndMillis End of the period, in milliseconds since the epoch.
   * @return The aggregate, or {@code null} if nothing was accumulated.
   */
  @Nullable
  MetricAggregate complete(long periodEndMillis);

  /**
   * Creates aggregators for series as they become eligible in a period.
   */
  interface Factory {

    /**
     * Creates a new, empty aggregator.
     *
     * @param series Series to aggregate.
     * @param periodStartMillis Start of the period, in milliseconds since the epoch.
     * @return A new aggregator.
     */
    MetricSeriesAggregator create(MetricSeries series, long periodStartMillis);
  }
}
