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

/**
 * Decides whether a metric series participates in a consumer's aggregation period.
 *
 * <p>A filter is consulted once per series per period, on the first value written to the series
 * after the period started.  Implementations must be thread safe.
 *
 * @see MetricSeriesFilters
 */
public interface MetricSeriesFilter {

  /**
   * Tests whether values of {@code series} should be aggregated.
   *
   * @param series A series that received a value.
   * @return {@code true} to aggregate the series for the current period.
   */
  boolean includes(MetricSeries series);
}
