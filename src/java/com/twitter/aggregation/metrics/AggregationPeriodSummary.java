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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The outcome of closing one aggregation period: the finished aggregates, in a stable order, and
 * the bounds of the period.  Instances are immutable.
 */
public final class AggregationPeriodSummary {

  private final ImmutableList<MetricAggregate> aggregates;
  private final long periodStartMillis;
  private final long periodEndMillis;

  public AggregationPeriodSummary(Iterable<MetricAggregate> aggregates, long periodStartMillis,
      long periodEndMillis) {
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.periodStartMillis = periodStartMillis;
    this.periodEndMillis = periodEndMillis;
  }

  /**
   * Creates a summary of a zero-length period with no aggregates.
   *
   * @param timestampMillis Both start and end of the period.
   * @return An empty summary.
   */
  public static AggregationPeriodSummary empty(long timestampMillis) {
    return new AggregationPeriodSummary(ImmutableList.<MetricAggregate>of(), timestampMillis,
        timestampMillis);
  }

  public ImmutableList<MetricAggregate> getAggregates() {
    return aggregates;
  }

  public long getPeriodStartMillis() {
    return periodStartMillis;
  }

  public long getPeriodEndMillis() {
    return periodEndMillis;
  }

  public boolean isEmpty() {
    return aggregates.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", periodStartMillis)
        .add("end", periodEndMillis)
        .add("aggregates", aggregates.size())
        .toString();
  }
}
