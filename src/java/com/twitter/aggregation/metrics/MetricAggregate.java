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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

/**
 * The finished result of aggregating one series over one period.  Instances are immutable.
 */
public final class MetricAggregate {

  private final String metricId;
  private final ImmutableSortedMap<String, String> dimensions;
  private final String aggregationKind;
  private final long periodStartMillis;
  private final long periodDurationMillis;
  private final ImmutableMap<String, Number> data;

  /**
   * Creates a new aggregate.
   *
   * @param metricId Id of the aggregated series.
   * @param dimensions Dimensions of the aggregated series.
   * @param aggregationKind Name of the aggregation that produced the data; eg: "measurement".
   * @param periodStartMillis Start of the period, in milliseconds since the epoch.
   * @param periodDurationMillis Length of the period in milliseconds.
   * @param data Named statistics, in the order they should be reported.
   */
  public MetricAggregate(String metricId, Map<String, String> dimensions, String aggregationKind,
      long periodStartMillis, long periodDurationMillis, Map<String, ? extends Number> data) {
    this.metricId = Preconditions.checkNotNull(metricId);
    this.dimensions = ImmutableSortedMap.copyOf(dimensions);
    this.aggregationKind = Preconditions.checkNotNull(aggregationKind);
    this.periodStartMillis = periodStartMillis;
    this.periodDurationMillis = periodDurationMillis;
    this.data = ImmutableMap.copyOf(data);
  }

  public String getMetricId() {
    return metricId;
  }

  public ImmutableSortedMap<String, String> getDimensions() {
    return dimensions;
  }

  public String getAggregationKind() {
    return aggregationKind;
  }

  public long getPeriodStartMillis() {
    return periodStartMillis;
  }

  public long getPeriodDurationMillis() {
    return periodDurationMillis;
  }

  public ImmutableMap<String, Number> getData() {
    return data;
  }

  /**
   * Returns a single named statistic, or {@code null} if this aggregate does not carry it.
   */
  @Nullable
  public Number getDataValue(String name) {
    return data.get(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricAggregate)) {
      return false;
    }
    MetricAggregate other = (MetricAggregate) o;
    return metricId.equals(other.metricId)
        && dimensions.equals(other.dimensions)
        && aggregationKind.equals(other.aggregationKind)
        && periodStartMillis == other.periodStartMillis
        && periodDurationMillis == other.periodDurationMillis
        && data.equals(other.data);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(metricId, dimensions, aggregationKind, periodStartMillis,
        periodDurationMillis, data);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("metricId", metricId)
        .add("dimensions", dimensions)
        .add("kind", aggregationKind)
        .add("start", periodStartMillis)
        .add("duration", periodDurationMillis)
        .add("data", data)
        .toString();
  }
}
