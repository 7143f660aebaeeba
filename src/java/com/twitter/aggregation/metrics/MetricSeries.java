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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import com.twitter.aggregation.base.MorePreconditions;

/**
 * A single named, dimensioned metric stream.  Values written to a series are routed to the
 * aggregators of every consumer kind whose current filter includes it.
 *
 * <p>Series are created with {@link MetricManager#createNewSeries(String, Map)} and stay bound to
 * the manager that created them.
 */
public final class MetricSeries {

  private final MetricAggregationManager aggregationManager;
  private final String metricId;
  private final ImmutableSortedMap<String, String> dimensions;

  MetricSeries(MetricAggregationManager aggregationManager, String metricId,
      Map<String, String> dimensions) {
    this.aggregationManager = Preconditions.checkNotNull(aggregationManager);
    this.metricId = MorePreconditions.checkNotBlank(metricId, "Metric id may not be blank.");
    Preconditions.checkNotNull(dimensions);
    for (Map.Entry<String, String> dimension : dimensions.entrySet()) {
      MorePreconditions.checkNotBlank(dimension.getKey(), "Dimension names may not be blank.");
      Preconditions.checkNotNull(dimension.getValue(), "Dimension %s has no value.",
          dimension.getKey());
    }
    this.dimensions = ImmutableSortedMap.copyOf(dimensions);
  }

  public String getMetricId() {
    return metricId;
  }

  /**
   * Returns the dimension names and values of this series, sorted by name.
   */
  public ImmutableSortedMap<String, String> getDimensions() {
    return dimensions;
  }

  /**
   * Records one observation.
   *
   * @param value Observed value.
   */
  public void trackValue(double value) {
    aggregationManager.trackValue(this, value);
  }

  MetricAggregationManager getAggregationManager() {
    return aggregationManager;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricSeries)) {
      return false;
    }
    MetricSeries other = (MetricSeries) o;
    return aggregationManager == other.aggregationManager
        && metricId.equals(other.metricId)
        && dimensions.equals(other.dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(metricId, dimensions);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("metricId", metricId)
        .add("dimensions", dimensions)
        .toString();
  }
}
