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

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableSet;

/**
 * Utility functions for building {@link MetricSeriesFilter}s.
 */
public final class MetricSeriesFilters {

  private static final MetricSeriesFilter ALL = new MetricSeriesFilter() {
    @Override public boolean includes(MetricSeries series) {
      return true;
    }

    @Override public String toString() {
      return "MetricSeriesFilters.all()";
    }
  };

  private static final MetricSeriesFilter NONE = new MetricSeriesFilter() {
    @Override public boolean includes(MetricSeries series) {
      return false;
    }

    @Override public String toString() {
      return "MetricSeriesFilters.none()";
    }
  };

  private MetricSeriesFilters() {
    // utility
  }

  /**
   * Returns a filter that includes every series.
   */
  public static MetricSeriesFilter all() {
    return ALL;
  }

  /**
   * Returns a filter that excludes every series.
   */
  public static MetricSeriesFilter none() {
    return NONE;
  }

  /**
   * Returns a filter that includes only series with one of the given metric ids.
   *
   * @param metricIds Ids of the metrics to include.
   * @return A filter on metric id.
   */
  public static MetricSeriesFilter forMetricIds(String... metricIds) {
    final ImmutableSet<String> ids = ImmutableSet.copyOf(metricIds);
    return new MetricSeriesFilter() {
      @Override public boolean includes(MetricSeries series) {
        return ids.contains(series.getMetricId());
      }

      @Override public String toString() {
        return "MetricSeriesFilters.forMetricIds(" + ids + ")";
      }
    };
  }

  /**
   * Adapts a predicate to a series filter.
   *
   * @param predicate Predicate to delegate to.
   * @return A filter that includes the series the predicate applies to.
   */
  public static MetricSeriesFilter fromPredicate(final Predicate<? super MetricSeries> predicate) {
    Preconditions.checkNotNull(predicate);
    return new MetricSeriesFilter() {
      @Override public boolean includes(MetricSeries series) {
        return predicate.apply(series);
      }
    };
  }
}
