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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Aggregates arbitrary measurements into count, sum, min, max and standard deviation.
 * Values that are not a number or infinite are ignored.
 */
public class MeasurementAggregator implements MetricSeriesAggregator {

  public static final String AGGREGATION_KIND = "measurement";

  public static final String COUNT = "count";
  public static final String SUM = "sum";
  public static final String MIN = "min";
  public static final String MAX = "max";
  public static final String STDDEV = "stddev";

  /**
   * Creates a measurement aggregator for each eligible series.
   */
  public static final Factory FACTORY = new Factory() {
    @Override public MetricSeriesAggregator create(MetricSeries series, long periodStartMillis) {
      return new MeasurementAggregator(series, periodStartMillis);
    }
  };

  private final MetricSeries series;
  private final long periodStartMillis;

  private long count;
  private double sum;
  private double min = Double.MAX_VALUE;
  private double max = -Double.MAX_VALUE;
  private double runningMean;
  private double accumulatedVariance;

  public MeasurementAggregator(MetricSeries series, long periodStartMillis) {
    this.series = Preconditions.checkNotNull(series);
    this.periodStartMillis = periodStartMillis;
  }

  @Override
  public synchronized void trackValue(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return;
    }

    count++;
    sum += value;
    double delta = value - runningMean;
    runningMean += delta / count;
    accumulatedVariance += delta * (value - runningMean);

    min = value < min ? value : min;
    max = value > max ? value : max;
  }

  @Override
  @Nullable
  public synchronized MetricAggregate complete(long periodEndMillis) {
    if (count == 0) {
      return null;
    }

    ImmutableMap<String, Number> data = ImmutableMap.<String, Number>builder()
        .put(COUNT, count)
        .put(SUM, sum)
        .put(MIN, min)
        .put(MAX, max)
        .put(STDDEV, Math.sqrt(accumulatedVariance / count))
        .build();
    return new MetricAggregate(series.getMetricId(), series.getDimensions(), AGGREGATION_KIND,
        periodStartMillis, periodEndMillis - periodStartMillis, data);
  }
}
