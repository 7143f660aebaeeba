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

package com.twitter.aggregation.application.modules;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.TypeLiteral;
import com.google.inject.name.Named;
import com.google.inject.name.Names;

import com.twitter.aggregation.application.ShutdownRegistry;
import com.twitter.aggregation.base.MorePreconditions;
import com.twitter.aggregation.metrics.AggregationSummaryListener;
import com.twitter.aggregation.metrics.MetricManager;
import com.twitter.aggregation.quantity.Amount;
import com.twitter.aggregation.quantity.Time;
import com.twitter.aggregation.util.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binding module for the process-wide {@link MetricManager}.
 *
 * The aggregation period defaults to one minute and may be overridden through the constructor.
 *
 * Bindings required by this module:
 * <ul>
 *   <li>{@code AggregationSummaryListener} - Sink for closed aggregation periods.
 *   <li>{@code ShutdownRegistry} - Shutdown hook registry, used to stop the manager gracefully.
 * </ul>
 */
public class MetricAggregationModule extends AbstractModule {

  /**
   * {@literal @Named} binding key for the aggregation period of the background cycle.
   */
  public static final String AGGREGATION_PERIOD =
      "com.twitter.aggregation.application.modules.MetricAggregationModule.AGGREGATION_PERIOD";

  public static final Amount<Long, Time> DEFAULT_AGGREGATION_PERIOD = Amount.of(1L, Time.MINUTES);

  private final Amount<Long, Time> aggregationPeriod;

  public MetricAggregationModule() {
    this(DEFAULT_AGGREGATION_PERIOD);
  }

  /**
   * Creates a module with a custom aggregation period.
   *
   * @param aggregationPeriod Time between background aggregation cycles.
   */
  public MetricAggregationModule(Amount<Long, Time> aggregationPeriod) {
    checkNotNull(aggregationPeriod);
    MorePreconditions.checkPositive(aggregationPeriod.getValue(), "Aggregation period");
    this.aggregationPeriod = aggregationPeriod;
  }

  @Override
  protected void configure() {
    requireBinding(AggregationSummaryListener.class);
    requireBinding(ShutdownRegistry.class);

    bind(new TypeLiteral<Amount<Long, Time>>() { })
        .annotatedWith(Names.named(AGGREGATION_PERIOD))
        .toInstance(aggregationPeriod);
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
  }

  @Provides
  @Singleton
  MetricManager provideMetricManager(
      AggregationSummaryListener listener,
      @Named(AGGREGATION_PERIOD) Amount<Long, Time> period,
      Clock clock,
      ShutdownRegistry shutdownRegistry) {

    MetricManager metricManager = new MetricManager(listener, period, clock);
    metricManager.registerShutdown(shutdownRegistry);
    return metricManager;
  }
}
