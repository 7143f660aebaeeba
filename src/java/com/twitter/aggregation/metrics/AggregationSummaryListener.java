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
 * A sink that receives the summary of every period closed by the aggregation cycle, typically to
 * export it.
 */
public interface AggregationSummaryListener {

  /**
   * Notifies the listener of a closed period.
   *
   * @param consumerKind Consumer kind whose period closed.
   * @param summary Aggregates of the closed period.
   */
  void summaryReady(MetricConsumerKind consumerKind, AggregationPeriodSummary summary);
}
