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
 * Identifies an independent aggregation consumer.  Each kind has its own filter and its own set of
 * active aggregators; kinds never share aggregation state.
 */
public enum MetricConsumerKind {
  /** The regular telemetry pipeline, driven by the background aggregation cycle. */
  DEFAULT,

  /** Live diagnostics that sample a subset of series on their own cadence. */
  DIAGNOSTIC,

  /** Reserved for application-defined consumers. */
  CUSTOM
}
