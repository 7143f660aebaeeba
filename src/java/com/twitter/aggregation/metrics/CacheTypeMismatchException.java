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
 * Thrown when the extension cache of a metric manager is requested as a type that is incompatible
 * with the instance already cached.  This means that more than one extension is using the single
 * cache slot.
 */
public class CacheTypeMismatchException extends IllegalStateException {

  private final Class<?> expectedType;
  private final Class<?> actualType;

  public CacheTypeMismatchException(Class<?> expectedType, Class<?> actualType) {
    super(String.format("Expected to find a cache of type %s, but the present cache is of type %s."
        + " Multiple extensions are using the metric manager cache in a conflicting manner.",
        expectedType.getName(), actualType.getName()));
    this.expectedType = expectedType;
    this.actualType = actualType;
  }

  public Class<?> getExpectedType() {
    return expectedType;
  }

  public Class<?> getActualType() {
    return actualType;
  }
}
