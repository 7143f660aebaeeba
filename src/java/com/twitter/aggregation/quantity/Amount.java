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

package com.twitter.aggregation.quantity;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A whole number of units, used to pass intervals around unambiguously; eg: an aggregation
 * period of {@code Amount.of(1L, Time.MINUTES)}.
 *
 * @param <T> the type of number the amount value is expressed in
 * @param <U> the type of unit that this amount quantifies
 */
public final class Amount<T extends Number & Comparable<T>, U extends Unit<U>>
    implements Comparable<Amount<T, U>> {

  private final long value;
  private final U unit;

  private Amount(long value, U unit) {
    this.value = value;
    this.unit = Preconditions.checkNotNull(unit);
  }

  /**
   * Creates an amount that uses a {@code long} value.
   *
   * @param number the number of units the returned amount should quantify
   * @param unit the unit the returned amount is expressed in terms of
   * @param <U> the type of unit that the returned amount quantifies
   * @return an amount quantifying the given {@code number} of {@code unit}s
   */
  public static <U extends Unit<U>> Amount<Long, U> of(long number, U unit) {
    return new Amount<Long, U>(number, unit);
  }

  @SuppressWarnings("unchecked")
  public T getValue() {
    return (T) Long.valueOf(value);
  }

  public U getUnit() {
    return unit;
  }

  /**
   * Converts this amount to another unit of the same hierarchy.  Conversions to a coarser unit
   * truncate.
   *
   * @param otherUnit the unit to express this amount in
   * @return the number of {@code otherUnit}s this amount represents
   */
  @SuppressWarnings("unchecked")
  public T as(U otherUnit) {
    if (unit.equals(otherUnit)) {
      return getValue();
    }
    return (T) Long.valueOf((long) (value * (unit.multiplier() / otherUnit.multiplier())));
  }

  @Override
  public int compareTo(Amount<T, U> other) {
    // Compare in the more precise unit (the one with the lower multiplier).
    U precise = other.unit.multiplier() > unit.multiplier() ? unit : other.unit;
    return as(precise).compareTo(other.as(precise));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Amount)) {
      return false;
    }
    Amount<?, ?> other = (Amount<?, ?>) obj;
    return value == other.value && unit.equals(other.unit);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, unit);
  }

  @Override
  public String toString() {
    return value + " " + unit;
  }
}
