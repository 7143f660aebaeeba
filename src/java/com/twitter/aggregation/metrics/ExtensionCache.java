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

import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

/**
 * A single-slot cache that extensions use to attach state to the object that owns it.  The slot
 * is filled at most once, by the first factory invoked, and its type never changes afterwards.
 *
 * @param <O> Type of the owner passed to cache factories.
 */
public final class ExtensionCache<O> {

  private final O owner;
  private final AtomicReference<Entry> slot = new AtomicReference<Entry>();
  private final Object creationLock = new Object();

  public ExtensionCache(O owner) {
    this.owner = Preconditions.checkNotNull(owner);
  }

  /**
   * Returns the cached instance, creating it with {@code factory} if the slot is empty.  The
   * factory is only invoked if no instance exists yet, and never by more than one thread.
   *
   * @param type Type the caller expects the cached instance to have.
   * @param factory Creates the instance from the owner.  Must not return {@code null}.
   * @param <T> Expected type.
   * @return The cached instance.
   * @throws CacheTypeMismatchException if the cached instance is not a {@code T}.
   */
  public <T> T getOrCreate(Class<T> type, Function<? super O, ? extends T> factory) {
    Preconditions.checkNotNull(type);
    Preconditions.checkNotNull(factory);

    Entry entry = slot.get();
    if (entry == null) {
      synchronized (creationLock) {
        entry = slot.get();
        if (entry == null) {
          T instance = factory.apply(owner);
          Preconditions.checkState(instance != null, "Cache factory for %s returned null.",
              type.getName());
          Entry created = new Entry(type, type.cast(instance));
          Preconditions.checkState(slot.compareAndSet(null, created));
          entry = created;
        }
      }
    }

    if (!type.isInstance(entry.instance)) {
      throw new CacheTypeMismatchException(type, entry.instance.getClass());
    }
    return type.cast(entry.instance);
  }

  /**
   * Returns the type the cached instance was created as, or {@code null} if the slot is empty.
   */
  @Nullable
  public Class<?> getCreatedType() {
    Entry entry = slot.get();
    return entry == null ? null : entry.createdType;
  }

  private static final class Entry {
    private final Class<?> createdType;
    private final Object instance;

    Entry(Class<?> createdType, Object instance) {
      this.createdType = createdType;
      this.instance = instance;
    }
  }
}
