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

package com.twitter.aggregation.application;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import com.twitter.aggregation.base.ExceptionalCommand;

/**
 * A registry of actions to run when the process shuts down.  Metric managers register their
 * graceful stop here so that buffered observations are flushed before the JVM exits.
 */
public interface ShutdownRegistry {

  /**
   * Adds an action to the shutdown registry.
   *
   * @param action Action to register.
   * @param <E> Exception type thrown by the action.
   * @param <T> Type of command.
   */
  <E extends Exception, T extends ExceptionalCommand<E>> void addAction(T action);

  /**
   * Executes actions in the reverse order they were registered.  A failing action is logged and
   * does not prevent the remaining actions from running.
   */
  public static class ShutdownRegistryImpl implements ShutdownRegistry {
    private static final Logger LOG = Logger.getLogger(ShutdownRegistry.class.getName());

    private final List<ExceptionalCommand<? extends Exception>> actions = Lists.newLinkedList();

    private boolean completed = false;

    /**
     * Registers an action to execute during {@link #execute()}. It is an error to call this method
     * after calling {@link #execute()}.
     *
     * @param action the action to add to the list of actions to execute during execution
     */
    @Override
    public synchronized <E extends Exception, T extends ExceptionalCommand<E>> void addAction(
        T action) {
      Preconditions.checkNotNull(action);
      Preconditions.checkState(!completed, "Shutdown actions have already been executed.");
      actions.add(action);
    }

    /**
     * Runs all registered actions.  Only the first call has any effect.
     */
    public synchronized void execute() {
      if (completed) {
        LOG.info("Shutdown actions have already been executed, subsequent calls ignored.");
        return;
      }

      LOG.info(String.format("Executing %d shutdown actions.", actions.size()));
      completed = true;
      try {
        for (ExceptionalCommand<? extends Exception> action : Lists.reverse(actions)) {
          // Every action must get a chance to run, so failures are logged and skipped.
          // SUPPRESS CHECKSTYLE:OFF IllegalCatch
          try {
            action.execute();
          } catch (Exception e) {
            LOG.log(Level.WARNING, "Shutdown action failed.", e);
          }
          // SUPPRESS CHECKSTYLE:ON IllegalCatch
        }
      } finally {
        actions.clear();
      }
    }
  }
}
