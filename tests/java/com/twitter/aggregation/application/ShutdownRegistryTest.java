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

import java.io.IOException;

import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Test;

import com.twitter.aggregation.application.ShutdownRegistry.ShutdownRegistryImpl;
import com.twitter.aggregation.base.Command;
import com.twitter.aggregation.base.ExceptionalCommand;
import com.twitter.aggregation.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.expectLastCall;

public class ShutdownRegistryTest extends EasyMockTest {

  private Command first;
  private ExceptionalCommand<IOException> second;
  private ShutdownRegistryImpl shutdownRegistry;

  @Before
  public void setUp() {
    control = EasyMock.createStrictControl();
    first = createMock(Command.class);
    second = createMock(new Clazz<ExceptionalCommand<IOException>>() { });
    shutdownRegistry = new ShutdownRegistryImpl();
  }

  @Test
  public void testActionsRunInReverseOrder() throws Exception {
    second.execute();
    first.execute();

    control.replay();

    shutdownRegistry.addAction(first);
    shutdownRegistry.addAction(second);
    shutdownRegistry.execute();
  }

  @Test
  public void testFailingActionDoesNotStopOthers() throws Exception {
    second.execute();
    expectLastCall().andThrow(new IOException("flush failed"));
    first.execute();

    control.replay();

    shutdownRegistry.addAction(first);
    shutdownRegistry.addAction(second);
    shutdownRegistry.execute();
  }

  @Test
  public void testExecutesOnlyOnce() {
    first.execute();

    control.replay();

    shutdownRegistry.addAction(first);
    shutdownRegistry.execute();
    shutdownRegistry.execute();
  }

  @Test(expected = IllegalStateException.class)
  public void testAddAfterExecute() {
    control.replay();

    shutdownRegistry.execute();
    shutdownRegistry.addAction(first);
  }
}
