// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.batch.impl;

import static com.rabbitmq.client.batch.Resource.State.FLUSHING;
import static com.rabbitmq.client.batch.Resource.State.IDLE;
import static com.rabbitmq.client.batch.Resource.State.RUNNING;

import com.rabbitmq.client.batch.Resource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = new ArrayList<>(listeners);
    this.state(IDLE);
  }

  protected boolean isConsuming() {
    State current = this.state.get();
    return current == RUNNING || current == FLUSHING;
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable failureCause) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      this.dispatch(previousState, state, failureCause);
    }
  }

  private void dispatch(State previous, State current, Throwable failureCause) {
    if (!this.listeners.isEmpty()) {
      Context context = new DefaultContext(this, failureCause, previous, current);
      for (StateListener listener : this.listeners) {
        try {
          listener.handle(context);
        } catch (Exception e) {
          LOGGER.warn("Error in resource listener", e);
        }
      }
    }
  }

  private static final class DefaultContext implements Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private DefaultContext(
        Resource resource, Throwable failureCause, State previousState, State currentState) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }
  }
}
