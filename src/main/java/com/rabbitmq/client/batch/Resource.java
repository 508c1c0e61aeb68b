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
package com.rabbitmq.client.batch;

/**
 * Marker interface for classes with a lifecycle, like {@link Consumer}.
 *
 * <p>Applications can register {@link StateListener}s to follow the state changes of a resource,
 * e.g. to know when a consumer stops.
 *
 * @see ConsumerBuilder#listeners(StateListener...)
 */
public interface Resource {

  /**
   * Application listener for a {@link Resource}.
   *
   * <p>Listeners are called on the thread that changes the state, they should not block.
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(Context context);
  }

  /** Context of a resource state change. */
  interface Context {

    /**
     * The resource instance.
     *
     * @return resource instance
     */
    Resource resource();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause, null if no cause for failure
     */
    Throwable failureCause();

    /**
     * The previous state of the resource.
     *
     * @return previous state
     */
    State previousState();

    /**
     * The current (new) state of the resource.
     *
     * @return current state
     */
    State currentState();
  }

  /** Resource state. */
  enum State {
    /** The resource has been created and is not consuming yet. */
    IDLE,
    /** The resource is consuming. */
    RUNNING,
    /** The resource is settling a batch of deferred messages. */
    FLUSHING,
    /** The resource stopped consuming. */
    STOPPED
  }
}
