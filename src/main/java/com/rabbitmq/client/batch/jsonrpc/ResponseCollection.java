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
package com.rabbitmq.client.batch.jsonrpc;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Responses received by a {@link JsonRpcClient}, indexed by request ID. */
public final class ResponseCollection implements Iterable<JsonRpcResponse> {

  private final Map<String, JsonRpcResponse> responses = new LinkedHashMap<>();

  ResponseCollection() {}

  void add(JsonRpcResponse response) {
    this.responses.put(response.id(), response);
  }

  /**
   * The response of a request.
   *
   * @param id the request ID
   * @return the response, null if it was not received
   */
  public JsonRpcResponse response(String id) {
    return this.responses.get(id);
  }

  public boolean hasResponse(String id) {
    return this.responses.containsKey(id);
  }

  public int size() {
    return this.responses.size();
  }

  public boolean isEmpty() {
    return this.responses.isEmpty();
  }

  @Override
  public Iterator<JsonRpcResponse> iterator() {
    return Collections.unmodifiableCollection(this.responses.values()).iterator();
  }

  @Override
  public String toString() {
    return "ResponseCollection{" + "responses=" + responses.values() + '}';
  }
}
