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

/** JSON-RPC response, with a result or an error. */
public final class JsonRpcResponse {

  private final String id;
  private final Object result;
  private final JsonRpcError error;

  private JsonRpcResponse(String id, Object result, JsonRpcError error) {
    this.id = id;
    this.result = result;
    this.error = error;
  }

  public static JsonRpcResponse withResult(String id, Object result) {
    return new JsonRpcResponse(id, result, null);
  }

  public static JsonRpcResponse withError(String id, JsonRpcError error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null");
    }
    return new JsonRpcResponse(id, null, error);
  }

  /**
   * The ID of the request, i.e. the correlation ID of the messages.
   *
   * @return the request ID
   */
  public String id() {
    return this.id;
  }

  public Object result() {
    return this.result;
  }

  public JsonRpcError error() {
    return this.error;
  }

  public boolean isError() {
    return this.error != null;
  }

  @Override
  public String toString() {
    return "JsonRpcResponse{"
        + "id='"
        + id
        + '\''
        + (isError() ? ", error=" + error : ", result=" + result)
        + '}';
  }
}
