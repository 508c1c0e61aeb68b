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

import java.util.Objects;

/** Error of a JSON-RPC response. */
public final class JsonRpcError {

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;

  private final int code;
  private final String message;
  private final Object data;

  public JsonRpcError(int code) {
    this(code, defaultMessage(code), null);
  }

  public JsonRpcError(int code, String message) {
    this(code, message, null);
  }

  /**
   * Create an error.
   *
   * @param code error code, a reserved JSON-RPC 2.0 code or an application-defined code
   * @param message error message, the default message of the code if null
   * @param data additional information, can be null
   */
  public JsonRpcError(int code, String message, Object data) {
    this.code = code;
    this.message = message == null ? defaultMessage(code) : message;
    this.data = data;
  }

  /**
   * The standard message of a reserved code.
   *
   * @param code error code
   * @return the message, "Unknown error" for an application-defined code
   */
  public static String defaultMessage(int code) {
    switch (code) {
      case PARSE_ERROR:
        return "Parse error";
      case INVALID_REQUEST:
        return "Invalid Request";
      case METHOD_NOT_FOUND:
        return "Method not found";
      case INVALID_PARAMS:
        return "Invalid params";
      case INTERNAL_ERROR:
        return "Internal error";
      default:
        return "Unknown error";
    }
  }

  public int code() {
    return this.code;
  }

  public String message() {
    return this.message;
  }

  public Object data() {
    return this.data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    JsonRpcError that = (JsonRpcError) o;
    return code == that.code && message.equals(that.message) && Objects.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, data);
  }

  @Override
  public String toString() {
    return "JsonRpcError{" + "code=" + code + ", message='" + message + '\'' + ", data=" + data + '}';
  }
}
