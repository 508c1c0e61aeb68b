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

/**
 * JSON-RPC failure, turned into an error response by {@link JsonRpcServer}.
 *
 * <p>Handlers can throw instances of this class to reply with a specific error code.
 */
public class JsonRpcException extends RuntimeException {

  private final JsonRpcError error;

  public JsonRpcException(JsonRpcError error) {
    super(error.message());
    this.error = error;
  }

  public JsonRpcException(int code, String message) {
    this(new JsonRpcError(code, message));
  }

  JsonRpcException(int code, String message, Throwable cause) {
    super(message, cause);
    this.error = new JsonRpcError(code, message);
  }

  public JsonRpcError error() {
    return this.error;
  }

  public int code() {
    return this.error.code();
  }

  /** The <code>jsonrpc</code> header is missing or is not <code>2.0</code>. */
  public static class InvalidVersionException extends JsonRpcException {

    public InvalidVersionException(String message) {
      super(JsonRpcError.INVALID_REQUEST, message);
    }
  }

  /** The request does not have the expected content type and encoding. */
  public static class InvalidRequestException extends JsonRpcException {

    public InvalidRequestException(String message) {
      super(JsonRpcError.INVALID_REQUEST, message);
    }
  }

  /** The body is not valid JSON. */
  public static class ParseErrorException extends JsonRpcException {

    public ParseErrorException(String message, Throwable cause) {
      super(JsonRpcError.PARSE_ERROR, message, cause);
    }
  }

  public static class MethodNotFoundException extends JsonRpcException {

    public MethodNotFoundException(String method) {
      super(JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + method);
    }
  }

  public static class InvalidParamsException extends JsonRpcException {

    public InvalidParamsException(String message) {
      super(JsonRpcError.INVALID_PARAMS, message);
    }
  }
}
