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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON conversion of JSON-RPC payloads with Gson.
 *
 * <p>Decoding is strict, JSON numbers are decoded as {@link Long} when they are integral, as
 * {@link Double} otherwise.
 */
public final class JsonRpcCodec {

  public static final String VERSION = "2.0";
  public static final String VERSION_HEADER = "jsonrpc";
  public static final String CONTENT_TYPE = "application/json";
  public static final String CONTENT_ENCODING = "UTF-8";

  private static final Gson GSON =
      new GsonBuilder()
          .serializeNulls()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .create();

  private JsonRpcCodec() {}

  public static byte[] encode(Object value) {
    return GSON.toJson(value).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Decode a JSON document.
   *
   * @param body the UTF-8 JSON document
   * @return maps for objects, lists for arrays, strings, numbers, booleans or null
   * @throws JsonRpcException.ParseErrorException if the body is not a single valid JSON document
   */
  public static Object decode(byte[] body) {
    return GSON.fromJson(parse(body), Object.class);
  }

  /**
   * The reply body of a response.
   *
   * <p><code>{"result": ...}</code> for a success, <code>
   * {"error": {"code": ..., "message": ...}, "data": ...}</code> for an error.
   *
   * @param response the response
   * @return the reply body
   */
  public static byte[] encodeResponse(JsonRpcResponse response) {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (response.isError()) {
      Map<String, Object> error = new LinkedHashMap<>();
      error.put("code", response.error().code());
      error.put("message", response.error().message());
      payload.put("error", error);
      payload.put("data", response.error().data());
    } else {
      payload.put("result", response.result());
    }
    return encode(payload);
  }

  /**
   * Decode a reply body.
   *
   * @param id the request ID (correlation ID of the reply)
   * @param body the reply body
   * @return the response
   * @throws JsonRpcException.ParseErrorException if the body is not a valid reply
   */
  public static JsonRpcResponse decodeResponse(String id, byte[] body) {
    JsonElement element = parse(body);
    if (!element.isJsonObject()) {
      throw new JsonRpcException.ParseErrorException("Reply must be a JSON object", null);
    }
    JsonObject object = element.getAsJsonObject();
    if (object.has("error") && object.get("error").isJsonObject()) {
      JsonObject error = object.getAsJsonObject("error");
      int code =
          error.has("code") && !error.get("code").isJsonNull()
              ? error.get("code").getAsInt()
              : JsonRpcError.INTERNAL_ERROR;
      String message =
          error.has("message") && !error.get("message").isJsonNull()
              ? error.get("message").getAsString()
              : null;
      Object data = object.has("data") ? GSON.fromJson(object.get("data"), Object.class) : null;
      return JsonRpcResponse.withError(id, new JsonRpcError(code, message, data));
    } else if (object.has("result")) {
      return JsonRpcResponse.withResult(id, GSON.fromJson(object.get("result"), Object.class));
    } else {
      throw new JsonRpcException.ParseErrorException(
          "Reply must contain a result or an error", null);
    }
  }

  private static JsonElement parse(byte[] body) {
    if (body == null || body.length == 0) {
      throw new JsonRpcException.ParseErrorException("Empty JSON document", null);
    }
    try {
      JsonReader reader =
          new JsonReader(new StringReader(new String(body, StandardCharsets.UTF_8)));
      reader.setLenient(false);
      JsonElement element = GSON.getAdapter(JsonElement.class).read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new JsonRpcException.ParseErrorException("Trailing content after JSON document", null);
      }
      return element;
    } catch (IOException | JsonParseException | IllegalStateException e) {
      throw new JsonRpcException.ParseErrorException("Invalid JSON: " + e.getMessage(), e);
    }
  }
}
