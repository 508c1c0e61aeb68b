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

import com.rabbitmq.client.batch.Attributes;
import com.rabbitmq.client.batch.DeliveryResult;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.impl.AbstractConsumer;

/**
 * JSON-RPC server over a queue.
 *
 * <p>Requests are acknowledged as soon as they are received, before the handler is called. A
 * request with a correlation ID gets a reply on its reply-to queue, a request without correlation
 * ID is a notification and gets no reply.
 *
 * @see JsonRpcServerBuilder
 */
public class JsonRpcServer extends AbstractConsumer {

  private final Handler handler;
  private final Exchange replyExchange;
  private final String appId;

  JsonRpcServer(JsonRpcServerBuilder builder) {
    super(
        builder.queue(),
        builder.consumerTag(),
        builder.controlAppId(),
        1,
        builder.idleTimeout(),
        builder.logger(),
        builder.metricsCollector(),
        builder.registerShutdownHook(),
        builder.listeners());
    this.handler = builder.handler();
    this.appId = builder.appId();
    this.replyExchange =
        builder
            .queue()
            .channel()
            .newExchange()
            .name(builder.replyExchange())
            .type(Exchange.Type.DIRECT);
  }

  @Override
  protected DeliveryResult onDelivery(Envelope envelope) throws Exception {
    this.acknowledge(envelope);
    if (this.isControlMessage(envelope)) {
      return this.handleControlMessage(envelope);
    } else {
      return this.handleDelivery(envelope);
    }
  }

  @Override
  protected DeliveryResult handleDelivery(Envelope envelope) {
    JsonRpcResponse response;
    try {
      JsonRpcRequest request = requestFromEnvelope(envelope);
      Object result = this.handler.handle(request);
      if (request.isNotification()) {
        return DeliveryResult.ACK;
      }
      if (result instanceof JsonRpcResponse) {
        response = (JsonRpcResponse) result;
      } else {
        response = JsonRpcResponse.withResult(envelope.correlationId(), result);
      }
    } catch (JsonRpcException.InvalidVersionException e) {
      this.logger().error("Invalid JSON-RPC version for message {}", envelope.deliveryTag());
      response = errorResponse(envelope, e);
    } catch (JsonRpcException.InvalidRequestException e) {
      this.logger().error("Invalid JSON-RPC request for message {}", envelope.deliveryTag());
      response = errorResponse(envelope, e);
    } catch (JsonRpcException.ParseErrorException e) {
      this.logger().error("JSON parse error for message {}", envelope.deliveryTag());
      response = errorResponse(envelope, e);
    } catch (JsonRpcException e) {
      this.logger()
          .warn("JSON-RPC error {} for message {}", e.code(), envelope.deliveryTag());
      response = JsonRpcResponse.withError(envelope.correlationId(), e.error());
    } catch (Exception e) {
      this.logger()
          .error("Exception occurred for message {}: {}", envelope.deliveryTag(), e.getMessage(), e);
      response =
          JsonRpcResponse.withError(
              envelope.correlationId(), new JsonRpcError(JsonRpcError.INTERNAL_ERROR));
    }
    this.sendReply(response, envelope);
    return DeliveryResult.ACK;
  }

  /**
   * Nothing to do, the message was acknowledged on reception.
   *
   * @param envelope the message
   * @param result the outcome
   */
  @Override
  protected void processResult(Envelope envelope, DeliveryResult result) {
    this.logger()
        .debug("Message {} already acknowledged, ignoring {}", envelope.deliveryTag(), result);
  }

  protected void sendReply(JsonRpcResponse response, Envelope envelope) {
    if (envelope.correlationId() == null || envelope.replyTo() == null) {
      this.logger()
          .warn(
              "Cannot reply to message {} (correlation ID {}, reply to {}), dropping response",
              envelope.deliveryTag(),
              envelope.correlationId(),
              envelope.replyTo());
      return;
    }
    Attributes attributes =
        Attributes.builder()
            .contentType(JsonRpcCodec.CONTENT_TYPE)
            .contentEncoding(JsonRpcCodec.CONTENT_ENCODING)
            .deliveryMode(Attributes.DELIVERY_MODE_PERSISTENT)
            .correlationId(envelope.correlationId())
            .appId(this.appId)
            .header(JsonRpcCodec.VERSION_HEADER, JsonRpcCodec.VERSION)
            .build();
    this.replyExchange.publish(
        JsonRpcCodec.encodeResponse(response), envelope.replyTo(), attributes);
    this.metricsCollector().publish();
  }

  private static JsonRpcResponse errorResponse(Envelope envelope, JsonRpcException e) {
    return JsonRpcResponse.withError(envelope.correlationId(), new JsonRpcError(e.code()));
  }

  static JsonRpcRequest requestFromEnvelope(Envelope envelope) {
    Object version = envelope.header(JsonRpcCodec.VERSION_HEADER);
    if (version == null || !JsonRpcCodec.VERSION.equals(version.toString())) {
      throw new JsonRpcException.InvalidVersionException(
          "Unsupported JSON-RPC version: " + version);
    }
    if (!JsonRpcCodec.CONTENT_TYPE.equals(envelope.contentType())
        || !JsonRpcCodec.CONTENT_ENCODING.equals(envelope.contentEncoding())) {
      throw new JsonRpcException.InvalidRequestException(
          "Unsupported content type or encoding: "
              + envelope.contentType()
              + ", "
              + envelope.contentEncoding());
    }
    Object params = JsonRpcCodec.decode(envelope.body());
    return new JsonRpcRequest(
        envelope.exchangeName(),
        envelope.type(),
        params,
        envelope.correlationId(),
        envelope.routingKey(),
        envelope.expiration(),
        envelope.timestamp());
  }

  Exchange replyExchange() {
    return this.replyExchange;
  }

  /** Application handler of JSON-RPC requests. */
  @FunctionalInterface
  public interface Handler {

    /**
     * Handle a request.
     *
     * @param request the request
     * @return the result, sent back as is if it is a {@link JsonRpcResponse}, wrapped in a
     *     successful response otherwise
     * @throws Exception if the handling fails, a {@link JsonRpcException} to reply with a specific
     *     error
     */
    Object handle(JsonRpcRequest request) throws Exception;
  }
}
