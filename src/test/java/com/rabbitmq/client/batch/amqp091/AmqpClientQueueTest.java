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
package com.rabbitmq.client.batch.amqp091;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.batch.AmqpException;
import com.rabbitmq.client.batch.DeliveryResult;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.impl.CallbackConsumerBuilder;
import com.rabbitmq.client.impl.LongStringHelper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

public class AmqpClientQueueTest {

  Channel delegate;
  Queue queue;
  Consumer registeredConsumer;

  @BeforeEach
  void init() {
    delegate = mock(Channel.class);
    when(delegate.isOpen()).thenReturn(true);
    queue = new AmqpClientChannel(null, delegate).newQueue().name("orders");
  }

  @Test
  void consumeShouldDispatchDeliveriesAndCancelOnStop() throws Exception {
    stubConsume(
        consumer -> {
          consumer.handleDelivery("ctag", envelope(1), properties(), body("one"));
          consumer.handleDelivery("ctag", envelope(2), properties(), body("two"));
        });
    List<Envelope> received = new ArrayList<>();

    queue.consume(
        "ctag",
        Duration.ofMillis(10),
        envelope -> {
          received.add(envelope);
          return false;
        });

    assertThat(received).hasSize(1);
    assertThat(received.get(0).deliveryTag()).isEqualTo(1);
    assertThat(new String(received.get(0).body(), StandardCharsets.UTF_8)).isEqualTo("one");
    assertThat(received.get(0).appId()).isEqualTo("billing");
    verify(delegate).basicCancel("ctag");
    verify(delegate).basicReject(2L, true);
    verify(delegate, never()).basicReject(1L, true);
  }

  @Test
  void deliveryAfterStopShouldBeRequeued() throws Exception {
    stubConsume(consumer -> consumer.handleDelivery("ctag", envelope(1), properties(), body("one")));
    List<Envelope> received = new ArrayList<>();

    queue.consume(
        "ctag",
        Duration.ofMillis(10),
        envelope -> {
          received.add(envelope);
          return false;
        });
    // in flight when basic.cancel was sent
    registeredConsumer.handleDelivery("ctag", envelope(3), properties(), body("late"));

    assertThat(received).hasSize(1);
    verify(delegate).basicCancel("ctag");
    verify(delegate).basicReject(3L, true);
    verify(delegate, never()).basicReject(1L, true);
  }

  @Test
  void deliveryAfterStopShouldBeDroppedWhenChannelIsClosed() throws Exception {
    stubConsume(consumer -> {});
    int[] idleCount = new int[1];

    queue.consume(
        "ctag",
        Duration.ofMillis(10),
        new Queue.ConsumeCallback() {
          @Override
          public boolean onDelivery(Envelope envelope) {
            return true;
          }

          @Override
          public boolean onIdle() {
            return ++idleCount[0] < 1;
          }
        });
    when(delegate.isOpen()).thenReturn(false);
    registeredConsumer.handleDelivery("ctag", envelope(4), properties(), body("late"));

    verify(delegate, never()).basicReject(anyLong(), anyBoolean());
  }

  @Test
  void interruptedConsumerShouldAcknowledgeDeferredMessages() throws Exception {
    stubConsume(
        consumer -> {
          consumer.handleDelivery("ctag", envelope(1), properties(), body("one"));
          consumer.handleDelivery("ctag", envelope(2), properties(), body("two"));
        });
    com.rabbitmq.client.batch.Consumer consumer =
        new CallbackConsumerBuilder()
            .queue(queue)
            .consumerTag("ctag")
            .batchSize(10)
            .deliveryHandler(
                (env, q) -> {
                  if (env.deliveryTag() == 2) {
                    Thread.currentThread().interrupt();
                  }
                  return DeliveryResult.DEFER;
                })
            .build();

    consumer.consume(0);

    assertThat(Thread.interrupted()).isTrue();
    verify(delegate).basicCancel("ctag");
    verify(delegate).basicAck(2L, true);
    assertThat(consumer.unacknowledgedMessageCount()).isZero();
  }

  @Test
  void idlePollsShouldCallOnIdle() throws Exception {
    stubConsume(consumer -> {});
    int[] idleCount = new int[1];

    queue.consume(
        "ctag",
        Duration.ofMillis(10),
        new Queue.ConsumeCallback() {
          @Override
          public boolean onDelivery(Envelope envelope) {
            return true;
          }

          @Override
          public boolean onIdle() {
            return ++idleCount[0] < 3;
          }
        });

    assertThat(idleCount[0]).isEqualTo(3);
    verify(delegate).basicCancel("ctag");
  }

  @Test
  void brokerCancellationShouldEndConsume() throws Exception {
    stubConsume(consumer -> consumer.handleCancel("ctag"));

    queue.consume("ctag", Duration.ofMillis(10), envelope -> true);

    verify(delegate, never()).basicCancel(anyString());
  }

  @Test
  void shutdownSignalShouldFailConsume() throws Exception {
    stubConsume(
        consumer ->
            consumer.handleShutdownSignal(
                "ctag", new ShutdownSignalException(false, false, null, null)));

    assertThatThrownBy(() -> queue.consume("ctag", Duration.ofMillis(10), envelope -> true))
        .isInstanceOf(AmqpException.AmqpChannelException.class)
        .hasMessageContaining("orders");
    verify(delegate, never()).basicCancel(anyString());
  }

  @Test
  void settlementsShouldBeDelegated() throws Exception {
    queue.ack(5, true);
    queue.nack(6, true, false);
    queue.reject(7, true);

    verify(delegate).basicAck(5L, true);
    verify(delegate).basicNack(6L, true, false);
    verify(delegate).basicReject(7L, true);
  }

  @Test
  void clientErrorsShouldBeConverted() throws Exception {
    doThrow(new IOException("boom")).when(delegate).basicAck(anyLong(), anyBoolean());

    assertThatThrownBy(() -> queue.ack(1, false))
        .isInstanceOf(AmqpException.AmqpQueueException.class)
        .hasMessage("Error while acknowledging 1")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void declareShouldUseNameReturnedByBroker() throws Exception {
    AMQP.Queue.DeclareOk ok = mock(AMQP.Queue.DeclareOk.class);
    when(ok.getQueue()).thenReturn("amq.gen-1");
    when(ok.getMessageCount()).thenReturn(4);
    when(delegate.queueDeclare(eq(""), eq(false), eq(true), eq(true), anyMap())).thenReturn(ok);

    Queue serverNamed = queue.name(null).exclusive(true).autoDelete(true);

    assertThat(serverNamed.declare()).isEqualTo(4);
    assertThat(serverNamed.name()).isEqualTo("amq.gen-1");
  }

  @Test
  void passiveDeclareShouldNotCreateQueue() throws Exception {
    AMQP.Queue.DeclareOk ok = mock(AMQP.Queue.DeclareOk.class);
    when(ok.getQueue()).thenReturn("orders");
    when(delegate.queueDeclarePassive("orders")).thenReturn(ok);

    queue.passive(true).declare();

    verify(delegate, never())
        .queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), anyMap());
  }

  @Test
  void getShouldConvertResponse() throws Exception {
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .correlationId("r1")
            .headers(
                Map.of(
                    "jsonrpc",
                    LongStringHelper.asLongString("2.0"),
                    "path",
                    List.of(LongStringHelper.asLongString("a"))))
            .build();
    when(delegate.basicGet("orders", true))
        .thenReturn(new GetResponse(envelope(9), properties, body("{}"), 0));

    Envelope envelope = queue.get(true);

    assertThat(envelope.deliveryTag()).isEqualTo(9);
    assertThat(envelope.correlationId()).isEqualTo("r1");
    assertThat(envelope.headers()).containsEntry("jsonrpc", "2.0");
    assertThat(envelope.headers().get("path")).isEqualTo(List.of("a"));
  }

  @Test
  void getShouldReturnNullWhenQueueIsEmpty() throws Exception {
    when(delegate.basicGet("orders", false)).thenReturn(null);

    assertThat(queue.get(false)).isNull();
  }

  private void stubConsume(ConsumerAction action) throws IOException {
    Answer<String> answer =
        invocation -> {
          Consumer consumer = invocation.getArgument(3);
          registeredConsumer = consumer;
          action.accept(consumer);
          return "ctag";
        };
    when(delegate.basicConsume(eq("orders"), eq(false), eq("ctag"), any(Consumer.class)))
        .thenAnswer(answer);
  }

  private static com.rabbitmq.client.Envelope envelope(long tag) {
    return new com.rabbitmq.client.Envelope(tag, false, "", "orders");
  }

  private static AMQP.BasicProperties properties() {
    return new AMQP.BasicProperties.Builder().appId("billing").build();
  }

  private static byte[] body(String body) {
    return body.getBytes(StandardCharsets.UTF_8);
  }

  @FunctionalInterface
  private interface ConsumerAction {

    void accept(Consumer consumer) throws IOException;
  }
}
