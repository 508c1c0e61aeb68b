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
package com.rabbitmq.client.batch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong consumers;
  private final Counter consume, consumeAcknowledged, consumeRejected, consumeRequeued;
  private final Counter flushAcknowledged, flushRejected;
  private final DistributionSummary flushSize;
  private final Counter publish;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.batch");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.consumers = registry.gauge(prefix + ".consumers", tags, new AtomicLong(0));
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.consumeAcknowledged = registry.counter(prefix + ".consumed_acknowledged", tags);
    this.consumeRejected = registry.counter(prefix + ".consumed_rejected", tags);
    this.consumeRequeued = registry.counter(prefix + ".consumed_requeued", tags);
    this.flushAcknowledged = registry.counter(prefix + ".flushed_acknowledged", tags);
    this.flushRejected = registry.counter(prefix + ".flushed_rejected", tags);
    this.flushSize =
        DistributionSummary.builder(prefix + ".flush_size").tags(tags).register(registry);
    this.publish = registry.counter(prefix + ".published", tags);
  }

  @Override
  public void openConsumer() {
    this.consumers.incrementAndGet();
  }

  @Override
  public void closeConsumer() {
    this.consumers.decrementAndGet();
  }

  @Override
  public void consume() {
    this.consume.increment();
  }

  @Override
  public void consumeDisposition(ConsumeDisposition disposition) {
    switch (disposition) {
      case ACKNOWLEDGED:
        this.consumeAcknowledged.increment();
        break;
      case REJECTED:
        this.consumeRejected.increment();
        break;
      case REQUEUED:
        this.consumeRequeued.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void flush(int batchSize, ConsumeDisposition disposition) {
    this.flushSize.record(batchSize);
    if (disposition == ConsumeDisposition.ACKNOWLEDGED) {
      this.flushAcknowledged.increment(batchSize);
    } else {
      this.flushRejected.increment(batchSize);
    }
  }

  @Override
  public void publish() {
    this.publish.increment();
  }
}
