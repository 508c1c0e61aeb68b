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

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Properties of a message to publish.
 *
 * <p>Instances are immutable, use {@link #builder()} to create them and {@link #toBuilder()} to
 * derive new instances.
 *
 * @see Exchange#publish(byte[], String, java.util.Set, Attributes)
 */
public final class Attributes {

  /** Non-persistent delivery mode. */
  public static final int DELIVERY_MODE_NON_PERSISTENT = 1;

  /** Persistent delivery mode. */
  public static final int DELIVERY_MODE_PERSISTENT = 2;

  private static final Attributes EMPTY = builder().build();

  private final String contentType;
  private final String contentEncoding;
  private final Integer deliveryMode;
  private final Integer priority;
  private final String correlationId;
  private final String replyTo;
  private final String expiration;
  private final String messageId;
  private final Date timestamp;
  private final String type;
  private final String userId;
  private final String appId;
  private final Map<String, Object> headers;

  private Attributes(Builder builder) {
    this.contentType = builder.contentType;
    this.contentEncoding = builder.contentEncoding;
    this.deliveryMode = builder.deliveryMode;
    this.priority = builder.priority;
    this.correlationId = builder.correlationId;
    this.replyTo = builder.replyTo;
    this.expiration = builder.expiration;
    this.messageId = builder.messageId;
    this.timestamp = builder.timestamp == null ? null : new Date(builder.timestamp.getTime());
    this.type = builder.type;
    this.userId = builder.userId;
    this.appId = builder.appId;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
  }

  public static Attributes empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder =
        new Builder()
            .contentType(this.contentType)
            .contentEncoding(this.contentEncoding)
            .deliveryMode(this.deliveryMode)
            .priority(this.priority)
            .correlationId(this.correlationId)
            .replyTo(this.replyTo)
            .expiration(this.expiration)
            .messageId(this.messageId)
            .timestamp(this.timestamp)
            .type(this.type)
            .userId(this.userId)
            .appId(this.appId);
    builder.headers.putAll(this.headers);
    return builder;
  }

  /**
   * Combine these attributes with others.
   *
   * <p>Values set in <code>overrides</code> win, headers are merged.
   *
   * @param overrides attributes taking precedence
   * @return the merged attributes
   */
  public Attributes merge(Attributes overrides) {
    if (overrides == null || overrides == EMPTY) {
      return this;
    }
    Builder builder = this.toBuilder();
    if (overrides.contentType != null) {
      builder.contentType(overrides.contentType);
    }
    if (overrides.contentEncoding != null) {
      builder.contentEncoding(overrides.contentEncoding);
    }
    if (overrides.deliveryMode != null) {
      builder.deliveryMode(overrides.deliveryMode);
    }
    if (overrides.priority != null) {
      builder.priority(overrides.priority);
    }
    if (overrides.correlationId != null) {
      builder.correlationId(overrides.correlationId);
    }
    if (overrides.replyTo != null) {
      builder.replyTo(overrides.replyTo);
    }
    if (overrides.expiration != null) {
      builder.expiration(overrides.expiration);
    }
    if (overrides.messageId != null) {
      builder.messageId(overrides.messageId);
    }
    if (overrides.timestamp != null) {
      builder.timestamp(overrides.timestamp);
    }
    if (overrides.type != null) {
      builder.type(overrides.type);
    }
    if (overrides.userId != null) {
      builder.userId(overrides.userId);
    }
    if (overrides.appId != null) {
      builder.appId(overrides.appId);
    }
    builder.headers.putAll(overrides.headers);
    return builder.build();
  }

  public String contentType() {
    return this.contentType;
  }

  public String contentEncoding() {
    return this.contentEncoding;
  }

  public Integer deliveryMode() {
    return this.deliveryMode;
  }

  public Integer priority() {
    return this.priority;
  }

  public String correlationId() {
    return this.correlationId;
  }

  public String replyTo() {
    return this.replyTo;
  }

  public String expiration() {
    return this.expiration;
  }

  public String messageId() {
    return this.messageId;
  }

  public Date timestamp() {
    return this.timestamp == null ? null : new Date(this.timestamp.getTime());
  }

  public String type() {
    return this.type;
  }

  public String userId() {
    return this.userId;
  }

  public String appId() {
    return this.appId;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  @Override
  public String toString() {
    return "Attributes{"
        + "contentType='"
        + contentType
        + '\''
        + ", contentEncoding='"
        + contentEncoding
        + '\''
        + ", deliveryMode="
        + deliveryMode
        + ", correlationId='"
        + correlationId
        + '\''
        + ", replyTo='"
        + replyTo
        + '\''
        + ", type='"
        + type
        + '\''
        + ", appId='"
        + appId
        + '\''
        + ", headers="
        + headers
        + '}';
  }

  /** Builder for {@link Attributes}. */
  public static final class Builder {

    private String contentType;
    private String contentEncoding;
    private Integer deliveryMode;
    private Integer priority;
    private String correlationId;
    private String replyTo;
    private String expiration;
    private String messageId;
    private Date timestamp;
    private String type;
    private String userId;
    private String appId;
    private final Map<String, Object> headers = new LinkedHashMap<>();

    private Builder() {}

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder contentEncoding(String contentEncoding) {
      this.contentEncoding = contentEncoding;
      return this;
    }

    /**
     * Delivery mode, 1 for non-persistent, 2 for persistent.
     *
     * @param deliveryMode delivery mode
     * @return this builder
     * @see #DELIVERY_MODE_NON_PERSISTENT
     * @see #DELIVERY_MODE_PERSISTENT
     */
    public Builder deliveryMode(Integer deliveryMode) {
      if (deliveryMode != null
          && deliveryMode != DELIVERY_MODE_NON_PERSISTENT
          && deliveryMode != DELIVERY_MODE_PERSISTENT) {
        throw new IllegalArgumentException("Delivery mode must be 1 or 2, not " + deliveryMode);
      }
      this.deliveryMode = deliveryMode;
      return this;
    }

    public Builder priority(Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    public Builder expiration(String expiration) {
      this.expiration = expiration;
      return this;
    }

    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    public Builder timestamp(Date timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder appId(String appId) {
      this.appId = appId;
      return this;
    }

    public Builder header(String name, Object value) {
      this.headers.put(name, value);
      return this;
    }

    public Builder headers(Map<String, Object> headers) {
      if (headers != null) {
        this.headers.putAll(headers);
      }
      return this;
    }

    public Attributes build() {
      return new Attributes(this);
    }
  }
}
