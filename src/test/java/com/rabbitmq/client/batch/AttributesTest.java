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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Date;
import org.junit.jupiter.api.Test;

public class AttributesTest {

  @Test
  void mergeShouldKeepDefaultsAndApplyOverrides() {
    Attributes defaults =
        Attributes.builder()
            .contentType("application/json")
            .appId("app")
            .priority(1)
            .header("a", 1)
            .header("b", 2)
            .build();
    Attributes overrides =
        Attributes.builder().appId("other").correlationId("42").header("b", 3).build();

    Attributes merged = defaults.merge(overrides);

    assertThat(merged.contentType()).isEqualTo("application/json");
    assertThat(merged.appId()).isEqualTo("other");
    assertThat(merged.correlationId()).isEqualTo("42");
    assertThat(merged.priority()).isEqualTo(1);
    assertThat(merged.headers()).containsEntry("a", 1).containsEntry("b", 3);
    assertThat(defaults.appId()).isEqualTo("app");
  }

  @Test
  void mergeWithEmptyAttributesShouldReturnSameInstance() {
    Attributes attributes = Attributes.builder().type("t").build();
    assertThat(attributes.merge(Attributes.empty())).isSameAs(attributes);
    assertThat(attributes.merge(null)).isSameAs(attributes);
  }

  @Test
  void attributesShouldBeImmutable() {
    Date timestamp = new Date(1000);
    Attributes attributes = Attributes.builder().timestamp(timestamp).header("h", "v").build();
    timestamp.setTime(2000);
    assertThat(attributes.timestamp()).isEqualTo(new Date(1000));
    assertThatThrownBy(() -> attributes.headers().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void invalidDeliveryModeShouldBeRefused() {
    assertThatThrownBy(() -> Attributes.builder().deliveryMode(3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toBuilderShouldCopyAllValues() {
    Attributes attributes =
        Attributes.builder()
            .contentType("text/plain")
            .contentEncoding("UTF-8")
            .deliveryMode(Attributes.DELIVERY_MODE_PERSISTENT)
            .replyTo("replies")
            .expiration("1000")
            .messageId("m1")
            .userId("guest")
            .build();
    Attributes copy = attributes.toBuilder().build();
    assertThat(copy.contentType()).isEqualTo("text/plain");
    assertThat(copy.contentEncoding()).isEqualTo("UTF-8");
    assertThat(copy.deliveryMode()).isEqualTo(2);
    assertThat(copy.replyTo()).isEqualTo("replies");
    assertThat(copy.expiration()).isEqualTo("1000");
    assertThat(copy.messageId()).isEqualTo("m1");
    assertThat(copy.userId()).isEqualTo("guest");
  }
}
