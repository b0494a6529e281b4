// Copyright 2019 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.joda.time.Duration;
import org.joda.time.Instant;
import org.junit.jupiter.api.Test;

class ExperimentConfigTest {

  private static final Instant START = new Instant(1000L);
  private static final Instant END = new Instant(5000L);

  private static ExperimentConfig.Builder config() {
    return ExperimentConfig.builder()
        .setExperimentName("pricing_page_test")
        .setStartDate(START)
        .setEndDate(END);
  }

  @Test
  void builder_defaultsToWebOnlyWithoutGrace() {
    ExperimentConfig config = config().build();

    assertThat(config.productType()).isEqualTo(ProductType.WEB_ONLY);
    assertThat(config.activationGraceDays()).isZero();
    assertThat(config.activationGraceDuration()).isEqualTo(Duration.ZERO);
  }

  @Test
  void activationGrace_onlyAppliesToHybridProducts() {
    ExperimentConfig webOnly = config().setActivationGraceDays(7).build();
    ExperimentConfig hybrid =
        config().setProductType(ProductType.HYBRID).setActivationGraceDays(7).build();

    assertThat(webOnly.activationGraceDuration()).isEqualTo(Duration.ZERO);
    assertThat(hybrid.activationGraceDuration()).isEqualTo(Duration.standardDays(7));
  }

  @Test
  void isWithinWindow_includesStartAndExcludesEnd() {
    ExperimentConfig config = config().build();

    assertThat(config.isWithinWindow(START)).isTrue();
    assertThat(config.isWithinWindow(new Instant(4999L))).isTrue();
    assertThat(config.isWithinWindow(END)).isFalse();
    assertThat(config.isWithinWindow(new Instant(999L))).isFalse();
    assertThat(config.isWithinWindow(null)).isFalse();
  }

  @Test
  void build_rejectsEmptyWindow() {
    assertThatThrownBy(() -> config().setEndDate(START).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("pricing_page_test");
  }

  @Test
  void build_rejectsNegativeGrace() {
    assertThatThrownBy(() -> config().setActivationGraceDays(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void build_rejectsGraceTooLongToSubtract() {
    assertThatThrownBy(() -> config()
        .setProductType(ProductType.HYBRID)
        .setActivationGraceDays(200_000_000_000L)
        .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("pricing_page_test");
    assertThatThrownBy(() -> config()
        .setActivationGraceDays(ExperimentConfig.MAX_ACTIVATION_GRACE_DAYS + 1)
        .build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void build_acceptsLongestGrace() {
    ExperimentConfig config = config()
        .setProductType(ProductType.HYBRID)
        .setActivationGraceDays(ExperimentConfig.MAX_ACTIVATION_GRACE_DAYS)
        .build();

    assertThat(config.activationGraceDuration().getStandardDays())
        .isEqualTo(ExperimentConfig.MAX_ACTIVATION_GRACE_DAYS);
  }
}
