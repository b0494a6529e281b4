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

import org.junit.jupiter.api.Test;

class AggregationDimensionTest {

  @Test
  void parseList_keepsOrder() {
    assertThat(AggregationDimension.parseList(" variant, device_type ,experiment_name"))
        .containsExactly(
            AggregationDimension.VARIANT,
            AggregationDimension.DEVICE_TYPE,
            AggregationDimension.EXPERIMENT_NAME);
  }

  @Test
  void parseList_blank_returnsDefaults() {
    assertThat(AggregationDimension.parseList("  ")).isEqualTo(
        AggregationDimension.DEFAULT_DIMENSIONS);
    assertThat(AggregationDimension.parseList(null)).isEqualTo(
        AggregationDimension.DEFAULT_DIMENSIONS);
  }

  @Test
  void parseList_rejectsUnknownAndDuplicateColumns() {
    assertThatThrownBy(() -> AggregationDimension.parseList("variant,browser"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("browser");
    assertThatThrownBy(() -> AggregationDimension.parseList("variant,region,variant"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void extract_readsMatchingField() {
    FunnelFact fact = FunnelFact.builder()
        .setExperimentName("homepage_cta_test")
        .setVariant("treatment")
        .setRegion("US")
        .setPackageGroup(null)
        .build();

    assertThat(AggregationDimension.EXPERIMENT_NAME.extract(fact)).isEqualTo("homepage_cta_test");
    assertThat(AggregationDimension.VARIANT.extract(fact)).isEqualTo("treatment");
    assertThat(AggregationDimension.REGION.extract(fact)).isEqualTo("US");
    assertThat(AggregationDimension.PACKAGE_GROUP.extract(fact)).isNull();
  }
}
