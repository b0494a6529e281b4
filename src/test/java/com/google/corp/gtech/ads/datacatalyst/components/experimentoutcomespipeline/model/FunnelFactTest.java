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

import org.junit.jupiter.api.Test;

class FunnelFactTest {

  @Test
  void isContaminated_onlyNotContaminatedIsClean() {
    assertThat(fact(FunnelFact.NOT_CONTAMINATED).isContaminated()).isFalse();
    assertThat(fact("Cross-Bucket").isContaminated()).isTrue();
    assertThat(fact("not contaminated").isContaminated()).isTrue();
    assertThat(fact(null).isContaminated()).isTrue();
  }

  @Test
  void toBuilder_leavesOriginalUnchanged() {
    FunnelFact original = fact(FunnelFact.NOT_CONTAMINATED);

    FunnelFact changed = original.toBuilder().setVariant("control").build();

    assertThat(original.getVariant()).isEqualTo("treatment");
    assertThat(changed.getVariant()).isEqualTo("control");
    assertThat(changed).isNotEqualTo(original);
    assertThat(changed.toBuilder().setVariant("treatment").build()).isEqualTo(original);
  }

  private static FunnelFact fact(String contaminationFlag) {
    return FunnelFact.builder()
        .setUserId("user-1")
        .setExperimentName("homepage_cta_test")
        .setVariant("treatment")
        .setContaminationFlag(contaminationFlag)
        .setDuplicationRank(1)
        .build();
  }
}
