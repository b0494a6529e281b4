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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ClassificationMode;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import org.junit.jupiter.api.Test;

class StagedFlagsClassifierTest {

  private final OutcomeClassifier classifier = new StagedFlagsClassifier();

  @Test
  void stagedFlags_arePassedThrough() {
    FunnelFact fact = FunnelFact.builder()
        .setUserId("user-1")
        .setExperimentName("unconfigured_test")
        .setDuplicationRank(1)
        .setStagedEligibleVisitor(true)
        .setStagedActivated(true)
        .setStagedConverted(false)
        .setStagedNewBooking(null)
        .build();

    // No config is needed to copy the staged flags.
    Outcome outcome = classifier.classify(fact, null);

    assertThat(outcome.isEligibleVisitor()).isTrue();
    assertThat(outcome.isActivated()).isTrue();
    assertThat(outcome.isConverted()).isFalse();
    assertThat(outcome.isNewBooking()).isFalse();
    assertThat(outcome.isOnboardingStarted()).isFalse();
  }

  @Test
  void forMode_returnsMatchingClassifier() {
    assertThat(OutcomeClassifier.forMode(ClassificationMode.DERIVE))
        .isInstanceOf(EligibilityClassifier.class);
    assertThat(OutcomeClassifier.forMode(ClassificationMode.STAGED))
        .isInstanceOf(StagedFlagsClassifier.class);
  }
}
