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

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ClassificationMode;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.io.Serializable;

/**
 * Maps a {@link FunnelFact} to its {@link Outcome}. Implementations are pure and total: they hold
 * no mutable state and never throw for any fact, so facts may be classified in any order and in
 * parallel.
 */
public interface OutcomeClassifier extends Serializable {

  /**
   * Classifies the fact under the given experiment configuration. A null config means the
   * experiment is unknown, and no funnel stage is reached.
   */
  Outcome classify(FunnelFact fact, ExperimentConfig config);

  static OutcomeClassifier forMode(ClassificationMode mode) {
    switch (mode) {
      case DERIVE:
        return new EligibilityClassifier();
      case STAGED:
        return new StagedFlagsClassifier();
    }
    throw new IllegalArgumentException("Invalid classification mode: " + mode);
  }
}
