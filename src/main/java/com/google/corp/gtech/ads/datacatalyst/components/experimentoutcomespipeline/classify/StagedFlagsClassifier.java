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

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;

/**
 * Copies the funnel flags pre-computed in the staging table into the Outcome, treating null as
 * false. The experiment configuration is ignored and no funnel ordering is enforced; the staging
 * table is trusted as is.
 */
public class StagedFlagsClassifier implements OutcomeClassifier {

  private static final long serialVersionUID = -3349712730685192284L;

  @Override
  public Outcome classify(FunnelFact fact, ExperimentConfig config) {
    return new Outcome(
        fact,
        Boolean.TRUE.equals(fact.getStagedEligibleVisitor()),
        Boolean.TRUE.equals(fact.getStagedActivated()),
        Boolean.TRUE.equals(fact.getStagedConverted()),
        Boolean.TRUE.equals(fact.getStagedNewBooking()));
  }
}
