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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform;

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.KV;

/**
 * Keys each Outcome by its (userId, experimentName) pair, the partition in which duplicate rows of
 * the same user are resolved.
 */
public class MapOutcomeToUserExperimentKey extends DoFn<Outcome, KV<KV<String, String>, Outcome>> {

  @ProcessElement
  public void processElement(ProcessContext context) {
    Outcome outcome = context.element();
    context.output(KV.of(
        KV.of(outcome.getFact().getUserId(), outcome.getFact().getExperimentName()), outcome));
  }
}
