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

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.classify.EligibilityClassifier;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.classify.OutcomeClassifier;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.util.Map;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.PCollectionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies each FunnelFact into an Outcome using the configuration of its experiment, read from
 * a side input keyed by experiment name.
 *
 * <p>Classification ambiguities (no configuration for the experiment, no first exposure date, an
 * activation rejected because of a conversion before exposure) never fail the row. They are always
 * counted, and logged per row only when logAmbiguities is set.
 */
public class ClassifyFunnelFactFn extends DoFn<FunnelFact, Outcome> {
  private static final Logger LOG = LoggerFactory.getLogger(ClassifyFunnelFactFn.class);

  public static final String METRICS_NAMESPACE = "experiment_outcomes";
  public static final String FACTS_CLASSIFIED = "facts_classified";
  public static final String FACTS_WITHOUT_CONFIG = "facts_without_config";
  public static final String FACTS_MISSING_EXPOSURE = "facts_missing_exposure";
  public static final String PRE_EXPOSURE_CONVERSIONS =
      "activations_rejected_for_pre_exposure_conversion";

  private final Counter factsClassified = Metrics.counter(METRICS_NAMESPACE, FACTS_CLASSIFIED);
  private final Counter factsWithoutConfig =
      Metrics.counter(METRICS_NAMESPACE, FACTS_WITHOUT_CONFIG);
  private final Counter factsMissingExposure =
      Metrics.counter(METRICS_NAMESPACE, FACTS_MISSING_EXPOSURE);
  private final Counter preExposureConversions =
      Metrics.counter(METRICS_NAMESPACE, PRE_EXPOSURE_CONVERSIONS);

  private final OutcomeClassifier classifier;
  // View map of experiment name to its ExperimentConfig.
  private final PCollectionView<Map<String, ExperimentConfig>> experimentConfigsView;
  private final boolean logAmbiguities;

  public ClassifyFunnelFactFn(
      OutcomeClassifier classifier,
      PCollectionView<Map<String, ExperimentConfig>> experimentConfigsView,
      boolean logAmbiguities) {
    this.classifier = classifier;
    this.experimentConfigsView = experimentConfigsView;
    this.logAmbiguities = logAmbiguities;
  }

  @ProcessElement
  public void processElement(ProcessContext context) {
    FunnelFact fact = context.element();
    ExperimentConfig config = context.sideInput(experimentConfigsView).get(
        fact.getExperimentName());
    Outcome outcome = classifier.classify(fact, config);
    recordAmbiguities(fact, config, outcome);
    factsClassified.inc();
    context.output(outcome);
  }

  private void recordAmbiguities(FunnelFact fact, ExperimentConfig config, Outcome outcome) {
    if (config == null) {
      factsWithoutConfig.inc();
      logAmbiguity(fact, "no configuration for experiment");
    }
    if (fact.getFirstExposureDate() == null) {
      factsMissingExposure.inc();
      logAmbiguity(fact, "no first exposure date");
    }
    if (outcome.isEligibleVisitor()
        && fact.getActivationDate() != null
        && EligibilityClassifier.hasPreExposureConversion(fact)) {
      preExposureConversions.inc();
      logAmbiguity(fact, "activation rejected, conversion precedes first exposure");
    }
  }

  private void logAmbiguity(FunnelFact fact, String reason) {
    if (logAmbiguities) {
      LOG.warn("User [{}] in experiment [{}]: {}",
          fact.getUserId(), fact.getExperimentName(), reason);
    }
  }
}
