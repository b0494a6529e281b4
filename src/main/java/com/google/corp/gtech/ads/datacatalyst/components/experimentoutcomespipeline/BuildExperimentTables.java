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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline;

import com.google.api.services.bigquery.model.TableRow;
import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.classify.OutcomeClassifier;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.AggregationDimension;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.AggregateCohortFn;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.ClassifyFunnelFactFn;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapDuplicationAnomalyToTableRow;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapOutcomeToDimensionKey;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapOutcomeToTableRow;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapOutcomeToUserExperimentKey;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.ResolveCanonicalOutcomeFn;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.ListCoder;
import org.apache.beam.sdk.coders.NullableCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;
import org.apache.beam.sdk.io.gcp.bigquery.TableRowJsonCoder;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.GroupByKey;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.View;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.PCollectionView;
import org.apache.beam.sdk.values.TupleTag;
import org.apache.beam.sdk.values.TupleTagList;

/**
 * Turns FunnelFacts into the experiment tables, each output as BigQuery TableRows:
 *
 * <ul>
 *   <li>{@link #OUTCOMES}: one classified Outcome per FunnelFact.
 *   <li>{@link #CLEAN_OUTCOMES}: the canonical, eligible, uncontaminated Outcome of each
 *       (userId, experimentName) pair.
 *   <li>{@link #AGGREGATED}: the clean cohort rolled up by the aggregation dimensions.
 *   <li>{@link #ANOMALIES}: the (userId, experimentName) pairs without exactly one canonical row.
 * </ul>
 *
 * <p>Data only flows forward: facts are classified, the classified outcomes are resolved into the
 * clean cohort, and the clean cohort is aggregated.
 */
public class BuildExperimentTables extends PTransform<PCollection<FunnelFact>, PCollectionTuple> {

  public static final TupleTag<TableRow> OUTCOMES = new TupleTag<TableRow>("outcomes") {};
  public static final TupleTag<TableRow> CLEAN_OUTCOMES =
      new TupleTag<TableRow>("outcomes_clean") {};
  public static final TupleTag<TableRow> AGGREGATED = new TupleTag<TableRow>("aggregated") {};
  public static final TupleTag<TableRow> ANOMALIES = new TupleTag<TableRow>("anomalies") {};

  private final ImmutableList<ExperimentConfig> experimentConfigs;
  private final ImmutableList<AggregationDimension> dimensions;
  private final OutcomeClassifier classifier;
  private final boolean logClassificationAmbiguities;

  public BuildExperimentTables(
      List<ExperimentConfig> experimentConfigs,
      List<AggregationDimension> dimensions,
      OutcomeClassifier classifier,
      boolean logClassificationAmbiguities) {
    if (dimensions.isEmpty()) {
      throw new IllegalArgumentException("At least one aggregation dimension is required");
    }
    this.experimentConfigs = ImmutableList.copyOf(experimentConfigs);
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.classifier = classifier;
    this.logClassificationAmbiguities = logClassificationAmbiguities;
  }

  @Override
  public PCollectionTuple expand(PCollection<FunnelFact> facts) {
    List<KV<String, ExperimentConfig>> configsByName = new ArrayList<>();
    for (ExperimentConfig config : experimentConfigs) {
      configsByName.add(KV.of(config.experimentName(), config));
    }
    PCollectionView<Map<String, ExperimentConfig>> experimentConfigsView = facts.getPipeline()
        .apply("CreateExperimentConfigs", Create.of(configsByName).withCoder(
            KvCoder.of(StringUtf8Coder.of(), SerializableCoder.of(ExperimentConfig.class))))
        .apply("CreateExperimentConfigsView", View.<String, ExperimentConfig>asMap());

    PCollection<Outcome> outcomes = facts
        .apply("ClassifyFunnelFacts", ParDo.of(
            new ClassifyFunnelFactFn(
                classifier, experimentConfigsView, logClassificationAmbiguities))
            .withSideInputs(experimentConfigsView));

    PCollectionTuple resolved = outcomes
        .apply("MapOutcomeToUserExperimentKey", ParDo.of(new MapOutcomeToUserExperimentKey()))
        .apply("GroupByUserExperiment", GroupByKey.<KV<String, String>, Outcome>create())
        .apply("ResolveCanonicalOutcome", ParDo.of(new ResolveCanonicalOutcomeFn())
            .withOutputTags(
                ResolveCanonicalOutcomeFn.CLEAN_OUTCOMES,
                TupleTagList.of(ResolveCanonicalOutcomeFn.DUPLICATION_ANOMALIES)));
    PCollection<Outcome> cleanOutcomes = resolved.get(ResolveCanonicalOutcomeFn.CLEAN_OUTCOMES);

    PCollection<TableRow> aggregated = cleanOutcomes
        .apply("MapOutcomeToDimensionKey", ParDo.of(new MapOutcomeToDimensionKey(dimensions)))
        .setCoder(KvCoder.of(
            ListCoder.of(NullableCoder.of(StringUtf8Coder.of())), AvroCoder.of(Outcome.class)))
        .apply("GroupByDimensions", GroupByKey.<List<String>, Outcome>create())
        .apply("AggregateCohort", ParDo.of(new AggregateCohortFn(dimensions)))
        .setCoder(TableRowJsonCoder.of());

    return PCollectionTuple
        .of(OUTCOMES, outcomes
            .apply("MapOutcomeToTableRow", ParDo.of(new MapOutcomeToTableRow()))
            .setCoder(TableRowJsonCoder.of()))
        .and(CLEAN_OUTCOMES, cleanOutcomes
            .apply("MapCleanOutcomeToTableRow", ParDo.of(new MapOutcomeToTableRow()))
            .setCoder(TableRowJsonCoder.of()))
        .and(AGGREGATED, aggregated)
        .and(ANOMALIES, resolved.get(ResolveCanonicalOutcomeFn.DUPLICATION_ANOMALIES)
            .apply("MapDuplicationAnomalyToTableRow",
                ParDo.of(new MapDuplicationAnomalyToTableRow()))
            .setCoder(TableRowJsonCoder.of()));
  }
}
