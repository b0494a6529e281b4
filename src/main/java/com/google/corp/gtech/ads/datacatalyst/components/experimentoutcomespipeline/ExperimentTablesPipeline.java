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
import com.google.api.services.bigquery.model.TableSchema;
import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.classify.OutcomeClassifier;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.AggregationDimension;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.AggregateCohortFn;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.ExperimentConfigFactory;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapDuplicationAnomalyToTableRow;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapOutcomeToTableRow;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.MapTableRowToFunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.ValidateStagingTableRow;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.io.gcp.bigquery.BigQueryIO;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline for building the experiment outcomes, clean outcomes, aggregated and anomalies
 * BigQuery tables from the staging table of raw user/experiment rows.
 *
 * <p>A staging row that is structurally invalid (a missing identifier, or a value of the wrong
 * type) fails the run before any table is written. Rows that are merely ambiguous are classified
 * conservatively and counted, and duplication rank violations are written to the anomalies table;
 * neither fails the run. The counters are logged as a {@link RunSummary} when the run finishes.
 */
public class ExperimentTablesPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(ExperimentTablesPipeline.class);

  public static void main(String[] args) {
    ExperimentTablesPipelineOptions options =
        PipelineOptionsFactory.fromArgs(args).withValidation().as(
            ExperimentTablesPipelineOptions.class);
    // Configuration errors fail here, before the pipeline is constructed.
    ImmutableList<ExperimentConfig> experimentConfigs =
        new ExperimentConfigFactory().createExperimentConfigs(options.getExperimentConfigs());
    ImmutableList<AggregationDimension> dimensions =
        AggregationDimension.parseList(options.getAggregationDimensions());
    LOG.info("Building experiment tables for {} experiments, {} classification, grouped by {}",
        experimentConfigs.size(), options.getClassificationMode(), dimensions);

    Pipeline pipeline = Pipeline.create(options);
    // Reading with the table schema fetches it while the pipeline is built, so a staging table
    // without a required column fails here, before the run starts.
    PCollection<TableRow> stagingRows = pipeline.apply("Read BigQuery Staging Table",
        BigQueryIO.readTableRowsWithSchema().from(options.getInputStagingTable()));
    ValidateStagingTableRow.checkStagingColumns(
        stagingRows.getSchema().getFieldNames(), options.getClassificationMode(), dimensions);

    PCollectionTuple tables = stagingRows
        .apply("ValidateStagingTableRow", ParDo.of(new ValidateStagingTableRow()))
        .apply("MapTableRowToFunnelFact", ParDo.of(new MapTableRowToFunnelFact()))
        .apply("BuildExperimentTables", new BuildExperimentTables(
            experimentConfigs,
            dimensions,
            OutcomeClassifier.forMode(options.getClassificationMode()),
            options.getLogClassificationAmbiguities()));

    writeTable(tables.get(BuildExperimentTables.OUTCOMES), "WriteOutcomesToBigQuery",
        options.getOutputOutcomesTable(), MapOutcomeToTableRow.getTableSchema());
    writeTable(tables.get(BuildExperimentTables.CLEAN_OUTCOMES), "WriteCleanOutcomesToBigQuery",
        options.getOutputCleanOutcomesTable(), MapOutcomeToTableRow.getTableSchema());
    writeTable(tables.get(BuildExperimentTables.AGGREGATED), "WriteAggregatedToBigQuery",
        options.getOutputAggregatedTable(), AggregateCohortFn.getTableSchema(dimensions));
    writeTable(tables.get(BuildExperimentTables.ANOMALIES), "WriteAnomaliesToBigQuery",
        options.getOutputAnomaliesTable(), MapDuplicationAnomalyToTableRow.getTableSchema());

    PipelineResult result = pipeline.run();
    result.waitUntilFinish();
    RunSummary summary = RunSummary.fromMetrics(result.metrics());
    if (summary.hasAnomalies()) {
      LOG.warn("Experiment tables built with duplication rank violations, see {}: {}",
          options.getOutputAnomaliesTable(), summary);
    } else {
      LOG.info("Experiment tables built: {}", summary);
    }
  }

  private static void writeTable(
      PCollection<TableRow> rows, String stepName, String table, TableSchema schema) {
    rows.apply(stepName,
        BigQueryIO.writeTableRows()
            .to(table)
            .withoutValidation()
            .withSchema(schema)
            .withCreateDisposition(BigQueryIO.Write.CreateDisposition.CREATE_IF_NEEDED)
            .withWriteDisposition(BigQueryIO.Write.WriteDisposition.WRITE_TRUNCATE));
  }
}
