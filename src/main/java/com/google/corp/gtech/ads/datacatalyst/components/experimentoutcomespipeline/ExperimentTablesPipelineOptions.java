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

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ClassificationMode;
import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.Validation;

/**
 * The options used to setup an ExperimentTablesPipeline.
 */
public interface ExperimentTablesPipelineOptions extends PipelineOptions {

  @Description("BigQuery staging table with one row per user and experiment observation, "
               + "in [project:]dataset.table format.")
  @Validation.Required
  String getInputStagingTable();
  void setInputStagingTable(String inputStagingTable);

  @Description("Experiment configs, each as "
               + "experimentName:[dd/mm/yyyy start,dd/mm/yyyy end]:[WEB_ONLY|HYBRID]:[graceDays]. "
               + "The start date is inclusive and the end date is not.")
  @Validation.Required
  String getExperimentConfigs();
  void setExperimentConfigs(String experimentConfigs);

  @Description("DERIVE to classify funnel stages from the stage dates, or STAGED to copy the "
               + "staging table's is_eligible_visitor, is_activated, is_converted and "
               + "new_booking_flag columns.")
  @Default.Enum("DERIVE")
  ClassificationMode getClassificationMode();
  void setClassificationMode(ClassificationMode classificationMode);

  @Description("Comma separated list of columns to aggregate the clean cohort by. Any of "
               + "experiment_name, variant, region, device_type, package_group, list_size_group.")
  @Default.String("experiment_name,variant,region,package_group,list_size_group")
  String getAggregationDimensions();
  void setAggregationDimensions(String aggregationDimensions);

  @Description("Set true to log every classification ambiguity, e.g. a missing exposure date.")
  @Default.Boolean(false)
  boolean getLogClassificationAmbiguities();
  void setLogClassificationAmbiguities(boolean logClassificationAmbiguities);

  @Description("Location to write the BigQuery outcomes table.")
  @Validation.Required
  String getOutputOutcomesTable();
  void setOutputOutcomesTable(String outputOutcomesTable);

  @Description("Location to write the BigQuery clean outcomes table.")
  @Validation.Required
  String getOutputCleanOutcomesTable();
  void setOutputCleanOutcomesTable(String outputCleanOutcomesTable);

  @Description("Location to write the BigQuery aggregated table.")
  @Validation.Required
  String getOutputAggregatedTable();
  void setOutputAggregatedTable(String outputAggregatedTable);

  @Description("Location to write the BigQuery duplication anomalies table.")
  @Validation.Required
  String getOutputAnomaliesTable();
  void setOutputAnomaliesTable(String outputAnomaliesTable);
}
