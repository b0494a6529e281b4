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

import com.google.api.services.bigquery.model.TableFieldSchema;
import com.google.api.services.bigquery.model.TableRow;
import com.google.api.services.bigquery.model.TableSchema;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.DuplicationAnomaly;
import java.util.Arrays;
import org.apache.beam.sdk.transforms.DoFn;

/** Converts a DuplicationAnomaly to a BigQuery TableRow of the anomalies table. */
public class MapDuplicationAnomalyToTableRow extends DoFn<DuplicationAnomaly, TableRow> {

  public static final String RANK_ONE_ROWS = "rank_one_rows";
  public static final String TOTAL_ROWS = "total_rows";

  // Returns the table schema for DuplicationAnomaly TableRows.
  public static TableSchema getTableSchema() {
    TableSchema schema = new TableSchema();
    schema.setFields(Arrays.asList(
        new TableFieldSchema().setName(StagingColumns.USER_ID).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.EXPERIMENT_NAME).setType("STRING"),
        new TableFieldSchema().setName(RANK_ONE_ROWS).setType("INTEGER"),
        new TableFieldSchema().setName(TOTAL_ROWS).setType("INTEGER")));
    return schema;
  }

  @ProcessElement
  public void processElement(ProcessContext context) {
    DuplicationAnomaly anomaly = context.element();
    TableRow tablerow = new TableRow();
    tablerow.set(StagingColumns.USER_ID, anomaly.getUserId());
    tablerow.set(StagingColumns.EXPERIMENT_NAME, anomaly.getExperimentName());
    tablerow.set(RANK_ONE_ROWS, anomaly.getRankOneRows());
    tablerow.set(TOTAL_ROWS, anomaly.getTotalRows());
    context.output(tablerow);
  }
}
