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

import com.google.api.services.bigquery.model.TableRow;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.AggregationDimension;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ClassificationMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.beam.sdk.transforms.DoFn;

/**
 * Validates the staging TableRows contain the required identifier columns. A missing column is a
 * structural error and fails the whole run, so no output table is written from a partially
 * readable staging table.
 */
public class ValidateStagingTableRow extends DoFn<TableRow, TableRow> {

  public static final ImmutableList<String> REQUIRED_COLUMNS = ImmutableList.of(
      StagingColumns.USER_ID,
      StagingColumns.EXPERIMENT_NAME,
      StagingColumns.VARIANT,
      StagingColumns.DUPLICATION_RANK);

  // Nullable columns the staging table must still declare. BigQuery leaves NULL values out of
  // the rows it reads, so only the table schema shows whether these columns exist.
  public static final ImmutableList<String> REQUIRED_SCHEMA_COLUMNS = ImmutableList.of(
      StagingColumns.FIRST_EXPOSURE_DATE,
      StagingColumns.CONTAMINATION_FLAG,
      StagingColumns.NB_MRR,
      StagingColumns.TOTAL_REVENUE);

  public static final ImmutableList<String> DERIVE_COLUMNS = ImmutableList.of(
      StagingColumns.ACTIVATION_DATE,
      StagingColumns.CONVERSION_DATE,
      StagingColumns.BOOKING_DATE);

  public static final ImmutableList<String> STAGED_COLUMNS = ImmutableList.of(
      StagingColumns.IS_ELIGIBLE_VISITOR,
      StagingColumns.IS_ACTIVATED,
      StagingColumns.IS_CONVERTED,
      StagingColumns.NEW_BOOKING_FLAG);

  public ValidateStagingTableRow() {
  }

  @ProcessElement
  public void processElement(ProcessContext context) {
    TableRow tablerow = context.element();
    checkRequiredColumns(tablerow);
    context.output(tablerow);
  }

  /**
   * Dies if the staging table schema, given as its column names, lacks a column this run reads:
   * the identifiers, the columns required for classification in the given mode, or an
   * aggregation dimension.
   */
  public static void checkStagingColumns(
      Collection<String> columnNames,
      ClassificationMode mode,
      List<AggregationDimension> dimensions) {
    Set<String> requiredColumns = new LinkedHashSet<>(REQUIRED_COLUMNS);
    requiredColumns.addAll(REQUIRED_SCHEMA_COLUMNS);
    requiredColumns.addAll(mode == ClassificationMode.STAGED ? STAGED_COLUMNS : DERIVE_COLUMNS);
    for (AggregationDimension dimension : dimensions) {
      requiredColumns.add(dimension.getColumnName());
    }
    requiredColumns.removeAll(columnNames);
    if (!requiredColumns.isEmpty()) {
      throw new IllegalArgumentException(String.format(
          "Staging table is missing the following required columns: %s",
          Joiner.on(", ").join(requiredColumns)));
    }
  }

  // Dies if the given TableRow is missing any required column or has an empty value for one.
  public static void checkRequiredColumns(TableRow tablerow) {
    List<String> missingColumns = new ArrayList<>();
    for (String column : REQUIRED_COLUMNS) {
      Object value = tablerow.get(column);
      if (value == null || value.toString().trim().isEmpty()) {
        missingColumns.add(column);
      }
    }
    if (!missingColumns.isEmpty()) {
      throw new IllegalArgumentException(String.format(
          "Input tablerow [%s] is missing the following required fields: %s",
          tablerow, Joiner.on(", ").join(missingColumns)));
    }
  }
}
