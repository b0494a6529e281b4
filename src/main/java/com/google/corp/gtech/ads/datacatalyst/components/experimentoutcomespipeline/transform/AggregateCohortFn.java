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
import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.aggregate.CohortAggregate;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.AggregationDimension;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.util.ArrayList;
import java.util.List;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.KV;

/**
 * Rolls up all clean cohort Outcomes sharing one aggregation key into an aggregated TableRow: the
 * key's dimension values followed by user, funnel and revenue totals. The whole group is seen
 * before its row is output, and a group without Outcomes outputs nothing.
 */
public class AggregateCohortFn extends DoFn<KV<List<String>, Iterable<Outcome>>, TableRow> {

  public static final String USERS = "users";
  public static final String ACTIVATIONS = "activations";
  public static final String CONVERSIONS = "conversions";
  public static final String NEW_BOOKINGS = "new_bookings";
  public static final String TOTAL_NEW_MRR = "total_new_mrr";
  public static final String TOTAL_REVENUE = "total_revenue";
  public static final String AVG_NB_MRR = "avg_nb_mrr";
  public static final String SD_NB_MRR = "sd_nb_mrr";
  public static final String N_NB_MRR = "n_nb_mrr";

  private final ImmutableList<AggregationDimension> dimensions;

  public AggregateCohortFn(List<AggregationDimension> dimensions) {
    this.dimensions = ImmutableList.copyOf(dimensions);
  }

  // Returns the table schema for aggregated TableRows grouped by the given dimensions.
  public static TableSchema getTableSchema(List<AggregationDimension> dimensions) {
    List<TableFieldSchema> fields = new ArrayList<>();
    for (AggregationDimension dimension : dimensions) {
      fields.add(new TableFieldSchema().setName(dimension.getColumnName()).setType("STRING"));
    }
    fields.add(new TableFieldSchema().setName(USERS).setType("INTEGER"));
    fields.add(new TableFieldSchema().setName(ACTIVATIONS).setType("INTEGER"));
    fields.add(new TableFieldSchema().setName(CONVERSIONS).setType("INTEGER"));
    fields.add(new TableFieldSchema().setName(NEW_BOOKINGS).setType("INTEGER"));
    fields.add(new TableFieldSchema().setName(TOTAL_NEW_MRR).setType("FLOAT"));
    fields.add(new TableFieldSchema().setName(TOTAL_REVENUE).setType("FLOAT"));
    fields.add(new TableFieldSchema().setName(AVG_NB_MRR).setType("FLOAT"));
    fields.add(new TableFieldSchema().setName(SD_NB_MRR).setType("FLOAT"));
    fields.add(new TableFieldSchema().setName(N_NB_MRR).setType("INTEGER"));
    return new TableSchema().setFields(fields);
  }

  @ProcessElement
  public void processElement(ProcessContext context) {
    KV<List<String>, Iterable<Outcome>> kv = context.element();
    CohortAggregate aggregate = new CohortAggregate();
    for (Outcome outcome : kv.getValue()) {
      aggregate.accumulate(outcome);
    }
    if (aggregate.isEmpty()) {
      return;
    }
    context.output(toTableRow(kv.getKey(), aggregate));
  }

  private TableRow toTableRow(List<String> key, CohortAggregate aggregate) {
    TableRow tablerow = new TableRow();
    for (int i = 0; i < dimensions.size(); i++) {
      setIfNotNull(tablerow, dimensions.get(i).getColumnName(), key.get(i));
    }
    tablerow.set(USERS, aggregate.getUsers());
    tablerow.set(ACTIVATIONS, aggregate.getActivations());
    tablerow.set(CONVERSIONS, aggregate.getConversions());
    tablerow.set(NEW_BOOKINGS, aggregate.getNewBookings());
    tablerow.set(TOTAL_NEW_MRR, aggregate.getTotalNewMrr());
    tablerow.set(TOTAL_REVENUE, aggregate.getTotalRevenue());
    setIfNotNull(tablerow, AVG_NB_MRR, aggregate.getAverageNewMrr());
    setIfNotNull(tablerow, SD_NB_MRR, aggregate.getNewMrrStandardDeviation());
    tablerow.set(N_NB_MRR, aggregate.getRows());
    return tablerow;
  }

  // Null columns are left out of the TableRow, which BigQuery reads as NULL.
  static void setIfNotNull(TableRow tablerow, String column, Object value) {
    if (value != null) {
      tablerow.set(column, value);
    }
  }
}
