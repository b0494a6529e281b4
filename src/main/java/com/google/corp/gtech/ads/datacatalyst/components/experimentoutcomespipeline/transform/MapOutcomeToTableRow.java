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
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.util.Arrays;
import org.apache.beam.sdk.transforms.DoFn;

/**
 * Converts an Outcome to a BigQuery TableRow of the outcomes and clean outcomes tables. Null
 * values are left out of the row.
 */
public class MapOutcomeToTableRow extends DoFn<Outcome, TableRow> {

  // Returns the table schema for Outcome TableRows.
  public static TableSchema getTableSchema() {
    TableSchema schema = new TableSchema();
    schema.setFields(Arrays.asList(
        new TableFieldSchema().setName(StagingColumns.USER_ID).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.EXPERIMENT_NAME).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.VARIANT).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.FIRST_EXPOSURE_DATE).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.REGION).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.DEVICE_TYPE).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.PACKAGE_GROUP).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.LIST_SIZE_GROUP).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.ACTIVATION_DATE).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.CONVERSION_DATE).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.BOOKING_DATE).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.ONBOARDING_START).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.ONBOARDING_COMPLETE).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.CHECKOUT_START).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.CHECKOUT_COMPLETE).setType("DATE"),
        new TableFieldSchema().setName(StagingColumns.IS_ELIGIBLE_VISITOR).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.IS_ACTIVATED).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.IS_CONVERTED).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.NEW_BOOKING_FLAG).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.IS_ONBOARDING_STARTED).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.IS_ONBOARDING_COMPLETED).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.IS_CHECKOUT_STARTED).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.IS_CHECKOUT_COMPLETED).setType("BOOLEAN"),
        new TableFieldSchema().setName(StagingColumns.NB_MRR).setType("FLOAT"),
        new TableFieldSchema().setName(StagingColumns.TOTAL_REVENUE).setType("FLOAT"),
        new TableFieldSchema().setName(StagingColumns.CONTAMINATION_FLAG).setType("STRING"),
        new TableFieldSchema().setName(StagingColumns.DUPLICATION_RANK).setType("INTEGER")));
    return schema;
  }

  @ProcessElement
  public void processElement(ProcessContext context) {
    context.output(toTableRow(context.element()));
  }

  public static TableRow toTableRow(Outcome outcome) {
    FunnelFact fact = outcome.getFact();
    TableRow tablerow = new TableRow();
    setIfNotNull(tablerow, StagingColumns.USER_ID, fact.getUserId());
    setIfNotNull(tablerow, StagingColumns.EXPERIMENT_NAME, fact.getExperimentName());
    setIfNotNull(tablerow, StagingColumns.VARIANT, fact.getVariant());
    setIfNotNull(tablerow, StagingColumns.FIRST_EXPOSURE_DATE,
        DateUtil.formatDate(fact.getFirstExposureDate()));
    setIfNotNull(tablerow, StagingColumns.REGION, fact.getRegion());
    setIfNotNull(tablerow, StagingColumns.DEVICE_TYPE, fact.getDeviceType());
    setIfNotNull(tablerow, StagingColumns.PACKAGE_GROUP, fact.getPackageGroup());
    setIfNotNull(tablerow, StagingColumns.LIST_SIZE_GROUP, fact.getListSizeGroup());
    setIfNotNull(tablerow, StagingColumns.ACTIVATION_DATE,
        DateUtil.formatDate(fact.getActivationDate()));
    setIfNotNull(tablerow, StagingColumns.CONVERSION_DATE,
        DateUtil.formatDate(fact.getConversionDate()));
    setIfNotNull(tablerow, StagingColumns.BOOKING_DATE,
        DateUtil.formatDate(fact.getBookingDate()));
    setIfNotNull(tablerow, StagingColumns.ONBOARDING_START,
        DateUtil.formatDate(fact.getOnboardingStart()));
    setIfNotNull(tablerow, StagingColumns.ONBOARDING_COMPLETE,
        DateUtil.formatDate(fact.getOnboardingComplete()));
    setIfNotNull(tablerow, StagingColumns.CHECKOUT_START,
        DateUtil.formatDate(fact.getCheckoutStart()));
    setIfNotNull(tablerow, StagingColumns.CHECKOUT_COMPLETE,
        DateUtil.formatDate(fact.getCheckoutComplete()));
    tablerow.set(StagingColumns.IS_ELIGIBLE_VISITOR, outcome.isEligibleVisitor());
    tablerow.set(StagingColumns.IS_ACTIVATED, outcome.isActivated());
    tablerow.set(StagingColumns.IS_CONVERTED, outcome.isConverted());
    tablerow.set(StagingColumns.NEW_BOOKING_FLAG, outcome.isNewBooking());
    tablerow.set(StagingColumns.IS_ONBOARDING_STARTED, outcome.isOnboardingStarted());
    tablerow.set(StagingColumns.IS_ONBOARDING_COMPLETED, outcome.isOnboardingCompleted());
    tablerow.set(StagingColumns.IS_CHECKOUT_STARTED, outcome.isCheckoutStarted());
    tablerow.set(StagingColumns.IS_CHECKOUT_COMPLETED, outcome.isCheckoutCompleted());
    setIfNotNull(tablerow, StagingColumns.NB_MRR, fact.getNbMrr());
    setIfNotNull(tablerow, StagingColumns.TOTAL_REVENUE, fact.getTotalRevenue());
    setIfNotNull(tablerow, StagingColumns.CONTAMINATION_FLAG, fact.getContaminationFlag());
    tablerow.set(StagingColumns.DUPLICATION_RANK, fact.getDuplicationRank());
    return tablerow;
  }

  private static void setIfNotNull(TableRow tablerow, String column, Object value) {
    if (value != null) {
      tablerow.set(column, value);
    }
  }
}
