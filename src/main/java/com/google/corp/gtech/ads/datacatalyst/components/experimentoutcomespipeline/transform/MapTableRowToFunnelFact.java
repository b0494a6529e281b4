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
import com.google.common.base.Strings;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import java.util.Locale;
import org.apache.beam.sdk.transforms.DoFn;
import org.joda.time.Instant;

/**
 * Converts staging TableRows to FunnelFacts. Only types are coerced here; a value that cannot be
 * coerced to its column type is a structural error and fails the run. Null or absent nullable
 * columns stay null.
 */
public class MapTableRowToFunnelFact extends DoFn<TableRow, FunnelFact> {

  @ProcessElement
  public void processElement(ProcessContext context) {
    context.output(toFunnelFact(context.element()));
  }

  public static FunnelFact toFunnelFact(TableRow row) {
    long duplicationRank = parseLong(row, StagingColumns.DUPLICATION_RANK);
    if (duplicationRank < 1) {
      throw new IllegalArgumentException(String.format(
          "Input tablerow [%s] has non-positive %s: %d",
          row, StagingColumns.DUPLICATION_RANK, duplicationRank));
    }
    return FunnelFact.builder()
        .setUserId(getString(row, StagingColumns.USER_ID))
        .setExperimentName(getString(row, StagingColumns.EXPERIMENT_NAME))
        .setVariant(getString(row, StagingColumns.VARIANT))
        .setFirstExposureDate(getDate(row, StagingColumns.FIRST_EXPOSURE_DATE))
        .setRegion(getString(row, StagingColumns.REGION))
        .setDeviceType(getString(row, StagingColumns.DEVICE_TYPE))
        .setPackageGroup(getString(row, StagingColumns.PACKAGE_GROUP))
        .setListSizeGroup(getString(row, StagingColumns.LIST_SIZE_GROUP))
        .setActivationDate(getDate(row, StagingColumns.ACTIVATION_DATE))
        .setConversionDate(getDate(row, StagingColumns.CONVERSION_DATE))
        .setBookingDate(getDate(row, StagingColumns.BOOKING_DATE))
        .setOnboardingStart(getDate(row, StagingColumns.ONBOARDING_START))
        .setOnboardingComplete(getDate(row, StagingColumns.ONBOARDING_COMPLETE))
        .setCheckoutStart(getDate(row, StagingColumns.CHECKOUT_START))
        .setCheckoutComplete(getDate(row, StagingColumns.CHECKOUT_COMPLETE))
        .setNbMrr(getDouble(row, StagingColumns.NB_MRR))
        .setTotalRevenue(getDouble(row, StagingColumns.TOTAL_REVENUE))
        .setPriorActivityFlag(getBoolean(row, StagingColumns.PRIOR_ACTIVITY_FLAG))
        .setPriorActivityDate(getDate(row, StagingColumns.PRIOR_ACTIVITY_DATE))
        .setPriorBookingDate(getDate(row, StagingColumns.PRIOR_BOOKING_DATE))
        .setContaminationFlag(getString(row, StagingColumns.CONTAMINATION_FLAG))
        .setDuplicationRank(duplicationRank)
        .setStagedEligibleVisitor(getBoolean(row, StagingColumns.IS_ELIGIBLE_VISITOR))
        .setStagedActivated(getBoolean(row, StagingColumns.IS_ACTIVATED))
        .setStagedConverted(getBoolean(row, StagingColumns.IS_CONVERTED))
        .setStagedNewBooking(getBoolean(row, StagingColumns.NEW_BOOKING_FLAG))
        .build();
  }

  private static String getString(TableRow row, String column) {
    Object value = row.get(column);
    return value == null ? null : value.toString();
  }

  private static Instant getDate(TableRow row, String column) {
    return DateUtil.parseStagingDate(column, row.get(column));
  }

  private static long parseLong(TableRow row, String column) {
    String value = Strings.nullToEmpty(getString(row, column)).trim();
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Column [%s] has invalid integer value [%s]", column, value), e);
    }
  }

  // NaN and infinite values are rejected; they cannot be summed into the aggregates.
  private static Double getDouble(TableRow row, String column) {
    Object value = row.get(column);
    double doubleValue;
    if (value instanceof Number) {
      doubleValue = ((Number) value).doubleValue();
    } else {
      String stringValue = Strings.nullToEmpty(getString(row, column)).trim();
      if (stringValue.isEmpty()) {
        return null;
      }
      try {
        doubleValue = Double.parseDouble(stringValue);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("Column [%s] has invalid numeric value [%s]", column, stringValue), e);
      }
    }
    if (!Double.isFinite(doubleValue)) {
      throw new IllegalArgumentException(
          String.format("Column [%s] has non-finite numeric value [%s]", column, value));
    }
    return doubleValue;
  }

  // Accepts BOOL values as well as the 0/1 integers some staging tables use for flags.
  private static Boolean getBoolean(TableRow row, String column) {
    Object value = row.get(column);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String stringValue = Strings.nullToEmpty(getString(row, column)).trim();
    switch (stringValue.toLowerCase(Locale.ROOT)) {
      case "":
        return null;
      case "true":
      case "1":
        return true;
      case "false":
      case "0":
        return false;
      default:
        throw new IllegalArgumentException(
            String.format("Column [%s] has invalid boolean value [%s]", column, stringValue));
    }
  }
}
