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

/** Column names shared by the staging table and the output tables. */
public final class StagingColumns {
  public static final String USER_ID = "user_id";
  public static final String EXPERIMENT_NAME = "experiment_name";
  public static final String VARIANT = "variant";
  public static final String FIRST_EXPOSURE_DATE = "first_exposure_date";
  public static final String REGION = "region";
  public static final String DEVICE_TYPE = "device_type";
  public static final String PACKAGE_GROUP = "package_group";
  public static final String LIST_SIZE_GROUP = "list_size_group";
  public static final String ACTIVATION_DATE = "activation_date";
  public static final String CONVERSION_DATE = "conversion_date";
  public static final String BOOKING_DATE = "booking_date";
  public static final String ONBOARDING_START = "onboarding_start";
  public static final String ONBOARDING_COMPLETE = "onboarding_complete";
  public static final String CHECKOUT_START = "checkout_start";
  public static final String CHECKOUT_COMPLETE = "checkout_complete";
  public static final String NB_MRR = "nb_mrr";
  public static final String TOTAL_REVENUE = "total_revenue";
  public static final String PRIOR_ACTIVITY_FLAG = "prior_activity_flag";
  public static final String PRIOR_ACTIVITY_DATE = "prior_activity_date";
  public static final String PRIOR_BOOKING_DATE = "prior_booking_date";
  public static final String CONTAMINATION_FLAG = "contamination_flag";
  public static final String DUPLICATION_RANK = "duplication_rank";
  // Funnel flags. Outputs of classification; inputs only in STAGED classification mode.
  public static final String IS_ELIGIBLE_VISITOR = "is_eligible_visitor";
  public static final String IS_ACTIVATED = "is_activated";
  public static final String IS_CONVERTED = "is_converted";
  public static final String NEW_BOOKING_FLAG = "new_booking_flag";
  public static final String IS_ONBOARDING_STARTED = "is_onboarding_started";
  public static final String IS_ONBOARDING_COMPLETED = "is_onboarding_completed";
  public static final String IS_CHECKOUT_STARTED = "is_checkout_started";
  public static final String IS_CHECKOUT_COMPLETED = "is_checkout_completed";

  private StagingColumns() {
  }
}
