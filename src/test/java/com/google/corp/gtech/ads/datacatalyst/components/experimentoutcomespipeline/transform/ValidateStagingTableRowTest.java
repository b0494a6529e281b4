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

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.api.services.bigquery.model.TableRow;
import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.AggregationDimension;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ClassificationMode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidateStagingTableRowTest {

  @Test
  void checkRequiredColumns_acceptsCompleteRow() {
    TableRow tablerow = new TableRow()
        .set("user_id", "user-1")
        .set("experiment_name", "homepage_cta_test")
        .set("variant", "control")
        .set("duplication_rank", 1);

    assertThatCode(() -> ValidateStagingTableRow.checkRequiredColumns(tablerow))
        .doesNotThrowAnyException();
  }

  @Test
  void checkRequiredColumns_listsEveryMissingColumn() {
    TableRow tablerow = new TableRow()
        .set("user_id", "user-1")
        .set("experiment_name", " ");

    assertThatThrownBy(() -> ValidateStagingTableRow.checkRequiredColumns(tablerow))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("experiment_name, variant, duplication_rank");
  }

  private static List<String> stagingColumns(String... extraColumns) {
    List<String> columns = new ArrayList<>(ImmutableList.of(
        "user_id", "experiment_name", "variant", "first_exposure_date", "region",
        "package_group", "list_size_group", "activation_date", "conversion_date", "booking_date",
        "nb_mrr", "total_revenue", "contamination_flag", "duplication_rank"));
    columns.addAll(ImmutableList.copyOf(extraColumns));
    return columns;
  }

  @Test
  void checkStagingColumns_acceptsCompleteSchema() {
    assertThatCode(() -> ValidateStagingTableRow.checkStagingColumns(
        stagingColumns(), ClassificationMode.DERIVE, AggregationDimension.DEFAULT_DIMENSIONS))
        .doesNotThrowAnyException();
  }

  @Test
  void checkStagingColumns_rejectsMissingNullableColumns() {
    List<String> columns = stagingColumns();
    columns.remove("contamination_flag");
    columns.remove("first_exposure_date");

    assertThatThrownBy(() -> ValidateStagingTableRow.checkStagingColumns(
        columns, ClassificationMode.DERIVE, AggregationDimension.DEFAULT_DIMENSIONS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("first_exposure_date, contamination_flag");
  }

  @Test
  void checkStagingColumns_requiresColumnsOfClassificationMode() {
    assertThatThrownBy(() -> ValidateStagingTableRow.checkStagingColumns(
        stagingColumns(), ClassificationMode.STAGED, AggregationDimension.DEFAULT_DIMENSIONS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is_eligible_visitor");
    assertThatCode(() -> ValidateStagingTableRow.checkStagingColumns(
        stagingColumns("is_eligible_visitor", "is_activated", "is_converted", "new_booking_flag"),
        ClassificationMode.STAGED,
        AggregationDimension.DEFAULT_DIMENSIONS))
        .doesNotThrowAnyException();
  }

  @Test
  void checkStagingColumns_requiresAggregationDimensions() {
    assertThatThrownBy(() -> ValidateStagingTableRow.checkStagingColumns(
        stagingColumns(),
        ClassificationMode.DERIVE,
        ImmutableList.of(AggregationDimension.VARIANT, AggregationDimension.DEVICE_TYPE)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("device_type");
  }
}
