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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ProductType;
import org.joda.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExperimentConfigFactoryTest {

  private ExperimentConfigFactory factory;

  @BeforeEach
  void setUp() {
    factory = new ExperimentConfigFactory();
  }

  @Test
  void createExperimentConfigs_parsesEveryConfig() {
    ImmutableList<ExperimentConfig> configs = factory.createExperimentConfigs(
        "homepage_cta_test:[01/03/2024,01/04/2024]:[WEB_ONLY]:[]; "
            + "onboarding_flow_test:[01/03/2024,15/04/2024]:[HYBRID]:[90]");

    assertThat(configs).hasSize(2);
    ExperimentConfig webOnly = configs.get(0);
    assertThat(webOnly.experimentName()).isEqualTo("homepage_cta_test");
    assertThat(webOnly.startDate()).isEqualTo(DateUtil.parseStartDateStringToInstant("01/03/2024"));
    assertThat(webOnly.endDate()).isEqualTo(DateUtil.parseEndDateStringToInstant("01/04/2024"));
    assertThat(webOnly.productType()).isEqualTo(ProductType.WEB_ONLY);
    assertThat(webOnly.activationGraceDays()).isZero();
    ExperimentConfig hybrid = configs.get(1);
    assertThat(hybrid.productType()).isEqualTo(ProductType.HYBRID);
    assertThat(hybrid.activationGraceDays()).isEqualTo(90);
  }

  @Test
  void createExperimentConfigs_emptyPartsUseDefaults() {
    ExperimentConfig config =
        factory.createExperimentConfigs("always_on_test:[,]:[]:[]").get(0);

    assertThat(config.startDate()).isEqualTo(new Instant(0));
    assertThat(config.endDate()).isEqualTo(new Instant(Long.MAX_VALUE));
    assertThat(config.productType()).isEqualTo(ProductType.WEB_ONLY);
  }

  @Test
  void createExperimentConfigs_emptyOptionHasNoConfigs() {
    assertThat(factory.createExperimentConfigs("")).isEmpty();
  }

  @Test
  void createExperimentConfigs_rejectsMalformedText() {
    assertThatThrownBy(() -> factory.createExperimentConfigs(
        "homepage_cta_test:[01/03/2024,01/04/2024]:[WEB_ONLY]:[] pricing_test:[01/03/2024]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Malformed");
  }

  @Test
  void createExperimentConfigs_rejectsUnknownProductType() {
    assertThatThrownBy(() -> factory.createExperimentConfigs(
        "homepage_cta_test:[01/03/2024,01/04/2024]:[MOBILE]:[]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("MOBILE");
  }

  @Test
  void createExperimentConfigs_rejectsDuplicateExperiment() {
    assertThatThrownBy(() -> factory.createExperimentConfigs(
        "homepage_cta_test:[01/03/2024,01/04/2024]:[]:[],"
            + "homepage_cta_test:[01/05/2024,01/06/2024]:[]:[]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("homepage_cta_test");
  }

  @Test
  void createExperimentConfigs_rejectsOutOfRangeGraceDays() {
    assertThatThrownBy(() -> factory.createExperimentConfigs(
        "onboarding_flow_test:[01/03/2024,15/04/2024]:[HYBRID]:[200000000000]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("onboarding_flow_test");
    assertThatThrownBy(() -> factory.createExperimentConfigs(
        "onboarding_flow_test:[01/03/2024,15/04/2024]:[HYBRID]:[99999999999999999999]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("onboarding_flow_test");
  }

  @Test
  void createExperimentConfigs_rejectsEndBeforeStart() {
    assertThatThrownBy(() -> factory.createExperimentConfigs(
        "homepage_cta_test:[01/04/2024,01/03/2024]:[]:[]"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
