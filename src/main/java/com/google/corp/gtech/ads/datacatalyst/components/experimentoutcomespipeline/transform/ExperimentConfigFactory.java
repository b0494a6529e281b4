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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ProductType;
import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Factory class to create ExperimentConfig instances from a pipeline option string. */
public class ExperimentConfigFactory implements Serializable {

  private static final long serialVersionUID = 5920671309412551837L;

  public static final Splitter DATE_RANGE_SPLITTER = Splitter.on(',').trimResults();
  // Characters allowed between two experiment configs.
  private static final CharMatcher CONFIG_SEPARATOR_MATCHER =
      CharMatcher.whitespace().or(CharMatcher.anyOf(";,"));

  // Pattern: experimentName:[start date,end date]:[product type]:[activation grace days]
  // Dates are dd/MM/yyyy and may be empty; product type defaults to WEB_ONLY and grace days to 0.
  // Examples:
  // homepage_cta_test:[01/03/2024,01/04/2024]:[WEB_ONLY]:[]
  // onboarding_flow_test:[01/03/2024,15/04/2024]:[HYBRID]:[90]
  private static final Pattern EXPERIMENT_MATCHER =
      Pattern.compile(
          "([a-zA-Z0-9_\\-\\.]+):\\[([0-9/]*,[0-9/]*)\\]:\\[([a-zA-Z_]*)\\]:\\[([0-9]*)\\]");

  /**
   * Parses every experiment config in the given option string. Dies if any part of the string is
   * not a well formed config or if an experiment is configured twice.
   */
  public ImmutableList<ExperimentConfig> createExperimentConfigs(String options) {
    ImmutableList.Builder<ExperimentConfig> configs = ImmutableList.builder();
    Set<String> experimentNames = new HashSet<>();
    Matcher m = EXPERIMENT_MATCHER.matcher(Strings.nullToEmpty(options));
    int unmatchedFrom = 0;
    while (m.find()) {
      checkOnlySeparators(options.substring(unmatchedFrom, m.start()));
      unmatchedFrom = m.end();
      ExperimentConfig config = createExperimentConfig(m.group(1), m.group(2), m.group(3),
          m.group(4));
      if (!experimentNames.add(config.experimentName())) {
        throw new IllegalArgumentException(
            "Experiment configured more than once: " + config.experimentName());
      }
      configs.add(config);
    }
    checkOnlySeparators(Strings.nullToEmpty(options).substring(unmatchedFrom));
    return configs.build();
  }

  private ExperimentConfig createExperimentConfig(
      String experimentName, String dateRange, String productType, String graceDays) {
    List<String> dates = DATE_RANGE_SPLITTER.splitToList(dateRange);
    ExperimentConfig.Builder builder = ExperimentConfig.builder()
        .setExperimentName(experimentName)
        .setStartDate(DateUtil.parseStartDateStringToInstant(dates.get(0)))
        .setEndDate(DateUtil.parseEndDateStringToInstant(dates.get(1)));
    if (!productType.isEmpty()) {
      builder.setProductType(parseProductType(productType));
    }
    if (!graceDays.isEmpty()) {
      builder.setActivationGraceDays(parseGraceDays(experimentName, graceDays));
    }
    return builder.build();
  }

  private static ProductType parseProductType(String productType) {
    try {
      return ProductType.valueOf(productType);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid product type: " + productType, e);
    }
  }

  private static long parseGraceDays(String experimentName, String graceDays) {
    try {
      return Long.parseLong(graceDays);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "Experiment [%s] has invalid activation grace days: %s", experimentName, graceDays), e);
    }
  }

  private static void checkOnlySeparators(String text) {
    if (!CONFIG_SEPARATOR_MATCHER.matchesAllOf(text)) {
      throw new IllegalArgumentException("Malformed experiment config: " + text.trim());
    }
  }
}
