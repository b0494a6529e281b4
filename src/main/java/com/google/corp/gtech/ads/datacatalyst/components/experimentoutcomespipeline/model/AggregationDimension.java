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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Columns the clean cohort may be grouped by, named as in the output tables. */
public enum AggregationDimension {
  EXPERIMENT_NAME("experiment_name") {
    @Override
    public String extract(FunnelFact fact) {
      return fact.getExperimentName();
    }
  },
  VARIANT("variant") {
    @Override
    public String extract(FunnelFact fact) {
      return fact.getVariant();
    }
  },
  REGION("region") {
    @Override
    public String extract(FunnelFact fact) {
      return fact.getRegion();
    }
  },
  DEVICE_TYPE("device_type") {
    @Override
    public String extract(FunnelFact fact) {
      return fact.getDeviceType();
    }
  },
  PACKAGE_GROUP("package_group") {
    @Override
    public String extract(FunnelFact fact) {
      return fact.getPackageGroup();
    }
  },
  LIST_SIZE_GROUP("list_size_group") {
    @Override
    public String extract(FunnelFact fact) {
      return fact.getListSizeGroup();
    }
  };

  public static final ImmutableList<AggregationDimension> DEFAULT_DIMENSIONS =
      ImmutableList.of(EXPERIMENT_NAME, VARIANT, REGION, PACKAGE_GROUP, LIST_SIZE_GROUP);

  private static final Splitter DIMENSION_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  private final String columnName;

  AggregationDimension(String columnName) {
    this.columnName = columnName;
  }

  public String getColumnName() {
    return columnName;
  }

  /** Returns this dimension's value for the given fact, which may be null. */
  public abstract String extract(FunnelFact fact);

  /**
   * Parses a comma separated list of column names, e.g. "experiment_name,variant,region", into
   * dimensions. Returns {@link #DEFAULT_DIMENSIONS} for an empty list.
   */
  public static ImmutableList<AggregationDimension> parseList(String columnNames) {
    if (columnNames == null || CharMatcher.whitespace().trimFrom(columnNames).isEmpty()) {
      return DEFAULT_DIMENSIONS;
    }
    List<String> names = DIMENSION_SPLITTER.splitToList(columnNames);
    ImmutableList<AggregationDimension> dimensions =
        names.stream().map(AggregationDimension::fromColumnName).collect(toImmutableList());
    if (dimensions.stream().distinct().count() != dimensions.size()) {
      throw new IllegalArgumentException("Duplicate aggregation dimension in: " + columnNames);
    }
    return dimensions;
  }

  public static AggregationDimension fromColumnName(String columnName) {
    for (AggregationDimension dimension : values()) {
      if (dimension.columnName.equals(columnName)) {
        return dimension;
      }
    }
    throw new IllegalArgumentException("Unknown aggregation dimension: " + columnName);
  }
}
