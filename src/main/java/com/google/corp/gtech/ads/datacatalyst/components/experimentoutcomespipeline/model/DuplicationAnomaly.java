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

import com.google.common.base.MoreObjects;
import java.util.Arrays;
import java.util.Objects;
import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/**
 * A (userId, experimentName) partition whose rows do not contain exactly one row of
 * duplicationRank 1. Such partitions are left out of the clean cohort.
 */
@DefaultCoder(AvroCoder.class)
public class DuplicationAnomaly {
  private String userId;
  private String experimentName;
  // Number of rows in the partition with duplicationRank 1.
  private long rankOneRows;
  // Number of rows in the partition.
  private long totalRows;

  // Required by AvroCoder.
  private DuplicationAnomaly() {
  }

  public DuplicationAnomaly(
      String userId, String experimentName, long rankOneRows, long totalRows) {
    this.userId = userId;
    this.experimentName = experimentName;
    this.rankOneRows = rankOneRows;
    this.totalRows = totalRows;
  }

  public String getUserId() {
    return userId;
  }

  public String getExperimentName() {
    return experimentName;
  }

  public long getRankOneRows() {
    return rankOneRows;
  }

  public long getTotalRows() {
    return totalRows;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DuplicationAnomaly)) {
      return false;
    }
    DuplicationAnomaly that = (DuplicationAnomaly) other;
    return Objects.equals(this.userId, that.userId)
        && Objects.equals(this.experimentName, that.experimentName)
        && this.rankOneRows == that.rankOneRows
        && this.totalRows == that.totalRows;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(new Object[] {userId, experimentName, rankOneRows, totalRows});
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .addValue(userId)
        .addValue(experimentName)
        .add("rankOneRows", rankOneRows)
        .add("totalRows", totalRows)
        .toString();
  }
}
