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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.aggregate;

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashSet;
import java.util.Set;

/**
 * Accumulates the clean cohort Outcomes of one aggregation group into count and revenue rollups.
 *
 * <p>Financial sums are kept as exact BigDecimals, so the rollup does not depend on the order in
 * which Outcomes are accumulated. Null financial values count as zero in the totals, but are
 * skipped by the new-booking MRR mean and standard deviation.
 */
public class CohortAggregate {

  private final Set<String> userIds = new HashSet<>();
  private long rows;
  private long activations;
  private long conversions;
  private long newBookings;
  private BigDecimal totalNewMrr = BigDecimal.ZERO;
  // Rows with a non-null new-booking MRR, and the sum of their squares.
  private long newMrrValues;
  private BigDecimal totalNewMrrSquares = BigDecimal.ZERO;
  private BigDecimal totalRevenue = BigDecimal.ZERO;

  /** Accumulates one Outcome. */
  public void accumulate(Outcome outcome) {
    userIds.add(outcome.getFact().getUserId());
    rows++;
    if (outcome.isActivated()) {
      activations++;
    }
    if (outcome.isConverted()) {
      conversions++;
    }
    if (outcome.isNewBooking()) {
      newBookings++;
    }
    Double nbMrr = outcome.getFact().getNbMrr();
    if (nbMrr != null) {
      BigDecimal value = new BigDecimal(nbMrr);
      newMrrValues++;
      totalNewMrr = totalNewMrr.add(value);
      totalNewMrrSquares = totalNewMrrSquares.add(value.multiply(value));
    }
    totalRevenue = totalRevenue.add(new BigDecimal(outcome.getTotalRevenueOrZero()));
  }

  public boolean isEmpty() {
    return rows == 0;
  }

  // Distinct user count.
  public long getUsers() {
    return userIds.size();
  }

  public long getRows() {
    return rows;
  }

  public long getActivations() {
    return activations;
  }

  public long getConversions() {
    return conversions;
  }

  public long getNewBookings() {
    return newBookings;
  }

  public double getTotalNewMrr() {
    return totalNewMrr.doubleValue();
  }

  public double getTotalRevenue() {
    return totalRevenue.doubleValue();
  }

  // Number of rows with a non-null new-booking MRR.
  public long getNewMrrValues() {
    return newMrrValues;
  }

  // Mean of the non-null new-booking MRR values, or null when there are none.
  public Double getAverageNewMrr() {
    if (newMrrValues == 0) {
      return null;
    }
    return totalNewMrr.divide(BigDecimal.valueOf(newMrrValues), MathContext.DECIMAL128)
        .doubleValue();
  }

  // Sample standard deviation (n - 1 denominator) of the non-null new-booking MRR values, or null
  // for fewer than two values.
  public Double getNewMrrStandardDeviation() {
    if (newMrrValues < 2) {
      return null;
    }
    BigDecimal n = BigDecimal.valueOf(newMrrValues);
    BigDecimal sumOfSquaredDeviations = totalNewMrrSquares.subtract(
        totalNewMrr.multiply(totalNewMrr).divide(n, MathContext.DECIMAL128));
    double variance = sumOfSquaredDeviations
        .divide(BigDecimal.valueOf(newMrrValues - 1), MathContext.DECIMAL128)
        .doubleValue();
    return Math.sqrt(Math.max(variance, 0.0));
  }
}
