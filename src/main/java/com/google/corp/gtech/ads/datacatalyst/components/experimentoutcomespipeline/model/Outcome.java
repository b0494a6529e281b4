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
 * An Outcome is the classification of one {@link FunnelFact}: the fact itself, carried through
 * unchanged, plus the derived funnel stage memberships. Outcomes are never mutated; a changed fact
 * is classified into a new Outcome.
 */
@DefaultCoder(AvroCoder.class)
public class Outcome {
  private FunnelFact fact;
  private boolean eligibleVisitor;
  private boolean activated;
  private boolean converted;
  private boolean newBooking;
  private boolean onboardingStarted;
  private boolean onboardingCompleted;
  private boolean checkoutStarted;
  private boolean checkoutCompleted;

  // Required by AvroCoder.
  private Outcome() {
  }

  public Outcome(
      FunnelFact fact,
      boolean eligibleVisitor,
      boolean activated,
      boolean converted,
      boolean newBooking) {
    this(fact, eligibleVisitor, activated, converted, newBooking,
        false /* onboardingStarted */, false /* onboardingCompleted */,
        false /* checkoutStarted */, false /* checkoutCompleted */);
  }

  public Outcome(
      FunnelFact fact,
      boolean eligibleVisitor,
      boolean activated,
      boolean converted,
      boolean newBooking,
      boolean onboardingStarted,
      boolean onboardingCompleted,
      boolean checkoutStarted,
      boolean checkoutCompleted) {
    this.fact = fact;
    this.eligibleVisitor = eligibleVisitor;
    this.activated = activated;
    this.converted = converted;
    this.newBooking = newBooking;
    this.onboardingStarted = onboardingStarted;
    this.onboardingCompleted = onboardingCompleted;
    this.checkoutStarted = checkoutStarted;
    this.checkoutCompleted = checkoutCompleted;
  }

  public FunnelFact getFact() {
    return fact;
  }

  public boolean isEligibleVisitor() {
    return eligibleVisitor;
  }

  public boolean isActivated() {
    return activated;
  }

  public boolean isConverted() {
    return converted;
  }

  public boolean isNewBooking() {
    return newBooking;
  }

  public boolean isOnboardingStarted() {
    return onboardingStarted;
  }

  public boolean isOnboardingCompleted() {
    return onboardingCompleted;
  }

  public boolean isCheckoutStarted() {
    return checkoutStarted;
  }

  public boolean isCheckoutCompleted() {
    return checkoutCompleted;
  }

  // Total revenue with null treated as zero, for summing.
  public double getTotalRevenueOrZero() {
    return fact.getTotalRevenue() == null ? 0.0 : fact.getTotalRevenue();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Outcome)) {
      return false;
    }
    Outcome that = (Outcome) other;
    return Objects.equals(this.fact, that.fact)
        && this.eligibleVisitor == that.eligibleVisitor
        && this.activated == that.activated
        && this.converted == that.converted
        && this.newBooking == that.newBooking
        && this.onboardingStarted == that.onboardingStarted
        && this.onboardingCompleted == that.onboardingCompleted
        && this.checkoutStarted == that.checkoutStarted
        && this.checkoutCompleted == that.checkoutCompleted;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(new Object[] {
        fact, eligibleVisitor, activated, converted, newBooking,
        onboardingStarted, onboardingCompleted, checkoutStarted, checkoutCompleted});
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("fact", fact)
        .add("eligibleVisitor", eligibleVisitor)
        .add("activated", activated)
        .add("converted", converted)
        .add("newBooking", newBooking)
        .toString();
  }
}
