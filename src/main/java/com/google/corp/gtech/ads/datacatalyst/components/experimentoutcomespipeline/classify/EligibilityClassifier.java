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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.classify;

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.ExperimentConfig;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import org.joda.time.Instant;

/**
 * Derives funnel stage memberships from a FunnelFact's stage dates.
 *
 * <p>Stages are evaluated top-down and each is gated by the one before it, so an Outcome is
 * always monotonic: converted implies activated implies eligible visitor. Same-day transitions are
 * valid. A missing date never raises; it resolves to the stage not being reached.
 *
 * <ul>
 *   <li>Eligible visitor: first exposure within [startDate, endDate) with no disqualifying prior
 *       activity.
 *   <li>Activated: an activation on or after first exposure. For hybrid products activation may
 *       precede exposure by the grace window, but a conversion before first exposure always
 *       rejects activation.
 *   <li>Converted: a conversion on or after both activation and first exposure, before endDate.
 *   <li>New booking: the user's first booking, on or after conversion.
 * </ul>
 */
public class EligibilityClassifier implements OutcomeClassifier {

  private static final long serialVersionUID = 2087410542915768533L;

  @Override
  public Outcome classify(FunnelFact fact, ExperimentConfig config) {
    boolean eligibleVisitor = isEligibleVisitor(fact, config);
    boolean activated = eligibleVisitor && isActivated(fact, config);
    boolean converted = activated && isConverted(fact, config);
    boolean newBooking = converted && isNewBooking(fact);
    return new Outcome(
        fact,
        eligibleVisitor,
        activated,
        converted,
        newBooking,
        activated && isStepStarted(fact.getOnboardingStart(), config),
        activated && isStepCompleted(
            fact.getOnboardingStart(), fact.getOnboardingComplete(), config),
        activated && isStepStarted(fact.getCheckoutStart(), config),
        activated && isStepCompleted(fact.getCheckoutStart(), fact.getCheckoutComplete(), config));
  }

  static boolean isEligibleVisitor(FunnelFact fact, ExperimentConfig config) {
    if (config == null || fact.getFirstExposureDate() == null) {
      return false;
    }
    return config.isWithinWindow(fact.getFirstExposureDate())
        && !hasDisqualifyingPriorActivity(fact);
  }

  // Only meaningful for eligible visitors; config must not be null.
  static boolean isActivated(FunnelFact fact, ExperimentConfig config) {
    if (fact.getActivationDate() == null || hasPreExposureConversion(fact)) {
      return false;
    }
    Instant earliestActivation =
        fact.getFirstExposureDate().minus(config.activationGraceDuration());
    return !fact.getActivationDate().isBefore(earliestActivation);
  }

  // Only meaningful for activated users; config must not be null.
  static boolean isConverted(FunnelFact fact, ExperimentConfig config) {
    Instant conversionDate = fact.getConversionDate();
    return conversionDate != null
        && isOnOrAfter(conversionDate, fact.getActivationDate())
        && isOnOrAfter(conversionDate, fact.getFirstExposureDate())
        && conversionDate.isBefore(config.endDate());
  }

  // Only meaningful for converted users.
  static boolean isNewBooking(FunnelFact fact) {
    return fact.getBookingDate() != null
        && isOnOrAfter(fact.getBookingDate(), fact.getConversionDate())
        && isFirstBooking(fact);
  }

  // A start counts only when it happened within the experiment window.
  static boolean isStepStarted(Instant start, ExperimentConfig config) {
    return config != null && config.isWithinWindow(start);
  }

  // A completion within the window is valid even when its start is missing; when both are present
  // the completion must not precede the start.
  static boolean isStepCompleted(Instant start, Instant complete, ExperimentConfig config) {
    if (config == null || !config.isWithinWindow(complete)) {
      return false;
    }
    return start == null || isOnOrAfter(complete, start);
  }

  public static boolean hasDisqualifyingPriorActivity(FunnelFact fact) {
    if (Boolean.TRUE.equals(fact.getPriorActivityFlag())) {
      return true;
    }
    return isStrictlyBefore(fact.getPriorActivityDate(), fact.getFirstExposureDate());
  }

  // A conversion dated before first exposure happened outside this experiment.
  public static boolean hasPreExposureConversion(FunnelFact fact) {
    return isStrictlyBefore(fact.getConversionDate(), fact.getFirstExposureDate());
  }

  static boolean isFirstBooking(FunnelFact fact) {
    return !isStrictlyBefore(fact.getPriorBookingDate(), fact.getBookingDate());
  }

  private static boolean isOnOrAfter(Instant date, Instant other) {
    return date != null && other != null && !date.isBefore(other);
  }

  private static boolean isStrictlyBefore(Instant date, Instant other) {
    return date != null && other != null && date.isBefore(other);
  }
}
