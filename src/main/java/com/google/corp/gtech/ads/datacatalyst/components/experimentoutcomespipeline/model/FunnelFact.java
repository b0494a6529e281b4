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
import org.apache.avro.reflect.Nullable;
import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;
import org.joda.time.Instant;

/**
 * A FunnelFact is one raw staging row describing a user's journey through a single experiment:
 * exposure, activation, conversion and booking. Dates are day-granular and stored as the Instant
 * of midnight UTC. A null date means the event never happened.
 *
 * <p>The same (userId, experimentName) pair may appear in several FunnelFacts; the row with
 * duplicationRank 1 is the canonical one.
 */
@DefaultCoder(AvroCoder.class)
public class FunnelFact {
  public static final String NOT_CONTAMINATED = "Not Contaminated";

  private String userId;
  private String experimentName;
  private String variant;
  @Nullable private Instant firstExposureDate;
  // Segmentation attributes, passed through unmodified.
  @Nullable private String region;
  @Nullable private String deviceType;
  @Nullable private String packageGroup;
  @Nullable private String listSizeGroup;
  // Funnel stage dates.
  @Nullable private Instant activationDate;
  @Nullable private Instant conversionDate;
  @Nullable private Instant bookingDate;
  // Optional intermediate steps.
  @Nullable private Instant onboardingStart;
  @Nullable private Instant onboardingComplete;
  @Nullable private Instant checkoutStart;
  @Nullable private Instant checkoutComplete;
  // Financials. Null is summed as zero.
  @Nullable private Double nbMrr;
  @Nullable private Double totalRevenue;
  // Disqualifying activity before the experiment.
  @Nullable private Boolean priorActivityFlag;
  @Nullable private Instant priorActivityDate;
  // An earlier booking by the same user, if any.
  @Nullable private Instant priorBookingDate;
  @Nullable private String contaminationFlag;
  private long duplicationRank;
  // Pre-computed funnel flags from the staging table, only read in STAGED classification mode.
  @Nullable private Boolean stagedEligibleVisitor;
  @Nullable private Boolean stagedActivated;
  @Nullable private Boolean stagedConverted;
  @Nullable private Boolean stagedNewBooking;

  // Required by AvroCoder.
  private FunnelFact() {
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.fact = copy(this);
    return builder;
  }

  public String getUserId() {
    return userId;
  }

  public String getExperimentName() {
    return experimentName;
  }

  public String getVariant() {
    return variant;
  }

  public Instant getFirstExposureDate() {
    return firstExposureDate;
  }

  public String getRegion() {
    return region;
  }

  public String getDeviceType() {
    return deviceType;
  }

  public String getPackageGroup() {
    return packageGroup;
  }

  public String getListSizeGroup() {
    return listSizeGroup;
  }

  public Instant getActivationDate() {
    return activationDate;
  }

  public Instant getConversionDate() {
    return conversionDate;
  }

  public Instant getBookingDate() {
    return bookingDate;
  }

  public Instant getOnboardingStart() {
    return onboardingStart;
  }

  public Instant getOnboardingComplete() {
    return onboardingComplete;
  }

  public Instant getCheckoutStart() {
    return checkoutStart;
  }

  public Instant getCheckoutComplete() {
    return checkoutComplete;
  }

  public Double getNbMrr() {
    return nbMrr;
  }

  public Double getTotalRevenue() {
    return totalRevenue;
  }

  public Boolean getPriorActivityFlag() {
    return priorActivityFlag;
  }

  public Instant getPriorActivityDate() {
    return priorActivityDate;
  }

  public Instant getPriorBookingDate() {
    return priorBookingDate;
  }

  public String getContaminationFlag() {
    return contaminationFlag;
  }

  public long getDuplicationRank() {
    return duplicationRank;
  }

  public Boolean getStagedEligibleVisitor() {
    return stagedEligibleVisitor;
  }

  public Boolean getStagedActivated() {
    return stagedActivated;
  }

  public Boolean getStagedConverted() {
    return stagedConverted;
  }

  public Boolean getStagedNewBooking() {
    return stagedNewBooking;
  }

  // Returns true unless the contamination flag is exactly NOT_CONTAMINATED. Null and unknown
  // values count as contaminated.
  public boolean isContaminated() {
    return !NOT_CONTAMINATED.equals(contaminationFlag);
  }

  private static FunnelFact copy(FunnelFact other) {
    FunnelFact fact = new FunnelFact();
    fact.userId = other.userId;
    fact.experimentName = other.experimentName;
    fact.variant = other.variant;
    fact.firstExposureDate = other.firstExposureDate;
    fact.region = other.region;
    fact.deviceType = other.deviceType;
    fact.packageGroup = other.packageGroup;
    fact.listSizeGroup = other.listSizeGroup;
    fact.activationDate = other.activationDate;
    fact.conversionDate = other.conversionDate;
    fact.bookingDate = other.bookingDate;
    fact.onboardingStart = other.onboardingStart;
    fact.onboardingComplete = other.onboardingComplete;
    fact.checkoutStart = other.checkoutStart;
    fact.checkoutComplete = other.checkoutComplete;
    fact.nbMrr = other.nbMrr;
    fact.totalRevenue = other.totalRevenue;
    fact.priorActivityFlag = other.priorActivityFlag;
    fact.priorActivityDate = other.priorActivityDate;
    fact.priorBookingDate = other.priorBookingDate;
    fact.contaminationFlag = other.contaminationFlag;
    fact.duplicationRank = other.duplicationRank;
    fact.stagedEligibleVisitor = other.stagedEligibleVisitor;
    fact.stagedActivated = other.stagedActivated;
    fact.stagedConverted = other.stagedConverted;
    fact.stagedNewBooking = other.stagedNewBooking;
    return fact;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FunnelFact)) {
      return false;
    }
    FunnelFact that = (FunnelFact) other;
    return Arrays.equals(this.values(), that.values());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values());
  }

  private Object[] values() {
    return new Object[] {
      userId, experimentName, variant, firstExposureDate, region, deviceType, packageGroup,
      listSizeGroup, activationDate, conversionDate, bookingDate, onboardingStart,
      onboardingComplete, checkoutStart, checkoutComplete, nbMrr, totalRevenue, priorActivityFlag,
      priorActivityDate, priorBookingDate, contaminationFlag, duplicationRank,
      stagedEligibleVisitor, stagedActivated, stagedConverted, stagedNewBooking
    };
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("userId", userId)
        .add("experimentName", experimentName)
        .add("variant", variant)
        .add("firstExposureDate", firstExposureDate)
        .add("activationDate", activationDate)
        .add("conversionDate", conversionDate)
        .add("bookingDate", bookingDate)
        .add("contaminationFlag", contaminationFlag)
        .add("duplicationRank", duplicationRank)
        .toString();
  }

  /** Builder for {@link FunnelFact}. */
  public static final class Builder {
    private FunnelFact fact = new FunnelFact();

    private Builder() {
    }

    public Builder setUserId(String userId) {
      fact.userId = userId;
      return this;
    }

    public Builder setExperimentName(String experimentName) {
      fact.experimentName = experimentName;
      return this;
    }

    public Builder setVariant(String variant) {
      fact.variant = variant;
      return this;
    }

    public Builder setFirstExposureDate(Instant firstExposureDate) {
      fact.firstExposureDate = firstExposureDate;
      return this;
    }

    public Builder setRegion(String region) {
      fact.region = region;
      return this;
    }

    public Builder setDeviceType(String deviceType) {
      fact.deviceType = deviceType;
      return this;
    }

    public Builder setPackageGroup(String packageGroup) {
      fact.packageGroup = packageGroup;
      return this;
    }

    public Builder setListSizeGroup(String listSizeGroup) {
      fact.listSizeGroup = listSizeGroup;
      return this;
    }

    public Builder setActivationDate(Instant activationDate) {
      fact.activationDate = activationDate;
      return this;
    }

    public Builder setConversionDate(Instant conversionDate) {
      fact.conversionDate = conversionDate;
      return this;
    }

    public Builder setBookingDate(Instant bookingDate) {
      fact.bookingDate = bookingDate;
      return this;
    }

    public Builder setOnboardingStart(Instant onboardingStart) {
      fact.onboardingStart = onboardingStart;
      return this;
    }

    public Builder setOnboardingComplete(Instant onboardingComplete) {
      fact.onboardingComplete = onboardingComplete;
      return this;
    }

    public Builder setCheckoutStart(Instant checkoutStart) {
      fact.checkoutStart = checkoutStart;
      return this;
    }

    public Builder setCheckoutComplete(Instant checkoutComplete) {
      fact.checkoutComplete = checkoutComplete;
      return this;
    }

    public Builder setNbMrr(Double nbMrr) {
      fact.nbMrr = nbMrr;
      return this;
    }

    public Builder setTotalRevenue(Double totalRevenue) {
      fact.totalRevenue = totalRevenue;
      return this;
    }

    public Builder setPriorActivityFlag(Boolean priorActivityFlag) {
      fact.priorActivityFlag = priorActivityFlag;
      return this;
    }

    public Builder setPriorActivityDate(Instant priorActivityDate) {
      fact.priorActivityDate = priorActivityDate;
      return this;
    }

    public Builder setPriorBookingDate(Instant priorBookingDate) {
      fact.priorBookingDate = priorBookingDate;
      return this;
    }

    public Builder setContaminationFlag(String contaminationFlag) {
      fact.contaminationFlag = contaminationFlag;
      return this;
    }

    public Builder setDuplicationRank(long duplicationRank) {
      fact.duplicationRank = duplicationRank;
      return this;
    }

    public Builder setStagedEligibleVisitor(Boolean stagedEligibleVisitor) {
      fact.stagedEligibleVisitor = stagedEligibleVisitor;
      return this;
    }

    public Builder setStagedActivated(Boolean stagedActivated) {
      fact.stagedActivated = stagedActivated;
      return this;
    }

    public Builder setStagedConverted(Boolean stagedConverted) {
      fact.stagedConverted = stagedConverted;
      return this;
    }

    public Builder setStagedNewBooking(Boolean stagedNewBooking) {
      fact.stagedNewBooking = stagedNewBooking;
      return this;
    }

    // Each call returns an independent FunnelFact; the builder may be reused afterwards.
    public FunnelFact build() {
      return copy(fact);
    }
  }
}
