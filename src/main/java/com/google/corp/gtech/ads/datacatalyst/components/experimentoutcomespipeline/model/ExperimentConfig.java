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

import com.google.auto.value.AutoValue;
import java.io.Serializable;
import org.joda.time.DateTimeConstants;
import org.joda.time.Duration;
import org.joda.time.Instant;

/**
 * Classification rules for one experiment: its active window [startDate, endDate), its product
 * type and, for hybrid products, how many days activation may precede exposure.
 */
@AutoValue
public abstract class ExperimentConfig implements Serializable {

  private static final long serialVersionUID = 4412067853203394117L;

  // Largest grace window whose span can still be subtracted from any exposure date.
  public static final long MAX_ACTIVATION_GRACE_DAYS =
      Long.MAX_VALUE / 2 / DateTimeConstants.MILLIS_PER_DAY;

  public static Builder builder() {
    return new AutoValue_ExperimentConfig.Builder()
        .setProductType(ProductType.WEB_ONLY)
        .setActivationGraceDays(0L);
  }

  /** Builder for {@link ExperimentConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setExperimentName(String experimentName);

    public abstract Builder setStartDate(Instant startDate);

    public abstract Builder setEndDate(Instant endDate);

    public abstract Builder setProductType(ProductType productType);

    public abstract Builder setActivationGraceDays(long activationGraceDays);

    abstract ExperimentConfig autoBuild();

    public ExperimentConfig build() {
      ExperimentConfig config = autoBuild();
      if (!config.endDate().isAfter(config.startDate())) {
        throw new IllegalArgumentException(String.format(
            "Experiment [%s] end date %s must be after its start date %s",
            config.experimentName(), config.endDate(), config.startDate()));
      }
      if (config.activationGraceDays() < 0
          || config.activationGraceDays() > MAX_ACTIVATION_GRACE_DAYS) {
        throw new IllegalArgumentException(String.format(
            "Experiment [%s] activation grace days must be between 0 and %d: %d",
            config.experimentName(), MAX_ACTIVATION_GRACE_DAYS, config.activationGraceDays()));
      }
      return config;
    }
  }

  public abstract Builder toBuilder();

  public abstract String experimentName();

  // Inclusive.
  public abstract Instant startDate();

  // Exclusive.
  public abstract Instant endDate();

  public abstract ProductType productType();

  public abstract long activationGraceDays();

  // Returns the grace window for activation before exposure; zero unless the product allows it.
  public Duration activationGraceDuration() {
    if (!productType().isActivationGraceAllowed()) {
      return Duration.ZERO;
    }
    return Duration.standardDays(activationGraceDays());
  }

  // Returns true if the given date is within [startDate, endDate).
  public boolean isWithinWindow(Instant date) {
    return date != null && !date.isBefore(startDate()) && date.isBefore(endDate());
  }
}
