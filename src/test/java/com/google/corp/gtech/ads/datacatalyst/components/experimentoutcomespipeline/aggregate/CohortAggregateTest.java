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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.FunnelFact;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class CohortAggregateTest {

  private static Outcome outcome(String userId, Double nbMrr, boolean newBooking) {
    FunnelFact fact = FunnelFact.builder()
        .setUserId(userId)
        .setExperimentName("homepage_cta_test")
        .setVariant("treatment")
        .setRegion("US")
        .setNbMrr(nbMrr)
        .setTotalRevenue(nbMrr == null ? null : nbMrr * 2)
        .setContaminationFlag(FunnelFact.NOT_CONTAMINATED)
        .setDuplicationRank(1)
        .build();
    return new Outcome(fact, true, newBooking, newBooking, newBooking);
  }

  @Test
  void accumulate_countsUsersAndSumsMrr() {
    CohortAggregate aggregate = new CohortAggregate();
    aggregate.accumulate(outcome("user-1", 10.0, true));
    aggregate.accumulate(outcome("user-2", 0.0, false));
    aggregate.accumulate(outcome("user-3", 20.0, true));

    assertThat(aggregate.getUsers()).isEqualTo(3);
    assertThat(aggregate.getRows()).isEqualTo(3);
    assertThat(aggregate.getActivations()).isEqualTo(2);
    assertThat(aggregate.getNewBookings()).isEqualTo(2);
    assertThat(aggregate.getTotalNewMrr()).isEqualTo(30.0);
    assertThat(aggregate.getTotalRevenue()).isEqualTo(60.0);
    assertThat(aggregate.getAverageNewMrr()).isEqualTo(10.0);
    assertThat(aggregate.getNewMrrStandardDeviation()).isCloseTo(10.0, within(1e-9));
  }

  @Test
  void accumulate_nullMrrIsSkippedByMeanAndSpread() {
    CohortAggregate aggregate = new CohortAggregate();
    aggregate.accumulate(outcome("user-1", 10.0, true));
    aggregate.accumulate(outcome("user-2", null, false));

    assertThat(aggregate.getRows()).isEqualTo(2);
    assertThat(aggregate.getNewMrrValues()).isEqualTo(1);
    assertThat(aggregate.getTotalNewMrr()).isEqualTo(10.0);
    assertThat(aggregate.getAverageNewMrr()).isEqualTo(10.0);
    assertThat(aggregate.getNewMrrStandardDeviation()).isNull();

    aggregate.accumulate(outcome("user-3", 20.0, true));
    aggregate.accumulate(outcome("user-4", null, false));

    assertThat(aggregate.getRows()).isEqualTo(4);
    assertThat(aggregate.getTotalNewMrr()).isEqualTo(30.0);
    assertThat(aggregate.getAverageNewMrr()).isEqualTo(15.0);
    assertThat(aggregate.getNewMrrStandardDeviation()).isCloseTo(Math.sqrt(50.0), within(1e-9));
  }

  @Test
  void allMrrNull_hasNoMean() {
    CohortAggregate aggregate = new CohortAggregate();
    aggregate.accumulate(outcome("user-1", null, false));
    aggregate.accumulate(outcome("user-2", null, false));

    assertThat(aggregate.getTotalNewMrr()).isZero();
    assertThat(aggregate.getAverageNewMrr()).isNull();
    assertThat(aggregate.getNewMrrStandardDeviation()).isNull();
  }

  @Test
  void emptyAndSingleRowAggregates_haveNoSpread() {
    CohortAggregate aggregate = new CohortAggregate();
    assertThat(aggregate.isEmpty()).isTrue();
    assertThat(aggregate.getAverageNewMrr()).isNull();

    aggregate.accumulate(outcome("user-1", 7.0, true));
    assertThat(aggregate.isEmpty()).isFalse();
    assertThat(aggregate.getNewMrrStandardDeviation()).isNull();
  }

  @Test
  void totals_doNotDependOnAccumulationOrder() {
    List<Outcome> outcomes = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      outcomes.add(outcome("user-" + i, 0.1 * i + 1e-7, i % 3 == 0));
    }
    CohortAggregate inOrder = new CohortAggregate();
    outcomes.forEach(inOrder::accumulate);

    Collections.shuffle(outcomes, new Random(42));
    CohortAggregate shuffled = new CohortAggregate();
    outcomes.forEach(shuffled::accumulate);

    assertThat(shuffled.getTotalNewMrr()).isEqualTo(inOrder.getTotalNewMrr());
    assertThat(shuffled.getTotalRevenue()).isEqualTo(inOrder.getTotalRevenue());
    assertThat(shuffled.getNewMrrStandardDeviation())
        .isEqualTo(inOrder.getNewMrrStandardDeviation());
  }
}
