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

import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.DuplicationAnomaly;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.TupleTag;

/**
 * Given all Outcomes of one (userId, experimentName) partition, outputs the canonical Outcome if it
 * belongs to the clean cohort.
 *
 * <p>The canonical Outcome is the single row with duplicationRank 1. The rank is trusted as
 * computed upstream and never re-derived, but a partition with zero or several rank 1 rows is not
 * resolved: it is output as a {@link DuplicationAnomaly} on {@link #DUPLICATION_ANOMALIES} and
 * left out of the clean cohort.
 *
 * <p>A canonical Outcome is in the clean cohort if it is an eligible visitor and its
 * contamination flag is exactly "Not Contaminated". Any other flag value, including null, is
 * treated as contaminated.
 */
public class ResolveCanonicalOutcomeFn
    extends DoFn<KV<KV<String, String>, Iterable<Outcome>>, Outcome> {

  public static final String DUPLICATION_RANK_VIOLATIONS = "duplication_rank_violations";
  public static final String CLEAN_COHORT_USERS = "clean_cohort_users";

  public static final TupleTag<Outcome> CLEAN_OUTCOMES = new TupleTag<Outcome>() {};
  public static final TupleTag<DuplicationAnomaly> DUPLICATION_ANOMALIES =
      new TupleTag<DuplicationAnomaly>() {};

  private final Counter duplicationRankViolations = Metrics.counter(
      ClassifyFunnelFactFn.METRICS_NAMESPACE, DUPLICATION_RANK_VIOLATIONS);
  private final Counter cleanCohortUsers =
      Metrics.counter(ClassifyFunnelFactFn.METRICS_NAMESPACE, CLEAN_COHORT_USERS);

  @ProcessElement
  public void processElement(ProcessContext context) {
    KV<KV<String, String>, Iterable<Outcome>> kv = context.element();
    Outcome canonical = null;
    long rankOneRows = 0;
    long totalRows = 0;
    for (Outcome outcome : kv.getValue()) {
      totalRows++;
      if (outcome.getFact().getDuplicationRank() == 1) {
        rankOneRows++;
        canonical = outcome;
      }
    }
    if (rankOneRows != 1) {
      duplicationRankViolations.inc();
      context.output(DUPLICATION_ANOMALIES, new DuplicationAnomaly(
          kv.getKey().getKey(), kv.getKey().getValue(), rankOneRows, totalRows));
      return;
    }
    if (isCleanCohortMember(canonical)) {
      cleanCohortUsers.inc();
      context.output(canonical);
    }
  }

  public static boolean isCleanCohortMember(Outcome outcome) {
    return outcome.isEligibleVisitor() && !outcome.getFact().isContaminated();
  }
}
