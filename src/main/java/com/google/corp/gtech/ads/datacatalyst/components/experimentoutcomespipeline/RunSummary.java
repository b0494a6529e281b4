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

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.ClassifyFunnelFactFn;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform.ResolveCanonicalOutcomeFn;
import java.util.HashMap;
import java.util.Map;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.MetricResults;
import org.apache.beam.sdk.metrics.MetricsFilter;

/**
 * Summary of the data quality counters of one pipeline run: how many facts were classified, how
 * many hit a classification ambiguity, and how many (userId, experimentName) partitions were left
 * out of the clean cohort because of a duplication rank violation.
 */
public class RunSummary {
  private final ImmutableMap<String, Long> counters;

  public RunSummary(Map<String, Long> counters) {
    this.counters = ImmutableMap.copyOf(counters);
  }

  // Sums the attempted value of every counter in the pipeline's metrics namespace across steps.
  public static RunSummary fromMetrics(MetricResults metrics) {
    MetricQueryResults results = metrics.queryMetrics(
        MetricsFilter.builder()
            .addNameFilter(MetricNameFilter.inNamespace(ClassifyFunnelFactFn.METRICS_NAMESPACE))
            .build());
    Map<String, Long> counters = new HashMap<>();
    for (MetricResult<Long> counter : results.getCounters()) {
      counters.merge(counter.getName().getName(), counter.getAttempted(), Long::sum);
    }
    return new RunSummary(counters);
  }

  public long getFactsClassified() {
    return getCounter(ClassifyFunnelFactFn.FACTS_CLASSIFIED);
  }

  public long getFactsWithoutConfig() {
    return getCounter(ClassifyFunnelFactFn.FACTS_WITHOUT_CONFIG);
  }

  public long getFactsMissingExposure() {
    return getCounter(ClassifyFunnelFactFn.FACTS_MISSING_EXPOSURE);
  }

  public long getPreExposureConversions() {
    return getCounter(ClassifyFunnelFactFn.PRE_EXPOSURE_CONVERSIONS);
  }

  public long getCleanCohortUsers() {
    return getCounter(ResolveCanonicalOutcomeFn.CLEAN_COHORT_USERS);
  }

  public long getDuplicationRankViolations() {
    return getCounter(ResolveCanonicalOutcomeFn.DUPLICATION_RANK_VIOLATIONS);
  }

  public boolean hasAnomalies() {
    return getDuplicationRankViolations() > 0;
  }

  private long getCounter(String name) {
    return counters.getOrDefault(name, 0L);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("factsClassified", getFactsClassified())
        .add("factsWithoutConfig", getFactsWithoutConfig())
        .add("factsMissingExposure", getFactsMissingExposure())
        .add("preExposureConversions", getPreExposureConversions())
        .add("cleanCohortUsers", getCleanCohortUsers())
        .add("duplicationRankViolations", getDuplicationRankViolations())
        .toString();
  }
}
