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

import com.google.common.collect.ImmutableList;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.AggregationDimension;
import com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.model.Outcome;
import java.util.ArrayList;
import java.util.List;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.KV;

/**
 * Keys each Outcome by its values for the given aggregation dimensions, in order. Values may be
 * null; a null is its own group.
 */
public class MapOutcomeToDimensionKey extends DoFn<Outcome, KV<List<String>, Outcome>> {
  private final ImmutableList<AggregationDimension> dimensions;

  public MapOutcomeToDimensionKey(List<AggregationDimension> dimensions) {
    this.dimensions = ImmutableList.copyOf(dimensions);
  }

  @ProcessElement
  public void processElement(ProcessContext context) {
    Outcome outcome = context.element();
    List<String> key = new ArrayList<>(dimensions.size());
    for (AggregationDimension dimension : dimensions) {
      key.add(dimension.extract(outcome.getFact()));
    }
    context.output(KV.of(key, outcome));
  }
}
