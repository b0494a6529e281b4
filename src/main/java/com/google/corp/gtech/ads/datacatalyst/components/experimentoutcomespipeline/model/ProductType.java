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

/** Product types, which decide how activation is ordered against exposure. */
public enum ProductType {
  // Purely behavioural product: activation must not precede exposure.
  WEB_ONLY(false),
  // Product with offline activity: activation may precede exposure by a grace window.
  HYBRID(true);

  private final boolean activationGraceAllowed;

  ProductType(boolean activationGraceAllowed) {
    this.activationGraceAllowed = activationGraceAllowed;
  }

  public boolean isActivationGraceAllowed() {
    return activationGraceAllowed;
  }
}
