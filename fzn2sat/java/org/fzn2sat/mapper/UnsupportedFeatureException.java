// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.fzn2sat.mapper;

import org.fzn2sat.flatzinc.FlatZincException;
import org.fzn2sat.flatzinc.Location;

/**
 * Raised for constructs that are recognized but cannot be lowered, such as multi-dimensional
 * arrays or set variables.
 */
public class UnsupportedFeatureException extends FlatZincException {
  public UnsupportedFeatureException(String feature, Location location) {
    super("unsupported feature: " + feature, location);
    this.feature = feature;
  }

  /** Returns the name of the unsupported construct. */
  public String getFeature() {
    return feature;
  }

  private final String feature;
}
