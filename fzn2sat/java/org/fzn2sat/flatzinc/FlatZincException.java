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

package org.fzn2sat.flatzinc;

/**
 * Base class of every error raised while reading, translating or solving a FlatZinc model.
 *
 * <p>The message never contains the location; callers combine {@link #getLocation()} and
 * {@link #getMessage()} when rendering a diagnostic.
 */
public class FlatZincException extends RuntimeException {
  public FlatZincException(String message, Location location) {
    super(message);
    this.location = location;
  }

  public FlatZincException(String message, Location location, Throwable cause) {
    super(message, cause);
    this.location = location;
  }

  /** Returns the source position of the error, or null when it is not tied to one. */
  public Location getLocation() {
    return location;
  }

  /** Returns {@code "line:column: message"}, or just the message without a location. */
  public String render() {
    return location == null ? getMessage() : location + ": " + getMessage();
  }

  private final Location location;
}
