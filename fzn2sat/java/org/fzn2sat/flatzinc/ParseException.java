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

/** Raised by the {@link Parser} when the token stream is not a well-formed FlatZinc model. */
public class ParseException extends FlatZincException {
  public ParseException(String message, Location location) {
    super(message, location);
  }

  static ParseException expected(String what, Token found) {
    return new ParseException("expected " + what + ", found " + found.describe(),
        found.getLocation());
  }
}
