// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.google.devtools.valuedump;

import com.google.auto.value.AutoValue;

/** The label of a reused object, as returned by {@link LabelRegistry#labelFor}. */
@AutoValue
abstract class PointerLabel {

  /** The label text, {@code p0}, {@code p1}, .... */
  abstract String name();

  /** Whether this is the first request for the label, i.e. the object's body is still unwritten. */
  abstract boolean firstVisit();

  static PointerLabel create(String name, boolean firstVisit) {
    return new AutoValue_PointerLabel(name, firstVisit);
  }
}
