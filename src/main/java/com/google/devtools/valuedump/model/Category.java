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
package com.google.devtools.valuedump.model;

/** The runtime category of a {@link Value}, which decides how it is scanned and rendered. */
public enum Category {
  /** Java {@code null}. */
  NIL,
  /** Self-contained literals: booleans, characters, numbers, strings, enum constants, classes. */
  SCALAR,
  /** Arrays and collections. */
  SEQUENCE,
  /** Maps and multimaps. */
  MAPPING,
  /** Objects rendered field by field. */
  RECORD,
  /** Mutable or weak holders of a single other value. */
  REFERENCE,
  /** Optionals; rendered as their contents. */
  WRAPPER,
  /** Lambdas, method references and reflective methods. */
  FUNCTION,
  /** Threads, streams, channels and the like, which have no inspectable contents. */
  HANDLE,
  /** Values whose structure cannot be observed; rendered with {@code toString}. */
  OPAQUE;

  /** Reports whether values of this category own storage that may be shared or cyclic. */
  public boolean hasIdentity() {
    return this == SEQUENCE || this == MAPPING || this == RECORD || this == REFERENCE;
  }
}
