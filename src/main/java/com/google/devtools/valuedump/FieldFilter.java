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

import com.google.devtools.valuedump.model.FieldDescriptor;
import javax.annotation.Nullable;

/** Decides which record fields are rendered. */
@FunctionalInterface
public interface FieldFilter {

  /** Returns true if {@code field}, whose current value is {@code value}, should be rendered. */
  boolean include(FieldDescriptor field, @Nullable Object value);
}
