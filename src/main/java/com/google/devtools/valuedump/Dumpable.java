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

import java.io.IOException;

/**
 * Implemented by types that want to control their own dump output.
 *
 * <p>The text written by {@link #dump} is prefixed with the type name and re-indented to the
 * nesting depth at which the value appears: the first line is left as is, each following line is
 * indented, and a trailing newline is dropped. Shared and cyclic instances are labelled like any
 * other object.
 */
public interface Dumpable {

  /** Writes a representation of this value to {@code out}. */
  void dump(Appendable out) throws IOException;
}
