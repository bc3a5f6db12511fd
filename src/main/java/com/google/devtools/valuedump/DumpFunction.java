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
 * A formatting callback consulted for every non-nil value before any other rendering rule,
 * including {@link Dumpable}.
 */
@FunctionalInterface
public interface DumpFunction {

  /**
   * Writes a representation of {@code value} to {@code out} and returns true, or returns false
   * (having written nothing) to let the value be rendered normally.
   */
  boolean dump(Object value, Appendable out) throws IOException;
}
