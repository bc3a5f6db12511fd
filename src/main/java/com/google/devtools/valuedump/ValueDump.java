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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * Static entry points for dumping values with a process-wide configuration.
 *
 * <p>The configuration starts out as {@link DumpOptions#DEFAULT} and may be replaced at any time
 * with {@link #setConfig}. It is not synchronized: replacing it while another thread
 * is dumping is a data race, and avoiding that is the caller's business. Code that cannot make
 * that promise, and libraries in general, should call the methods of a {@link DumpOptions}
 * instance instead.
 */
public final class ValueDump {

  private static DumpOptions config = DumpOptions.DEFAULT;

  private ValueDump() {}

  /** Returns the process-wide configuration. */
  public static DumpOptions getConfig() {
    return config;
  }

  /** Replaces the process-wide configuration. */
  public static void setConfig(DumpOptions options) {
    config = checkNotNull(options);
  }

  /** Writes the dump of {@code values} and a newline to standard output. */
  public static void dump(@Nullable Object... values) {
    config.dump(values);
  }

  /** Returns the dump of {@code values}. */
  public static String sdump(@Nullable Object... values) {
    return config.sdump(values);
  }
}
