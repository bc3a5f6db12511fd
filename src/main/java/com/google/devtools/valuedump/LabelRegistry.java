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

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Hands out the labels of reused objects during one render session.
 *
 * <p>Labels are numbered in the order objects are first asked about, so for a given traversal
 * order the labelling is deterministic. A registry is not thread-safe.
 */
final class LabelRegistry {

  private final ImmutableSet<Identity> reused;
  private final Map<Identity, String> labels = new HashMap<>();

  LabelRegistry(ImmutableSet<Identity> reused) {
    this.reused = checkNotNull(reused);
  }

  /**
   * Returns the label of {@code id}, or null if it was not found to be reused. The first call for
   * an identity allocates the next label and reports a first visit; later calls return the same
   * label.
   */
  @Nullable
  PointerLabel labelFor(Identity id) {
    if (!reused.contains(id)) {
      return null;
    }
    String name = labels.get(id);
    if (name != null) {
      return PointerLabel.create(name, false);
    }
    name = "p" + labels.size();
    labels.put(id, name);
    return PointerLabel.create(name, true);
  }
}
