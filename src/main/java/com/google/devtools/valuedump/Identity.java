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

import com.google.devtools.valuedump.model.Value;
import javax.annotation.Nullable;

/**
 * An opaque token for one piece of referenced storage. Two tokens are equal iff they were derived
 * from the same object, regardless of that object's own {@code equals}.
 */
public final class Identity {

  private final Object referent;

  private Identity(Object referent) {
    this.referent = referent;
  }

  /**
   * Returns the identity of {@code value}, or null if it has none: only sequences, mappings,
   * records and references own storage. Wrappers take the identity of what they wrap.
   *
   * <p>Empty sequences and mappings have no identity. They cannot be part of a cycle, and the
   * platform shares single instances of them ({@code List.of()}, {@code Collections.emptyMap()})
   * between unrelated owners.
   */
  @Nullable
  public static Identity of(Value value) {
    Value v = value.unwrap();
    if (!v.category().hasIdentity() || v.isEmpty()) {
      return null;
    }
    return new Identity(v.object());
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Identity && ((Identity) that).referent == referent;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(referent);
  }

  @Override
  public String toString() {
    return referent.getClass().getName() + "@" + Integer.toHexString(hashCode());
  }
}
