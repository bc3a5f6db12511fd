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

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.valuedump.model.FieldDescriptor;
import com.google.devtools.valuedump.model.Value;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds the objects that are reachable more than once from a set of roots.
 *
 * <p>Each object with an {@link Identity} is descended into the first time it is met. Meeting it a
 * second time marks it as reused and stops the descent there, since everything below it has
 * already been seen; so the scan visits each distinct object once, whatever the number of paths to
 * it, and terminates on cycles. Record fields are all followed, including those a dump would hide,
 * and so are the keys of mappings.
 *
 * <p>Scanning only reads the graph, and may be done independently of any rendering.
 */
public final class ReachabilityScanner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Set<Identity> boundary;
  private final Set<Identity> seenOnce = new HashSet<>();
  private final Set<Identity> reused = new LinkedHashSet<>();

  private ReachabilityScanner(Set<Identity> boundary) {
    this.boundary = boundary;
  }

  /**
   * Returns the identities reachable from {@code roots} through two or more references, whether
   * siblings or a cycle. Order is that of discovery.
   */
  public static ImmutableSet<Identity> scan(Iterable<?> roots) {
    return scan(roots, ImmutableSet.of());
  }

  /**
   * Like {@link #scan(Iterable)}, but the objects in {@code boundary} are neither counted nor
   * descended into.
   */
  public static ImmutableSet<Identity> scan(Iterable<?> roots, Set<Identity> boundary) {
    ReachabilityScanner scanner = new ReachabilityScanner(boundary);
    for (Object root : roots) {
      scanner.consider(Value.of(root));
    }
    logger.atFinest().log(
        "Scanned %d distinct objects, %d reused",
        scanner.seenOnce.size() + scanner.reused.size(), scanner.reused.size());
    return ImmutableSet.copyOf(scanner.reused);
  }

  private void consider(Value v) {
    // A wrapper is transparent: it shares the identity of its contents.
    Value value = v.unwrap();
    if (value.isNil()) {
      return;
    }
    Identity id = Identity.of(value);
    if (id != null) {
      if (reused.contains(id) || boundary.contains(id)) {
        return;
      }
      if (seenOnce.remove(id)) {
        reused.add(id);
        return;
      }
      seenOnce.add(id);
    }

    switch (value.category()) {
      case SEQUENCE:
        for (Value element : value.elements()) {
          consider(element);
        }
        break;
      case MAPPING:
        for (Map.Entry<Value, Value> entry : value.entries()) {
          consider(entry.getKey());
          consider(entry.getValue());
        }
        break;
      case RECORD:
        for (FieldDescriptor field : value.layout().fields()) {
          consider(value.field(field));
        }
        break;
      case REFERENCE:
        consider(value.target());
        break;
      default:
        // Leaves.
        break;
    }
  }
}
