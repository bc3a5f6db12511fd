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

import com.google.common.annotations.VisibleForTesting;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Spells type names, and the names of functions, the way a {@link DumpOptions} asks for. */
final class TypeNames {

  // A lower-case identifier followed by a dot: by convention, a package name segment.
  private static final Pattern PACKAGE_QUALIFIER = Pattern.compile("\\b[a-z_][a-zA-Z_0-9]*\\.");
  private static final Pattern COMPACT_PUNCTUATION = Pattern.compile("\\s*([,;{}()])\\s*");

  private final boolean stripPackageNames;
  private final boolean compact;
  @Nullable private final Pattern homePackage;

  TypeNames(DumpOptions options) {
    this.stripPackageNames = options.stripPackageNames();
    this.compact = options.compact();
    this.homePackage =
        options.homePackage().isEmpty()
            ? null
            : Pattern.compile("(?<![\\w.$])" + Pattern.quote(options.homePackage()) + "\\.");
  }

  /** Returns the name of {@code cls}: {@code java.util.Map.Entry}, {@code int[]}, .... */
  @VisibleForTesting
  static String qualifiedName(Class<?> cls) {
    if (cls.isArray()) {
      return qualifiedName(cls.getComponentType()) + "[]";
    }
    // Anonymous and local classes have no canonical name.
    String canonical = cls.getCanonicalName();
    return canonical != null ? canonical : cls.getName();
  }

  /** Returns the display name of {@code cls}. */
  String of(Class<?> cls) {
    return simplify(qualifiedName(cls));
  }

  /** Applies package stripping or home-package elision, and compaction, to any qualified name. */
  String simplify(String name) {
    if (stripPackageNames) {
      name = PACKAGE_QUALIFIER.matcher(name).replaceAll("");
    } else if (homePackage != null) {
      name = homePackage.matcher(name).replaceAll("");
    }
    if (compact) {
      name = COMPACT_PUNCTUATION.matcher(name).replaceAll("$1");
    }
    return name;
  }
}
