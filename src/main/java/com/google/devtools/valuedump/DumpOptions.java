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
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * DumpOptions is the set of formatting choices for one dump call. It is immutable, so a single
 * instance may be shared freely; the entry points on this class use only the options they are
 * called on, unlike the static methods of {@link ValueDump}, which read a process-wide default.
 *
 * <p>{@link #builder} starts from neutral settings: every field is shown and nothing is filtered.
 * {@link #DEFAULT} holds the settings {@link ValueDump} starts with.
 */
@AutoValue
public abstract class DumpOptions {

  /**
   * Field names starting with {@code $}, the prefix code generators and instrumentation agents
   * give the fields they add to classes.
   */
  public static final Pattern GENERATED_FIELDS = Pattern.compile("^(\\$.*)$");

  /** The initial process-wide configuration. */
  public static final DumpOptions DEFAULT =
      builder()
          .hidePrivateFields(true)
          .fieldExclusions(GENERATED_FIELDS)
          .separator(" ")
          .build();

  /** Render on a single line: no indentation or newlines, and labels as inline comments. */
  public abstract boolean compact();

  /** Remove package qualifiers from every type name. */
  public abstract boolean stripPackageNames();

  /** Leave out record fields that are not part of their class's public surface. */
  public abstract boolean hidePrivateFields();

  /** Leave out record fields holding the zero value of their type. */
  public abstract boolean hideZeroValues();

  /** Leave out record fields whose name contains a match of this pattern. */
  @Nullable
  public abstract Pattern fieldExclusions();

  /** Leave out record fields this filter rejects. */
  @Nullable
  public abstract FieldFilter fieldFilter();

  /**
   * A package whose qualifier is removed from type names, e.g. {@code com.example} turns {@code
   * com.example.Foo} into {@code Foo}. Empty for none. Ignored if {@link #stripPackageNames} is
   * set.
   */
  public abstract String homePackage();

  /** Text written between the top-level values of one call. */
  public abstract String separator();

  /** A callback given the first chance to render each non-nil value. */
  @Nullable
  public abstract DumpFunction dumpFunction();

  /**
   * Render every occurrence of a shared object in full instead of replacing repeats with a label.
   * Cycles are still broken by labels. Useful when diffing two dumps, where labels would show up as
   * spurious changes.
   */
  public abstract boolean disablePointerReplacement();

  /** Render dates and times as UTC {@code ZonedDateTime.of(...)} literals. */
  public abstract boolean formatTime();

  public static Builder builder() {
    // These are the neutral values.
    return new AutoValue_DumpOptions.Builder()
        .compact(false)
        .stripPackageNames(false)
        .hidePrivateFields(false)
        .hideZeroValues(false)
        .homePackage("")
        .separator("")
        .disablePointerReplacement(false)
        .formatTime(false);
  }

  public abstract Builder toBuilder();

  /** A mutable container used to construct an immutable DumpOptions. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder compact(boolean value);

    public abstract Builder stripPackageNames(boolean value);

    public abstract Builder hidePrivateFields(boolean value);

    public abstract Builder hideZeroValues(boolean value);

    public abstract Builder fieldExclusions(@Nullable Pattern value);

    public abstract Builder fieldFilter(@Nullable FieldFilter value);

    public abstract Builder homePackage(String value);

    public abstract Builder separator(String value);

    public abstract Builder dumpFunction(@Nullable DumpFunction value);

    public abstract Builder disablePointerReplacement(boolean value);

    public abstract Builder formatTime(boolean value);

    public abstract DumpOptions build();
  }

  /**
   * Returns the dump of {@code values}, separated by {@link #separator}.
   *
   * <p>As with any varargs method, a single array argument is spread into its elements; cast it to
   * {@code Object} to dump the array itself.
   */
  public String sdump(@Nullable Object... values) {
    StringBuilder buf = new StringBuilder();
    dumpTo(buf, values);
    return buf.toString();
  }

  /** Writes the dump of {@code values} and a newline to standard output. */
  public void dump(@Nullable Object... values) {
    PrintStream out = System.out;
    dumpTo(out, values);
    out.append('\n');
    out.flush();
    if (out.checkError()) {
      throw new UncheckedIOException(new IOException("error writing dump to standard output"));
    }
  }

  /**
   * Writes the dump of {@code values} to {@code out}.
   *
   * @throws UncheckedIOException if {@code out} fails; the output written so far is incomplete
   */
  public void dumpTo(Appendable out, @Nullable Object... values) {
    // A bare null argument arrives as a null array.
    Renderer.render(
        out, this, values == null ? Collections.singletonList(null) : Arrays.asList(values));
  }

  /** Returns the dump of a single value, never spreading arrays. */
  public String sdumpValue(@Nullable Object value) {
    StringBuilder buf = new StringBuilder();
    Renderer.render(buf, this, Collections.singletonList(value));
    return buf.toString();
  }
}
