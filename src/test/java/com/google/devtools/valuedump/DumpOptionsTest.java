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

import static com.google.common.truth.Truth.assertThat;

import com.google.devtools.valuedump.Fixtures.Basic;
import com.google.devtools.valuedump.Fixtures.Blank;
import com.google.devtools.valuedump.Fixtures.Circular;
import com.google.devtools.valuedump.Fixtures.Flags;
import com.google.devtools.valuedump.Fixtures.Generated;
import com.google.devtools.valuedump.Fixtures.Item;
import com.google.devtools.valuedump.Fixtures.Mixed;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the individual formatting options. */
@RunWith(JUnit4.class)
public final class DumpOptionsTest {

  private static final DumpOptions STRIPPED = DumpOptions.builder().stripPackageNames(true).build();

  @Test
  public void testBuilderStartsNeutral() {
    DumpOptions options = DumpOptions.builder().build();
    assertThat(options.compact()).isFalse();
    assertThat(options.stripPackageNames()).isFalse();
    assertThat(options.hidePrivateFields()).isFalse();
    assertThat(options.hideZeroValues()).isFalse();
    assertThat(options.fieldExclusions()).isNull();
    assertThat(options.fieldFilter()).isNull();
    assertThat(options.homePackage()).isEmpty();
    assertThat(options.separator()).isEmpty();
    assertThat(options.dumpFunction()).isNull();
    assertThat(options.disablePointerReplacement()).isFalse();
    assertThat(options.formatTime()).isFalse();
  }

  @Test
  public void testDefaults() {
    assertThat(DumpOptions.DEFAULT.hidePrivateFields()).isTrue();
    assertThat(DumpOptions.DEFAULT.fieldExclusions())
        .isSameInstanceAs(DumpOptions.GENERATED_FIELDS);
    assertThat(DumpOptions.DEFAULT.separator()).isEqualTo(" ");
    assertThat(DumpOptions.DEFAULT.compact()).isFalse();
  }

  @Test
  public void testPackageNamesAreKeptUnlessStripped() {
    assertThat(DumpOptions.builder().build().sdumpValue(new Blank()))
        .isEqualTo("com.google.devtools.valuedump.Fixtures.Blank{}");
    assertThat(STRIPPED.sdumpValue(new Blank())).isEqualTo("Fixtures.Blank{}");
  }

  @Test
  public void testHomePackage() {
    DumpOptions options =
        DumpOptions.builder().homePackage("com.google.devtools.valuedump").build();
    assertThat(options.sdumpValue(new Blank())).isEqualTo("Fixtures.Blank{}");
    // Other packages keep their qualifier.
    assertThat(options.sdumpValue(new java.util.ArrayList<>())).isEqualTo("java.util.ArrayList{}");
  }

  @Test
  public void testHomePackageIsOnlyRemovedAsAWholePackage() {
    DumpOptions options = DumpOptions.builder().homePackage("devtools.valuedump").build();
    assertThat(options.sdumpValue(new Blank()))
        .isEqualTo("com.google.devtools.valuedump.Fixtures.Blank{}");
  }

  @Test
  public void testHidePrivateFields() {
    Basic basic = new Basic(1, 2);
    assertThat(STRIPPED.sdumpValue(basic))
        .isEqualTo(
            """
            Fixtures.Basic{
              pub: 1,
              priv: 2,
            }""");
    assertThat(STRIPPED.toBuilder().hidePrivateFields(true).build().sdumpValue(basic))
        .isEqualTo(
            """
            Fixtures.Basic{
              pub: 1,
            }""");
  }

  @Test
  public void testHiddenFieldsStillExposeCycles() {
    // The only path back to the root goes through a hidden field.
    Circular circular = new Circular();
    circular.self = circular;
    DumpOptions options = STRIPPED.toBuilder().hidePrivateFields(true).build();
    assertThat(options.sdumpValue(circular)).isEqualTo("Fixtures.Circular{}/*p0*/");
  }

  @Test
  public void testHideZeroValues() {
    DumpOptions options = STRIPPED.toBuilder().hideZeroValues(true).build();
    assertThat(options.sdumpValue(new Basic(0, 2)))
        .isEqualTo(
            """
            Fixtures.Basic{
              priv: 2,
            }""");
    assertThat(options.sdumpValue(new Basic(0, 0))).isEqualTo("Fixtures.Basic{}");
    Flags flags = new Flags();
    flags.enabled = false;
    assertThat(options.sdumpValue(flags))
        .isEqualTo(
            """
            Fixtures.Flags{
              count: 3,
            }""");
  }

  @Test
  public void testZeroValuesAreShownByDefault() {
    assertThat(STRIPPED.sdumpValue(new Item(null)))
        .isEqualTo(
            """
            Fixtures.Item{
              name: nil,
            }""");
  }

  @Test
  public void testFieldExclusions() {
    DumpOptions options = DumpOptions.DEFAULT.toBuilder().stripPackageNames(true).build();
    assertThat(options.sdumpValue(new Generated()))
        .isEqualTo(
            """
            Fixtures.Generated{
              value: 1,
            }""");
    options = STRIPPED.toBuilder().fieldExclusions(Pattern.compile("al")).build();
    assertThat(options.sdumpValue(new Generated()))
        .isEqualTo(
            """
            Fixtures.Generated{
              $cache: 2,
            }""");
  }

  @Test
  public void testFieldFilter() {
    DumpOptions options =
        STRIPPED.toBuilder().fieldFilter((field, value) -> value instanceof String).build();
    assertThat(options.sdumpValue(new Mixed()))
        .isEqualTo(
            """
            Fixtures.Mixed{
              name: "n",
            }""");
  }

  @Test
  public void testFieldFilterSeesDescriptors() {
    DumpOptions options =
        STRIPPED.toBuilder()
            .fieldFilter((field, value) -> field.type() == int.class && field.exported())
            .build();
    assertThat(options.sdumpValue(new Basic(1, 2)))
        .isEqualTo(
            """
            Fixtures.Basic{
              pub: 1,
            }""");
  }

  @Test
  public void testDumpFunction() {
    DumpOptions options =
        STRIPPED.toBuilder()
            .dumpFunction(
                (value, out) -> {
                  if (!(value instanceof Boolean)) {
                    return false;
                  }
                  out.append((Boolean) value ? "\"on\"" : "\"off\"");
                  return true;
                })
            .build();
    assertThat(options.sdumpValue(true)).isEqualTo("Boolean\"on\"");
    assertThat(options.sdumpValue(1)).isEqualTo("1");
    assertThat(options.sdumpValue(new Flags()))
        .isEqualTo(
            """
            Fixtures.Flags{
              enabled: Boolean"on",
              count: 3,
            }""");
  }

  @Test
  public void testDisablePointerReplacement() {
    DumpOptions options = STRIPPED.toBuilder().disablePointerReplacement(true).build();
    Item a = new Item("a");
    assertThat(options.sdumpValue(new Item[] {a, a}))
        .isEqualTo(
            """
            Fixtures.Item[]{
              Fixtures.Item{ // p0
                name: "a",
              },
              Fixtures.Item{ // p0
                name: "a",
              },
            }""");
  }

  @Test
  public void testDisablePointerReplacementStillBreaksCycles() {
    DumpOptions options = STRIPPED.toBuilder().disablePointerReplacement(true).build();
    Circular circular = new Circular();
    circular.self = circular;
    assertThat(options.sdumpValue(circular))
        .isEqualTo(
            """
            Fixtures.Circular{ // p0
              self: p0,
            }""");
  }

  @Test
  public void testSeparator() {
    DumpOptions options = STRIPPED.toBuilder().separator("***").build();
    assertThat(options.sdump(new String[] {"x", "y"}, 42))
        .isEqualTo(
            """
            String[]{
              "x",
              "y",
            }***42""");
    assertThat(options.sdump(1, 2, 3)).isEqualTo("1***2***3");
    assertThat(options.sdump()).isEmpty();
  }

  @Test
  public void testLabelsSpanAllValuesOfOneCall() {
    DumpOptions options = STRIPPED.toBuilder().separator(" ").build();
    Item a = new Item("a");
    assertThat(options.sdump(a, a))
        .isEqualTo(
            """
            Fixtures.Item{ // p0
              name: "a",
            } p0""");
    Blank blank = new Blank();
    assertThat(options.sdump(blank, blank)).isEqualTo("Fixtures.Blank{}/*p0*/ p0");
  }

  @Test
  public void testNullArguments() {
    assertThat(STRIPPED.sdump((Object) null)).isEqualTo("nil");
    assertThat(STRIPPED.sdump((Object[]) null)).isEqualTo("nil");
    assertThat(STRIPPED.toBuilder().separator(",").build().sdump(null, null)).isEqualTo("nil,nil");
  }

  @Test
  public void testFormatTime() {
    DumpOptions options = STRIPPED.toBuilder().formatTime(true).build();
    assertThat(options.sdumpValue(Instant.ofEpochSecond(0)))
        .isEqualTo("ZonedDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)");
    assertThat(options.sdumpValue(LocalDateTime.of(2020, 2, 29, 13, 5, 7, 9)))
        .isEqualTo("ZonedDateTime.of(2020, 2, 29, 13, 5, 7, 9, ZoneOffset.UTC)");
    assertThat(options.sdumpValue(new Date(1000)))
        .isEqualTo("ZonedDateTime.of(1970, 1, 1, 0, 0, 1, 0, ZoneOffset.UTC)");
    assertThat(STRIPPED.sdumpValue(Instant.ofEpochSecond(0))).isEqualTo("1970-01-01T00:00:00Z");
  }

  @Test
  public void testCompactTypeNames() {
    DumpOptions options = DumpOptions.builder().compact(true).build();
    assertThat(options.sdumpValue(new Flags()))
        .isEqualTo("com.google.devtools.valuedump.Fixtures.Flags{enabled:true,count:3}");
  }
}
