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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.devtools.valuedump.Fixtures.Basic;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the static entry points and the process-wide configuration. */
@RunWith(JUnit4.class)
public final class ValueDumpTest {

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private PrintStream savedOut;
  private DumpOptions savedConfig;

  @Before
  public void captureStandardOutput() {
    savedOut = System.out;
    savedConfig = ValueDump.getConfig();
    System.setOut(new PrintStream(stdout, true, UTF_8));
  }

  @After
  public void restore() {
    System.setOut(savedOut);
    ValueDump.setConfig(savedConfig);
  }

  @Test
  public void testInitialConfigIsDefault() {
    assertThat(savedConfig).isEqualTo(DumpOptions.DEFAULT);
  }

  @Test
  public void testSdumpUsesDefaultConfig() {
    assertThat(ValueDump.sdump(new Basic(1, 2)))
        .isEqualTo(
            """
            com.google.devtools.valuedump.Fixtures.Basic{
              pub: 1,
            }""");
    assertThat(ValueDump.sdump("a", 1)).isEqualTo("\"a\" 1");
  }

  @Test
  public void testSetConfig() {
    DumpOptions options = DumpOptions.builder().stripPackageNames(true).compact(true).build();
    ValueDump.setConfig(options);
    assertThat(ValueDump.getConfig()).isSameInstanceAs(options);
    assertThat(ValueDump.sdump(new Basic(1, 2))).isEqualTo("Fixtures.Basic{pub:1,priv:2}");
  }

  @Test
  public void testSetConfigRejectsNull() {
    assertThrows(NullPointerException.class, () -> ValueDump.setConfig(null));
  }

  @Test
  public void testDumpWritesToStandardOutputWithNewline() {
    ValueDump.setConfig(DumpOptions.DEFAULT.toBuilder().separator(", ").build());
    ValueDump.dump(1, "two", null);
    assertThat(stdout.toString(UTF_8)).isEqualTo("1, \"two\", nil\n");
  }

  @Test
  public void testOptionsDumpIgnoresProcessConfig() {
    ValueDump.setConfig(DumpOptions.DEFAULT.toBuilder().compact(true).build());
    DumpOptions.builder().build().dump(new int[] {1});
    assertThat(stdout.toString(UTF_8)).isEqualTo("int[]{\n  1,\n}\n");
  }
}
