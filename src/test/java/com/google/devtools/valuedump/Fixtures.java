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
import java.io.Serializable;
import java.util.Map;
import java.util.function.Function;

/** Types used as dump input by the tests of this package. */
final class Fixtures {

  private Fixtures() {}

  static final class Blank {}

  static final class Basic {
    public int pub;
    private int priv;

    Basic(int pub, int priv) {
      this.pub = pub;
      this.priv = priv;
    }
  }

  static final class Circular {
    Circular self;
  }

  static final class Item {
    public final String name;

    Item(String name) {
      this.name = name;
    }
  }

  static final class Holder {
    public Object value;

    Holder(Object value) {
      this.value = value;
    }
  }

  static final class Outer {
    public Item item;
    public Object list;
  }

  static final class WithMap {
    public Map<String, Integer> counts;
  }

  static final class Flags {
    public boolean enabled = true;
    public int count = 3;
  }

  static final class Mixed {
    public String name = "n";
    public int number = 1;
  }

  static final class Generated {
    public int value = 1;
    public int $cache = 2;
  }

  static final class Diamond {
    public Diamond left;
    public Diamond right;
  }

  /** A map key that refers back to the map holding it. */
  static final class Key {
    public Map<Object, String> owner;
  }

  static final class Node {
    Node next;
  }

  record Point(int x, int y) {}

  enum Color {
    RED,
    GREEN
  }

  static final class CustomMultiLine implements Dumpable {
    public int dummy;

    CustomMultiLine(int dummy) {
      this.dummy = dummy;
    }

    @Override
    public void dump(Appendable out) throws IOException {
      out.append("{\n  multi\n  line\n}");
    }
  }

  static final class CustomSingleLine implements Dumpable {
    @Override
    public void dump(Appendable out) throws IOException {
      out.append("<custom>\n");
    }
  }

  static final class BrokenDumpable implements Dumpable {
    @Override
    public void dump(Appendable out) throws IOException {
      throw new IOException("broken");
    }
  }

  interface SerializableFunction<A, B> extends Function<A, B>, Serializable {}

  static Integer twice(Integer x) {
    return 2 * x;
  }

  /** Builds a chain of {@code n} diamonds, each pointing twice to the next. */
  static Diamond diamonds(int n) {
    Diamond head = null;
    for (int i = 0; i < n; i++) {
      Diamond d = new Diamond();
      d.left = head;
      d.right = head;
      head = d;
    }
    return head;
  }
}
