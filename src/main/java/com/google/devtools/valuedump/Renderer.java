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
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimap;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.valuedump.model.FieldDescriptor;
import com.google.devtools.valuedump.model.Value;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * A render session: writes the text of one or more values to an {@link Appendable}.
 *
 * <p>Before rendering, the session {@linkplain ReachabilityScanner scans} all the values together
 * for objects reachable along more than one path. Each such object is written in full once, with
 * its label ({@code p0}, {@code p1}, ...) as a trailing comment on its first line, and as the bare
 * label everywhere else. Every other object is written in full where it occurs.
 *
 * <p>A session is single-threaded and is discarded after its call.
 */
final class Renderer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String INDENT = "  ";
  private static final String NIL = "nil";

  // Stands in, within a sort key, for an object that encloses the key.
  private static final String ENCLOSING = "^";

  private final Appendable out;
  private final DumpOptions options;
  private final TypeNames typeNames;
  private final LabelRegistry labels;

  // Objects whose bodies are being written. Without pointer replacement, these are the only
  // objects that are replaced by their labels, since repeating them would never end.
  private final Set<Identity> parents = new HashSet<>();

  // Labels that go at the end of the next line.
  private final List<String> pendingLabels = new ArrayList<>();

  // Objects being written by the sessions this one computes a sort key for. Empty for a top-level
  // session.
  private final ImmutableSet<Identity> enclosing;

  // Sort keys of objects with an identity, shared with the sessions that compute them.
  private final Map<Identity, String> keyTexts;

  private int depth;

  private Renderer(
      Appendable out,
      DumpOptions options,
      ImmutableSet<Identity> reused,
      ImmutableSet<Identity> enclosing,
      Map<Identity, String> keyTexts) {
    this.out = out;
    this.options = options;
    this.typeNames = new TypeNames(options);
    this.labels = new LabelRegistry(reused);
    this.enclosing = enclosing;
    this.keyTexts = keyTexts;
  }

  /**
   * Renders {@code values}, separated by the options' separator, in one session.
   *
   * @throws UncheckedIOException if {@code out} fails
   * @throws IllegalStateException if the values are nested too deeply to render
   */
  static void render(Appendable out, DumpOptions options, List<?> values) {
    checkNotNull(out);
    checkNotNull(options);
    try {
      Renderer renderer =
          new Renderer(
              out, options, ReachabilityScanner.scan(values), ImmutableSet.of(), new HashMap<>());
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          renderer.append(options.separator());
        }
        renderer.dump(Value.of(values.get(i)));
        renderer.flushPendingLabels();
      }
    } catch (StackOverflowError unused) {
      throw new IllegalStateException("nesting depth limit exceeded");
    }
  }

  @CanIgnoreReturnValue
  private Renderer append(char c) {
    try {
      out.append(c);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return this;
  }

  @CanIgnoreReturnValue
  private Renderer append(CharSequence s) {
    try {
      out.append(s);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return this;
  }

  private void indent() {
    if (!options.compact()) {
      append(Strings.repeat(INDENT, depth));
    }
  }

  // Ends a line, first emitting any labels that are waiting for it.
  private void newline() {
    if (!pendingLabels.isEmpty()) {
      if (options.compact()) {
        append("/*").append(Joiner.on(',').join(pendingLabels)).append("*/");
      } else {
        append(" // ").append(Joiner.on(", ").join(pendingLabels)).append('\n');
      }
      pendingLabels.clear();
      return;
    }
    if (!options.compact()) {
      append('\n');
    }
  }

  // A top-level value may end without another line break, e.g. an empty record; its label is
  // then written inline, where it cannot swallow the text that follows.
  private void flushPendingLabels() {
    if (!pendingLabels.isEmpty()) {
      append("/*").append(Joiner.on(',').join(pendingLabels)).append("*/");
      pendingLabels.clear();
    }
  }

  private void dump(Value value) {
    if (value.isNil()) {
      dumpNil(value);
      return;
    }
    Value v = value.unwrap();
    if (v.isNil()) {
      append(NIL);
      return;
    }
    Object object = v.object();

    DumpFunction dumpFunction = options.dumpFunction();
    if (dumpFunction != null) {
      StringBuilder buf = new StringBuilder();
      boolean handled;
      try {
        handled = dumpFunction.dump(object, buf);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      if (handled) {
        dumpCustom(v, buf);
        return;
      }
    }

    if (object instanceof Dumpable) {
      descend(
          v,
          () -> {
            StringBuilder buf = new StringBuilder();
            try {
              ((Dumpable) object).dump(buf);
            } catch (IOException e) {
              throw new UncheckedIOException(e);
            }
            dumpCustom(v, buf);
          });
      return;
    }

    if (options.formatTime()) {
      String literal = TimeLiterals.format(object);
      if (literal != null) {
        append(literal);
        return;
      }
    }

    switch (v.category()) {
      case SCALAR:
        dumpScalar(object);
        break;
      case SEQUENCE:
        descend(v, () -> dumpSequence(v));
        break;
      case MAPPING:
        descend(v, () -> dumpMapping(v));
        break;
      case RECORD:
        descend(v, () -> dumpRecord(v));
        break;
      case REFERENCE:
        descend(v, () -> dumpReference(v));
        break;
      case FUNCTION:
        dumpFunctionValue(object);
        break;
      case HANDLE:
        append(typeNames.of(v.type()));
        break;
      default:
        dumpOpaque(v);
    }
  }

  // A nil map is told apart from an empty one when the declared type says it is a map.
  private void dumpNil(Value value) {
    Class<?> declared = value.declaredType();
    if (declared != null
        && (Map.class.isAssignableFrom(declared) || Multimap.class.isAssignableFrom(declared))) {
      append(typeNames.of(declared)).append("(nil)");
    } else {
      append(NIL);
    }
  }

  /**
   * Writes the body of an object that may be reused, or just its label if the body has been
   * written already.
   */
  private void descend(Value value, Runnable body) {
    Identity id = Identity.of(value);
    if (id == null) {
      body.run();
      return;
    }
    if (enclosing.contains(id)) {
      append(ENCLOSING);
      return;
    }
    boolean pushed = parents.add(id);
    try {
      if (options.disablePointerReplacement() && pushed) {
        // Not a cycle: write the body again, under its label if it has one.
        PointerLabel label = labels.labelFor(id);
        if (label != null) {
          pendingLabels.add(label.name());
        }
        body.run();
        return;
      }
      PointerLabel label = labels.labelFor(id);
      if (label == null) {
        if (!pushed) {
          throw new IllegalStateException("cycle through " + id + " escaped the reachability scan");
        }
        body.run();
      } else if (label.firstVisit()) {
        pendingLabels.add(label.name());
        body.run();
      } else {
        append(label.name());
      }
    } finally {
      if (pushed) {
        parents.remove(id);
      }
    }
  }

  private void dumpScalar(Object object) {
    if (object instanceof String) {
      appendQuoted((String) object, '"');
    } else if (object instanceof Character) {
      appendQuoted(object.toString(), '\'');
    } else if (object instanceof Enum) {
      Enum<?> constant = (Enum<?>) object;
      append(typeNames.of(constant.getDeclaringClass())).append('.').append(constant.name());
    } else if (object instanceof Class) {
      append(typeNames.of((Class<?>) object)).append(".class");
    } else {
      // Booleans, numbers, complex numbers.
      append(object.toString());
    }
  }

  private void dumpSequence(Value v) {
    ImmutableList<Value> elements = v.elements();
    if (v.isSet()) {
      elements = canonicalOrder(elements, e -> e);
    }
    append(typeNames.of(v.type()));
    if (elements.isEmpty()) {
      append("{}");
      return;
    }
    append('{');
    newline();
    depth++;
    for (int i = 0; i < elements.size(); i++) {
      indent();
      dump(elements.get(i));
      endItem(i, elements.size());
    }
    depth--;
    indent();
    append('}');
  }

  private void dumpMapping(Value v) {
    ImmutableList<Map.Entry<Value, Value>> entries = canonicalOrder(v.entries(), Map.Entry::getKey);
    append(typeNames.of(v.type()));
    if (entries.isEmpty()) {
      append("{}");
      return;
    }
    append('{');
    newline();
    depth++;
    for (int i = 0; i < entries.size(); i++) {
      Map.Entry<Value, Value> entry = entries.get(i);
      indent();
      dump(entry.getKey());
      append(options.compact() ? ":" : ": ");
      dump(entry.getValue());
      endItem(i, entries.size());
    }
    depth--;
    indent();
    append('}');
  }

  private void dumpRecord(Value v) {
    List<FieldDescriptor> shownFields = new ArrayList<>();
    List<Value> shownValues = new ArrayList<>();
    Pattern exclusions = options.fieldExclusions();
    FieldFilter filter = options.fieldFilter();
    for (FieldDescriptor field : v.layout().fields()) {
      if (options.hidePrivateFields() && !field.exported()) {
        continue;
      }
      if (exclusions != null && exclusions.matcher(field.name()).find()) {
        continue;
      }
      Value fieldValue = v.field(field);
      if (filter != null && !filter.include(field, fieldValue.object())) {
        continue;
      }
      if (options.hideZeroValues() && fieldValue.isZero()) {
        continue;
      }
      shownFields.add(field);
      shownValues.add(fieldValue);
    }

    append(typeNames.of(v.type()));
    if (shownFields.isEmpty()) {
      append("{}");
      return;
    }
    append('{');
    newline();
    depth++;
    for (int i = 0; i < shownFields.size(); i++) {
      indent();
      append(shownFields.get(i).name()).append(options.compact() ? ":" : ": ");
      dump(shownValues.get(i));
      endItem(i, shownFields.size());
    }
    depth--;
    indent();
    append('}');
  }

  private void dumpReference(Value v) {
    append(typeNames.of(v.type())).append('(');
    dump(v.target());
    append(')');
  }

  private void dumpFunctionValue(Object fn) {
    String name = FunctionNames.nameOf(fn);
    if (name != null) {
      append(typeNames.simplify(name));
    } else {
      append(FunctionNames.signatureOf(fn.getClass(), typeNames));
    }
  }

  private void dumpOpaque(Value v) {
    String text;
    try {
      text = String.valueOf(v.object());
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("toString() of %s failed", v.type().getName());
      append(typeNames.of(v.type()));
      return;
    }
    append(text);
  }

  /**
   * Writes the output of a custom formatter after the value's type name. Lines after the first are
   * indented to the current depth; trailing spaces and a final line break are dropped.
   */
  private void dumpCustom(Value v, CharSequence captured) {
    append(typeNames.of(v.type()));
    if (options.compact()) {
      append(captured);
      return;
    }
    BufferedReader lines = new BufferedReader(new StringReader(captured.toString()));
    try {
      String line = lines.readLine();
      boolean first = true;
      while (line != null) {
        if (!first) {
          indent();
        }
        first = false;
        append(CharMatcher.is(' ').trimTrailingFrom(line));
        line = lines.readLine();
        if (line != null) {
          newline();
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("cannot read back custom dump output", e);
    }
  }

  // Ends the i'th of n items of a sequence, mapping or record.
  private void endItem(int i, int n) {
    if (!options.compact() || i < n - 1) {
      append(',');
    }
    newline();
  }

  /**
   * Sorts items by the text of their keys, each key rendered once on its own. Ties keep their
   * iteration order.
   */
  private <T> ImmutableList<T> canonicalOrder(List<T> items, Function<T, Value> keyOf) {
    if (items.size() < 2) {
      return ImmutableList.copyOf(items);
    }
    List<Map.Entry<String, T>> keyed = new ArrayList<>(items.size());
    for (T item : items) {
      keyed.add(Maps.immutableEntry(textOf(keyOf.apply(item)), item));
    }
    keyed.sort(Map.Entry.<String, T>comparingByKey());
    return keyed.stream().map(Map.Entry::getValue).collect(toImmutableList());
  }

  /**
   * Returns the text a key sorts by: its rendering in a separate session, in which the objects
   * this session is inside of are written as {@code ^}. Texts of keys with an identity are
   * computed once per call.
   */
  private String textOf(Value key) {
    Identity id = Identity.of(key);
    if (id != null) {
      String text = keyTexts.get(id);
      if (text != null) {
        return text;
      }
    }
    ImmutableSet<Identity> boundary =
        ImmutableSet.<Identity>builder().addAll(enclosing).addAll(parents).build();
    StringBuilder buf = new StringBuilder();
    Renderer keyRenderer =
        new Renderer(
            buf,
            options,
            ReachabilityScanner.scan(Collections.singletonList(key.object()), boundary),
            boundary,
            keyTexts);
    keyRenderer.dump(key);
    keyRenderer.flushPendingLabels();
    String text = buf.toString();
    if (id != null) {
      keyTexts.put(id, text);
    }
    return text;
  }

  private void appendQuoted(String s, char quote) {
    append(quote);
    int len = s.length();
    for (int i = 0; i < len; i++) {
      escapeCharacter(s.charAt(i), quote);
    }
    append(quote);
  }

  private void backslashChar(char c) {
    append('\\').append(c);
  }

  private void escapeCharacter(char c, char quote) {
    if (c == quote) {
      backslashChar(c);
      return;
    }
    switch (c) {
      case '\\':
        backslashChar('\\');
        break;
      case '\r':
        backslashChar('r');
        break;
      case '\n':
        backslashChar('n');
        break;
      case '\t':
        backslashChar('t');
        break;
      default:
        if (c < 32 || c == 127) {
          append(String.format("\\x%02x", (int) c));
        } else {
          append(c);
        }
    }
  }
}
