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
package com.google.devtools.valuedump.model;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The ordered list of instance fields through which values of a class are rendered as records.
 *
 * <p>Fields of superclasses come first, then those of subclasses, each class contributing its
 * fields in declaration order (record components in component order). Static and
 * compiler-synthetic fields are never included. Fields declared in packages that are not open to
 * this library cannot be read; they are left out of the layout, and a class whose own fields are
 * all of that kind is not {@linkplain #isObservable() observable} at all.
 *
 * <p>Layouts are computed once per class and shared by all threads.
 */
public final class RecordLayout {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final ConcurrentHashMap<Class<?>, RecordLayout> cache = new ConcurrentHashMap<>();

  private final Class<?> type;
  private final boolean observable;
  private final ImmutableList<FieldDescriptor> fields;

  private RecordLayout(Class<?> type, boolean observable, ImmutableList<FieldDescriptor> fields) {
    this.type = type;
    this.observable = observable;
    this.fields = fields;
  }

  /** Returns the layout of {@code cls}, computing it on first use. */
  public static RecordLayout forClass(Class<?> cls) {
    // Concurrent calls may compute the same layout twice; the first one stored wins.
    RecordLayout layout = cache.get(cls);
    if (layout == null) {
      layout = build(cls);
      RecordLayout prev = cache.putIfAbsent(cls, layout);
      if (prev != null) {
        layout = prev;
      }
    }
    return layout;
  }

  /** The class this layout describes. */
  public Class<?> type() {
    return type;
  }

  /**
   * Reports whether instances of the class can be inspected field by field. Classes of
   * encapsulated modules (most of the JDK) that declare instance fields are not observable.
   */
  public boolean isObservable() {
    return observable;
  }

  /** The readable fields, in rendering order. Empty if the layout is not observable. */
  public ImmutableList<FieldDescriptor> fields() {
    return fields;
  }

  private static RecordLayout build(Class<?> cls) {
    if (!isOpen(cls) && hasInstanceFields(cls)) {
      logger.atFine().log("%s is not open for reflection; rendering it opaquely", cls.getName());
      return new RecordLayout(cls, false, ImmutableList.of());
    }

    Deque<Class<?>> chain = new ArrayDeque<>();
    for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
      chain.addFirst(c);
    }

    Map<String, Class<?>> accessors = publicAccessors(cls);
    ImmutableList.Builder<FieldDescriptor> fields = ImmutableList.builder();
    for (Class<?> c : chain) {
      if (!isOpen(c)) {
        if (hasInstanceFields(c)) {
          logger.atFine().log("Skipping unobservable fields of %s in %s", c.getName(), cls);
        }
        continue;
      }
      if (c.isRecord()) {
        for (RecordComponent component : c.getRecordComponents()) {
          Field field = componentField(c, component);
          if (grantAccess(field)) {
            fields.add(FieldDescriptor.create(field, /* exported= */ true));
          }
        }
        continue;
      }
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        if (grantAccess(field)) {
          fields.add(FieldDescriptor.create(field, isExported(field, accessors)));
        }
      }
    }
    return new RecordLayout(cls, true, fields.build());
  }

  private static Field componentField(Class<?> recordClass, RecordComponent component) {
    try {
      return recordClass.getDeclaredField(component.getName());
    } catch (NoSuchFieldException e) {
      throw new IllegalStateException(
          "record " + recordClass.getName() + " has no field for component " + component, e);
    }
  }

  private static boolean grantAccess(Field field) {
    if (field.trySetAccessible()) {
      return true;
    }
    logger.atFine().log("Cannot read %s; leaving it out", field);
    return false;
  }

  // Public no-argument methods of cls, by name, with their return types.
  private static Map<String, Class<?>> publicAccessors(Class<?> cls) {
    Map<String, Class<?>> accessors = new HashMap<>();
    for (Method method : cls.getMethods()) {
      if (method.getParameterCount() == 0 && !Modifier.isStatic(method.getModifiers())) {
        accessors.put(method.getName(), method.getReturnType());
      }
    }
    return accessors;
  }

  private static boolean isExported(Field field, Map<String, Class<?>> accessors) {
    if (Modifier.isPublic(field.getModifiers())) {
      return true;
    }
    String name = field.getName();
    String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
    Class<?> type = field.getType();
    return type.equals(accessors.get(name))
        || type.equals(accessors.get("get" + capitalized))
        || (type == boolean.class && type.equals(accessors.get("is" + capitalized)));
  }

  private static boolean isOpen(Class<?> cls) {
    return cls.getModule().isOpen(cls.getPackageName(), RecordLayout.class.getModule());
  }

  private static boolean hasInstanceFields(Class<?> cls) {
    for (Field field : cls.getDeclaredFields()) {
      if (!Modifier.isStatic(field.getModifiers())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return type.getName() + fields;
  }
}
