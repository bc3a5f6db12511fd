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

import com.google.auto.value.AutoValue;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import javax.annotation.Nullable;

/** Describes one field of a {@link RecordLayout}. */
@AutoValue
public abstract class FieldDescriptor {

  /** The field's simple name, as declared. */
  public abstract String name();

  /** The class that declares the field, which may be a superclass of the record's class. */
  public abstract Class<?> declaringClass();

  /** The declared (erased) type of the field. */
  public abstract Class<?> type();

  /**
   * Whether the field is part of the public surface of its class: a {@code public} field, a record
   * component, or a field exposed through a public accessor.
   */
  public abstract boolean exported();

  abstract Field field();

  static FieldDescriptor create(Field field, boolean exported) {
    return new AutoValue_FieldDescriptor(
        field.getName(), field.getDeclaringClass(), field.getType(), exported, field);
  }

  /** The declared type of the field, including type arguments. */
  public Type genericType() {
    return field().getGenericType();
  }

  /**
   * Returns the value of this field in {@code record}.
   *
   * @throws IllegalStateException if the field is unreadable although access was granted when the
   *     layout was built
   */
  @Nullable
  public Object read(Object record) {
    try {
      return field().get(record);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("field " + this + " became unreadable", e);
    }
  }

  /** Returns the field's value in {@code record} as a {@link Value} carrying the declared type. */
  public Value valueIn(Object record) {
    return Value.of(read(record), type());
  }

  @Override
  public final String toString() {
    return declaringClass().getName() + "." + name();
  }
}
