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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Defaults;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimap;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.lang.ref.Reference;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.channels.Channel;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import javax.annotation.Nullable;

/**
 * A node of the object graph being dumped: a Java object (or {@code null}) together with its
 * {@link Category} and, where known, the type it was declared with.
 *
 * <p>{@link #of} is the single place where Java objects are classified; the accessors expose only
 * what the scanner and the renderer need for the value's category. Values never modify the
 * objects they wrap.
 */
public final class Value {

  // Types whose instances render as their type alone.
  private static final ImmutableList<Class<?>> HANDLE_TYPES =
      ImmutableList.of(
          Thread.class,
          InputStream.class,
          OutputStream.class,
          Reader.class,
          Writer.class,
          Channel.class,
          Executor.class,
          Future.class,
          Lock.class,
          Socket.class,
          ServerSocket.class,
          Process.class);

  @Nullable private final Object object;
  @Nullable private final Class<?> declaredType;
  private final Category category;

  private Value(@Nullable Object object, @Nullable Class<?> declaredType, Category category) {
    this.object = object;
    this.declaredType = declaredType;
    this.category = category;
  }

  /** Classifies {@code object}. */
  public static Value of(@Nullable Object object) {
    return of(object, null);
  }

  /**
   * Classifies {@code object}, which was found in a location (field, array slot) of type {@code
   * declaredType}.
   */
  public static Value of(@Nullable Object object, @Nullable Class<?> declaredType) {
    return new Value(object, declaredType, categorize(object));
  }

  private static Category categorize(@Nullable Object object) {
    if (object == null) {
      return Category.NIL;
    }
    if (object instanceof Optional
        || object instanceof OptionalInt
        || object instanceof OptionalLong
        || object instanceof OptionalDouble) {
      return Category.WRAPPER;
    }
    if (object instanceof Boolean
        || object instanceof Character
        || object instanceof Number
        || object instanceof String
        || object instanceof Complex
        || object instanceof Enum
        || object instanceof Class) {
      return Category.SCALAR;
    }
    Class<?> cls = object.getClass();
    if (cls.isArray() || object instanceof Collection) {
      return Category.SEQUENCE;
    }
    if (object instanceof Map || object instanceof Multimap) {
      return Category.MAPPING;
    }
    if (object instanceof AtomicReference || object instanceof Reference) {
      return Category.REFERENCE;
    }
    if (object instanceof Method || object instanceof Constructor || isLambda(cls)) {
      return Category.FUNCTION;
    }
    for (Class<?> handle : HANDLE_TYPES) {
      if (handle.isInstance(object)) {
        return Category.HANDLE;
      }
    }
    return RecordLayout.forClass(cls).isObservable() ? Category.RECORD : Category.OPAQUE;
  }

  /** Reports whether {@code cls} was spun up for a lambda expression or method reference. */
  public static boolean isLambda(Class<?> cls) {
    return cls.isSynthetic() && cls.getName().contains("$$Lambda");
  }

  public Category category() {
    return category;
  }

  public boolean isNil() {
    return category == Category.NIL;
  }

  /** The wrapped object, or {@code null} for {@link Category#NIL}. */
  @Nullable
  public Object object() {
    return object;
  }

  /**
   * The runtime class of the object; for nil values, the declared type if known, else {@code
   * Object}.
   */
  public Class<?> type() {
    if (object != null) {
      return object.getClass();
    }
    return declaredType != null ? declaredType : Object.class;
  }

  /** The type of the location the value was read from, if known. */
  @Nullable
  public Class<?> declaredType() {
    return declaredType;
  }

  /** The elements of a sequence, in iteration order. */
  public ImmutableList<Value> elements() {
    checkState(category == Category.SEQUENCE, "not a sequence: %s", this);
    ImmutableList.Builder<Value> elements = ImmutableList.builder();
    if (object.getClass().isArray()) {
      Class<?> componentType = object.getClass().getComponentType();
      int length = Array.getLength(object);
      for (int i = 0; i < length; i++) {
        elements.add(of(Array.get(object, i), componentType));
      }
    } else {
      for (Object element : (Collection<?>) object) {
        elements.add(of(element));
      }
    }
    return elements.build();
  }

  /** Reports whether this is a sequence or mapping without elements. */
  public boolean isEmpty() {
    switch (category) {
      case SEQUENCE:
        return object.getClass().isArray()
            ? Array.getLength(object) == 0
            : ((Collection<?>) object).isEmpty();
      case MAPPING:
        return object instanceof Multimap
            ? ((Multimap<?, ?>) object).isEmpty()
            : ((Map<?, ?>) object).isEmpty();
      default:
        return false;
    }
  }

  /** Reports whether this sequence is a {@link Set}, whose elements are rendered sorted. */
  public boolean isSet() {
    return object instanceof Set;
  }

  /** The entries of a mapping, in iteration order. Multimaps map each key to its collection. */
  public ImmutableList<Map.Entry<Value, Value>> entries() {
    checkState(category == Category.MAPPING, "not a mapping: %s", this);
    Map<?, ?> map =
        object instanceof Multimap ? ((Multimap<?, ?>) object).asMap() : (Map<?, ?>) object;
    ImmutableList.Builder<Map.Entry<Value, Value>> entries = ImmutableList.builder();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      entries.add(Maps.immutableEntry(of(entry.getKey()), of(entry.getValue())));
    }
    return entries.build();
  }

  /** The layout through which this record's fields are read. */
  public RecordLayout layout() {
    checkState(category == Category.RECORD, "not a record: %s", this);
    return RecordLayout.forClass(object.getClass());
  }

  /** The value of one field of this record. */
  public Value field(FieldDescriptor field) {
    checkState(category == Category.RECORD, "not a record: %s", this);
    return field.valueIn(object);
  }

  /** The value held by a reference or wrapper, possibly nil. */
  public Value target() {
    switch (category) {
      case REFERENCE:
        if (object instanceof AtomicReference) {
          return of(((AtomicReference<?>) object).get());
        }
        return of(((Reference<?>) object).get());
      case WRAPPER:
        if (object instanceof Optional) {
          return of(((Optional<?>) object).orElse(null));
        } else if (object instanceof OptionalInt) {
          OptionalInt opt = (OptionalInt) object;
          return of(opt.isPresent() ? opt.getAsInt() : null);
        } else if (object instanceof OptionalLong) {
          OptionalLong opt = (OptionalLong) object;
          return of(opt.isPresent() ? opt.getAsLong() : null);
        }
        OptionalDouble opt = (OptionalDouble) object;
        return of(opt.isPresent() ? opt.getAsDouble() : null);
      default:
        throw new IllegalStateException("no target: " + this);
    }
  }

  /** Strips any number of wrappers, returning the first non-wrapper value. */
  public Value unwrap() {
    Value v = this;
    while (v.category == Category.WRAPPER) {
      v = v.target();
    }
    return v;
  }

  /**
   * Reports whether this is the zero value of its declared type: nil, or the default value of a
   * primitive type.
   */
  public boolean isZero() {
    if (object == null) {
      return true;
    }
    return declaredType != null
        && declaredType.isPrimitive()
        && object.equals(Defaults.defaultValue(declaredType));
  }

  @Override
  public String toString() {
    return category + ":" + type().getName();
  }
}
