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

import com.google.common.base.Joiner;
import com.google.common.flogger.GoogleLogger;
import java.io.Serializable;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Recovers human-readable names for function values. */
final class FunctionNames {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private FunctionNames() {}

  /**
   * Returns {@code DeclaringType::method} for {@code fn}, or null if it is anonymous or its origin
   * cannot be recovered. Only reflective methods and constructors, and serializable method
   * references, carry their origin.
   */
  @Nullable
  static String nameOf(Object fn) {
    if (fn instanceof Method) {
      Method method = (Method) fn;
      return TypeNames.qualifiedName(method.getDeclaringClass()) + "::" + method.getName();
    }
    if (fn instanceof Constructor) {
      return TypeNames.qualifiedName(((Constructor<?>) fn).getDeclaringClass()) + "::new";
    }
    SerializedLambda lambda = serializedForm(fn);
    if (lambda == null || lambda.getImplMethodName().startsWith("lambda$")) {
      return null;
    }
    String method = lambda.getImplMethodName();
    return lambda.getImplClass().replace('/', '.').replace('$', '.')
        + "::"
        + (method.equals("<init>") ? "new" : method);
  }

  /** Returns the qualified names of the functional interfaces implemented by {@code cls}. */
  private static List<String> interfacesOf(Class<?> cls) {
    List<String> names = new ArrayList<>();
    for (Class<?> iface : cls.getInterfaces()) {
      if (iface != Serializable.class) {
        names.add(TypeNames.qualifiedName(iface));
      }
    }
    return names;
  }

  /** Returns the type of an anonymous function, e.g. {@code java.util.function.Supplier}. */
  static String signatureOf(Class<?> cls, TypeNames typeNames) {
    List<String> interfaces = interfacesOf(cls);
    if (interfaces.isEmpty()) {
      return typeNames.of(cls);
    }
    List<String> simplified = new ArrayList<>();
    for (String name : interfaces) {
      simplified.add(typeNames.simplify(name));
    }
    return Joiner.on(" & ").join(simplified);
  }

  // Serializable lambdas answer writeReplace() with a description of their implementation method.
  @Nullable
  private static SerializedLambda serializedForm(Object fn) {
    if (!(fn instanceof Serializable)) {
      return null;
    }
    try {
      Method writeReplace = fn.getClass().getDeclaredMethod("writeReplace");
      if (!writeReplace.trySetAccessible()) {
        return null;
      }
      Object replacement = writeReplace.invoke(fn);
      return replacement instanceof SerializedLambda ? (SerializedLambda) replacement : null;
    } catch (ReflectiveOperationException e) {
      logger.atFine().withCause(e).log("No serialized form for %s", fn.getClass().getName());
      return null;
    }
  }
}
