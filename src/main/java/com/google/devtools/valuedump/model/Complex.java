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

/**
 * A complex number. Java has no built-in complex type; values of this class are rendered as
 * scalars in the form {@code (re+imi)}.
 */
@AutoValue
public abstract class Complex {

  public abstract double real();

  public abstract double imaginary();

  public static Complex of(double real, double imaginary) {
    return new AutoValue_Complex(real, imaginary);
  }

  @Override
  public final String toString() {
    double im = imaginary();
    // Negative parts, including -0.0, print their own sign.
    String sign = im < 0 || (im == 0 && 1 / im < 0) ? "" : "+";
    return "(" + real() + sign + im + "i)";
  }
}
