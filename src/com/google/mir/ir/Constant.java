/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.mir.ir;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import java.util.regex.Pattern;

/**
 * A literal constant. The literal is kept as written; it has no addressable place, so a
 * constant of aggregate type cannot be projected without first storing it in a local.
 */
@AutoValue
@Immutable
public abstract class Constant {

  private static final Pattern SUFFIXED_NUMBER =
      Pattern.compile("-?[0-9]+(\\.[0-9]+)?_[a-z][a-z0-9]*");

  public abstract String getLiteral();

  public abstract Type getType();

  public static Constant create(String literal, Type type) {
    return new AutoValue_Constant(literal, type);
  }

  public static Constant integer(long value, String scalarName) {
    return create(value + "_" + scalarName, Type.scalar(scalarName));
  }

  public static Constant bool(boolean value) {
    return create(String.valueOf(value), Type.scalar("bool"));
  }

  public static Constant unit() {
    return create("()", Type.unit());
  }

  /** Whether the literal spells out its own type, as {@code 5_i32} or {@code true} do. */
  public final boolean isSelfTyped() {
    String literal = getLiteral();
    if (getType().isUnit()) {
      return literal.equals("()");
    }
    if (getType().isScalar() && getType().getName().equals("bool")) {
      return literal.equals("true") || literal.equals("false");
    }
    return getType().isScalar()
        && SUFFIXED_NUMBER.matcher(literal).matches()
        && literal.endsWith("_" + getType().getName());
  }

  @Override
  public final String toString() {
    return isSelfTyped() ? getLiteral() : getLiteral() + ": " + getType();
  }
}
