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

/** The source span and lexical scope an IR element originates from. */
@AutoValue
@Immutable
public abstract class SourceInfo {

  private static final SourceInfo UNKNOWN = create(0, 0, 0);

  /** 1-based line, or zero if unknown. */
  public abstract int lineno();

  /** 0-based column. */
  public abstract int charno();

  public abstract int scope();

  public static SourceInfo create(int lineno, int charno, int scope) {
    return new AutoValue_SourceInfo(lineno, charno, scope);
  }

  public static SourceInfo at(int lineno, int charno) {
    return create(lineno, charno, 0);
  }

  public static SourceInfo unknown() {
    return UNKNOWN;
  }

  @Override
  public final String toString() {
    return "scope " + scope() + " at " + lineno() + ":" + charno();
  }
}
