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

/** An entry of a body's local table. */
@AutoValue
@Immutable
public abstract class LocalDecl {

  public abstract Mutability getMutability();

  public abstract Type getType();

  public abstract SourceInfo getSourceInfo();

  public static LocalDecl create(Mutability mutability, Type type, SourceInfo sourceInfo) {
    return new AutoValue_LocalDecl(mutability, type, sourceInfo);
  }

  public static LocalDecl create(Mutability mutability, Type type) {
    return create(mutability, type, SourceInfo.unknown());
  }

  /** Returns a declaration of {@code newType} that keeps this one's mutability and span. */
  public final LocalDecl withType(Type newType) {
    return create(getMutability(), newType, getSourceInfo());
  }
}
