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

/** Maps a source-level variable name to where its value lives. */
@AutoValue
@Immutable
public abstract class VarDebugInfo {

  public abstract String getName();

  public abstract SourceInfo getSourceInfo();

  public abstract VarDebugInfoContents getContents();

  public static VarDebugInfo create(
      String name, SourceInfo sourceInfo, VarDebugInfoContents contents) {
    return new AutoValue_VarDebugInfo(name, sourceInfo, contents);
  }

  public static VarDebugInfo create(String name, VarDebugInfoContents contents) {
    return create(name, SourceInfo.unknown(), contents);
  }

  public final VarDebugInfo withContents(VarDebugInfoContents newContents) {
    return newContents.equals(getContents())
        ? this
        : create(getName(), getSourceInfo(), newContents);
  }
}
