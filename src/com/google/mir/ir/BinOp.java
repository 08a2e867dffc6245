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

import org.jspecify.annotations.Nullable;

/** Binary operators, named as they are printed. */
public enum BinOp {
  ADD("Add"),
  SUB("Sub"),
  MUL("Mul"),
  DIV("Div"),
  REM("Rem"),
  BIT_XOR("BitXor"),
  BIT_AND("BitAnd"),
  BIT_OR("BitOr"),
  SHL("Shl"),
  SHR("Shr"),
  EQ("Eq"),
  LT("Lt"),
  LE("Le"),
  NE("Ne"),
  GE("Ge"),
  GT("Gt"),
  OFFSET("Offset");

  private final String mirName;

  BinOp(String mirName) {
    this.mirName = mirName;
  }

  public String getMirName() {
    return mirName;
  }

  public static @Nullable BinOp fromMirName(String name) {
    for (BinOp op : values()) {
      if (op.mirName.equals(name)) {
        return op;
      }
    }
    return null;
  }
}
