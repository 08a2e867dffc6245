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

/** Unary operators. */
public enum UnOp {
  NOT("Not"),
  NEG("Neg");

  private final String mirName;

  UnOp(String mirName) {
    this.mirName = mirName;
  }

  public String getMirName() {
    return mirName;
  }

  public static @Nullable UnOp fromMirName(String name) {
    for (UnOp op : values()) {
      if (op.mirName.equals(name)) {
        return op;
      }
    }
    return null;
  }
}
