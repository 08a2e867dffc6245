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

/** Thrown when textual MIR cannot be parsed. */
@SuppressWarnings("serial")
public class MirSyntaxException extends RuntimeException {
  private final String sourceName;
  private final int lineNumber;
  private final int columnNumber;

  public MirSyntaxException(String details, String sourceName, int lineNumber, int columnNumber) {
    super(details);
    this.sourceName = sourceName;
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  @Override
  public final String getMessage() {
    String details = details();
    if (lineNumber <= 0) {
      return details;
    }
    return details + " (" + sourceName + "#" + lineNumber + ":" + columnNumber + ")";
  }

  /** The message without the source position. */
  public String details() {
    return super.getMessage();
  }

  public final String sourceName() {
    return sourceName;
  }

  public final int lineNumber() {
    return lineNumber;
  }

  public final int columnNumber() {
    return columnNumber;
  }
}
