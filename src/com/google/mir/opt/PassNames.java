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

package com.google.mir.opt;

/** Names of the passes, as they appear in logs. */
public final class PassNames {
  public static final String SCALAR_REPLACEMENT_OF_AGGREGATES = "scalarReplacementOfAggregates";
  public static final String VALIDATE_MIR = "validateMir";

  private PassNames() {}
}
