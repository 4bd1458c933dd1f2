/*
 * Copyright 2026 The Pasta Authors.
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

package com.google.pasta.syntax;

/**
 * Disambiguation outcomes for statements whose tree shape has two spellings. The outcome is
 * recorded on the inner statement when the source joins it to its parent instead of nesting it.
 */
public enum JoinedForm {
  /** An IF that is the only ORELSE statement of another IF, spelled {@code elif}. */
  ELIF(Kind.IF),
  /** A WITH that is the only body statement of another WITH, spelled {@code with a, b:}. */
  CONTINUED_WITH(Kind.WITH),
  /** A TRY_EXCEPT that is the only body statement of a TRY_FINALLY, sharing its {@code try:}. */
  JOINED_TRY(Kind.TRY_EXCEPT);

  private final Kind kind;

  JoinedForm(Kind kind) {
    this.kind = kind;
  }

  /** The kind of the inner statement this outcome applies to. */
  public Kind getKind() {
    return kind;
  }
}
