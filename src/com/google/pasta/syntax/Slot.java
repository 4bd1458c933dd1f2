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
 * Named places in a node's source where whitespace, punctuation or literal spelling is captured.
 * Each {@link Kind} declares the slots its traversal fills.
 */
public enum Slot {
  /** Everything before the node: indentation and comments, or parentheses for expressions. */
  PREFIX,
  /** Everything after the node: the end of line for statements, closing parens for expressions. */
  SUFFIX,
  /** The exact spelling of a literal, identifier or multi-token operator. */
  CONTENT,
  /** The colon and end of line that open the first block of a compound statement. */
  HEADER,
  ELSE_PREFIX,
  ELSE,
  FINALLY_PREFIX,
  FINALLY,
  /** The declared name, and for functions the opening parenthesis of the parameters. */
  NAME,
  NAMES,
  MODULE,
  IMPORT,
  AS,
  OPEN,
  CLOSE,
  /** An optional trailing comma. */
  TRAILING,
  ARROW,
  STAR,
  /** The {@code **} of a dictionary unpacking; one entry per dictionary item. */
  DOUBLE_STAR(true),
  EQUALS,
  COLON,
  ATTR,
  FROM,
  STEP_COLON;

  private final boolean indexed;

  Slot() {
    this(false);
  }

  Slot(boolean indexed) {
    this.indexed = indexed;
  }

  /** Whether the slot is captured once per element of a list instead of once per node. */
  public boolean isIndexed() {
    return indexed;
  }
}
