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

import org.jspecify.annotations.Nullable;

/** Semantic payloads carried by a {@link Node}, as declared by its {@link Kind}. */
public enum Prop implements Dependency {
  /** Identifier of a NAME. */
  ID,
  /** Decoded literal value: String, BigInteger, Double or Boolean (absent for None). */
  VALUE,
  /** True for imaginary number literals. */
  IMAGINARY,
  /** True for {@code bytes} string literals. */
  BYTES,
  /** True for f-strings, whose VALUE is the body as written. */
  FORMATTED,
  /** Declared name of a function, class, import alias or exception handler. */
  NAME,
  ASNAME,
  /** Dotted module path of a {@code from} import; absent for {@code from . import x}. */
  MODULE,
  /** Number of leading dots of a relative {@code from} import. */
  LEVEL,
  ATTR,
  /** Parameter name of an ARG, keyword name of a KEYWORD (absent for {@code **kwargs}). */
  ARG,
  /** An {@link Operator}. */
  OP,
  /** A {@link Context}. */
  CONTEXT,
  /** Identifiers of a {@code global} or {@code nonlocal} statement, as a list of strings. */
  NAMES;

  @Override
  public @Nullable Object valueOf(Node node) {
    return node.getProp(this);
  }
}
