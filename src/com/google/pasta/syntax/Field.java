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
 * Child slots of a {@link Node}. Which fields a node has, and whether each holds one node, an
 * optional node or a list, is declared by its {@link Kind}.
 *
 * <p>As a {@link Dependency} a field stands for the number of children it currently holds.
 */
public enum Field implements Dependency {
  BODY,
  ORELSE,
  FINALBODY,
  HANDLERS,
  TEST,
  TARGET,
  TARGETS,
  VALUE,
  VALUES,
  ITER,
  LEFT,
  RIGHT,
  OPERAND,
  OPS,
  COMPARATORS,
  ELT,
  ELTS,
  KEY,
  KEYS,
  GENERATORS,
  IFS,
  FUNC,
  ARGS,
  KEYWORDS,
  DEFAULTS,
  KW_DEFAULTS,
  KWONLYARGS,
  VARARG,
  KWARG,
  ANNOTATION,
  RETURNS,
  DECORATOR_LIST,
  BASES,
  NAMES,
  TYPE,
  CONTEXT_EXPR,
  OPTIONAL_VARS,
  LOWER,
  UPPER,
  STEP,
  SLICE,
  MSG,
  EXC,
  CAUSE;

  @Override
  public Integer valueOf(Node node) {
    return node.childCount(this);
  }
}
