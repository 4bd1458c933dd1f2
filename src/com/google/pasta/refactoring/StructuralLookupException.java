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

package com.google.pasta.refactoring;

/**
 * Thrown when an edit helper cannot find a node in any statement list of the parent the scope
 * analysis recorded for it, for example because the tree changed after it was analyzed.
 */
public final class StructuralLookupException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public StructuralLookupException(String message) {
    super(message);
  }
}
