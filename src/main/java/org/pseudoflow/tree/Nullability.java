/*
 * Copyright 2025 The Pseudoflow Authors
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

package org.pseudoflow.tree;

/** What the type checker was able to prove about whether an expression's value may be null. */
public enum Nullability {
  /** The value is never null. */
  NON_NULL,
  /** The value is always null (e.g. the {@code null} literal). */
  NULL,
  /** Nothing is known. */
  UNKNOWN
}
