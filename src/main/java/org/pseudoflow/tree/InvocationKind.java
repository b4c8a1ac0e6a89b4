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

/**
 * What the type checker knows about how a callee uses the lambda literals passed to it.
 *
 * <p>Only {@link #IN_PLACE} calls let an unconditional non-local return inside a lambda argument
 * make the code after the call unreachable.
 */
public enum InvocationKind {
  /** Each lambda argument is invoked exactly once, before the call returns. */
  IN_PLACE,
  /** The lambda arguments may be invoked any number of times, at any time (or never). */
  UNKNOWN
}
