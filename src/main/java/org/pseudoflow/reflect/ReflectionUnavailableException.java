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

package org.pseudoflow.reflect;

/**
 * Thrown by the reflective accessors of a {@link CallableReference} whose descriptor could not be
 * resolved.
 */
public class ReflectionUnavailableException extends RuntimeException {
  public final String callable;

  public ReflectionUnavailableException(String callable, String reason) {
    super(String.format("Reflection backend unavailable for %s: %s", callable, reason));
    this.callable = callable;
  }
}
