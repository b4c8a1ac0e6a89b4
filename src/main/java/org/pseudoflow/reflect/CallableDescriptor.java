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

import com.google.common.collect.ImmutableList;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Full reflective information about a function or property accessor. */
public interface CallableDescriptor {

  enum Visibility {
    PUBLIC,
    PROTECTED,
    INTERNAL,
    PRIVATE
  }

  /** The parameter names, in declaration order. */
  ImmutableList<String> parameters();

  String returnType();

  ImmutableList<String> annotations();

  ImmutableList<String> typeParameters();

  /** Invokes the callable with positional arguments. */
  @Nullable Object call(Object... args);

  /** Invokes the callable with arguments given by parameter name. */
  @Nullable Object callBy(Map<String, Object> args);

  Visibility visibility();

  boolean isFinal();

  boolean isOpen();

  boolean isAbstract();
}
