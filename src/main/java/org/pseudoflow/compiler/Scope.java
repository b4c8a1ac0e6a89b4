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

package org.pseudoflow.compiler;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pseudoflow.code.Graph;

/**
 * Maps the names declared in a block to their Entries. Lookups that fail continue with the
 * enclosing scope, which for the outermost block of a lambda or local function is the scope in
 * which it was declared.
 */
final class Scope {

  static final class Entry {
    final String name;
    final boolean mutable;

    /**
     * If the variable is known to hold a lambda literal, or the name is a local function, the
     * corresponding Graph.
     */
    @Nullable Graph callable;

    Entry(String name, boolean mutable, @Nullable Graph callable) {
      this.name = name;
      this.mutable = mutable;
      this.callable = callable;
    }
  }

  /** Maps each name declared in this scope to the corresponding Entry. */
  private final Map<String, Entry> entries = new HashMap<>();

  private final @Nullable Scope outer;

  Scope(@Nullable Scope outer) {
    this.outer = outer;
  }

  /** Returns a new Scope for a block nested in this one. */
  Scope nested() {
    return new Scope(this);
  }

  /** Adds an entry, hiding any entry for the same name in an enclosing scope. */
  @CanIgnoreReturnValue
  Entry declare(String name, boolean mutable, @Nullable Graph callable) {
    Entry entry = new Entry(name, mutable, callable);
    entries.put(name, entry);
    return entry;
  }

  /** Returns the innermost Entry for the given name, or null if there is none. */
  @Nullable Entry lookup(String name) {
    for (Scope scope = this; scope != null; scope = scope.outer) {
      Entry entry = scope.entries.get(name);
      if (entry != null) {
        return entry;
      }
    }
    return null;
  }
}
