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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An opaque handle for a callable reference such as {@code ::foo}. The identifying metadata
 * ({@link #owner}, {@link #name}, {@link #signature}) is supplied at construction and never
 * requires resolution; everything else is delegated to a {@link CallableDescriptor} that is
 * computed by {@link #computeResolution} the first time it is needed and then cached for the
 * lifetime of the handle.
 *
 * <p>If resolution fails every reflective accessor throws {@link
 * ReflectionUnavailableException}. Exceptions thrown by the descriptor itself (e.g. by the invoked
 * function) propagate unchanged.
 */
public abstract class CallableReference {

  /**
   * The result of resolving a CallableReference. There are two subclasses ({@link Unresolved} and
   * {@link Resolved}), and that's it.
   */
  public abstract static class Resolution {
    private Resolution() {}

    public static Resolution unresolved(String reason) {
      return new Unresolved(reason);
    }

    public static Resolution resolved(CallableDescriptor descriptor) {
      return new Resolved(descriptor);
    }

    public abstract boolean isResolved();
  }

  public static final class Unresolved extends Resolution {
    public final String reason;

    private Unresolved(String reason) {
      this.reason = Preconditions.checkNotNull(reason);
    }

    @Override
    public boolean isResolved() {
      return false;
    }

    @Override
    public String toString() {
      return "unresolved(" + reason + ")";
    }
  }

  public static final class Resolved extends Resolution {
    public final CallableDescriptor descriptor;

    private Resolved(CallableDescriptor descriptor) {
      this.descriptor = Preconditions.checkNotNull(descriptor);
    }

    @Override
    public boolean isResolved() {
      return true;
    }

    @Override
    public String toString() {
      return "resolved";
    }
  }

  private final String owner;
  private final String name;
  private final String signature;

  @GuardedBy("this")
  private @Nullable Resolution resolution;

  protected CallableReference(String owner, String name, String signature) {
    this.owner = owner;
    this.name = name;
    this.signature = signature;
  }

  /** The class or package that declares the callable. */
  public String owner() {
    return owner;
  }

  public String name() {
    return name;
  }

  /** A JVM-style signature that disambiguates overloads, e.g. {@code "foo(I)V"}. */
  public String signature() {
    return signature;
  }

  /**
   * Resolves this reference; called at most once per instance. Implementations should return
   * {@link Resolution#unresolved} rather than throw if no reflective backend is available.
   */
  protected abstract Resolution computeResolution();

  /** Returns the (cached) resolution of this reference, computing it if necessary. */
  public final synchronized Resolution resolution() {
    if (resolution == null) {
      resolution = Preconditions.checkNotNull(computeResolution());
    }
    return resolution;
  }

  private CallableDescriptor descriptor() {
    Resolution r = resolution();
    if (r instanceof Resolved resolved) {
      return resolved.descriptor;
    }
    throw new ReflectionUnavailableException(toString(), ((Unresolved) r).reason);
  }

  public ImmutableList<String> parameters() {
    return descriptor().parameters();
  }

  public String returnType() {
    return descriptor().returnType();
  }

  public ImmutableList<String> annotations() {
    return descriptor().annotations();
  }

  public ImmutableList<String> typeParameters() {
    return descriptor().typeParameters();
  }

  public @Nullable Object call(Object... args) {
    return descriptor().call(args);
  }

  public @Nullable Object callBy(Map<String, Object> args) {
    return descriptor().callBy(args);
  }

  public CallableDescriptor.Visibility visibility() {
    return descriptor().visibility();
  }

  public boolean isFinal() {
    return descriptor().isFinal();
  }

  public boolean isOpen() {
    return descriptor().isOpen();
  }

  public boolean isAbstract() {
    return descriptor().isAbstract();
  }

  @Override
  public String toString() {
    return owner + "::" + name + " " + signature;
  }
}
