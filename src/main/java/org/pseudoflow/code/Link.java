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

package org.pseudoflow.code;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A Link is a directed control edge from an Instruction (the Link's {@link #origin}, which is
 * fixed) to its {@link #target}. While a graph is being built a Link's target may be a {@link
 * Label} or the builder's {@link Future}, which serve as placeholders until the target instruction
 * has been emitted.
 *
 * <p>Each instruction has a small, fixed number of outlinks (0, 1, or 2), but may have an
 * unbounded number of inlinks. The LinkTarget has an {@link LinkTarget#inLink} field pointing to
 * the most recently added of its inlinks; in order to find the others, all Links with the same
 * target are connected in a circular list via their {@link #sibling} field, ordered by {@link
 * #seq}.
 */
public final class Link {
  public enum Kind {
    NORMAL,
    /** Followed when a branch's test succeeds. */
    TRUE,
    /** Followed when a branch's test fails. */
    FALSE,
    /** Never followed; every DEAD link targets its graph's sink. */
    DEAD
  }

  /** Links are created and owned by their origin instructions. */
  public final Instruction origin;

  public final Kind kind;

  /** Links are numbered in creation order within a graph; inlinks are always listed by seq. */
  public final int seq;

  private LinkTarget target;

  /**
   * All Links with the same non-null target are connected in a circular list by their {@code
   * sibling} fields.
   */
  Link sibling;

  /** If this link flows into a merge, the value it contributes. */
  @Nullable Value value;

  Link(Instruction origin, Kind kind, int seq) {
    this.origin = origin;
    this.kind = kind;
    this.seq = seq;
    this.sibling = this;
  }

  public LinkTarget target() {
    return target;
  }

  /** The target of this Link, which must be an Instruction. */
  public Instruction targetInstruction() {
    return (Instruction) target;
  }

  public @Nullable Value value() {
    return value;
  }

  public boolean isDead() {
    return kind == Kind.DEAD;
  }

  /** Sets the target of this Link; should only be called once. */
  void setTarget(LinkTarget target) {
    Preconditions.checkArgument(this.target == null && target != null);
    this.target = target;
    append(target, this);
  }

  /**
   * Changes the target of this Link and all of its siblings; the previous target will no longer
   * have any inlinks.
   */
  void moveWithAllSiblings(LinkTarget newTarget) {
    assert newTarget != null && newTarget != target;
    LinkTarget prev = target;
    prev.forEachInLink(x -> x.target = newTarget);
    Link last = prev.inLink;
    prev.inLink = null;
    append(newTarget, last);
  }

  /**
   * Splices the circular list ending with {@code last} into {@code target}'s inlinks. The lists are
   * merged by seq, so that inlinks stay in creation order however they were collected.
   */
  private static void append(LinkTarget target, Link last) {
    Link existing = target.inLink;
    if (existing == null) {
      target.inLink = last;
      return;
    }
    // Break both circles, merge the two ascending chains, and close the result again.
    Link a = existing.sibling;
    existing.sibling = null;
    Link b = last.sibling;
    last.sibling = null;
    Link head = null;
    Link tail = null;
    while (a != null || b != null) {
      Link next;
      if (b == null || (a != null && a.seq < b.seq)) {
        next = a;
        a = a.sibling;
      } else {
        next = b;
        b = b.sibling;
      }
      if (tail == null) {
        head = next;
      } else {
        tail.sibling = next;
      }
      tail = next;
    }
    tail.sibling = head;
    target.inLink = tail;
  }

  @Override
  public String toString() {
    String dest = (target instanceof Instruction inst) ? inst.ref() : String.valueOf(target);
    return origin.ref() + " → " + dest + (kind == Kind.NORMAL ? "" : " (" + kind + ")");
  }
}
