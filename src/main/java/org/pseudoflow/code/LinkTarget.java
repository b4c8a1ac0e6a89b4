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

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;

/** The target of a Link. LinkTarget has three subclasses: Instruction, Label, and Future. */
public abstract class LinkTarget {
  /**
   * Null if this is not the target of any Links. Otherwise {@code inLink} is the Link with the
   * highest seq that has {@code this} as its target; its sibling is the one with the lowest seq.
   */
  Link inLink;

  /** Returns true if this target has at least one inlink. */
  public boolean hasInLink() {
    return inLink != null;
  }

  /**
   * Changes all inlinks to this target to point to the given target; on return {@link #hasInLink}
   * will be false.
   */
  void moveAllInLinks(LinkTarget other) {
    assert other != null;
    if (other != this && inLink != null) {
      inLink.moveWithAllSiblings(other);
      assert inLink == null;
    }
  }

  /**
   * Calls {@code consumer.accept()} with each of this target's inlinks, in creation order.
   *
   * <p>The consumer may change the given link's {@code target} field, but must not make any other
   * changes to this target's links.
   */
  public void forEachInLink(Consumer<Link> consumer) {
    if (inLink == null) {
      return;
    }
    Link last = inLink;
    Link link = last.sibling;
    while (true) {
      // Find the next link before accepting this one
      Link next = link.sibling;
      consumer.accept(link);
      if (link == last) {
        break;
      }
      link = next;
    }
  }

  /** Returns this target's inlinks, in creation order. */
  public ImmutableList<Link> inlinks() {
    ImmutableList.Builder<Link> result = ImmutableList.builder();
    forEachInLink(result::add);
    return result.build();
  }

  /** Returns the number of inlinks. */
  public int inlinkCount() {
    int[] count = new int[1];
    forEachInLink(x -> count[0]++);
    return count[0];
  }
}
