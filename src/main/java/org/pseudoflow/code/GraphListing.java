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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A deterministic textual form of a Graph, e.g.
 *
 * <pre>
 * == f ==
 * L0:
 *    1 n0   &lt;START&gt;
 *    2 n1   mark(val y = x ?: 1)
 *        ...
 * L1:
 *        n9   &lt;END&gt;                 NEXT:[n11]  PREV:[n4, n8]
 * error:
 *        n10  &lt;ERROR&gt;               PREV:[]
 * sink:
 *        n11  &lt;SINK&gt;                PREV:[n10, n9, n6]
 * =====================
 * </pre>
 *
 * <p>Each instruction line has the source line (omitted if unchanged from the previous
 * instruction), the instruction's ref, and its text. {@code NEXT} is omitted when the instruction
 * has a single NORMAL link to the following instruction (or is SINK); {@code PREV} is omitted when
 * the instruction is START with no inlinks or its only inlink comes from the previous instruction.
 * Link kinds are not printed, since they follow from the instruction: links to SINK from anything
 * other than END and ERROR are DEAD, the links of {@code jt} are (FALSE, TRUE), the links of {@code
 * jf} are (TRUE, FALSE), and all others are NORMAL.
 *
 * <p>{@link #parse} recovers an equal GraphListing from its {@link #toString}.
 */
public final class GraphListing {

  /** An outlink, identified by its target's ref. */
  public record Edge(String ref, Link.Kind kind) {
    @Override
    public String toString() {
      return ref;
    }
  }

  /** One instruction, with its label headings (without the trailing colon) and links. */
  public record Entry(
      int line,
      ImmutableList<String> labels,
      String ref,
      String text,
      ImmutableList<Edge> next,
      ImmutableList<String> prev) {}

  private static final String FOOTER = "=====================";

  private static final Pattern HEADER_PATTERN = Pattern.compile("== (.+) ==");
  private static final Pattern FOOTER_PATTERN = Pattern.compile("=+");
  private static final Pattern LABEL_PATTERN =
      Pattern.compile("(L\\d+(?: \\[.*\\])?|error|sink):");
  private static final Pattern ENTRY_PATTERN =
      Pattern.compile(
          " *(\\d+)? +(n\\d+) +(.*?)(?: +NEXT:\\[([^\\]]*)\\])?(?: +PREV:\\[([^\\]]*)\\])? *");

  private static final Splitter REFS = Splitter.on(',').trimResults().omitEmptyStrings();

  public final String name;
  public final ImmutableList<Entry> entries;

  public GraphListing(String name, List<Entry> entries) {
    this.name = name;
    this.entries = ImmutableList.copyOf(entries);
  }

  public static GraphListing of(Graph graph) {
    ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    for (Instruction inst : graph.instructions) {
      entries.add(
          new Entry(
              inst.line,
              inst.labels.stream()
                  .map(label -> label.heading().substring(0, label.heading().length() - 1))
                  .collect(ImmutableList.toImmutableList()),
              inst.ref(),
              inst.toString(),
              inst.outlinks.stream()
                  .map(link -> new Edge(link.targetInstruction().ref(), link.kind))
                  .collect(ImmutableList.toImmutableList()),
              inst.inlinks().stream()
                  .map(link -> link.origin.ref())
                  .collect(ImmutableList.toImmutableList())));
    }
    return new GraphListing(graph.name, entries.build());
  }

  /** Returns listings for each graph of the forest, in forest order. */
  public static ImmutableList<GraphListing> ofForest(GraphForest forest) {
    return forest.graphs().stream().map(GraphListing::of).collect(ImmutableList.toImmutableList());
  }

  /** Returns the concatenated listings, separated by blank lines. */
  public static String toString(List<GraphListing> listings) {
    return listings.stream().map(GraphListing::toString).collect(Collectors.joining("\n"));
  }

  private boolean showNext(int i) {
    Entry entry = entries.get(i);
    if (entry.next.isEmpty() && entry.text.equals("<SINK>")) {
      return false;
    }
    return !(entry.next.size() == 1
        && entry.next.get(0).kind() == Link.Kind.NORMAL
        && i + 1 < entries.size()
        && entry.next.get(0).ref().equals(entries.get(i + 1).ref));
  }

  private boolean showPrev(int i) {
    Entry entry = entries.get(i);
    if (i == 0) {
      return !entry.prev.isEmpty();
    }
    return !(entry.prev.size() == 1 && entry.prev.get(0).equals(entries.get(i - 1).ref));
  }

  @Override
  public String toString() {
    List<String> heads = new ArrayList<>();
    int width = 0;
    for (int i = 0; i < entries.size(); i++) {
      Entry entry = entries.get(i);
      boolean sameLine = i > 0 && entries.get(i - 1).line == entry.line;
      String lineNum = sameLine ? "" : String.valueOf(entry.line);
      String head = String.format("%4s %-4s %s", lineNum, entry.ref, entry.text);
      heads.add(head);
      width = Math.max(width, head.length());
    }
    StringBuilder sb = new StringBuilder();
    sb.append("== ").append(name).append(" ==\n");
    for (int i = 0; i < entries.size(); i++) {
      Entry entry = entries.get(i);
      for (String label : entry.labels) {
        sb.append(label).append(":\n");
      }
      StringBuilder line = new StringBuilder(heads.get(i));
      boolean showNext = showNext(i);
      boolean showPrev = showPrev(i);
      if (showNext || showPrev) {
        while (line.length() < width) {
          line.append(' ');
        }
        if (showNext) {
          line.append("  NEXT:").append(entry.next);
        }
        if (showPrev) {
          line.append("  PREV:").append(entry.prev);
        }
      }
      sb.append(line).append('\n');
    }
    return sb.append(FOOTER).append('\n').toString();
  }

  /** Parses a single listing, as returned by {@link #toString()}. */
  public static GraphListing parse(String text) {
    ImmutableList<GraphListing> result = parseAll(text);
    Preconditions.checkArgument(result.size() == 1, "Expected one graph, found %s", result.size());
    return result.get(0);
  }

  /** Parses a sequence of listings, as returned by {@link #toString(List)}. */
  public static ImmutableList<GraphListing> parseAll(String text) {
    ImmutableList.Builder<GraphListing> result = ImmutableList.builder();
    String name = null;
    List<RawEntry> raw = new ArrayList<>();
    List<String> labels = new ArrayList<>();
    for (String line : Splitter.on('\n').split(text)) {
      if (line.isBlank()) {
        continue;
      }
      Matcher m;
      if (name == null) {
        m = HEADER_PATTERN.matcher(line);
        Preconditions.checkArgument(m.matches(), "Expected graph header: %s", line);
        name = m.group(1);
      } else if (FOOTER_PATTERN.matcher(line).matches()) {
        Preconditions.checkArgument(labels.isEmpty(), "Label without instruction in %s", name);
        result.add(new GraphListing(name, resolve(raw)));
        name = null;
        raw.clear();
      } else if ((m = LABEL_PATTERN.matcher(line)).matches()) {
        labels.add(m.group(1));
      } else if ((m = ENTRY_PATTERN.matcher(line)).matches()) {
        int lineNum;
        if (m.group(1) != null) {
          lineNum = Integer.parseInt(m.group(1));
        } else {
          Preconditions.checkArgument(!raw.isEmpty(), "Missing line number: %s", line);
          lineNum = raw.get(raw.size() - 1).line;
        }
        raw.add(
            new RawEntry(
                lineNum,
                ImmutableList.copyOf(labels),
                m.group(2),
                m.group(3),
                (m.group(4) == null) ? null : REFS.splitToList(m.group(4)),
                (m.group(5) == null) ? null : REFS.splitToList(m.group(5))));
        labels.clear();
      } else {
        throw new IllegalArgumentException("Can't parse: " + line);
      }
    }
    Preconditions.checkArgument(name == null, "Missing footer for %s", name);
    return result.build();
  }

  /** An entry as parsed, before omitted links are filled in. */
  private record RawEntry(
      int line,
      ImmutableList<String> labels,
      String ref,
      String text,
      List<String> next,
      List<String> prev) {}

  private static ImmutableList<Entry> resolve(List<RawEntry> raw) {
    String sinkRef = null;
    for (RawEntry e : raw) {
      if (e.text.equals("<SINK>")) {
        sinkRef = e.ref;
      }
    }
    ImmutableList.Builder<Entry> result = ImmutableList.builder();
    for (int i = 0; i < raw.size(); i++) {
      RawEntry e = raw.get(i);
      List<String> next = e.next;
      if (next == null) {
        boolean last = e.text.equals("<SINK>") || i + 1 == raw.size();
        next = last ? List.of() : List.of(raw.get(i + 1).ref);
      }
      List<String> prev = e.prev;
      if (prev == null) {
        prev = (i == 0) ? List.of() : List.of(raw.get(i - 1).ref);
      }
      ImmutableList.Builder<Edge> edges = ImmutableList.builder();
      for (int j = 0; j < next.size(); j++) {
        edges.add(new Edge(next.get(j), inferKind(e.text, j, next.get(j).equals(sinkRef))));
      }
      result.add(
          new Entry(e.line, e.labels, e.ref, e.text, edges.build(), ImmutableList.copyOf(prev)));
    }
    return result.build();
  }

  private static Link.Kind inferKind(String text, int index, boolean toSink) {
    if (toSink && !text.equals("<END>") && !text.equals("<ERROR>")) {
      return Link.Kind.DEAD;
    } else if (text.startsWith("jt(")) {
      return (index == 0) ? Link.Kind.FALSE : Link.Kind.TRUE;
    } else if (text.startsWith("jf(")) {
      return (index == 0) ? Link.Kind.TRUE : Link.Kind.FALSE;
    }
    return Link.Kind.NORMAL;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof GraphListing other
        && name.equals(other.name)
        && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + entries.hashCode();
  }
}
