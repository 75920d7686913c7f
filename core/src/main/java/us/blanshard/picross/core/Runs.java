/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.picross.core;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Finds the runs in a line of cells, and matches them against constraints.
 * Empty and crossed-out cells end a run without starting one; a change of
 * value between adjacent filled cells ends one run and starts the next.
 */
public final class Runs {
  private Runs() {}

  /** Returns the runs found in the given line, in order. */
  public static <V> List<Run<V>> scan(Iterable<Cell<V>> line) {
    final ImmutableList.Builder<Run<V>> runs = ImmutableList.builder();
    visit(line, new Visitor<V>() {
      @Override public boolean run(V value, int length) {
        runs.add(Run.of(value, length));
        return true;
      }
    });
    return runs.build();
  }

  /**
   * Tells whether the runs in the given line are exactly those of the
   * constraint: same count, and each the same value and length as the entry at
   * its position.  Stops at the first mismatch.
   */
  public static <V> boolean satisfies(final List<ConstraintEntry<V>> constraint,
      Iterable<Cell<V>> line) {
    final int[] matched = {0};
    boolean finished = visit(line, new Visitor<V>() {
      @Override public boolean run(V value, int length) {
        int i = matched[0];
        if (i >= constraint.size()) return false;
        ConstraintEntry<V> entry = constraint.get(i);
        if (entry.size != length || !entry.value.equals(value)) return false;
        matched[0] = i + 1;
        return true;
      }
    });
    return finished && matched[0] == constraint.size();
  }

  private interface Visitor<V> {
    /** Receives the next run, returns false to stop the scan. */
    boolean run(V value, int length);
  }

  /** Feeds the line's runs to the visitor, returns false if it was stopped. */
  private static <V> boolean visit(Iterable<Cell<V>> line, Visitor<V> visitor) {
    V current = null;
    int length = 0;
    for (Cell<V> cell : line) {
      if (cell.isIgnored()) {
        if (current != null && !visitor.run(current, length)) return false;
        current = null;
        length = 0;
      } else if (current != null && current.equals(cell.getValue())) {
        ++length;
      } else {
        if (current != null && !visitor.run(current, length)) return false;
        current = cell.getValue();
        length = 1;
      }
    }
    return current == null || visitor.run(current, length);
  }
}
