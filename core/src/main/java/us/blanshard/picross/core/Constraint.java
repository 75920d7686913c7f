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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

import javax.annotation.concurrent.Immutable;

/**
 * The ordered runs expected in one row or column.  Order matters: the entries
 * must appear left to right (or top to bottom) exactly as listed.  A
 * constraint with no entries requires a line with no filled cells at all.
 */
@Immutable
public final class Constraint<V> extends AbstractList<ConstraintEntry<V>>
    implements RandomAccess {

  private static final Constraint<Object> EMPTY =
      new Constraint<Object>(ImmutableList.<ConstraintEntry<Object>>of());

  private final ImmutableList<ConstraintEntry<V>> entries;

  private Constraint(ImmutableList<ConstraintEntry<V>> entries) {
    this.entries = entries;
  }

  /** Returns the constraint with no entries. */
  @SuppressWarnings("unchecked")  // Holds nothing, so safe for any V.
  public static <V> Constraint<V> empty() {
    return (Constraint<V>) EMPTY;
  }

  @SafeVarargs
  public static <V> Constraint<V> of(ConstraintEntry<V>... entries) {
    return copyOf(ImmutableList.copyOf(entries));
  }

  public static <V> Constraint<V> copyOf(Iterable<ConstraintEntry<V>> entries) {
    if (entries instanceof Constraint) return (Constraint<V>) entries;
    return new Constraint<V>(ImmutableList.copyOf(entries));
  }

  public static <V> Builder<V> builder() {
    return new Builder<V>();
  }

  /** Accumulates entries in order. */
  public static final class Builder<V> {
    private final ImmutableList.Builder<ConstraintEntry<V>> entries = ImmutableList.builder();

    private Builder() {}

    /** Appends a run of {@code size} cells of the given value. */
    public Builder<V> add(int size, V value) {
      entries.add(ConstraintEntry.of(size, value));
      return this;
    }

    public Builder<V> add(ConstraintEntry<V> entry) {
      entries.add(checkNotNull(entry));
      return this;
    }

    public Constraint<V> build() {
      return new Constraint<V>(entries.build());
    }
  }

  /** Tells whether the given line of cells holds exactly the runs of this constraint. */
  public boolean isSatisfiedBy(List<Cell<V>> line) {
    return Runs.satisfies(this, line);
  }

  @Override public ConstraintEntry<V> get(int index) {
    return entries.get(index);
  }

  @Override public int size() {
    return entries.size();
  }

  @Override public String toString() {
    return "[" + Joiner.on(", ").join(entries) + "]";
  }
}
