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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The contents of one square of a Picross board: empty, crossed out, or filled
 * with a value.  Only filled cells take part in run matching; the other two
 * kinds are "ignored".
 *
 * @param <V> the type of value a filled cell carries
 */
@Immutable
public final class Cell<V> {

  /** The three kinds of cell. */
  public enum Kind {
    EMPTY,
    CROSSED_OUT,
    FILLED;
  }

  private static final Cell<Object> EMPTY = new Cell<Object>(Kind.EMPTY, null);
  private static final Cell<Object> CROSSED_OUT = new Cell<Object>(Kind.CROSSED_OUT, null);

  private final Kind kind;
  @Nullable private final V value;

  private Cell(Kind kind, @Nullable V value) {
    this.kind = kind;
    this.value = value;
  }

  /** Returns the empty cell. */
  @SuppressWarnings("unchecked")  // Holds no value, so safe for any V.
  public static <V> Cell<V> empty() {
    return (Cell<V>) EMPTY;
  }

  /** Returns the crossed-out cell. */
  @SuppressWarnings("unchecked")  // Holds no value, so safe for any V.
  public static <V> Cell<V> crossedOut() {
    return (Cell<V>) CROSSED_OUT;
  }

  /** Returns a cell filled with the given value. */
  public static <V> Cell<V> filled(V value) {
    return new Cell<V>(Kind.FILLED, checkNotNull(value));
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isEmpty() {
    return kind == Kind.EMPTY;
  }

  public boolean isCrossedOut() {
    return kind == Kind.CROSSED_OUT;
  }

  public boolean isFilled() {
    return kind == Kind.FILLED;
  }

  /** Tells whether this cell is skipped by run matching: empty or crossed out. */
  public boolean isIgnored() {
    return kind != Kind.FILLED;
  }

  /** Returns the value of a filled cell. */
  public V getValue() {
    checkState(kind == Kind.FILLED, "%s cell has no value", kind);
    return value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Cell)) return false;
    Cell<?> that = (Cell<?>) o;
    return this.kind == that.kind && Objects.equal(this.value, that.value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(kind, value);
  }

  /** Renders empty as ".", crossed out as "/", and filled as the value's string. */
  @Override public String toString() {
    switch (kind) {
      case EMPTY: return ".";
      case CROSSED_OUT: return "/";
      default: return String.valueOf(value);
    }
  }
}
