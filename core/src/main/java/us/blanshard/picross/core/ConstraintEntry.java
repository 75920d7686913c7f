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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * One expected run in a {@link Constraint}: {@link #size} contiguous cells all
 * filled with {@link #value}.
 */
@Immutable
public final class ConstraintEntry<V> {

  /** The value every cell of the run must hold. */
  public final V value;

  /** The number of cells in the run, at least 1. */
  public final int size;

  private ConstraintEntry(int size, V value) {
    checkArgument(size >= 1, "Run size must be positive, got %s", size);
    this.size = size;
    this.value = checkNotNull(value);
  }

  /** Returns an entry for a run of {@code size} cells of the given value. */
  public static <V> ConstraintEntry<V> of(int size, V value) {
    return new ConstraintEntry<V>(size, value);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ConstraintEntry)) return false;
    ConstraintEntry<?> that = (ConstraintEntry<?>) o;
    return this.size == that.size && this.value.equals(that.value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(size, value);
  }

  @Override public String toString() {
    return size + " " + value;
  }
}
