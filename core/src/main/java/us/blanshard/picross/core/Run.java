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
 * A maximal stretch of adjacent filled cells holding equal values, as observed
 * in one line of a board.
 */
@Immutable
public final class Run<V> {
  public final V value;
  public final int length;

  private Run(V value, int length) {
    checkArgument(length >= 1);
    this.value = checkNotNull(value);
    this.length = length;
  }

  public static <V> Run<V> of(V value, int length) {
    return new Run<V>(value, length);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Run)) return false;
    Run<?> that = (Run<?>) o;
    return this.length == that.length && this.value.equals(that.value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(value, length);
  }

  @Override public String toString() {
    return length + " " + value;
  }
}
