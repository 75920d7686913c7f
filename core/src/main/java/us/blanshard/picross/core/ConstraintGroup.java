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

import java.util.AbstractList;
import java.util.RandomAccess;

import javax.annotation.concurrent.Immutable;

/**
 * The constraints for all the rows of a puzzle, top to bottom, or for all the
 * columns, left to right.
 */
@Immutable
public final class ConstraintGroup<V> extends AbstractList<Constraint<V>>
    implements RandomAccess {

  private final ImmutableList<Constraint<V>> constraints;

  private ConstraintGroup(ImmutableList<Constraint<V>> constraints) {
    this.constraints = constraints;
  }

  @SafeVarargs
  public static <V> ConstraintGroup<V> of(Constraint<V>... constraints) {
    return new ConstraintGroup<V>(ImmutableList.copyOf(constraints));
  }

  public static <V> ConstraintGroup<V> copyOf(Iterable<Constraint<V>> constraints) {
    if (constraints instanceof ConstraintGroup) return (ConstraintGroup<V>) constraints;
    return new ConstraintGroup<V>(ImmutableList.copyOf(constraints));
  }

  @Override public Constraint<V> get(int index) {
    return constraints.get(index);
  }

  @Override public int size() {
    return constraints.size();
  }
}
