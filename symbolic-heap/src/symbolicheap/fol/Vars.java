/*
 * Copyright 2010 Google Inc.
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

package symbolicheap.fol;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * Static utilities for sets of variables. All results are sorted immutable
 * sets, so iteration order, and with it printing and fresh-name generation,
 * is deterministic. An argument is returned as is when the result would be
 * equal to it.
 */
public final class Vars {
  private Vars() {}

  public static ImmutableSortedSet<Var> of() {
    return ImmutableSortedSet.of();
  }

  public static ImmutableSortedSet<Var> of(Var... vs) {
    return ImmutableSortedSet.copyOf(vs);
  }

  public static ImmutableSortedSet<Var> copyOf(Iterable<Var> vs) {
    return ImmutableSortedSet.copyOf(vs);
  }

  /** @return whether every element of a is in b */
  public static boolean subset(Set<Var> a, Set<Var> b) {
    return b.containsAll(a);
  }

  public static ImmutableSortedSet<Var> union(Set<Var> a, Set<Var> b) {
    if (b.isEmpty() || a.containsAll(b)) {
      return copyOf(a);
    }
    if (a.isEmpty()) {
      return copyOf(b);
    }
    return ImmutableSortedSet.copyOf(Sets.union(a, b));
  }

  public static ImmutableSortedSet<Var> diff(Set<Var> a, Set<Var> b) {
    if (b.isEmpty() || disjoint(a, b)) {
      return copyOf(a);
    }
    return ImmutableSortedSet.copyOf(Sets.difference(a, b));
  }

  public static ImmutableSortedSet<Var> inter(Set<Var> a, Set<Var> b) {
    return ImmutableSortedSet.copyOf(Sets.intersection(a, b));
  }

  public static boolean disjoint(Set<Var> a, Set<Var> b) {
    Set<Var> small = a.size() <= b.size() ? a : b;
    Set<Var> large = small == a ? b : a;
    for (Var v : small) {
      if (large.contains(v)) {
        return false;
      }
    }
    return true;
  }
}
