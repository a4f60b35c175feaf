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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Set;

/**
 * An injective map from variables to variables. Identity entries are dropped
 * on construction.
 */
public final class Renaming {
  private static final Renaming EMPTY =
      new Renaming(ImmutableSortedMap.<Var, Var>of());

  private final ImmutableSortedMap<Var, Var> map;

  private Renaming(ImmutableSortedMap<Var, Var> map) {
    this.map = map;
  }

  public static Renaming empty() {
    return EMPTY;
  }

  public static Renaming of(Var from, Var to) {
    return of(ImmutableSortedMap.of(from, to));
  }

  /**
   * @throws IllegalArgumentException if two variables are mapped to the same
   *         one
   */
  public static Renaming of(Map<Var, Var> map) {
    ImmutableSortedMap.Builder<Var, Var> builder =
        ImmutableSortedMap.naturalOrder();
    Set<Var> range = Sets.newHashSet();
    for (Map.Entry<Var, Var> e : map.entrySet()) {
      Preconditions.checkArgument(range.add(e.getValue()),
          "renaming is not injective: %s", map);
      if (!e.getKey().equals(e.getValue())) {
        builder.put(e);
      }
    }
    ImmutableSortedMap<Var, Var> m = builder.build();
    return m.isEmpty() ? EMPTY : new Renaming(m);
  }

  /**
   * Maps each variable of {@code vs} to a fresh variable of the same name
   * that is neither in {@code wrt} nor another image.
   */
  public static Renaming freshen(Set<Var> vs, Set<Var> wrt) {
    if (vs.isEmpty()) {
      return EMPTY;
    }
    Set<Var> avoid = Sets.newHashSet(wrt);
    avoid.addAll(vs);
    ImmutableSortedMap.Builder<Var, Var> builder =
        ImmutableSortedMap.naturalOrder();
    for (Var v : ImmutableSortedSet.copyOf(vs)) {
      Var fresh = Var.fresh(v, avoid);
      avoid.add(fresh);
      builder.put(v, fresh);
    }
    return new Renaming(builder.build());
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public ImmutableSortedSet<Var> domain() {
    return map.keySet();
  }

  public ImmutableSortedSet<Var> range() {
    return ImmutableSortedSet.copyOf(map.values());
  }

  /** @return the image of v, which is v itself outside the domain */
  public Var apply(Var v) {
    Var w = map.get(v);
    return w == null ? v : w;
  }

  public ImmutableSortedSet<Var> applyTo(Set<Var> vs) {
    if (map.isEmpty()) {
      return Vars.copyOf(vs);
    }
    ImmutableSortedSet.Builder<Var> builder = ImmutableSortedSet.naturalOrder();
    for (Var v : vs) {
      builder.add(apply(v));
    }
    return builder.build();
  }

  public Renaming invert() {
    ImmutableSortedMap.Builder<Var, Var> builder =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Var, Var> e : map.entrySet()) {
      builder.put(e.getValue(), e.getKey());
    }
    return new Renaming(builder.build());
  }

  public Renaming restrict(Set<Var> vs) {
    if (vs.containsAll(map.keySet())) {
      return this;
    }
    ImmutableSortedMap.Builder<Var, Var> builder =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Var, Var> e : map.entrySet()) {
      if (vs.contains(e.getKey())) {
        builder.put(e);
      }
    }
    ImmutableSortedMap<Var, Var> m = builder.build();
    return m.isEmpty() ? EMPTY : new Renaming(m);
  }

  public Substitution asSubstitution() {
    return Substitution.of(map);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Renaming && map.equals(((Renaming) o).map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(", ").withKeyValueSeparator(" |-> ").join(map) + "]";
  }
}
