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

import java.util.Map;
import java.util.Set;

/**
 * A finite map from variables to terms, applied simultaneously. Entries that
 * map a variable to itself are dropped on construction.
 */
public final class Substitution {
  private static final Substitution EMPTY =
      new Substitution(ImmutableSortedMap.<Var, Term>of());

  private final ImmutableSortedMap<Var, Term> map;

  private Substitution(ImmutableSortedMap<Var, Term> map) {
    this.map = map;
  }

  public static Substitution empty() {
    return EMPTY;
  }

  public static Substitution of(Var v, Term t) {
    return of(ImmutableSortedMap.<Var, Term>of(v, t));
  }

  public static Substitution of(Map<Var, ? extends Term> map) {
    ImmutableSortedMap.Builder<Var, Term> builder =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Var, ? extends Term> e : map.entrySet()) {
      Preconditions.checkNotNull(e.getValue());
      if (!e.getKey().equals(e.getValue())) {
        builder.put(e.getKey(), e.getValue());
      }
    }
    ImmutableSortedMap<Var, Term> m = builder.build();
    return m.isEmpty() ? EMPTY : new Substitution(m);
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public ImmutableSortedSet<Var> domain() {
    return map.keySet();
  }

  /** @return the variables occurring in the images of the domain */
  public ImmutableSortedSet<Var> rangeFv() {
    ImmutableSortedSet.Builder<Var> vs = ImmutableSortedSet.naturalOrder();
    for (Term t : map.values()) {
      vs.addAll(t.fv());
    }
    return vs.build();
  }

  /** @return the image of v, or null if v is not in the domain */
  public Term get(Var v) {
    return map.get(v);
  }

  public Term apply(Term t) {
    return t.substitute(map);
  }

  public Formula apply(Formula f) {
    return f.substitute(this);
  }

  /** @return this substitution with its domain cut down to vs */
  public Substitution restrict(Set<Var> vs) {
    if (vs.containsAll(map.keySet())) {
      return this;
    }
    ImmutableSortedMap.Builder<Var, Term> builder =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Var, Term> e : map.entrySet()) {
      if (vs.contains(e.getKey())) {
        builder.put(e);
      }
    }
    return of(builder.build());
  }

  public ImmutableSortedMap<Var, Term> asMap() {
    return map;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Substitution && map.equals(((Substitution) o).map);
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
