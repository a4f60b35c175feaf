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

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;

/**
 * A solved form of a set of equations: a map from terms to the terms that
 * replace them. Applying a solution rewrites a term bottom-up, replacing
 * every subterm found in the map. A {@link Context} produces one that maps
 * every term it knows to the representative of its class.
 */
public final class Solution {
  private static final Solution EMPTY =
      new Solution(ImmutableMap.<Term, Term>of());

  private final ImmutableMap<Term, Term> map;
  private final Function<Term, Term> lookup = new Function<Term, Term>() {
    @Override
    public Term apply(Term t) {
      Term image = map.get(t);
      return image == null ? t : image;
    }
  };

  private Solution(ImmutableMap<Term, Term> map) {
    this.map = map;
  }

  public static Solution empty() {
    return EMPTY;
  }

  public static Solution of(Term from, Term to) {
    return of(ImmutableMap.of(from, to));
  }

  public static Solution of(Map<? extends Term, ? extends Term> map) {
    ImmutableMap.Builder<Term, Term> builder = ImmutableMap.builder();
    for (Map.Entry<? extends Term, ? extends Term> e : map.entrySet()) {
      if (!e.getKey().equals(e.getValue())) {
        builder.put(e.getKey(), e.getValue());
      }
    }
    ImmutableMap<Term, Term> m = builder.build();
    return m.isEmpty() ? EMPTY : new Solution(m);
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public Term apply(Term t) {
    if (map.isEmpty()) {
      return t;
    }
    return t.transform(lookup);
  }

  public Formula apply(Formula f) {
    if (map.isEmpty()) {
      return f;
    }
    return f.mapTerms(lookup);
  }

  /** @return the equations {@code from = to}, one per entry */
  public ImmutableList<Formula> equations() {
    ImmutableList.Builder<Formula> eqs = ImmutableList.builder();
    for (Map.Entry<Term, Term> e : map.entrySet()) {
      eqs.add(Formula.eq(e.getKey(), e.getValue()));
    }
    return eqs.build();
  }

  public ImmutableSortedSet<Var> fv() {
    ImmutableSortedSet.Builder<Var> vs = ImmutableSortedSet.naturalOrder();
    for (Map.Entry<Term, Term> e : map.entrySet()) {
      vs.addAll(e.getKey().fv());
      vs.addAll(e.getValue().fv());
    }
    return vs.build();
  }

  public ImmutableMap<Term, Term> asMap() {
    return map;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Solution && map.equals(((Solution) o).map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").withKeyValueSeparator(" -> ").join(map) + "}";
  }
}
