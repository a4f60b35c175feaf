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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Set;

/**
 * A symbolic variable. A variable is identified by its name together with a
 * numeric id; fresh variables keep the name of the variable they replace and
 * get an id larger than any id they have to avoid.
 */
public final class Var extends Term {
  private final String name;
  private final int id;

  private Var(String name, int id) {
    this.name = name;
    this.id = id;
  }

  /**
   * @param name The name to give the variable
   */
  public static Var create(String name) {
    return create(name, 0);
  }

  public static Var create(String name, int id) {
    Preconditions.checkNotNull(name);
    Preconditions.checkArgument(id >= 0, "negative id %s for %s", id, name);
    return new Var(name, id);
  }

  /**
   * @return a variable named like {@code base} that is not in {@code wrt}
   */
  public static Var fresh(Var base, Set<Var> wrt) {
    int max = base.id;
    for (Var v : wrt) {
      max = Math.max(max, v.id);
    }
    return new Var(base.name, max + 1);
  }

  public String name() {
    return name;
  }

  public int id() {
    return id;
  }

  @Override
  public ImmutableSortedSet<Var> fv() {
    return ImmutableSortedSet.of(this);
  }

  @Override
  public Term transform(Function<? super Term, ? extends Term> f) {
    return f.apply(this);
  }

  @Override
  public int depth() {
    return 0;
  }

  @Override
  int rank() {
    return 1;
  }

  @Override
  int compareSameRank(Term other) {
    Var v = (Var) other;
    int c = name.compareTo(v.name);
    if (c != 0) {
      return c;
    }
    return id < v.id ? -1 : (id == v.id ? 0 : 1);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Var)) {
      return false;
    }
    Var v = (Var) o;
    return id == v.id && name.equals(v.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + id;
  }

  @Override
  public String toString() {
    return id == 0 ? name : name + "_" + id;
  }
}
