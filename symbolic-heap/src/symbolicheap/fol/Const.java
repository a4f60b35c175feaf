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
import com.google.common.collect.ImmutableSortedSet;

/**
 * An integer constant term.
 */
public final class Const extends Term {
  /** The encapsulated value */
  private final long value;

  private Const(long value) {
    this.value = value;
  }

  static Const create(long value) {
    return new Const(value);
  }

  public long value() {
    return value;
  }

  @Override
  public ImmutableSortedSet<Var> fv() {
    return ImmutableSortedSet.of();
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
    return 0;
  }

  @Override
  int compareSameRank(Term other) {
    return Long.compare(value, ((Const) other).value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Const && ((Const) o).value == value;
  }

  @Override
  public int hashCode() {
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
