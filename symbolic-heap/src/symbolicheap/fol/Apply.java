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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * A term representing an operation applied to argument terms, such as
 * {@code p + 8} or {@code concat(x, y)}.
 * <p>
 * Apart from the folding of constant offsets done by {@link Term#add}, the
 * operators are uninterpreted: two applications are equal only if they have
 * the same operator and equal arguments, or if a {@link Context} has learned
 * that they are equal.
 */
public final class Apply extends Term {
  private final String op;
  private final ImmutableList<Term> args;
  private final int depth;

  private Apply(String op, ImmutableList<Term> args) {
    this.op = op;
    this.args = args;
    int d = 0;
    for (Term arg : args) {
      d = Math.max(d, arg.depth());
    }
    this.depth = d + 1;
  }

  /** Factory method, use {@link Term#apply} to get offset folding */
  static Apply create(String op, ImmutableList<Term> args) {
    Preconditions.checkNotNull(op);
    Preconditions.checkArgument(!args.isEmpty(), "%s applied to nothing", op);
    return new Apply(op, args);
  }

  public String op() {
    return op;
  }

  public ImmutableList<Term> args() {
    return args;
  }

  @Override
  public ImmutableSortedSet<Var> fv() {
    ImmutableSortedSet.Builder<Var> vs = ImmutableSortedSet.naturalOrder();
    for (Term arg : args) {
      vs.addAll(arg.fv());
    }
    return vs.build();
  }

  @Override
  public Term transform(Function<? super Term, ? extends Term> f) {
    ImmutableList.Builder<Term> newArgs = ImmutableList.builder();
    boolean changed = false;
    for (Term arg : args) {
      Term newArg = arg.transform(f);
      changed |= newArg != arg;
      newArgs.add(newArg);
    }
    Term rebuilt = changed ? Term.apply(op, newArgs.build()) : this;
    return f.apply(rebuilt);
  }

  @Override
  public int depth() {
    return depth;
  }

  @Override
  int rank() {
    return 2;
  }

  @Override
  int compareSameRank(Term other) {
    Apply a = (Apply) other;
    int c = op.compareTo(a.op);
    if (c != 0) {
      return c;
    }
    if (args.size() != a.args.size()) {
      return args.size() < a.args.size() ? -1 : 1;
    }
    for (int i = 0; i < args.size(); i++) {
      c = args.get(i).compareTo(a.args.get(i));
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Apply)) {
      return false;
    }
    Apply a = (Apply) o;
    return op.equals(a.op) && args.equals(a.args);
  }

  @Override
  public int hashCode() {
    return op.hashCode() * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    if (op.equals(ADD) && args.size() == 2) {
      return String.format("(%s + %s)", args.get(0), args.get(1));
    }
    return String.format("%s(%s)", op, Joiner.on(", ").join(args));
  }
}
