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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;

/**
 * A symbolic term over program values. There are three kinds of terms:
 * variables ({@link Var}), integer constants ({@link Const}) and applications
 * of a named operator to argument terms ({@link Apply}).
 * <p>
 * Terms are immutable and compared structurally. The total order puts
 * constants first, then variables, then applications, which makes constants
 * and variables the preferred representatives of equivalence classes in a
 * {@link Context}.
 */
public abstract class Term implements Comparable<Term> {
  /** The operator symbol of offset arithmetic */
  public static final String ADD = "+";

  // Only the three kinds in this package.
  Term() {}

  /** @return the variables occurring in this term */
  public abstract ImmutableSortedSet<Var> fv();

  /**
   * Rewrites this term bottom-up: the arguments of an application are
   * transformed first, the application is rebuilt from them, and then
   * {@code f} is applied to the rebuilt node.
   */
  public abstract Term transform(Function<? super Term, ? extends Term> f);

  /** @return the nesting depth of this term, 0 for variables and constants */
  public abstract int depth();

  /** Position of this kind of term in the total order */
  abstract int rank();

  /** Compares two terms of the same rank */
  abstract int compareSameRank(Term other);

  /**
   * Replaces every variable in the domain of {@code sub} by its image.
   */
  public Term substitute(final Map<Var, ? extends Term> sub) {
    if (sub.isEmpty()) {
      return this;
    }
    return transform(new Function<Term, Term>() {
      @Override
      public Term apply(Term t) {
        if (t instanceof Var) {
          Term image = sub.get(t);
          if (image != null) {
            return image;
          }
        }
        return t;
      }
    });
  }

  @Override
  public int compareTo(Term other) {
    if (rank() != other.rank()) {
      return rank() < other.rank() ? -1 : 1;
    }
    return compareSameRank(other);
  }

  /** @return the integer constant n */
  public static Const integer(long n) {
    return Const.create(n);
  }

  /**
   * Offset addition. Constant offsets are folded so that terms are kept in
   * the form {@code base + k}: {@code (p + 8) + 8} is {@code p + 16} and
   * {@code p + 0} is {@code p}.
   */
  public static Term add(Term a, Term b) {
    if (a instanceof Const && b instanceof Const) {
      return Const.create(((Const) a).value() + ((Const) b).value());
    }
    if (a instanceof Const) {
      return add(b, a);
    }
    if (b instanceof Const) {
      long k = ((Const) b).value();
      if (k == 0) {
        return a;
      }
      if (a instanceof Apply) {
        Apply sum = (Apply) a;
        if (sum.op().equals(ADD) && sum.args().size() == 2
            && sum.args().get(1) instanceof Const) {
          long j = ((Const) sum.args().get(1)).value();
          return add(sum.args().get(0), Const.create(j + k));
        }
      }
    }
    return Apply.create(ADD, ImmutableList.of(a, b));
  }

  /**
   * Applies an operator to arguments. Binary applications of {@link #ADD}
   * are folded as by {@link #add(Term, Term)}.
   */
  public static Term apply(String op, Term... args) {
    return apply(op, ImmutableList.copyOf(args));
  }

  /** @see #apply(String, Term...) */
  public static Term apply(String op, ImmutableList<Term> args) {
    if (op.equals(ADD) && args.size() == 2) {
      return add(args.get(0), args.get(1));
    }
    return Apply.create(op, args);
  }
}
