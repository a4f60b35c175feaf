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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A quantifier-free boolean constraint over terms: the "pure" part of a
 * symbolic heap, which says nothing about the shape of the heap.
 * <p>
 * Formulas are built only through the static factories, which fold the
 * trivial cases: {@code eq(t, t)} is {@link #tt()}, an equation between
 * distinct constants is {@link #ff()}, conjunctions and disjunctions are
 * flattened, and {@code tt}/{@code ff} are absorbed. The result of
 * {@link #isFalse()} is therefore a sound but incomplete unsatisfiability
 * check.
 */
public final class Formula {
  /** The kinds of formulas */
  public enum Kind {
    TT, FF, EQ, DQ, AND, OR
  }

  private static final Formula TT =
      new Formula(Kind.TT, ImmutableList.<Term>of(), ImmutableList.<Formula>of());
  private static final Formula FF =
      new Formula(Kind.FF, ImmutableList.<Term>of(), ImmutableList.<Formula>of());

  private final Kind kind;
  /** The two sides of an equation or disequation, in order */
  private final ImmutableList<Term> terms;
  /** The operands of a conjunction or disjunction */
  private final ImmutableList<Formula> args;

  private Formula(Kind kind, ImmutableList<Term> terms,
      ImmutableList<Formula> args) {
    this.kind = kind;
    this.terms = terms;
    this.args = args;
  }

  public static Formula tt() {
    return TT;
  }

  public static Formula ff() {
    return FF;
  }

  /** The equation {@code a = b} */
  public static Formula eq(Term a, Term b) {
    if (a.equals(b)) {
      return TT;
    }
    if (a instanceof Const && b instanceof Const) {
      return FF;
    }
    return atom(Kind.EQ, a, b);
  }

  /** The disequation {@code a != b} */
  public static Formula dq(Term a, Term b) {
    if (a.equals(b)) {
      return FF;
    }
    if (a instanceof Const && b instanceof Const) {
      return TT;
    }
    return atom(Kind.DQ, a, b);
  }

  private static Formula atom(Kind kind, Term a, Term b) {
    // Sides are ordered so that structurally equal atoms are equal.
    if (a.compareTo(b) > 0) {
      Term t = a;
      a = b;
      b = t;
    }
    return new Formula(kind, ImmutableList.of(a, b), ImmutableList.<Formula>of());
  }

  public static Formula and(Formula... fs) {
    return and(Arrays.asList(fs));
  }

  /** Conjunction, flattened, without duplicates, in order of first occurrence */
  public static Formula and(Iterable<Formula> fs) {
    LinkedHashSet<Formula> conjuncts = Sets.newLinkedHashSet();
    for (Formula f : fs) {
      if (f.kind == Kind.FF) {
        return FF;
      } else if (f.kind == Kind.AND) {
        conjuncts.addAll(f.args);
      } else if (f.kind != Kind.TT) {
        conjuncts.add(f);
      }
    }
    return junction(Kind.AND, conjuncts, TT);
  }

  public static Formula or(Formula... fs) {
    return or(Arrays.asList(fs));
  }

  /** Disjunction, flattened, without duplicates, in order of first occurrence */
  public static Formula or(Iterable<Formula> fs) {
    LinkedHashSet<Formula> disjuncts = Sets.newLinkedHashSet();
    for (Formula f : fs) {
      if (f.kind == Kind.TT) {
        return TT;
      } else if (f.kind == Kind.OR) {
        disjuncts.addAll(f.args);
      } else if (f.kind != Kind.FF) {
        disjuncts.add(f);
      }
    }
    return junction(Kind.OR, disjuncts, FF);
  }

  private static Formula junction(Kind kind, LinkedHashSet<Formula> fs,
      Formula unit) {
    if (fs.isEmpty()) {
      return unit;
    }
    if (fs.size() == 1) {
      return fs.iterator().next();
    }
    return new Formula(kind, ImmutableList.<Term>of(), ImmutableList.copyOf(fs));
  }

  /** Negation, pushed down to the atoms */
  public static Formula not(Formula f) {
    switch (f.kind) {
      case TT:
        return FF;
      case FF:
        return TT;
      case EQ:
        return dq(f.terms.get(0), f.terms.get(1));
      case DQ:
        return eq(f.terms.get(0), f.terms.get(1));
      case AND:
        return or(negateAll(f.args));
      case OR:
        return and(negateAll(f.args));
      default:
        throw new AssertionError(f.kind);
    }
  }

  private static List<Formula> negateAll(List<Formula> fs) {
    List<Formula> negated = Lists.newArrayListWithCapacity(fs.size());
    for (Formula f : fs) {
      negated.add(not(f));
    }
    return negated;
  }

  public Kind kind() {
    return kind;
  }

  /** @return the left-hand side of an equation or disequation */
  public Term left() {
    return terms.get(0);
  }

  /** @return the right-hand side of an equation or disequation */
  public Term right() {
    return terms.get(1);
  }

  /** @return the operands of a conjunction or disjunction */
  public ImmutableList<Formula> args() {
    return args;
  }

  public boolean isTrue() {
    return kind == Kind.TT;
  }

  public boolean isFalse() {
    return kind == Kind.FF;
  }

  /**
   * @return the top-level conjuncts: the operands of a conjunction, nothing
   *         for {@code tt}, and the formula itself otherwise
   */
  public ImmutableList<Formula> conjuncts() {
    switch (kind) {
      case AND:
        return args;
      case TT:
        return ImmutableList.of();
      default:
        return ImmutableList.of(this);
    }
  }

  public ImmutableSortedSet<Var> fv() {
    ImmutableSortedSet.Builder<Var> vs = ImmutableSortedSet.naturalOrder();
    for (Term t : terms) {
      vs.addAll(t.fv());
    }
    for (Formula f : args) {
      vs.addAll(f.fv());
    }
    return vs.build();
  }

  /**
   * Rebuilds this formula with {@code f} applied to every side of every
   * atom. The smart constructors are used again, so a mapped formula may
   * collapse to {@code tt} or {@code ff}.
   */
  public Formula mapTerms(Function<? super Term, ? extends Term> f) {
    switch (kind) {
      case TT:
      case FF:
        return this;
      case EQ:
      case DQ: {
        Term a = f.apply(terms.get(0));
        Term b = f.apply(terms.get(1));
        if (a.equals(terms.get(0)) && b.equals(terms.get(1))) {
          return this;
        }
        return kind == Kind.EQ ? eq(a, b) : dq(a, b);
      }
      default: {
        List<Formula> mapped = Lists.newArrayListWithCapacity(args.size());
        boolean changed = false;
        for (Formula arg : args) {
          Formula m = arg.mapTerms(f);
          changed |= m != arg;
          mapped.add(m);
        }
        if (!changed) {
          return this;
        }
        return kind == Kind.AND ? and(mapped) : or(mapped);
      }
    }
  }

  /** Replaces variables by terms */
  public Formula substitute(final Substitution sub) {
    if (sub.isEmpty()) {
      return this;
    }
    return mapTerms(new Function<Term, Term>() {
      @Override
      public Term apply(Term t) {
        return sub.apply(t);
      }
    });
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Formula)) {
      return false;
    }
    Formula f = (Formula) o;
    return kind == f.kind && terms.equals(f.terms) && args.equals(f.args);
  }

  @Override
  public int hashCode() {
    return (kind.hashCode() * 31 + terms.hashCode()) * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    switch (kind) {
      case TT:
        return "tt";
      case FF:
        return "ff";
      case EQ:
        return terms.get(0) + " = " + terms.get(1);
      case DQ:
        return terms.get(0) + " != " + terms.get(1);
      case AND:
        return "(" + Joiner.on(" && ").join(args) + ")";
      case OR:
        return "(" + Joiner.on(" || ").join(args) + ")";
      default:
        throw new AssertionError(kind);
    }
  }
}
