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

package symbolicheap;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Renaming;
import symbolicheap.fol.Substitution;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

import java.util.Set;

/**
 * Operations on the vocabulary and bound variables of symbolic heaps. All
 * of them avoid capture through {@link #freshenXs}, the one place where
 * bound variables are renamed.
 */
final class Vocabulary {
  private Vocabulary() {}

  /**
   * Renames the bound variables of q that are in wrt to fresh ones, which
   * are also apart from the vocabulary. Nested disjuncts follow the
   * renaming of their enclosing vocabulary.
   */
  static SymbolicHeap freshenXs(SymbolicHeap q, Set<Var> wrt) {
    ImmutableSortedSet<Var> clash = Vars.inter(q.xs(), wrt);
    if (clash.isEmpty()) {
      return q;
    }
    Set<Var> avoid = Vars.union(Vars.union(wrt, q.us()), q.xs());
    Renaming r = Renaming.freshen(clash, avoid);
    Substitution sub = r.asSubstitution();
    ImmutableList.Builder<Disjunction> djns = ImmutableList.builder();
    for (Disjunction djn : q.djns()) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(substitute(sub, d));
      }
      djns.add(Disjunction.of(disjuncts.build()));
    }
    return SymbolicHeap.create(q.us(), r.applyTo(q.xs()),
        q.ctx().mapTerms(asFunction(sub)), sub.apply(q.pure()),
        mapHeap(q.heap(), asFunction(sub)), djns.build());
  }

  static Function<Term, Term> asFunction(final Substitution sub) {
    return new Function<Term, Term>() {
      @Override
      public Term apply(Term t) {
        return sub.apply(t);
      }
    };
  }

  static ImmutableList<Segment> mapHeap(ImmutableList<Segment> heap,
      Function<? super Term, ? extends Term> f) {
    ImmutableList.Builder<Segment> mapped = ImmutableList.builder();
    boolean changed = false;
    for (Segment s : heap) {
      Segment m = s.mapTerms(f);
      changed |= m != s;
      mapped.add(m);
    }
    return changed ? mapped.build() : heap;
  }

  /**
   * Applies sub, restricted to the vocabulary, to q. Bound variables that
   * clash with the variables of the images are renamed first.
   */
  static SymbolicHeap substitute(Substitution sub, SymbolicHeap q) {
    sub = sub.restrict(q.us());
    if (sub.isEmpty()) {
      return q;
    }
    ImmutableSortedSet<Var> rangeFv = sub.rangeFv();
    ImmutableSortedSet<Var> us =
        Vars.union(Vars.diff(q.us(), sub.domain()), rangeFv);
    if (q.isCanonicalFalse()) {
      return Algebra.ff(us);
    }
    q = freshenXs(q, rangeFv);
    Function<Term, Term> f = asFunction(sub);
    Context ctx = q.ctx().mapTerms(f);
    Formula pure = sub.apply(q.pure());
    if (ctx.isUnsat() || pure.isFalse()) {
      return Algebra.ff(us);
    }
    ImmutableList.Builder<Disjunction> djns = ImmutableList.builder();
    for (Disjunction djn : q.djns()) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(substitute(sub, d));
      }
      djns.add(Disjunction.of(disjuncts.build()));
    }
    return SymbolicHeap.create(us, q.xs(), ctx, pure, mapHeap(q.heap(), f),
        djns.build());
  }

  static SymbolicHeap rename(Renaming r, SymbolicHeap q) {
    return substitute(r.restrict(q.us()).asSubstitution(), q);
  }

  /**
   * Adds vs to the vocabulary of q and of its nested disjuncts, renaming
   * bound variables in vs out of the way.
   */
  static SymbolicHeap extendUs(Set<Var> vs, SymbolicHeap q) {
    ImmutableSortedSet<Var> added = Vars.diff(vs, q.us());
    if (added.isEmpty()) {
      return q;
    }
    if (q.isCanonicalFalse()) {
      return Algebra.ff(Vars.union(q.us(), added));
    }
    q = freshenXs(q, added);
    return SymbolicHeap.create(Vars.union(q.us(), added), q.xs(), q.ctx(),
        q.pure(), q.heap(), extendDjns(added, q.djns()));
  }

  static ImmutableList<Disjunction> extendDjns(Set<Var> vs,
      ImmutableList<Disjunction> djns) {
    if (vs.isEmpty() || djns.isEmpty()) {
      return djns;
    }
    ImmutableList.Builder<Disjunction> extended = ImmutableList.builder();
    for (Disjunction djn : djns) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(extendUs(vs, d));
      }
      extended.add(Disjunction.of(disjuncts.build()));
    }
    return extended.build();
  }

  /**
   * Removes vs from the vocabulary of q and of its nested disjuncts. None of
   * vs may occur free in q.
   */
  static SymbolicHeap shrinkUs(Set<Var> vs, SymbolicHeap q) {
    if (Vars.disjoint(vs, q.us())) {
      return q;
    }
    ImmutableSortedSet<Var> us = Vars.diff(q.us(), vs);
    if (q.isCanonicalFalse()) {
      return Algebra.ff(us);
    }
    ImmutableList.Builder<Disjunction> djns = ImmutableList.builder();
    for (Disjunction djn : q.djns()) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(shrinkUs(vs, d));
      }
      djns.add(Disjunction.of(disjuncts.build()));
    }
    return SymbolicHeap.create(us, q.xs(), q.ctx(), q.pure(), q.heap(),
        djns.build());
  }

  /** Binds the variables of vs that are in the vocabulary of q */
  static SymbolicHeap exists(Set<Var> vs, SymbolicHeap q) {
    ImmutableSortedSet<Var> bound = Vars.inter(vs, q.us());
    if (bound.isEmpty()) {
      return q;
    }
    ImmutableSortedSet<Var> us = Vars.diff(q.us(), bound);
    if (q.isCanonicalFalse()) {
      return Algebra.ff(us);
    }
    return SymbolicHeap.create(us, Vars.union(q.xs(), bound), q.ctx(),
        q.pure(), q.heap(), q.djns());
  }

  static SymbolicHeap.Bound bindExists(SymbolicHeap q, Set<Var> wrt) {
    if (q.xs().isEmpty()) {
      return new SymbolicHeap.Bound(Vars.of(), q);
    }
    q = freshenXs(q, wrt);
    return new SymbolicHeap.Bound(q.xs(), SymbolicHeap.create(
        Vars.union(q.us(), q.xs()), Vars.of(), q.ctx(), q.pure(), q.heap(),
        q.djns()));
  }

  static SymbolicHeap.Freshened freshen(SymbolicHeap q, Set<Var> wrt) {
    ImmutableSortedSet<Var> clash = Vars.inter(q.us(), wrt);
    Renaming r = Renaming.freshen(clash,
        Vars.union(Vars.union(wrt, q.us()), q.xs()));
    SymbolicHeap renamed = rename(r, q);
    return new SymbolicHeap.Freshened(extendUs(wrt, renamed), r);
  }
}
