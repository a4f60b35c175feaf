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
import com.google.common.collect.Lists;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Solution;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

import java.util.List;

/**
 * Conjunction with pure facts and rewriting of symbolic heaps into normal
 * form. The context of a clause is kept in step with its pure part: every
 * fact conjoined into one is conjoined into the other.
 */
final class Normalizer {
  private static final Logger logger = LogManager.getLogger(Normalizer.class);

  private Normalizer() {}

  static SymbolicHeap and(Formula b, SymbolicHeap q) {
    if (b.isTrue()) {
      return q;
    }
    q = Vocabulary.extendUs(b.fv(), q);
    if (q.isCanonicalFalse()) {
      return q;
    }
    Context ctx = q.ctx().and(b);
    Formula pure = Formula.and(q.pure(), b);
    if (ctx.isUnsat() || pure.isFalse()) {
      logger.debug("conjoining {} makes {} inconsistent", b, q);
      return Algebra.ff(q.us());
    }
    return q.with(ctx, pure, q.heap(), q.djns());
  }

  static SymbolicHeap andCtx(Context c, SymbolicHeap q) {
    if (c.isEmpty()) {
      return q;
    }
    q = Vocabulary.extendUs(c.fv(), q);
    if (q.isCanonicalFalse()) {
      return q;
    }
    Context ctx = q.ctx().union(c);
    if (ctx.isUnsat()) {
      logger.debug("conjoining context {} makes {} inconsistent", c, q);
      return Algebra.ff(q.us());
    }
    return q.with(ctx, q.pure(), q.heap(), q.djns());
  }

  static SymbolicHeap andSubst(Solution sol, SymbolicHeap q) {
    for (Formula eq : sol.equations()) {
      q = and(eq, q);
    }
    return q;
  }

  static SymbolicHeap norm(final Solution sol, SymbolicHeap q) {
    if (sol.isEmpty()) {
      return q;
    }
    q = Vocabulary.extendUs(sol.fv(), q);
    if (q.isCanonicalFalse()) {
      return q;
    }
    Function<Term, Term> f = new Function<Term, Term>() {
      @Override
      public Term apply(Term t) {
        return sol.apply(t);
      }
    };
    Context ctx = q.ctx().mapTerms(f);
    Formula pure = sol.apply(q.pure());
    if (ctx.isUnsat() || pure.isFalse()) {
      return Algebra.ff(q.us());
    }
    ImmutableList.Builder<Disjunction> djns = ImmutableList.builder();
    for (Disjunction djn : q.djns()) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(norm(sol, d));
      }
      djns.add(Disjunction.of(disjuncts.build()));
    }
    return q.with(ctx, pure, Vocabulary.mapHeap(q.heap(), f), djns.build());
  }

  static SymbolicHeap simplify(SymbolicHeap q) {
    logger.trace("simplify {}", q);
    if (q.isCanonicalFalse()) {
      return q;
    }
    if (q.isFalse()) {
      return Algebra.ff(q.us());
    }
    ImmutableSortedSet<Var> vocab = Vars.union(q.us(), q.xs());
    List<Disjunction> kept = Lists.newArrayList();
    List<SymbolicHeap> singles = Lists.newArrayList();
    for (Disjunction djn : q.djns()) {
      List<SymbolicHeap> live = Lists.newArrayList();
      for (SymbolicHeap d : djn) {
        SymbolicHeap s = simplify(d);
        if (!s.isFalse()) {
          live.add(s);
        }
      }
      if (live.isEmpty()) {
        logger.debug("every disjunct of {} is false", djn);
        return Algebra.ff(q.us());
      } else if (live.size() == 1) {
        singles.add(live.get(0));
      } else {
        kept.add(Disjunction.of(live));
      }
    }
    // The bound variables are freed while the single disjuncts, which are
    // over them, are merged in.
    SymbolicHeap open = SymbolicHeap.create(vocab, Vars.of(), q.ctx(),
        q.pure(), q.heap(), ImmutableList.copyOf(kept));
    for (SymbolicHeap single : singles) {
      open = Algebra.star(open, single);
    }
    if (open.isCanonicalFalse()) {
      return Algebra.ff(q.us());
    }
    final Context ctx = open.ctx();
    Function<Term, Term> normalize = new Function<Term, Term>() {
      @Override
      public Term apply(Term t) {
        return ctx.normalize(t);
      }
    };
    Solution sol = ctx.solution();
    ImmutableList.Builder<Disjunction> djns = ImmutableList.builder();
    for (Disjunction djn : open.djns()) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(norm(sol, d));
      }
      djns.add(Disjunction.of(disjuncts.build()));
    }
    open = open.with(ctx, open.pure(),
        Vocabulary.mapHeap(open.heap(), normalize), djns.build());
    SymbolicHeap closed =
        Vocabulary.exists(Vars.union(q.xs(), open.xs()), promote(open));
    return dropUnusedXs(closed);
  }

  /** @return q with its bound variables moved into the vocabulary */
  private static SymbolicHeap promote(SymbolicHeap q) {
    if (q.xs().isEmpty()) {
      return q;
    }
    return SymbolicHeap.create(Vars.union(q.us(), q.xs()), Vars.of(), q.ctx(),
        q.pure(), q.heap(), q.djns());
  }

  private static SymbolicHeap dropUnusedXs(SymbolicHeap q) {
    ImmutableSortedSet.Builder<Var> occurring = ImmutableSortedSet.naturalOrder();
    q.occurring(false, occurring);
    ImmutableSortedSet<Var> unused = Vars.diff(q.xs(), occurring.build());
    if (unused.isEmpty()) {
      return q;
    }
    ImmutableList.Builder<Disjunction> djns = ImmutableList.builder();
    for (Disjunction djn : q.djns()) {
      ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(Vocabulary.shrinkUs(unused, d));
      }
      djns.add(Disjunction.of(disjuncts.build()));
    }
    return SymbolicHeap.create(q.us(), Vars.diff(q.xs(), unused), q.ctx(),
        q.pure(), q.heap(), djns.build());
  }
}
