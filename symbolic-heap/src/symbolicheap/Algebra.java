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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

import java.util.Set;

/**
 * The smart constructors combining symbolic heaps. Operands are always
 * brought to a common vocabulary here, with bound variables renamed apart,
 * so callers never have to.
 */
final class Algebra {
  private static final Logger logger = LogManager.getLogger(Algebra.class);

  private Algebra() {}

  static SymbolicHeap ff(Set<Var> vs) {
    return SymbolicHeap.create(vs, Vars.of(), Context.empty(), Formula.tt(),
        ImmutableList.<Segment>of(), ImmutableList.of(Disjunction.EMPTY));
  }

  static SymbolicHeap seg(Segment s) {
    return SymbolicHeap.create(s.fv(), Vars.of(), Context.empty(),
        Formula.tt(), ImmutableList.of(s), ImmutableList.<Disjunction>of());
  }

  /**
   * @return whether q is the unit of {@link #star}: no segments, no
   *         disjunctions, no bound variables and no constraints
   */
  static boolean isTrivial(SymbolicHeap q) {
    return q.heap().isEmpty() && q.djns().isEmpty() && q.xs().isEmpty()
        && q.pure().isTrue() && q.ctx().isEmpty();
  }

  static SymbolicHeap star(SymbolicHeap q1, SymbolicHeap q2) {
    logger.trace("star {} with {}", q1, q2);
    ImmutableSortedSet<Var> us = Vars.union(q1.us(), q2.us());
    if (q1.isCanonicalFalse() || q2.isCanonicalFalse()) {
      return ff(us);
    }
    if (isTrivial(q1)) {
      return Vocabulary.extendUs(us, q2);
    }
    if (isTrivial(q2)) {
      return Vocabulary.extendUs(us, q1);
    }
    SymbolicHeap a = Vocabulary.extendUs(us, q1);
    SymbolicHeap b = Vocabulary.freshenXs(Vocabulary.extendUs(us, q2), a.xs());
    Context ctx = a.ctx().union(b.ctx());
    Formula pure = Formula.and(a.pure(), b.pure());
    if (ctx.isUnsat() || pure.isFalse()) {
      logger.debug("star of {} and {} is inconsistent", q1, q2);
      return ff(us);
    }
    ImmutableList<Segment> heap = ImmutableList.<Segment>builder()
        .addAll(a.heap()).addAll(b.heap()).build();
    ImmutableList<Disjunction> djns = ImmutableList.<Disjunction>builder()
        .addAll(Vocabulary.extendDjns(b.xs(), a.djns()))
        .addAll(Vocabulary.extendDjns(a.xs(), b.djns()))
        .build();
    return SymbolicHeap.create(us, Vars.union(a.xs(), b.xs()), ctx, pure, heap,
        djns);
  }

  /**
   * @return whether q only wraps a single disjunction, so that its
   *         disjuncts can be spliced into an enclosing one
   */
  private static boolean isWrapper(SymbolicHeap q) {
    return q.djns().size() == 1 && q.heap().isEmpty() && q.xs().isEmpty()
        && q.pure().isTrue() && q.ctx().isEmpty();
  }

  static SymbolicHeap or(SymbolicHeap q1, SymbolicHeap q2) {
    logger.trace("or {} with {}", q1, q2);
    ImmutableSortedSet<Var> us = Vars.union(q1.us(), q2.us());
    if (q1.isCanonicalFalse()) {
      return Vocabulary.extendUs(us, q2);
    }
    if (q2.isCanonicalFalse()) {
      return Vocabulary.extendUs(us, q1);
    }
    SymbolicHeap a = Vocabulary.extendUs(us, q1);
    SymbolicHeap b = Vocabulary.extendUs(us, q2);
    ImmutableList.Builder<SymbolicHeap> disjuncts = ImmutableList.builder();
    for (SymbolicHeap q : ImmutableList.of(a, b)) {
      if (isWrapper(q)) {
        disjuncts.addAll(q.djns().get(0));
      } else {
        disjuncts.add(q);
      }
    }
    Context ctx = a.ctx().join(b.ctx()).restrict(us);
    return SymbolicHeap.create(us, Vars.of(), ctx, Formula.tt(),
        ImmutableList.<Segment>of(),
        ImmutableList.of(Disjunction.of(disjuncts.build())));
  }
}
