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

import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

/**
 * Enumeration of the disjunctive normal form of a symbolic heap.
 * <p>
 * A path starts at the root clause. Entering a clause frees its bound
 * variables, renamed apart from those already freed on the path, conjoins
 * the clause without its disjunctions, and schedules those disjunctions
 * ahead of the ones still pending. The path then splits on the first
 * pending disjunction, one branch per disjunct from left to right, and ends
 * when nothing is pending.
 */
final class Dnf {
  private static final Logger logger = LogManager.getLogger(Dnf.class);

  private Dnf() {}

  static <C, D> D fold(DnfFolder<C, D> folder, SymbolicHeap q,
      ImmutableSortedSet<Var> xs, C conjuncts, D disjuncts) {
    return addDisjunct(folder, ImmutableList.<Disjunction>of(), q, xs,
        conjuncts, disjuncts);
  }

  private static <C, D> D addDisjunct(DnfFolder<C, D> folder,
      ImmutableList<Disjunction> pending, SymbolicHeap q,
      ImmutableSortedSet<Var> xs, C conjuncts, D disjuncts) {
    SymbolicHeap.Bound bound = Vocabulary.bindExists(q, xs);
    SymbolicHeap clause = bound.heap();
    ImmutableList<Disjunction> splits = ImmutableList.<Disjunction>builder()
        .addAll(clause.djns()).addAll(pending).build();
    SymbolicHeap stripped = clause.djns().isEmpty() ? clause
        : clause.with(clause.ctx(), clause.pure(), clause.heap(),
            ImmutableList.<Disjunction>of());
    return splitCase(folder, splits, Vars.union(xs, bound.vars()),
        folder.conj(stripped, conjuncts), disjuncts);
  }

  private static <C, D> D splitCase(DnfFolder<C, D> folder,
      ImmutableList<Disjunction> pending, ImmutableSortedSet<Var> xs,
      C conjuncts, D disjuncts) {
    if (pending.isEmpty()) {
      return folder.disj(xs, conjuncts, disjuncts);
    }
    ImmutableList<Disjunction> rest = pending.subList(1, pending.size());
    for (SymbolicHeap d : pending.get(0)) {
      disjuncts = addDisjunct(folder, rest, d, xs, conjuncts, disjuncts);
    }
    return disjuncts;
  }

  static Disjunction dnf(SymbolicHeap q) {
    logger.trace("dnf {}", q);
    DnfFolder<SymbolicHeap, ImmutableList<SymbolicHeap>> folder =
        new DnfFolder<SymbolicHeap, ImmutableList<SymbolicHeap>>() {
          @Override
          public SymbolicHeap conj(SymbolicHeap clause,
              SymbolicHeap conjuncts) {
            return Algebra.star(conjuncts, clause);
          }

          @Override
          public ImmutableList<SymbolicHeap> disj(ImmutableSortedSet<Var> xs,
              SymbolicHeap conjuncts, ImmutableList<SymbolicHeap> disjuncts) {
            SymbolicHeap clause = Vocabulary.exists(xs, conjuncts);
            if (clause.isFalse()) {
              return disjuncts;
            }
            return ImmutableList.<SymbolicHeap>builder()
                .addAll(disjuncts).add(clause).build();
          }
        };
    ImmutableList<SymbolicHeap> clauses = fold(folder, q, Vars.of(),
        SymbolicHeap.emp(), ImmutableList.<SymbolicHeap>of());
    logger.trace("dnf has {} clauses", clauses.size());
    return Disjunction.of(clauses);
  }
}
