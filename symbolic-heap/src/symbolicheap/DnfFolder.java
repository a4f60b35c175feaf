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

import com.google.common.collect.ImmutableSortedSet;

import symbolicheap.fol.Var;

/**
 * The two steps of a fold over the disjunctive normal form of a symbolic
 * heap, see {@link SymbolicHeap#foldDnf}.
 *
 * @param <C> The type of conjunctions being built
 * @param <D> The type of the accumulated result
 */
public interface DnfFolder<C, D> {
  /**
   * @param clause A clause on the current path, without its disjunctions
   * @param conjuncts The conjunction of the clauses before it on the path
   * @return the conjunction of both
   */
  C conj(SymbolicHeap clause, C conjuncts);

  /**
   * @param xs The variables bound along the path
   * @param conjuncts The conjunction of all the clauses on the path
   * @param disjuncts The result so far
   * @return the result with the path added
   */
  D disj(ImmutableSortedSet<Var> xs, C conjuncts, D disjuncts);
}
