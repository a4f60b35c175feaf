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

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Renaming;
import symbolicheap.fol.Solution;
import symbolicheap.fol.Substitution;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

import java.util.Set;

/**
 * A symbolic heap: an existentially quantified star-conjunction of a pure
 * formula, a list of {@link Segment}s and a list of {@link Disjunction}s.
 * <p>
 * {@code us} is the vocabulary, the variables in scope, and {@code xs} the
 * variables bound by this clause. Every variable occurring in the clause is
 * in one of them, and every disjunct nested in the clause has exactly
 * {@code us} and {@code xs} together as its vocabulary. The context
 * {@code ctx} holds facts implied by the clause and is consistent unless the
 * clause is the canonical false one, which has a single empty disjunction
 * and nothing else.
 * <p>
 * Symbolic heaps are immutable. The operations below return new values, or
 * the receiver itself when they have nothing to do, and never capture bound
 * variables: whenever a vocabulary grows over a bound variable, the bound
 * variable is renamed first.
 */
public final class SymbolicHeap {
  /**
   * When set, the result of every operation is validated with
   * {@link #checkInvariant()}
   */
  static final boolean CHECK_INVARIANTS =
      Boolean.getBoolean("symbolicheap.checkInvariants");

  private static final SymbolicHeap EMP = new SymbolicHeap(Vars.of(),
      Vars.of(), Context.empty(), Formula.tt(), ImmutableList.<Segment>of(),
      ImmutableList.<Disjunction>of());

  private final ImmutableSortedSet<Var> us;
  private final ImmutableSortedSet<Var> xs;
  private final Context ctx;
  private final Formula pure;
  private final ImmutableList<Segment> heap;
  private final ImmutableList<Disjunction> djns;

  private SymbolicHeap(ImmutableSortedSet<Var> us, ImmutableSortedSet<Var> xs,
      Context ctx, Formula pure, ImmutableList<Segment> heap,
      ImmutableList<Disjunction> djns) {
    this.us = us;
    this.xs = xs;
    this.ctx = ctx;
    this.pure = pure;
    this.heap = heap;
    this.djns = djns;
  }

  /**
   * The only way to build a symbolic heap. The invariant is checked here
   * when invariant checking is enabled.
   */
  static SymbolicHeap create(Set<Var> us, Set<Var> xs, Context ctx,
      Formula pure, ImmutableList<Segment> heap,
      ImmutableList<Disjunction> djns) {
    SymbolicHeap q = new SymbolicHeap(Vars.copyOf(us), Vars.copyOf(xs),
        Preconditions.checkNotNull(ctx), Preconditions.checkNotNull(pure),
        heap, djns);
    if (CHECK_INVARIANTS) {
      q.checkInvariant();
    }
    return q;
  }

  /** @return a copy of this clause with different parts, same vocabulary */
  SymbolicHeap with(Context newCtx, Formula newPure,
      ImmutableList<Segment> newHeap, ImmutableList<Disjunction> newDjns) {
    if (newCtx == ctx && newPure == pure && newHeap == heap && newDjns == djns) {
      return this;
    }
    return create(us, xs, newCtx, newPure, newHeap, newDjns);
  }

  public ImmutableSortedSet<Var> us() {
    return us;
  }

  public ImmutableSortedSet<Var> xs() {
    return xs;
  }

  public Context ctx() {
    return ctx;
  }

  public Formula pure() {
    return pure;
  }

  public ImmutableList<Segment> heap() {
    return heap;
  }

  public ImmutableList<Disjunction> djns() {
    return djns;
  }

  // Construction

  /** @return the empty heap over no variables */
  public static SymbolicHeap emp() {
    return EMP;
  }

  /** @return the inconsistent symbolic heap over exactly {@code vs} */
  public static SymbolicHeap ff(Set<Var> vs) {
    return Algebra.ff(vs);
  }

  /** @return the symbolic heap of the single segment s, over fv(s) */
  public static SymbolicHeap seg(Segment s) {
    return Algebra.seg(s);
  }

  /** @return the empty heap constrained by b, over fv(b) */
  public static SymbolicHeap pure(Formula b) {
    return Normalizer.and(b, EMP);
  }

  /** Separating conjunction, over the union of both vocabularies */
  public static SymbolicHeap star(SymbolicHeap q1, SymbolicHeap q2) {
    return Algebra.star(q1, q2);
  }

  /** Disjunction, over the union of both vocabularies */
  public static SymbolicHeap or(SymbolicHeap q1, SymbolicHeap q2) {
    return Algebra.or(q1, q2);
  }

  /** @return the conjunction of this and the pure formula b */
  public SymbolicHeap and(Formula b) {
    return Normalizer.and(b, this);
  }

  /** @return the conjunction of this and the facts of c */
  public SymbolicHeap andCtx(Context c) {
    return Normalizer.andCtx(c, this);
  }

  /** @return the conjunction of this and the equations of sol */
  public SymbolicHeap andSubst(Solution sol) {
    return Normalizer.andSubst(sol, this);
  }

  // Update

  /**
   * Replaces the pure part. The context is kept as is, so it may be weaker
   * than the new pure part. {@code b} must be over the same vocabulary; this
   * is not checked.
   */
  public SymbolicHeap withPure(Formula b) {
    if (b.equals(pure)) {
      return this;
    }
    return new SymbolicHeap(us, xs, ctx, b, heap, djns);
  }

  /**
   * Removes the segment {@code s}, which must be the very instance held in
   * the heap: a segment that is only equal to it does not match.
   *
   * @throws IllegalArgumentException if s is not in the heap
   */
  public SymbolicHeap remSeg(Segment s) {
    int index = -1;
    for (int i = 0; i < heap.size(); i++) {
      if (heap.get(i) == s) {
        index = i;
        break;
      }
    }
    Preconditions.checkArgument(index >= 0, "segment %s is not in %s", s, this);
    ImmutableList<Segment> newHeap = ImmutableList.<Segment>builder()
        .addAll(heap.subList(0, index))
        .addAll(heap.subList(index + 1, heap.size()))
        .build();
    return with(ctx, pure, newHeap, djns);
  }

  /** @return this with only the segments satisfying pred */
  public SymbolicHeap filterHeap(Predicate<? super Segment> pred) {
    ImmutableList<Segment> kept = ImmutableList.copyOf(
        Iterables.filter(heap, pred));
    if (kept.size() == heap.size()) {
      return this;
    }
    return with(ctx, pure, kept, djns);
  }

  /**
   * Rewrites every term, nested disjuncts included, through sol. The
   * vocabulary is extended by the variables of sol.
   */
  public SymbolicHeap norm(Solution sol) {
    return Normalizer.norm(sol, this);
  }

  /**
   * Simplifies this symbolic heap: false disjuncts are dropped, single
   * disjuncts are merged into the clause, heap terms are normalized through
   * the context and unused bound variables are dropped.
   */
  public SymbolicHeap simplify() {
    return Normalizer.simplify(this);
  }

  // Quantification

  /** Binds the variables of vs that are in the vocabulary */
  public SymbolicHeap exists(Set<Var> vs) {
    return Vocabulary.exists(vs, this);
  }

  /**
   * Renames the bound variables apart from wrt and frees them.
   *
   * @return the freed variables and the resulting symbolic heap
   */
  public Bound bindExists(Set<Var> wrt) {
    return Vocabulary.bindExists(this, wrt);
  }

  /**
   * Renames the variables of the vocabulary that are in the domain of r.
   * Bound variables that clash with the range are renamed apart first.
   */
  public SymbolicHeap rename(Renaming r) {
    return Vocabulary.rename(r, this);
  }

  /**
   * Replaces the variables of the vocabulary that are in the domain of sub
   * by their images. The vocabulary loses the domain and gains the variables
   * of the images.
   */
  public SymbolicHeap subst(Substitution sub) {
    return Vocabulary.substitute(sub, this);
  }

  /**
   * Renames the variables of the vocabulary that are in wrt to fresh ones
   * and then extends the vocabulary with wrt.
   *
   * @return the result and the renaming used
   */
  public Freshened freshen(Set<Var> wrt) {
    return Vocabulary.freshen(this, wrt);
  }

  /** Extends the vocabulary by vs, renaming clashing bound variables */
  public SymbolicHeap extendUs(Set<Var> vs) {
    return Vocabulary.extendUs(vs, this);
  }

  // Queries

  /** @return whether this is the canonical inconsistent symbolic heap */
  public boolean isCanonicalFalse() {
    return djns.size() == 1 && djns.get(0).isEmpty() && heap.isEmpty();
  }

  /**
   * A sound but incomplete inconsistency check.
   *
   * @return true only if this symbolic heap is unsatisfiable
   */
  public boolean isFalse() {
    if (isCanonicalFalse() || ctx.isUnsat() || ctx.normalize(pure).isFalse()) {
      return true;
    }
    for (Disjunction djn : djns) {
      boolean allFalse = true;
      for (SymbolicHeap d : djn) {
        if (!d.isFalse()) {
          allFalse = false;
          break;
        }
      }
      if (allFalse) {
        return true;
      }
    }
    return false;
  }

  /** @return whether every model of this symbolic heap has an empty heap */
  public boolean isEmpty() {
    if (!heap.isEmpty()) {
      return false;
    }
    for (Disjunction djn : djns) {
      for (SymbolicHeap d : djn) {
        if (!d.isEmpty()) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @return a pure formula implied by this symbolic heap, so that if it is
   *         inconsistent then so is this
   */
  public Formula pureApprox() {
    ImmutableList.Builder<Formula> conjuncts = ImmutableList.builder();
    conjuncts.add(pure);
    for (Disjunction djn : djns) {
      ImmutableList.Builder<Formula> disjuncts = ImmutableList.builder();
      for (SymbolicHeap d : djn) {
        disjuncts.add(d.pureApprox());
      }
      conjuncts.add(Formula.or(disjuncts.build()));
    }
    return Formula.and(conjuncts.build());
  }

  /** @return the free variables, a subset of the vocabulary */
  public ImmutableSortedSet<Var> fv() {
    return fv(false);
  }

  /**
   * @param ignoreCtx Whether to leave out the variables of the context
   * @return the free variables, a subset of the vocabulary. The canonical
   *         false symbolic heap reports its whole vocabulary.
   */
  public ImmutableSortedSet<Var> fv(boolean ignoreCtx) {
    if (isCanonicalFalse()) {
      return us;
    }
    ImmutableSortedSet.Builder<Var> vs = ImmutableSortedSet.naturalOrder();
    occurring(ignoreCtx, vs);
    return Vars.diff(vs.build(), xs);
  }

  /** Adds the variables occurring in this clause, nested disjuncts included */
  void occurring(boolean ignoreCtx, ImmutableSortedSet.Builder<Var> vs) {
    if (!ignoreCtx) {
      vs.addAll(ctx.fv());
    }
    vs.addAll(pure.fv());
    for (Segment s : heap) {
      vs.addAll(s.fv());
    }
    for (Disjunction djn : djns) {
      for (SymbolicHeap d : djn) {
        if (!d.isCanonicalFalse()) {
          vs.addAll(d.fv(ignoreCtx));
        }
      }
    }
  }

  /**
   * Folds over the disjunctive normal form, depth first and left to right.
   * Each clause of the normal form is built by {@code folder.conj} from the
   * clauses on one path through the nested disjunctions, their bound
   * variables freed and renamed apart, and then passed with those variables
   * to {@code folder.disj}.
   *
   * @param xs The variables already bound in {@code conjuncts}
   */
  public <C, D> D foldDnf(DnfFolder<C, D> folder, Set<Var> xs, C conjuncts,
      D disjuncts) {
    return Dnf.fold(folder, this, Vars.copyOf(xs), conjuncts, disjuncts);
  }

  /** @return the clauses of the disjunctive normal form, without djns */
  public Disjunction dnf() {
    return Dnf.dnf(this);
  }

  /**
   * Checks the well-formedness of this symbolic heap and all nested ones.
   *
   * @throws IllegalStateException if it is not well formed
   */
  public void checkInvariant() {
    Preconditions.checkState(Vars.disjoint(us, xs),
        "vocabulary %s and bound variables %s overlap", us, xs);
    boolean hasEmptyDjn = false;
    for (Disjunction djn : djns) {
      hasEmptyDjn |= djn.isEmpty();
    }
    if (hasEmptyDjn) {
      Preconditions.checkState(djns.size() == 1 && heap.isEmpty()
          && xs.isEmpty() && pure.isTrue() && ctx.isEmpty(),
          "non-canonical false: %s", this);
      return;
    }
    Preconditions.checkState(!ctx.isUnsat(), "inconsistent context: %s", this);
    ImmutableSortedSet<Var> vocab = Vars.union(us, xs);
    ImmutableSortedSet.Builder<Var> used = ImmutableSortedSet.naturalOrder();
    used.addAll(ctx.fv()).addAll(pure.fv());
    for (Segment s : heap) {
      used.addAll(s.fv());
    }
    ImmutableSortedSet<Var> occurring = used.build();
    Preconditions.checkState(Vars.subset(occurring, vocab),
        "variables %s out of scope in %s", Vars.diff(occurring, vocab), this);
    for (Disjunction djn : djns) {
      for (SymbolicHeap d : djn) {
        Preconditions.checkState(d.us.equals(vocab),
            "disjunct over %s nested in clause over %s", d.us, vocab);
        d.checkInvariant();
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof SymbolicHeap)) {
      return false;
    }
    SymbolicHeap q = (SymbolicHeap) o;
    return us.equals(q.us) && xs.equals(q.xs) && ctx.equals(q.ctx)
        && pure.equals(q.pure) && heap.equals(q.heap) && djns.equals(q.djns);
  }

  @Override
  public int hashCode() {
    int h = us.hashCode();
    h = h * 31 + xs.hashCode();
    h = h * 31 + ctx.hashCode();
    h = h * 31 + pure.hashCode();
    h = h * 31 + heap.hashCode();
    return h * 31 + djns.hashCode();
  }

  @Override
  public String toString() {
    return HeapPrinter.pp(this);
  }

  /** The result of {@link SymbolicHeap#bindExists} */
  public static final class Bound {
    private final ImmutableSortedSet<Var> vars;
    private final SymbolicHeap heap;

    Bound(ImmutableSortedSet<Var> vars, SymbolicHeap heap) {
      this.vars = vars;
      this.heap = heap;
    }

    /** @return the variables that were bound and are now free */
    public ImmutableSortedSet<Var> vars() {
      return vars;
    }

    public SymbolicHeap heap() {
      return heap;
    }
  }

  /** The result of {@link SymbolicHeap#freshen} */
  public static final class Freshened {
    private final SymbolicHeap heap;
    private final Renaming renaming;

    Freshened(SymbolicHeap heap, Renaming renaming) {
      this.heap = heap;
      this.renaming = renaming;
    }

    public SymbolicHeap heap() {
      return heap;
    }

    /** @return the renaming from the original variables to the fresh ones */
    public Renaming renaming() {
      return renaming;
    }
  }
}
