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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A decision procedure for equalities and disequalities over terms with
 * uninterpreted operators and constant offsets. A context is the congruence
 * closure of the atomic facts conjoined into it: it can tell whether the
 * facts are inconsistent, map a term to the canonical representative of its
 * equivalence class, and decide entailment of atoms.
 * <p>
 * Disjunctions are not represented; conjoining one leaves the context
 * unchanged, so a context is always implied by the formulas it was built
 * from.
 * <p>
 * Contexts are immutable. The closure is computed once when a context is
 * created.
 */
public final class Context {
  /** Orders terms by depth first, so shallow terms represent their class */
  private static final Comparator<Term> BY_DEPTH = new Comparator<Term>() {
    @Override
    public int compare(Term a, Term b) {
      if (a.depth() != b.depth()) {
        return a.depth() < b.depth() ? -1 : 1;
      }
      return a.compareTo(b);
    }
  };

  // Built after BY_DEPTH, which the constructor needs.
  private static final Context EMPTY = new Context(ImmutableSet.<Formula>of());

  /** The asserted atoms, equations and disequations, and possibly ff */
  private final ImmutableSet<Formula> facts;
  private final boolean unsat;
  /**
   * Maps every known term, and every known term with its arguments in
   * normal form, to the normal form of its class
   */
  private final ImmutableMap<Term, Term> reps;

  private final Function<Term, Term> lookup = new Function<Term, Term>() {
    @Override
    public Term apply(Term t) {
      Term rep = reps.get(t);
      return rep == null ? t : rep;
    }
  };

  private Context(ImmutableSet<Formula> facts) {
    this.facts = facts;
    Closure closure = new Closure(facts);
    this.unsat = closure.unsat;
    this.reps = closure.unsat ? ImmutableMap.<Term, Term>of() : closure.reps();
  }

  public static Context empty() {
    return EMPTY;
  }

  private static Context create(Set<Formula> facts) {
    if (facts.isEmpty()) {
      return EMPTY;
    }
    return new Context(ImmutableSet.copyOf(facts));
  }

  public boolean isUnsat() {
    return unsat;
  }

  /** @return whether no facts have been asserted */
  public boolean isEmpty() {
    return facts.isEmpty();
  }

  /** @return the asserted atoms */
  public ImmutableSet<Formula> facts() {
    return facts;
  }

  /**
   * Conjoins a formula. Atoms that are already entailed are not recorded,
   * and disjunctions are ignored.
   */
  public Context and(Formula f) {
    if (unsat || f.isTrue()) {
      return this;
    }
    Set<Formula> added = Sets.newLinkedHashSet();
    collectAtoms(f, added);
    Set<Formula> newFacts = Sets.newLinkedHashSet(facts);
    boolean changed = false;
    for (Formula atom : added) {
      if (!entails(atom)) {
        changed |= newFacts.add(atom);
      }
    }
    return changed ? create(newFacts) : this;
  }

  private static void collectAtoms(Formula f, Set<Formula> atoms) {
    switch (f.kind()) {
      case TT:
      case OR:
        break;
      case AND:
        for (Formula arg : f.args()) {
          collectAtoms(arg, atoms);
        }
        break;
      default:
        atoms.add(f);
    }
  }

  /** @return the conjunction of both contexts */
  public Context union(Context other) {
    if (other.facts.isEmpty() || unsat) {
      return this;
    }
    if (facts.isEmpty() || other.unsat) {
      return other;
    }
    return and(Formula.and(other.facts));
  }

  /**
   * @return a context that holds the facts entailed by both contexts, an
   *         over-approximation of their disjunction
   */
  public Context join(Context other) {
    if (unsat) {
      return other;
    }
    if (other.unsat) {
      return this;
    }
    if (facts.isEmpty() || other.facts.isEmpty()) {
      return EMPTY;
    }
    if (facts.equals(other.facts)) {
      return this;
    }
    Set<Formula> common = Sets.newLinkedHashSet();
    for (Formula atom : toFormula().conjuncts()) {
      if (other.entails(atom)) {
        common.add(atom);
      }
    }
    for (Formula atom : other.toFormula().conjuncts()) {
      if (entails(atom)) {
        common.add(atom);
      }
    }
    return EMPTY.and(Formula.and(common));
  }

  /**
   * Projects this context onto the variables in {@code vs}: the result holds
   * the equalities and disequalities between terms over {@code vs} that this
   * context entails through its classes.
   */
  public Context restrict(Set<Var> vs) {
    if (unsat || vs.containsAll(fv())) {
      return this;
    }
    Map<Term, List<Term>> classes = classes();
    Map<Term, Term> witness = Maps.newHashMap();
    List<Formula> kept = Lists.newArrayList();
    for (Map.Entry<Term, List<Term>> e : classes.entrySet()) {
      Term first = null;
      for (Term t : e.getValue()) {
        if (!vs.containsAll(t.fv())) {
          continue;
        }
        if (first == null) {
          first = t;
          witness.put(e.getKey(), t);
        } else {
          kept.add(Formula.eq(first, t));
        }
      }
    }
    for (Formula fact : facts) {
      if (fact.kind() == Formula.Kind.DQ) {
        Term a = witness.get(normalize(fact.left()));
        Term b = witness.get(normalize(fact.right()));
        if (a != null && b != null) {
          kept.add(Formula.dq(a, b));
        }
      }
    }
    return EMPTY.and(Formula.and(kept));
  }

  /** @return the known terms grouped by the normal form of their class */
  private Map<Term, List<Term>> classes() {
    Map<Term, List<Term>> classes = Maps.newTreeMap(BY_DEPTH);
    Set<Term> known = Sets.newTreeSet(BY_DEPTH);
    for (Formula fact : facts) {
      if (fact.kind() == Formula.Kind.EQ || fact.kind() == Formula.Kind.DQ) {
        subterms(fact.left(), known);
        subterms(fact.right(), known);
      }
    }
    for (Term t : known) {
      Term rep = normalize(t);
      List<Term> members = classes.get(rep);
      if (members == null) {
        members = Lists.newArrayList();
        classes.put(rep, members);
      }
      members.add(t);
    }
    return classes;
  }

  private static void subterms(Term t, Set<Term> into) {
    if (into.add(t) && t instanceof Apply) {
      for (Term arg : ((Apply) t).args()) {
        subterms(arg, into);
      }
    }
  }

  /** @return the normal form of t, built from class representatives */
  public Term normalize(Term t) {
    if (reps.isEmpty()) {
      return t;
    }
    return t.transform(lookup);
  }

  /**
   * @return f with every term in normal form, which folds entailed atoms to
   *         {@code tt} and refuted ones to {@code ff}
   */
  public Formula normalize(Formula f) {
    if (unsat) {
      return Formula.ff();
    }
    Formula n = reps.isEmpty() ? f : f.mapTerms(lookup);
    return refuteDisequations(n);
  }

  private Formula refuteDisequations(Formula f) {
    switch (f.kind()) {
      case EQ:
        return entailsDq(f.left(), f.right()) ? Formula.ff() : f;
      case DQ:
        return entailsDq(f.left(), f.right()) ? Formula.tt() : f;
      case AND:
      case OR: {
        List<Formula> args = Lists.newArrayList();
        boolean changed = false;
        for (Formula arg : f.args()) {
          Formula a = refuteDisequations(arg);
          changed |= a != arg;
          args.add(a);
        }
        if (!changed) {
          return f;
        }
        return f.kind() == Formula.Kind.AND ? Formula.and(args) : Formula.or(args);
      }
      default:
        return f;
    }
  }

  /** @return whether every model of this context satisfies f */
  public boolean entails(Formula f) {
    if (unsat) {
      return true;
    }
    switch (f.kind()) {
      case TT:
        return true;
      case FF:
        return false;
      case EQ:
        return normalize(f.left()).equals(normalize(f.right()));
      case DQ:
        return entailsDq(f.left(), f.right());
      case AND:
        for (Formula arg : f.args()) {
          if (!entails(arg)) {
            return false;
          }
        }
        return true;
      case OR:
        for (Formula arg : f.args()) {
          if (entails(arg)) {
            return true;
          }
        }
        return false;
      default:
        throw new AssertionError(f.kind());
    }
  }

  private boolean entailsDq(Term a, Term b) {
    Term na = normalize(a);
    Term nb = normalize(b);
    if (na.equals(nb)) {
      return false;
    }
    if (Offset.of(na).conflicts(Offset.of(nb))) {
      return true;
    }
    for (Formula fact : facts) {
      if (fact.kind() == Formula.Kind.DQ) {
        Term l = normalize(fact.left());
        Term r = normalize(fact.right());
        if ((l.equals(na) && r.equals(nb)) || (l.equals(nb) && r.equals(na))) {
          return true;
        }
      }
    }
    return false;
  }

  public ImmutableSortedSet<Var> fv() {
    ImmutableSortedSet.Builder<Var> vs = ImmutableSortedSet.naturalOrder();
    for (Formula fact : facts) {
      vs.addAll(fact.fv());
    }
    return vs.build();
  }

  /** Rebuilds this context from its facts with f applied to their terms */
  public Context mapTerms(Function<? super Term, ? extends Term> f) {
    if (facts.isEmpty()) {
      return this;
    }
    List<Formula> mapped = Lists.newArrayListWithCapacity(facts.size());
    boolean changed = false;
    for (Formula fact : facts) {
      Formula m = fact.mapTerms(f);
      changed |= m != fact;
      mapped.add(m);
    }
    if (!changed) {
      return this;
    }
    return EMPTY.and(Formula.and(mapped));
  }

  /** @return the map from every known term to its normal form */
  public Solution solution() {
    if (unsat) {
      return Solution.empty();
    }
    Map<Term, Term> sol = Maps.newLinkedHashMap();
    for (Map.Entry<Term, List<Term>> e : classes().entrySet()) {
      for (Term t : e.getValue()) {
        sol.put(t, e.getKey());
      }
    }
    return Solution.of(sol);
  }

  /**
   * @return a formula equivalent to this context: one equation per
   *         non-representative term and the asserted disequations
   */
  public Formula toFormula() {
    if (unsat) {
      return Formula.ff();
    }
    List<Formula> atoms = Lists.newArrayList();
    for (Map.Entry<Term, List<Term>> e : classes().entrySet()) {
      for (Term t : e.getValue()) {
        if (!t.equals(e.getKey())) {
          atoms.add(Formula.eq(e.getKey(), t));
        }
      }
    }
    for (Formula fact : facts) {
      if (fact.kind() == Formula.Kind.DQ) {
        atoms.add(Formula.dq(normalize(fact.left()), normalize(fact.right())));
      }
    }
    return Formula.and(atoms);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Context && facts.equals(((Context) o).facts);
  }

  @Override
  public int hashCode() {
    return facts.hashCode();
  }

  @Override
  public String toString() {
    if (unsat) {
      return "{ff}";
    }
    return "{" + Joiner.on(", ").join(facts) + "}";
  }

  /** A term split into a base and a constant offset */
  private static final class Offset {
    final Term base;
    final long offset;

    Offset(Term base, long offset) {
      this.base = base;
      this.offset = offset;
    }

    static Offset of(Term t) {
      if (t instanceof Apply) {
        Apply a = (Apply) t;
        if (a.op().equals(Term.ADD) && a.args().size() == 2
            && a.args().get(1) instanceof Const) {
          return new Offset(a.args().get(0), ((Const) a.args().get(1)).value());
        }
      }
      if (t instanceof Const) {
        return new Offset(Term.integer(0), ((Const) t).value());
      }
      return new Offset(t, 0);
    }

    /** @return whether the two terms are the same base at different offsets */
    boolean conflicts(Offset other) {
      return base.equals(other.base) && offset != other.offset;
    }
  }

  /**
   * Union-find over the subterms of the facts, closed under congruence.
   */
  private static final class Closure {
    private final Map<Term, Term> parent = Maps.newHashMap();
    private final List<Term> terms;
    boolean unsat;

    Closure(Set<Formula> facts) {
      Set<Term> known = Sets.newTreeSet(BY_DEPTH);
      List<Formula> dqs = Lists.newArrayList();
      for (Formula fact : facts) {
        if (fact.isFalse()) {
          unsat = true;
        } else {
          subterms(fact.left(), known);
          subterms(fact.right(), known);
          if (fact.kind() == Formula.Kind.DQ) {
            dqs.add(fact);
          }
        }
      }
      terms = ImmutableList.copyOf(known);
      for (Term t : terms) {
        parent.put(t, t);
      }
      for (Formula fact : facts) {
        if (fact.kind() == Formula.Kind.EQ) {
          union(fact.left(), fact.right());
        }
      }
      closeUnderCongruence();
      if (!unsat) {
        unsat = hasConflict(dqs);
      }
    }

    Term find(Term t) {
      Term p = parent.get(t);
      if (p == null || p.equals(t)) {
        return t;
      }
      Term root = find(p);
      parent.put(t, root);
      return root;
    }

    /** @return whether the classes were distinct */
    boolean union(Term a, Term b) {
      Term ra = find(a);
      Term rb = find(b);
      if (ra.equals(rb)) {
        return false;
      }
      // The smaller term stays the root.
      if (BY_DEPTH.compare(ra, rb) < 0) {
        parent.put(rb, ra);
      } else {
        parent.put(ra, rb);
      }
      return true;
    }

    private void closeUnderCongruence() {
      List<Apply> apps = Lists.newArrayList();
      for (Term t : terms) {
        if (t instanceof Apply) {
          apps.add((Apply) t);
        }
      }
      boolean changed = true;
      while (changed) {
        changed = false;
        for (int i = 0; i < apps.size(); i++) {
          for (int j = i + 1; j < apps.size(); j++) {
            Apply a = apps.get(i);
            Apply b = apps.get(j);
            if (!find(a).equals(find(b)) && congruent(a, b)) {
              changed |= union(a, b);
            }
          }
        }
      }
    }

    private boolean congruent(Apply a, Apply b) {
      if (!a.op().equals(b.op()) || a.args().size() != b.args().size()) {
        return false;
      }
      for (int i = 0; i < a.args().size(); i++) {
        if (!find(a.args().get(i)).equals(find(b.args().get(i)))) {
          return false;
        }
      }
      return true;
    }

    private boolean hasConflict(List<Formula> dqs) {
      for (Formula dq : dqs) {
        if (find(dq.left()).equals(find(dq.right()))) {
          return true;
        }
      }
      Map<Term, List<Term>> classes = Maps.newHashMap();
      for (Term t : terms) {
        Term root = find(t);
        List<Term> members = classes.get(root);
        if (members == null) {
          members = Lists.newArrayList();
          classes.put(root, members);
        }
        members.add(t);
      }
      for (List<Term> members : classes.values()) {
        for (int i = 0; i < members.size(); i++) {
          Offset oi = Offset.of(members.get(i));
          for (int j = i + 1; j < members.size(); j++) {
            Offset oj = Offset.of(members.get(j));
            if (oi.offset != oj.offset
                && find(oi.base).equals(find(oj.base))) {
              return true;
            }
          }
        }
      }
      return false;
    }

    /**
     * Computes the normal form of every class, representatives first in
     * order of depth, then keys every term both as is and with its
     * arguments in normal form.
     */
    ImmutableMap<Term, Term> reps() {
      Map<Term, Term> normal = Maps.newHashMap();
      List<Term> roots = Lists.newArrayList();
      for (Term t : terms) {
        if (find(t).equals(t)) {
          roots.add(t);
        }
      }
      Collections.sort(roots, BY_DEPTH);
      for (Term root : roots) {
        normal.put(root, withNormalArgs(root, normal));
      }
      Map<Term, Term> reps = Maps.newLinkedHashMap();
      for (Term t : terms) {
        Term rep = normal.get(find(t));
        reps.put(t, rep);
        Term n = withNormalArgs(t, normal);
        if (!reps.containsKey(n)) {
          reps.put(n, rep);
        }
      }
      for (Term rep : normal.values()) {
        if (!reps.containsKey(rep)) {
          reps.put(rep, rep);
        }
      }
      return ImmutableMap.copyOf(reps);
    }

    private Term withNormalArgs(Term t, Map<Term, Term> normal) {
      if (!(t instanceof Apply)) {
        return t;
      }
      Apply a = (Apply) t;
      ImmutableList.Builder<Term> args = ImmutableList.builder();
      for (Term arg : a.args()) {
        Term n = normal.get(find(arg));
        args.add(n == null ? arg : n);
      }
      return Term.apply(a.op(), args.build());
    }
  }
}
