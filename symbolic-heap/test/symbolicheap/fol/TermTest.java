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

import com.google.common.collect.ImmutableMap;

import junit.framework.TestCase;

/**
 * Tests for {@link Term} and its subclasses.
 */
public class TermTest extends TestCase {
  private final Var p = Var.create("p");
  private final Var q = Var.create("q");
  private final Var x = Var.create("x");

  public void testAddFoldsConstantOffsets() {
    Term p8 = Term.add(p, Term.integer(8));
    assertEquals(Term.add(p, Term.integer(16)), Term.add(p8, Term.integer(8)));
    assertEquals(p, Term.add(p, Term.integer(0)));
    assertEquals(Term.integer(7), Term.add(Term.integer(3), Term.integer(4)));
    assertEquals(p8, Term.add(Term.integer(8), p));
  }

  public void testApplyOfPlusFolds() {
    assertEquals(Term.add(p, Term.integer(8)),
        Term.apply(Term.ADD, p, Term.integer(8)));
    assertEquals("f(p, x)", Term.apply("f", p, x).toString());
  }

  public void testApplyNeedsArguments() {
    try {
      Term.apply("f");
      fail();
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("f"));
    }
  }

  public void testOrderPutsConstantsThenVariablesThenApplications() {
    Term one = Term.integer(1);
    Term app = Term.add(p, Term.integer(8));
    assertTrue(one.compareTo(x) < 0);
    assertTrue(x.compareTo(app) < 0);
    assertTrue(p.compareTo(x) < 0);
    assertEquals(0, app.compareTo(Term.add(p, Term.integer(8))));
  }

  public void testFv() {
    Term t = Term.apply("f", p, Term.add(x, Term.integer(1)));
    assertEquals(Vars.of(p, x), t.fv());
    assertTrue(Term.integer(3).fv().isEmpty());
  }

  public void testDepth() {
    assertEquals(0, x.depth());
    assertEquals(1, Term.add(x, Term.integer(1)).depth());
    assertEquals(2, Term.apply("f", Term.add(x, Term.integer(1))).depth());
  }

  public void testSubstituteRefoldsOffsets() {
    Term t = Term.add(p, Term.integer(8));
    Term image = t.substitute(
        ImmutableMap.<Var, Term>of(p, Term.add(q, Term.integer(8))));
    assertEquals(Term.add(q, Term.integer(16)), image);
  }

  public void testSubstituteKeepsUnchangedTerm() {
    Term t = Term.apply("f", p, x);
    assertSame(t, t.substitute(ImmutableMap.<Var, Term>of(q, x)));
  }

  public void testFreshVariable() {
    Var fresh = Var.fresh(x, Vars.of(x, Var.create("x", 3), p));
    assertEquals(Var.create("x", 4), fresh);
    assertEquals("x_4", fresh.toString());
    assertEquals("x", x.toString());
  }

  public void testVarsUnionAndDiff() {
    assertEquals(Vars.of(p, q, x), Vars.union(Vars.of(p, x), Vars.of(q)));
    assertEquals(Vars.of(p), Vars.diff(Vars.of(p, x), Vars.of(x, q)));
    assertEquals(Vars.of(x), Vars.inter(Vars.of(p, x), Vars.of(x, q)));
    assertTrue(Vars.disjoint(Vars.of(p), Vars.of(x, q)));
    assertFalse(Vars.disjoint(Vars.of(p, x), Vars.of(x)));
    assertTrue(Vars.subset(Vars.of(x), Vars.of(p, x)));
    assertTrue(Vars.subset(Vars.of(), Vars.of(p)));
    assertFalse(Vars.subset(Vars.of(p, q), Vars.of(p, x)));
  }
}
