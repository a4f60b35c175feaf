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
import com.google.common.base.Functions;

import junit.framework.TestCase;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Substitution;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

/**
 * Tests for {@link Segment}.
 */
public class SegmentTest extends TestCase {
  private final Var p = Var.create("p");
  private final Var x = Var.create("x");
  private final Var y = Var.create("y");
  private final Term eight = Term.integer(8);

  public void testFields() {
    Segment s = Segment.create(Term.add(p, eight), p, Term.integer(16), eight, x);
    assertEquals(Term.add(p, eight), s.loc());
    assertEquals(p, s.bas());
    assertEquals(Term.integer(16), s.len());
    assertEquals(eight, s.siz());
    assertEquals(x, s.seq());
    assertEquals(Vars.of(p, x), s.fv());
  }

  public void testNullFieldRejected() {
    try {
      Segment.create(p, p, eight, eight, null);
      fail();
    } catch (NullPointerException expected) {
      assertNull(expected.getMessage());
    }
  }

  public void testEqualityIsStructural() {
    Segment s = Segment.create(p, p, eight, eight, x);
    Segment t = Segment.create(p, p, eight, eight, x);
    assertNotSame(s, t);
    assertEquals(s, t);
    assertEquals(s.hashCode(), t.hashCode());
    assertFalse(s.equals(Segment.create(p, p, eight, eight, y)));
  }

  public void testMapTerms() {
    Segment s = Segment.create(p, p, eight, eight, x);
    assertSame(s, s.mapTerms(Functions.<Term>identity()));
    final Substitution sub = Substitution.of(x, y);
    Segment t = s.mapTerms(new Function<Term, Term>() {
      @Override
      public Term apply(Term term) {
        return sub.apply(term);
      }
    });
    assertEquals(Segment.create(p, p, eight, eight, y), t);
  }

  public void testToString() {
    assertEquals("p -[ 8 ]-> <8,x>",
        Segment.create(p, p, eight, eight, x).toString());
    assertEquals("(p + 8) -[p, 16)-> <8,y>", Segment.create(
        Term.add(p, eight), p, Term.integer(16), eight, y).toString());
  }

  public void testToStringThroughContext() {
    Segment s = Segment.create(p, p, eight, eight, y);
    Context ctx = Context.empty().and(Formula.eq(x, y));
    assertEquals("p -[ 8 ]-> <8,x>", s.toString(ctx));
    assertEquals("p -[ 8 ]-> <8,y>", s.toString());
  }
}
