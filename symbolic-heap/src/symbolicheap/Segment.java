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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import symbolicheap.fol.Context;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;

/**
 * A points-to predicate: the bytes {@code seq}, {@code siz} of them, start at
 * {@code loc}, inside an allocated block of {@code len} bytes starting at
 * {@code bas}.
 * <p>
 * Segments are compared structurally by {@link #equals}, but
 * {@link SymbolicHeap#remSeg} matches by identity, so two equal segments are
 * not interchangeable there.
 */
public final class Segment {
  private final Term loc;
  private final Term bas;
  private final Term len;
  private final Term siz;
  private final Term seq;

  private Segment(Term loc, Term bas, Term len, Term siz, Term seq) {
    this.loc = loc;
    this.bas = bas;
    this.len = len;
    this.siz = siz;
    this.seq = seq;
  }

  /**
   * @param loc The start address of the described bytes
   * @param bas The start address of the enclosing block
   * @param len The length of the enclosing block
   * @param siz The number of described bytes
   * @param seq The contents of the described bytes
   */
  public static Segment create(Term loc, Term bas, Term len, Term siz,
      Term seq) {
    return new Segment(Preconditions.checkNotNull(loc),
        Preconditions.checkNotNull(bas), Preconditions.checkNotNull(len),
        Preconditions.checkNotNull(siz), Preconditions.checkNotNull(seq));
  }

  public Term loc() {
    return loc;
  }

  public Term bas() {
    return bas;
  }

  public Term len() {
    return len;
  }

  public Term siz() {
    return siz;
  }

  public Term seq() {
    return seq;
  }

  public ImmutableSortedSet<Var> fv() {
    return ImmutableSortedSet.<Var>naturalOrder()
        .addAll(loc.fv()).addAll(bas.fv()).addAll(len.fv())
        .addAll(siz.fv()).addAll(seq.fv()).build();
  }

  /** @return this segment with f applied to each field, or this if unchanged */
  public Segment mapTerms(Function<? super Term, ? extends Term> f) {
    Term newLoc = f.apply(loc);
    Term newBas = f.apply(bas);
    Term newLen = f.apply(len);
    Term newSiz = f.apply(siz);
    Term newSeq = f.apply(seq);
    if (newLoc.equals(loc) && newBas.equals(bas) && newLen.equals(len)
        && newSiz.equals(siz) && newSeq.equals(seq)) {
      return this;
    }
    return new Segment(newLoc, newBas, newLen, newSiz, newSeq);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Segment)) {
      return false;
    }
    Segment s = (Segment) o;
    return loc.equals(s.loc) && bas.equals(s.bas) && len.equals(s.len)
        && siz.equals(s.siz) && seq.equals(s.seq);
  }

  @Override
  public int hashCode() {
    int h = loc.hashCode();
    h = h * 31 + bas.hashCode();
    h = h * 31 + len.hashCode();
    h = h * 31 + siz.hashCode();
    return h * 31 + seq.hashCode();
  }

  /**
   * Prints the segment with every term replaced by its representative in
   * {@code ctx}.
   */
  public String toString(Context ctx) {
    return format(ctx.normalize(loc), ctx.normalize(bas), ctx.normalize(len),
        ctx.normalize(siz), ctx.normalize(seq));
  }

  @Override
  public String toString() {
    return format(loc, bas, len, siz, seq);
  }

  // The block is omitted when the segment covers all of it.
  private static String format(Term loc, Term bas, Term len, Term siz,
      Term seq) {
    if (loc.equals(bas) && siz.equals(len)) {
      return String.format("%s -[ %s ]-> <%s,%s>", loc, len, siz, seq);
    }
    return String.format("%s -[%s, %s)-> <%s,%s>", loc, bas, len, siz, seq);
  }
}
