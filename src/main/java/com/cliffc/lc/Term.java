package com.cliffc.lc;

import com.cliffc.lc.util.SB;
import org.jetbrains.annotations.NotNull;

/** Lambda terms, with variables named by De Bruijn *level*.
 *
 *  A {@link Var} index counts binders from the outermost abstraction of the
 *  tree under consideration down to its binder; e.g. {@code λ.λ.(0 1)} applies
 *  the outer argument to the inner one.  Terms are immutable, and every tree
 *  has a single owner: every rewrite (lift, subst, reduce1) builds a fresh
 *  tree sharing no node with its input, including the parts the rewrite
 *  leaves unchanged.  The node count of every subtree is computed once, at
 *  construction.
 *
 *  The only subclasses are {@link Var}, {@link Func} and {@link App}.
 */
public abstract class Term {
  public final int _size;       // Node count of this subtree
  private final int _hash;      // Structural hash

  Term( int size, int hash ) { _size=size; _hash=hash; }

  // ----------------- Factories ---------------------
  public static Var var( int idx ) {
    if( idx < 0 ) throw new IllegalArgumentException("Negative variable index "+idx);
    return new Var(idx);
  }
  public static Func fun( @NotNull Term body ) { return new Func(body); }
  public static App  app( @NotNull Term lhs, @NotNull Term rhs ) { return new App(lhs,rhs); }

  /** @return count of nodes in this subtree */
  public final int size() { return _size; }

  /** @return a deep copy, sharing nothing with this term */
  public final Term copy() { return lift(0,0); }

  /** Every variable with index {@code >= cutoff} moves up by {@code amt};
   *  the cutoff does not change under a binder.
   *  @return a new term */
  public abstract Term lift( int amt, int cutoff );

  /** Remove the binder at depth {@code idx}, replacing its variable with
   *  {@code arg}.  Variables bound deeper than {@code idx} move down by one.
   *  @param lift count of binders crossed from the redex down to here
   *  @param idx depth of the eliminated binder, from the reduction root
   *  @param arg the argument of the redex
   *  @return a new term */
  public abstract Term subst( int lift, int idx, Term arg );

  /** One step of leftmost-outermost beta-reduction.
   *  @param depth count of binders from the reduction root down to here
   *  @return the reduced term, or null if already in normal form */
  public abstract Term reduce1( int depth );
  public final Term reduce1() { return reduce1(0); }

  /** Reduce to normal form, without limits */
  public final Normal normalize() { return Normal.go(this,Normal.INF,Normal.INF); }
  public final Normal normalize( long steps ) { return Normal.go(this,steps,Normal.INF); }
  public final Normal normalize( long steps, long size ) { return Normal.go(this,steps,size); }

  // Print: λ.(body) and (lhs rhs), raw indices
  @Override public final String toString() { return str(new SB()).toString(); }
  public abstract SB str(SB sb);

  @Override public final int hashCode() { return _hash; }


  // --- Variable ------------------------
  public static final class Var extends Term {
    public final int _idx;      // De Bruijn level of the binder
    private Var( int idx ) { super(1,idx*31+1); _idx=idx; }

    @Override public Var lift( int amt, int cutoff ) {
      assert amt >= 0 && cutoff >= 0;
      return new Var(_idx < cutoff ? _idx : _idx+amt);
    }

    @Override public Term subst( int lift, int idx, Term arg ) {
      assert lift >= 0 && idx >= 0;
      if( _idx > idx ) return new Var(_idx-1); // Bound inside the redex, now one binder shallower
      if( _idx < idx ) return new Var(_idx);   // Bound outside the redex
      return arg.lift(lift,idx);               // The replaced variable
    }

    @Override public Term reduce1( int depth ) { assert depth >= 0; return null; }

    @Override public SB str(SB sb) { return sb.p(_idx); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Var v && v._idx==_idx);
    }
  }

  // --- Abstraction ------------------------
  public static final class Func extends Term {
    public final Term _body;
    private Func( Term body ) {
      super(1+body._size, body._hash*37+2);
      _body = body;
    }

    // Same cutoff: a binder does not change what is outside the whole subtree
    @Override public Func lift( int amt, int cutoff ) { return new Func(_body.lift(amt,cutoff)); }

    // One more binder between the redex and any occurrence in the body
    @Override public Func subst( int lift, int idx, Term arg ) {
      assert lift >= 0 && idx >= 0;
      return new Func(_body.subst(lift+1,idx,arg));
    }

    @Override public Func reduce1( int depth ) {
      assert depth >= 0;
      Term body = _body.reduce1(depth+1);
      return body==null ? null : new Func(body);
    }

    @Override public SB str(SB sb) { return _body.str(sb.p("λ.(")).p(')'); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Func f && f._size==_size && _body.equals(f._body));
    }
  }

  // --- Application ------------------------
  public static final class App extends Term {
    public final Term _lhs, _rhs;
    private App( Term lhs, Term rhs ) {
      super(1+lhs._size+rhs._size, (lhs._hash*41+rhs._hash)*43+3);
      _lhs = lhs;
      _rhs = rhs;
    }

    @Override public App lift( int amt, int cutoff ) {
      return new App(_lhs.lift(amt,cutoff),_rhs.lift(amt,cutoff));
    }

    @Override public App subst( int lift, int idx, Term arg ) {
      assert lift >= 0 && idx >= 0;
      return new App(_lhs.subst(lift,idx,arg),_rhs.subst(lift,idx,arg));
    }

    @Override public Term reduce1( int depth ) {
      assert depth >= 0;
      // A redex here is contracted before looking inside either side;
      // this is what makes the order leftmost-outermost.
      if( _lhs instanceof Func f )
        return f._body.subst(0,depth,_rhs);
      // The untouched side is copied, never shared
      Term lhs = _lhs.reduce1(depth);
      if( lhs != null ) return new App(lhs,_rhs.copy());
      Term rhs = _rhs.reduce1(depth);
      if( rhs != null ) return new App(_lhs.copy(),rhs);
      return null;              // Normal form
    }

    @Override public SB str(SB sb) { return _rhs.str(_lhs.str(sb.p('(')).p(' ')).p(')'); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof App a && a._size==_size && _lhs.equals(a._lhs) && _rhs.equals(a._rhs));
    }
  }
}
