package com.cliffc.lc;

import com.cliffc.lc.util.Ary;
import com.cliffc.lc.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/** A program is a main term plus helper terms it references as if they were
 *  global constants.  The helpers are bound by a tower of abstractions:
 *  <pre>
 *    helpers [h0, h1, h2], main M  ==>  ((λ.((λ.((λ.M) h2)) h1)) h0)
 *  </pre>
 *  Normalizing the tower beta-substitutes each helper into its binder, so
 *  {@code Var(k)} in M names helper {@code k}.  Helper {@code k} sits under
 *  {@code k} binders and is written at that depth: its own binders start at
 *  level {@code k}, and it may reference any earlier helper.
 */
public class Program {
  private final Ary<Term> _helpers = new Ary<>(Term.class);

  /** Append a helper written at depth {@link #len()}.
   *  @return the global reference to it */
  public Term.Var define( @NotNull Term helper ) {
    _helpers.add(helper);
    return Term.var(_helpers.len()-1);
  }

  /** Append a closed term written at depth 0, relocated to the next depth.
   *  @return the global reference to it */
  public Term.Var defineClosed( @NotNull Term closed ) { return define(closed.lift(len(),0)); }

  /** @return the reference to helper {@code k} */
  public Term.Var glb( int k ) {
    if( k < 0 || k >= len() ) throw new IllegalArgumentException("No helper "+k+", only "+len()+" defined");
    return Term.var(k);
  }

  /** @return the {@code i}th binder of a term being written at the top of the
   *  tower; either the next helper or main */
  public Term.Var loc( int i ) { return Term.var(len()+i); }

  /** @return helper {@code k}, as written at depth {@code k} */
  public Term helper( int k ) { return _helpers.at(k); }

  /** @return number of helpers */
  public int len() { return _helpers.len(); }

  /** @return the binding tower over all helpers, around main */
  public Term build( @NotNull Term main ) { return tower(_helpers,main); }

  public Normal run( @NotNull Term main ) { return build(main).normalize(); }
  public Normal run( @NotNull Term main, long steps, long size ) { return build(main).normalize(steps,size); }

  // One helper per line, with its global index
  @Override public String toString() {
    SB sb = new SB().p("helpers").nl().ii(1);
    int k=0;
    for( Term h : _helpers )
      h.str(sb.i().p(k++).p(": ")).nl();
    return sb.di(1).toString();
  }

  /** Build the binding tower.  Reduces nothing; with no helpers, a copy of main. */
  public static Term tower( @NotNull Ary<Term> helpers, @NotNull Term main ) { return tower(helpers.asAry(),0,main); }
  public static Term tower( @NotNull List<Term> helpers, @NotNull Term main ) { return tower(helpers.toArray(new Term[0]),0,main); }

  private static Term tower( Term[] helpers, int i, Term main ) {
    if( i==helpers.length ) return main.copy();
    return Term.app(Term.fun(tower(helpers,i+1,main)),helpers[i].copy());
  }
}
