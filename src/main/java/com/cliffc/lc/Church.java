package com.cliffc.lc;

import org.jetbrains.annotations.NotNull;

import static com.cliffc.lc.Term.*;

/** Standard closed terms, all written at depth 0 (their outermost binder is
 *  level 0).  Use {@link Program#defineClosed} to bind them as helpers.
 */
public abstract class Church {
  // Combinators
  public static final Term I = fun(var(0));                 // λx.x
  public static final Term K = fun(fun(var(0)));            // λx.λy.x
  public static final Term S =                              // λx.λy.λz. x z (y z)
    fun(fun(fun(app(app(var(0),var(2)),app(var(1),var(2))))));
  public static final Term OMEGA = app(fun(app(var(0),var(0))),fun(app(var(0),var(0))));

  // Booleans
  public static final Term TRUE  = fun(fun(var(0)));        // λt.λf.t
  public static final Term FALSE = fun(fun(var(1)));        // λt.λf.f

  // Numerals
  public static final Term ZERO = fun(fun(var(1)));         // λf.λx.x
  public static final Term SUCC =                           // λn.λf.λx. f (n f x)
    fun(fun(fun(app(var(1),app(app(var(0),var(1)),var(2))))));
  public static final Term ADD =                            // λm.λn.λf.λx. m f (n f x)
    fun(fun(fun(fun(app(app(var(0),var(2)),app(app(var(1),var(2)),var(3)))))));
  public static final Term MULT =                           // λm.λn.λf.λx. m (n f) x
    fun(fun(fun(fun(app(app(var(0),app(var(1),var(2))),var(3))))));

  /** @return the normal form of numeral {@code n}: λf.λx. f (f ... x) */
  public static Term num( int n ) {
    if( n < 0 ) throw new IllegalArgumentException("Negative numeral "+n);
    Term body = var(1);
    for( int i=0; i<n; i++ )
      body = app(var(0),body);
    return fun(fun(body));
  }

  /** @return the value of a normal-form numeral at depth 0, or -1 if not one */
  public static int nat( @NotNull Term t ) {
    if( !(t instanceof Func f) || !(f._body instanceof Func g) ) return -1;
    int n=0;
    Term body = g._body;
    while( body instanceof App a && a._lhs instanceof Var v && v._idx==0 ) {
      n++;
      body = a._rhs;
    }
    return body instanceof Var x && x._idx==1 ? n : -1;
  }

  /** @return the value of a normal-form boolean at depth 0, or null if not one */
  public static Boolean bool( @NotNull Term t ) {
    if( t.equals(TRUE ) ) return Boolean.TRUE;
    if( t.equals(FALSE) ) return Boolean.FALSE;
    return null;
  }
}
