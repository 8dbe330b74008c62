package com.cliffc.lc;

import org.junit.Test;

import static com.cliffc.lc.Term.*;
import static org.junit.Assert.*;

public class TestTerm {
  // Size of every node matches a recount of its subtree
  static int check_size( Term t ) {
    int sz = 1;
    if( t instanceof Func f ) sz += check_size(f._body);
    if( t instanceof App  a ) sz += check_size(a._lhs) + check_size(a._rhs);
    assertEquals(t.toString(),sz,t.size());
    return sz;
  }

  @Test public void testFactories() {
    Var v = var(1);
    assertEquals(1,v._idx);
    Func f = fun(var(0));
    assertTrue(f._body instanceof Var);
    assertEquals(0,((Var)f._body)._idx);
    App a = app(var(0),var(1));
    assertEquals(var(0),a._lhs);
    assertEquals(var(1),a._rhs);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeIndex() { var(-1); }

  @Test public void testSize() {
    assertEquals(1,var(7).size());
    assertEquals(2,fun(var(0)).size());
    assertEquals(3,fun(fun(var(0))).size());
    assertEquals(3,app(var(0),var(1)).size());
    assertEquals(6,app(fun(var(0)),app(var(1),var(2))).size());
    check_size(Church.S);
    check_size(Church.OMEGA);
    assertEquals(7,Church.OMEGA.size());
  }

  @Test public void testEquals() {
    assertEquals(var(0),var(0));
    assertNotEquals(var(0),var(1));
    assertEquals(fun(var(0)),fun(var(0)));
    assertNotEquals(fun(var(0)),fun(var(1)));
    assertNotEquals(fun(var(0)),var(0));
    assertEquals(app(var(0),fun(var(1))),app(var(0),fun(var(1))));
    assertNotEquals(app(var(0),var(1)),app(var(1),var(0)));
    assertNotEquals(app(var(0),var(1)),fun(app(var(0),var(1))));
    // Same shape, different binder: not equal
    assertNotEquals(fun(fun(var(0))),fun(fun(var(1))));
    assertEquals(Church.S.hashCode(),Church.S.copy().hashCode());
    assertNotEquals(Church.S,null);
  }

  @Test public void testCopy() {
    Term s = Church.S;
    Term c = s.copy();
    assertEquals(s,c);
    assertNotSame(s,c);
    // No node is shared with the source term
    Func f0 = (Func)s, f1 = (Func)c;
    assertNotSame(f0._body,f1._body);
    App a0 = (App)((Func)((Func)f0._body)._body)._body;
    App a1 = (App)((Func)((Func)f1._body)._body)._body;
    assertNotSame(a0._lhs,a1._lhs);
    assertNotSame(a0._rhs,a1._rhs);
    check_size(c);
  }

  @Test public void testPrint() {
    assertEquals("5",var(5).toString());
    assertEquals("λ.(0)",fun(var(0)).toString());
    assertEquals("(0 1)",app(var(0),var(1)).toString());
    assertEquals("(λ.((0 0)) λ.((0 0)))",Church.OMEGA.toString());
    assertEquals("λ.(λ.(λ.(((0 2) (1 2)))))",Church.S.toString());
  }
}
