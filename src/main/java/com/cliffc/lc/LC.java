package com.cliffc.lc;

/** An untyped lambda calculus, De Bruijn *levels*, normal-order reduction.
 */

public abstract class LC {
  // Print the starting term and every committed reduction from normalize.
  // Off by default; -Dlc.trace=true to turn on from the command line.
  public static boolean TRACE = Boolean.getBoolean("lc.trace");

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !LC.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
