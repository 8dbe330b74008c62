package com.cliffc.lc;

import com.cliffc.lc.util.SB;
import org.jetbrains.annotations.NotNull;

/** Result of driving a term to beta-normal form under a step and a size
 *  limit.  Beta-reduction need not terminate ({@code (λ.(0 0) λ.(0 0))}
 *  reduces to itself forever), so both limits are checked once per step;
 *  hitting one is reported here, not thrown.
 */
public final class Normal {
  public static final long INF = Long.MAX_VALUE; // No limit
  public static final int NO_PEAK = 0;           // Peak before any reduction

  public final Term _term;          // Last committed term
  public final long _steps;         // Committed reductions
  public final int _peak;           // Largest committed term size, or NO_PEAK
  public final boolean _step_excess;// Stopped by the step limit
  public final boolean _size_excess;// Stopped by the size limit

  private Normal( Term term, long steps, int peak, boolean step_excess, boolean size_excess ) {
    _term = term;
    _steps = steps;
    _peak = peak;
    _step_excess = step_excess;
    _size_excess = size_excess;
  }

  /** Reduce a copy of {@code t} until normal form or a limit is hit.  A
   *  candidate reduction that would break a limit is neither applied nor
   *  counted.
   *  @param step_limit max committed reductions; {@link #INF} for none
   *  @param size_limit max term size after a reduction; {@link #INF} for none */
  public static Normal go( @NotNull Term t, long step_limit, long size_limit ) {
    assert step_limit >= 0 && size_limit >= 0;
    Term rez = t.copy();
    long steps = 0;
    int peak = NO_PEAK;
    trace(0,rez);
    Term x;
    while( (x = rez.reduce1(0)) != null ) {
      if( steps == step_limit ) {
        return LC.p(new Normal(rez,steps,peak,true,false),"Step limit "+step_limit+" hit");
      }
      if( x.size() > size_limit ) {
        return LC.p(new Normal(rez,steps,peak,false,true),"Size limit "+size_limit+" hit by a term of size "+x.size()+" at step "+steps);
      }
      steps++;
      peak = Math.max(peak,x.size());
      rez = x;
      trace(steps,rez);
    }
    return new Normal(rez,steps,peak,false,false);
  }

  private static void trace( long step, Term t ) {
    if( LC.TRACE )
      System.out.println(new SB().p(step).p(": ").p(t.toString()));
  }

  /** @return true if the term reached normal form */
  public boolean done() { return !_step_excess && !_size_excess; }

  @Override public String toString() {
    SB sb = new SB().p(_term.toString()).p(" in ").p(_steps).p(" steps, peak ").p(_peak);
    if( _step_excess ) sb.p(", step limit");
    if( _size_excess ) sb.p(", size limit");
    return sb.toString();
  }
}
