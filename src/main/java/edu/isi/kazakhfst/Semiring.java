package edu.isi.kazakhfst;
import java.io.Serializable;
// how weights combine along a path (times) and across paths (plus).
// subclasses fix the operations; automata only ever ask through this interface
public abstract class Semiring implements Serializable {
	public abstract double plus(double a, double b);
	public abstract double times(double a, double b);
	// better means "closer to one"...sort of
	public abstract boolean better(double a, double b);
	public abstract boolean betteroreq(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();
	// a zero-weight arc or final state is no arc or final state at all
	public boolean isZero(double a) {
		return betteroreq(ZERO(), a);
	}
	// whether best-path search over this weight is safe (no improving cycles)
	public abstract boolean isMonotone(double a);
}
