package edu.isi.kazakhfst;

// tropical is min, +, +INF, 0
// every rule in the kazakh tables is unweighted, so all arcs carry ONE
public class TropicalSemiring extends Semiring {
	public double plus(double a, double b) {
		return Math.min(a, b);
	}
	public double times(double a, double b) {
		return a+b;
	}
	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean betteroreq(double a, double b) {
		return a<=b;
	}
	public boolean isMonotone(double a) {
		return a >= 0;
	}
	public double ZERO() { return Double.POSITIVE_INFINITY; }
	public double ONE() { return 0; }
	public String toString() { return "tropical"; }
}
