package edu.isi.verbatim;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends Semiring {
	// tolerance for weight comparisons along a path
	public static final double DELTA = 1e-6;

	public double plus(double a, double b) {
		return Math.min(a, b);
	}
	public double times(double a, double b) {
		if (a == Double.POSITIVE_INFINITY || b == Double.POSITIVE_INFINITY)
			return Double.POSITIVE_INFINITY;
		return a+b;
	}
	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean approx(double a, double b) {
		if (a == b)
			return true;
		return Math.abs(a-b) <= DELTA;
	}
	public double ZERO(){return  Double.POSITIVE_INFINITY;}
	public double ONE() {
		return 0;
	}
}
