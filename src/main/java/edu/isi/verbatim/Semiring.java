package edu.isi.verbatim;
import java.io.Serializable;
// the general semiring over path weights. Subclasses do the operations
public abstract class Semiring implements Serializable {
	// combine alternative paths
	public abstract double plus(double a, double b);
	// extend a path
	public abstract double times(double a, double b);
	// better means "closer to one"...sort of
	public abstract boolean better(double a, double b);
	// equal up to the rounding that float sums pick up along a path
	public abstract boolean approx(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();
	public boolean isZero(double a) {
		return a == ZERO();
	}
}
