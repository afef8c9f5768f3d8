package edu.isi.verbatim;

import java.io.Serializable;

// a single transition. immutable
public final class Arc implements Serializable {
	private static final long serialVersionUID = 1L;

	private final int ilabel;
	private final int olabel;
	private final double weight;
	private final int nextstate;

	public Arc(int ilabel, int olabel, double weight, int nextstate) {
		this.ilabel = ilabel;
		this.olabel = olabel;
		this.weight = weight;
		this.nextstate = nextstate;
	}

	public int getIlabel() { return ilabel; }
	public int getOlabel() { return olabel; }
	public double getWeight() { return weight; }
	public int getNextstate() { return nextstate; }

	// same labels and weight, elsewhere
	public Arc moveTo(int next) {
		return new Arc(ilabel, olabel, weight, next);
	}

	public String toString() {
		return Labels.display(ilabel)+":"+Labels.display(olabel)+"/"+weight+" -> "+nextstate;
	}
}
