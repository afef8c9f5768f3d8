package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * Strongly connected components by Tarjan's algorithm, iterative so that
 * long chains do not exhaust the stack. Components are numbered in reverse
 * topological order: an arc never leads to a component with a higher number.
 */
public class Components {
	private final int[] component;
	private final int count;

	public Components(Fst f) {
		int n = f.numStates();
		component = new int[n];
		Arrays.fill(component, -1);
		int[] index = new int[n];
		int[] low = new int[n];
		boolean[] onStack = new boolean[n];
		Arrays.fill(index, -1);
		TIntArrayList stack = new TIntArrayList();
		// explicit call stack: state and position in its arc list
		TIntArrayList callState = new TIntArrayList();
		TIntArrayList callArc = new TIntArrayList();
		int next = 0;
		int comps = 0;
		for (int root = 0; root < n; root++) {
			if (index[root] >= 0)
				continue;
			callState.add(root);
			callArc.add(0);
			index[root] = low[root] = next++;
			stack.add(root);
			onStack[root] = true;
			while (!callState.isEmpty()) {
				int top = callState.size()-1;
				int s = callState.get(top);
				int ai = callArc.get(top);
				if (ai < f.numArcs(s)) {
					callArc.set(top, ai+1);
					int t = f.getArc(s, ai).getNextstate();
					if (index[t] < 0) {
						index[t] = low[t] = next++;
						stack.add(t);
						onStack[t] = true;
						callState.add(t);
						callArc.add(0);
					}
					else if (onStack[t])
						low[s] = Math.min(low[s], index[t]);
					continue;
				}
				// s finished
				if (low[s] == index[s]) {
					int t;
					do {
						t = stack.removeAt(stack.size()-1);
						onStack[t] = false;
						component[t] = comps;
					} while (t != s);
					comps++;
				}
				callState.removeAt(top);
				callArc.removeAt(top);
				if (top > 0) {
					int parent = callState.get(top-1);
					low[parent] = Math.min(low[parent], low[s]);
				}
			}
		}
		count = comps;
	}

	public int getComponent(int s) {
		return component[s];
	}

	public int numComponents() {
		return count;
	}
}
