package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * Trim: keep only states that are reachable from the start and can reach a
 * final state. Surviving states keep their relative order.
 */
public class Connector {

	public static Fst connect(Fst f) {
		if (f.isEmpty())
			return f;
		int n = f.numStates();
		boolean[] access = new boolean[n];
		TIntArrayList queue = new TIntArrayList();
		access[f.getStart()] = true;
		queue.add(f.getStart());
		for (int qi = 0; qi < queue.size(); qi++) {
			int s = queue.get(qi);
			for (int i = 0; i < f.numArcs(s); i++) {
				int t = f.getArc(s, i).getNextstate();
				if (!access[t]) {
					access[t] = true;
					queue.add(t);
				}
			}
		}
		// reverse adjacency, compressed
		int[] indeg = new int[n+1];
		for (int s = 0; s < n; s++)
			for (int i = 0; i < f.numArcs(s); i++)
				indeg[f.getArc(s, i).getNextstate()+1]++;
		for (int s = 0; s < n; s++)
			indeg[s+1] += indeg[s];
		int[] preds = new int[indeg[n]];
		int[] fill = indeg.clone();
		for (int s = 0; s < n; s++)
			for (int i = 0; i < f.numArcs(s); i++)
				preds[fill[f.getArc(s, i).getNextstate()]++] = s;
		boolean[] coaccess = new boolean[n];
		queue.clear();
		for (int s = 0; s < n; s++) {
			if (f.isFinal(s) && access[s]) {
				coaccess[s] = true;
				queue.add(s);
			}
		}
		for (int qi = 0; qi < queue.size(); qi++) {
			int t = queue.get(qi);
			for (int k = indeg[t]; k < indeg[t+1]; k++) {
				int s = preds[k];
				if (access[s] && !coaccess[s]) {
					coaccess[s] = true;
					queue.add(s);
				}
			}
		}
		if (!coaccess[f.getStart()])
			return FstBuilder.empty();
		int[] map = new int[n];
		MutableFst m = new MutableFst();
		for (int s = 0; s < n; s++) {
			if (coaccess[s]) {
				map[s] = m.addState();
				m.setFinal(map[s], f.getFinal(s));
			}
			else
				map[s] = -1;
		}
		if (m.numStates() == n)
			return f;
		for (int s = 0; s < n; s++) {
			if (map[s] < 0)
				continue;
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				if (map[a.getNextstate()] >= 0)
					m.addArc(map[s], a.moveTo(map[a.getNextstate()]));
			}
		}
		m.setStart(map[f.getStart()]);
		return m.build();
	}
}
