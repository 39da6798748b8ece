package com.arbor.dispatch.tree;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.arbor.dispatch.filter.Filter;

/**
 * Node of a dispatch tree.
 *
 * <p>A node holds one edge map per {@link Combinator}. Within a map, filters are unique under {@code equals}/
 * {@code hashCode}; registering an equal filter again reuses the existing child. Children are held through
 * {@link CowCell}s, so one subtree may hang under several parents and is only copied when a path through a shared cell
 * needs to change it.
 *
 * <p>Nodes are mutated only by {@link #extend(Iterable)}. Extending is not thread-safe and must not overlap with a
 * dispatch over the same tree; callers build the tree first (or synchronize externally).
 */
public final class DispatchNode implements Copyable<DispatchNode> {

	private final EnumMap<Combinator, Map<Filter, CowCell<DispatchNode>>> edges = new EnumMap<>(Combinator.class);

	public DispatchNode() {
		for (Combinator c : Combinator.values()) {
			edges.put(c, new LinkedHashMap<>());
		}
	}

	/** Read-only view of the edges of one kind, in registration order. */
	public Map<Filter, CowCell<DispatchNode>> edges(Combinator combinator) {
		return Collections.unmodifiableMap(edges.get(combinator));
	}

	public boolean isEmpty() {
		for (Map<Filter, CowCell<DispatchNode>> m : edges.values()) {
			if (!m.isEmpty()) return false;
		}
		return true;
	}

	/**
	 * Fresh node with the same edges. Children are not copied: every child cell of the copy is a shared view of the
	 * original child, so only this node is guaranteed to be new.
	 */
	@Override
	public DispatchNode copy() {
		DispatchNode node = new DispatchNode();
		for (Combinator c : Combinator.values()) {
			Map<Filter, CowCell<DispatchNode>> target = node.edges.get(c);
			edges.get(c).forEach((filter, cell) -> target.put(filter, cell.shareView()));
		}
		return node;
	}

	/** Varargs form of {@link #extend(Iterable)}. */
	public DispatchNode extend(PathStep... path) {
		return extend(Arrays.asList(path));
	}

	/**
	 * Adds a path to this tree and returns this node.
	 *
	 * <p>Each step either follows an existing edge with an equal filter (copying the child first if it is shared) or
	 * creates the edge: a supplied subtree is attached as a shared reference, otherwise a new empty node is attached. A
	 * subtree supplied for an edge that already exists is ignored. Re-adding a path that is already present changes
	 * nothing.
	 */
	public DispatchNode extend(Iterable<PathStep> path) {
		CowCell<DispatchNode> cursor = CowCell.owned(this);
		Map<Filter, CowCell<DispatchNode>> parentEdges = null;
		Filter parentFilter = null;

		for (PathStep step : path) {
			if (!cursor.isOwned()) {
				// cursor sits on a prebuilt subtree attached earlier in this path
				cursor = cursor.makeMutable();
				parentEdges.put(parentFilter, cursor);
			}
			Map<Filter, CowCell<DispatchNode>> children = cursor.view().edges.get(step.combinator());
			CowCell<DispatchNode> child = children.get(step.filter());
			if (child != null) {
				CowCell<DispatchNode> mutable = child.makeMutable();
				if (mutable != child) {
					children.put(step.filter(), mutable);
				}
				child = mutable;
			} else {
				child = (step.subtree() != null)
					? CowCell.shared(step.subtree())
					: CowCell.owned(new DispatchNode());
				children.put(step.filter(), child);
			}
			parentEdges = children;
			parentFilter = step.filter();
			cursor = child;
		}
		return this;
	}

	/** Number of distinct node objects reachable from here, this node included. */
	public int nodeCount() {
		Set<DispatchNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<DispatchNode> todo = new ArrayDeque<>();
		todo.push(this);
		while (!todo.isEmpty()) {
			DispatchNode n = todo.pop();
			if (!seen.add(n)) continue;
			for (Map<Filter, CowCell<DispatchNode>> m : n.edges.values()) {
				for (CowCell<DispatchNode> cell : m.values()) {
					todo.push(cell.view());
				}
			}
		}
		return seen.size();
	}

	@Override
	public String toString() {
		return "DispatchNode{and=" + edges.get(Combinator.AND).size()
			+ ", or=" + edges.get(Combinator.OR).size()
			+ ", catch=" + edges.get(Combinator.CATCH).size() + "}";
	}
}
