package com.example.owlmon.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Tarjan's algorithm over a dense integer graph.
 * <p>
 * The depth-first search runs on an explicit frame stack instead of the call stack, so large
 * automata cannot overflow it. Discovery indices, low-links and the order in which components
 * are emitted are the same as in the recursive formulation: a component is emitted once all
 * components reachable from it have been emitted (reverse topological order).
 */
final class StronglyConnectedComponents {

    private static final int UNVISITED = -1;

    private StronglyConnectedComponents() {
    }

    /**
     * Computes the components reachable from {@code root}.
     *
     * @param nodeCount  number of nodes; nodes are {@code 0 .. nodeCount - 1}
     * @param root       node the search starts from
     * @param successors successor function
     * @return the components in emission order
     */
    static List<Set<Integer>> compute(int nodeCount, int root, IntFunction<? extends Iterable<Integer>> successors) {
        int[] index = new int[nodeCount];
        int[] lowLink = new int[nodeCount];
        boolean[] onStack = new boolean[nodeCount];
        Arrays.fill(index, UNVISITED);

        List<Set<Integer>> components = new ArrayList<>();
        Deque<Integer> active = new ArrayDeque<>();
        Deque<Frame> frames = new ArrayDeque<>();
        int counter = 0;

        index[root] = counter;
        lowLink[root] = counter;
        counter++;
        active.push(root);
        onStack[root] = true;
        frames.push(new Frame(root, successors.apply(root).iterator()));

        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            int node = frame.node;

            if (frame.pendingChild != UNVISITED) {
                // returning from the child's visit
                lowLink[node] = Math.min(lowLink[node], lowLink[frame.pendingChild]);
                frame.pendingChild = UNVISITED;
            }

            boolean descended = false;
            while (frame.successors.hasNext()) {
                int next = frame.successors.next();
                if (index[next] == UNVISITED) {
                    index[next] = counter;
                    lowLink[next] = counter;
                    counter++;
                    active.push(next);
                    onStack[next] = true;
                    frame.pendingChild = next;
                    frames.push(new Frame(next, successors.apply(next).iterator()));
                    descended = true;
                    break;
                } else if (onStack[next]) {
                    lowLink[node] = Math.min(lowLink[node], index[next]);
                }
            }
            if (descended) {
                continue;
            }

            frames.pop();
            if (lowLink[node] == index[node]) {
                Set<Integer> component = new LinkedHashSet<>();
                int member;
                do {
                    member = active.pop();
                    onStack[member] = false;
                    component.add(member);
                } while (member != node);
                components.add(component);
            }
        }
        return components;
    }

    private static final class Frame {
        private final int node;
        private final Iterator<Integer> successors;
        private int pendingChild = UNVISITED;

        private Frame(int node, Iterator<Integer> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
