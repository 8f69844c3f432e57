package org.adg.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntHeapPriorityQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Time-flow queries on diagrams read as directed graphs (line {@code from -> to}
 * means {@code from} happens before {@code to}).
 */
@UtilityClass
public class TimeFlow {

    /**
     * Kahn topological sort, smallest ready vertex first.
     *
     * @return vertices in time order; shorter than the vertex count when the diagram has a cycle.
     */
    public IntList topologicalOrder(Diagram diagram) {
        int n = diagram.vertexCount();
        int[] pending = new int[n];
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                pending[to] += diagram.lines(from, to);
            }
        }
        IntHeapPriorityQueue ready = new IntHeapPriorityQueue();
        for (int v = 0; v < n; v++) {
            if (pending[v] == 0) {
                ready.enqueue(v);
            }
        }
        IntArrayList order = new IntArrayList(n);
        while (!ready.isEmpty()) {
            int v = ready.dequeueInt();
            order.add(v);
            for (int to = 0; to < n; to++) {
                int count = diagram.lines(v, to);
                if (count > 0) {
                    pending[to] -= count;
                    if (pending[to] == 0) {
                        ready.enqueue(to);
                    }
                }
            }
        }
        return order;
    }

    public boolean isAcyclic(Diagram diagram) {
        return topologicalOrder(diagram).size() == diagram.vertexCount();
    }

    /**
     * Enumerates every linear extension of the time order.
     *
     * @param lastVertex vertex forced to the final position, or -1 for none.
     * @return orderings as vertex arrays, lexicographically ascending; empty when the diagram has a cycle
     *         or {@code lastVertex} cannot come last.
     */
    public List<int[]> linearExtensions(Diagram diagram, int lastVertex) {
        int n = diagram.vertexCount();
        int[] pending = new int[n];
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                pending[to] += diagram.lines(from, to);
            }
        }
        List<int[]> result = new ArrayList<>();
        extend(diagram, lastVertex, pending, new boolean[n], new int[n], 0, result);
        return result;
    }

    private void extend(
            Diagram diagram,
            int lastVertex,
            int[] pending,
            boolean[] placed,
            int[] prefix,
            int depth,
            List<int[]> result
    ) {
        int n = diagram.vertexCount();
        if (depth == n) {
            result.add(prefix.clone());
            return;
        }
        for (int v = 0; v < n; v++) {
            if (placed[v] || pending[v] != 0) {
                continue;
            }
            if (v == lastVertex && depth != n - 1) {
                continue;
            }
            placed[v] = true;
            prefix[depth] = v;
            for (int to = 0; to < n; to++) {
                pending[to] -= diagram.lines(v, to);
            }
            extend(diagram, lastVertex, pending, placed, prefix, depth + 1, result);
            for (int to = 0; to < n; to++) {
                pending[to] += diagram.lines(v, to);
            }
            placed[v] = false;
        }
    }

    /**
     * Strict reachability: {@code [u][w]} is true when a non-empty directed path leads from u to w.
     */
    public boolean[][] reachability(Diagram diagram) {
        int n = diagram.vertexCount();
        boolean[][] reach = new boolean[n][n];
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                reach[from][to] = diagram.lines(from, to) > 0;
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (!reach[i][k]) {
                    continue;
                }
                for (int j = 0; j < n; j++) {
                    if (reach[k][j]) {
                        reach[i][j] = true;
                    }
                }
            }
        }
        return reach;
    }

    /**
     * Successors of {@code vertex} in the transitive reduction of the time order.
     */
    public IntList immediateSuccessors(Diagram diagram, int vertex) {
        return immediateSuccessors(diagram, reachability(diagram), vertex);
    }

    private IntList immediateSuccessors(Diagram diagram, boolean[][] reach, int vertex) {
        int n = diagram.vertexCount();
        IntArrayList result = new IntArrayList();
        for (int w = 0; w < n; w++) {
            if (w == vertex || diagram.lines(vertex, w) == 0) {
                continue;
            }
            boolean direct = true;
            for (int u = 0; u < n && direct; u++) {
                if (u != vertex && u != w && reach[vertex][u] && reach[u][w]) {
                    direct = false;
                }
            }
            if (direct) {
                result.add(w);
            }
        }
        return result;
    }

    /**
     * True when every interaction vertex has at most one immediate successor among
     * interaction vertices, i.e. the time structure without the observable is a forest
     * of in-trees.
     */
    public boolean isTree(Diagram diagram) {
        boolean[][] reach = reachability(diagram);
        for (int v = 0; v < diagram.vertexCount(); v++) {
            if (diagram.kind(v) == VertexKind.OBSERVABLE) {
                continue;
            }
            int interactionSuccessors = 0;
            IntList successors = immediateSuccessors(diagram, reach, v);
            for (int i = 0; i < successors.size(); i++) {
                if (diagram.kind(successors.getInt(i)) != VertexKind.OBSERVABLE) {
                    interactionSuccessors++;
                }
            }
            if (interactionSuccessors > 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * {@code vertex} together with every vertex that happens before it, ascending.
     */
    public IntList downSet(Diagram diagram, int vertex) {
        boolean[][] reach = reachability(diagram);
        IntArrayList result = new IntArrayList();
        for (int u = 0; u < diagram.vertexCount(); u++) {
            if (u == vertex || reach[u][vertex]) {
                result.add(u);
            }
        }
        return result;
    }
}
