package org.yulcfg;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Multi-root breadth-first traversal. A vertex is marked as discovered when it is
 * enqueued, so each vertex is visited once even when the graph has cycles.
 * Vertices are compared by reference.
 */
public class BreadthFirstSearch<V> {

    /** 방문 콜백: (현재 정점, 자식 추가 함수) */
    public interface VertexVisitor<V> {
        void visit(V vertex, Consumer<V> addChild);
    }

    private final Deque<V> verticesToTraverse = new ArrayDeque<>();
    private final Set<V> discovered = Collections.newSetFromMap(new IdentityHashMap<>());

    @SafeVarargs
    public BreadthFirstSearch(V... roots) {
        for (V root : roots) addRoot(root);
    }

    /** Roots are visited in the order they are added; duplicates are ignored. */
    public BreadthFirstSearch<V> addRoot(V root) {
        enqueue(root);
        return this;
    }

    /** @return number of visited vertices */
    public int run(VertexVisitor<V> visitor) {
        int visited = 0;
        while (!verticesToTraverse.isEmpty()) {
            V vertex = verticesToTraverse.pollFirst();
            visitor.visit(vertex, this::enqueue);
            visited++;
        }
        return visited;
    }

    public boolean isDiscovered(V vertex) {
        return discovered.contains(vertex);
    }

    private void enqueue(V vertex) {
        if (discovered.add(vertex)) {
            verticesToTraverse.addLast(vertex);
        }
    }
}
