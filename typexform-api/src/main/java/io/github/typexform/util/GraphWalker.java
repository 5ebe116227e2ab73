package io.github.typexform.util;

import java.util.*;
import java.util.function.Function;

/**
 * Walks a possibly cyclic graph depth-first, visiting each node once.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Children are visited in the order the successor function yields them.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Iterable<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Collect the pre-order traversal of the graph to a list.
     *
     * @return The nodes, in pre-order.
     */
    public List<T> toList() {
        List<T> ls = new ArrayList<>();
        for (T t : preOrder()) {
            ls.add(t);
        }
        return ls;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.push(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.pop();
            List<T> children = new ArrayList<>();
            for (T child : getChildren.apply(top)) {
                if (seen.add(child)) {
                    children.add(child);
                }
            }
            // pushed in reverse, so the first child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return top;
        }
    }
}
