package io.github.eutro.flattening.util;

import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Function;

import java.util.*;

/**
 * Walks a graph depth-first from a root.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker. Children yielded later by the successor function are visited first.
     *
     * @param root        The root of the walk.
     * @param getChildren The successor function.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a walker over the blocks of a function reachable from its entry.
     *
     * @param func The function.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.blocks.get(0), $ -> $.getControl().targets);
    }

    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
