package com.treewalk.walk;

import com.treewalk.ast.Node;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy traversal over any node tree, yielding {@link Visit}s.
 *
 * <p>Children are discovered only through {@link Node#childNodes()}, never by inspecting the kind.
 * Each step takes one entry off the frontier, schedules its children one level deeper and returns
 * it. Abandoning the iteration early is always safe. A walker is single-use; create a new one to
 * walk again.</p>
 *
 * <pre>{@code
 * for (Visit visit : Walker.of(program)) {
 *     System.out.println("  ".repeat(visit.depth()) + visit.node().type());
 * }
 * }</pre>
 */
public final class Walker implements Iterator<Visit>, Iterable<Visit> {

    private final ArrayDeque<Visit> frontier = new ArrayDeque<>();
    private final TraversalOrder order;
    private boolean consumed;

    public Walker(Node root, TraversalOrder order) {
        Objects.requireNonNull(root, "root");
        this.order = Objects.requireNonNull(order, "order");
        frontier.add(new Visit(root, 0));
    }

    public static Walker of(Node root) {
        return new Walker(root, TraversalOrder.PRE_ORDER);
    }

    public static Walker of(Node root, TraversalOrder order) {
        return new Walker(root, order);
    }

    public static Stream<Visit> stream(Node root) {
        return of(root).stream();
    }

    public static Stream<Visit> stream(Node root, TraversalOrder order) {
        return of(root, order).stream();
    }

    public TraversalOrder order() {
        return order;
    }

    @Override
    public boolean hasNext() {
        return !frontier.isEmpty();
    }

    @Override
    public Visit next() {
        if (frontier.isEmpty()) {
            throw new NoSuchElementException();
        }
        Visit visit = frontier.poll();
        List<Node> children = visit.node().childNodes();
        int depth = visit.depth() + 1;
        if (order == TraversalOrder.LEVEL_ORDER) {
            for (Node child : children) {
                frontier.addLast(new Visit(child, depth));
            }
        } else {
            // pushed in reverse so the first child comes off the stack first
            for (int i = children.size() - 1; i >= 0; i--) {
                frontier.addFirst(new Visit(children.get(i), depth));
            }
        }
        return visit;
    }

    @Override
    public Iterator<Visit> iterator() {
        if (consumed) {
            throw new IllegalStateException("Walker already iterated; create a new one");
        }
        consumed = true;
        return this;
    }

    public Stream<Visit> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }
}
