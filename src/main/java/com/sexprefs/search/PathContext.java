package com.sexprefs.search;

import java.util.ArrayList;
import java.util.List;

import com.sexprefs.sexp.Symbol;

/**
 * Immutable stack of {@link PathEntry} frames, innermost first.
 */
public final class PathContext {
    public static final PathContext EMPTY = new PathContext(null, null, 0);

    private final PathEntry head;
    private final PathContext parent;
    private final int depth;

    private PathContext(PathEntry head, PathContext parent, int depth) {
        this.head = head;
        this.parent = parent;
        this.depth = depth;
    }

    public static PathContext of(PathEntry... innermostFirst) {
        PathContext context = EMPTY;
        for (int i = innermostFirst.length - 1; i >= 0; i--) {
            context = context.push(innermostFirst[i]);
        }
        return context;
    }

    public PathContext push(PathEntry entry) {
        return new PathContext(entry, this, depth + 1);
    }

    public PathContext push(Symbol operator, int index) {
        return push(new PathEntry(operator, index));
    }

    public PathEntry innermost() {
        return frame(0);
    }

    public PathEntry second() {
        return frame(1);
    }

    public PathEntry third() {
        return frame(2);
    }

    /**
     * Frame {@code n} levels out from the current form, or {@code null} past the root.
     */
    public PathEntry frame(int n) {
        PathContext context = this;
        for (int i = 0; i < n && context.head != null; i++) {
            context = context.parent;
        }
        return context.head;
    }

    public int depth() {
        return depth;
    }

    public boolean isEmpty() {
        return head == null;
    }

    public List<PathEntry> toList() {
        List<PathEntry> entries = new ArrayList<>(depth);
        for (PathContext context = this; context.head != null; context = context.parent) {
            entries.add(context.head);
        }
        return entries;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PathContext that)) {
            return false;
        }
        return toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
