package com.sexprefs.sexp;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interned symbol. Two symbols are equal only when they are the same instance, so
 * {@code Symbol.intern("foo") == Symbol.intern("foo")} while every uninterned symbol is
 * distinct from all others.
 *
 * <p>The obarray holds its symbols weakly. A name is dropped once nothing refers to its
 * symbol any more, so reading many corpora does not grow it without bound.
 */
public final class Symbol implements Form {
    private static final ConcurrentMap<String, NamedReference> OBARRAY = new ConcurrentHashMap<>();
    private static final ReferenceQueue<Symbol> CLEARED = new ReferenceQueue<>();

    public static final Symbol NIL = intern("nil");
    public static final Symbol QUOTE = intern("quote");
    public static final Symbol FUNCTION = intern("function");
    public static final Symbol BACKQUOTE = intern("`");
    public static final Symbol COMMA = intern(",");
    public static final Symbol COMMA_AT = intern(",@");

    private final String name;
    private final boolean interned;

    private Symbol(String name, boolean interned) {
        this.name = name;
        this.interned = interned;
    }

    public static Symbol intern(String name) {
        Objects.requireNonNull(name, "name");
        expungeCleared();
        while (true) {
            NamedReference current = OBARRAY.get(name);
            Symbol existing = current == null ? null : current.get();
            if (existing != null) {
                return existing;
            }
            Symbol created = new Symbol(name, true);
            NamedReference fresh = new NamedReference(created);
            boolean installed = current == null
                    ? OBARRAY.putIfAbsent(name, fresh) == null
                    : OBARRAY.replace(name, current, fresh);
            if (installed) {
                return created;
            }
        }
    }

    static int obarraySize() {
        expungeCleared();
        return OBARRAY.size();
    }

    private static void expungeCleared() {
        Reference<? extends Symbol> cleared;
        while ((cleared = CLEARED.poll()) != null) {
            NamedReference entry = (NamedReference) cleared;
            OBARRAY.remove(entry.name, entry);
        }
    }

    public static Symbol uninterned(String name) {
        return new Symbol(Objects.requireNonNull(name, "name"), false);
    }

    public String name() {
        return name;
    }

    public boolean isInterned() {
        return interned;
    }

    @Override
    public String toString() {
        return interned ? name : "#:" + name;
    }

    private static final class NamedReference extends WeakReference<Symbol> {
        private final String name;

        private NamedReference(Symbol symbol) {
            super(symbol, CLEARED);
            this.name = symbol.name;
        }
    }
}
