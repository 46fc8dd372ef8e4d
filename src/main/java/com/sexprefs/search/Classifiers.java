package com.sexprefs.search;

import java.util.Set;

import com.sexprefs.sexp.Form;
import com.sexprefs.sexp.ListForm;
import com.sexprefs.sexp.Symbol;

/**
 * The reference classifiers. Binding positions are recognised from the innermost two or three
 * path frames only; a symbol rebound further out is not tracked.
 */
public final class Classifiers {
    static final Symbol DEFUN = Symbol.intern("defun");
    static final Symbol DEFSUBST = Symbol.intern("defsubst");
    static final Symbol DEFMACRO = Symbol.intern("defmacro");
    static final Symbol CL_DEFUN = Symbol.intern("cl-defun");
    static final Symbol CL_DEFMACRO = Symbol.intern("cl-defmacro");
    static final Symbol LAMBDA = Symbol.intern("lambda");
    static final Symbol LET = Symbol.intern("let");
    static final Symbol LET_STAR = Symbol.intern("let*");
    static final Symbol FUNCALL = Symbol.intern("funcall");
    static final Symbol APPLY = Symbol.intern("apply");

    // Operators whose child at index 2 is a parameter list.
    private static final Set<Symbol> DEFINERS = Set.of(DEFUN, DEFSUBST, DEFMACRO, CL_DEFUN, CL_DEFMACRO);
    private static final Set<Symbol> LET_FORMS = Set.of(LET, LET_STAR);

    private Classifiers() {
    }

    public static FormClassifier forKind(ReferenceKind kind) {
        return switch (kind) {
            case FUNCTION -> Classifiers::isFunctionReference;
            case MACRO, SPECIAL_FORM -> Classifiers::isCallReference;
            case VARIABLE -> Classifiers::isVariableReference;
            case SYMBOL -> Classifiers::isSymbolOccurrence;
        };
    }

    /**
     * {@code (target ...)}, {@code (funcall 'target ...)}, {@code (apply 'target ...)} or any
     * call passing {@code #'target}.
     */
    public static boolean isFunctionReference(Symbol target, Form form, PathContext path) {
        if (!isCall(form) || inBindingSlot(path)) {
            return false;
        }
        ListForm list = (ListForm) form;
        Symbol operator = list.operator();
        if (operator == target) {
            return true;
        }
        if ((operator == FUNCALL || operator == APPLY) && list.size() > 1
                && (isQuoted(list.get(1), Symbol.QUOTE, target) || isQuoted(list.get(1), Symbol.FUNCTION, target))) {
            return true;
        }
        for (int i = 1; i < list.size(); i++) {
            if (isQuoted(list.get(i), Symbol.FUNCTION, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Macro and special form references: literally {@code (target ...)}.
     */
    public static boolean isCallReference(Symbol target, Form form, PathContext path) {
        return isCall(form) && !inBindingSlot(path) && ((ListForm) form).operator() == target;
    }

    /**
     * The bare symbol anywhere except as the head of a call. Names bound by {@code let},
     * {@code let*} and {@code lambda} count as variables even though they sit at index 0 of a
     * binding.
     */
    public static boolean isVariableReference(Symbol target, Form form, PathContext path) {
        if (form != target) {
            return false;
        }
        PathEntry second = path.second();
        if (isLetBindingList(second) || isLetBindingList(path.third())
                || (second != null && second.is(LAMBDA, 1))) {
            return true;
        }
        PathEntry innermost = path.innermost();
        return innermost == null || !innermost.is(target, 0);
    }

    public static boolean isSymbolOccurrence(Symbol target, Form form, PathContext path) {
        return form == target;
    }

    private static boolean isCall(Form form) {
        return form instanceof ListForm list && list.isProper() && !list.isEmpty();
    }

    // Parameter lists of definers and lambdas, and let binding lists.
    private static boolean inBindingSlot(PathContext path) {
        PathEntry innermost = path.innermost();
        if (innermost != null && innermost.operator() != null) {
            if (innermost.index() == 2 && DEFINERS.contains(innermost.operator())) {
                return true;
            }
            if (innermost.is(LAMBDA, 1) || isLetBindingList(innermost)) {
                return true;
            }
        }
        return isLetBindingList(path.second());
    }

    private static boolean isLetBindingList(PathEntry entry) {
        return entry != null && entry.index() == 1 && entry.operator() != null && LET_FORMS.contains(entry.operator());
    }

    private static boolean isQuoted(Form form, Symbol quoteOperator, Symbol target) {
        return form instanceof ListForm list
                && list.isProper()
                && list.size() == 2
                && list.get(0) == quoteOperator
                && list.get(1) == target;
    }
}
