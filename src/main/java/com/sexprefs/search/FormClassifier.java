package com.sexprefs.search;

import com.sexprefs.sexp.Form;
import com.sexprefs.sexp.Symbol;

/**
 * Decides whether {@code form}, reached through {@code path}, is a genuine reference to
 * {@code target}. Implementations are pure.
 */
@FunctionalInterface
public interface FormClassifier {

    boolean matches(Symbol target, Form form, PathContext path);
}
