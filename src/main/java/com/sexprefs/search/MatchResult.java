package com.sexprefs.search;

import com.sexprefs.reader.Span;
import com.sexprefs.sexp.Form;

public record MatchResult(Span span, Form form) {
}
