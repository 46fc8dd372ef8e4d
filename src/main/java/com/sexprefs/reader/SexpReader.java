package com.sexprefs.reader;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.sexprefs.sexp.CharAtom;
import com.sexprefs.sexp.Form;
import com.sexprefs.sexp.ListForm;
import com.sexprefs.sexp.NumberAtom;
import com.sexprefs.sexp.StringAtom;
import com.sexprefs.sexp.Symbol;
import com.sexprefs.sexp.VectorForm;

/**
 * Reads Emacs Lisp source text into top-level forms, recording where every leaf symbol was
 * read from.
 *
 * <p>Reading stops quietly at the end of the text or at a trailing form that the text cuts
 * short. Any other syntax problem raises {@link SexpReadException}.
 */
public class SexpReader {
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+\\.?");
    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:e(?:[+-]?[0-9]+|\\+INF|\\+NaN))?");

    private static final int ALT = 1 << 22;
    private static final int SUPER = 1 << 23;
    private static final int HYPER = 1 << 24;
    private static final int SHIFT = 1 << 25;
    private static final int CTRL = 1 << 26;
    private static final int META = 1 << 27;
    private static final int MODIFIERS = ALT | SUPER | HYPER | SHIFT | CTRL | META;

    private static final char NO_BREAK_SPACE = '\u00A0';
    private static final char REPLACEMENT_CHARACTER = '\uFFFD';
    private static final int MAX_CHAR = 0x3FFFFF;
    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9A-Fa-f]+");

    // Marks input that ended inside a form; never escapes this class.
    private static final Form TRUNCATED = new Form() {
        @Override
        public String toString() {
            return "#<truncated>";
        }
    };
    private static final int TRUNCATED_CHAR = -1;

    public List<PositionedForm> readAll(String text) {
        List<PositionedForm> forms = new ArrayList<>();
        int pos = 0;
        while (true) {
            int start = skipAtmosphere(text, pos);
            if (start >= text.length()) {
                break;
            }
            Cursor cursor = new Cursor(text, start, true);
            Form form = read(cursor);
            if (form == TRUNCATED) {
                break;
            }
            forms.add(new PositionedForm(form, new Span(start, cursor.pos), cursor.relativeOccurrences(start)));
            pos = cursor.pos;
        }
        return forms;
    }

    /**
     * Span of the next complete expression at or after {@code from}, skipping whitespace and
     * comments, or {@code null} when the text ends before one completes.
     */
    public Span scanExpression(String text, int from) {
        int start = skipAtmosphere(text, from);
        if (start >= text.length()) {
            return null;
        }
        Cursor cursor = new Cursor(text, start, false);
        Form form = read(cursor);
        return form == TRUNCATED ? null : new Span(start, cursor.pos);
    }

    /**
     * Skips whitespace, {@code ;} comments and {@code #!} comment lines.
     */
    public static int skipAtmosphere(String text, int pos) {
        int length = text.length();
        while (pos < length) {
            char ch = text.charAt(pos);
            if (ch <= ' ' || ch == NO_BREAK_SPACE) {
                pos++;
            } else if (ch == ';' || (ch == '#' && pos + 1 < length && text.charAt(pos + 1) == '!')) {
                while (pos < length && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
        return pos;
    }

    /**
     * True when a lone {@code .} token (dotted-pair marker) starts at {@code pos}.
     */
    public static boolean isDotToken(String text, int pos) {
        if (pos >= text.length() || text.charAt(pos) != '.') {
            return false;
        }
        return pos + 1 >= text.length() || isTerminator(text.charAt(pos + 1));
    }

    static boolean isTerminator(char ch) {
        return ch <= ' ' || ch == NO_BREAK_SPACE
                || ch == '"' || ch == '\'' || ch == ';' || ch == '#'
                || ch == '(' || ch == ')' || ch == '[' || ch == ']'
                || ch == '`' || ch == ',';
    }

    private Form read(Cursor c) {
        String text = c.text;
        c.pos = skipAtmosphere(text, c.pos);
        if (c.pos >= text.length()) {
            return TRUNCATED;
        }
        int start = c.pos;
        char ch = text.charAt(start);
        switch (ch) {
            case '(':
                c.pos++;
                return readList(c);
            case '[':
                c.pos++;
                return readVector(c);
            case ')':
            case ']':
                throw new SexpReadException(start, "Unexpected '" + ch + "'");
            case '"':
                c.pos++;
                return readString(c);
            case '\'':
                return readShorthand(c, start, 1, Symbol.QUOTE);
            case '`':
                return readShorthand(c, start, 1, Symbol.BACKQUOTE);
            case ',':
                if (start + 1 < text.length() && text.charAt(start + 1) == '@') {
                    return readShorthand(c, start, 2, Symbol.COMMA_AT);
                }
                return readShorthand(c, start, 1, Symbol.COMMA);
            case '?':
                c.pos++;
                return readCharacter(c);
            case '#':
                return readDispatch(c, start);
            default:
                return readAtom(c, start);
        }
    }

    private Form readList(Cursor c) {
        String text = c.text;
        List<Form> elements = new ArrayList<>();
        while (true) {
            c.pos = skipAtmosphere(text, c.pos);
            if (c.pos >= text.length()) {
                return TRUNCATED;
            }
            char ch = text.charAt(c.pos);
            if (ch == ')') {
                c.pos++;
                return new ListForm(elements, null);
            }
            if (ch == ']') {
                throw new SexpReadException(c.pos, "Mismatched ']' inside list");
            }
            if (isDotToken(text, c.pos)) {
                return readDottedTail(c, elements);
            }
            Form element = read(c);
            if (element == TRUNCATED) {
                return TRUNCATED;
            }
            elements.add(element);
        }
    }

    private Form readDottedTail(Cursor c, List<Form> elements) {
        String text = c.text;
        if (elements.isEmpty()) {
            throw new SexpReadException(c.pos, "Invalid '.' at the start of a list");
        }
        c.pos++;
        int tailStart = skipAtmosphere(text, c.pos);
        if (tailStart < text.length() && text.charAt(tailStart) == ')') {
            throw new SexpReadException(tailStart, "Missing form after '.'");
        }
        Form tail = read(c);
        if (tail == TRUNCATED) {
            return TRUNCATED;
        }
        c.pos = skipAtmosphere(text, c.pos);
        if (c.pos >= text.length()) {
            return TRUNCATED;
        }
        if (text.charAt(c.pos) != ')') {
            throw new SexpReadException(c.pos, "Expected ')' after dotted tail");
        }
        c.pos++;

        if (tail == Symbol.NIL) {
            return new ListForm(elements, null);
        }
        // Covers quote shorthands too: (a . 'b) is (a quote b).
        if (tail instanceof ListForm tailList) {
            List<Form> joined = new ArrayList<>(elements);
            joined.addAll(tailList.elements());
            return new ListForm(joined, tailList.tail());
        }
        return ListForm.dotted(elements, tail);
    }

    private Form readVector(Cursor c) {
        String text = c.text;
        List<Form> elements = new ArrayList<>();
        while (true) {
            c.pos = skipAtmosphere(text, c.pos);
            if (c.pos >= text.length()) {
                return TRUNCATED;
            }
            char ch = text.charAt(c.pos);
            if (ch == ']') {
                c.pos++;
                return new VectorForm(elements);
            }
            if (ch == ')') {
                throw new SexpReadException(c.pos, "Mismatched ')' inside vector");
            }
            Form element = read(c);
            if (element == TRUNCATED) {
                return TRUNCATED;
            }
            elements.add(element);
        }
    }

    private Form readShorthand(Cursor c, int start, int prefixLength, Symbol operator) {
        c.recordShorthand(operator, start, prefixLength);
        c.pos = start + prefixLength;
        Form quoted = read(c);
        if (quoted == TRUNCATED) {
            return TRUNCATED;
        }
        return ListForm.of(operator, quoted);
    }

    private Form readString(Cursor c) {
        String text = c.text;
        StringBuilder value = new StringBuilder();
        while (c.pos < text.length()) {
            char ch = text.charAt(c.pos++);
            if (ch == '"') {
                return new StringAtom(value.toString());
            }
            if (ch != '\\') {
                value.append(ch);
                continue;
            }
            if (c.pos >= text.length()) {
                return TRUNCATED;
            }
            char escape = text.charAt(c.pos);
            if (escape == '\n' || escape == ' ') {
                c.pos++;
                continue;
            }
            int decoded = readEscape(c);
            if (decoded == TRUNCATED_CHAR) {
                return TRUNCATED;
            }
            int codePoint = decoded & ~MODIFIERS;
            // Raw bytes and other Emacs-only chars have no Unicode counterpart.
            if (codePoint > Character.MAX_CODE_POINT) {
                value.append(REPLACEMENT_CHARACTER);
            } else {
                value.appendCodePoint(codePoint);
            }
        }
        return TRUNCATED;
    }

    private Form readCharacter(Cursor c) {
        String text = c.text;
        if (c.pos >= text.length()) {
            return TRUNCATED;
        }
        int codePoint = readCharBody(c);
        if (codePoint == TRUNCATED_CHAR) {
            return TRUNCATED;
        }
        return new CharAtom(codePoint);
    }

    private int readCharBody(Cursor c) {
        String text = c.text;
        if (c.pos >= text.length()) {
            return TRUNCATED_CHAR;
        }
        int ch = text.codePointAt(c.pos);
        c.pos += Character.charCount(ch);
        if (ch == '\\') {
            return readEscape(c);
        }
        return ch;
    }

    // c.pos sits just after the backslash.
    private int readEscape(Cursor c) {
        String text = c.text;
        if (c.pos >= text.length()) {
            return TRUNCATED_CHAR;
        }
        int escapeAt = c.pos;
        char escape = text.charAt(c.pos++);
        switch (escape) {
            case 'C':
                if (followedByDash(c)) {
                    return control(readCharBody(c));
                }
                return escape;
            case '^':
                return control(readCharBody(c));
            case 'M':
                return followedByDash(c) ? withModifier(readCharBody(c), META) : escape;
            case 'S':
                return followedByDash(c) ? withModifier(readCharBody(c), SHIFT) : escape;
            case 'H':
                return followedByDash(c) ? withModifier(readCharBody(c), HYPER) : escape;
            case 'A':
                return followedByDash(c) ? withModifier(readCharBody(c), ALT) : escape;
            case 's':
                return followedByDash(c) ? withModifier(readCharBody(c), SUPER) : ' ';
            case 'a':
                return 7;
            case 'b':
                return '\b';
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'v':
                return 11;
            case 'f':
                return '\f';
            case 'r':
                return '\r';
            case 'e':
                return 27;
            case 'd':
                return 127;
            case 'x':
                return readHexDigits(c, escapeAt, 0, Integer.MAX_VALUE);
            case 'u':
                return readHexDigits(c, escapeAt, 4, 4);
            case 'U':
                return readHexDigits(c, escapeAt, 8, 8);
            case 'N':
                return readNamedCharacter(c, escapeAt);
            default:
                if (escape >= '0' && escape <= '7') {
                    int value = escape - '0';
                    for (int i = 0; i < 2 && c.pos < text.length(); i++) {
                        char digit = text.charAt(c.pos);
                        if (digit < '0' || digit > '7') {
                            break;
                        }
                        value = value * 8 + (digit - '0');
                        c.pos++;
                    }
                    return value;
                }
                c.pos = escapeAt;
                int literal = text.codePointAt(c.pos);
                c.pos += Character.charCount(literal);
                return literal;
        }
    }

    private boolean followedByDash(Cursor c) {
        if (c.pos < c.text.length() && c.text.charAt(c.pos) == '-') {
            c.pos++;
            return true;
        }
        return false;
    }

    private static int withModifier(int ch, int modifier) {
        return ch == TRUNCATED_CHAR ? TRUNCATED_CHAR : ch | modifier;
    }

    private static int control(int ch) {
        if (ch == TRUNCATED_CHAR) {
            return TRUNCATED_CHAR;
        }
        int base = ch & ~MODIFIERS;
        int modifiers = ch & MODIFIERS;
        if (base == '?') {
            return 127 | modifiers;
        }
        if ((base >= '@' && base <= '_') || (base >= 'a' && base <= 'z')) {
            return (base & 31) | modifiers;
        }
        return ch | CTRL;
    }

    private int readHexDigits(Cursor c, int escapeAt, int minDigits, int maxDigits) {
        String text = c.text;
        int value = 0;
        int digits = 0;
        while (digits < maxDigits && c.pos < text.length()) {
            int digit = Character.digit(text.charAt(c.pos), 16);
            if (digit < 0) {
                break;
            }
            value = value * 16 + digit;
            if (value > MAX_CHAR) {
                throw new SexpReadException(escapeAt, "Character code out of range");
            }
            digits++;
            c.pos++;
        }
        if (digits < minDigits) {
            if (c.pos >= text.length()) {
                return TRUNCATED_CHAR;
            }
            throw new SexpReadException(escapeAt, "Expected " + minDigits + " hex digits in escape");
        }
        return value;
    }

    private int readNamedCharacter(Cursor c, int escapeAt) {
        String text = c.text;
        if (c.pos >= text.length()) {
            return TRUNCATED_CHAR;
        }
        if (text.charAt(c.pos) != '{') {
            throw new SexpReadException(escapeAt, "Expected '{' after \\N");
        }
        int close = text.indexOf('}', c.pos);
        if (close < 0) {
            return TRUNCATED_CHAR;
        }
        String name = text.substring(c.pos + 1, close).replaceAll("\\s+", " ").trim();
        c.pos = close + 1;
        if (name.startsWith("U+")) {
            return parseCodePointName(name, escapeAt);
        }
        try {
            return Character.codePointOf(name);
        } catch (IllegalArgumentException e) {
            throw new SexpReadException(escapeAt, "Unknown character name '" + name + "'", e);
        }
    }

    private static int parseCodePointName(String name, int escapeAt) {
        String digits = name.substring(2);
        if (!HEX_DIGITS.matcher(digits).matches()) {
            throw new SexpReadException(escapeAt, "Invalid code point name '" + name + "'");
        }
        int value;
        try {
            value = Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new SexpReadException(escapeAt, "Character code out of range in '" + name + "'", e);
        }
        if (value > MAX_CHAR) {
            throw new SexpReadException(escapeAt, "Character code out of range in '" + name + "'");
        }
        return value;
    }

    private Form readDispatch(Cursor c, int start) {
        String text = c.text;
        if (start + 1 >= text.length()) {
            return TRUNCATED;
        }
        char dispatch = text.charAt(start + 1);
        switch (dispatch) {
            case '\'':
                return readShorthand(c, start, 2, Symbol.FUNCTION);
            case '(':
                return readPropertizedString(c, start);
            case '[':
                c.pos = start + 2;
                return readVector(c);
            case 's':
                return readRecord(c, start);
            case '&':
                return readBoolVector(c, start);
            case '^':
                return readCharTable(c, start);
            case ':': {
                c.pos = start + 2;
                Token token = readToken(c);
                if (token == null) {
                    return TRUNCATED;
                }
                Symbol symbol = Symbol.uninterned(token.name());
                c.record(symbol, start, c.pos - start);
                return symbol;
            }
            case '#':
                c.pos = start + 2;
                c.record(Symbol.intern(""), start, 2);
                return Symbol.intern("");
            case '_': {
                c.pos = start + 2;
                Token token = readToken(c);
                if (token == null) {
                    return TRUNCATED;
                }
                Symbol symbol = Symbol.intern(token.name());
                c.record(symbol, start, c.pos - start);
                return symbol;
            }
            case 'x':
            case 'X':
                return readRadixInteger(c, start, start + 2, 16);
            case 'o':
            case 'O':
                return readRadixInteger(c, start, start + 2, 8);
            case 'b':
            case 'B':
                return readRadixInteger(c, start, start + 2, 2);
            default:
                if (Character.isDigit(dispatch)) {
                    return readNumberedDispatch(c, start);
                }
                throw new SexpReadException(start, "Invalid read syntax '#" + dispatch + "'");
        }
    }

    private Form readPropertizedString(Cursor c, int start) {
        c.pos = start + 2;
        Form list = readList(c);
        if (list == TRUNCATED) {
            return TRUNCATED;
        }
        ListForm properties = (ListForm) list;
        if (properties.isEmpty() || !(properties.get(0) instanceof StringAtom)) {
            throw new SexpReadException(start, "Invalid string property list");
        }
        return properties.get(0);
    }

    private Form readRecord(Cursor c, int start) {
        String text = c.text;
        if (start + 2 >= text.length()) {
            return TRUNCATED;
        }
        if (text.charAt(start + 2) != '(') {
            throw new SexpReadException(start, "Invalid read syntax '#s'");
        }
        c.pos = start + 3;
        Form list = readList(c);
        if (list == TRUNCATED) {
            return TRUNCATED;
        }
        ListForm fields = (ListForm) list;
        if (!fields.isProper()) {
            throw new SexpReadException(start, "Record literal cannot be a dotted list");
        }
        return new VectorForm(fields.elements());
    }

    // #&N"..." packs N bits into (N + 7) / 8 string chars.
    private Form readBoolVector(Cursor c, int start) {
        String text = c.text;
        int pos = start + 2;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos >= text.length()) {
            return TRUNCATED;
        }
        if (pos == start + 2 || text.charAt(pos) != '"') {
            throw new SexpReadException(start, "Invalid bool-vector syntax");
        }
        long length;
        try {
            length = Long.parseLong(text.substring(start + 2, pos));
        } catch (NumberFormatException e) {
            throw new SexpReadException(start, "Bool-vector length too large", e);
        }
        c.pos = pos + 1;
        Form bits = readString(c);
        if (bits == TRUNCATED) {
            return TRUNCATED;
        }
        int chars = ((StringAtom) bits).value().length();
        if (chars != (length + 7) / 8 && length != (chars - 1) * 8L) {
            throw new SexpReadException(start, "Bool-vector length " + length + " does not match its data");
        }
        return new VectorForm(List.of(bits));
    }

    // #^[...] is a char-table, #^^[...] a sub-char-table.
    private Form readCharTable(Cursor c, int start) {
        String text = c.text;
        int pos = start + 2;
        if (pos < text.length() && text.charAt(pos) == '^') {
            pos++;
        }
        if (pos >= text.length()) {
            return TRUNCATED;
        }
        if (text.charAt(pos) != '[') {
            throw new SexpReadException(start, "Invalid char-table syntax");
        }
        c.pos = pos + 1;
        return readVector(c);
    }

    private Form readNumberedDispatch(Cursor c, int start) {
        String text = c.text;
        int pos = start + 1;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos >= text.length()) {
            return TRUNCATED;
        }
        int number;
        try {
            number = Integer.parseInt(text.substring(start + 1, pos));
        } catch (NumberFormatException e) {
            throw new SexpReadException(start, "Read label too large", e);
        }
        char kind = text.charAt(pos);
        if (kind == 'r') {
            if (number < 2 || number > 36) {
                throw new SexpReadException(start, "Invalid radix " + number);
            }
            return readRadixInteger(c, start, pos + 1, number);
        }
        if (kind == '=') {
            c.pos = pos + 1;
            Form labelled = read(c);
            if (labelled == TRUNCATED) {
                return TRUNCATED;
            }
            c.labels.put(number, labelled);
            return labelled;
        }
        if (kind == '#') {
            c.pos = pos + 1;
            Form labelled = c.labels.get(number);
            if (labelled != null) {
                return labelled;
            }
            if (!c.recording) {
                return Symbol.NIL;
            }
            throw new SexpReadException(start, "Undefined read label #" + number + "#");
        }
        throw new SexpReadException(start, "Invalid read syntax '#" + number + kind + "'");
    }

    private Form readRadixInteger(Cursor c, int start, int digitsStart, int radix) {
        c.pos = digitsStart;
        Token token = readToken(c);
        if (token == null) {
            return TRUNCATED;
        }
        if (token.name().isEmpty()) {
            if (c.pos >= c.text.length()) {
                return TRUNCATED;
            }
            throw new SexpReadException(start, "Missing digits after radix prefix");
        }
        String digits = token.name().startsWith("+") ? token.name().substring(1) : token.name();
        try {
            return new NumberAtom(new BigInteger(digits, radix));
        } catch (NumberFormatException e) {
            throw new SexpReadException(start, "Invalid base-" + radix + " integer '" + token.name() + "'", e);
        }
    }

    private Form readAtom(Cursor c, int start) {
        Token token = readToken(c);
        if (token == null) {
            return TRUNCATED;
        }
        String name = token.name();
        if (!token.escaped()) {
            if (".".equals(name)) {
                throw new SexpReadException(start, "Invalid '.' outside of a list");
            }
            if (INTEGER.matcher(name).matches()) {
                String digits = name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
                if (digits.startsWith("+")) {
                    digits = digits.substring(1);
                }
                return new NumberAtom(new BigInteger(digits));
            }
            if (FLOAT.matcher(name).matches()) {
                return new NumberAtom(parseFloat(name));
            }
        }
        Symbol symbol = Symbol.intern(name);
        c.record(symbol, start, c.pos - start);
        return symbol;
    }

    private static double parseFloat(String token) {
        boolean negative = token.startsWith("-");
        if (token.endsWith("e+INF")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (token.endsWith("e+NaN")) {
            return Double.NaN;
        }
        return Double.parseDouble(token);
    }

    /**
     * Reads a symbol-constituent run, un-escaping backslashes. Returns {@code null} when the
     * text ends right after a backslash.
     */
    private Token readToken(Cursor c) {
        String text = c.text;
        StringBuilder name = new StringBuilder();
        boolean escaped = false;
        while (c.pos < text.length()) {
            char ch = text.charAt(c.pos);
            if (ch == '\\') {
                if (c.pos + 1 >= text.length()) {
                    return null;
                }
                escaped = true;
                name.append(text.charAt(c.pos + 1));
                c.pos += 2;
                continue;
            }
            if (isTerminator(ch)) {
                break;
            }
            name.append(ch);
            c.pos++;
        }
        return new Token(name.toString(), escaped);
    }

    private record Token(String name, boolean escaped) {
    }

    private static final class Cursor {
        private final String text;
        private final boolean recording;
        private final List<SymbolOccurrence> occurrences = new ArrayList<>();
        private final Map<Integer, Form> labels = new HashMap<>();
        private int pos;

        private Cursor(String text, int pos, boolean recording) {
            this.text = text;
            this.pos = pos;
            this.recording = recording;
        }

        // Offsets are absolute until relativeOccurrences() rebases them.
        private void record(Symbol symbol, int offset, int length) {
            if (recording) {
                occurrences.add(new SymbolOccurrence(symbol, offset, length));
            }
        }

        private void recordShorthand(Symbol operator, int offset, int length) {
            if (recording) {
                occurrences.add(new SymbolOccurrence(operator, offset, length, true));
            }
        }

        private List<SymbolOccurrence> relativeOccurrences(int formStart) {
            List<SymbolOccurrence> relative = new ArrayList<>(occurrences.size());
            for (SymbolOccurrence occurrence : occurrences) {
                relative.add(new SymbolOccurrence(
                        occurrence.symbol(), occurrence.offset() - formStart, occurrence.length(), occurrence.shorthand()));
            }
            return relative;
        }
    }
}
