package io.tabula.core.stream;

import java.util.Objects;

/**
 * Incremental decoder that pulls one string field out of a tool-input JSON object while the object
 * is still arriving in fragments.
 *
 * <p>Contract: {@link #feed(String)} consumes the next raw fragment and returns the newly decoded
 * characters of the target field, possibly empty. Escape sequences split across fragments are
 * buffered, and a trailing high surrogate is held back until its pair arrives. Once the closing quote
 * of the field is seen {@link #complete()} turns true and further input yields nothing. Other
 * fields, including nested objects and arrays, are skipped. Only top-level keys are considered.
 */
public final class ToolInputTextExtractor {

    private enum State {
        BEFORE_OBJECT,
        EXPECT_KEY,
        IN_KEY,
        EXPECT_COLON,
        EXPECT_VALUE,
        IN_TARGET,
        IN_OTHER_STRING,
        IN_NESTED,
        IN_SCALAR,
        AFTER_VALUE,
        CLOSED
    }

    private final String field;
    private final StringBuilder key = new StringBuilder();
    private final StringBuilder text = new StringBuilder();
    private State state = State.BEFORE_OBJECT;
    private boolean escaping;
    private boolean inUnicode;
    private int unicodeDigits;
    private int unicodeValue;
    private int nesting;
    private boolean nestedString;
    private boolean complete;
    private char held;

    public ToolInputTextExtractor() {
        this("text");
    }

    public ToolInputTextExtractor(String field) {
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public String feed(String fragment) {
        if (fragment == null || fragment.isEmpty() || state == State.CLOSED) {
            return "";
        }
        StringBuilder delta = new StringBuilder();
        for (int i = 0; i < fragment.length(); i++) {
            step(fragment.charAt(i), delta);
        }
        return flush(delta);
    }

    public boolean complete() {
        return complete;
    }

    public String text() {
        return text.toString();
    }

    private void step(char c, StringBuilder delta) {
        switch (state) {
            case BEFORE_OBJECT -> {
                if (c == '{') {
                    state = State.EXPECT_KEY;
                }
            }
            case EXPECT_KEY -> {
                if (c == '"') {
                    key.setLength(0);
                    state = State.IN_KEY;
                } else if (c == '}') {
                    state = State.CLOSED;
                }
            }
            case IN_KEY -> {
                if (escaping) {
                    key.append(c);
                    escaping = false;
                } else if (c == '\\') {
                    escaping = true;
                } else if (c == '"') {
                    state = State.EXPECT_COLON;
                } else {
                    key.append(c);
                }
            }
            case EXPECT_COLON -> {
                if (c == ':') {
                    state = State.EXPECT_VALUE;
                }
            }
            case EXPECT_VALUE -> {
                if (Character.isWhitespace(c)) {
                    return;
                }
                if (c == '"') {
                    state = !complete && field.contentEquals(key) ? State.IN_TARGET : State.IN_OTHER_STRING;
                } else if (c == '{' || c == '[') {
                    nesting = 1;
                    nestedString = false;
                    state = State.IN_NESTED;
                } else {
                    state = State.IN_SCALAR;
                }
            }
            case IN_TARGET -> decode(c, delta);
            case IN_OTHER_STRING -> {
                if (escaping) {
                    escaping = false;
                } else if (c == '\\') {
                    escaping = true;
                } else if (c == '"') {
                    state = State.AFTER_VALUE;
                }
            }
            case IN_NESTED -> skipNested(c);
            case IN_SCALAR, AFTER_VALUE -> {
                if (c == ',') {
                    state = State.EXPECT_KEY;
                } else if (c == '}') {
                    state = State.CLOSED;
                }
            }
            case CLOSED -> {
                // trailing input after the object is ignored
            }
        }
    }

    private void decode(char c, StringBuilder delta) {
        if (inUnicode) {
            int digit = Character.digit(c, 16);
            unicodeValue = digit < 0 ? -1 : (unicodeValue < 0 ? -1 : unicodeValue * 16 + digit);
            if (++unicodeDigits == 4) {
                emit(unicodeValue < 0 ? '�' : (char) unicodeValue, delta);
                inUnicode = false;
            }
            return;
        }
        if (escaping) {
            escaping = false;
            switch (c) {
                case 'n' -> emit('\n', delta);
                case 't' -> emit('\t', delta);
                case 'r' -> emit('\r', delta);
                case 'b' -> emit('\b', delta);
                case 'f' -> emit('\f', delta);
                case 'u' -> {
                    inUnicode = true;
                    unicodeDigits = 0;
                    unicodeValue = 0;
                }
                default -> emit(c, delta);
            }
            return;
        }
        if (c == '\\') {
            escaping = true;
        } else if (c == '"') {
            complete = true;
            state = State.AFTER_VALUE;
        } else {
            emit(c, delta);
        }
    }

    private void skipNested(char c) {
        if (nestedString) {
            if (escaping) {
                escaping = false;
            } else if (c == '\\') {
                escaping = true;
            } else if (c == '"') {
                nestedString = false;
            }
        } else if (c == '"') {
            nestedString = true;
        } else if (c == '{' || c == '[') {
            nesting++;
        } else if ((c == '}' || c == ']') && --nesting == 0) {
            state = State.AFTER_VALUE;
        }
    }

    private void emit(char c, StringBuilder delta) {
        text.append(c);
        delta.append(c);
    }

    private String flush(StringBuilder delta) {
        if (held != 0) {
            delta.insert(0, held);
            held = 0;
        }
        int last = delta.length() - 1;
        if (last >= 0 && !complete && Character.isHighSurrogate(delta.charAt(last))) {
            held = delta.charAt(last);
            delta.setLength(last);
        }
        return delta.toString();
    }
}
