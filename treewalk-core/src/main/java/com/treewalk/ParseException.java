package com.treewalk;

/**
 * Thrown for caller mistakes that prevent parsing from starting: a null source, an unknown
 * source type or a grammar that cannot be loaded. Syntax errors in the source are never thrown;
 * they are reported through {@link ParseResult#errors()}.
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
