package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.frontend.CompilerFrontendException;
import org.zerox.compiler.frontend.lexer.Token;

/**
 * Thrown by the {@link Parser} on the first syntax error. Parsing does not recover.
 */
public class ParseException extends CompilerFrontendException {

    public ParseException(CompilerErrorCode code, String detail, int line, int column) {
        super(code, detail, line, column);
    }

    /**
     * Creates an exception positioned at the given token.
     * @param code   The error code.
     * @param detail The message.
     * @param at     The offending token.
     * @return The exception.
     */
    public static ParseException at(CompilerErrorCode code, String detail, Token at) {
        return new ParseException(code, detail, at.line(), at.column());
    }
}
