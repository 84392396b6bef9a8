package org.zerox.compiler.frontend.lexer;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.frontend.CompilerFrontendException;

/**
 * Thrown by the {@link Lexer} for input it cannot tokenize at all, such as an unterminated string.
 */
public class LexerException extends CompilerFrontendException {

    public LexerException(CompilerErrorCode code, String detail, int line, int column) {
        super(code, detail, line, column);
    }
}
