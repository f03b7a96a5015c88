package org.docweave.extractor.frontend.lexer;

import org.docweave.extractor.model.SourceSpan;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param kind The kind of the token.
 * @param span The region of the source the token covers.
 * @param text The exact text of the token from the source code.
 */
public record Token(
        TokenKind kind,
        SourceSpan span,
        String text
) {
}
