package org.messagewrangler.compiler.frontend.parser.ast;

import org.messagewrangler.compiler.model.Token;
import org.messagewrangler.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Comments attached to a declaration.
 *
 * @param doc     The {@code ///} doc comment lines joined with newlines, or an empty string.
 * @param comment Every attached comment (doc, local and block) joined with newlines, doc lines first.
 */
public record Comments(String doc, String comment) {

    public static final Comments NONE = new Comments("", "");

    /**
     * Builds the comments of a declaration from the comment tokens preceding it and
     * the comment tokens trailing it on its last line.
     */
    public static Comments of(List<Token> leading, List<Token> trailing) {
        List<String> docs = new ArrayList<>();
        List<String> others = new ArrayList<>();
        collect(leading, docs, others);
        collect(trailing, docs, others);
        if (docs.isEmpty() && others.isEmpty()) {
            return NONE;
        }
        List<String> all = new ArrayList<>(docs);
        all.addAll(others);
        return new Comments(String.join("\n", docs), String.join("\n", all));
    }

    private static void collect(List<Token> tokens, List<String> docs, List<String> others) {
        for (Token t : tokens) {
            if (t.type() == TokenType.DOC_COMMENT) {
                docs.add(t.text());
            } else {
                others.add(t.text());
            }
        }
    }

    public boolean hasDoc() {
        return !doc.isEmpty();
    }
}
