package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.ArrayList;
import java.util.List;

/**
 * A raw message declaration.
 */
public class EarlyMessage {

    private final String name;
    private final List<EarlyField> fields = new ArrayList<>();
    private String parentRaw;
    private final String doc;
    private final String comment;
    private final SourceRef source;

    public EarlyMessage(String name, String parentRaw, String doc, String comment, SourceRef source) {
        this.name = name;
        this.parentRaw = parentRaw;
        this.doc = doc;
        this.comment = comment;
        this.source = source;
    }

    public String name() {
        return name;
    }

    public List<EarlyField> fields() {
        return fields;
    }

    public String parentRaw() {
        return parentRaw;
    }

    public void setParentRaw(String parentRaw) {
        this.parentRaw = parentRaw;
    }

    public String doc() {
        return doc;
    }

    public String comment() {
        return comment;
    }

    public SourceRef source() {
        return source;
    }
}
