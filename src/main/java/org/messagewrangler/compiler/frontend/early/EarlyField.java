package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;

/**
 * A raw message field. The type is replaced by transform passes; everything else is as parsed.
 */
public class EarlyField {

    private final String name;
    private RawType type;
    private final List<String> modifiers;
    private final String defaultRaw;
    private final String doc;
    private final String comment;
    private final SourceRef source;
    private final String declaredNamespace;

    public EarlyField(String name, RawType type, List<String> modifiers, String defaultRaw,
                      String doc, String comment, SourceRef source, String declaredNamespace) {
        this.name = name;
        this.type = type;
        this.modifiers = List.copyOf(modifiers);
        this.defaultRaw = defaultRaw;
        this.doc = doc;
        this.comment = comment;
        this.source = source;
        this.declaredNamespace = declaredNamespace;
    }

    public String name() {
        return name;
    }

    public RawType type() {
        return type;
    }

    public void setType(RawType type) {
        this.type = type;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    /**
     * Returns the default value expression exactly as written, or {@code null}.
     */
    public String defaultRaw() {
        return defaultRaw;
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

    /**
     * Returns the {@code ::}-joined names of the namespaces enclosing the declaration in its file,
     * empty for top-level messages.
     */
    public String declaredNamespace() {
        return declaredNamespace;
    }
}
