package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;

/**
 * A raw enum or options declaration, written standalone or promoted from a field.
 */
public class EarlyEnum {

    /** Distinguishes plain enums from bit-flag option sets. */
    public enum Kind {
        ENUM,
        OPTIONS
    }

    private final String name;
    private final Kind kind;
    private final boolean open;
    private final List<EarlyEnumValue> values;
    private String parentRaw;
    private final String doc;
    private final String comment;
    private final SourceRef source;
    private final String promotedFrom;

    public EarlyEnum(String name, Kind kind, boolean open, List<EarlyEnumValue> values, String parentRaw,
                     String doc, String comment, SourceRef source) {
        this(name, kind, open, values, parentRaw, doc, comment, source, null);
    }

    /**
     * @param promotedFrom {@code Message.field} for enums synthesized from an inline body, else {@code null}.
     */
    public EarlyEnum(String name, Kind kind, boolean open, List<EarlyEnumValue> values, String parentRaw,
                     String doc, String comment, SourceRef source, String promotedFrom) {
        this.name = name;
        this.kind = kind;
        this.open = open;
        this.values = List.copyOf(values);
        this.parentRaw = parentRaw;
        this.doc = doc;
        this.comment = comment;
        this.source = source;
        this.promotedFrom = promotedFrom;
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isOptions() {
        return kind == Kind.OPTIONS;
    }

    public boolean isOpen() {
        return open;
    }

    public List<EarlyEnumValue> values() {
        return values;
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

    public String promotedFrom() {
        return promotedFrom;
    }

    public boolean isPromoted() {
        return promotedFrom != null;
    }
}
