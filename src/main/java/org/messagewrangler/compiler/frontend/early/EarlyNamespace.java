package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.ArrayList;
import java.util.List;

/**
 * A namespace node in the {@link EarlyModel} arena. Links to the parent and to nested namespaces
 * are arena indices, never object references.
 */
public class EarlyNamespace {

    /** Marks a namespace without a parent. */
    public static final int NO_PARENT = -1;

    private final int index;
    private final String name;
    private int parentIndex;
    private final List<Integer> children = new ArrayList<>();
    private final List<EarlyMessage> messages = new ArrayList<>();
    private final List<EarlyEnum> enums = new ArrayList<>();
    private final List<EarlyEnum> options = new ArrayList<>();
    private final List<EarlyCompound> compounds = new ArrayList<>();
    private final String doc;
    private final String comment;
    private final SourceRef source;
    private String qfn;
    private boolean fileLevel;

    EarlyNamespace(int index, String name, int parentIndex, String doc, String comment, SourceRef source) {
        this.index = index;
        this.name = name;
        this.parentIndex = parentIndex;
        this.doc = doc;
        this.comment = comment;
        this.source = source;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public int parentIndex() {
        return parentIndex;
    }

    void setParentIndex(int parentIndex) {
        this.parentIndex = parentIndex;
    }

    public boolean hasParent() {
        return parentIndex != NO_PARENT;
    }

    /**
     * Returns the arena indices of the nested namespaces, in declaration order.
     */
    public List<Integer> children() {
        return children;
    }

    public List<EarlyMessage> messages() {
        return messages;
    }

    public List<EarlyEnum> enums() {
        return enums;
    }

    /**
     * Returns the standalone {@code options} declarations.
     */
    public List<EarlyEnum> options() {
        return options;
    }

    public List<EarlyCompound> compounds() {
        return compounds;
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
     * Returns the fully qualified name, or {@code null} before QFN resolution.
     */
    public String qfn() {
        return qfn;
    }

    public void setQfn(String qfn) {
        this.qfn = qfn;
    }

    public boolean isFileLevel() {
        return fileLevel;
    }

    public void setFileLevel(boolean fileLevel) {
        this.fileLevel = fileLevel;
    }

    public boolean isEmpty() {
        return children.isEmpty() && messages.isEmpty() && enums.isEmpty() && options.isEmpty() && compounds.isEmpty();
    }
}
