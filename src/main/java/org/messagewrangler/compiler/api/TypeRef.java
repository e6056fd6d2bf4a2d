package org.messagewrangler.compiler.api;

/**
 * A non-owning reference to an entity of a {@link Model}, resolved through {@link Model#resolve(TypeRef)}.
 *
 * @param qfn  The fully qualified name of the target.
 * @param kind The kind of the target.
 */
public record TypeRef(String qfn, Kind kind) {

    public enum Kind {
        MESSAGE,
        ENUM,
        OPTIONS
    }

    @Override
    public String toString() {
        return qfn;
    }
}
