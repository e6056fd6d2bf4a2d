package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyField;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;
import org.messagewrangler.compiler.frontend.early.EarlyNamespace;
import org.messagewrangler.compiler.frontend.early.RawType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifts inline enum and options bodies out of field types into named enums.
 * <p>
 * The synthesized enum is called {@code {Message}_{field}} and is added to the namespace enclosing the
 * message; the field is rewritten to a reference to its QFN. Inline bodies used as array elements or
 * map values are promoted the same way. Fields without an inline body are untouched.
 */
public class PromoteInlineEnums implements IEarlyTransform {

    private static final Logger log = LoggerFactory.getLogger(PromoteInlineEnums.class);

    @Override
    public EarlyModel apply(EarlyModel model) {
        int promoted = 0;
        for (EarlyNamespace ns : model.namespacesDepthFirst()) {
            for (EarlyMessage message : ns.messages()) {
                for (EarlyField field : message.fields()) {
                    if (field.type().containsInline()) {
                        field.setType(promote(ns, message, field, field.type()));
                        promoted++;
                    }
                }
            }
        }
        if (promoted > 0) {
            log.debug("{}: promoted {} inline enums", model.file(), promoted);
        }
        return model;
    }

    /**
     * Returns the name of the enum promoted from a field's inline body.
     */
    public static String promotedName(EarlyMessage message, EarlyField field) {
        return message.name() + "_" + field.name();
    }

    private RawType promote(EarlyNamespace ns, EarlyMessage message, EarlyField field, RawType type) {
        if (type instanceof RawType.InlineEnum inline) {
            return register(ns, message, field, EarlyEnum.Kind.ENUM, inline.open(), inline);
        }
        if (type instanceof RawType.InlineOptions inline) {
            return register(ns, message, field, EarlyEnum.Kind.OPTIONS, false, inline);
        }
        if (type instanceof RawType.Array array) {
            return new RawType.Array(promote(ns, message, field, array.element()));
        }
        if (type instanceof RawType.MapOf map) {
            return new RawType.MapOf(map.key(), promote(ns, message, field, map.value()));
        }
        return type;
    }

    private RawType register(EarlyNamespace ns, EarlyMessage message, EarlyField field,
                             EarlyEnum.Kind kind, boolean open, RawType inline) {
        String name = promotedName(message, field);
        var values = inline instanceof RawType.InlineEnum e ? e.values() : ((RawType.InlineOptions) inline).values();
        ns.enums().add(new EarlyEnum(name, kind, open, values, null, field.doc(), field.comment(), field.source(),
                message.name() + "." + field.name()));
        String qualifier = ns.qfn() != null ? ns.qfn() + "::" : "";
        return new RawType.Reference(qualifier + name,
                kind == EarlyEnum.Kind.OPTIONS ? RawType.RefKind.OPTIONS : RawType.RefKind.ENUM);
    }
}
