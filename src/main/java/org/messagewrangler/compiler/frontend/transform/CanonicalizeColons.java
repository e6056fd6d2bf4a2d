package org.messagewrangler.compiler.frontend.transform;

import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyField;
import org.messagewrangler.compiler.frontend.early.EarlyMessage;
import org.messagewrangler.compiler.frontend.early.EarlyModel;

/**
 * Rewrites legacy dotted qualifiers ({@code A.B}) to {@code A::B} in every raw type name,
 * compound base type and parent reference.
 */
public class CanonicalizeColons implements IEarlyTransform {

    @Override
    public EarlyModel apply(EarlyModel model) {
        for (EarlyMessage message : model.allMessages()) {
            message.setParentRaw(canonicalize(message.parentRaw()));
            for (EarlyField field : message.fields()) {
                field.setType(field.type().mapNames(CanonicalizeColons::canonicalize, true));
            }
        }
        for (EarlyEnum earlyEnum : model.allEnums()) {
            earlyEnum.setParentRaw(canonicalize(earlyEnum.parentRaw()));
        }
        return model;
    }

    static String canonicalize(String name) {
        if (name == null || name.indexOf('.') < 0) {
            return name;
        }
        return name.replace(".", "::");
    }
}
