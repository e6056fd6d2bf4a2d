package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A resolved namespace with its members in declaration order.
 * Enums and options sets share the {@code enums} list; promoted inline enums follow the declared ones.
 */
public record ModelNamespace(String name, String qfn, List<ModelNamespace> namespaces, List<ModelMessage> messages,
                             List<ModelEnum> enums, List<ModelCompound> compounds,
                             String doc, String comment, SourceRef source) {

    public ModelNamespace {
        namespaces = List.copyOf(namespaces);
        messages = List.copyOf(messages);
        enums = List.copyOf(enums);
        compounds = List.copyOf(compounds);
    }

    public List<ModelEnum> options() {
        return enums.stream().filter(ModelEnum::options).collect(Collectors.toList());
    }
}
