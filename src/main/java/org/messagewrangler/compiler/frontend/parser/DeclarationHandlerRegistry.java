package org.messagewrangler.compiler.frontend.parser;

import org.messagewrangler.compiler.frontend.parser.ast.BasicTypeNode;
import org.messagewrangler.compiler.frontend.parser.features.compound.CompoundDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.features.enumdef.EnumDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.features.importdecl.ImportDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.features.message.MessageDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.features.namespace.NamespaceDeclarationHandler;
import org.messagewrangler.compiler.frontend.parser.features.options.OptionsDeclarationHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for declaration handlers.
 * Maps introducing keywords (e.g., "message", "enum") to their handlers.
 */
public class DeclarationHandlerRegistry {

    private final Map<String, IDeclarationHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for a keyword.
     * @param keyword The keyword (case-sensitive).
     * @param handler The handler for this declaration.
     */
    public void register(String keyword, IDeclarationHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a keyword.
     * @param keyword The keyword.
     * @return The handler, or empty if the word does not introduce a declaration.
     */
    public Optional<IDeclarationHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    public Set<String> keywords() {
        return handlers.keySet();
    }

    /**
     * Creates a registry with all built-in declaration handlers.
     * @return A new registry instance.
     */
    public static DeclarationHandlerRegistry initialize() {
        DeclarationHandlerRegistry registry = new DeclarationHandlerRegistry();
        registry.register("import", new ImportDeclarationHandler());
        registry.register("namespace", new NamespaceDeclarationHandler());
        registry.register("message", new MessageDeclarationHandler());
        EnumDeclarationHandler enumHandler = new EnumDeclarationHandler();
        registry.register("enum", enumHandler);
        registry.register("open_enum", enumHandler);
        registry.register("options", new OptionsDeclarationHandler());
        CompoundDeclarationHandler compoundHandler = new CompoundDeclarationHandler();
        for (String basic : BasicTypeNode.NAMES) {
            registry.register(basic, compoundHandler);
        }
        return registry;
    }
}
