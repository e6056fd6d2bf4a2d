package org.messagewrangler.compiler.frontend.module;

import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.diagnostics.ErrorKind;
import org.messagewrangler.compiler.frontend.early.ImportDecl;
import org.messagewrangler.compiler.frontend.io.SourceLoader;
import org.messagewrangler.compiler.frontend.lexer.Lexer;
import org.messagewrangler.compiler.frontend.parser.Parser;
import org.messagewrangler.compiler.frontend.parser.ast.SchemaFileNode;
import org.messagewrangler.compiler.frontend.parser.features.importdecl.ImportNode;
import org.messagewrangler.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and parses the root file and every file it transitively imports.
 *
 * <p>Each file is parsed exactly once: a file is registered in the {@link CompilationContext}
 * before its own imports are followed, so diamond imports are shared and import cycles terminate here.
 * Cycles themselves are reported later by {@code DependencySort}.</p>
 *
 * <p>An import path is resolved relative to the importing file, then against each configured search
 * path. A path without extension is also tried with the default file extension. A path that resolves
 * nowhere is a missing import; a file that fails to parse is not registered.</p>
 */
public final class DependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyScanner.class);

    private final DiagnosticsEngine diagnostics;
    private final List<Path> searchPaths;
    private final String defaultExtension;

    public DependencyScanner(DiagnosticsEngine diagnostics) {
        this(diagnostics, List.of(), ".def");
    }

    /**
     * @param diagnostics      The diagnostics engine.
     * @param searchPaths      Directories tried after the importing file's own directory.
     * @param defaultExtension The extension appended to import paths written without one.
     */
    public DependencyScanner(DiagnosticsEngine diagnostics, List<Path> searchPaths, String defaultExtension) {
        this.diagnostics = diagnostics;
        this.searchPaths = List.copyOf(searchPaths);
        this.defaultExtension = defaultExtension;
    }

    /**
     * Scans a root file on disk and all its transitive imports.
     *
     * @param rootFile The root schema file.
     * @param context  The registry receiving one descriptor per file.
     * @return The identity of the root file.
     */
    public ModuleId scan(Path rootFile, CompilationContext context) {
        ModuleId rootId = ModuleId.of(rootFile);
        context.setRoot(rootId);
        if (!Files.isRegularFile(rootFile)) {
            diagnostics.reportError(ErrorKind.MISSING_IMPORT, "Schema file not found: " + rootFile, rootFile.toString(), 0);
            return rootId;
        }
        scanFile(rootId, rootFile.toString(), context);
        return rootId;
    }

    /**
     * Scans in-memory source for a root file and all its transitive imports.
     * Relative imports resolve against the directory of {@code sourcePath}.
     *
     * @param content    The root source text.
     * @param sourcePath The (possibly virtual) path of the root file.
     * @param context    The registry receiving one descriptor per file.
     * @return The identity of the root file.
     */
    public ModuleId scan(String content, String sourcePath, CompilationContext context) {
        ModuleId rootId = ModuleId.of(Path.of(sourcePath));
        context.setRoot(rootId);
        scanModule(rootId, sourcePath, content, context);
        return rootId;
    }

    private void scanFile(ModuleId id, String sourcePath, CompilationContext context) {
        if (context.isScanned(id)) return;
        String content;
        try {
            content = SourceLoader.loadFile(id.toPath()).content();
        } catch (IOException e) {
            diagnostics.reportError(ErrorKind.IO, "Could not read schema file: " + e.getMessage(), sourcePath, 0);
            return;
        }
        scanModule(id, sourcePath, content, context);
    }

    private void scanModule(ModuleId id, String sourcePath, String content, CompilationContext context) {
        if (context.isScanned(id)) return;
        log.debug("Scanning {}", sourcePath);

        SchemaFileNode tree = parse(content, sourcePath);
        if (tree == null) {
            return;
        }

        List<ImportDecl> imports = new ArrayList<>();
        List<ModuleId> toScan = new ArrayList<>();
        List<String> toScanPaths = new ArrayList<>();
        for (ImportNode importNode : tree.imports()) {
            Path resolved = resolveImport(importNode.pathValue(), sourcePath);
            if (resolved == null) {
                diagnostics.reportError(ErrorKind.MISSING_IMPORT,
                        "Imported file '" + importNode.pathValue() + "' does not exist.",
                        sourcePath, importNode.getSourceLine());
                imports.add(new ImportDecl(importNode.pathValue(), importNode.aliasName(), null, importNode.getSourceLine()));
                continue;
            }
            ModuleId importId = ModuleId.of(resolved);
            imports.add(new ImportDecl(importNode.pathValue(), importNode.aliasName(), importId, importNode.getSourceLine()));
            toScan.add(importId);
            toScanPaths.add(resolved.toString().replace('\\', '/'));
        }

        context.registerDescriptor(new ModuleDescriptor(id, sourcePath, tree, List.copyOf(imports)));

        for (int i = 0; i < toScan.size(); i++) {
            scanFile(toScan.get(i), toScanPaths.get(i), context);
        }
    }

    /**
     * Lexes and parses one file.
     *
     * @return The parse tree, or {@code null} if the file has a syntax error.
     */
    public SchemaFileNode parse(String content, String sourcePath) {
        int errorsBefore = diagnostics.errorCount();
        Lexer lexer = new Lexer(content, diagnostics, sourcePath);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.errorCount() > errorsBefore) {
            return null;
        }
        Parser parser = new Parser(tokens, diagnostics);
        SchemaFileNode tree = parser.parse();
        return parser.hasFailed() ? null : tree;
    }

    private Path resolveImport(String importPath, String importingFile) {
        List<Path> bases = new ArrayList<>();
        Path importingDir = Path.of(importingFile).toAbsolutePath().getParent();
        if (importingDir != null) {
            bases.add(importingDir);
        }
        bases.addAll(searchPaths);

        for (Path base : bases) {
            Path candidate = base.resolve(importPath).normalize();
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            if (!hasExtension(importPath)) {
                Path withExtension = base.resolve(importPath + defaultExtension).normalize();
                if (Files.isRegularFile(withExtension)) {
                    return withExtension;
                }
            }
        }
        return null;
    }

    private static boolean hasExtension(String path) {
        Path fileName = Path.of(path).getFileName();
        return fileName != null && fileName.toString().lastIndexOf('.') > 0;
    }
}
