package org.messagewrangler.compiler;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one compilation, read from the {@code compiler} block of the configuration.
 *
 * @param fileExtension     Appended to import paths written without an extension.
 * @param importSearchPaths Directories tried, in order, after the importing file's own directory.
 * @param warningsAsErrors  Whether any warning fails the compilation.
 */
public record CompilerOptions(String fileExtension, List<Path> importSearchPaths, boolean warningsAsErrors) {

    public static final String DEFAULT_FILE_EXTENSION = ".def";

    public CompilerOptions {
        importSearchPaths = List.copyOf(importSearchPaths);
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_FILE_EXTENSION, List.of(), false);
    }

    /**
     * Reads the options from a configuration containing a {@code compiler} block.
     * Missing keys keep their defaults.
     */
    public static CompilerOptions fromConfig(Config config) {
        if (!config.hasPath("compiler")) {
            return defaults();
        }
        Config compiler = config.getConfig("compiler");
        String extension = compiler.hasPath("file-extension")
                ? compiler.getString("file-extension")
                : DEFAULT_FILE_EXTENSION;
        List<Path> searchPaths = new ArrayList<>();
        if (compiler.hasPath("import-search-paths")) {
            for (String dir : compiler.getStringList("import-search-paths")) {
                searchPaths.add(Path.of(dir));
            }
        }
        boolean warningsAsErrors = compiler.hasPath("warnings-as-errors") && compiler.getBoolean("warnings-as-errors");
        return new CompilerOptions(extension, searchPaths, warningsAsErrors);
    }

    /**
     * Returns a copy with additional search paths tried before the configured ones.
     */
    public CompilerOptions withLeadingSearchPaths(List<Path> paths) {
        List<Path> combined = new ArrayList<>(paths);
        combined.addAll(importSearchPaths);
        return new CompilerOptions(fileExtension, combined, warningsAsErrors);
    }
}
