package org.messagewrangler.compiler.frontend.module;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Identifies a source file by its canonical absolute path.
 * Used as the key of the per-compilation registry, so a file reached through different
 * relative import strings is processed once.
 *
 * @param path The canonical, normalized absolute path with {@code /} separators.
 */
public record ModuleId(String path) {

    /**
     * Canonicalizes a path: symbolic links are resolved when the file exists,
     * otherwise the absolute path is normalized.
     */
    public static ModuleId of(Path file) {
        Path canonical;
        try {
            canonical = Files.exists(file) ? file.toRealPath() : file.toAbsolutePath().normalize();
        } catch (IOException e) {
            canonical = file.toAbsolutePath().normalize();
        }
        return new ModuleId(canonical.toString().replace('\\', '/'));
    }

    public Path toPath() {
        return Path.of(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
