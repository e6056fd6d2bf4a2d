package org.messagewrangler.compiler.frontend.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads schema text from the filesystem or the classpath.
 * <p>
 * Both sources are decoded as UTF-8, a leading byte order mark is dropped and line endings are
 * normalized to {@code \n}, so line numbers in diagnostics do not depend on the editor that wrote the file.
 */
public final class SourceLoader {

    private static final char BOM = '\uFEFF';

    /**
     * Schema text with the name diagnostics use for it.
     *
     * @param content     The normalized text.
     * @param logicalName The file path with forward slashes, or the resource path.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path resolvedPath) throws IOException {
        byte[] bytes = Files.readAllBytes(resolvedPath);
        return new LoadResult(normalize(new String(bytes, StandardCharsets.UTF_8)),
                resolvedPath.toString().replace('\\', '/'));
    }

    /**
     * Loads a schema bundled on the classpath, e.g. a test fixture.
     *
     * @throws IOException If no such resource exists or it cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        String name = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SourceLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            return new LoadResult(normalize(new String(in.readAllBytes(), StandardCharsets.UTF_8)), name);
        }
    }

    static String normalize(String text) {
        String body = !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        return body.replace("\r\n", "\n").replace('\r', '\n');
    }
}
