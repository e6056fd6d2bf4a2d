package org.messagewrangler.cli.commands;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.messagewrangler.cli.CommandLineInterface;
import org.messagewrangler.compiler.CompilationException;
import org.messagewrangler.compiler.Compiler;
import org.messagewrangler.compiler.CompilerOptions;
import org.messagewrangler.compiler.api.Model;
import org.messagewrangler.compiler.backend.json.ModelJsonWriter;
import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that compiles a schema file with all of its imports.
 * <p>
 * Exit codes: 0 on success, 1 if the schema has errors, 2 on configuration or I/O failures.
 */
@Command(
    name = "compile",
    description = "Compile a schema file and its imports into a resolved model"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_COMPILATION_ERRORS = 1;

    @Option(
        names = {"-i", "--input"},
        required = true,
        description = "Root schema file"
    )
    private Path input;

    @Option(
        names = {"-o", "--output"},
        description = "Directory to write <name>.model.json into"
    )
    private Path outputDir;

    @Option(
        names = {"-I", "--import-path"},
        description = "Additional directory searched for imports (repeatable)"
    )
    private List<Path> importPaths = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        CompilerOptions options;
        try {
            options = CompilerOptions.fromConfig(parent.getConfig()).withLeadingSearchPaths(importPaths);
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        if (!Files.isRegularFile(input)) {
            err.println("Error: Schema file not found: " + input);
            return CommandLineInterface.EXIT_FAILURE;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Model model;
        try {
            model = new Compiler(options).compile(input, diagnostics);
        } catch (CompilationException e) {
            log.debug("Compilation failed", e);
            err.println(diagnostics.summary());
            if (diagnostics.hasErrors()) {
                err.printf("%d error(s)%n", diagnostics.errorCount());
            } else {
                err.println("Warnings are treated as errors (compiler.warnings-as-errors)");
            }
            return EXIT_COMPILATION_ERRORS;
        }
        if (diagnostics.hasWarnings()) {
            err.println(diagnostics.summary());
        }

        out.printf("Compiled %s: %d namespaces, %d messages, %d enums%n", input,
                model.allNamespaces().size(), model.messages().size(), model.enums().size());

        if (outputDir != null) {
            try {
                Path written = new ModelJsonWriter().write(model, outputDir);
                out.println("Wrote " + written);
            } catch (IOException e) {
                err.println("Error: Could not write model to " + outputDir + ": " + e.getMessage());
                return CommandLineInterface.EXIT_FAILURE;
            }
        }
        return 0;
    }
}
