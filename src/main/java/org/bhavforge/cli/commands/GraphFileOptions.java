package org.bhavforge.cli.commands;

import java.nio.file.Path;

import org.bhavforge.runtime.codec.PackageLoadException;
import org.bhavforge.runtime.codec.PackageLoader;
import org.bhavforge.runtime.model.BehaviorGraph;

import picocli.CommandLine.Option;

/**
 * Shared options of commands that operate on a single behavior file.
 */
public class GraphFileOptions {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Raw behavior file (12-byte instruction records)"
    )
    Path file;

    @Option(
        names = {"--id"},
        description = "Behavior id (default: parsed from the file name, else 0)"
    )
    Integer id;

    @Option(
        names = {"--locals"},
        defaultValue = "0",
        description = "Number of declared locals (default: ${DEFAULT-VALUE})"
    )
    int locals;

    @Option(
        names = {"--args"},
        defaultValue = "0",
        description = "Number of declared arguments (default: ${DEFAULT-VALUE})"
    )
    int args;

    /**
     * Reads and decodes the behavior file.
     *
     * @return the behavior
     * @throws PackageLoadException if the file cannot be read or decoded
     */
    BehaviorGraph load() {
        return PackageLoader.loadGraph(file, resolveId(), locals, args);
    }

    int resolveId() {
        if (id != null) {
            return id;
        }
        String name = file.getFileName().toString();
        String stem = name.contains(".") ? name.substring(0, name.lastIndexOf('.')) : name;
        if (stem.matches("\\d+|0[xX][0-9a-fA-F]+")) {
            return PackageLoader.idFromFileName(file);
        }
        return 0;
    }
}
