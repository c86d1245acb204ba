package org.bhavforge.runtime.codec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.bhavforge.runtime.model.BehaviorGraph;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Reads behaviors from the file system.
 * <p>
 * A package directory holds one raw record file per behavior, named by its id in decimal or
 * {@code 0x}-prefixed hex ({@code 4096.bhav}, {@code 0x1000.bhav}), and optionally a
 * {@code package.conf} manifest:
 * <pre>
 * name = "kitchen"
 * entry-points = [4096]
 * defaults { locals = 0, args = 0 }
 * behaviors { "4097" { locals = 3, args = 1 } }
 * </pre>
 * Without a manifest every behavior has no locals or arguments and there are no entry points.
 */
public final class PackageLoader {

    private static final Logger log = LoggerFactory.getLogger(PackageLoader.class);

    public static final String EXTENSION = ".bhav";
    public static final String MANIFEST = "package.conf";

    private PackageLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads every behavior file of a directory.
     *
     * @param directory the package directory
     * @return the package
     * @throws PackageLoadException if a file cannot be read or decoded, or the manifest is malformed
     */
    public static BehaviorPackage load(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new PackageLoadException("Package directory not found: " + directory.toAbsolutePath());
        }
        Config manifest = readManifest(directory);
        String name = manifest.hasPath("name") ? manifest.getString("name") : directory.getFileName().toString();

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PackageLoadException("Failed to list package directory " + directory, e);
        }

        List<BehaviorGraph> graphs = new ArrayList<>(files.size());
        for (Path file : files) {
            int id = idFromFileName(file);
            int locals;
            int args;
            try {
                Config settings = behaviorSettings(manifest, id);
                locals = settings.getInt("locals");
                args = settings.getInt("args");
            } catch (ConfigException e) {
                throw new PackageLoadException("Malformed manifest entry for behavior " + id + ": " + e.getMessage(), e);
            }
            graphs.add(loadGraph(file, id, locals, args));
        }

        Set<Integer> entryPoints = new HashSet<>();
        try {
            if (manifest.hasPath("entry-points")) {
                entryPoints.addAll(manifest.getIntList("entry-points"));
            }
        } catch (ConfigException e) {
            throw new PackageLoadException("Malformed entry-points in manifest: " + e.getMessage(), e);
        }
        log.debug("Loaded package '{}' from {}: {} behavior(s), entry points {}", name, directory, graphs.size(),
                entryPoints);
        try {
            return new BehaviorPackage(name, graphs, entryPoints);
        } catch (IllegalArgumentException e) {
            throw new PackageLoadException(e.getMessage(), e);
        }
    }

    /**
     * Loads a single behavior file.
     *
     * @param file          raw record file
     * @param id            behavior id
     * @param localCount    declared locals
     * @param argumentCount declared arguments
     * @return the behavior
     * @throws PackageLoadException if the file cannot be read or decoded
     */
    public static BehaviorGraph loadGraph(Path file, int id, int localCount, int argumentCount) {
        try {
            return InstructionCodec.decode(id, Files.readAllBytes(file), localCount, argumentCount);
        } catch (IOException e) {
            throw new PackageLoadException("Failed to read " + file, e);
        } catch (DecodeException e) {
            throw new PackageLoadException("Failed to decode " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Derives a behavior id from a file name such as {@code 4096.bhav} or {@code 0x1000.bhav}.
     *
     * @param file the file
     * @return the id
     * @throws PackageLoadException if the name is not a valid id
     */
    public static int idFromFileName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot < 0 ? fileName : fileName.substring(0, dot);
        try {
            int id = stem.toLowerCase(Locale.ROOT).startsWith("0x")
                    ? Integer.parseInt(stem.substring(2), 16)
                    : Integer.parseInt(stem);
            if (id < 0 || id > 0xFFFF) {
                throw new PackageLoadException("Behavior id out of range in file name: " + fileName);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new PackageLoadException("File name is not a behavior id: " + fileName, e);
        }
    }

    private static Config readManifest(Path directory) {
        Path manifest = directory.resolve(MANIFEST);
        if (!Files.exists(manifest)) {
            return ConfigFactory.empty();
        }
        try {
            return ConfigFactory.parseFile(manifest.toFile()).resolve();
        } catch (ConfigException e) {
            throw new PackageLoadException("Malformed manifest " + manifest + ": " + e.getMessage(), e);
        }
    }

    private static Config behaviorSettings(Config manifest, int id) {
        Config fallback = ConfigFactory.parseString("locals = 0\nargs = 0");
        if (manifest.hasPath("defaults")) {
            fallback = manifest.getConfig("defaults").withFallback(fallback);
        }
        String key = "behaviors.\"" + id + "\"";
        return manifest.hasPath(key) ? manifest.getConfig(key).withFallback(fallback) : fallback;
    }
}
