package org.bhavforge.runtime.isa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Table-driven {@link IOpcodeCatalog}.
 * <p>
 * Entries come either from a HOCON table (see {@code opcodes.conf} on the classpath) or from
 * {@link #builder()}. Opcodes at or above the subroutine base that have no explicit entry are
 * calls to the behavior with that id.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class OpcodeCatalog implements IOpcodeCatalog {

    private static final Logger log = LoggerFactory.getLogger(OpcodeCatalog.class);

    /** Resource holding the default opcode table. */
    public static final String DEFAULT_RESOURCE = "opcodes.conf";

    /** First opcode that denotes a subroutine call unless listed explicitly. */
    public static final int DEFAULT_SUBROUTINE_BASE = 256;

    private final Int2ObjectMap<OpcodeInfo> entries;
    private final int subroutineBase;

    private OpcodeCatalog(Int2ObjectMap<OpcodeInfo> entries, int subroutineBase) {
        this.entries = Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(entries));
        this.subroutineBase = subroutineBase;
    }

    @Override
    public OpcodeInfo lookup(int opcode) {
        OpcodeInfo info = entries.get(opcode);
        if (info != null) {
            return info;
        }
        if (opcode >= subroutineBase) {
            return new OpcodeInfo(opcode, String.format("Call BHAV 0x%04X", opcode), OpcodeCategory.SUBROUTINE,
                    0, null, true, CallSpec.byOpcode(CallKind.SUBROUTINE), true);
        }
        return OpcodeInfo.unknown(opcode);
    }

    public int subroutineBase() {
        return subroutineBase;
    }

    /**
     * Number of explicit entries, excluding synthesized subroutine calls.
     *
     * @return the entry count
     */
    public int size() {
        return entries.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the table named by {@code bhavforge.opcodes.resource}.
     *
     * @param appConfig the resolved application configuration
     * @return the catalog
     * @throws ConfigException if the resource is missing or malformed
     */
    public static OpcodeCatalog load(Config appConfig) {
        String resource = appConfig.hasPath("bhavforge.opcodes.resource")
                ? appConfig.getString("bhavforge.opcodes.resource")
                : DEFAULT_RESOURCE;
        return loadResource(resource);
    }

    /**
     * Returns the catalog shipped with the library.
     *
     * @return the default catalog
     */
    public static OpcodeCatalog loadDefault() {
        return DefaultHolder.INSTANCE;
    }

    static OpcodeCatalog loadResource(String resource) {
        Config parsed = ConfigFactory.parseResources(OpcodeCatalog.class.getClassLoader(), resource).resolve();
        if (!parsed.hasPath("opcodes")) {
            throw new ConfigException.Missing("opcodes (in resource " + resource + ")");
        }
        OpcodeCatalog catalog = fromConfig(parsed.getConfig("opcodes"));
        log.debug("Loaded {} opcode entries from {}", catalog.size(), resource);
        return catalog;
    }

    /**
     * Builds a catalog from an {@code opcodes { ... }} block.
     * <p>
     * Expected layout:
     * <pre>
     * subroutine-opcode-base = 256
     * schemas { expression { used-bytes = 8, slots = [ ... ] } }
     * table = [ { opcode = 2, name = "Expression", category = MATH, conditional = true, schema = expression } ]
     * </pre>
     *
     * @param opcodes the {@code opcodes} block
     * @return the catalog
     * @throws ConfigException if an entry is malformed
     */
    public static OpcodeCatalog fromConfig(Config opcodes) {
        Builder builder = builder();
        if (opcodes.hasPath("subroutine-opcode-base")) {
            builder.subroutineBase(opcodes.getInt("subroutine-opcode-base"));
        }

        Map<String, OperandSchema> schemas = new HashMap<>();
        if (opcodes.hasPath("schemas")) {
            Config schemaBlock = opcodes.getConfig("schemas");
            for (String name : schemaBlock.root().keySet()) {
                schemas.put(name, parseSchema(name, schemaBlock.getConfig(name)));
            }
        }

        for (Config entry : opcodes.getConfigList("table")) {
            int opcode = entry.getInt("opcode");
            OperandSchema schema = null;
            if (entry.hasPath("schema")) {
                String schemaName = entry.getString("schema");
                schema = schemas.get(schemaName);
                if (schema == null) {
                    throw new ConfigException.BadValue(entry.origin(), "schema",
                            "Unknown operand schema '" + schemaName + "' for opcode " + opcode);
                }
            }
            CallSpec callSpec = entry.hasPath("call") ? parseCall(entry.getConfig("call")) : null;
            builder.add(new OpcodeInfo(
                    opcode,
                    entry.getString("name"),
                    parseEnum(OpcodeCategory.class, entry, "category"),
                    entry.hasPath("stack-delta") ? entry.getInt("stack-delta") : 0,
                    schema,
                    entry.hasPath("conditional") && entry.getBoolean("conditional"),
                    callSpec,
                    true));
        }
        return builder.build();
    }

    private static OperandSchema parseSchema(String name, Config schema) {
        List<VariableSlot> slots = new ArrayList<>();
        if (schema.hasPath("slots")) {
            for (Config slot : schema.getConfigList("slots")) {
                slots.add(new VariableSlot(
                        slot.getString("label"),
                        slot.getInt("data-offset"),
                        slot.getInt("scope-offset"),
                        parseEnum(VariableAccess.class, slot, "access"),
                        slot.hasPath("flag-offset") ? slot.getInt("flag-offset") : 0,
                        slot.hasPath("flag-mask") ? slot.getInt("flag-mask") : 0));
            }
        }
        return new OperandSchema(name, schema.getInt("used-bytes"), slots);
    }

    private static CallSpec parseCall(Config call) {
        CallKind kind = parseEnum(CallKind.class, call, "kind");
        String target = call.getString("target").toLowerCase(Locale.ROOT);
        return switch (target) {
            case "opcode" -> CallSpec.byOpcode(kind);
            case "operand" -> CallSpec.byOperand(kind, call.getInt("offset"));
            default -> throw new ConfigException.BadValue(call.origin(), "target",
                    "Expected 'opcode' or 'operand', got '" + target + "'");
        };
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, Config config, String path) {
        String raw = config.getString(path);
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), path,
                    "Unknown " + type.getSimpleName() + " '" + raw + "'", e);
        }
    }

    /**
     * Assembles catalogs programmatically, mainly for tests and embedding.
     */
    public static final class Builder {

        private final Int2ObjectMap<OpcodeInfo> entries = new Int2ObjectOpenHashMap<>();
        private int subroutineBase = DEFAULT_SUBROUTINE_BASE;

        private Builder() {
        }

        public Builder subroutineBase(int base) {
            if (base < 0) {
                throw new IllegalArgumentException("Subroutine base must be non-negative, got: " + base);
            }
            this.subroutineBase = base;
            return this;
        }

        public Builder add(OpcodeInfo info) {
            entries.put(info.opcode(), info);
            return this;
        }

        /**
         * Adds a primitive with no operand schema and no call behavior.
         *
         * @param opcode the opcode
         * @param name display name
         * @param conditional whether the primitive can report false
         * @param stackDelta declared stack change
         * @return this builder
         */
        public Builder primitive(int opcode, String name, boolean conditional, int stackDelta) {
            return add(new OpcodeInfo(opcode, name, OpcodeCategory.MISC, stackDelta, null, conditional, null, true));
        }

        public Builder call(int opcode, String name, CallSpec callSpec) {
            return add(new OpcodeInfo(opcode, name, OpcodeCategory.CONTROL, 0, null, true, callSpec, true));
        }

        public OpcodeCatalog build() {
            return new OpcodeCatalog(entries, subroutineBase);
        }
    }

    private static final class DefaultHolder {
        private static final OpcodeCatalog INSTANCE = loadResource(DEFAULT_RESOURCE);
    }
}
