package org.bhavforge.runtime.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Contains unit tests for {@link PackageLoader} reading package directories.
 */
@Tag("unit")
class PackageLoaderTest {

    @TempDir
    Path dir;

    @Test
    void load_readsBehaviorsAndManifest() throws IOException {
        writeBehavior("4096.bhav", Instruction.of(0, 0x1001, ExitPointer.RETURN_TRUE, ExitPointer.RETURN_FALSE));
        writeBehavior("0x1001.bhav", Instruction.of(0, 2, ExitPointer.RETURN_TRUE, ExitPointer.RETURN_FALSE));
        Files.writeString(dir.resolve(PackageLoader.MANIFEST), """
                name = "kitchen"
                entry-points = [4096]
                defaults { locals = 1 }
                behaviors { "4097" { locals = 3, args = 2 } }
                """);
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        BehaviorPackage pkg = PackageLoader.load(dir);

        assertThat(pkg.name()).isEqualTo("kitchen");
        assertThat(pkg.ids()).containsExactly(0x1000, 0x1001);
        assertThat(pkg.entryPoints()).containsExactly(0x1000);
        assertThat(pkg.graph(0x1000).orElseThrow().localCount()).isEqualTo(1);
        assertThat(pkg.graph(0x1001).orElseThrow().localCount()).isEqualTo(3);
        assertThat(pkg.graph(0x1001).orElseThrow().argumentCount()).isEqualTo(2);
    }

    @Test
    void load_withoutManifestUsesDirectoryName() throws IOException {
        writeBehavior("12.bhav", Instruction.of(0, 2, ExitPointer.RETURN_TRUE, ExitPointer.RETURN_FALSE));

        BehaviorPackage pkg = PackageLoader.load(dir);

        assertThat(pkg.name()).isEqualTo(dir.getFileName().toString());
        assertThat(pkg.entryPoints()).isEmpty();
        assertThat(pkg.graph(12).orElseThrow().localCount()).isZero();
    }

    @Test
    void load_reportsCorruptFile() throws IOException {
        Files.write(dir.resolve("5.bhav"), new byte[5]);

        assertThatThrownBy(() -> PackageLoader.load(dir))
                .isInstanceOf(PackageLoadException.class)
                .hasMessageContaining("5.bhav")
                .hasCauseInstanceOf(DecodeException.class);
    }

    @Test
    void load_reportsMissingDirectory() {
        assertThatThrownBy(() -> PackageLoader.load(dir.resolve("absent")))
                .isInstanceOf(PackageLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_reportsDuplicateIds() throws IOException {
        writeBehavior("16.bhav", Instruction.of(0, 2, ExitPointer.RETURN_TRUE, ExitPointer.RETURN_TRUE));
        writeBehavior("0x10.bhav", Instruction.of(0, 2, ExitPointer.RETURN_TRUE, ExitPointer.RETURN_TRUE));

        assertThatThrownBy(() -> PackageLoader.load(dir))
                .isInstanceOf(PackageLoadException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void idFromFileName_acceptsDecimalAndHex() {
        assertThat(PackageLoader.idFromFileName(Path.of("4096.bhav"))).isEqualTo(4096);
        assertThat(PackageLoader.idFromFileName(Path.of("0X1000.bhav"))).isEqualTo(4096);
        assertThatThrownBy(() -> PackageLoader.idFromFileName(Path.of("main.bhav")))
                .isInstanceOf(PackageLoadException.class);
        assertThatThrownBy(() -> PackageLoader.idFromFileName(Path.of("70000.bhav")))
                .isInstanceOf(PackageLoadException.class);
    }

    private void writeBehavior(String fileName, Instruction... instructions) throws IOException {
        Files.write(dir.resolve(fileName), InstructionCodec.encode(List.of(instructions)));
    }
}
