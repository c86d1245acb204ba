package org.bhavforge.runtime.isa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Contains unit tests for {@link Instruction} and {@link ExitPointer}.
 */
@Tag("unit")
class InstructionTest {

    @Test
    void constructor_copiesOperand() {
        byte[] operand = {1, 2, 3, 4, 5, 6, 7, 8};
        Instruction instruction = new Instruction(0, 2, 1, ExitPointer.RETURN_FALSE, operand);

        operand[0] = 99;
        byte[] copy = instruction.operand();
        copy[1] = 99;

        assertThat(instruction.operandByte(0)).isEqualTo(1);
        assertThat(instruction.operandByte(1)).isEqualTo(2);
    }

    @Test
    void operandU16_readsLittleEndian() {
        byte[] operand = {0x34, 0x12, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, 0};
        Instruction instruction = new Instruction(0, 2, 0, 0, operand);

        assertThat(instruction.operandU16(0)).isEqualTo(0x1234);
        assertThat(instruction.operandU16(2)).isEqualTo(0xFFFF);
        assertThat(instruction.operandHex()).isEqualTo("3412FFFF00000000");
    }

    @Test
    void constructor_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> Instruction.of(0, 0x10000, 0, 0))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Opcode");
        assertThatThrownBy(() -> Instruction.of(0, 1, 256, 0))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("True exit");
        assertThatThrownBy(() -> Instruction.of(0, 1, 0, -1))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("False exit");
        assertThatThrownBy(() -> new Instruction(0, 1, 0, 0, new byte[7]))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Operand");
    }

    @Test
    void withExits_keepsOpcodeAndOperand() {
        byte[] operand = {9, 0, 0, 0, 0, 0, 0, 0};
        Instruction original = new Instruction(3, 7, 4, 5, operand);

        Instruction rewired = original.withExits(ExitPointer.ERROR, 1);

        assertThat(rewired.opcode()).isEqualTo(7);
        assertThat(rewired.position()).isEqualTo(3);
        assertThat(rewired.operandByte(0)).isEqualTo(9);
        assertThat(rewired.exit(true)).isEqualTo(ExitPointer.ERROR);
        assertThat(rewired.exit(false)).isEqualTo(1);
        assertThat(original.trueExit()).isEqualTo(4);
    }

    @Test
    void equality_includesOperandBytes() {
        Instruction a = new Instruction(0, 2, 1, 1, new byte[] {1, 0, 0, 0, 0, 0, 0, 0});
        Instruction b = new Instruction(0, 2, 1, 1, new byte[] {1, 0, 0, 0, 0, 0, 0, 0});
        Instruction c = new Instruction(0, 2, 1, 1, new byte[] {2, 0, 0, 0, 0, 0, 0, 0});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    void exitPointer_classifiesSentinels() {
        assertThat(ExitPointer.isSentinel(253)).isTrue();
        assertThat(ExitPointer.isSentinel(254)).isTrue();
        assertThat(ExitPointer.isSentinel(255)).isTrue();
        assertThat(ExitPointer.isSentinel(252)).isFalse();

        assertThat(ExitPointer.isInBounds(2, 3)).isTrue();
        assertThat(ExitPointer.isInBounds(3, 3)).isFalse();
        assertThat(ExitPointer.isInBounds(ExitPointer.RETURN_TRUE, 255)).isFalse();

        assertThat(ExitPointer.describe(ExitPointer.ERROR)).isEqualTo("ERROR");
        assertThat(ExitPointer.describe(ExitPointer.RETURN_TRUE)).isEqualTo("TRUE");
        assertThat(ExitPointer.describe(ExitPointer.RETURN_FALSE)).isEqualTo("FALSE");
        assertThat(ExitPointer.describe(17)).isEqualTo("17");
    }
}
