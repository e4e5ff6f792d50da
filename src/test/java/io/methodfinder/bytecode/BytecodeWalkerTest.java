package io.methodfinder.bytecode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.objectweb.asm.Opcodes.ALOAD;
import static org.objectweb.asm.Opcodes.BIPUSH;
import static org.objectweb.asm.Opcodes.GOTO;
import static org.objectweb.asm.Opcodes.IINC;
import static org.objectweb.asm.Opcodes.ILOAD;
import static org.objectweb.asm.Opcodes.INVOKEDYNAMIC;
import static org.objectweb.asm.Opcodes.INVOKEINTERFACE;
import static org.objectweb.asm.Opcodes.INVOKESTATIC;
import static org.objectweb.asm.Opcodes.LOOKUPSWITCH;
import static org.objectweb.asm.Opcodes.MULTIANEWARRAY;
import static org.objectweb.asm.Opcodes.NOP;
import static org.objectweb.asm.Opcodes.RETURN;
import static org.objectweb.asm.Opcodes.SIPUSH;
import static org.objectweb.asm.Opcodes.TABLESWITCH;

class BytecodeWalkerTest {

    /**
     * Small code array assembler; {@link #mark()} records the offset of the next instruction.
     */
    private static final class Code {
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private final DataOutputStream out = new DataOutputStream(buf);
        private final List<Integer> starts = new ArrayList<>();

        Code mark() {
            starts.add(buf.size());
            return this;
        }

        Code u1(int... values) {
            for (int value : values) {
                buf.write(value);
            }
            return this;
        }

        Code s4(int value) throws IOException {
            out.writeInt(value);
            return this;
        }

        Code pad() {
            while (buf.size() % 4 != 0) {
                buf.write(0);
            }
            return this;
        }

        byte[] bytes() {
            return buf.toByteArray();
        }

        List<Integer> starts() {
            return starts;
        }
    }

    private static List<Integer> walk(byte[] code) throws MalformedBytecodeException {
        List<Integer> offsets = new ArrayList<>();
        int end = BytecodeWalker.walk(code, (bytes, offset, opcode) -> offsets.add(offset));
        assertThat(end).isEqualTo(code.length);
        return offsets;
    }

    @Test
    void walk_fixedWidthInstructions() throws Exception {
        Code code = new Code()
                .mark().u1(NOP)
                .mark().u1(BIPUSH, 5)
                .mark().u1(SIPUSH, 1, 0)
                .mark().u1(ILOAD, 1)
                .mark().u1(IINC, 1, 1)
                .mark().u1(INVOKESTATIC, 0, 7)
                .mark().u1(INVOKEINTERFACE, 0, 8, 1, 0)
                .mark().u1(INVOKEDYNAMIC, 0, 9, 0, 0)
                .mark().u1(MULTIANEWARRAY, 0, 3, 2)
                .mark().u1(GOTO, 0, 3)
                .mark().u1(Instructions.GOTO_W, 0, 0, 0, 5)
                .mark().u1(Instructions.LDC_W, 0, 1)
                .mark().u1(RETURN);

        assertThat(walk(code.bytes())).isEqualTo(code.starts());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3})
    void walk_tableswitch_paddingDependsOnOffset(int leadingNops) throws Exception {
        Code code = new Code();
        for (int i = 0; i < leadingNops; i++) {
            code.mark().u1(NOP);
        }
        code.mark().u1(TABLESWITCH).pad()
                .s4(20).s4(1).s4(3)
                .s4(20).s4(20).s4(20);
        code.mark().u1(Instructions.WIDE, ILOAD, 1, 0);
        code.mark().u1(RETURN);

        assertThat(walk(code.bytes())).isEqualTo(code.starts());
        assertThat(Instructions.width(code.bytes(), leadingNops))
                .isEqualTo(1 + ((4 - ((leadingNops + 1) & 3)) & 3) + 12 + 3 * 4);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3})
    void walk_lookupswitch_paddingDependsOnOffset(int leadingNops) throws Exception {
        Code code = new Code();
        for (int i = 0; i < leadingNops; i++) {
            code.mark().u1(NOP);
        }
        code.mark().u1(LOOKUPSWITCH).pad()
                .s4(16).s4(2)
                .s4(1).s4(16)
                .s4(9).s4(16);
        code.mark().u1(INVOKESTATIC, 0, 2);
        code.mark().u1(RETURN);

        assertThat(walk(code.bytes())).isEqualTo(code.starts());
    }

    @Test
    void walk_wideIinc_isSixBytes() throws Exception {
        Code code = new Code()
                .mark().u1(Instructions.WIDE, IINC, 1, 0, 0, 10)
                .mark().u1(Instructions.WIDE, ALOAD, 1, 0)
                .mark().u1(RETURN);

        assertThat(walk(code.bytes())).isEqualTo(code.starts());
    }

    @Test
    void walk_reportsUnsignedOpcodes() throws Exception {
        byte[] code = {(byte) INVOKESTATIC, 0, 1, (byte) RETURN};
        List<Integer> opcodes = new ArrayList<>();

        BytecodeWalker.walk(code, (bytes, offset, opcode) -> opcodes.add(opcode));

        assertThat(opcodes).containsExactly(INVOKESTATIC, RETURN);
    }

    @Test
    void walk_emptyCode() throws Exception {
        assertThat(walk(new byte[0])).isEmpty();
    }

    @Test
    void unknownOpcode_isMalformed() {
        byte[] code = {(byte) NOP, (byte) 0xCB, (byte) RETURN};

        assertThatThrownBy(() -> walk(code))
                .isInstanceOf(MalformedBytecodeException.class)
                .hasMessageContaining("Unknown opcode 0xcb")
                .satisfies(e -> assertThat(((MalformedBytecodeException) e).offset()).isEqualTo(1));
    }

    @Test
    void truncatedOperand_isMalformed() {
        byte[] code = {(byte) NOP, (byte) INVOKESTATIC, 0};

        assertThatThrownBy(() -> walk(code))
                .isInstanceOf(MalformedBytecodeException.class)
                .hasMessageContaining("runs past code_length 3")
                .hasMessageEndingWith("at offset 1");
    }

    @Test
    void truncatedSwitchTable_isMalformed() throws Exception {
        Code code = new Code().u1(TABLESWITCH).pad().s4(0).s4(0).s4(100);

        assertThatThrownBy(() -> walk(code.bytes()))
                .isInstanceOf(MalformedBytecodeException.class)
                .hasMessageContaining("Switch table");
    }

    @Test
    void tableswitch_highBelowLow_isMalformed() throws Exception {
        Code code = new Code().u1(TABLESWITCH).pad().s4(0).s4(5).s4(4).u1(RETURN);

        assertThatThrownBy(() -> walk(code.bytes()))
                .isInstanceOf(MalformedBytecodeException.class)
                .hasMessageContaining("high 4 < low 5");
    }

    @Test
    void lookupswitch_negativePairs_isMalformed() throws Exception {
        Code code = new Code().u1(LOOKUPSWITCH).pad().s4(0).s4(-1);

        assertThatThrownBy(() -> walk(code.bytes()))
                .isInstanceOf(MalformedBytecodeException.class)
                .hasMessageContaining("npairs -1");
    }

    @Test
    void wide_onNonLocalOpcode_isMalformed() {
        byte[] code = {(byte) Instructions.WIDE, (byte) GOTO, 0, 0};

        assertThatThrownBy(() -> walk(code))
                .isInstanceOf(MalformedBytecodeException.class)
                .hasMessageContaining("wide cannot modify");
    }

    @Test
    void visitorSeesNothingPastMalformedInstruction() {
        byte[] code = {(byte) INVOKESTATIC, 0, 1, (byte) 0xFE, (byte) INVOKESTATIC, 0, 1};
        List<Integer> offsets = new ArrayList<>();

        assertThatThrownBy(() -> BytecodeWalker.walk(code, (bytes, offset, opcode) -> offsets.add(offset)))
                .isInstanceOf(MalformedBytecodeException.class);
        assertThat(offsets).containsExactly(0);
    }
}
