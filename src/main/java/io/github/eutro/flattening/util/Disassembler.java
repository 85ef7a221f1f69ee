package io.github.eutro.flattening.util;

import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders Java bytecode instructions for display in IR dumps.
 */
public class Disassembler {
    private static Map<Integer, String> opcodeMnemonics = null;

    /**
     * Look up the mnemonic for a Java opcode.
     * <p>
     * Several constants in {@link Opcodes} share values, so this only looks at
     * the range of actual instruction opcodes.
     *
     * @param opcode The Java opcode.
     * @return The mnemonic, or null if not found.
     */
    @Nullable
    public static synchronized String getMnemonic(int opcode) {
        if (opcodeMnemonics == null) generateMnemonics();
        return opcodeMnemonics.get(opcode);
    }

    public static String disassembleList(InsnList insns) {
        StringBuilder sb = new StringBuilder();
        for (AbstractInsnNode insn : insns) {
            disassembleInsn(sb, insn);
            if (insn != insns.getLast()) sb.append("; ");
        }
        return sb.toString();
    }

    public static void disassembleInsn(StringBuilder sb, AbstractInsnNode insn) {
        String mnemonic = getMnemonic(insn.getOpcode());
        sb.append(mnemonic == null ? "op" + insn.getOpcode() : mnemonic.toLowerCase());
        for (Field field : insn.getClass().getFields()) {
            if (Modifier.isStatic(field.getModifiers())) continue;
            Object value;
            try {
                value = field.get(insn);
            } catch (IllegalAccessException e) {
                // getFields() only returns public fields
                throw new IllegalStateException(e);
            }
            if (value == null) continue;
            sb.append(' ')
                    .append(field.getName())
                    .append('=')
                    .append(value);
        }
    }

    private static void generateMnemonics() {
        Map<Integer, String> mnemonics = new HashMap<>();
        for (Field field : Opcodes.class.getFields()) {
            int mods = field.getModifiers();
            if (!(Modifier.isStatic(mods) && Modifier.isFinal(mods)
                    && field.getType() == int.class)) continue;
            // the instruction opcodes are declared after every other int constant
            int value;
            try {
                value = field.getInt(null);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
            if (value >= Opcodes.NOP && value <= Opcodes.IFNONNULL) {
                mnemonics.put(value, field.getName());
            }
        }
        opcodeMnemonics = mnemonics;
    }
}
