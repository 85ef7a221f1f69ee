package io.github.eutro.flattening.ops;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.util.Disassembler;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;

import java.util.List;


/**
 * Operations modelled on Java bytecode.
 */
public class JavaOps {
    /**
     * Control: jump conditionally. The first target is taken if the condition holds, the second otherwise.
     */
    public static final UnaryOpKey<JumpType> BR_COND = new UnaryOpKey<>("br_cond"); /* takenB fallthroughB */
    /**
     * Effect: returns the first argument if the condition holds on the remaining arguments,
     * otherwise the second.
     */
    public static final UnaryOpKey<JumpType> SELECT = new UnaryOpKey<>("select"); /* taken fallthrough cond... */
    /**
     * Effect: returns true if the condition holds, false otherwise.
     */
    public static final UnaryOpKey<JumpType> BOOL_SELECT = new UnaryOpKey<>("bool");

    /**
     * Control: an {@link Opcodes#TABLESWITCH} on its argument.
     * With n jump targets, the first n-1 correspond to keys {@code [0, n-1)}; the last is the default.
     */
    public static final Op TABLESWITCH = new SimpleOpKey("tableswitch").create();

    /**
     * Control: run the second target, "jumping" to the first if it throws an exception of the given type.
     */
    public static final UnaryOpKey<Type> TRY = new UnaryOpKey<>("try", Type::getInternalName);

    /**
     * Effect: an inline sequence of ASM instructions, taking its arguments from the operand stack.
     */
    public static final UnaryOpKey<InsnList> INSNS = new UnaryOpKey<>("insns", Disassembler::disassembleList);

    public static Op insns(InsnList insns) {
        return INSNS.create(insns);
    }

    public static Op insns(AbstractInsnNode... in) {
        InsnList il = new InsnList();
        for (AbstractInsnNode node : in) {
            il.add(node);
        }
        return insns(il);
    }

    public static final Op IADD = insns(new InsnNode(Opcodes.IADD));
    public static final Op ISUB = insns(new InsnNode(Opcodes.ISUB));
    public static final Op IMUL = insns(new InsnNode(Opcodes.IMUL));
    /**
     * Effect: integer division, throwing on a zero divisor.
     */
    public static final Op IDIV = insns(new InsnNode(Opcodes.IDIV));
    public static final Op IREM = insns(new InsnNode(Opcodes.IREM));
    public static final Op INEG = insns(new InsnNode(Opcodes.INEG));
    public static final Op IAND = insns(new InsnNode(Opcodes.IAND));
    public static final Op IOR = insns(new InsnNode(Opcodes.IOR));
    public static final Op IXOR = insns(new InsnNode(Opcodes.IXOR));

    static {
        TRY.attachExt(CommonExts.HAS_EXCEPTIONAL_EDGE, true);
    }

    /**
     * A conditional jump's type in Java bytecode. The jump is taken if the condition holds.
     */
    public enum JumpType {
        IFNE(Opcodes.IFNE, 1),
        IFEQ(Opcodes.IFEQ, 1),
        IFLT(Opcodes.IFLT, 1),
        IFGE(Opcodes.IFGE, 1),
        IFGT(Opcodes.IFGT, 1),
        IFLE(Opcodes.IFLE, 1),
        IFNULL(Opcodes.IFNULL, 1),
        IFNONNULL(Opcodes.IFNONNULL, 1),
        IF_ICMPEQ(Opcodes.IF_ICMPEQ, 2),
        IF_ICMPNE(Opcodes.IF_ICMPNE, 2),
        IF_ICMPLT(Opcodes.IF_ICMPLT, 2),
        IF_ICMPGE(Opcodes.IF_ICMPGE, 2),
        IF_ICMPGT(Opcodes.IF_ICMPGT, 2),
        IF_ICMPLE(Opcodes.IF_ICMPLE, 2),
        IF_ACMPEQ(Opcodes.IF_ACMPEQ, 2),
        IF_ACMPNE(Opcodes.IF_ACMPNE, 2),
        ;

        /**
         * The Java opcode of the jump instruction.
         */
        public final int opcode;
        /**
         * The number of operands the condition takes.
         */
        public final int arity;

        JumpType(int opcode, int arity) {
            this.opcode = opcode;
            this.arity = arity;
        }

        /**
         * Evaluate the condition on concrete operands. Integer conditions take {@link Integer}s
         * (or {@link Boolean}s, as 0 and 1), reference conditions take any object.
         *
         * @param args The operands, exactly {@link #arity} of them.
         * @return Whether the jump would be taken.
         */
        public boolean test(List<Object> args) {
            if (args.size() != arity) {
                throw new IllegalArgumentException(String.format(
                        "%s takes %d operands, got %d", this, arity, args.size()));
            }
            // @formatter:off
            switch (this) {
                case IFNULL: return args.get(0) == null;
                case IFNONNULL: return args.get(0) != null;
                case IF_ACMPEQ: return args.get(0) == args.get(1);
                case IF_ACMPNE: return args.get(0) != args.get(1);
                default: break;
            }
            int lhs = asInt(args.get(0));
            int rhs = arity == 2 ? asInt(args.get(1)) : 0;
            switch (this) {
                case IFNE: case IF_ICMPNE: return lhs != rhs;
                case IFEQ: case IF_ICMPEQ: return lhs == rhs;
                case IFLT: case IF_ICMPLT: return lhs < rhs;
                case IFGE: case IF_ICMPGE: return lhs >= rhs;
                case IFGT: case IF_ICMPGT: return lhs > rhs;
                case IFLE: case IF_ICMPLE: return lhs <= rhs;
                default: throw new IllegalStateException();
            }
            // @formatter:on
        }

        private static int asInt(Object o) {
            if (o instanceof Boolean) return (Boolean) o ? 1 : 0;
            return (Integer) o;
        }
    }
}
