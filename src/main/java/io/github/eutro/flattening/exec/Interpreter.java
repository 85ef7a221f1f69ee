package io.github.eutro.flattening.exec;

import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.ops.JavaOps;
import io.github.eutro.flattening.ops.OpKey;
import io.github.eutro.flattening.ssa.*;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;

import java.util.*;

/**
 * Runs a {@link Function} directly, for checking that transformations preserve behaviour.
 * <p>
 * Side effects are only possible through {@link CommonOps#CALL}, which is delegated to a {@link Host}.
 * Execution is bounded by a step budget, so that non-terminating functions
 * raise an {@link OutOfFuelException} instead of hanging.
 */
public class Interpreter {
    /**
     * The default number of instructions a function may execute,
     * read from {@code FLATTENING_INTERPRETER_FUEL} if set.
     */
    public static final long DEFAULT_FUEL;

    static {
        String fuel = System.getenv("FLATTENING_INTERPRETER_FUEL");
        DEFAULT_FUEL = fuel == null ? 1_000_000L : Long.parseLong(fuel);
    }

    /**
     * Handles the {@link CommonOps#CALL calls} of the interpreted function.
     */
    @FunctionalInterface
    public interface Host {
        Object call(String name, List<Object> args);
    }

    /**
     * Thrown when the function executes a {@link CommonOps#TRAP}.
     */
    public static class TrapException extends RuntimeException {
        public TrapException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when the function runs out of steps.
     */
    public static class OutOfFuelException extends RuntimeException {
        public OutOfFuelException(long steps) {
            super(String.format("function did not finish in %d steps", steps));
        }
    }

    private final Host host;
    private final long maxSteps;

    public Interpreter(Host host, long maxSteps) {
        this.host = host;
        this.maxSteps = maxSteps;
    }

    public Interpreter(Host host) {
        this(host, DEFAULT_FUEL);
    }

    /**
     * Run a function.
     *
     * @param func The function.
     * @param args The arguments to the function.
     * @return The value it returned, or null if it returned nothing.
     * @throws TrapException      If the function traps.
     * @throws OutOfFuelException If the function takes too many steps.
     */
    @Nullable
    public Object run(Function func, Object... args) {
        Frame frame = new Frame(host, args);
        BasicBlock block = func.blocks.get(0);
        long steps = 0;
        while (true) {
            List<Effect> effects = block.getEffects();
            int i = 0;

            // phis read their arguments simultaneously
            Map<Var, Object> phiValues = new LinkedHashMap<>();
            for (; i < effects.size(); i++) {
                Effect effect = effects.get(i);
                if (effect.insn().op.key != CommonOps.PHI) break;
                List<BasicBlock> preds = CommonOps.PHI.cast(effect.insn().op).arg;
                int idx = preds.indexOf(frame.pred);
                if (idx == -1) {
                    throw new IllegalStateException(String.format(
                            "phi has no value for predecessor %s: %s",
                            frame.pred == null ? "<entry>" : frame.pred.toTargetString(),
                            effect));
                }
                phiValues.put(effect.getAssignsTo().get(0), frame.get(effect.insn().args().get(idx)));
            }
            frame.values.putAll(phiValues);
            steps += phiValues.size();

            for (; i < effects.size(); i++) {
                if (++steps > maxSteps) throw new OutOfFuelException(maxSteps);
                Effect effect = effects.get(i);
                Insn insn = effect.insn();
                Evaluator evaluator = FX_EVALUATORS.get(insn.op.key);
                if (evaluator == null) {
                    throw new UnsupportedOperationException(String.format("cannot interpret effect: %s", effect));
                }
                Object result = evaluator.eval(frame, insn);
                List<Var> assignsTo = effect.getAssignsTo();
                if (!assignsTo.isEmpty()) {
                    frame.values.put(assignsTo.get(0), result);
                }
            }

            if (++steps > maxSteps) throw new OutOfFuelException(maxSteps);
            Control ctrl = block.getControl();
            Jumper jumper = CTRL_EVALUATORS.get(ctrl.insn().op.key);
            if (jumper == null) {
                throw new UnsupportedOperationException(String.format("cannot interpret control: %s", ctrl));
            }
            BasicBlock next = jumper.jump(frame, ctrl);
            if (next == null) {
                return frame.result;
            }
            frame.pred = block;
            block = next;
        }
    }

    private static final class Frame {
        final Host host;
        final Object[] args;
        final Map<Var, Object> values = new HashMap<>();
        BasicBlock pred;
        Object result;

        Frame(Host host, Object[] args) {
            this.host = host;
            this.args = args;
        }

        Object get(Var var) {
            if (!values.containsKey(var)) {
                throw new IllegalStateException(String.format("read of unassigned variable %s", var));
            }
            return values.get(var);
        }

        List<Object> getAll(List<Var> vars) {
            List<Object> ret = new ArrayList<>(vars.size());
            for (Var var : vars) {
                ret.add(get(var));
            }
            return ret;
        }
    }

    private static final class Cell {
        Object value;

        @Override
        public String toString() {
            return "Cell(" + value + ")";
        }
    }

    private interface Evaluator {
        Object eval(Frame frame, Insn insn);
    }

    private interface Jumper {
        @Nullable
        BasicBlock jump(Frame frame, Control ctrl);
    }

    private static final Map<OpKey, Evaluator> FX_EVALUATORS = new HashMap<>();
    private static final Map<OpKey, Jumper> CTRL_EVALUATORS = new HashMap<>();

    static {
        FX_EVALUATORS.put(CommonOps.ARG, (f, insn) -> {
            int n = CommonOps.ARG.cast(insn.op).arg;
            if (n >= f.args.length) {
                throw new IllegalArgumentException(String.format(
                        "argument %d requested, but only %d given", n, f.args.length));
            }
            return f.args[n];
        });
        FX_EVALUATORS.put(CommonOps.CONST, (f, insn) -> CommonOps.CONST.cast(insn.op).arg);
        FX_EVALUATORS.put(CommonOps.IDENTITY.key, (f, insn) -> f.get(insn.args().get(0)));
        FX_EVALUATORS.put(CommonOps.ALLOCA.key, (f, insn) -> new Cell());
        FX_EVALUATORS.put(CommonOps.LOAD.key, (f, insn) -> cell(f.get(insn.args().get(0))).value);
        FX_EVALUATORS.put(CommonOps.STORE.key, (f, insn) -> {
            cell(f.get(insn.args().get(0))).value = f.get(insn.args().get(1));
            return null;
        });
        FX_EVALUATORS.put(CommonOps.CALL, (f, insn) ->
                f.host.call(CommonOps.CALL.cast(insn.op).arg, f.getAll(insn.args())));
        FX_EVALUATORS.put(JavaOps.SELECT, (f, insn) -> {
            List<Object> args = f.getAll(insn.args());
            boolean taken = JavaOps.SELECT.cast(insn.op).arg.test(args.subList(2, args.size()));
            return taken ? args.get(0) : args.get(1);
        });
        FX_EVALUATORS.put(JavaOps.BOOL_SELECT, (f, insn) ->
                JavaOps.BOOL_SELECT.cast(insn.op).arg.test(f.getAll(insn.args())));
        FX_EVALUATORS.put(JavaOps.INSNS, (f, insn) -> {
            InsnList il = JavaOps.INSNS.cast(insn.op).arg;
            if (il.size() != 1) {
                throw new UnsupportedOperationException(String.format("cannot interpret %s", insn));
            }
            return arith(il.getFirst(), f.getAll(insn.args()));
        });

        CTRL_EVALUATORS.put(CommonOps.BR.key, (f, ct) -> ct.targets.get(0));
        CTRL_EVALUATORS.put(JavaOps.BR_COND, (f, ct) -> {
            boolean taken = JavaOps.BR_COND.cast(ct.insn().op).arg.test(f.getAll(ct.insn().args()));
            return ct.targets.get(taken ? 0 : 1);
        });
        CTRL_EVALUATORS.put(JavaOps.TABLESWITCH.key, (f, ct) -> {
            int key = (Integer) f.get(ct.insn().args().get(0));
            int cases = ct.targets.size() - 1;
            return ct.targets.get(key >= 0 && key < cases ? key : cases);
        });
        CTRL_EVALUATORS.put(CommonOps.RETURN.key, (f, ct) -> {
            List<Var> args = ct.insn().args();
            f.result = args.isEmpty() ? null : f.get(args.get(0));
            return null;
        });
        CTRL_EVALUATORS.put(CommonOps.TRAP, (f, ct) -> {
            throw new TrapException(CommonOps.TRAP.cast(ct.insn().op).arg);
        });
        CTRL_EVALUATORS.put(JavaOps.TRY, (f, ct) -> {
            throw new UnsupportedOperationException("exception handlers cannot be interpreted");
        });
    }

    private static Cell cell(Object o) {
        if (!(o instanceof Cell)) {
            throw new IllegalStateException(String.format("not a storage cell: %s", o));
        }
        return (Cell) o;
    }

    private static int arith(AbstractInsnNode node, List<Object> args) {
        int a = (Integer) args.get(0);
        // @formatter:off
        switch (node.getOpcode()) {
            case Opcodes.INEG: return -a;
            case Opcodes.IADD: return a + (Integer) args.get(1);
            case Opcodes.ISUB: return a - (Integer) args.get(1);
            case Opcodes.IMUL: return a * (Integer) args.get(1);
            case Opcodes.IDIV: return a / (Integer) args.get(1);
            case Opcodes.IREM: return a % (Integer) args.get(1);
            case Opcodes.IAND: return a & (Integer) args.get(1);
            case Opcodes.IOR: return a | (Integer) args.get(1);
            case Opcodes.IXOR: return a ^ (Integer) args.get(1);
            default: throw new UnsupportedOperationException(String.format("cannot interpret opcode %d", node.getOpcode()));
        }
        // @formatter:on
    }
}
