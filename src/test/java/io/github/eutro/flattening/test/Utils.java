package io.github.eutro.flattening.test;

import io.github.eutro.flattening.exec.Interpreter;
import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.ops.JavaOps;
import io.github.eutro.flattening.passes.Passes;
import io.github.eutro.flattening.passes.meta.EscapeAnalysis;
import io.github.eutro.flattening.passes.obf.Dispatcher;
import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Control;
import io.github.eutro.flattening.ssa.Effect;
import io.github.eutro.flattening.ssa.Function;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class Utils {
    /**
     * What a run of a function did: the calls it made, in order, and how it finished.
     */
    public static final class Trace {
        final List<String> calls;
        final Object result;

        Trace(List<String> calls, Object result) {
            this.calls = calls;
            this.result = result;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Trace)) return false;
            Trace trace = (Trace) o;
            return calls.equals(trace.calls) && Objects.equals(result, trace.result);
        }

        @Override
        public int hashCode() {
            return Objects.hash(calls, result);
        }

        @Override
        public String toString() {
            return "Trace{calls=" + calls + ", result=" + result + "}";
        }
    }

    /**
     * Run a function with a host that logs each call and returns its name and arguments,
     * except {@code check} and {@code again}, which return their first argument, or 0.
     */
    public static Trace trace(Function func, Object... args) {
        List<String> calls = new ArrayList<>();
        Object result;
        try {
            result = new Interpreter((name, callArgs) -> {
                calls.add(name + callArgs);
                switch (name) {
                    case "check":
                    case "again":
                        return callArgs.isEmpty() ? 0 : callArgs.get(0);
                    default:
                        return name + callArgs;
                }
            }, 100_000).run(func, args);
        } catch (Interpreter.TrapException e) {
            result = "trap: " + e.getMessage();
        }
        return new Trace(calls, result);
    }

    /**
     * Check the shape of a flattened function: an entry that jumps to the dispatch block
     * right after it, a case for every other block, cases that only ever jump back to
     * the dispatch block, no phis, and no values live across blocks except entry cells.
     */
    public static Dispatcher assertFlattened(Function func) {
        Passes.VERIFY.run(func);

        Dispatcher dispatcher = func.getExtOrThrow(CommonExts.DISPATCHER);
        BasicBlock entry = func.blocks.get(0);
        assertSame(dispatcher.dispatch, func.blocks.get(1));
        assertEquals(Collections.singletonList(dispatcher.dispatch), entry.getControl().targets);

        Control sw = dispatcher.dispatch.getControl();
        assertSame(JavaOps.TABLESWITCH, sw.insn().op);
        List<BasicBlock> expectedTargets = new ArrayList<>(dispatcher.cases);
        expectedTargets.add(dispatcher.defaultTarget);
        assertEquals(expectedTargets, sw.targets);

        Set<BasicBlock> others = new LinkedHashSet<>(func.blocks);
        others.remove(entry);
        others.remove(dispatcher.dispatch);
        others.remove(dispatcher.defaultTarget);
        assertEquals(others, new LinkedHashSet<>(dispatcher.cases));
        assertEquals(dispatcher.cases.size(), new HashSet<>(dispatcher.cases).size());

        for (int i = 0; i < dispatcher.cases.size(); i++) {
            BasicBlock block = dispatcher.cases.get(i);
            assertEquals(i, block.getExtOrThrow(CommonExts.CASE_INDEX));
            List<BasicBlock> targets = block.getControl().targets;
            assertTrue(targets.isEmpty() || targets.equals(Collections.singletonList(dispatcher.dispatch)),
                    () -> "case jumps elsewhere: " + block);
        }

        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                assertNotSame(CommonOps.PHI, effect.insn().op.key, () -> "phi left in " + block);
            }
        }
        assertEquals(Collections.emptyList(), EscapeAnalysis.findEscaping(func));
        return dispatcher;
    }
}
