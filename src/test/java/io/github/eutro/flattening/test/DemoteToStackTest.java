package io.github.eutro.flattening.test;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.passes.Passes;
import io.github.eutro.flattening.passes.form.DemoteToStack;
import io.github.eutro.flattening.passes.meta.EscapeAnalysis;
import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Effect;
import io.github.eutro.flattening.ssa.Function;
import io.github.eutro.flattening.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.function.Supplier;

import static io.github.eutro.flattening.test.Utils.trace;
import static org.junit.jupiter.api.Assertions.*;

public class DemoteToStackTest {
    void testDemotion(Supplier<Function> program, Object... args) {
        Function func = program.get();
        Utils.Trace before = trace(func, args);
        DemoteToStack.INSTANCE.runInPlace(func);
        Passes.VERIFY.run(func);
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                assertNotSame(CommonOps.PHI, effect.insn().op.key);
            }
        }
        assertEquals(Collections.emptyList(), EscapeAnalysis.findEscaping(func));
        assertEquals(before, trace(func, args));
    }

    @Test
    void testDiamond() {
        testDemotion(Programs::diamond, 1);
    }

    @Test
    void testLoop() {
        testDemotion(Programs::sumLoop, 6);
    }

    @Test
    void testSwap() {
        testDemotion(Programs::swapLoop, 3, 4, 5);
    }

    @Test
    void testPhiBecomesLoad() {
        Function func = Programs.diamond();
        BasicBlock m = func.blocks.get(3);
        Var p = m.getEffects().get(0).getAssignsTo().get(0);
        DemoteToStack.INSTANCE.runInPlace(func);

        Effect def = p.getExtOrThrow(CommonExts.ASSIGNED_AT);
        assertSame(m, def.getExtOrThrow(CommonExts.OWNING_BLOCK));
        assertSame(CommonOps.LOAD, def.insn().op);
        assertEquals(Boolean.TRUE, p.getNullable(CommonExts.IS_PHI));

        // both incoming values are stored at the end of their predecessor
        Var cell = def.insn().args().get(0);
        for (BasicBlock pred : new BasicBlock[]{func.blocks.get(1), func.blocks.get(2)}) {
            Effect last = pred.getEffects().get(pred.getEffects().size() - 1);
            assertSame(CommonOps.STORE, last.insn().op);
            assertSame(cell, last.insn().args().get(0));
        }
    }

    @Test
    void testLocalValuesStay() {
        Function func = Programs.singleBlock();
        String before = func.toString();
        DemoteToStack.INSTANCE.runInPlace(func);
        assertEquals(before, func.toString());
    }
}
