package io.github.eutro.flattening.test;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.passes.meta.ComputeDoms;
import io.github.eutro.flattening.passes.meta.ComputePreds;
import io.github.eutro.flattening.passes.meta.VerifyDominance;
import io.github.eutro.flattening.passes.meta.VerifyIntegrity;
import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Control;
import io.github.eutro.flattening.ssa.Effect;
import io.github.eutro.flattening.ssa.Function;
import io.github.eutro.flattening.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MetaPassesTest {
    @Test
    void testDoms() {
        Function func = Programs.diamond();
        BasicBlock unreachable = func.newBb();
        unreachable.setControl(Control.br(func.blocks.get(3)));
        List<BasicBlock> order = new ArrayList<>(func.blocks);

        ComputeDoms.INSTANCE.runInPlace(func);
        assertEquals(order, func.blocks);

        BasicBlock entry = func.blocks.get(0);
        assertNull(entry.getNullable(CommonExts.IDOM));
        for (int i = 1; i <= 3; i++) {
            assertSame(entry, func.blocks.get(i).getNullable(CommonExts.IDOM));
        }
        assertNull(unreachable.getNullable(CommonExts.IDOM));
        assertTrue(ComputeDoms.dominates(entry, func.blocks.get(3)));
        assertFalse(ComputeDoms.dominates(func.blocks.get(1), func.blocks.get(3)));
    }

    @Test
    void testLoopDoms() {
        Function func = Programs.sumLoop();
        ComputeDoms.INSTANCE.runInPlace(func);
        BasicBlock header = func.blocks.get(1);
        assertSame(header, func.blocks.get(2).getNullable(CommonExts.IDOM));
        assertSame(header, func.blocks.get(3).getNullable(CommonExts.IDOM));
    }

    @Test
    void testPreds() {
        Function func = Programs.sumLoop();
        ComputePreds.INSTANCE.runInPlace(func);
        assertEquals(Arrays.asList(func.blocks.get(0), func.blocks.get(2)),
                func.blocks.get(1).getExtOrThrow(CommonExts.PREDS));
        assertEquals(Collections.emptyList(), func.blocks.get(0).getExtOrThrow(CommonExts.PREDS));
    }

    @Test
    void testValidPrograms() {
        for (Function func : new Function[]{
                Programs.straightLine(),
                Programs.diamond(),
                Programs.sumLoop(),
                Programs.swapLoop(),
                Programs.outOfOrder(),
        }) {
            VerifyIntegrity.INSTANCE.runInPlace(func);
            VerifyDominance.INSTANCE.runInPlace(func);
        }
    }

    @Test
    void testUndominatedUse() {
        Function func = Programs.diamond();
        // use x, defined only on the left, in the merge block
        Var x = func.blocks.get(1).getEffects().get(0).getAssignsTo().get(0);
        BasicBlock m = func.blocks.get(3);
        m.addEffect(CommonOps.CALL.create("leak").insn(x).assignTo());
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> VerifyDominance.INSTANCE.runInPlace(func));
        assertTrue(e.getMessage().contains("not dominated"));
    }

    @Test
    void testUseBeforeDef() {
        Function func = Programs.straightLine();
        BasicBlock b1 = func.blocks.get(1);
        Effect call = b1.getEffects().get(0);
        Var x = call.getAssignsTo().get(0);
        b1.getEffects().add(0, CommonOps.IDENTITY.insn(x).assignTo(func.newVar("early")));
        assertThrows(IllegalStateException.class, () -> VerifyDominance.INSTANCE.runInPlace(func));
    }

    @Test
    void testPhiNotAtStart() {
        Function func = Programs.diamond();
        List<Effect> effects = func.blocks.get(3).getEffects();
        effects.add(0, effects.remove(1));
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }

    @Test
    void testForeignTarget() {
        Function func = Programs.straightLine();
        BasicBlock foreign = new Function().newBb();
        func.blocks.get(1).setControl(Control.br(foreign));
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }

    @Test
    void testDoubleAssignment() {
        Function func = Programs.straightLine();
        Var a = func.blocks.get(0).getEffects().get(0).getAssignsTo().get(0);
        func.blocks.get(1).addEffect(CommonOps.constant(1).assignTo(a));
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }
}
