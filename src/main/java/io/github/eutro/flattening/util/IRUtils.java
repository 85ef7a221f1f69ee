package io.github.eutro.flattening.util;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.ssa.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Small edits on the IR shared between passes.
 */
public class IRUtils {
    /**
     * Split a block in two. The effects from {@code index} onward and the control move to a
     * new block placed right after {@code block}, which then ends by jumping to the new block.
     * <p>
     * Phis in the successors are updated to name the new block as their predecessor.
     *
     * @param func  The function containing the block.
     * @param block The block to split.
     * @param index The index of the first effect to move.
     * @return The new block.
     */
    public static BasicBlock splitBlock(Function func, BasicBlock block, int index) {
        List<Effect> effects = block.getEffects();
        if (index < 0 || index > effects.size()) {
            throw new IndexOutOfBoundsException(String.format(
                    "split index %d out of bounds for block with %d effects", index, effects.size()));
        }
        if (index < effects.size() && effects.get(index).insn().op.key == CommonOps.PHI) {
            throw new IllegalArgumentException("cannot split a block before a phi");
        }
        BasicBlock tail = func.newBbAt(func.blocks.indexOf(block) + 1);
        List<Effect> moved = effects.subList(index, effects.size());
        for (Effect effect : new ArrayList<>(moved)) {
            tail.addEffect(effect);
        }
        moved.clear();
        tail.setControl(block.getControl());
        block.setControl(Control.br(tail));
        for (BasicBlock succ : tail.getControl().targets) {
            replacePhiPred(succ, block, tail);
        }
        func.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        return tail;
    }

    /**
     * Make the phis of {@code block} take the values they took from {@code from} from {@code to} instead.
     *
     * @param block The block whose phis to update.
     * @param from  The old predecessor.
     * @param to    The new predecessor.
     */
    public static void replacePhiPred(BasicBlock block, BasicBlock from, BasicBlock to) {
        for (Effect effect : block.getEffects()) {
            Insn insn = effect.insn();
            if (insn.op.key != CommonOps.PHI) break;
            List<BasicBlock> preds = CommonOps.PHI.cast(insn.op).arg;
            if (!preds.contains(from)) continue;
            List<BasicBlock> newPreds = new ArrayList<>(preds);
            newPreds.replaceAll(pred -> pred == from ? to : pred);
            insn.op = CommonOps.PHI.create(newPreds);
        }
    }

    /**
     * Allocate a storage cell at the top of the entry block, after any other cells.
     *
     * @param func The function.
     * @param name The name of the cell variable.
     * @return The variable holding the cell.
     */
    public static Var allocaAtEntry(Function func, String name) {
        BasicBlock entry = func.blocks.get(0);
        List<Effect> effects = entry.getEffects();
        int i = 0;
        while (i < effects.size() && isAlloca(effects.get(i))) i++;
        Var cell = func.newVar(name);
        effects.add(i, CommonOps.ALLOCA.insn().assignTo(cell));
        return cell;
    }

    public static boolean isAlloca(Effect effect) {
        return effect.insn().op == CommonOps.ALLOCA;
    }

    /**
     * Check whether {@code var} is a storage cell allocated in the entry block,
     * which is available everywhere in the function.
     *
     * @param var The variable.
     * @return Whether it is an entry cell.
     */
    public static boolean isEntryCell(Var var) {
        Effect def = var.getNullable(CommonExts.ASSIGNED_AT);
        if (def == null || !isAlloca(def)) return false;
        BasicBlock block = def.getNullable(CommonExts.OWNING_BLOCK);
        if (block == null) return false;
        Function func = block.getNullable(CommonExts.OWNING_FUNCTION);
        return func != null && func.blocks.get(0) == block;
    }

    /**
     * Find the index of the first effect in a block that is not a phi.
     *
     * @param block The block.
     * @return The index.
     */
    public static int firstNonPhi(BasicBlock block) {
        List<Effect> effects = block.getEffects();
        int i = 0;
        while (i < effects.size() && effects.get(i).insn().op.key == CommonOps.PHI) i++;
        return i;
    }
}
