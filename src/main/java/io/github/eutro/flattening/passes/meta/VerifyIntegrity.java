package io.github.eutro.flattening.passes.meta;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.ssa.*;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Checks that a function is well-formed, throwing {@link IllegalStateException} if not.
 * <p>
 * Every block must end in a control owned by it, phis must come first and name
 * as many predecessors as they have arguments, every referenced block must be in
 * the function, and every variable must be assigned once.
 */
public class VerifyIntegrity implements InPlaceIRPass<Function> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Function function) {
        Set<BasicBlock> blockSet = new HashSet<>(function.blocks);
        if (blockSet.size() != function.blocks.size()) {
            throw new IllegalStateException("function contains duplicate blocks");
        }
        Set<Var> assigned = new HashSet<>();

        for (BasicBlock block : function.blocks) {
            if (block.getControl() == null) {
                throw new IllegalStateException(String.format(
                        "block has no control\n  in block: %s",
                        block.toTargetString()));
            }

            Iterator<Effect> it = block.getEffects().iterator();
            while (it.hasNext()) {
                Effect effect = it.next();
                if (effect.insn().op.key == CommonOps.PHI) {
                    List<BasicBlock> preds = CommonOps.PHI.cast(effect.insn().op).arg;
                    if (preds.size() != effect.insn().args().size()) {
                        throw new IllegalStateException(String.format(
                                "phi has %d predecessors but %d arguments\n  phi: %s\n  in block: %s",
                                preds.size(),
                                effect.insn().args().size(),
                                effect,
                                block));
                    }
                    for (BasicBlock pred : preds) {
                        if (!blockSet.contains(pred)) {
                            throwInvalidReference(block, effect, pred);
                        }
                    }
                } else {
                    break;
                }
            }
            while (it.hasNext()) {
                if (it.next().insn().op.key == CommonOps.PHI) {
                    throw new IllegalStateException(String.format(
                            "phi not at block start\n  in block: %s",
                            block));
                }
            }

            for (Effect effect : block.getEffects()) {
                if (effect.getNullable(CommonExts.OWNING_BLOCK) != block) {
                    throw new IllegalStateException(String.format(
                            "effect not owned by block\n  effect: %s\n  block: %s",
                            effect,
                            block));
                }
                for (Var var : effect.getAssignsTo()) {
                    if (!assigned.add(var) || var.getNullable(CommonExts.ASSIGNED_AT) != effect) {
                        throw new IllegalStateException(String.format(
                                "variable assigned more than once\n  variable: %s\n  effect: %s\n  in block: %s",
                                var,
                                effect,
                                block.toTargetString()));
                    }
                }
            }
            if (block.getControl().getNullable(CommonExts.OWNING_BLOCK) != block) {
                throw new IllegalStateException(String.format(
                        "control not owned by block\n  control: %s\n  block: %s",
                        block.getControl(),
                        block));
            }

            for (BasicBlock target : block.getControl().targets) {
                if (!blockSet.contains(target)) {
                    throwInvalidReference(block, block.getControl(), target);
                }
            }
        }
    }

    private void throwInvalidReference(BasicBlock block, Object insn, BasicBlock referenced) {
        throw new IllegalStateException(String.format(
                "instruction references block not in function;" +
                        "\n  referenced: %s" +
                        "\n  instruction: %s" +
                        "\n  in block: %s",
                referenced.toTargetString(),
                insn,
                block
        ));
    }
}
