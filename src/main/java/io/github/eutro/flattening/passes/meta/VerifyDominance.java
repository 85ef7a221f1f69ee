package io.github.eutro.flattening.passes.meta;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.MetadataState;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.ssa.*;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that every use of a variable in a reachable block is dominated by its definition.
 * <p>
 * A phi argument counts as a use at the end of the corresponding predecessor.
 */
public class VerifyDominance implements InPlaceIRPass<Function> {
    public static final VerifyDominance INSTANCE = new VerifyDominance();

    @Override
    public void runInPlace(Function func) {
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func, MetadataState.DOMS);

        Set<BasicBlock> reachable = new HashSet<>();
        Map<Effect, Integer> positions = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            if (block == func.blocks.get(0) || block.getNullable(CommonExts.IDOM) != null) {
                reachable.add(block);
            }
            List<Effect> effects = block.getEffects();
            for (int i = 0; i < effects.size(); i++) {
                positions.put(effects.get(i), i);
            }
        }

        for (BasicBlock block : func.blocks) {
            if (!reachable.contains(block)) continue;
            List<Effect> effects = block.getEffects();
            for (int i = 0; i < effects.size(); i++) {
                Insn insn = effects.get(i).insn();
                if (insn.op.key == CommonOps.PHI) {
                    List<BasicBlock> preds = CommonOps.PHI.cast(insn.op).arg;
                    for (int j = 0; j < preds.size(); j++) {
                        BasicBlock pred = preds.get(j);
                        if (!reachable.contains(pred)) continue;
                        checkUse(insn.args().get(j), insn, pred, Integer.MAX_VALUE, positions);
                    }
                } else {
                    for (Var arg : insn.args()) {
                        checkUse(arg, insn, block, i, positions);
                    }
                }
            }
            Insn ctrl = block.getControl().insn();
            for (Var arg : ctrl.args()) {
                checkUse(arg, ctrl, block, Integer.MAX_VALUE, positions);
            }
        }
    }

    private static void checkUse(Var var, Insn user, BasicBlock useBlock, int usePos, Map<Effect, Integer> positions) {
        Effect def = var.getNullable(CommonExts.ASSIGNED_AT);
        BasicBlock defBlock = def == null ? null : def.getNullable(CommonExts.OWNING_BLOCK);
        boolean ok;
        if (defBlock == null) {
            ok = false;
        } else if (defBlock == useBlock) {
            ok = positions.get(def) < usePos;
        } else {
            ok = ComputeDoms.dominates(defBlock, useBlock);
        }
        if (!ok) {
            IllegalStateException e = new IllegalStateException(String.format(
                    "use of %s not dominated by its definition" +
                            "\n  used at: %s" +
                            "\n  in block: %s" +
                            "\n  defined at: %s" +
                            "\n  in block: %s",
                    var,
                    user,
                    useBlock.toTargetString(),
                    def,
                    defBlock == null ? "<none>" : defBlock.toTargetString()));
            if (user.created != null) {
                e.addSuppressed(user.created);
            }
            throw e;
        }
    }
}
