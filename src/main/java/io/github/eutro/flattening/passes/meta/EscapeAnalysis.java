package io.github.eutro.flattening.passes.meta;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.MetadataState;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.ssa.*;
import io.github.eutro.flattening.util.IRUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds variables whose value must survive a jump: those used in a block other
 * than the one defining them, or used by a phi.
 * <p>
 * Queries read {@link CommonExts#USED_AT}, so {@link MetadataState#USES} must be valid.
 */
public class EscapeAnalysis {
    /**
     * Check whether a variable escapes its defining block.
     *
     * @param var The variable.
     * @return Whether any use of it is in another block, or is a phi.
     */
    public static boolean escapes(Var var) {
        Set<Insn> uses = var.getNullable(CommonExts.USED_AT);
        if (uses == null || uses.isEmpty()) return false;
        Effect def = var.getNullable(CommonExts.ASSIGNED_AT);
        BasicBlock defBlock = def == null ? null : def.getNullable(CommonExts.OWNING_BLOCK);
        for (Insn use : uses) {
            if (use.op.key == CommonOps.PHI) return true;
            if (use.getBlock() != defBlock) return true;
        }
        return false;
    }

    /**
     * List the escaping variables of a function in block order, except storage
     * cells allocated in the entry block, which are valid everywhere.
     *
     * @param func The function.
     * @return The escaping variables.
     */
    public static List<Var> findEscaping(Function func) {
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func, MetadataState.USES);
        List<Var> escaping = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    if (!IRUtils.isEntryCell(var) && escapes(var)) {
                        escaping.add(var);
                    }
                }
            }
        }
        return escaping;
    }
}
