package io.github.eutro.flattening.passes.meta;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.MetadataState;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.ssa.*;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes the {@link CommonExts#USED_AT uses} of every {@link Var} in a function.
 */
public class ComputeUses implements InPlaceIRPass<Function> {
    public static final ComputeUses INSTANCE = new ComputeUses();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var arg : effect.insn().args()) {
                    arg.removeExt(CommonExts.USED_AT);
                }
                for (Var var : effect.getAssignsTo()) {
                    var.removeExt(CommonExts.USED_AT);
                }
            }
            for (Var arg : block.getControl().insn().args()) {
                arg.removeExt(CommonExts.USED_AT);
            }
        }
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var arg : effect.insn().args()) {
                    getOrCreateUses(arg).add(effect.insn());
                }
                for (Var var : effect.getAssignsTo()) {
                    getOrCreateUses(var);
                }
            }
            Control ctrl = block.getControl();
            for (Var arg : ctrl.insn().args()) {
                getOrCreateUses(arg).add(ctrl.insn());
            }
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.USES);
    }

    /**
     * Get the use set of a variable, creating an empty one if it has none.
     * Passes that keep uses up to date by hand go through this.
     *
     * @param var The variable.
     * @return Its mutable use set.
     */
    @NotNull
    public static Set<Insn> getOrCreateUses(Var var) {
        Set<Insn> uses = var.getNullable(CommonExts.USED_AT);
        if (uses == null) {
            // ordered, so that passes walking uses edit the IR deterministically
            uses = new LinkedHashSet<>();
            var.attachExt(CommonExts.USED_AT, uses);
        }
        return uses;
    }
}
