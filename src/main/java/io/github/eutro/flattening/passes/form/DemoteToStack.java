package io.github.eutro.flattening.passes.form;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.MetadataState;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.passes.meta.ComputeUses;
import io.github.eutro.flattening.passes.meta.EscapeAnalysis;
import io.github.eutro.flattening.ssa.*;
import io.github.eutro.flattening.util.IRUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Moves values that cross block boundaries into storage cells allocated in the entry block.
 * <p>
 * Every phi is replaced by a load from a cell, which each predecessor stores its incoming
 * value into just before leaving. Then every variable still used outside its defining
 * block is stored to a cell right after its definition, and reloaded in each block that
 * uses it. Afterwards no phis remain, and the only variables used in more than one block
 * are the entry block's cells.
 * <p>
 * {@link CommonExts#USED_AT} is kept up to date as the function is edited, so the
 * variables a demotion exposes are found without recomputing uses.
 */
public class DemoteToStack implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemoteToStack.class);

    public static final DemoteToStack INSTANCE = new DemoteToStack();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.USES);

        List<Effect> phis = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                if (effect.insn().op.key != CommonOps.PHI) break;
                phis.add(effect);
            }
        }

        Deque<Var> worklist = new ArrayDeque<>();
        for (Effect phi : phis) {
            Var phiVar = demotePhi(func, phi);
            if (EscapeAnalysis.escapes(phiVar)) {
                worklist.add(phiVar);
            }
        }
        // incoming values stored in predecessors may have started or stopped escaping
        worklist.addAll(EscapeAnalysis.findEscaping(func));

        Set<Var> visited = new HashSet<>();
        int demoted = 0;
        while (!worklist.isEmpty()) {
            Var var = worklist.remove();
            if (!visited.add(var) || !EscapeAnalysis.escapes(var)) continue;
            demoteVar(func, var);
            demoted++;
        }

        LOGGER.debug("demoted {} phis and {} variables to stack", phis.size(), demoted);
        ms.varsChanged();
    }

    private static Var demotePhi(Function func, Effect phi) {
        BasicBlock block = phi.getExtOrThrow(CommonExts.OWNING_BLOCK);
        Insn phiInsn = phi.insn();
        List<BasicBlock> preds = CommonOps.PHI.cast(phiInsn.op).arg;
        List<Var> values = phiInsn.args();
        if (phi.getAssignsTo().size() != 1) {
            throw new IllegalStateException(String.format("phi assigns %d variables: %s",
                    phi.getAssignsTo().size(), phi));
        }
        Var phiVar = phi.getAssignsTo().get(0);

        Var cell = IRUtils.allocaAtEntry(func, phiVar.name + "_cell");
        Set<Insn> cellUses = ComputeUses.getOrCreateUses(cell);
        for (int i = 0; i < preds.size(); i++) {
            BasicBlock pred = preds.get(i);
            Var value = values.get(i);
            Insn store = CommonOps.STORE.insn(cell, value);
            pred.addEffect(store.assignTo());
            cellUses.add(store);
            Set<Insn> valueUses = ComputeUses.getOrCreateUses(value);
            valueUses.remove(phiInsn);
            valueUses.add(store);
        }

        Insn load = CommonOps.LOAD.insn(cell);
        List<Effect> effects = block.getEffects();
        effects.set(effects.indexOf(phi), load.copyFrom(phi));
        cellUses.add(load);
        phiVar.attachExt(CommonExts.IS_PHI, true);
        return phiVar;
    }

    private static void demoteVar(Function func, Var var) {
        Effect def = var.getNullable(CommonExts.ASSIGNED_AT);
        BasicBlock defBlock = def == null ? null : def.getNullable(CommonExts.OWNING_BLOCK);
        if (defBlock == null) {
            throw new IllegalStateException(String.format("variable %s is used but never assigned", var));
        }

        Var cell = IRUtils.allocaAtEntry(func, var.name + "_cell");
        Set<Insn> cellUses = ComputeUses.getOrCreateUses(cell);
        Set<Insn> uses = ComputeUses.getOrCreateUses(var);

        List<Insn> remote = new ArrayList<>();
        for (Insn use : uses) {
            if (use.getBlock() != defBlock) {
                remote.add(use);
            }
        }

        Insn store = CommonOps.STORE.insn(cell, var);
        List<Effect> defEffects = defBlock.getEffects();
        defEffects.add(defEffects.indexOf(def) + 1, store.assignTo());
        cellUses.add(store);
        uses.add(store);

        for (Insn use : remote) {
            BasicBlock useBlock = Objects.requireNonNull(use.getBlock());
            Var reloaded = func.newVar(var.name);
            Insn load = CommonOps.LOAD.insn(cell);
            List<Effect> effects = useBlock.getEffects();
            Effect useFx = use.getNullable(CommonExts.OWNING_EFFECT);
            effects.add(useFx == null ? effects.size() : effects.indexOf(useFx), load.assignTo(reloaded));
            cellUses.add(load);

            ListIterator<Var> it = use.args().listIterator();
            while (it.hasNext()) {
                if (it.next() == var) it.set(reloaded);
            }
            uses.remove(use);
            ComputeUses.getOrCreateUses(reloaded).add(use);
        }
    }
}
