package io.github.eutro.flattening.passes.obf;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.ops.JavaOps;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.passes.form.DemoteToStack;
import io.github.eutro.flattening.ssa.*;
import io.github.eutro.flattening.util.IRUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Flattens the control flow of a function into a single dispatch loop.
 * <p>
 * Every block but the entry becomes a case of a {@link JavaOps#TABLESWITCH} on a
 * state cell. Each case ends by storing the index of the case to run next and
 * jumping back to the dispatch block, so the original edges only exist as
 * state values. Values which crossed blocks are then {@link DemoteToStack demoted}
 * to storage cells.
 * <p>
 * Functions that cannot be flattened are left untouched. These are functions with
 * exceptional edges, fewer than two blocks, branches to more than two targets
 * (or two-target branches other than {@link JavaOps#BR_COND}), and functions whose
 * entry block is jumped to or jumps nowhere.
 */
public class Flatten implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Flatten.class);

    public static final Flatten INSTANCE = new Flatten(DefaultTarget.LOOP);

    /**
     * Where the dispatch block jumps if the state matches no case.
     */
    public enum DefaultTarget {
        /**
         * Back to the dispatch block itself.
         */
        LOOP,
        /**
         * To a block that traps.
         */
        TRAP,
    }

    private final DefaultTarget defaultTarget;

    public Flatten(DefaultTarget defaultTarget) {
        this.defaultTarget = defaultTarget;
    }

    @Override
    public void runInPlace(Function func) {
        flatten(func);
    }

    /**
     * Flatten a function, if it can be.
     *
     * @param func The function.
     * @return Whether the function was flattened. If false, it was not modified.
     */
    public boolean flatten(Function func) {
        String rejection = checkFlattenable(func);
        if (rejection != null) {
            LOGGER.debug("not flattening function: {}", rejection);
            return false;
        }

        BasicBlock entry = func.blocks.get(0);
        if (entry.getControl().targets.size() > 1) {
            List<Effect> effects = entry.getEffects();
            IRUtils.splitBlock(func, entry, effects.isEmpty() ? 0 : effects.size() - 1);
        }

        List<BasicBlock> cases = new ArrayList<>(func.blocks.subList(1, func.blocks.size()));
        Map<BasicBlock, Integer> caseTable = new LinkedHashMap<>();
        for (BasicBlock block : cases) {
            caseTable.put(block, caseTable.size());
        }

        Var state = IRUtils.allocaAtEntry(func, "switchVar");
        BasicBlock dispatch = func.newBbAt(1);
        BasicBlock dflt;
        if (defaultTarget == DefaultTarget.TRAP) {
            dflt = func.newBb();
            dflt.setControl(CommonOps.TRAP.create("unmatched dispatch state").insn().jumpsTo());
        } else {
            dflt = dispatch;
        }

        IRBuilder ib = new IRBuilder(func, dispatch);
        Var stateVal = ib.insert(CommonOps.LOAD.insn(state), "switchVar.load");
        List<BasicBlock> switchTargets = new ArrayList<>(cases);
        switchTargets.add(dflt);
        ib.insertCtrl(JavaOps.TABLESWITCH.insn(stateVal).jumpsTo(switchTargets));

        ib.setBlock(entry);
        BasicBlock first = entry.getControl().targets.get(0);
        Var init = ib.insert(CommonOps.constant(caseOf(caseTable, first)), "init");
        ib.insert(CommonOps.STORE.insn(state, init).assignTo());
        ib.insertCtrl(Control.br(dispatch));

        for (BasicBlock block : cases) {
            rewriteTerminator(ib, block, state, dispatch, caseTable);
        }

        for (Map.Entry<BasicBlock, Integer> entryCase : caseTable.entrySet()) {
            entryCase.getKey().attachExt(CommonExts.CASE_INDEX, entryCase.getValue());
        }
        func.attachExt(CommonExts.DISPATCHER, new Dispatcher(state, dispatch, cases, dflt));
        func.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();

        DemoteToStack.INSTANCE.runInPlace(func);

        LOGGER.debug("flattened function into {} cases", cases.size());
        return true;
    }

    private static void rewriteTerminator(
            IRBuilder ib,
            BasicBlock block,
            Var state,
            BasicBlock dispatch,
            Map<BasicBlock, Integer> caseTable
    ) {
        Control ctrl = block.getControl();
        Var next;
        ib.setBlock(block);
        switch (ctrl.targets.size()) {
            case 0:
                return;
            case 1:
                next = ib.insert(CommonOps.constant(caseOf(caseTable, ctrl.targets.get(0))), "next");
                break;
            case 2: {
                JavaOps.JumpType type = JavaOps.BR_COND.cast(ctrl.insn().op).arg;
                Var taken = ib.insert(CommonOps.constant(caseOf(caseTable, ctrl.targets.get(0))), "taken");
                Var fallthrough = ib.insert(CommonOps.constant(caseOf(caseTable, ctrl.targets.get(1))), "fallthrough");
                List<Var> selectArgs = new ArrayList<>();
                selectArgs.add(taken);
                selectArgs.add(fallthrough);
                selectArgs.addAll(ctrl.insn().args());
                next = ib.insert(JavaOps.SELECT.create(type).insn(selectArgs), "next");
                break;
            }
            default:
                throw new IllegalStateException(String.format(
                        "cannot rewrite control with %d targets: %s",
                        ctrl.targets.size(), ctrl));
        }
        ib.insert(CommonOps.STORE.insn(state, next).assignTo());
        ib.insertCtrl(Control.br(dispatch));
    }

    private static int caseOf(Map<BasicBlock, Integer> caseTable, BasicBlock target) {
        Integer index = caseTable.get(target);
        if (index == null) {
            throw new IllegalStateException(String.format(
                    "jump target %s has no case", target.toTargetString()));
        }
        return index;
    }

    private static String checkFlattenable(Function func) {
        if (func.blocks.size() <= 1) {
            return "function has a single block";
        }
        BasicBlock entry = func.blocks.get(0);
        for (BasicBlock block : func.blocks) {
            Control ctrl = block.getControl();
            if (Boolean.TRUE.equals(ctrl.insn().getNullable(CommonExts.HAS_EXCEPTIONAL_EDGE))) {
                return String.format("block %s has an exceptional edge: %s", block.toTargetString(), ctrl);
            }
            int targets = ctrl.targets.size();
            if (targets > 2 || targets == 2 && ctrl.insn().op.key != JavaOps.BR_COND) {
                return String.format("block %s has an unsupported branch: %s", block.toTargetString(), ctrl);
            }
            if (ctrl.targets.contains(entry)) {
                return String.format("block %s jumps to the entry block", block.toTargetString());
            }
        }
        if (entry.getControl().targets.isEmpty()) {
            return "entry block does not jump anywhere";
        }
        return null;
    }
}
