package io.github.eutro.flattening.ext;

import io.github.eutro.flattening.ops.Op;
import io.github.eutro.flattening.ops.OpKey;
import io.github.eutro.flattening.passes.form.DemoteToStack;
import io.github.eutro.flattening.passes.meta.ComputeDoms;
import io.github.eutro.flattening.passes.meta.ComputePreds;
import io.github.eutro.flattening.passes.meta.ComputeUses;
import io.github.eutro.flattening.passes.obf.Dispatcher;
import io.github.eutro.flattening.passes.obf.Flatten;
import io.github.eutro.flattening.ssa.*;

import java.util.List;
import java.util.Set;

/**
 * The {@link Ext}s used throughout the IR.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which analyses are currently valid for it.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}, computed by {@link ComputeDoms}. Its immediate dominator,
     * absent for the entry block and unreachable blocks.
     */
    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
    /**
     * Attached to a {@link BasicBlock}, computed by {@link ComputePreds}. Its predecessors,
     * once for each edge.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey} of a control instruction.
     * Whether control can leave the block through an edge that is not one of its targets,
     * such as an exception handler.
     */
    public static final Ext<Boolean> HAS_EXCEPTIONAL_EDGE = Ext.create(Boolean.class, "HAS_EXCEPTIONAL_EDGE");

    /**
     * Attached to a {@link Var}. The {@link Effect} it is assigned at.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    /**
     * Attached to a {@link Var}, computed by {@link ComputeUses}. The instructions that use it.
     */
    public static final Ext<Set<Insn>> USED_AT = Ext.create(Set.class, "USED_AT");
    /**
     * Attached to a {@link Var}. Whether it was assigned by a phi that has since been
     * replaced by a load from a storage cell.
     *
     * @see DemoteToStack
     */
    public static final Ext<Boolean> IS_PHI = Ext.create(Boolean.class, "IS_PHI");

    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Attached to a {@link Function} by {@link Flatten}. The dispatch loop that was built.
     */
    public static final Ext<Dispatcher> DISPATCHER = Ext.create(Dispatcher.class, "DISPATCHER");
    /**
     * Attached to a {@link BasicBlock} by {@link Flatten}. The state value that selects it.
     */
    public static final Ext<Integer> CASE_INDEX = Ext.create(Integer.class, "CASE_INDEX");
}
