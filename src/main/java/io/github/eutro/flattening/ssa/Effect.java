package io.github.eutro.flattening.ssa;

import io.github.eutro.flattening.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A non-control instruction in a block, together with the variables it assigns.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo = new TrackedList<Var>(new ArrayList<>()) {
        @Override
        protected void onAdded(Var elt) {
            elt.attachExt(CommonExts.ASSIGNED_AT, Effect.this);
        }

        @Override
        protected void onRemoved(Var elt) {
        }
    };
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo.addAll(assignsTo);
        this.setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!assignsTo.isEmpty()) {
            sb.append(assignsTo.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn());
        return sb.toString();
    }

    /**
     * Get the variables this effect assigns to. Variables added to the list
     * have their {@link CommonExts#ASSIGNED_AT} set to this effect.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
