package io.github.eutro.flattening.ssa;

import io.github.eutro.flattening.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: a list of {@link Effect}s followed by exactly one {@link Control}.
 * <p>
 * Blocks are identified by identity.
 */
public final class BasicBlock extends ExtHolder {
    private final TrackedList<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            registerWithThis(elt);
        }

        @Override
        protected void onRemoved(Effect elt) {
            if (elt.getNullable(CommonExts.OWNING_BLOCK) == BasicBlock.this) {
                elt.removeExt(CommonExts.OWNING_BLOCK);
            }
        }
    };
    private Control control;

    BasicBlock() {
    }

    /**
     * Format this block as a jump target, for display.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    private <T extends ExtContainer> T registerWithThis(T extable) {
        if (extable != null) {
            extable.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        return extable;
    }

    /**
     * Get the mutable list of effects in this block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        if (this.control != null && this.control.getNullable(CommonExts.OWNING_BLOCK) == this) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        this.control = registerWithThis(control);
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
