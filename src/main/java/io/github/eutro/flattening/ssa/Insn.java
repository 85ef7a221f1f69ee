package io.github.eutro.flattening.ssa;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.DelegatingExtHolder;
import io.github.eutro.flattening.ext.Ext;
import io.github.eutro.flattening.ext.ExtContainer;
import io.github.eutro.flattening.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An instruction: an {@link Op} applied to some argument {@link Var}s.
 * <p>
 * An instruction becomes part of a block by being wrapped in an {@link Effect}
 * ({@link #assignTo(Var...)}) or a {@link Control} ({@link #jumpsTo(BasicBlock...)}).
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    public static final boolean TRACK_INSN_CREATIONS = System.getenv("FLATTENING_TRACK_INSN_CREATIONS") != null;

    /**
     * Where this instruction was constructed, if {@link #TRACK_INSN_CREATIONS} is set.
     */
    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    /**
     * Get the mutable list of arguments of this instruction.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    /**
     * Create an effect assigning to the same variables as {@code fx}, which replaces it.
     *
     * @param fx The effect to take the variables of.
     * @return The new effect.
     */
    public Effect copyFrom(Effect fx) {
        return assignTo(new ArrayList<>(fx.getAssignsTo()));
    }

    /**
     * Get the block this instruction is in, through its effect or control.
     *
     * @return The block, or null if the instruction is not in one.
     */
    public @Nullable BasicBlock getBlock() {
        if (owner == null) return null;
        return ((ExtContainer) owner).getNullable(CommonExts.OWNING_BLOCK);
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }
}
