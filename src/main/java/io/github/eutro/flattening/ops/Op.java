package io.github.eutro.flattening.ops;

import io.github.eutro.flattening.ext.DelegatingExtHolder;
import io.github.eutro.flattening.ext.ExtContainer;
import io.github.eutro.flattening.ssa.Insn;
import io.github.eutro.flattening.ssa.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if any.
 */
public class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}
