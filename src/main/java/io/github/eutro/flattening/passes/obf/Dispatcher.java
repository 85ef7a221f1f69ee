package io.github.eutro.flattening.passes.obf;

import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Var;

import java.util.Collections;
import java.util.List;

/**
 * The dispatch loop of a flattened function.
 */
public final class Dispatcher {
    /**
     * The storage cell holding the index of the next case to run.
     */
    public final Var state;
    public final BasicBlock dispatch;
    /**
     * The case blocks, case {@code i} being {@code cases.get(i)}.
     */
    public final List<BasicBlock> cases;
    /**
     * Where the dispatch block goes for a state that is not a case index.
     */
    public final BasicBlock defaultTarget;

    public Dispatcher(Var state, BasicBlock dispatch, List<BasicBlock> cases, BasicBlock defaultTarget) {
        this.state = state;
        this.dispatch = dispatch;
        this.cases = Collections.unmodifiableList(cases);
        this.defaultTarget = defaultTarget;
    }

    @Override
    public String toString() {
        return String.format("Dispatcher(%s, %s, %d cases)", state, dispatch.toTargetString(), cases.size());
    }
}
