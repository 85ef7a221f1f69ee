package io.github.eutro.flattening.ssa;

/**
 * Appends instructions to the end of a block of a function.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock bb;

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Insert an instruction, assigning its result to {@code v}.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return {@code v}
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Insert an instruction, assigning its result to a new variable.
     *
     * @param insn The instruction.
     * @param name The name of the new variable.
     * @return The new variable.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }
}
