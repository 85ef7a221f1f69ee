package io.github.eutro.flattening.ops;

import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Insn;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operations that are not specific to Java code.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its only target.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: returns its argument, or nothing, from the function.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: aborts execution with the given message. Has no targets.
     */
    public static final UnaryOpKey<String> TRAP = new UnaryOpKey<>("trap");

    /**
     * Effect: returns its argument.
     */
    public static final Op IDENTITY = new SimpleOpKey("id").create();

    /**
     * Effect: returns the argument at the same position as the predecessor control arrived from.
     * <p>
     * Must precede any other (non-phi) effect in its block.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", bbs ->
            bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")));

    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const").allowNull();

    /**
     * Effect: returns a new storage cell, which lives until the function returns.
     */
    public static final Op ALLOCA = new SimpleOpKey("alloca").create();
    /**
     * Effect: returns the value last stored in the cell given as its argument.
     */
    public static final Op LOAD = new SimpleOpKey("load").create();
    /**
     * Effect: stores its second argument into the cell given as its first. Returns nothing.
     */
    public static final Op STORE = new SimpleOpKey("store").create();

    /**
     * Effect: calls the named function of the host with its arguments, returning its result.
     */
    public static final UnaryOpKey<String> CALL = new UnaryOpKey<>("call");

    /**
     * Return an instruction which returns the constant {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}
