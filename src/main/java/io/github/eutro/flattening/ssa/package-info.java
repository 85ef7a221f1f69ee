/**
 * The intermediate representation (IR) transformed by this library.
 * <p>
 * A {@link io.github.eutro.flattening.ssa.Function} is a list of
 * {@link io.github.eutro.flattening.ssa.BasicBlock}s, each a list of
 * {@link io.github.eutro.flattening.ssa.Effect}s ended by one
 * {@link io.github.eutro.flattening.ssa.Control}. Both wrap an
 * {@link io.github.eutro.flattening.ssa.Insn}, an
 * {@link io.github.eutro.flattening.ops.Op operation} on some
 * {@link io.github.eutro.flattening.ssa.Var}s.
 * <p>
 * The IR is expected to be in static single assignment form: each variable is
 * assigned by exactly one effect, and that effect dominates every use of the variable.
 * Values that depend on the edge control arrived from are expressed with
 * {@link io.github.eutro.flattening.ops.CommonOps#PHI phi} effects at the head of a block.
 */
package io.github.eutro.flattening.ssa;
