/**
 * The ext API associates typed side-data with IR objects.
 *
 * <pre>{@code
 * Ext<Integer> CASE = Ext.create(Integer.class, "CASE");
 * block.attachExt(CASE, 3);
 * block.getExtOrThrow(CASE); // => 3
 * }</pre>
 * <p>
 * Analyses such as {@link io.github.eutro.flattening.passes.meta.ComputeUses} store
 * their results as exts on the IR they analyse, and record their validity in the
 * function's {@link io.github.eutro.flattening.ext.MetadataState}. Hot exts,
 * like the owner of an effect, are kept in plain fields by the classes that have them.
 */
package io.github.eutro.flattening.ext;
