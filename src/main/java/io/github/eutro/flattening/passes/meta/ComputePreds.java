package io.github.eutro.flattening.passes.meta;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.MetadataState;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Function;

import java.util.ArrayList;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : block.getControl().targets) {
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.PREDS);
    }
}
