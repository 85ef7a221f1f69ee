package io.github.eutro.flattening.passes;

import io.github.eutro.flattening.passes.meta.VerifyDominance;
import io.github.eutro.flattening.passes.meta.VerifyIntegrity;
import io.github.eutro.flattening.passes.obf.Flatten;
import io.github.eutro.flattening.ssa.Function;

public class Passes {
    public static final IRPass<Function, Function> VERIFY =
            VerifyIntegrity.INSTANCE
                    .then(VerifyDominance.INSTANCE);

    public static final IRPass<Function, Function> FLATTEN =
            VerifyIntegrity.INSTANCE
                    .then(Flatten.INSTANCE)
                    .then(VERIFY);
}
