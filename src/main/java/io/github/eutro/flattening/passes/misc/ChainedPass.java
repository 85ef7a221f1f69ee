package io.github.eutro.flattening.passes.misc;

import io.github.eutro.flattening.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * A pass which runs one pass, then another on its result.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;
    private final boolean isInPlace;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    // flattened, so long chains don't nest deeply on the stack
    @SuppressWarnings("unchecked")
    private List<IRPass<Object, Object>> listPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> cPass = (ChainedPass<?, ?, ?>) pass;
            passes.add(cPass.nextPass);
            pass = cPass.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        ListIterator<IRPass<Object, Object>> li = listPasses().listIterator();
        Object acc = a;
        while (li.hasNext()) {
            IRPass<Object, Object> pass = li.next();
            try {
                acc = pass.run(acc);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException(String.format(
                        "running pass %d (%s) in chain", li.previousIndex(), pass.getClass().getSimpleName())));
                throw t;
            }
        }
        return (C) acc;
    }
}
