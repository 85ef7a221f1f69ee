package io.github.eutro.flattening.ext;

import io.github.eutro.flattening.passes.IRPass;
import io.github.eutro.flattening.passes.meta.ComputeDoms;
import io.github.eutro.flattening.passes.meta.ComputePreds;
import io.github.eutro.flattening.passes.meta.ComputeUses;
import io.github.eutro.flattening.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which analyses of a {@link Function} are up to date.
 * <p>
 * Passes that edit the graph call {@link #graphChanged()}, passes that
 * only move or replace variables call {@link #varsChanged()}.
 */
public class MetadataState {
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata which can be (re)computed by running passes.
     *
     * @param <T> The type of IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        private ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException(name + " computed by a pass that is not in-place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            USES = new ComputableMetaKind<>("USES", ComputeUses.INSTANCE);

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Recompute every kind in {@code kinds} that is not currently valid.
     *
     * @param t     The IR to compute it for.
     * @param kinds The kinds of metadata needed.
     * @param <T>   The type of the IR.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (!isValid(kind)) {
                kind.computeFor(t);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    public void graphChanged() {
        invalidate(PREDS, DOMS);
        varsChanged();
    }

    public void varsChanged() {
        invalidate(USES);
    }
}
