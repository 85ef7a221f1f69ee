package io.github.eutro.flattening.ssa;

import io.github.eutro.flattening.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function: an ordered list of {@link BasicBlock}s, the first of which is the entry.
 */
public final class Function extends ExtHolder {
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    }; // [0] is entry

    /**
     * If set, variables sharing a name are numbered apart, which makes printed IR readable.
     */
    public static final boolean UNIQUE_VAR_NAMES = System.getenv("FLATTENING_UNIQUE_VAR_NAMES") != null;

    private final Map<String, Integer> varCounts = UNIQUE_VAR_NAMES ? new HashMap<>() : null;

    public Var newVar(String name) {
        if (!UNIQUE_VAR_NAMES) {
            return new Var(name, 0);
        }
        int index = varCounts.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    /**
     * Create a new block at the end of this function.
     *
     * @return The block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    /**
     * Create a new block at the given position in this function.
     *
     * @param index The position of the new block.
     * @return The block.
     */
    public BasicBlock newBbAt(int index) {
        BasicBlock bb = new BasicBlock();
        blocks.add(index, bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
