package io.github.eutro.flattening.ops;

import io.github.eutro.flattening.ext.ExtHolder;

/**
 * The kind of an operation, without any immediates.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
