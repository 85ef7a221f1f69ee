package io.github.eutro.flattening.ops;

/**
 * An operation key with no immediates, and therefore exactly one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
