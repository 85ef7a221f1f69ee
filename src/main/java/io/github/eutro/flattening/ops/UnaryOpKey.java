package io.github.eutro.flattening.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An operation key with a single immediate of type {@code T}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;
    private boolean allowNull = false;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public UnaryOpKey<T> allowNull() {
        allowNull = true;
        return this;
    }

    public class UnaryOp extends Op {
        public final T arg;

        public UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    @Nullable
    public UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        }
        return null;
    }

    public Optional<UnaryOp> check(Op val) {
        return Optional.ofNullable(checkNullable(val));
    }

    /**
     * Cast an operation to one of this key.
     *
     * @param val The operation.
     * @return The operation, cast.
     * @throws IllegalArgumentException If the operation is of a different key.
     */
    public UnaryOp cast(Op val) {
        return check(val).orElseThrow(() -> new IllegalArgumentException(
                String.format("expected %s, got %s", mnemonic, val)));
    }

    public UnaryOp create(T arg) {
        if (!allowNull && arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
