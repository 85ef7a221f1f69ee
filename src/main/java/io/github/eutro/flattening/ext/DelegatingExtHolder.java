package io.github.eutro.flattening.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another container for exts it does not have,
 * so that e.g. an instruction sees the exts of its operation.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
