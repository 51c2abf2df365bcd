package me.christianrobert.nativebind.declaration.type;

/**
 * Base class for the types referenced by declarations (field types, parameter types, return types,
 * typedef and enum underlying types).
 *
 * <p>Type references are immutable values. Unlike declarations they compare structurally.</p>
 */
public abstract class TypeReference {

    protected TypeReference() {
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
