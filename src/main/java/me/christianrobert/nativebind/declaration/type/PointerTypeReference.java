package me.christianrobert.nativebind.declaration.type;

/**
 * Pointer to another type.
 */
public final class PointerTypeReference extends TypeReference {

    private final TypeReference inner;

    public PointerTypeReference(TypeReference inner) {
        if (inner == null) {
            throw new IllegalArgumentException("Inner type cannot be null");
        }
        this.inner = inner;
    }

    public TypeReference getInner() {
        return inner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return inner.equals(((PointerTypeReference) o).inner);
    }

    @Override
    public int hashCode() {
        return 31 * inner.hashCode() + 1;
    }

    @Override
    public String toString() {
        return inner + "*";
    }
}
