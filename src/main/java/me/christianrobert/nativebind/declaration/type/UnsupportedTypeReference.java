package me.christianrobert.nativebind.declaration.type;

/**
 * Placeholder for a native type the front end could not translate.
 */
public final class UnsupportedTypeReference extends TypeReference {

    private final String reason;

    public UnsupportedTypeReference(String reason) {
        if (reason == null || reason.trim().isEmpty()) {
            throw new IllegalArgumentException("Reason cannot be null or empty");
        }
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return reason.equals(((UnsupportedTypeReference) o).reason);
    }

    @Override
    public int hashCode() {
        return reason.hashCode();
    }

    @Override
    public String toString() {
        return "<unsupported: " + reason + ">";
    }
}
