package me.christianrobert.nativebind.declaration;

/**
 * One slot of a {@link TranslatedVTable}. Not a declaration itself.
 */
public final class TranslatedVTableEntry {

    private final VTableEntryKind entryKind;
    private final String name;
    private final DeclarationId method;

    public TranslatedVTableEntry(VTableEntryKind entryKind, String name, DeclarationId method) {
        if (entryKind == null) {
            throw new IllegalArgumentException("Entry kind cannot be null");
        }
        this.entryKind = entryKind;
        this.name = name == null ? "" : name;
        this.method = method;
    }

    public VTableEntryKind getEntryKind() {
        return entryKind;
    }

    public String getName() {
        return name;
    }

    /**
     * Handle of the virtual method occupying this slot, or null for non-function slots.
     */
    public DeclarationId getMethod() {
        return method;
    }

    @Override
    public String toString() {
        return entryKind + " " + name;
    }
}
