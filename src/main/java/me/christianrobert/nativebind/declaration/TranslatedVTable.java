package me.christianrobert.nativebind.declaration;

import java.util.List;

/**
 * Virtual dispatch table of a polymorphic record. Only valid as the designated vtable of its parent record.
 */
public final class TranslatedVTable extends AbstractTranslatedDeclaration<TranslatedVTable> {

    private final List<TranslatedVTableEntry> entries;

    public TranslatedVTable(TranslatedFile file, String name, List<TranslatedVTableEntry> entries) {
        this(new DeclarationInfo(file, name), entries == null ? List.of() : entries);
    }

    public TranslatedVTable(TranslatedFile file) {
        this(file, "VirtualMethodTable", List.of());
    }

    private TranslatedVTable(DeclarationInfo info, List<TranslatedVTableEntry> entries) {
        super(info);
        this.entries = List.copyOf(entries);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.VTABLE;
    }

    public List<TranslatedVTableEntry> getEntries() {
        return entries;
    }

    public TranslatedVTable withEntries(List<TranslatedVTableEntry> newEntries) {
        return new TranslatedVTable(getInfo(), newEntries);
    }

    @Override
    TranslatedVTable withInfo(DeclarationInfo newInfo) {
        return new TranslatedVTable(newInfo, entries);
    }

    @Override
    TranslatedVTable self() {
        return this;
    }
}
