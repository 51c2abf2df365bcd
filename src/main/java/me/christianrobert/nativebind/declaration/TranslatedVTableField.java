package me.christianrobert.nativebind.declaration;

/**
 * Layout slot holding the vtable pointer of a polymorphic record.
 */
public final class TranslatedVTableField extends TranslatedField<TranslatedVTableField> {

    public TranslatedVTableField(TranslatedFile file, String name, int offset) {
        this(new DeclarationInfo(file, name), offset);
    }

    public TranslatedVTableField(TranslatedFile file) {
        this(file, "VirtualMethodTablePointer", 0);
    }

    private TranslatedVTableField(DeclarationInfo info, int offset) {
        super(info, offset);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.VTABLE_FIELD;
    }

    @Override
    public TranslatedVTableField withOffset(int newOffset) {
        return new TranslatedVTableField(getInfo(), newOffset);
    }

    @Override
    TranslatedVTableField withInfo(DeclarationInfo newInfo) {
        return new TranslatedVTableField(newInfo, getOffset());
    }

    @Override
    TranslatedVTableField self() {
        return this;
    }
}
