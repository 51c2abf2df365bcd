package me.christianrobert.nativebind.declaration;

public final class TranslatedUnimplementedField extends TranslatedField<TranslatedUnimplementedField> {

    private final UnimplementedFieldKind fieldKind;

    public TranslatedUnimplementedField(TranslatedFile file, String name, int offset, UnimplementedFieldKind fieldKind) {
        this(new DeclarationInfo(file, name), offset, fieldKind);
    }

    private TranslatedUnimplementedField(DeclarationInfo info, int offset, UnimplementedFieldKind fieldKind) {
        super(info, offset);
        this.fieldKind = fieldKind == null ? UnimplementedFieldKind.UNKNOWN : fieldKind;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.UNIMPLEMENTED_FIELD;
    }

    public UnimplementedFieldKind getFieldKind() {
        return fieldKind;
    }

    @Override
    public TranslatedUnimplementedField withOffset(int newOffset) {
        return new TranslatedUnimplementedField(getInfo(), newOffset, fieldKind);
    }

    @Override
    TranslatedUnimplementedField withInfo(DeclarationInfo newInfo) {
        return new TranslatedUnimplementedField(newInfo, getOffset(), fieldKind);
    }

    @Override
    TranslatedUnimplementedField self() {
        return this;
    }
}
