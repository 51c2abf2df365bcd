package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.type.TypeReference;

/**
 * Layout slot holding a base class subobject.
 */
public final class TranslatedBaseField extends TranslatedField<TranslatedBaseField> {

    private final TypeReference type;

    public TranslatedBaseField(TranslatedFile file, String name, int offset, TypeReference type) {
        this(new DeclarationInfo(file, name), offset, type);
    }

    private TranslatedBaseField(DeclarationInfo info, int offset, TypeReference type) {
        super(info, offset);
        if (type == null) {
            throw new IllegalArgumentException("Base type cannot be null");
        }
        this.type = type;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.BASE_FIELD;
    }

    public TypeReference getType() {
        return type;
    }

    public TranslatedBaseField withType(TypeReference newType) {
        return new TranslatedBaseField(getInfo(), getOffset(), newType);
    }

    @Override
    public TranslatedBaseField withOffset(int newOffset) {
        return new TranslatedBaseField(getInfo(), newOffset, type);
    }

    @Override
    TranslatedBaseField withInfo(DeclarationInfo newInfo) {
        return new TranslatedBaseField(newInfo, getOffset(), type);
    }

    @Override
    TranslatedBaseField self() {
        return this;
    }
}
