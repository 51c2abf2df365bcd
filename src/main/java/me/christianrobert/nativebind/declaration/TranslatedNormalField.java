package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.type.TypeReference;

public final class TranslatedNormalField extends TranslatedField<TranslatedNormalField> {

    private final TypeReference type;

    public TranslatedNormalField(TranslatedFile file, String name, int offset, TypeReference type) {
        this(new DeclarationInfo(file, name), offset, type);
    }

    private TranslatedNormalField(DeclarationInfo info, int offset, TypeReference type) {
        super(info, offset);
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null");
        }
        this.type = type;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.NORMAL_FIELD;
    }

    public TypeReference getType() {
        return type;
    }

    public TranslatedNormalField withType(TypeReference newType) {
        return new TranslatedNormalField(getInfo(), getOffset(), newType);
    }

    @Override
    public TranslatedNormalField withOffset(int newOffset) {
        return new TranslatedNormalField(getInfo(), newOffset, type);
    }

    @Override
    TranslatedNormalField withInfo(DeclarationInfo newInfo) {
        return new TranslatedNormalField(newInfo, getOffset(), type);
    }

    @Override
    TranslatedNormalField self() {
        return this;
    }
}
