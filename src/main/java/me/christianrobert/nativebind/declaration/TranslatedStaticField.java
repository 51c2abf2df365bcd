package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.type.TypeReference;

/**
 * A global variable or a static data member, accessed through its exported symbol.
 */
public final class TranslatedStaticField extends AbstractTranslatedDeclaration<TranslatedStaticField> {

    private final TypeReference type;
    private final String mangledName;

    public TranslatedStaticField(TranslatedFile file, String name, TypeReference type, String mangledName) {
        this(new DeclarationInfo(file, name), type, mangledName == null ? name : mangledName);
    }

    private TranslatedStaticField(DeclarationInfo info, TypeReference type, String mangledName) {
        super(info);
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null");
        }
        this.type = type;
        this.mangledName = mangledName;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.STATIC_FIELD;
    }

    public TypeReference getType() {
        return type;
    }

    public String getMangledName() {
        return mangledName;
    }

    public TranslatedStaticField withType(TypeReference newType) {
        return new TranslatedStaticField(getInfo(), newType, mangledName);
    }

    @Override
    TranslatedStaticField withInfo(DeclarationInfo newInfo) {
        return new TranslatedStaticField(newInfo, type, mangledName);
    }

    @Override
    TranslatedStaticField self() {
        return this;
    }
}
