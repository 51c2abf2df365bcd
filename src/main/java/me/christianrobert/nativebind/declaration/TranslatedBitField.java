package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.type.TypeReference;

/**
 * Field occupying {@link #getBitWidth()} bits starting {@link #getBitOffset()} bits past its byte offset.
 */
public final class TranslatedBitField extends TranslatedField<TranslatedBitField> {

    private final TypeReference type;
    private final int bitOffset;
    private final int bitWidth;

    public TranslatedBitField(TranslatedFile file, String name, int offset, TypeReference type, int bitOffset, int bitWidth) {
        this(new DeclarationInfo(file, name), offset, type, bitOffset, bitWidth);
    }

    private TranslatedBitField(DeclarationInfo info, int offset, TypeReference type, int bitOffset, int bitWidth) {
        super(info, offset);
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null");
        }
        if (bitWidth <= 0) {
            throw new IllegalArgumentException("Bit width must be positive");
        }
        this.type = type;
        this.bitOffset = bitOffset;
        this.bitWidth = bitWidth;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.BIT_FIELD;
    }

    public TypeReference getType() {
        return type;
    }

    public int getBitOffset() {
        return bitOffset;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public TranslatedBitField withType(TypeReference newType) {
        return new TranslatedBitField(getInfo(), getOffset(), newType, bitOffset, bitWidth);
    }

    @Override
    public TranslatedBitField withOffset(int newOffset) {
        return new TranslatedBitField(getInfo(), newOffset, type, bitOffset, bitWidth);
    }

    @Override
    TranslatedBitField withInfo(DeclarationInfo newInfo) {
        return new TranslatedBitField(newInfo, getOffset(), type, bitOffset, bitWidth);
    }

    @Override
    TranslatedBitField self() {
        return this;
    }
}
