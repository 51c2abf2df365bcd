package me.christianrobert.nativebind.declaration.constant;

/**
 * Integral constant with its native width and signedness.
 */
public final class IntegerConstant extends ConstantValue {

    private final long value;
    private final int sizeOfBits;
    private final boolean signed;

    public IntegerConstant(long value, int sizeOfBits, boolean signed) {
        this.value = value;
        this.sizeOfBits = sizeOfBits;
        this.signed = signed;
    }

    public static IntegerConstant ofInt(int value) {
        return new IntegerConstant(value, 32, true);
    }

    public long getValue() {
        return value;
    }

    public int getSizeOfBits() {
        return sizeOfBits;
    }

    public boolean isSigned() {
        return signed;
    }

    @Override
    public String toString() {
        return signed ? Long.toString(value) : Long.toUnsignedString(value) + "U";
    }
}
