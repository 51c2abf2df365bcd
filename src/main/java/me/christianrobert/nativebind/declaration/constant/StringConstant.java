package me.christianrobert.nativebind.declaration.constant;

public final class StringConstant extends ConstantValue {

    private final String value;

    public StringConstant(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
