package me.christianrobert.nativebind.declaration.constant;

public final class FloatConstant extends ConstantValue {

    private final double value;
    private final boolean doublePrecision;

    public FloatConstant(double value, boolean doublePrecision) {
        this.value = value;
        this.doublePrecision = doublePrecision;
    }

    public double getValue() {
        return value;
    }

    public boolean isDoublePrecision() {
        return doublePrecision;
    }

    @Override
    public String toString() {
        return doublePrecision ? Double.toString(value) : value + "f";
    }
}
