package me.christianrobert.nativebind.declaration.constant;

/**
 * Value of a constant expression found in the native source, such as a default parameter value.
 */
public abstract class ConstantValue {

    protected ConstantValue() {
    }
}
