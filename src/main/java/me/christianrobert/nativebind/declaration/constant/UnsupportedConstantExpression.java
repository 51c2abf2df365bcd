package me.christianrobert.nativebind.declaration.constant;

/**
 * Constant expression the front end could not evaluate. The front end reports the reason as a
 * diagnostic on the owning declaration when it creates this placeholder.
 */
public final class UnsupportedConstantExpression extends ConstantValue {

    private final String message;

    public UnsupportedConstantExpression(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "<unsupported constant: " + message + ">";
    }
}
