package me.christianrobert.nativebind.transformation.context;

/**
 * Exception thrown when a transformation breaks the engine's contract (for example by replacing a
 * function parameter with something that is not a parameter).
 *
 * <p>Defects in the translated declarations themselves are never reported this way; they become
 * diagnostics on the offending declaration.</p>
 */
public class TransformationException extends RuntimeException {

    private final String passName;
    private final String declaration;

    public TransformationException(String message, String passName, String declaration) {
        super(message);
        this.passName = passName;
        this.declaration = declaration;
    }

    public String getPassName() {
        return passName;
    }

    public String getDeclaration() {
        return declaration;
    }

    /**
     * Gets a detailed error message including the pass and the declaration being transformed.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (passName != null) {
            sb.append("\nPass: ").append(passName);
        }
        if (declaration != null) {
            sb.append("\nDeclaration: ").append(declaration);
        }
        return sb.toString();
    }
}
