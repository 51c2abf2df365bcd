package me.christianrobert.nativebind.declaration.metadata;

import me.christianrobert.nativebind.declaration.type.TargetBuiltinType;

/**
 * Marks a declaration that wraps a native primitive (a native boolean or a native char) and that
 * surfaces as a target built-in type wherever a call wrapper is generated.
 */
public final class ProjectedAsBuiltinType implements DeclarationMetadataItem {

    private final TargetBuiltinType projectedType;

    public ProjectedAsBuiltinType(TargetBuiltinType projectedType) {
        if (projectedType == null) {
            throw new IllegalArgumentException("Projected type cannot be null");
        }
        this.projectedType = projectedType;
    }

    public TargetBuiltinType getProjectedType() {
        return projectedType;
    }

    @Override
    public String toString() {
        return "ProjectedAsBuiltinType{" + projectedType + "}";
    }
}
