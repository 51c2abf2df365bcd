package me.christianrobert.nativebind.declaration.metadata;

/**
 * Marker for side-channel facts a pass attaches to a declaration.
 *
 * <p>Each implementation class is its own key in {@link DeclarationMetadata}, so a declaration holds
 * at most one item per class.</p>
 */
public interface DeclarationMetadataItem {
}
