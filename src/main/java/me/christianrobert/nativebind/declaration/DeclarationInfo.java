package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.declaration.metadata.DeclarationMetadata;
import me.christianrobert.nativebind.declaration.metadata.DeclarationMetadataItem;
import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Properties every declaration kind carries. Each {@code with...} returns a new instance with the same handle.
 */
final class DeclarationInfo {

    private final DeclarationId id;
    private final TranslatedFile file;
    private final String name;
    private final String namespace;
    private final AccessModifier accessibility;
    private final List<TranslationDiagnostic> diagnostics;
    private final DeclarationMetadata metadata;

    DeclarationInfo(TranslatedFile file, String name) {
        this(DeclarationId.newId(), requireFile(file), name, null, AccessModifier.PUBLIC,
                Collections.emptyList(), DeclarationMetadata.EMPTY);
    }

    private DeclarationInfo(DeclarationId id,
                            TranslatedFile file,
                            String name,
                            String namespace,
                            AccessModifier accessibility,
                            List<TranslationDiagnostic> diagnostics,
                            DeclarationMetadata metadata) {
        this.id = id;
        this.file = file;
        this.name = name == null ? "" : name;
        this.namespace = namespace;
        this.accessibility = accessibility;
        this.diagnostics = diagnostics;
        this.metadata = metadata;
    }

    private static TranslatedFile requireFile(TranslatedFile file) {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        return file;
    }

    DeclarationId getId() {
        return id;
    }

    TranslatedFile getFile() {
        return file;
    }

    String getName() {
        return name;
    }

    String getNamespace() {
        return namespace;
    }

    AccessModifier getAccessibility() {
        return accessibility;
    }

    List<TranslationDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    DeclarationMetadata getMetadata() {
        return metadata;
    }

    DeclarationInfo withName(String newName) {
        return new DeclarationInfo(id, file, newName, namespace, accessibility, diagnostics, metadata);
    }

    DeclarationInfo withNamespace(String newNamespace) {
        return new DeclarationInfo(id, file, name, newNamespace, accessibility, diagnostics, metadata);
    }

    DeclarationInfo withAccessibility(AccessModifier newAccessibility) {
        if (newAccessibility == null) {
            throw new IllegalArgumentException("Accessibility cannot be null");
        }
        return new DeclarationInfo(id, file, name, namespace, newAccessibility, diagnostics, metadata);
    }

    DeclarationInfo withMetadata(DeclarationMetadataItem item) {
        return new DeclarationInfo(id, file, name, namespace, accessibility, diagnostics, metadata.add(item));
    }

    DeclarationInfo withDiagnostic(TranslationDiagnostic diagnostic) {
        if (diagnostic == null) {
            throw new IllegalArgumentException("Diagnostic cannot be null");
        }
        List<TranslationDiagnostic> appended = new ArrayList<>(diagnostics.size() + 1);
        appended.addAll(diagnostics);
        appended.add(diagnostic);
        return new DeclarationInfo(id, file, name, namespace, accessibility, Collections.unmodifiableList(appended), metadata);
    }
}
