package me.christianrobert.nativebind.declaration;

import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a whole translated library: the root declarations handed over by the front end
 * (and rewritten by passes), the source files, and library-level diagnostics.
 *
 * <p>The handle index used by {@link #tryFind(DeclarationId)} is built once at construction, so lookups
 * always observe exactly this snapshot and never a tree that a pass is still rewriting.</p>
 */
public final class TranslatedLibrary {

    private final List<TranslatedDeclaration> declarations;
    private final List<TranslatedFile> files;
    private final List<TranslationDiagnostic> parsingDiagnostics;
    private final List<TranslatedDeclaration> brokenDeclarations;
    private final Map<DeclarationId, TranslatedDeclaration> index;

    public TranslatedLibrary(List<? extends TranslatedDeclaration> declarations,
                             List<TranslatedFile> files,
                             List<TranslationDiagnostic> parsingDiagnostics,
                             List<? extends TranslatedDeclaration> brokenDeclarations) {
        if (declarations == null) {
            throw new IllegalArgumentException("Declarations cannot be null");
        }
        this.declarations = List.copyOf(declarations);
        this.files = files == null ? List.of() : List.copyOf(files);
        this.parsingDiagnostics = parsingDiagnostics == null ? List.of() : List.copyOf(parsingDiagnostics);
        this.brokenDeclarations = brokenDeclarations == null ? List.of() : List.copyOf(brokenDeclarations);
        this.index = buildIndex(this.declarations);
    }

    public TranslatedLibrary(List<? extends TranslatedDeclaration> declarations) {
        this(declarations, null, null, null);
    }

    private static Map<DeclarationId, TranslatedDeclaration> buildIndex(List<TranslatedDeclaration> roots) {
        Map<DeclarationId, TranslatedDeclaration> result = new IdentityHashMap<>();
        Deque<TranslatedDeclaration> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            TranslatedDeclaration declaration = pending.pop();
            // First occurrence wins; a handle appearing twice means a pass duplicated a declaration
            result.putIfAbsent(declaration.getId(), declaration);
            pending.addAll(declaration.getChildren());
        }
        return Collections.unmodifiableMap(result);
    }

    public List<TranslatedDeclaration> getDeclarations() {
        return declarations;
    }

    public List<TranslatedFile> getFiles() {
        return files;
    }

    /**
     * Diagnostics that are not attached to any declaration (reported by the front end while parsing).
     */
    public List<TranslationDiagnostic> getParsingDiagnostics() {
        return parsingDiagnostics;
    }

    /**
     * Root declarations that were pulled out of the tree because they carry errors.
     */
    public List<TranslatedDeclaration> getBrokenDeclarations() {
        return brokenDeclarations;
    }

    /**
     * Finds the declaration with the given handle anywhere in the tree.
     *
     * @return the declaration, or null when no declaration of this snapshot has the handle
     */
    public TranslatedDeclaration tryFind(DeclarationId id) {
        if (id == null) {
            return null;
        }
        return index.get(id);
    }

    /**
     * All declarations of the tree in depth-first pre-order.
     */
    public List<TranslatedDeclaration> allDeclarations() {
        List<TranslatedDeclaration> result = new ArrayList<>(index.size());
        collect(declarations, result);
        return result;
    }

    private static void collect(List<TranslatedDeclaration> declarations, List<TranslatedDeclaration> sink) {
        for (TranslatedDeclaration declaration : declarations) {
            sink.add(declaration);
            collect(declaration.getChildren(), sink);
        }
    }

    public TranslatedLibrary withDeclarations(List<? extends TranslatedDeclaration> newDeclarations) {
        return new TranslatedLibrary(newDeclarations, files, parsingDiagnostics, brokenDeclarations);
    }

    public TranslatedLibrary withBrokenDeclarations(List<? extends TranslatedDeclaration> newBrokenDeclarations) {
        return new TranslatedLibrary(declarations, files, parsingDiagnostics, newBrokenDeclarations);
    }

    @Override
    public String toString() {
        return "TranslatedLibrary{" +
                "declarations=" + declarations.size() +
                ", files=" + files.size() +
                ", parsingDiagnostics=" + parsingDiagnostics.size() +
                ", brokenDeclarations=" + brokenDeclarations.size() +
                '}';
    }
}
