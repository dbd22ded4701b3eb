package org.cuelang.cue.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A CUE source file: an ordered list of declarations plus file-level
 * comments.
 *
 * The declaration list is owned by the file and mutated in place.
 */
public final class File extends AbstractNode implements Node {

    private final String filename;
    private final List<Decl> decls;

    public File(List<Decl> decls) {
        this("", decls);
    }

    /**
     * Creates a file that takes ownership of the given declaration list.
     *
     * @param filename Source file name, empty when unknown
     * @param decls    Declarations; the file keeps using this list
     */
    public File(String filename, List<Decl> decls) {
        this.filename = Objects.requireNonNull(filename, "Filename cannot be null");
        this.decls = decls == null ? new ArrayList<>() : decls;
    }

    public String filename() {
        return filename;
    }

    /**
     * @return The live, mutable declaration list of this file
     */
    public List<Decl> decls() {
        return decls;
    }

    /**
     * Moves the declarations from index {@code from} to the end out of this
     * file. The file keeps the declarations before {@code from}.
     *
     * @return A new list owning the moved declarations, in their original order
     * @throws IndexOutOfBoundsException if {@code from} is outside {@code [0, size]}
     */
    public List<Decl> detach(int from) {
        List<Decl> tail = decls.subList(from, decls.size());
        List<Decl> moved = new ArrayList<>(tail);
        tail.clear();
        return moved;
    }
}
