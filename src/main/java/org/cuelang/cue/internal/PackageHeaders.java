package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Attribute;
import org.cuelang.cue.ast.CommentGroup;
import org.cuelang.cue.ast.Decl;
import org.cuelang.cue.ast.File;
import org.cuelang.cue.ast.Ident;
import org.cuelang.cue.ast.Package;
import org.cuelang.cue.ast.astutil.AstUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds and installs the package clause of a file, and determines the comment
 * that documents the file as a whole.
 *
 * The package clause may only be preceded by comments and attributes. The
 * lookups are read-only; {@link #setPackageName} mutates the file.
 */
public final class PackageHeaders {

    private static final Logger LOGGER = LoggerFactory.getLogger(PackageHeaders.class);

    private PackageHeaders() {
    }

    /**
     * Finds the package clause of a file.
     *
     * Scans past leading comment groups and attributes. Any other declaration
     * before a package clause means the file has none.
     */
    public static PackageInfo findPackageClause(File file) {
        for (Decl d : file.decls()) {
            if (d instanceof CommentGroup || d instanceof Attribute) {
                continue;
            }
            if (d instanceof Package pkg) {
                Ident name = pkg.name();
                if (name == null) {
                    return new PackageInfo(Optional.of(pkg), "", pkg.pos());
                }
                return new PackageInfo(Optional.of(pkg), name.name(), name.pos());
            }
            break;
        }
        return PackageInfo.notFound(file.pos());
    }

    /**
     * Sets the package name of a file.
     *
     * If the file has a package clause, its name is replaced only when
     * {@code overwrite} is set; the new identifier keeps the position and
     * comments of the old one. Otherwise a new clause is inserted after the
     * leading comment groups of the file.
     *
     * @param file      The file to modify
     * @param name      The package name
     * @param overwrite Whether an existing, different name is replaced
     */
    public static void setPackageName(File file, String name, boolean overwrite) {
        PackageInfo info = findPackageClause(file);
        if (info.clause().isPresent()) {
            Package pkg = info.clause().get();
            if (!overwrite || info.name().equals(name)) {
                return;
            }
            Ident ident = AstUtil.copyMeta(new Ident(name), pkg.name());
            pkg.setName(ident);
            LOGGER.debug("Renamed package '{}' to '{}' in '{}'", info.name(), name, file.filename());
            return;
        }

        List<Decl> decls = file.decls();
        int k = 0;
        while (k < decls.size() && decls.get(k) instanceof CommentGroup) {
            k++;
        }
        decls.add(k, new Package(new Ident(name)));
        LOGGER.debug("Inserted package clause '{}' at index {} in '{}'", name, k, file.filename());
    }

    /**
     * Returns the comment that documents the file as a whole.
     *
     * In order of preference, candidates are taken from:
     * - the comments attached to the package clause
     * - the file-level comments
     * - the first standalone comment group, or the comments of the first
     *   declaration that has any, among the leading attributes
     *
     * Of the candidates, the group placed before its node is returned.
     */
    public static Optional<CommentGroup> canonicalHeaderComment(File file) {
        PackageInfo info = findPackageClause(file);
        List<CommentGroup> cgs = List.of();
        if (info.clause().isPresent()) {
            cgs = info.clause().get().comments();
        } else if (!file.comments().isEmpty()) {
            cgs = file.comments();
        } else {
            for (Decl d : file.decls()) {
                if (d instanceof CommentGroup cg) {
                    return Optional.of(cg);
                }
                if (!d.comments().isEmpty()) {
                    cgs = d.comments();
                    break;
                }
                if (!(d instanceof Attribute)) {
                    break;
                }
            }
        }

        CommentGroup result = null;
        for (CommentGroup cg : cgs) {
            if (cg.position() == CommentGroup.BEFORE_NODE) {
                result = cg;
            }
        }
        return Optional.ofNullable(result);
    }
}
