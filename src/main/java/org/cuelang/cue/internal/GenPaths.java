package org.cuelang.cue.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Locates the directory for generated files of a module.
 */
public final class GenPaths {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenPaths.class);

    public static final String MODULE_DIR = "cue.mod";
    public static final String GEN_DIR = "gen";
    public static final String LEGACY_PKG_DIR = "pkg";

    private GenPaths() {
    }

    /**
     * Returns the directory in which to store generated files for the module
     * rooted at {@code root}.
     *
     * - {@code root/cue.mod/gen} if {@code root/cue.mod} is a directory
     * - {@code root/pkg} if it exists, as a file or a directory (legacy layout)
     * - {@code root/cue.mod/gen} otherwise
     */
    public static Path resolveGenPath(Path root) {
        Path moduleDir = root.resolve(MODULE_DIR);
        Path genDir = moduleDir.resolve(GEN_DIR);
        if (Files.isDirectory(moduleDir)) {
            return genDir;
        }
        Path pkgDir = root.resolve(LEGACY_PKG_DIR);
        if (Files.isRegularFile(pkgDir) || Files.isDirectory(pkgDir)) {
            LOGGER.debug("Using legacy generated-file directory {}", pkgDir);
            return pkgDir;
        }
        return genDir;
    }
}
