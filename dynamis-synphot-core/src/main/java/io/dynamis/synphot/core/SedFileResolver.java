package io.dynamis.synphot.core;

import java.nio.file.Path;

/**
 * Maps an SED name as stored in a catalog to the file holding its spectrum.
 *
 * Survey catalogs store bare names ("kp01_9750.fits_g40_9950"); the library
 * layout on disk is a deployment detail supplied by the caller.
 */
@FunctionalInterface
public interface SedFileResolver {

    /**
     * @param sedName catalog name; never the no-SED sentinel
     * @return path of the file to read; must not be null
     */
    Path resolve(String sedName);

    /** Resolves every name directly under directory. */
    static SedFileResolver inDirectory(Path directory) {
        if (directory == null) {
            throw new NullPointerException("directory");
        }
        return directory::resolve;
    }
}
