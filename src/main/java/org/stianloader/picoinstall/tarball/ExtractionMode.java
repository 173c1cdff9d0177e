package org.stianloader.picoinstall.tarball;

public enum ExtractionMode {
    /**
     * Extract straight into the output folder. Callers are expected to guard the folder
     * through the folder sync lock.
     */
    OVERWRITE,
    /**
     * Extract into a randomly named sibling of the output folder and rename it into place afterwards.
     * If another process won the race and the output folder exists by then, the extracted copy is discarded.
     */
    ATOMIC_SIBLING;
}
