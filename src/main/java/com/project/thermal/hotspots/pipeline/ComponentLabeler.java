package com.project.thermal.hotspots.pipeline;

/**
 * Assigns a unique positive label to each maximal 4-connected group of foreground pixels.
 * Label values are implementation-defined; the partition of pixels is not.
 */
public interface ComponentLabeler {

    LabelMap label(BinaryMask mask);
}
