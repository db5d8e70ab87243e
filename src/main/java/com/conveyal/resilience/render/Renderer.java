package com.conveyal.resilience.render;

import com.conveyal.resilience.analysis.AreaAnalysis;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Turns the analysis of one area into something a person can look at. Renderers only read the analysis.
 */
public interface Renderer {

    void render (AreaAnalysis analysis, OutputStream out) throws IOException;

    /** File name extension, without the dot, for files this renderer produces. */
    String extension ();
}
