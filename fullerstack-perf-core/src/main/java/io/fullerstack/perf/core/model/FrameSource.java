package io.fullerstack.perf.core.model;

/**
 * The two independent frame-producing contexts a monitor tracks.
 */
public enum FrameSource {
    /** Rendering (display) frames. */
    UI,
    /** Scripting runtime frames. */
    JS
}
