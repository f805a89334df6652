package io.fullerstack.perf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Retained frame-rate history of both trackers, oldest sample first.
 *
 * @param uiFpsSamples rendering samples
 * @param jsFpsSamples scripting samples
 * @param uiFpsMin     lowest rendering sample since reset (0 if none)
 * @param uiFpsMax     highest rendering sample since reset (0 if none)
 * @param jsFpsMin     lowest scripting sample since reset (0 if none)
 * @param jsFpsMax     highest scripting sample since reset (0 if none)
 */
public record FpsHistory(
    List<Integer> uiFpsSamples,
    List<Integer> jsFpsSamples,
    int uiFpsMin,
    int uiFpsMax,
    int jsFpsMin,
    int jsFpsMax
) {
    public FpsHistory {
        Objects.requireNonNull(uiFpsSamples, "uiFpsSamples cannot be null");
        Objects.requireNonNull(jsFpsSamples, "jsFpsSamples cannot be null");
        uiFpsSamples = List.copyOf(uiFpsSamples);
        jsFpsSamples = List.copyOf(jsFpsSamples);
    }
}
