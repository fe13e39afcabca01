package com.consullo.cup.driver;

import com.consullo.cup.capture.PruneResult;
import com.consullo.cup.core.Envelope;

/**
 * Outcome of a capture.
 *
 * @param canonical envelope before pruning
 * @param pruned pruning result
 * @param output rendered text: compact lines, overview lines or JSON of the pruned envelope
 * @since 1.0
 */
public record CaptureResult(Envelope canonical, PruneResult pruned, String output) {
}
