package ai.pipestream.frames.bulk;

import ai.pipestream.frames.composite.FrameTemplate;
import ai.pipestream.frames.composite.OverlayRect;

/**
 * Immutable copy of what a bulk run needs from a frame project, taken when the
 * run starts. Later edits to the project do not affect a run in progress.
 */
public record FrameProjectSnapshot(long projectId, FrameTemplate template, OverlayRect rect, String feedUrl) {
}
