package com.cardrewards.ingest.lifecycle;

import com.cardrewards.ingest.domain.FileState;

/**
 * Transition table for inbox files.
 * <p>
 * Each non-terminal state names the step the processor runs next. The step's
 * result selects the following state and the archive side effect, if any.
 * No I/O happens here.
 *
 * <pre>
 * DISCOVERED  --marker present--> ALREADY_HANDLED
 * DISCOVERED  --passed--> NORMALIZING --passed--> NORMALIZED --passed--> VALIDATING
 *             --passed--> IMPORTING --passed--> ARCHIVED_PROCESSED (archive processed)
 * any step    --failed--> ARCHIVED_FAILED (archive failed)
 * </pre>
 */
public final class FileLifecycle {

    public enum StepResult {
        PASSED,
        FAILED,
        MARKER_PRESENT
    }

    public enum Effect {
        NONE,
        ARCHIVE_PROCESSED,
        ARCHIVE_FAILED
    }

    public record Transition(FileState next, Effect effect) {}

    private FileLifecycle() {}

    public static Transition advance(FileState state, StepResult result) {
        if (state.isTerminal()) {
            throw new IllegalStateException("No transition out of terminal state " + state);
        }

        return switch (result) {
            case FAILED -> new Transition(FileState.ARCHIVED_FAILED, Effect.ARCHIVE_FAILED);
            case MARKER_PRESENT -> {
                if (state != FileState.DISCOVERED) {
                    throw new IllegalArgumentException("Completion marker is only checked on discovery, not in " + state);
                }
                yield new Transition(FileState.ALREADY_HANDLED, Effect.NONE);
            }
            case PASSED -> switch (state) {
                case DISCOVERED -> new Transition(FileState.NORMALIZING, Effect.NONE);
                case NORMALIZING -> new Transition(FileState.NORMALIZED, Effect.NONE);
                case NORMALIZED -> new Transition(FileState.VALIDATING, Effect.NONE);
                case VALIDATING -> new Transition(FileState.IMPORTING, Effect.NONE);
                case IMPORTING -> new Transition(FileState.ARCHIVED_PROCESSED, Effect.ARCHIVE_PROCESSED);
                default -> throw new IllegalStateException("Unexpected state " + state);
            };
        };
    }
}
