package org.dynamis.async.runtime;

import java.util.Objects;

/**
 * When a scheduled {@link Resumption} should run.
 */
public final class Timing {

    public enum Kind {
        SECONDS,
        FRAMES,
        COMPLETION
    }

    private final Kind kind;
    private final float seconds;
    private final int frames;
    private final Task<?> awaited;

    private Timing(Kind kind, float seconds, int frames, Task<?> awaited) {
        this.kind = kind;
        this.seconds = seconds;
        this.frames = frames;
        this.awaited = awaited;
    }

    public static Timing seconds(float seconds) {
        return new Timing(Kind.SECONDS, Math.max(0f, seconds), 0, null);
    }

    /** Frame counts below one are raised to one. */
    public static Timing frames(int frames) {
        return new Timing(Kind.FRAMES, 0f, Math.max(1, frames), null);
    }

    public static Timing nextFrame() {
        return frames(1);
    }

    public static Timing whenComplete(Task<?> task) {
        return new Timing(Kind.COMPLETION, 0f, 0, Objects.requireNonNull(task, "task"));
    }

    public Kind getKind() {
        return kind;
    }

    public float getSeconds() {
        return seconds;
    }

    public int getFrames() {
        return frames;
    }

    public Task<?> getAwaited() {
        return awaited;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Timing that = (Timing) o;
        return kind == that.kind && Float.compare(seconds, that.seconds) == 0 && frames == that.frames && awaited == that.awaited;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, seconds, frames, System.identityHashCode(awaited));
    }

    @Override
    public String toString() {
        switch (kind) {
            case SECONDS:
                return "Timing{" + seconds + "s}";
            case FRAMES:
                return "Timing{" + frames + " frame(s)}";
            default:
                return "Timing{when " + awaited + " completes}";
        }
    }
}
