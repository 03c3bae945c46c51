package com.eainde.monitor.suggest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Shortens a stack trace so that it fits the model's context.
 *
 * <p>System (library) frames are dropped first, taken out of the middle so the
 * outermost and innermost ones survive. Only when that is not enough are the
 * in-app frames thinned the same way.</p>
 */
public final class FrameTrimmer {

    public static final int MAX_STACKTRACE_FRAMES = 30;

    private FrameTrimmer() {
    }

    public static <T extends JsonNode> List<T> trimFrames(List<T> frames) {
        return trimFrames(frames, MAX_STACKTRACE_FRAMES);
    }

    /**
     * @param frames         frames in display order, each may carry an {@code in_app} flag
     * @param frameAllowance number of frames to aim for
     * @return the surviving frames in their original order; the input is returned as is
     * when it already fits and is never modified
     */
    public static <T extends JsonNode> List<T> trimFrames(List<T> frames, int frameAllowance) {
        List<T> appFrames = new ArrayList<>();
        List<T> systemFrames = new ArrayList<>();
        for (T frame : frames) {
            if (frame.path("in_app").asBoolean(false)) {
                appFrames.add(frame);
            } else {
                systemFrames.add(frame);
            }
        }

        if (frames.size() <= frameAllowance) {
            return frames;
        }

        Set<T> deleted = Collections.newSetFromMap(new IdentityHashMap<>());
        int remaining = frames.size() - frameAllowance;
        int appCount = appFrames.size();
        int systemAllowance = Math.max(frameAllowance - appCount, 0);

        List<T> systemToDrop = systemAllowance > 0
                ? middle(systemFrames, systemAllowance / 2)
                : systemFrames;
        for (T frame : systemToDrop) {
            deleted.add(frame);
            remaining--;
        }

        if (remaining != 0) {
            int appAllowance = appCount - remaining;
            deleted.addAll(middle(appFrames, appAllowance / 2));
        }

        List<T> kept = new ArrayList<>(frames.size() - deleted.size());
        for (T frame : frames) {
            if (!deleted.contains(frame)) {
                kept.add(frame);
            }
        }
        return kept;
    }

    /**
     * Everything except the first and last {@code keep} elements. Keeping nothing
     * from either end selects nothing.
     */
    private static <T> List<T> middle(List<T> items, int keep) {
        if (keep <= 0) {
            return List.of();
        }
        int end = items.size() - keep;
        return keep < end ? items.subList(keep, end) : List.of();
    }
}
