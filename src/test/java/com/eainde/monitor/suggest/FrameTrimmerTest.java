package com.eainde.monitor.suggest;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class FrameTrimmerTest {

    private static ObjectNode frame(int id, boolean inApp) {
        ObjectNode frame = JsonNodeFactory.instance.objectNode();
        frame.put("id", id);
        if (inApp) {
            frame.put("in_app", true);
        }
        return frame;
    }

    /** {@code appCount} in-app frames first, then {@code systemCount} system frames. */
    private static List<ObjectNode> frames(int appCount, int systemCount) {
        List<ObjectNode> frames = new ArrayList<>();
        for (int i = 0; i < appCount; i++) {
            frames.add(frame(frames.size(), true));
        }
        for (int i = 0; i < systemCount; i++) {
            frames.add(frame(frames.size(), false));
        }
        return frames;
    }

    private static List<Integer> ids(List<ObjectNode> frames) {
        return frames.stream().map(f -> f.get("id").asInt()).toList();
    }

    private static List<Integer> range(int fromInclusive, int toExclusive) {
        return IntStream.range(fromInclusive, toExclusive).boxed().toList();
    }

    @Test
    void trimFrames_shouldReturnInput_whenWithinAllowance() {
        List<ObjectNode> frames = frames(5, 5);

        List<ObjectNode> result = FrameTrimmer.trimFrames(frames);

        assertThat(result).isSameAs(frames);
    }

    @Test
    void trimFrames_shouldDropMiddleSystemFrames_whenOnlySystemFrames() {
        List<ObjectNode> frames = frames(0, 40);

        List<ObjectNode> result = FrameTrimmer.trimFrames(frames);

        assertThat(result).hasSize(30);
        List<Integer> expected = new ArrayList<>(range(0, 15));
        expected.addAll(range(25, 40));
        assertThat(ids(result)).isEqualTo(expected);
    }

    @Test
    void trimFrames_shouldKeepAllAppFrames_whenDroppingSystemFramesIsEnough() {
        List<ObjectNode> frames = frames(20, 20);

        List<ObjectNode> result = FrameTrimmer.trimFrames(frames);

        // system frames are ids 20..39, the middle ten of them go
        List<Integer> expected = new ArrayList<>(range(0, 25));
        expected.addAll(range(35, 40));
        assertThat(ids(result)).isEqualTo(expected);
    }

    @Test
    void trimFrames_shouldDropAllSystemFramesThenMiddleAppFrames_whenAppFramesExceedAllowance() {
        List<ObjectNode> frames = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            frames.add(frame(i, false));
        }
        for (int i = 5; i < 40; i++) {
            frames.add(frame(i, true));
        }

        List<ObjectNode> result = FrameTrimmer.trimFrames(frames);

        List<Integer> expected = new ArrayList<>(range(5, 20));
        expected.addAll(range(25, 40));
        assertThat(ids(result)).isEqualTo(expected);
    }

    @Test
    void trimFrames_shouldDropOneExtraSystemFrame_whenSystemAllowanceIsOdd() {
        List<ObjectNode> frames = frames(21, 19);

        List<ObjectNode> result = FrameTrimmer.trimFrames(frames);

        // allowance 9 keeps 4 system frames at each end
        assertThat(result).hasSize(29);
        List<Integer> expected = new ArrayList<>(range(0, 25));
        expected.addAll(range(36, 40));
        assertThat(ids(result)).isEqualTo(expected);
    }

    @Test
    void trimFrames_shouldHonourCustomAllowance() {
        List<ObjectNode> frames = frames(0, 10);

        List<ObjectNode> result = FrameTrimmer.trimFrames(frames, 4);

        assertThat(ids(result)).containsExactly(0, 1, 8, 9);
    }

    @Test
    void trimFrames_shouldNotModifyInput() {
        List<ObjectNode> frames = frames(10, 30);

        FrameTrimmer.trimFrames(frames);

        assertThat(frames).hasSize(40);
        assertThat(frames).allSatisfy(frame -> assertThat(frame.has("delete")).isFalse());
    }
}
