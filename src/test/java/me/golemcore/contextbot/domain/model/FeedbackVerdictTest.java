package me.golemcore.contextbot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackVerdictTest {

    @Test
    void mapsThumbReactions() {
        assertEquals(Optional.of(FeedbackVerdict.POSITIVE), FeedbackVerdict.fromReaction("+1"));
        assertEquals(Optional.of(FeedbackVerdict.POSITIVE), FeedbackVerdict.fromReaction("ThumbsUp"));
        assertEquals(Optional.of(FeedbackVerdict.NEGATIVE), FeedbackVerdict.fromReaction("-1"));
        assertEquals(Optional.of(FeedbackVerdict.NEGATIVE), FeedbackVerdict.fromReaction("thumbsdown"));
    }

    @Test
    void ignoresOtherReactions() {
        assertTrue(FeedbackVerdict.fromReaction("tada").isEmpty());
        assertTrue(FeedbackVerdict.fromReaction(null).isEmpty());
    }
}
