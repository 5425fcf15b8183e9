package org.knowhub.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.ReactionEvent;
import org.knowhub.entity.FeedbackKind;
import org.knowhub.service.FeedbackService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ReactionEventAdapterTest {

    private FeedbackService feedbackService;
    private ReactionEventAdapter adapter;

    @BeforeEach
    void setUp() {
        feedbackService = mock(FeedbackService.class);
        adapter = new ReactionEventAdapter(feedbackService);
    }

    @Test
    void reactionsMapToFeedbackKinds() {
        assertThat(adapter.classify(event("reaction_added", "thumbsup"))).contains(FeedbackKind.POSITIVE);
        assertThat(adapter.classify(event("reaction_added", ":+1:"))).contains(FeedbackKind.POSITIVE);
        assertThat(adapter.classify(event("reaction_added", "ThumbsDown"))).contains(FeedbackKind.NEGATIVE);
        assertThat(adapter.classify(event("reaction_removed", "thumbsup"))).contains(FeedbackKind.REMOVED);
    }

    @Test
    void unknownReactionsAreIgnored() {
        assertThat(adapter.classify(event("reaction_added", "tada"))).isEmpty();
        assertThat(adapter.classify(event("message_posted", "thumbsup"))).isEmpty();

        assertThat(adapter.handle(event("reaction_added", "tada"))).isEmpty();
        verify(feedbackService, never()).record(any(), any(), any(), any(), any(), any());
    }

    @Test
    void handledEventIsRecorded() {
        adapter.handle(event("reaction_added", "x"));

        verify(feedbackService).record(eq("turn-7"), eq("U123"), eq(FeedbackKind.NEGATIVE), isNull(), eq("x"), eq("conv-1"));
    }

    @Test
    void removedReactionRetractsItsOwnKind() {
        adapter.handle(event("reaction_removed", ":thumbsup:"));

        verify(feedbackService).retract(eq("turn-7"), eq("U123"), eq(FeedbackKind.POSITIVE), eq(":thumbsup:"), eq("conv-1"));
        verify(feedbackService, never()).record(any(), any(), any(), any(), any(), any());
    }

    @Test
    void removingUnmappedReactionIsIgnored() {
        assertThat(adapter.classify(event("reaction_removed", "eyes"))).isEmpty();

        assertThat(adapter.handle(event("reaction_removed", "eyes"))).isEmpty();
        verify(feedbackService, never()).retract(any(), any(), any(), any(), any());
        verify(feedbackService, never()).record(any(), any(), any(), any(), any(), any());
    }

    private static ReactionEvent event(String type, String reaction) {
        return new ReactionEvent(type, reaction, "U123", "turn-7", "conv-1");
    }
}
