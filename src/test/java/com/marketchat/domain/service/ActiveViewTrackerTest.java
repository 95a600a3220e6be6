package com.marketchat.domain.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ActiveViewTrackerTest {

    private final ActiveViewTracker tracker = new ActiveViewTracker();

    @Test
    void enter_ShouldReplacePreviousView() {
        tracker.enter(1L, 100L);
        tracker.enter(1L, 200L);

        assertThat(tracker.isActive(1L, 100L)).isFalse();
        assertThat(tracker.isActive(1L, 200L)).isTrue();
        assertThat(tracker.size()).isEqualTo(1);
    }

    @Test
    void leave_ShouldOnlyRemoveMatchingConversation() {
        tracker.enter(1L, 100L);

        assertThat(tracker.leave(1L, 200L)).isFalse();
        assertThat(tracker.isActive(1L, 100L)).isTrue();

        assertThat(tracker.leave(1L, 100L)).isTrue();
        assertThat(tracker.current(1L)).isNull();
    }

    @Test
    void clearIfOwnedBy_ShouldKeepViewEnteredFromAnotherConnection() {
        tracker.enter(1L, 100L, "conn-a");

        assertThat(tracker.clearIfOwnedBy(1L, "conn-b")).isFalse();
        assertThat(tracker.isActive(1L, 100L)).isTrue();

        assertThat(tracker.clearIfOwnedBy(1L, "conn-a")).isTrue();
        assertThat(tracker.isActive(1L, 100L)).isFalse();
    }

    @Test
    void clearIfOwnedBy_ShouldRemoveViewWithoutOwner() {
        tracker.enter(1L, 100L);
        assertThat(tracker.clearIfOwnedBy(1L, "any")).isTrue();
    }

    @Test
    void enter_ShouldIgnoreInvalidIds() {
        tracker.enter(0L, 100L);
        tracker.enter(1L, -1L);
        assertThat(tracker.size()).isZero();
    }
}
