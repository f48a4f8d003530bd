package org.dynamis.async.runtime;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    @Test
    void newTask_waitsForActivation() {
        Task<String> task = new Task<>();

        assertThat(task.getStatus()).isEqualTo(TaskStatus.WAITING_FOR_ACTIVATION);
        assertThat(task.isDone()).isFalse();
        assertThatThrownBy(task::getResult).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void firstTerminalTransition_wins() {
        Task<String> task = new Task<>();

        assertThat(task.complete("first")).isTrue();
        assertThat(task.cancel()).isFalse();
        assertThat(task.fail("late")).isFalse();
        assertThat(task.complete("second")).isFalse();

        assertThat(task.getResult()).isEqualTo("first");
        assertThat(task.getError()).isNull();
    }

    @Test
    void failedTask_carriesItsError() {
        Task<Void> task = Task.failed("boom");

        assertThat(task.isFaulted()).isTrue();
        assertThat(task.getError()).isEqualTo("boom");
        assertThat(task.toString()).contains("FAULTED").contains("boom");
    }

    @Test
    void whenAll_completesAfterEveryChild() {
        Task<Integer> a = new Task<>();
        Task<String> b = new Task<>();
        Task<Void> all = Task.whenAll(a, b);

        a.complete(1);
        assertThat(all.isDone()).isFalse();
        b.complete("x");

        assertThat(all.isCompletedSuccessfully()).isTrue();
    }

    @Test
    void whenAll_prefersFaultOverCancellation() {
        Task<Void> all = Task.whenAll(Task.canceled(), Task.failed("bad"), Task.completed(3));

        assertThat(all.isFaulted()).isTrue();
        assertThat(all.getError()).isEqualTo("bad");
    }

    @Test
    void whenAll_isCanceledWhenAChildIsCanceled() {
        assertThat(Task.whenAll(Task.completed(1), Task.canceled()).isCanceled()).isTrue();
    }

    @Test
    void whenAll_ofNothingIsAlreadyComplete() {
        assertThat(Task.whenAll().isCompletedSuccessfully()).isTrue();
    }

    @Test
    void whenAny_yieldsTheFirstDoneIndex() {
        Task<Integer> slow = new Task<>();
        Task<Integer> fast = new Task<>();
        Task<Integer> any = Task.whenAny(slow, fast);

        assertThat(any.isDone()).isFalse();
        fast.complete(9);
        assertThat(any.isDone()).isTrue();
        slow.complete(1);

        assertThat(any.getResult()).isEqualTo(1);
        assertThat(Task.whenAny().getResult()).isEqualTo(-1);
    }

    @Test
    void awaitablePrimitives_cannotRunUnlowered() {
        assertThatThrownBy(() -> Task.delay(1f)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Task.delayFrames(2)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(Task::yieldFrame).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Async.await(Task.completed(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("await");
    }

    @Test
    void cancellationToken_followsItsSource() {
        CancellationTokenSource source = new CancellationTokenSource();
        CancellationToken token = source.getToken();

        assertThat(token.canBeCanceled()).isTrue();
        assertThat(token.isCancellationRequested()).isFalse();
        source.cancel();
        assertThat(token.isCancellationRequested()).isTrue();
        source.reset();
        assertThat(token.isCancellationRequested()).isFalse();
        assertThat(CancellationToken.NONE.canBeCanceled()).isFalse();
    }

    @Test
    void timing_normalisesItsArguments() {
        assertThat(Timing.seconds(-1f).getSeconds()).isZero();
        assertThat(Timing.frames(0).getFrames()).isEqualTo(1);
        assertThat(Timing.nextFrame()).isEqualTo(Timing.frames(1));
        assertThat(Timing.whenComplete(Task.completed(1)).getKind()).isEqualTo(Timing.Kind.COMPLETION);
    }

    @Test
    void behaviourWithoutScheduler_refusesToSchedule() {
        Ticker ticker = new Ticker();

        assertThatThrownBy(ticker::tick)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no scheduler");
    }

    @Test
    void attachedBehaviour_forwardsToItsScheduler() {
        Ticker ticker = new Ticker();
        StringBuilder seen = new StringBuilder();
        ticker.attach((resumption, timing) -> seen.append(timing.getKind()));

        ticker.tick();

        assertThat(seen.toString()).isEqualTo("FRAMES");
    }

    private static final class Ticker extends AsyncBehaviour {
        void tick() {
            schedule(Resumption.of(this, () -> { }), Timing.nextFrame());
        }
    }
}
