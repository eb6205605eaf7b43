package com.codeheadsystems.sessionkey.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Expired key sweeper test.
 */
@ExtendWith(MockitoExtension.class)
class ExpiredKeySweeperTest {

  @Mock
  private LifecycleController lifecycleController;

  @Test
  void sweep_delegatesToController() {
    when(lifecycleController.cleanupExpired()).thenReturn(3);

    assertThat(new ExpiredKeySweeper(lifecycleController, Duration.ofMinutes(5)).sweep()).isEqualTo(3);
  }

  @Test
  void sweep_failureIsContained() {
    when(lifecycleController.cleanupExpired()).thenThrow(new IllegalStateException("store down"));

    assertThat(new ExpiredKeySweeper(lifecycleController, Duration.ofMinutes(5)).sweep()).isZero();
  }

  @Test
  void start_runsPeriodicallyUntilShutdown() {
    ExpiredKeySweeper sweeper = new ExpiredKeySweeper(lifecycleController, Duration.ofMillis(20));

    sweeper.start();
    try {
      assertThat(sweeper.isRunning()).isTrue();
      verify(lifecycleController, timeout(2_000).atLeast(2)).cleanupExpired();
      assertThatThrownBy(sweeper::start).isInstanceOf(IllegalStateException.class);
    } finally {
      sweeper.shutdown();
    }
    assertThat(sweeper.isRunning()).isFalse();
  }

  @Test
  void constructor_rejectsNonPositiveInterval() {
    assertThatThrownBy(() -> new ExpiredKeySweeper(lifecycleController, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
