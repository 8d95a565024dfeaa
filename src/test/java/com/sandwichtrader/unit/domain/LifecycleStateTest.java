package com.sandwichtrader.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sandwichtrader.domain.enums.ExitReason;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.enums.MonthType;
import com.sandwichtrader.domain.model.SandwichContext;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LifecycleStateTest {

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Moves forward one step at a time")
        void forwardOnly() {
            assertThat(LifecycleState.IDLE.canTransitionTo(LifecycleState.ACTIVE)).isTrue();
            assertThat(LifecycleState.ACTIVE.canTransitionTo(LifecycleState.DEFENSE_1)).isTrue();
            assertThat(LifecycleState.DEFENSE_2.canTransitionTo(LifecycleState.STRADDLE)).isTrue();
            assertThat(LifecycleState.ACTIVE.canTransitionTo(LifecycleState.DEFENSE_2)).isFalse();
            assertThat(LifecycleState.DEFENSE_1.canTransitionTo(LifecycleState.ACTIVE)).isFalse();
        }

        @Test
        @DisplayName("Any state holding positions may close; IDLE may not")
        void closeFromLiveStates() {
            assertThat(LifecycleState.ACTIVE.canTransitionTo(LifecycleState.CLOSED)).isTrue();
            assertThat(LifecycleState.STRADDLE.canTransitionTo(LifecycleState.CLOSED)).isTrue();
            assertThat(LifecycleState.IDLE.canTransitionTo(LifecycleState.CLOSED)).isFalse();
        }

        @Test
        @DisplayName("CLOSED is terminal")
        void closedIsTerminal() {
            for (LifecycleState target : LifecycleState.values()) {
                assertThat(LifecycleState.CLOSED.canTransitionTo(target)).isFalse();
            }
            assertThat(LifecycleState.CLOSED.isLive()).isFalse();
            assertThat(LifecycleState.IDLE.isLive()).isFalse();
            assertThat(LifecycleState.DEFENSE_1.isLive()).isTrue();
        }
    }

    @Nested
    @DisplayName("Sandwich context")
    class Context {

        private SandwichContext entered() {
            SandwichContext context = new SandwichContext();
            context.begin(
                    LocalDateTime.of(2025, 10, 28, 15, 0),
                    new BigDecimal("45000"),
                    new BigDecimal("45090"),
                    MonthType.SHORT_CYCLE,
                    LocalDate.of(2025, 10, 28),
                    LocalDate.of(2025, 11, 25));
            return context;
        }

        @Test
        @DisplayName("Cannot be entered twice")
        void beginOnce() {
            SandwichContext context = entered();

            assertThatThrownBy(() -> context.begin(
                            LocalDateTime.of(2025, 10, 28, 15, 1),
                            BigDecimal.ONE,
                            BigDecimal.ONE,
                            MonthType.SHORT_CYCLE,
                            LocalDate.of(2025, 10, 28),
                            LocalDate.of(2025, 11, 25)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Rejects skipping a defense")
        void rejectsSkip() {
            SandwichContext context = entered();

            assertThatThrownBy(() -> context.transitionTo(LifecycleState.STRADDLE))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("ACTIVE -> STRADDLE");
        }

        @Test
        @DisplayName("Counts days since entry and since the last adjustment")
        void dayCounters() {
            SandwichContext context = entered();

            assertThat(context.daysSinceLastAdjustment(LocalDate.of(2025, 11, 11))).isEqualTo(14);
            context.recordAdjustment(LocalDate.of(2025, 11, 11));
            assertThat(context.adjustedOn(LocalDate.of(2025, 11, 11))).isTrue();
            assertThat(context.daysSinceLastAdjustment(LocalDate.of(2025, 11, 15))).isEqualTo(4);
            assertThat(context.daysSinceEntry(LocalDate.of(2025, 11, 15))).isEqualTo(18);
        }

        @Test
        @DisplayName("Close records the exit reason")
        void closeRecordsReason() {
            SandwichContext context = entered();

            context.close(ExitReason.FINAL_EXPIRY);

            assertThat(context.getState()).isEqualTo(LifecycleState.CLOSED);
            assertThat(context.getExitReason()).isEqualTo(ExitReason.FINAL_EXPIRY);
        }
    }

    @Test
    @DisplayName("Five-week gaps are long cycles")
    void monthTypeClassification() {
        assertThat(MonthType.classify(LocalDate.of(2025, 10, 28), LocalDate.of(2025, 11, 25)))
                .isEqualTo(MonthType.SHORT_CYCLE);
        assertThat(MonthType.classify(LocalDate.of(2025, 11, 25), LocalDate.of(2025, 12, 30)))
                .isEqualTo(MonthType.LONG_CYCLE);
        assertThat(MonthType.classify(LocalDate.of(2025, 8, 28), LocalDate.of(2025, 9, 30)))
                .isEqualTo(MonthType.LONG_CYCLE);
    }
}
