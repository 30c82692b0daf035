package com.leveltrader.unit.level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.leveltrader.domain.enums.LevelOrderType;
import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.enums.OrderStatus;
import com.leveltrader.domain.model.LevelOrder;
import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.level.Level;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class LevelTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 3, 10, 0);
    private static final BigDecimal PRICE_100 = new BigDecimal("100");

    private static Level enteredBuy(int size, List<Double> exits) {
        Level level = new Level(1, 2.0, exits);
        level.executeEntry(T0, OrderSide.BUY, size, PRICE_100, -2.3);
        return level;
    }

    private static void assertPartitionMatchesPosition(Level level) {
        assertThat(level.getTotalRemainingExitQuantity()).isEqualTo(Math.abs(level.getCurrentPosition()));
    }

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("size 10 over 3 exit levels partitions as 4/3/3")
        void partitionsRemainderToLowestIndices() {
            Level level = enteredBuy(10, List.of(0.75, 0.5, 0.25));

            assertThat(level.getExitQuantityForLevel(0)).isEqualTo(4);
            assertThat(level.getExitQuantityForLevel(1)).isEqualTo(3);
            assertThat(level.getExitQuantityForLevel(2)).isEqualTo(3);
            assertPartitionMatchesPosition(level);
        }

        @Test
        @DisplayName("SELL entry produces a negative currentPosition")
        void sellEntryIsNegative() {
            Level level = new Level(2, 1.5, List.of(0.5));
            assertThat(level.executeEntry(T0, OrderSide.SELL, 3, PRICE_100, 1.7)).isTrue();

            assertThat(level.getCurrentPosition()).isEqualTo(-3);
            assertThat(level.getPositionSize()).isEqualTo(3);
            assertThat(level.getActualEntrySignal()).isEqualTo(1.7);
            assertPartitionMatchesPosition(level);
        }

        @Test
        @DisplayName("second entry is refused and changes nothing")
        void secondEntryRefused() {
            Level level = enteredBuy(4, List.of(0.5, 0.0));

            boolean second = level.executeEntry(T0.plusMinutes(1), OrderSide.SELL, 8, new BigDecimal("90"), 2.5);

            assertThat(second).isFalse();
            assertThat(level.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(level.getCurrentPosition()).isEqualTo(4);
            assertThat(level.getEntryPrice()).isEqualByComparingTo(PRICE_100);
        }

        @Test
        @DisplayName("non-positive size or missing price is refused")
        void invalidEntryRefused() {
            Level level = new Level(3, 1.0, List.of(0.5));

            assertThat(level.executeEntry(T0, OrderSide.BUY, 0, PRICE_100, -1.2)).isFalse();
            assertThat(level.executeEntry(T0, OrderSide.BUY, 2, null, -1.2)).isFalse();
            assertThat(level.isEntryComplete()).isFalse();
            assertThat(level.getTriggeredExitLevels(5.0)).isEmpty();
        }

        @Test
        @DisplayName("empty exit levels fail construction")
        void emptyExitLevelsRejected() {
            assertThatThrownBy(() -> new Level(1, 1.0, List.of())).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Exit triggers")
    class ExitTriggers {

        @Test
        @DisplayName("BUY level exits once signal reverts to -threshold * multiplier")
        void buyLevelTriggers() {
            Level level = enteredBuy(6, List.of(0.5, 0.0));

            assertThat(level.getTriggeredExitLevels(-1.5)).isEmpty();
            assertThat(level.getTriggeredExitLevels(-1.0)).containsExactly(0);
            assertThat(level.getTriggeredExitLevels(0.0)).containsExactly(0, 1);
        }

        @Test
        @DisplayName("SELL level exits once signal falls to +threshold * multiplier")
        void sellLevelTriggers() {
            Level level = new Level(1, 2.0, List.of(0.5, 0.0));
            level.executeEntry(T0, OrderSide.SELL, 6, PRICE_100, 2.4);

            assertThat(level.getTriggeredExitLevels(1.5)).isEmpty();
            assertThat(level.getTriggeredExitLevels(1.0)).containsExactly(0);
            assertThat(level.getTriggeredExitLevels(-0.1)).containsExactly(0, 1);
        }

        @Test
        @DisplayName("exhausted tranches are not reported again")
        void exhaustedTrancheNotTriggered() {
            Level level = enteredBuy(6, List.of(0.5, 0.0));
            level.executeExit(0, new BigDecimal("101"), T0.plusMinutes(5));

            assertThat(level.getTriggeredExitLevels(0.0)).containsExactly(1);
        }
    }

    @Nested
    @DisplayName("Exit execution")
    class ExitExecution {

        @Test
        @DisplayName("size 9 with exits [0.5, 0.5]: first tranche exits 5 at 101, residual 4 marked correctly")
        void partialExitAndResidualPnl() {
            Level level = enteredBuy(9, List.of(0.5, 0.5));

            int exited = level.executeExit(0, new BigDecimal("101"), T0.plusMinutes(3));

            assertThat(exited).isEqualTo(5);
            assertThat(level.getCurrentPosition()).isEqualTo(4);
            assertThat(level.calculateUnrealizedPnl(new BigDecimal("101"))).isEqualByComparingTo("4");
            assertThat(level.isLevelComplete()).isFalse();
            assertPartitionMatchesPosition(level);
        }

        @Test
        @DisplayName("exiting an exhausted or unknown tranche returns 0 and leaves the position alone")
        void exitIsIdempotent() {
            Level level = enteredBuy(4, List.of(0.5, 0.0));
            level.executeExit(0, new BigDecimal("101"), T0);

            assertThat(level.executeExit(0, new BigDecimal("102"), T0)).isZero();
            assertThat(level.executeExit(0, new BigDecimal("103"), T0)).isZero();
            assertThat(level.executeExit(7, new BigDecimal("103"), T0)).isZero();
            assertThat(level.getCurrentPosition()).isEqualTo(2);
        }

        @Test
        @DisplayName("exiting every tranche completes the level")
        void allTranchesComplete() {
            Level level = enteredBuy(5, List.of(0.75, 0.5, 0.25));

            level.executeExit(0, new BigDecimal("101"), T0);
            assertPartitionMatchesPosition(level);
            level.executeExit(2, new BigDecimal("101"), T0);
            assertPartitionMatchesPosition(level);
            level.executeExit(1, new BigDecimal("101"), T0);

            assertThat(level.getCurrentPosition()).isZero();
            assertThat(level.isLevelComplete()).isTrue();
            assertThat(level.getTriggeredExitLevels(10.0)).isEmpty();
        }

        @Test
        @DisplayName("a clamped exit that flattens the level zeroes every other tranche")
        void clampedExitDrainsOtherTranches() {
            Level level = enteredBuy(6, List.of(0.5, 0.25, 0.0));
            ReflectionTestUtils.setField(level, "currentPosition", 1);

            int exited = level.executeExit(0, new BigDecimal("101"), T0);

            assertThat(exited).isEqualTo(1);
            assertThat(level.getCurrentPosition()).isZero();
            assertThat(level.isLevelComplete()).isTrue();
            assertThat(level.getExitQuantityForLevel(1)).isZero();
            assertThat(level.getExitQuantityForLevel(2)).isZero();
            assertPartitionMatchesPosition(level);
            assertThat(level.forceExit(new BigDecimal("101"), T0)).isZero();
        }

        @Test
        @DisplayName("forceExit drains every remaining tranche")
        void forceExitDrains() {
            Level level = enteredBuy(7, List.of(0.5, 0.25, 0.0));
            level.executeExit(0, new BigDecimal("101"), T0);

            int exited = level.forceExit(new BigDecimal("99"), T0.plusMinutes(10));

            assertThat(exited).isEqualTo(4);
            assertThat(level.isLevelComplete()).isTrue();
            assertThat(level.getTotalRemainingExitQuantity()).isZero();
        }

        @Test
        @DisplayName("SELL level unrealized PnL is positive when price falls")
        void sellUnrealizedPnl() {
            Level level = new Level(1, 1.0, List.of(0.5));
            level.executeEntry(T0, OrderSide.SELL, 3, PRICE_100, 1.4);

            assertThat(level.calculateUnrealizedPnl(new BigDecimal("98"))).isEqualByComparingTo("6");
        }

        @Test
        @DisplayName("unrealized PnL is zero before entry")
        void unrealizedZeroBeforeEntry() {
            Level level = new Level(1, 1.0, List.of(0.5));

            assertThat(level.calculateUnrealizedPnl(PRICE_100)).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("working orders are pending until a terminal status, then cleaned up")
        void pendingAndCleanup() {
            Level level = enteredBuy(4, List.of(0.5, 0.0));
            level.addOrder(11L, LevelOrderType.ENTRY, 4, PRICE_100, LevelOrder.NO_EXIT_INDEX);
            level.addOrder(12L, LevelOrderType.EXIT, 2, new BigDecimal("101"), 0);

            assertThat(level.hasPendingOrders()).isTrue();

            level.updateOrderStatus(11L, OrderStatus.FILLED);
            level.updateOrderStatus(12L, OrderStatus.NEW);
            assertThat(level.hasPendingOrders()).isTrue();

            level.updateOrderStatus(12L, OrderStatus.CANCELLED);
            assertThat(level.hasPendingOrders()).isFalse();

            assertThat(level.cleanupCompletedOrders()).containsExactlyInAnyOrder(11L, 12L);
            assertThat(level.getOrderCount()).isZero();
        }

        @Test
        @DisplayName("fills accumulate into PARTIALLY_FILLED then FILLED")
        void fillsAccumulate() {
            Level level = enteredBuy(4, List.of(0.5, 0.0));
            level.addOrder(21L, LevelOrderType.ENTRY, 4, PRICE_100, LevelOrder.NO_EXIT_INDEX);

            level.applyFill(21L, 1);
            assertThat(level.snapshot().getOrders().get(21L).getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);

            level.applyFill(21L, 3);
            LevelOrder order = level.snapshot().getOrders().get(21L);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getFilledQuantity()).isEqualTo(4);
        }

        @Test
        @DisplayName("unknown orders are ignored")
        void unknownOrderIgnored() {
            Level level = enteredBuy(4, List.of(0.5));

            assertThat(level.updateOrderStatus(99L, OrderStatus.FILLED)).isFalse();
            assertThat(level.applyFill(99L, 1)).isFalse();
        }
    }

    @Test
    @DisplayName("snapshot is detached from the live level")
    void snapshotIsDetached() {
        Level level = enteredBuy(4, List.of(0.5, 0.0));
        level.addOrder(31L, LevelOrderType.ENTRY, 4, PRICE_100, LevelOrder.NO_EXIT_INDEX);

        LevelSnapshot snapshot = level.snapshot();
        snapshot.getOrders().get(31L).setStatus(OrderStatus.REJECTED);
        level.executeExit(0, new BigDecimal("101"), T0);

        assertThat(level.snapshot().getOrders().get(31L).getStatus()).isEqualTo(OrderStatus.PENDING_NEW);
        assertThat(snapshot.getCurrentPosition()).isEqualTo(4);
        assertThat(snapshot.getExitLevelStatus()).isEqualTo(Map.of(0, 2, 1, 2));
        assertThatThrownBy(() -> snapshot.getExitLevelStatus().put(0, 0))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
