package com.signalbot.backend.service.planner;

import com.signalbot.backend.config.ExecutionProperties;
import com.signalbot.backend.exception.OrderPlanningException;
import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketConstraints;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.OrderPlan;
import com.signalbot.backend.model.OrderPlan.StopLossOrderSpec;
import com.signalbot.backend.model.OrderPlan.TakeProfitOrderSpec;
import com.signalbot.backend.model.RejectionReason;
import com.signalbot.backend.model.ValidatedTrade;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the order ladder for a validated trade. No I/O and no shared state.
 * <p>
 * The take-profit ladder uses the 1st, 3rd and 5th signal levels (fewer when the signal has fewer),
 * each pulled toward entry by the configured offset. Quantities are split equally and rounded down to
 * the lot step; the rounding remainder goes to the last level. When a slice would fall under the
 * exchange minimums the ladder is cut to its first affordable levels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderPlanner {

    static final int[] LADDER_LEVELS = {0, 2, 4};

    private final ExecutionProperties executionProperties;

    public OrderPlan plan(ValidatedTrade trade) {
        return plan(trade, constraintsFor(trade.signal().marketType()));
    }

    public OrderPlan plan(ValidatedTrade trade, MarketConstraints constraints) {
        CandidateSignal signal = trade.signal();
        Direction direction = signal.direction();
        BigDecimal entryPrice = improvedEntry(signal.entryPrice(), direction);

        BigDecimal quantity = MoneyUtils.floorToStep(MoneyUtils.divide(trade.positionSize(), entryPrice),
                constraints.quantityStep());
        if (!meetsMinimums(quantity, entryPrice, constraints)) {
            throw new OrderPlanningException(RejectionReason.ORDER_TOO_SMALL,
                    "Entry quantity " + quantity + " @ " + entryPrice + " below exchange minimum");
        }

        List<TakeProfitOrderSpec> selected = selectLevels(signal.takeProfits(), direction, entryPrice);
        if (selected.isEmpty()) {
            throw new OrderPlanningException(RejectionReason.NO_TAKE_PROFIT, "No take-profit level survives selection");
        }
        List<TakeProfitOrderSpec> ladder = allocate(selected, quantity, constraints, false);
        if (ladder.isEmpty()) {
            throw new OrderPlanningException(RejectionReason.NO_TAKE_PROFIT,
                    "No take-profit slice meets exchange minimums for quantity " + quantity);
        }

        int leverage = signal.marketType().supportsLeverage() ? trade.leverage() : 1;
        OrderPlan plan = new OrderPlan(
                trade.tradeId(),
                signal.symbol(),
                direction,
                signal.marketType(),
                entryPrice,
                quantity,
                leverage,
                new StopLossOrderSpec(signal.stopLoss(), quantity),
                ladder
        );
        log.info("Plan {} {} {} qty={} @ {} lev={}x sl={} tps={}", plan.tradeId(), plan.symbol(), direction,
                quantity, entryPrice, leverage, signal.stopLoss(),
                ladder.stream().map(TakeProfitOrderSpec::triggerPrice).toList());
        return plan;
    }

    /**
     * Re-sizes the protective orders of a plan to the quantity that actually filled. Never rejects: a filled
     * position always gets at least one take-profit covering its whole quantity.
     */
    public OrderPlan rescale(OrderPlan plan, BigDecimal filledQuantity) {
        MarketConstraints constraints = constraintsFor(plan.marketType());
        BigDecimal quantity = MoneyUtils.floorToStep(filledQuantity, constraints.quantityStep());
        if (quantity.signum() == 0) {
            quantity = MoneyUtils.scale(filledQuantity);
        }
        List<TakeProfitOrderSpec> ladder = allocate(plan.takeProfits(), quantity, constraints, true);
        log.info("Plan {} rescaled to filled quantity {} ({} -> {} take-profit levels)",
                plan.tradeId(), quantity, plan.takeProfits().size(), ladder.size());
        return new OrderPlan(plan.tradeId(), plan.symbol(), plan.direction(), plan.marketType(), plan.entryPrice(),
                quantity, plan.leverage(), new StopLossOrderSpec(plan.stopLoss().triggerPrice(), quantity), ladder);
    }

    public MarketConstraints constraintsFor(MarketType marketType) {
        ExecutionProperties.Lot lot = marketType == MarketType.SPOT
                ? executionProperties.getSpot()
                : executionProperties.getFutures();
        return new MarketConstraints(lot.getQuantityStep(), lot.getMinQuantity(), lot.getMinNotional());
    }

    private BigDecimal improvedEntry(BigDecimal signalEntry, Direction direction) {
        BigDecimal tolerance = executionProperties.getEntryPriceTolerancePct();
        if (tolerance == null || tolerance.signum() == 0) {
            return MoneyUtils.scale(signalEntry);
        }
        BigDecimal factor = direction == Direction.LONG
                ? BigDecimal.ONE.subtract(tolerance)
                : BigDecimal.ONE.add(tolerance);
        return MoneyUtils.multiply(signalEntry, factor);
    }

    private List<TakeProfitOrderSpec> selectLevels(List<BigDecimal> takeProfits, Direction direction,
                                                   BigDecimal entryPrice) {
        BigDecimal offset = executionProperties.getTakeProfitOffsetPct();
        List<TakeProfitOrderSpec> selected = new ArrayList<>();
        for (int index : LADDER_LEVELS) {
            if (index >= takeProfits.size()) {
                break;
            }
            BigDecimal signalPrice = takeProfits.get(index);
            if (signalPrice == null || direction.favourableMove(entryPrice, signalPrice).signum() <= 0) {
                continue;
            }
            BigDecimal trigger = nudgeTowardEntry(signalPrice, direction, offset);
            if (direction.favourableMove(entryPrice, trigger).signum() <= 0) {
                trigger = MoneyUtils.scale(signalPrice);
            }
            selected.add(new TakeProfitOrderSpec(index + 1, signalPrice, trigger, BigDecimal.ZERO, BigDecimal.ZERO));
        }
        return selected;
    }

    private BigDecimal nudgeTowardEntry(BigDecimal price, Direction direction, BigDecimal offset) {
        if (offset == null || offset.signum() == 0) {
            return MoneyUtils.scale(price);
        }
        BigDecimal factor = direction == Direction.LONG
                ? BigDecimal.ONE.subtract(offset)
                : BigDecimal.ONE.add(offset);
        return MoneyUtils.multiply(price, factor);
    }

    private List<TakeProfitOrderSpec> allocate(List<TakeProfitOrderSpec> levels, BigDecimal quantity,
                                               MarketConstraints constraints, boolean forceOne) {
        for (int count = levels.size(); count >= 1; count--) {
            List<TakeProfitOrderSpec> ladder = split(levels.subList(0, count), quantity, constraints.quantityStep());
            boolean affordable = ladder.stream()
                    .allMatch(tp -> meetsMinimums(tp.quantity(), tp.triggerPrice(), constraints));
            if (affordable) {
                return ladder;
            }
        }
        if (forceOne) {
            return split(levels.subList(0, 1), quantity, constraints.quantityStep());
        }
        return List.of();
    }

    private List<TakeProfitOrderSpec> split(List<TakeProfitOrderSpec> levels, BigDecimal quantity, BigDecimal step) {
        int count = levels.size();
        BigDecimal slice = MoneyUtils.floorToStep(
                quantity.divide(BigDecimal.valueOf(count), MoneyUtils.SCALE, RoundingMode.DOWN), step);
        List<TakeProfitOrderSpec> result = new ArrayList<>(count);
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < count; i++) {
            TakeProfitOrderSpec level = levels.get(i);
            BigDecimal levelQty = i == count - 1 ? MoneyUtils.subtract(quantity, allocated) : slice;
            allocated = allocated.add(levelQty);
            result.add(new TakeProfitOrderSpec(level.level(), level.signalPrice(), level.triggerPrice(),
                    MoneyUtils.divide(levelQty, quantity), levelQty));
        }
        return result;
    }

    private boolean meetsMinimums(BigDecimal quantity, BigDecimal price, MarketConstraints constraints) {
        if (quantity.signum() <= 0) {
            return false;
        }
        if (constraints.minQuantity() != null && quantity.compareTo(constraints.minQuantity()) < 0) {
            return false;
        }
        return constraints.minNotional() == null
                || quantity.multiply(price).compareTo(constraints.minNotional()) >= 0;
    }
}
