package com.signalbot.backend.repository;

import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.TradeState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TrackedPositionRepository extends JpaRepository<TrackedPosition, Long> {

    List<TrackedPosition> findByStateNotIn(Collection<TradeState> states);

    List<TrackedPosition> findByState(TradeState state);

    List<TrackedPosition> findBySymbolAndMarketTypeAndStateNotIn(String symbol, MarketType marketType,
                                                                 Collection<TradeState> states);

    Optional<TrackedPosition> findByTradeId(String tradeId);
}
