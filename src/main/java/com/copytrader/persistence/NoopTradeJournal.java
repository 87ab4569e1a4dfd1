package com.copytrader.persistence;

import com.copytrader.domain.enums.PositionAction;
import com.copytrader.domain.model.Fill;
import com.copytrader.domain.model.PortfolioSnapshot;

/** Journal that records nothing. Used when storage is disabled and in commit-every-fill mode. */
public class NoopTradeJournal implements TradeJournal {

    @Override
    public void saveFill(Fill fill, PositionAction action, double realizedPnl, double unrealizedPnl) {}

    @Override
    public void saveAccount(PortfolioSnapshot snapshot) {}
}
