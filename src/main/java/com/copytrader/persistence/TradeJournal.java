package com.copytrader.persistence;

import com.copytrader.domain.enums.PositionAction;
import com.copytrader.domain.model.Fill;
import com.copytrader.domain.model.PortfolioSnapshot;

/**
 * Side-effecting sink the session calls after every committed trade.
 *
 * <p>Implementations must not throw for storage problems: they log and drop the record.
 * Accounting correctness never depends on a journal write succeeding.
 */
public interface TradeJournal {

    void saveFill(Fill fill, PositionAction action, double realizedPnl, double unrealizedPnl);

    void saveAccount(PortfolioSnapshot snapshot);
}
