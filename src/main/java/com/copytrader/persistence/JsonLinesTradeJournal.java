package com.copytrader.persistence;

import com.copytrader.domain.enums.PositionAction;
import com.copytrader.domain.model.Fill;
import com.copytrader.domain.model.PortfolioSnapshot;
import com.copytrader.domain.model.PositionSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends fills and account snapshots as JSON lines, one file per day.
 *
 * <p>Layout under the data directory:
 * <ul>
 *   <li>{@code fills/yyyyMMdd.jl}: one line per copied fill with the action and PnL of its batch</li>
 *   <li>{@code accounts/yyyyMMdd.jl}: one line per commit with totals and every open position</li>
 * </ul>
 *
 * <p>Directories are created on first write. Write failures are logged and the record dropped.
 */
@Slf4j
public class JsonLinesTradeJournal implements TradeJournal {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path dataDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonLinesTradeJournal(Path dataDir, ObjectMapper objectMapper, Clock clock) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void saveFill(Fill fill, PositionAction action, double realizedPnl, double unrealizedPnl) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("time", clock.millis());
        record.put("coin", fill.getCoin());
        record.put("side", fill.getSide().getVenueCode());
        record.put("size", fill.getSize());
        record.put("price", fill.getPrice());
        record.put("action", action.name());
        record.put("realized_pnl", realizedPnl);
        record.put("unrealized_pnl", unrealizedPnl);
        record.put("volume_usd", fill.notional());
        append("fills", record);
    }

    @Override
    public void saveAccount(PortfolioSnapshot snapshot) {
        Map<String, Object> positions = new LinkedHashMap<>();
        for (PositionSnapshot position : snapshot.getPositions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("size", position.getSize());
            entry.put("avg_price", position.getAvgEntryPrice());
            entry.put("last_price", position.getLastPrice());
            entry.put("realized", position.getRealizedPnl());
            entry.put("unrealized", position.getUnrealizedPnl());
            entry.put("market_val", position.getMarketValue());
            positions.put(position.getCoin(), entry);
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("time", clock.millis());
        record.put("total_pnl", snapshot.getTotalPnl());
        record.put("realized_pnl", snapshot.getTotalRealizedPnl());
        record.put("positions", positions);
        record.put("num_trades", snapshot.getTotalTrades());
        append("accounts", record);
    }

    /** Today's file for the given record kind, e.g. {@code <dataDir>/fills/20250115.jl}. */
    public Path fileFor(String kind) {
        return dataDir.resolve(kind).resolve(LocalDate.now(clock).format(FILE_DATE) + ".jl");
    }

    private void append(String kind, Map<String, Object> record) {
        Path file = fileFor(kind);
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            Files.createDirectories(file.getParent());
            Files.writeString(
                    file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} record: {}", kind, e.getMessage());
        } catch (IOException e) {
            log.warn("Could not append to {}: {}", file, e.getMessage());
        }
    }
}
