package com.copytrader.api.controller;

import com.copytrader.api.dto.request.FillRequest;
import com.copytrader.api.dto.response.FillIngestResponse;
import com.copytrader.domain.model.Fill;
import com.copytrader.domain.model.PaperTrade;
import com.copytrader.domain.model.PortfolioSnapshot;
import com.copytrader.domain.model.Position;
import com.copytrader.exception.InvalidRequestException;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.session.PaperTradingSession;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints over the paper-trading session.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/paper/summary -- portfolio snapshot with totals and open positions</li>
 *   <li>GET /api/paper/positions -- position copies, flat ones only on request</li>
 *   <li>GET /api/paper/positions/{coin} -- one position</li>
 *   <li>GET /api/paper/trades -- most recent trade records</li>
 *   <li>POST /api/paper/fills -- feed one fill through the session</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/paper")
public class PaperTradingController {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingController.class);

    static final int MAX_TRADE_LIMIT = 1000;

    private final PaperTradingSession session;
    private final Clock clock;

    public PaperTradingController(PaperTradingSession session, Clock clock) {
        this.session = session;
        this.clock = clock;
    }

    @GetMapping("/summary")
    public ResponseEntity<PortfolioSnapshot> getSummary() {
        return ResponseEntity.ok(session.snapshot());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> listPositions(
            @RequestParam(defaultValue = "false") boolean includeFlat) {
        List<Position> positions = session.getPositions();
        if (!includeFlat) {
            positions = positions.stream().filter(p -> !p.isFlat()).collect(Collectors.toList());
        }
        return ResponseEntity.ok(positions);
    }

    @GetMapping("/positions/{coin}")
    public ResponseEntity<Position> getPosition(@PathVariable String coin) {
        return session.getPosition(coin)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Position", coin));
    }

    @GetMapping("/trades")
    public ResponseEntity<List<PaperTrade>> getRecentTrades(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_TRADE_LIMIT) {
            throw new InvalidRequestException(
                    "limit must be between 1 and " + MAX_TRADE_LIMIT, Map.of("limit", limit));
        }
        return ResponseEntity.ok(session.getRecentTrades(limit));
    }

    @PostMapping("/fills")
    public ResponseEntity<FillIngestResponse> submitFill(@Valid @RequestBody FillRequest request) {
        Fill fill = Fill.builder()
                .coin(request.getCoin())
                .side(request.getSide())
                .size(request.getSize())
                .price(request.getPrice())
                .closedPnl(request.getClosedPnl())
                .time(request.getTime() != null ? request.getTime() : clock.millis())
                .hash(request.getHash())
                .build();
        log.info("Manual fill submitted: {} {} {} @ {}", fill.getSide(), fill.getSize(), fill.getCoin(), fill.getPrice());

        Optional<PaperTrade> trade = session.processFill(fill);
        return ResponseEntity.ok(FillIngestResponse.builder()
                .committed(trade.isPresent())
                .trade(trade.orElse(null))
                .pendingFills(session.getPendingFillCount(fill.getCoin()))
                .build());
    }
}
