package com.copytrader.unit.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.copytrader.api.controller.PaperTradingController;
import com.copytrader.config.ApiResponseAdvice;
import com.copytrader.exception.GlobalExceptionHandler;
import com.copytrader.session.PaperTradingSession;
import com.copytrader.session.SessionSettings;
import com.copytrader.unit.support.Fills;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the PaperTradingController, backed by a real session.
 */
class PaperTradingControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private MockMvc mockMvc;
    private PaperTradingSession session;

    @BeforeEach
    void setUp() {
        session = new PaperTradingSession(SessionSettings.builder()
                .bankroll(1e9)
                .volumeThreshold(1000)
                .build());
        PaperTradingController controller = new PaperTradingController(session, Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    // ==== Reads ====

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("GET /api/paper/summary returns session totals")
        void summary() throws Exception {
            session.processFill(Fills.buy("BTC", 1.0, 50000));
            session.processFill(Fills.sell("BTC", 0.5, 52000));

            mockMvc.perform(get("/api/paper/summary"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.totalTrades").value(2))
                    .andExpect(jsonPath("$.data.totalRealizedPnl").value(1000.0))
                    .andExpect(jsonPath("$.data.activePositions").value(1))
                    .andExpect(jsonPath("$.data.positions[0].coin").value("BTC"));
        }

        @Test
        @DisplayName("GET /api/paper/positions hides flat positions unless asked")
        void positions() throws Exception {
            session.processFill(Fills.buy("BTC", 1.0, 50000));
            session.processFill(Fills.buy("ETH", 1.0, 3000));
            session.processFill(Fills.sell("ETH", 1.0, 3100));

            mockMvc.perform(get("/api/paper/positions"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].coin").value("BTC"));

            mockMvc.perform(get("/api/paper/positions").param("includeFlat", "true"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(2)));
        }

        @Test
        @DisplayName("GET /api/paper/positions/{coin} returns 404 for an untraded coin")
        void unknownPosition() throws Exception {
            mockMvc.perform(get("/api/paper/positions/DOGE"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("GET /api/paper/positions/{coin} returns the position")
        void knownPosition() throws Exception {
            session.processFill(Fills.buy("SOL", 20, 100));

            mockMvc.perform(get("/api/paper/positions/SOL"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.size").value(20.0))
                    .andExpect(jsonPath("$.data.avgEntryPrice").value(100.0))
                    .andExpect(jsonPath("$.data.tradeCount").value(1));
        }

        @Test
        @DisplayName("GET /api/paper/trades honours the limit")
        void recentTrades() throws Exception {
            session.processFill(Fills.buy("BTC", 1.0, 50000));
            session.processFill(Fills.buy("BTC", 1.0, 51000));
            session.processFill(Fills.sell("BTC", 2.0, 52000));

            mockMvc.perform(get("/api/paper/trades").param("limit", "2"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(2)))
                    .andExpect(jsonPath("$.data[0].action").value("ADD"))
                    .andExpect(jsonPath("$.data[1].action").value("CLOSE"));
        }

        @Test
        @DisplayName("GET /api/paper/trades rejects an out-of-range limit")
        void invalidLimit() throws Exception {
            mockMvc.perform(get("/api/paper/trades").param("limit", "0"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.limit").value(0));

            mockMvc.perform(get("/api/paper/trades").param("limit", "abc"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }
    }

    // ==== Fill submission ====

    @Nested
    @DisplayName("Fill submission")
    class FillSubmission {

        @Test
        @DisplayName("POST /api/paper/fills commits a fill over the volume threshold")
        void commitsLargeFill() throws Exception {
            mockMvc.perform(post("/api/paper/fills")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"coin\":\"BTC\",\"side\":\"BUY\",\"size\":0.5,\"price\":50000}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.committed").value(true))
                    .andExpect(jsonPath("$.data.trade.action").value("OPEN"))
                    .andExpect(jsonPath("$.data.trade.positionSize").value(0.5))
                    .andExpect(jsonPath("$.data.pendingFills").value(0));
        }

        @Test
        @DisplayName("POST /api/paper/fills buffers a small fill")
        void buffersSmallFill() throws Exception {
            mockMvc.perform(post("/api/paper/fills")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"coin\":\"ETH\",\"side\":\"SELL\",\"size\":0.1,\"price\":3000}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.committed").value(false))
                    .andExpect(jsonPath("$.data.pendingFills").value(1));
        }

        @Test
        @DisplayName("POST /api/paper/fills validates the body")
        void rejectsInvalidBody() throws Exception {
            mockMvc.perform(post("/api/paper/fills")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"coin\":\"\",\"side\":\"BUY\",\"size\":-1,\"price\":0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.coin").exists())
                    .andExpect(jsonPath("$.error.details.size").exists())
                    .andExpect(jsonPath("$.error.details.price").exists());
        }

        @Test
        @DisplayName("POST /api/paper/fills rejects an unknown side")
        void rejectsUnknownSide() throws Exception {
            mockMvc.perform(post("/api/paper/fills")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"coin\":\"BTC\",\"side\":\"HOLD\",\"size\":1,\"price\":50000}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }
    }
}
