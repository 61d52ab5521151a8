package com.optiondesk.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optiondesk.api.controller.PreloaderController;
import com.optiondesk.config.ApiResponseAdvice;
import com.optiondesk.config.PreloaderProperties;
import com.optiondesk.exception.GlobalExceptionHandler;
import com.optiondesk.service.OptionPreloader;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PreloaderControllerTest {

    private MockMvc mockMvc;

    @Mock
    private OptionPreloader optionPreloader;

    @BeforeEach
    void setUp() {
        PreloaderController controller = new PreloaderController(optionPreloader, new PreloaderProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("POST /start starts the preloader and reports its status")
    void start() throws Exception {
        when(optionPreloader.isRunning()).thenReturn(true);

        mockMvc.perform(post("/api/preloader/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.running").value(true))
                .andExpect(jsonPath("$.data.symbols[0]").value("QQQ"));

        verify(optionPreloader).start();
    }

    @Test
    @DisplayName("POST /stop stops the preloader")
    void stop() throws Exception {
        mockMvc.perform(post("/api/preloader/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.running").value(false));

        verify(optionPreloader).stop();
    }

    @Test
    @DisplayName("GET /status includes the last completed cycle")
    void status_reportsLastCycle() throws Exception {
        when(optionPreloader.getLastCycleCompletedAt()).thenReturn(Instant.parse("2026-02-02T15:00:30Z"));
        when(optionPreloader.isCycleRunning()).thenReturn(true);

        mockMvc.perform(get("/api/preloader/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.cycleInProgress").value(true))
                .andExpect(jsonPath("$.data.lastCycleCompletedAt").exists());
    }

    @Test
    @DisplayName("POST /preload is accepted without waiting for the fetch")
    void preload() throws Exception {
        when(optionPreloader.requestPreload(eq("QQQ"), eq("20260220"), anyList()))
                .thenReturn(new CompletableFuture<>());
        String body = """
                {"symbol": "QQQ", "expiry": "20260220", "strikes": [585, 590, 595]}
                """;

        mockMvc.perform(post("/api/preloader/preload").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.symbol").value("QQQ"))
                .andExpect(jsonPath("$.data.strikes").value(3));
    }

    @Test
    @DisplayName("POST /preload validates the expiry format")
    void preload_validation() throws Exception {
        String body = """
                {"symbol": "QQQ", "expiry": "Feb20", "strikes": [590]}
                """;

        mockMvc.perform(post("/api/preloader/preload").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.expiry").value("expiry must be yyyyMMdd"));

        verify(optionPreloader, never()).requestPreload(anyString(), anyString(), any());
    }
}
