package com.optiondesk.api.controller;

import com.optiondesk.api.dto.request.PreloadRequest;
import com.optiondesk.api.dto.response.PreloaderStatusResponse;
import com.optiondesk.config.PreloaderProperties;
import com.optiondesk.service.OptionPreloader;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual control of the greeks preloader. It normally follows the gateway connection on its own.
 */
@RestController
@RequestMapping("/api/preloader")
public class PreloaderController {

    private final OptionPreloader optionPreloader;
    private final PreloaderProperties preloaderProperties;

    public PreloaderController(OptionPreloader optionPreloader, PreloaderProperties preloaderProperties) {
        this.optionPreloader = optionPreloader;
        this.preloaderProperties = preloaderProperties;
    }

    @PostMapping("/start")
    public ResponseEntity<PreloaderStatusResponse> start() {
        optionPreloader.start();
        return ResponseEntity.ok(status());
    }

    @PostMapping("/stop")
    public ResponseEntity<PreloaderStatusResponse> stop() {
        optionPreloader.stop();
        return ResponseEntity.ok(status());
    }

    @GetMapping("/status")
    public ResponseEntity<PreloaderStatusResponse> getStatus() {
        return ResponseEntity.ok(status());
    }

    /** Warms one (symbol, expiry, strikes) key right away. Returns before the fetch finishes. */
    @PostMapping("/preload")
    public ResponseEntity<Map<String, Object>> preload(@Valid @RequestBody PreloadRequest request) {
        optionPreloader.requestPreload(request.getSymbol(), request.getExpiry(), request.getStrikes());
        return ResponseEntity.accepted()
                .body(Map.of(
                        "symbol", request.getSymbol(),
                        "expiry", request.getExpiry(),
                        "strikes", request.getStrikes().size()));
    }

    private PreloaderStatusResponse status() {
        return PreloaderStatusResponse.builder()
                .running(optionPreloader.isRunning())
                .cycleInProgress(optionPreloader.isCycleRunning())
                .symbols(List.copyOf(preloaderProperties.getSymbols()))
                .lastCycleCompletedAt(optionPreloader.getLastCycleCompletedAt())
                .build();
    }
}
