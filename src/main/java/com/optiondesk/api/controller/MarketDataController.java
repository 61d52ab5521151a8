package com.optiondesk.api.controller;

import com.optiondesk.api.dto.request.OptionLegRequest;
import com.optiondesk.api.dto.request.OptionQuotesRequest;
import com.optiondesk.api.dto.response.CachedPriceResponse;
import com.optiondesk.domain.model.ChainParams;
import com.optiondesk.domain.model.OptionContractRef;
import com.optiondesk.domain.model.OptionGreek;
import com.optiondesk.domain.model.OptionQuote;
import com.optiondesk.domain.model.StockQuote;
import com.optiondesk.service.OptionChainService;
import com.optiondesk.service.OptionGreeksService;
import com.optiondesk.service.OptionPreloader;
import com.optiondesk.service.QuoteService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for market data: quotes, option chains and greeks.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/market-data/quote/{symbol} -- stock snapshot quote</li>
 *   <li>GET /api/market-data/quotes?symbols= -- one price per symbol</li>
 *   <li>POST /api/market-data/option-quotes -- snapshot quotes for a batch of options</li>
 *   <li>GET /api/market-data/option-chain/{symbol} -- chain parameters</li>
 *   <li>GET /api/market-data/greeks -- greeks for (symbol, expiry, strikes), cache first</li>
 *   <li>GET /api/market-data/greeks/cached -- everything cached for (symbol, expiry), no gateway traffic</li>
 *   <li>GET /api/market-data/price/cached/{symbol} -- last known stock price, no gateway traffic</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final QuoteService quoteService;
    private final OptionChainService optionChainService;
    private final OptionGreeksService optionGreeksService;
    private final OptionPreloader optionPreloader;

    public MarketDataController(
            QuoteService quoteService,
            OptionChainService optionChainService,
            OptionGreeksService optionGreeksService,
            OptionPreloader optionPreloader) {
        this.quoteService = quoteService;
        this.optionChainService = optionChainService;
        this.optionGreeksService = optionGreeksService;
        this.optionPreloader = optionPreloader;
    }

    @GetMapping("/quote/{symbol}")
    public ResponseEntity<StockQuote> getStockQuote(@PathVariable String symbol) {
        return ResponseEntity.ok(quoteService.getStockQuote(symbol));
    }

    @GetMapping("/quotes")
    public ResponseEntity<Map<String, BigDecimal>> getQuotes(@RequestParam List<String> symbols) {
        return ResponseEntity.ok(quoteService.getQuotes(symbols));
    }

    @PostMapping("/option-quotes")
    public ResponseEntity<List<OptionQuote>> getOptionQuotes(@Valid @RequestBody OptionQuotesRequest request) {
        List<OptionContractRef> contracts = new ArrayList<>();
        for (OptionLegRequest leg : request.getContracts()) {
            contracts.add(new OptionContractRef(request.getSymbol(), leg.getExpiry(), leg.getStrike(), leg.getRight()));
        }
        return ResponseEntity.ok(quoteService.getOptionQuotes(contracts));
    }

    @GetMapping("/option-chain/{symbol}")
    public ResponseEntity<List<ChainParams>> getOptionChain(@PathVariable String symbol) {
        return ResponseEntity.ok(optionChainService.getOptionChain(symbol));
    }

    /**
     * Greeks for calls and puts at every requested strike. Served from cache unless
     * {@code forceRefresh} is set or the key has never been fetched.
     */
    @GetMapping("/greeks")
    public ResponseEntity<List<OptionGreek>> getOptionGreeks(
            @RequestParam String symbol,
            @RequestParam String expiry,
            @RequestParam List<BigDecimal> strikes,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return ResponseEntity.ok(optionGreeksService.getOptionGreeks(symbol, expiry, strikes, forceRefresh));
    }

    @GetMapping("/greeks/cached")
    public ResponseEntity<List<OptionGreek>> getCachedGreeks(@RequestParam String symbol, @RequestParam String expiry) {
        return ResponseEntity.ok(optionGreeksService.getCachedGreeks(symbol, expiry));
    }

    @GetMapping("/price/cached/{symbol}")
    public ResponseEntity<CachedPriceResponse> getCachedStockPrice(@PathVariable String symbol) {
        BigDecimal price = optionPreloader.getCachedStockPrice(symbol).orElse(null);
        return ResponseEntity.ok(new CachedPriceResponse(symbol.toUpperCase(Locale.ROOT), price));
    }
}
