package com.kotsin.fairvalue.controller;

import com.kotsin.fairvalue.dto.FairValueRequest;
import com.kotsin.fairvalue.fairvalue.formatter.FairValueFormatter;
import com.kotsin.fairvalue.fairvalue.model.FairValueOptions;
import com.kotsin.fairvalue.fairvalue.model.PsychologicalFairValue;
import com.kotsin.fairvalue.fairvalue.model.WallLevels;
import com.kotsin.fairvalue.fairvalue.service.FairValueService;
import com.kotsin.fairvalue.profile.model.ProfileType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST Controller for psychological fair value.
 * Snapshot calculation, provider-backed lookups and cache administration.
 */
@Slf4j
@RestController
@RequestMapping("/api/fair-value")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class FairValueController {

    private final FairValueService fairValueService;
    private final FairValueFormatter formatter;

    /**
     * Calculate fair value for a caller-supplied snapshot.
     *
     * @param request input snapshot plus optional options
     * @return full fair value result
     */
    @PostMapping
    public ResponseEntity<PsychologicalFairValue> calculate(@RequestBody FairValueRequest request) {
        if (request == null || request.getInput() == null) {
            throw new IllegalArgumentException("Request body must contain input");
        }
        log.debug("[FAIR-VALUE-API] POST calculate for {}", request.getInput().getTicker());
        return ResponseEntity.ok(fairValueService.calculate(request.getInput(), request.getOptions()));
    }

    /**
     * Provider-backed fair value for a ticker.
     *
     * @param ticker           symbol (e.g. "AAPL")
     * @param profile          optional profile override
     * @param includeAllLevels keep levels below the minimum strength
     * @return 404 when no market data is available
     */
    @GetMapping("/{ticker}")
    public ResponseEntity<PsychologicalFairValue> getFairValue(
            @PathVariable String ticker,
            @RequestParam(required = false) ProfileType profile,
            @RequestParam(required = false) Integer minDte,
            @RequestParam(required = false) Integer maxDte,
            @RequestParam(defaultValue = "false") boolean includeAllLevels,
            @RequestParam(required = false) Integer maxLevels) {

        log.debug("[FAIR-VALUE-API] GET fair value for {} profile={}", ticker, profile);

        FairValueOptions options = FairValueOptions.builder()
                .minDte(minDte)
                .maxDte(maxDte)
                .includeAllLevels(includeAllLevels)
                .maxMagneticLevels(maxLevels)
                .build();

        return fairValueService.getFairValue(ticker, profile, options)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{ticker}/walls")
    public ResponseEntity<WallLevels> getWalls(@PathVariable String ticker) {
        return fairValueService.getFairValue(ticker)
                .map(fairValueService::extractWalls)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Compact one-line summary for a language-model context window.
     */
    @GetMapping(value = "/{ticker}/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getSummary(@PathVariable String ticker) {
        return fairValueService.getFairValue(ticker)
                .map(formatter::compact)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        return ResponseEntity.ok(fairValueService.cacheStats());
    }

    @DeleteMapping("/cache/{ticker}")
    public ResponseEntity<Map<String, Object>> evict(@PathVariable String ticker) {
        fairValueService.evict(ticker);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Evicted " + ticker
        ));
    }
}
