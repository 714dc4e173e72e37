package com.positionintel.intelligence.controller;

import com.positionintel.common.exception.InvalidQueryException;
import com.positionintel.common.exception.ProviderUnavailableException;
import com.positionintel.common.exception.SubjectNotFoundException;
import com.positionintel.common.model.CompetitivePosition;
import com.positionintel.common.model.CompetitiveTrends;
import com.positionintel.common.model.NetworkSummary;
import com.positionintel.intelligence.cache.CacheStats;
import com.positionintel.intelligence.service.CompetitivePositionService;
import com.positionintel.intelligence.service.CompetitiveTrendsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/intelligence")
public class IntelligenceController {

    private final CompetitivePositionService service;
    private final CompetitiveTrendsService   trends;

    public IntelligenceController(CompetitivePositionService service, CompetitiveTrendsService trends) {
        this.service = service;
        this.trends  = trends;
    }

    @GetMapping("/position/{subjectId}")
    public Mono<CompetitivePosition> getPosition(@PathVariable String subjectId,
                                                 @RequestParam(defaultValue = "7") int windowDays,
                                                 @RequestParam(defaultValue = "false") boolean force) {
        return service.computePosition(subjectId, windowDays, force);
    }

    @PostMapping("/network-summary")
    public Mono<NetworkSummary> networkSummary(@RequestBody List<String> subjectIds,
                                               @RequestParam(defaultValue = "7") int windowDays) {
        return service.summarizeNetwork(subjectIds, windowDays);
    }

    @GetMapping("/trends/{subjectId}")
    public Mono<CompetitiveTrends> getTrends(@PathVariable String subjectId,
                                             @RequestParam(defaultValue = "30") int windowDays) {
        return trends.computeTrends(subjectId, windowDays);
    }

    /** {@code family} is {@code positions} (default) or {@code trends}. */
    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats(@RequestParam(defaultValue = "positions") String family) {
        return switch (family) {
            case "positions" -> ResponseEntity.ok(service.cache().stats());
            case "trends"    -> ResponseEntity.ok(trends.cache().stats());
            default          -> ResponseEntity.badRequest().build();
        };
    }

    /** Applies to both cache families. Without a pattern everything is cleared. */
    @DeleteMapping("/cache")
    public Map<String, Object> invalidate(@RequestParam(required = false) String pattern) {
        if (pattern == null || pattern.isBlank()) {
            int size = service.cache().size() + trends.cache().size();
            service.cache().clear();
            trends.cache().clear();
            return Map.of("cleared", true, "removed", size);
        }
        int removed = service.cache().invalidatePattern(pattern) + trends.cache().invalidatePattern(pattern);
        return Map.of("cleared", false, "removed", removed);
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<Map<String, String>> onInvalidQuery(InvalidQueryException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_query", "message", e.getMessage()));
    }

    @ExceptionHandler(SubjectNotFoundException.class)
    public ResponseEntity<Map<String, String>> onSubjectNotFound(SubjectNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "subject_not_found", "subjectId", e.getSubjectId()));
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, String>> onProviderUnavailable(ProviderUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "provider_unavailable", "providerId", e.getProviderId()));
    }
}
