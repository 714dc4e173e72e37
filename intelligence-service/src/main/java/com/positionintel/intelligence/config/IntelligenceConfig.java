package com.positionintel.intelligence.config;

import com.positionintel.common.key.CacheKeyDeriver;
import com.positionintel.common.model.BaselineDefaults;
import com.positionintel.common.model.CompetitivePosition;
import com.positionintel.common.model.CompetitiveTrends;
import com.positionintel.intelligence.cache.TtlCacheStore;
import com.positionintel.intelligence.cascade.FallbackCascade;
import com.positionintel.intelligence.coordination.SingleFlightCoordinator;
import com.positionintel.intelligence.provider.CapacityObservationSource;
import com.positionintel.intelligence.provider.HttpCapacityObservationSource;
import com.positionintel.intelligence.provider.HttpPricingObservationSource;
import com.positionintel.intelligence.provider.PricingObservationSource;
import com.positionintel.intelligence.service.CompetitivePositionService;
import com.positionintel.intelligence.service.CompetitiveTrendsService;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Configuration
public class IntelligenceConfig {

    @Value("${intelligence.cache.default-ttl:30m}")
    private Duration defaultTtl;

    @Value("${intelligence.cache.position-ttl:60m}")
    private Duration positionTtl;

    @Value("${intelligence.cache.trends-ttl:60m}")
    private Duration trendsTtl;

    @Value("${intelligence.cache.sweep-interval:5m}")
    private Duration sweepInterval;

    @Value("${intelligence.provider-timeout:5s}")
    private Duration providerTimeout;

    @Value("${intelligence.compute-timeout:10s}")
    private Duration computeTimeout;

    @Value("${intelligence.max-window-days:365}")
    private int maxWindowDays;

    @Value("${intelligence.providers.pricing.base-url:http://localhost:8091}")
    private String pricingUrl;

    @Value("${intelligence.providers.capacity.base-url:http://localhost:8092}")
    private String capacityUrl;

    @Value("${intelligence.baseline.reference-price:#{null}}")
    private BigDecimal baselineReferencePrice;

    @Value("${intelligence.baseline.competitor-avg-price:#{null}}")
    private BigDecimal baselineCompetitorAvgPrice;

    @Value("${intelligence.baseline.share-percent:#{null}}")
    private BigDecimal baselineSharePercent;

    @Value("#{${intelligence.baseline.subject-reference-prices:{:}}}")
    private Map<String, String> subjectReferencePrices;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public TtlCacheStore<CompetitivePosition> positionCache(Clock clock) {
        return new TtlCacheStore<>(clock, defaultTtl, sweepInterval);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public TtlCacheStore<CompetitiveTrends> trendCache(Clock clock) {
        return new TtlCacheStore<>(clock, defaultTtl, sweepInterval);
    }

    @Bean
    public SingleFlightCoordinator singleFlightCoordinator() {
        return new SingleFlightCoordinator();
    }

    @Bean
    public CacheKeyDeriver cacheKeyDeriver() {
        return new CacheKeyDeriver();
    }

    @Bean
    public BaselineDefaults baselineDefaults() {
        Map<String, BigDecimal> perSubject = new HashMap<>();
        subjectReferencePrices.forEach((subject, price) -> perSubject.put(subject, new BigDecimal(price)));
        return new BaselineDefaults(baselineReferencePrice, baselineCompetitorAvgPrice,
            baselineSharePercent, perSubject);
    }

    // ── observation sources ─────────────────────────────────────────────────

    @Bean
    public PricingObservationSource pricingObservationSource(WebClient.Builder builder) {
        return new HttpPricingObservationSource(observationClient(builder, pricingUrl));
    }

    @Bean
    public CapacityObservationSource capacityObservationSource(WebClient.Builder builder) {
        return new HttpCapacityObservationSource(observationClient(builder, capacityUrl));
    }

    // ── pipeline ────────────────────────────────────────────────────────────

    @Bean
    public FallbackCascade fallbackCascade(PricingObservationSource pricing,
                                           CapacityObservationSource capacity,
                                           BaselineDefaults baselineDefaults) {
        return new FallbackCascade(pricing, capacity, baselineDefaults, providerTimeout);
    }

    @Bean
    public CompetitivePositionService competitivePositionService(TtlCacheStore<CompetitivePosition> positionCache,
                                                                 SingleFlightCoordinator singleFlightCoordinator,
                                                                 FallbackCascade fallbackCascade,
                                                                 CacheKeyDeriver cacheKeyDeriver,
                                                                 Clock clock) {
        return new CompetitivePositionService(positionCache, singleFlightCoordinator, fallbackCascade,
            cacheKeyDeriver, clock, positionTtl, computeTimeout, maxWindowDays);
    }

    @Bean
    public CompetitiveTrendsService competitiveTrendsService(TtlCacheStore<CompetitiveTrends> trendCache,
                                                             SingleFlightCoordinator singleFlightCoordinator,
                                                             PricingObservationSource pricing,
                                                             CacheKeyDeriver cacheKeyDeriver,
                                                             Clock clock) {
        return new CompetitiveTrendsService(trendCache, singleFlightCoordinator, pricing,
            cacheKeyDeriver, clock, trendsTtl, providerTimeout, maxWindowDays);
    }

    private WebClient observationClient(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) providerTimeout.toMillis())
            .responseTimeout(providerTimeout);

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
