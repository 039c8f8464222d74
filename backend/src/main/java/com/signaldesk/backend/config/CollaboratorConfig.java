package com.signaldesk.backend.config;

import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.trading.pipeline.IndicatorSnapshotProvider;
import com.signaldesk.backend.trading.pipeline.MarketContextProvider;
import com.signaldesk.backend.trading.pipeline.QualitativeAssessor;
import com.signaldesk.backend.trading.pipeline.TechnicalOnlyAssessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

/**
 * Stand-ins for the external collaborators. Market data and the qualitative service
 * live outside this service; a deployment overrides these beans with real adapters.
 */
@Slf4j
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public MarketContextProvider marketContextProvider(SignalDeskProperties properties) {
        return () -> MarketContext.of(properties.getMarket().getDefaultRegime());
    }

    @Bean
    @ConditionalOnMissingBean
    public IndicatorSnapshotProvider indicatorSnapshotProvider() {
        log.warn("⚠️ No market data adapter configured, signal generation will produce nothing");
        return symbol -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public QualitativeAssessor qualitativeAssessor() {
        return new TechnicalOnlyAssessor();
    }
}
