package com.signaldesk.backend.config;

import com.signaldesk.backend.model.MarketRegime;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "signal-desk")
@Data
@Validated
public class SignalDeskProperties {

    private List<String> symbols = List.of("BTC", "ETH", "SOL", "LINK", "OP", "ADA", "DOT", "AVAX", "UNI");
    private Market market = new Market();
    private Indicators indicators = new Indicators();
    private Capital capital = new Capital();
    private Quality quality = new Quality();
    private Approval approval = new Approval();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Market {
        @NotNull
        private MarketRegime defaultRegime = MarketRegime.NEUTRAL;
    }

    @Data
    public static class Indicators {
        private double rsiOversold = 30.0;
        private double rsiOverbought = 70.0;

        @Positive
        private double volumeSpikeFactor = 1.5;

        @Positive
        private double minTotalWeight = 60.0;
    }

    @Data
    public static class Capital {
        @Positive
        private double total = 1000.0;

        // percent of total capital
        @DecimalMin("0.1")
        @DecimalMax("5.0")
        private double riskPerTradePercent = 1.5;

        @Positive
        private double minTradeAmount = 10.0;

        @Positive
        private double maxTradeAmount = 50.0;

        @Positive
        private double stopLossPercent = 3.0;

        @Positive
        private double takeProfitPercent = 5.0;
    }

    @Data
    public static class Quality {
        @DecimalMin("0")
        @DecimalMax("100")
        private double minConfidence = 70.0;

        @Positive
        private double minRiskReward = 1.5;

        @Positive
        private double maxLossFractionOfMaxTrade = 0.5;

        @DecimalMin("0")
        @DecimalMax("100")
        private double counterTrendMinConfidence = 75.0;

        @Min(0)
        private long minSignalGapMinutes = 15;
    }

    @Data
    public static class Approval {
        private boolean manualApproval = false;

        // one day at most, like any single delay
        @Positive
        @Max(86_400_000L)
        private long timeoutMs = 300_000L;

        @Positive
        @Max(1440)
        private long defaultDelayMinutes = 5;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;

        @Positive
        private long intervalSeconds = 300;
    }
}
