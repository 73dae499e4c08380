package dev.smartrouter.config;

import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.domain.valueobject.TierThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Routing config. Size thresholds are billions of total parameters; the uncertain band is
 * closed on both ends. Re-read on every registry reload.
 */
@ConfigurationProperties(prefix = "smartrouter.routing")
public record RouterProperties(double smallMaxParams, double mediumMaxParams, double defaultParams,
                               Double uncertainLow, Double uncertainHigh,
                               String classifierModel, Duration classifierTimeout,
                               int classifierMaxChars, int classifierMaxTokens) {
    public RouterProperties {
        if (smallMaxParams <= 0) smallMaxParams = 10.0;
        if (mediumMaxParams <= 0) mediumMaxParams = 40.0;
        if (defaultParams <= 0) defaultParams = 20.0;
        if (uncertainLow == null) uncertainLow = ScoreBand.DEFAULT.low();
        if (uncertainHigh == null) uncertainHigh = ScoreBand.DEFAULT.high();
        if (classifierModel != null && classifierModel.isBlank()) classifierModel = null;
        if (classifierTimeout == null || classifierTimeout.isZero() || classifierTimeout.isNegative())
            classifierTimeout = Duration.ofSeconds(5);
        if (classifierMaxChars <= 0) classifierMaxChars = 2000;
        if (classifierMaxTokens <= 0) classifierMaxTokens = 16;
    }

    public static RouterProperties defaults() {
        return new RouterProperties(0, 0, 0, null, null, null, null, 0, 0);
    }

    public TierThresholds thresholds() {
        return new TierThresholds(smallMaxParams, mediumMaxParams);
    }

    public ScoreBand band() {
        return new ScoreBand(uncertainLow, uncertainHigh);
    }
}
