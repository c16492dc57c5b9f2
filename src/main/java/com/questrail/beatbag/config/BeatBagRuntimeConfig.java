package com.questrail.beatbag.config;

import com.questrail.beatbag.detect.ThresholdConfig;

import java.util.Objects;

/**
 * Aggregated configuration for the kick-sensor runtime.
 *
 * @param profile              sensor identifiers
 * @param thresholds           initial detector thresholds
 * @param serializeCallbacks   replay transport callbacks on a dedicated thread;
 *                             required when the transport dispatches on a pool
 */
public record BeatBagRuntimeConfig(
    SensorProfile profile,
    ThresholdConfig thresholds,
    boolean serializeCallbacks
) {
    public BeatBagRuntimeConfig {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(thresholds, "thresholds");
    }

    public static BeatBagRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SensorProfile profile = SensorProfile.wt901();
        private ThresholdConfig thresholds = ThresholdConfig.defaults();
        private boolean serializeCallbacks = false;

        public Builder withProfile(SensorProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder withThresholds(ThresholdConfig thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder withSerializedCallbacks(boolean serializeCallbacks) {
            this.serializeCallbacks = serializeCallbacks;
            return this;
        }

        public BeatBagRuntimeConfig build() {
            return new BeatBagRuntimeConfig(profile, thresholds, serializeCallbacks);
        }
    }
}
