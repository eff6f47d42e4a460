/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.config;

import java.time.Duration;

/**
 * Settings for the recommendation pipeline itself.
 *
 * @param parallelScoring
 *            score candidates on a parallel stream (output is identical either way)
 * @param recommendationTtl
 *            how long a generated recommendation stays valid
 */
public record PipelineSettings(boolean parallelScoring, Duration recommendationTtl) {

    public static PipelineSettings defaults() {
        return new PipelineSettings(false, Duration.ofDays(7));
    }
}
