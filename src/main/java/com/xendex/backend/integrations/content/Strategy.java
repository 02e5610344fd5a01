package com.xendex.backend.integrations.content;

import com.xendex.backend.enums.CallToAction;
import com.xendex.backend.enums.StrategyAngle;

/**
 * How a touch should be pitched.
 *
 * @param hook the concrete fact the opening line leans on, may be null
 */
public record Strategy(StrategyAngle angle, CallToAction cta, String tone, String hook) {
}
