package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.AssetClass;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * Draws one annual return per call: normal with the asset's median and standard deviation,
 * clamped into [minReturn, maxReturn]. Exactly one gaussian is consumed per call, also when
 * the standard deviation is zero, so draw order stays aligned across asset classes.
 */
@Component
public class ReturnSampler {

    public double sample(AssetClass asset, RandomGenerator rng) {
        return sample(asset.getMedianReturn(), asset.getStdDeviation(),
                asset.getMinReturn(), asset.getMaxReturn(), rng);
    }

    public double sample(double medianReturn, double stdDeviation,
                         double minReturn, double maxReturn, RandomGenerator rng) {
        double draw = medianReturn + stdDeviation * rng.nextGaussian();
        return Math.max(minReturn, Math.min(maxReturn, draw));
    }
}
