package com.stockanalysis.option;

import com.stockanalysis.domain.enums.OptionType;
import java.util.OptionalDouble;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Backs implied volatility out of an option's market price with Black-Scholes.
 *
 * <p>Newton-Raphson on vega first; deep ITM/OTM contracts where vega collapses fall back to
 * bisection over [0.1%, 500%]. Results outside [1%, 200%] are clamped. A price outside the
 * model's achievable range yields an empty result.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class ImpliedVolatilitySolver {

    private static final Logger log = LoggerFactory.getLogger(ImpliedVolatilitySolver.class);

    private static final double INITIAL_GUESS = 0.25;
    private static final double TOLERANCE = 1e-4;
    private static final int NEWTON_MAX_ITERATIONS = 100;
    private static final int BISECTION_MAX_ITERATIONS = 200;
    private static final double SIGMA_FLOOR = 0.001;
    private static final double SIGMA_CEILING = 5.0;
    static final double IV_MIN = 0.01;
    static final double IV_MAX = 2.0;

    private static final NormalDistribution NORMAL = new NormalDistribution();

    private final OptionAnalysisConfig optionAnalysisConfig;

    public ImpliedVolatilitySolver(OptionAnalysisConfig optionAnalysisConfig) {
        this.optionAnalysisConfig = optionAnalysisConfig;
    }

    /**
     * @param spot underlying price
     * @param strike strike price
     * @param yearsToExpiry time to expiry in years, must be positive
     * @param premium observed option price
     * @return implied volatility in percent (18.5 means 18.5%), or empty when unsolvable
     */
    public OptionalDouble impliedVolatilityPercent(
            double spot, double strike, double yearsToExpiry, OptionType optionType, double premium) {
        if (premium <= 0 || spot <= 0 || strike <= 0 || yearsToExpiry <= 0) {
            return OptionalDouble.empty();
        }
        boolean call = optionType == OptionType.CE;
        double rate = optionAnalysisConfig.getRiskFreeRate();
        double yield = optionAnalysisConfig.getDividendYield();

        double sigma = newton(spot, strike, yearsToExpiry, rate, yield, premium, call);
        if (Double.isNaN(sigma)) {
            sigma = bisection(spot, strike, yearsToExpiry, rate, yield, premium, call);
        }
        if (Double.isNaN(sigma)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(IV_MIN, Math.min(IV_MAX, sigma)) * 100);
    }

    double price(double spot, double strike, double years, double rate, double yield, double sigma, boolean call) {
        double sqrtT = Math.sqrt(years);
        double d1 = (Math.log(spot / strike) + (rate - yield + sigma * sigma / 2.0) * years) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;
        if (call) {
            return spot * Math.exp(-yield * years) * NORMAL.cumulativeProbability(d1)
                    - strike * Math.exp(-rate * years) * NORMAL.cumulativeProbability(d2);
        }
        return strike * Math.exp(-rate * years) * NORMAL.cumulativeProbability(-d2)
                - spot * Math.exp(-yield * years) * NORMAL.cumulativeProbability(-d1);
    }

    private double newton(
            double spot, double strike, double years, double rate, double yield, double premium, boolean call) {
        double sigma = INITIAL_GUESS;
        for (int i = 0; i < NEWTON_MAX_ITERATIONS; i++) {
            double diff = price(spot, strike, years, rate, yield, sigma, call) - premium;
            if (Math.abs(diff) < TOLERANCE) {
                return sigma;
            }
            double sqrtT = Math.sqrt(years);
            double d1 = (Math.log(spot / strike) + (rate - yield + sigma * sigma / 2.0) * years) / (sigma * sqrtT);
            double vega = spot * Math.exp(-yield * years) * NORMAL.density(d1) * sqrtT;
            if (Math.abs(vega) < 1e-10) {
                return Double.NaN;
            }
            sigma = Math.max(SIGMA_FLOOR, Math.min(SIGMA_CEILING, sigma - diff / vega));
        }
        return Double.NaN;
    }

    private double bisection(
            double spot, double strike, double years, double rate, double yield, double premium, boolean call) {
        double lower = SIGMA_FLOOR;
        double upper = SIGMA_CEILING;
        double lowerPrice = price(spot, strike, years, rate, yield, lower, call);
        double upperPrice = price(spot, strike, years, rate, yield, upper, call);
        if (premium < lowerPrice || premium > upperPrice) {
            log.debug("Premium {} outside model range [{}, {}] for strike {}", premium, lowerPrice, upperPrice, strike);
            return Double.NaN;
        }
        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = price(spot, strike, years, rate, yield, mid, call);
            if (Math.abs(midPrice - premium) < TOLERANCE) {
                return mid;
            }
            if (midPrice > premium) {
                upper = mid;
            } else {
                lower = mid;
            }
        }
        return (lower + upper) / 2.0;
    }
}
