package com.stockanalysis.option;

import com.stockanalysis.domain.enums.Direction;
import com.stockanalysis.domain.enums.OptionType;
import com.stockanalysis.domain.enums.StrikeType;
import com.stockanalysis.domain.model.OptionAnalysis;
import com.stockanalysis.domain.model.OptionChainSnapshot;
import com.stockanalysis.domain.model.OptionContract;
import com.stockanalysis.domain.model.StrikeRecommendation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives IV percentile, max pain, open interest structure and a recommended strike from
 * an option chain snapshot.
 *
 * <p>Pure functions over immutable snapshots. Max pain uses exact {@link BigDecimal}
 * sums over a sorted strike set, so the answer does not depend on the order contracts
 * arrive in. Chains that are empty or carry a single expiry still produce an analysis,
 * flagged as reduced confidence.
 */
@Service
public class OptionChainAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(OptionChainAnalyzer.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final OptionAnalysisConfig optionAnalysisConfig;

    public OptionChainAnalyzer(OptionAnalysisConfig optionAnalysisConfig) {
        this.optionAnalysisConfig = optionAnalysisConfig;
    }

    /**
     * @param currentPrice underlying price to measure against; falls back to the snapshot's
     *     spot price when null
     */
    public OptionAnalysis analyze(OptionChainSnapshot chain, BigDecimal currentPrice) {
        BigDecimal spot = currentPrice != null ? currentPrice : chain.getSpotPrice();
        OptionAnalysis.OptionAnalysisBuilder builder = OptionAnalysis.builder()
                .symbol(chain.getSymbol())
                .spotPrice(spot)
                .contractCount(chain.getContracts().size());

        if (chain.isEmpty()) {
            return builder.reducedConfidence(true).reason("empty option chain").build();
        }

        List<LocalDate> expiries = chain.expiries();
        LocalDate front = expiries.get(0);
        List<OptionContract> frontContracts = chain.contractsExpiring(front);
        builder.frontExpiry(front).expiryCount(expiries.size());
        boolean reduced = false;
        if (expiries.size() == 1) {
            builder.reason("single expiry");
            reduced = true;
        }

        if (spot != null) {
            BigDecimal atmStrike = nearestStrike(strikesOf(frontContracts), spot);
            builder.atmStrike(atmStrike);
            Double atmIv = meanIv(frontContracts.stream()
                    .filter(c -> c.getStrike().compareTo(atmStrike) == 0)
                    .collect(Collectors.toList()));
            List<Double> distribution = chain.getContracts().stream()
                    .map(OptionContract::getImpliedVolatility)
                    .filter(OptionChainAnalyzer::isValidIv)
                    .collect(Collectors.toList());
            if (atmIv == null || distribution.isEmpty()) {
                builder.reason("no implied volatility data");
                reduced = true;
            } else {
                builder.atmIv(atmIv).ivPercentile(ivPercentile(atmIv, distribution));
            }
        } else {
            builder.reason("no underlying price");
            reduced = true;
        }

        builder.maxPain(maxPain(frontContracts, spot));
        reduced |= analyzeOpenInterest(frontContracts, builder);

        OptionAnalysis analysis = builder.reducedConfidence(reduced).build();
        log.debug(
                "Option analysis for {}: atm={}, ivPct={}, maxPain={}, pcr={}, reasons={}",
                chain.getSymbol(),
                analysis.getAtmStrike(),
                analysis.getIvPercentile(),
                analysis.getMaxPain(),
                analysis.getPutCallOiRatio(),
                analysis.getReasons());
        return analysis;
    }

    /**
     * Strike at which option writers pay out least at expiry.
     *
     * <p>For each candidate strike K: sum of {@code max(0, K - strike) * OI} over calls plus
     * {@code max(0, strike - K) * OI} over puts. Ties go to the strike nearest
     * {@code currentPrice}, then to the lower strike.
     *
     * @return null for an empty contract list
     */
    public BigDecimal maxPain(Collection<OptionContract> contracts, BigDecimal currentPrice) {
        TreeSet<BigDecimal> candidates = strikesOf(contracts);
        BigDecimal best = null;
        BigDecimal bestPayout = null;
        for (BigDecimal candidate : candidates) {
            BigDecimal payout = BigDecimal.ZERO;
            for (OptionContract contract : contracts) {
                BigDecimal oi = BigDecimal.valueOf(contract.getOpenInterest());
                BigDecimal intrinsic = intrinsic(contract.getOptionType(), candidate, contract.getStrike());
                payout = payout.add(intrinsic.multiply(oi));
            }
            if (best == null || isBetterPain(payout, candidate, bestPayout, best, currentPrice)) {
                best = candidate;
                bestPayout = payout;
            }
        }
        return best;
    }

    /**
     * Percentile rank of {@code value} in {@code distribution}, counting equal values as half.
     * A single-value distribution always ranks 50.
     */
    public double ivPercentile(double value, List<Double> distribution) {
        long below = distribution.stream().filter(v -> v < value).count();
        long equal = distribution.stream().filter(v -> v == value).count();
        return (below + 0.5 * equal) * 100.0 / distribution.size();
    }

    /**
     * Picks the front-expiry contract nearest the target price with enough open interest.
     * Bullish calls take CE, bearish calls PE, neutral either. When no strike meets
     * {@code minOpenInterest}, the nearest strike is returned with {@code liquid=false}.
     */
    public Optional<StrikeRecommendation> recommendStrike(
            OptionChainSnapshot chain,
            BigDecimal currentPrice,
            BigDecimal targetPrice,
            BigDecimal stopLoss,
            Direction direction) {
        if (chain == null || chain.isEmpty() || currentPrice == null) {
            return Optional.empty();
        }
        LocalDate front = chain.expiries().get(0);
        List<OptionContract> candidates = chain.contractsExpiring(front).stream()
                .filter(c -> direction == Direction.NEUTRAL || c.getOptionType() == optionTypeFor(direction))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal target = targetPrice != null ? targetPrice : currentPrice;
        Comparator<OptionContract> nearestToTarget = Comparator.<OptionContract, BigDecimal>comparing(
                        c -> c.getStrike().subtract(target).abs())
                .thenComparing(OptionContract::getStrike)
                .thenComparing(OptionContract::getOptionType);

        Optional<OptionContract> liquid = candidates.stream()
                .filter(c -> c.getOpenInterest() >= optionAnalysisConfig.getMinOpenInterest())
                .min(nearestToTarget);
        OptionContract chosen = liquid.orElseGet(() -> candidates.stream().min(nearestToTarget).orElseThrow());
        BigDecimal atmStrike = nearestStrike(strikesOf(chain.contractsExpiring(front)), currentPrice);

        BigDecimal currentPremium = currentPremium(chosen, currentPrice);
        BigDecimal stop = stopLoss != null ? stopLoss : currentPrice;
        return Optional.of(StrikeRecommendation.builder()
                .tradingSymbol(chosen.getTradingSymbol())
                .strike(chosen.getStrike())
                .expiry(chosen.getExpiry())
                .optionType(chosen.getOptionType())
                .strikeType(strikeType(chosen, currentPrice, atmStrike))
                .openInterest(chosen.getOpenInterest())
                .liquid(liquid.isPresent())
                .currentPremium(currentPremium)
                .targetPremium(estimatedPremium(chosen, target))
                .stopPremium(stopPremium(chosen, stop, currentPremium))
                .build());
    }

    StrikeType strikeType(OptionContract contract, BigDecimal spot, BigDecimal atmStrike) {
        int vsSpot = contract.getStrike().compareTo(spot);
        if (contract.getStrike().compareTo(atmStrike) == 0 || vsSpot == 0) {
            return StrikeType.ATM;
        }
        boolean belowSpot = vsSpot < 0;
        if (contract.getOptionType() == OptionType.CE) {
            return belowSpot ? StrikeType.ITM : StrikeType.OTM;
        }
        return belowSpot ? StrikeType.OTM : StrikeType.ITM;
    }

    private boolean analyzeOpenInterest(List<OptionContract> frontContracts, OptionAnalysis.OptionAnalysisBuilder builder) {
        Map<BigDecimal, Long> callOi = oiByStrike(frontContracts, OptionType.CE);
        Map<BigDecimal, Long> putOi = oiByStrike(frontContracts, OptionType.PE);
        long totalCall = callOi.values().stream().mapToLong(Long::longValue).sum();
        long totalPut = putOi.values().stream().mapToLong(Long::longValue).sum();
        if (totalCall + totalPut == 0) {
            builder.reason("no open interest");
            return true;
        }

        builder.maxCallOiStrike(argMax(callOi)).maxPutOiStrike(argMax(putOi));
        if (totalCall > 0) {
            builder.putCallOiRatio((double) totalPut / totalCall);
        }

        Map<BigDecimal, Long> combined = new TreeMap<>(callOi);
        putOi.forEach((strike, oi) -> combined.merge(strike, oi, Long::sum));
        double mean = (double) (totalCall + totalPut) / combined.size();
        double threshold = mean * optionAnalysisConfig.getHighOiMultiple();
        combined.forEach((strike, oi) -> {
            if (oi > threshold) {
                builder.highOiStrike(strike);
            }
        });
        return false;
    }

    private static Map<BigDecimal, Long> oiByStrike(List<OptionContract> contracts, OptionType type) {
        Map<BigDecimal, Long> byStrike = new TreeMap<>();
        for (OptionContract contract : contracts) {
            if (contract.getOptionType() == type) {
                byStrike.merge(contract.getStrike(), contract.getOpenInterest(), Long::sum);
            }
        }
        return byStrike;
    }

    /** Strike with the highest OI; lowest strike wins a tie. Null when nothing has OI. */
    private static BigDecimal argMax(Map<BigDecimal, Long> oiByStrike) {
        BigDecimal best = null;
        long bestOi = 0;
        for (Map.Entry<BigDecimal, Long> entry : oiByStrike.entrySet()) {
            if (entry.getValue() > bestOi) {
                best = entry.getKey();
                bestOi = entry.getValue();
            }
        }
        return best;
    }

    private static boolean isBetterPain(
            BigDecimal payout, BigDecimal strike, BigDecimal bestPayout, BigDecimal bestStrike, BigDecimal price) {
        int byPayout = payout.compareTo(bestPayout);
        if (byPayout != 0) {
            return byPayout < 0;
        }
        if (price != null) {
            int byDistance = strike.subtract(price).abs().compareTo(bestStrike.subtract(price).abs());
            if (byDistance != 0) {
                return byDistance < 0;
            }
        }
        return strike.compareTo(bestStrike) < 0;
    }

    /** Value of one option at expiry with the underlying at {@code underlying}. */
    private static BigDecimal intrinsic(OptionType type, BigDecimal underlying, BigDecimal strike) {
        BigDecimal value = type == OptionType.CE ? underlying.subtract(strike) : strike.subtract(underlying);
        return value.max(BigDecimal.ZERO);
    }

    private BigDecimal currentPremium(OptionContract contract, BigDecimal currentPrice) {
        if (contract.getLastPrice() != null && contract.getLastPrice().signum() > 0) {
            return contract.getLastPrice();
        }
        BigDecimal extrinsic = currentPrice.multiply(BigDecimal.valueOf(optionAnalysisConfig.getFallbackExtrinsicPct()))
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return intrinsic(contract.getOptionType(), currentPrice, contract.getStrike()).add(extrinsic)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private BigDecimal estimatedPremium(OptionContract contract, BigDecimal underlying) {
        BigDecimal extrinsic = underlying.multiply(BigDecimal.valueOf(optionAnalysisConfig.getTargetExtrinsicPct()))
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return intrinsic(contract.getOptionType(), underlying, contract.getStrike()).add(extrinsic)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private BigDecimal stopPremium(OptionContract contract, BigDecimal stop, BigDecimal currentPremium) {
        BigDecimal floor = currentPremium.multiply(BigDecimal.valueOf(optionAnalysisConfig.getStopPremiumFloorPct()))
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return estimatedPremium(contract, stop).max(floor).min(currentPremium);
    }

    private static OptionType optionTypeFor(Direction direction) {
        return direction == Direction.BEARISH ? OptionType.PE : OptionType.CE;
    }

    private static TreeSet<BigDecimal> strikesOf(Collection<OptionContract> contracts) {
        TreeSet<BigDecimal> strikes = new TreeSet<>();
        contracts.forEach(c -> strikes.add(c.getStrike()));
        return strikes;
    }

    /** Strike closest to {@code price}; the lower one on a tie. Input is iterated in ascending order. */
    private static BigDecimal nearestStrike(TreeSet<BigDecimal> strikes, BigDecimal price) {
        BigDecimal nearest = null;
        BigDecimal nearestDiff = null;
        for (BigDecimal strike : strikes) {
            BigDecimal diff = strike.subtract(price).abs();
            if (nearestDiff == null || diff.compareTo(nearestDiff) < 0) {
                nearest = strike;
                nearestDiff = diff;
            }
        }
        return nearest;
    }

    private static Double meanIv(List<OptionContract> contracts) {
        OptionalDouble mean = contracts.stream()
                .map(OptionContract::getImpliedVolatility)
                .filter(OptionChainAnalyzer::isValidIv)
                .mapToDouble(Double::doubleValue)
                .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }

    private static boolean isValidIv(Double iv) {
        return iv != null && iv > 0 && Double.isFinite(iv);
    }
}
