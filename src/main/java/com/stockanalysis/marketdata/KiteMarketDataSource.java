package com.stockanalysis.marketdata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.stockanalysis.calendar.MarketHoursConfig;
import com.stockanalysis.domain.enums.EndpointClass;
import com.stockanalysis.domain.enums.OptionType;
import com.stockanalysis.domain.model.Candle;
import com.stockanalysis.domain.model.HistoricalRange;
import com.stockanalysis.domain.model.LiveQuote;
import com.stockanalysis.domain.model.OhlcvSeries;
import com.stockanalysis.domain.model.OptionChainSnapshot;
import com.stockanalysis.domain.model.OptionContract;
import com.stockanalysis.exception.MarketDataException;
import com.stockanalysis.exception.RateLimitException;
import com.stockanalysis.option.ImpliedVolatilitySolver;
import com.stockanalysis.option.OptionAnalysisConfig;
import com.stockanalysis.quota.QuotaDecision;
import com.stockanalysis.quota.QuotaTracker;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.HistoricalData;
import com.zerodhatech.models.Instrument;
import com.zerodhatech.models.Quote;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MarketDataSource} backed by the Kite Connect REST API.
 *
 * <p>Instrument dumps (one per exchange) are large and change once a day, so they are
 * cached in Caffeine for 12 hours. Everything else is fetched fresh on every call.
 *
 * <p>Option chains are assembled from the NFO instrument dump: the CE/PE contracts of the
 * underlying on its nearest {@code analysis.options.expiries} expiries, priced with one
 * quote call per 500 instruments. Kite does not publish implied volatility, so it is solved
 * from each contract's last price.
 *
 * <p>The scheduler reserves one call per request. Any further upstream call a request
 * makes (an instrument download, or quote batches past the first) is reserved here against
 * the {@link QuotaTracker}; when the budget is spent the request fails with a
 * {@link RateLimitException} carrying the wait, and the scheduler retries it later.
 */
@Component
public class KiteMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataSource.class);

    /** Kite's getQuote() accepts at most 500 instruments per call. */
    static final int QUOTE_BATCH_SIZE = 500;

    private static final String EQUITY_EXCHANGE = "NSE";
    private static final String DERIVATIVES_EXCHANGE = "NFO";
    private static final DateTimeFormatter KITE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");
    private static final LocalTime EXPIRY_TIME = LocalTime.of(15, 30);
    private static final double DAYS_PER_YEAR = 365.0;

    private final KiteConnect kiteConnect;
    private final ImpliedVolatilitySolver impliedVolatilitySolver;
    private final OptionAnalysisConfig optionAnalysisConfig;
    private final QuotaTracker quotaTracker;
    private final Clock clock;
    private final ZoneId exchangeZone;

    /** Key = exchange, value = that exchange's instrument dump. */
    private final Cache<String, List<Instrument>> instrumentCache;

    public KiteMarketDataSource(
            KiteConnect kiteConnect,
            ImpliedVolatilitySolver impliedVolatilitySolver,
            OptionAnalysisConfig optionAnalysisConfig,
            MarketHoursConfig marketHoursConfig,
            QuotaTracker quotaTracker,
            Clock clock) {
        this.kiteConnect = kiteConnect;
        this.impliedVolatilitySolver = impliedVolatilitySolver;
        this.optionAnalysisConfig = optionAnalysisConfig;
        this.quotaTracker = quotaTracker;
        this.clock = clock;
        this.exchangeZone = ZoneId.of(marketHoursConfig.getTimezone());
        this.instrumentCache = Caffeine.newBuilder()
                .expireAfterWrite(12, TimeUnit.HOURS)
                .maximumSize(4)
                .build();
    }

    @Override
    public OhlcvSeries fetchHistorical(String symbol, HistoricalRange range) {
        Instrument instrument = findEquity(symbol);
        Date from = Date.from(range.getFrom().atStartOfDay(exchangeZone).toInstant());
        Date to = Date.from(range.getTo().atTime(LocalTime.MAX).atZone(exchangeZone).toInstant());

        HistoricalData data;
        try {
            data = kiteConnect.getHistoricalData(
                    from, to, String.valueOf(instrument.instrument_token), range.getInterval(), false, false);
        } catch (KiteException e) {
            throw translate(e, "historical data for " + symbol);
        } catch (Exception e) {
            throw new MarketDataException("Failed to fetch historical data for " + symbol + ": " + e.getMessage(), e);
        }

        // Kite occasionally repeats the last bar; keep one candle per timestamp in order
        TreeMap<LocalDateTime, Candle> candles = new TreeMap<>();
        if (data != null && data.dataArrayList != null) {
            for (HistoricalData bar : data.dataArrayList) {
                Candle candle = toCandle(bar);
                if (candle != null) {
                    candles.put(candle.getTimestamp(), candle);
                }
            }
        }
        log.debug("Fetched {} {} candles for {}", candles.size(), range.getInterval(), symbol);
        return OhlcvSeries.of(symbol, range.getInterval(), new ArrayList<>(candles.values()));
    }

    @Override
    public LiveQuote fetchQuote(String symbol) {
        String key = EQUITY_EXCHANGE + ":" + symbol;
        Quote quote = fetchQuoteBatch(new String[] {key}, "quote for " + symbol).get(key);
        if (quote == null) {
            throw new MarketDataException("No quote returned for " + key);
        }
        return LiveQuote.builder()
                .symbol(symbol)
                .lastPrice(BigDecimal.valueOf(quote.lastPrice))
                .previousClose(quote.ohlc != null ? BigDecimal.valueOf(quote.ohlc.close) : null)
                .volume((long) quote.volumeTradedToday)
                .timestamp(LocalDateTime.now(clock.withZone(exchangeZone)))
                .build();
    }

    @Override
    public OptionChainSnapshot fetchOptionChain(String symbol) {
        LocalDateTime capturedAt = LocalDateTime.now(clock.withZone(exchangeZone));
        LocalDate today = capturedAt.toLocalDate();

        List<Instrument> options = instruments(DERIVATIVES_EXCHANGE).stream()
                .filter(i -> symbol.equals(i.name))
                .filter(i -> "CE".equals(i.instrument_type) || "PE".equals(i.instrument_type))
                .filter(i -> i.expiry != null && !toLocalDate(i.expiry).isBefore(today))
                .collect(Collectors.toList());
        if (options.isEmpty()) {
            log.info("No listed options for {}", symbol);
            return OptionChainSnapshot.empty(symbol, capturedAt);
        }

        Set<LocalDate> expiries = options.stream()
                .map(i -> toLocalDate(i.expiry))
                .distinct()
                .sorted()
                .limit(optionAnalysisConfig.getExpiries())
                .collect(Collectors.toSet());
        List<Instrument> selected =
                options.stream().filter(i -> expiries.contains(toLocalDate(i.expiry))).collect(Collectors.toList());

        String spotKey = EQUITY_EXCHANGE + ":" + symbol;
        List<String> keys = new ArrayList<>();
        keys.add(spotKey);
        selected.forEach(i -> keys.add(DERIVATIVES_EXCHANGE + ":" + i.tradingsymbol));
        Map<String, Quote> quotes = fetchQuotes(keys.toArray(new String[0]), "option chain for " + symbol);

        Quote spotQuote = quotes.get(spotKey);
        BigDecimal spot = spotQuote != null ? BigDecimal.valueOf(spotQuote.lastPrice) : null;

        OptionChainSnapshot.OptionChainSnapshotBuilder snapshot =
                OptionChainSnapshot.builder().symbol(symbol).spotPrice(spot).capturedAt(capturedAt);
        for (Instrument instrument : selected) {
            BigDecimal strike = parseStrike(instrument.strike);
            if (strike == null) {
                continue;
            }
            Quote quote = quotes.get(DERIVATIVES_EXCHANGE + ":" + instrument.tradingsymbol);
            snapshot.contract(toContract(instrument, strike, quote, spot, capturedAt));
        }
        OptionChainSnapshot chain = snapshot.build();
        log.debug("Built option chain for {}: {} contracts over {} expiries", symbol, chain.getContracts().size(), expiries.size());
        return chain;
    }

    private OptionContract toContract(
            Instrument instrument, BigDecimal strike, Quote quote, BigDecimal spot, LocalDateTime capturedAt) {
        OptionType type = OptionType.valueOf(instrument.instrument_type);
        LocalDate expiry = toLocalDate(instrument.expiry);
        OptionContract.OptionContractBuilder contract = OptionContract.builder()
                .tradingSymbol(instrument.tradingsymbol)
                .strike(strike)
                .expiry(expiry)
                .optionType(type);
        if (quote == null) {
            return contract.build();
        }
        contract.openInterest((long) quote.oi)
                .volume((long) quote.volumeTradedToday)
                .lastPrice(BigDecimal.valueOf(quote.lastPrice));
        if (spot != null && quote.lastPrice > 0) {
            double years = Duration.between(capturedAt, expiry.atTime(EXPIRY_TIME)).toMinutes() / (DAYS_PER_YEAR * 24 * 60);
            OptionalDouble iv = impliedVolatilitySolver.impliedVolatilityPercent(
                    spot.doubleValue(), strike.doubleValue(), years, type, quote.lastPrice);
            if (iv.isPresent()) {
                contract.impliedVolatility(iv.getAsDouble());
            }
        }
        return contract.build();
    }

    private Instrument findEquity(String symbol) {
        return instruments(EQUITY_EXCHANGE).stream()
                .filter(i -> symbol.equals(i.tradingsymbol))
                .findFirst()
                .orElseThrow(() -> new MarketDataException("Unknown NSE symbol: " + symbol));
    }

    private List<Instrument> instruments(String exchange) {
        List<Instrument> cached = instrumentCache.getIfPresent(exchange);
        if (cached != null) {
            return cached;
        }
        reserveExtraCall(EndpointClass.OTHER, exchange + " instruments");
        List<Instrument> downloaded;
        try {
            downloaded = kiteConnect.getInstruments(exchange);
        } catch (KiteException e) {
            throw translate(e, exchange + " instruments");
        } catch (Exception e) {
            throw new MarketDataException("Failed to download " + exchange + " instruments: " + e.getMessage(), e);
        }
        List<Instrument> instruments = downloaded != null ? List.copyOf(downloaded) : List.of();
        instrumentCache.put(exchange, instruments);
        log.info("Cached {} {} instruments", instruments.size(), exchange);
        return instruments;
    }

    private Map<String, Quote> fetchQuotes(String[] keys, String what) {
        if (keys.length <= QUOTE_BATCH_SIZE) {
            return fetchQuoteBatch(keys, what);
        }
        Map<String, Quote> all = new HashMap<>();
        for (int i = 0; i < keys.length; i += QUOTE_BATCH_SIZE) {
            if (i > 0) {
                reserveExtraCall(EndpointClass.OPTION_CHAIN, what);
            }
            String[] batch = Arrays.copyOfRange(keys, i, Math.min(i + QUOTE_BATCH_SIZE, keys.length));
            all.putAll(fetchQuoteBatch(batch, what));
        }
        return all;
    }

    private void reserveExtraCall(EndpointClass endpointClass, String what) {
        QuotaDecision decision = quotaTracker.reserve(endpointClass);
        if (decision.isAllowed()) {
            return;
        }
        Duration wait = decision.outcome() == QuotaDecision.Outcome.COOLING_DOWN
                ? Duration.between(quotaTracker.now(), decision.until())
                : decision.waitDuration();
        log.debug("No {} budget left for {}, retry in {}", endpointClass, what, wait);
        throw new RateLimitException("Quota exhausted for " + endpointClass + " fetching " + what, wait);
    }

    /** KiteException extends Throwable, not Exception, so it is caught on its own. */
    private Map<String, Quote> fetchQuoteBatch(String[] keys, String what) {
        try {
            Map<String, Quote> quotes = kiteConnect.getQuote(keys);
            return quotes != null ? quotes : Map.of();
        } catch (KiteException e) {
            throw translate(e, what);
        } catch (Exception e) {
            throw new MarketDataException("Failed to fetch " + what + ": " + e.getMessage(), e);
        }
    }

    /** HTTP 429 or a throttling message becomes a {@link RateLimitException}. */
    static MarketDataException translate(KiteException e, String what) {
        String message = e.message != null ? e.message : "";
        String lower = message.toLowerCase(Locale.ROOT);
        if (e.code == 429 || lower.contains("too many requests") || lower.contains("rate limit")) {
            return new RateLimitException("Rate limited fetching " + what + ": " + message);
        }
        return new MarketDataException("Kite error fetching " + what + " (code " + e.code + "): " + message);
    }

    private Candle toCandle(HistoricalData bar) {
        LocalDateTime timestamp = parseTimestamp(bar.timeStamp);
        if (timestamp == null) {
            return null;
        }
        return Candle.builder()
                .timestamp(timestamp)
                .open(BigDecimal.valueOf(bar.open))
                .high(BigDecimal.valueOf(bar.high))
                .low(BigDecimal.valueOf(bar.low))
                .close(BigDecimal.valueOf(bar.close))
                .volume(bar.volume)
                .build();
    }

    /** Kite timestamps look like {@code 2024-03-28T00:00:00+0530}. */
    private LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, KITE_TIMESTAMP)
                    .atZoneSameInstant(exchangeZone)
                    .toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Skipping candle with unparseable timestamp: {}", value);
            return null;
        }
    }

    private BigDecimal parseStrike(String strike) {
        if (strike == null || strike.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(strike);
        } catch (NumberFormatException e) {
            log.warn("Could not parse strike value: {}", strike);
            return null;
        }
    }

    private LocalDate toLocalDate(Date date) {
        return Objects.requireNonNull(date).toInstant().atZone(exchangeZone).toLocalDate();
    }
}
