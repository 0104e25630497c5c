package com.optionbot.data.market;

import com.optionbot.data.DataFetchException;
import com.optionbot.data.http.HttpClientEx;
import com.optionbot.model.OptionContract;
import com.optionbot.model.OptionKind;
import com.optionbot.model.Quote;
import com.optionbot.model.ScanFailureReason;
import com.optionbot.pricing.ExpiryCalendar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Spot quotes from the Yahoo chart endpoint and option chains from the v7 options endpoint.
 */
public class YahooMarketDataService implements MarketDataProvider {
    private static final Logger LOG = LogManager.getLogger(YahooMarketDataService.class);
    private static final String CHART_URL = "https://query1.finance.yahoo.com/v8/finance/chart/";
    private static final String OPTIONS_URL = "https://query2.finance.yahoo.com/v7/finance/options/";

    private final HttpClientEx http;
    private final int timeoutSec;

    public YahooMarketDataService(HttpClientEx http, int timeoutSec) {
        this.http = http;
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    @Override
    public Quote getQuote(String ticker) throws DataFetchException {
        String url = CHART_URL + encode(ticker) + "?range=1d&interval=1d";
        try {
            return parseChartQuote(ticker, http.getText(url, timeoutSec));
        } catch (IOException | InterruptedException | RuntimeException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw DataFetchException.classify("quote fetch for " + ticker, e, ScanFailureReason.QUOTE_UNAVAILABLE);
        }
    }

    @Override
    public List<OptionContract> getOptionChain(String ticker, int maxExpirations, Instant valuationInstant)
            throws DataFetchException {
        String base = OPTIONS_URL + encode(ticker);
        try {
            JSONObject first = chainResult(ticker, http.getText(base, timeoutSec));
            LocalDate today = valuationInstant.atZone(ExpiryCalendar.EXCHANGE_ZONE).toLocalDate();
            List<Long> expirations = selectExpirations(first.optJSONArray("expirationDates"), today, maxExpirations);

            List<OptionContract> out = new ArrayList<>();
            for (long epoch : expirations) {
                JSONObject page = first;
                if (firstPageExpiration(first) != epoch) {
                    page = chainResult(ticker, http.getText(base + "?date=" + epoch, timeoutSec));
                }
                out.addAll(parseOptionsPage(ticker, page));
            }
            LOG.debug("chain {} expirations={} contracts={}", ticker, expirations.size(), out.size());
            return out;
        } catch (IOException | InterruptedException | RuntimeException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw DataFetchException.classify("option chain fetch for " + ticker, e, ScanFailureReason.CHAIN_UNAVAILABLE);
        }
    }

    static Quote parseChartQuote(String ticker, String body) throws DataFetchException {
        JSONObject root = new JSONObject(body);
        JSONObject chart = root.optJSONObject("chart");
        JSONArray result = chart == null ? null : chart.optJSONArray("result");
        JSONObject r0 = result == null || result.length() == 0 ? null : result.optJSONObject(0);
        JSONObject meta = r0 == null ? null : r0.optJSONObject("meta");
        if (meta == null) {
            throw new DataFetchException(ScanFailureReason.QUOTE_UNAVAILABLE, "no chart data for " + ticker);
        }
        double price = meta.optDouble("regularMarketPrice", Double.NaN);
        long time = meta.optLong("regularMarketTime", 0L);
        if (!Double.isFinite(price) || price <= 0.0) {
            throw new DataFetchException(ScanFailureReason.QUOTE_UNAVAILABLE, "no usable spot price for " + ticker);
        }
        Instant observed = time > 0L ? Instant.ofEpochSecond(time) : Instant.now();
        return new Quote(ticker, price, observed);
    }

    static JSONObject chainResult(String ticker, String body) throws DataFetchException {
        JSONObject root = new JSONObject(body);
        JSONObject chain = root.optJSONObject("optionChain");
        if (chain == null) {
            throw new DataFetchException(ScanFailureReason.PARSE_ERROR, "missing optionChain for " + ticker);
        }
        JSONArray result = chain.optJSONArray("result");
        if (result == null || result.length() == 0 || result.optJSONObject(0) == null) {
            throw new DataFetchException(ScanFailureReason.CHAIN_UNAVAILABLE, "empty optionChain for " + ticker);
        }
        return result.getJSONObject(0);
    }

    static List<Long> selectExpirations(JSONArray epochs, LocalDate today, int maxExpirations) {
        List<Long> out = new ArrayList<>();
        if (epochs == null) {
            return out;
        }
        for (int i = 0; i < epochs.length() && out.size() < Math.max(1, maxExpirations); i++) {
            long epoch = epochs.optLong(i, 0L);
            if (epoch <= 0L) {
                continue;
            }
            if (!toExpiryDate(epoch).isBefore(today)) {
                out.add(epoch);
            }
        }
        return out;
    }

    private static long firstPageExpiration(JSONObject result) {
        JSONArray options = result.optJSONArray("options");
        JSONObject o0 = options == null || options.length() == 0 ? null : options.optJSONObject(0);
        return o0 == null ? -1L : o0.optLong("expirationDate", -1L);
    }

    static List<OptionContract> parseOptionsPage(String ticker, JSONObject result) {
        List<OptionContract> out = new ArrayList<>();
        JSONArray options = result.optJSONArray("options");
        if (options == null) {
            return out;
        }
        for (int i = 0; i < options.length(); i++) {
            JSONObject page = options.optJSONObject(i);
            if (page == null) {
                continue;
            }
            addContracts(out, ticker, OptionKind.CALL, page.optJSONArray("calls"));
            addContracts(out, ticker, OptionKind.PUT, page.optJSONArray("puts"));
        }
        return out;
    }

    private static void addContracts(List<OptionContract> out, String ticker, OptionKind kind, JSONArray rows) {
        if (rows == null) {
            return;
        }
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row == null) {
                continue;
            }
            long expiration = row.optLong("expiration", 0L);
            if (expiration <= 0L) {
                continue;
            }
            out.add(OptionContract.builder()
                    .ticker(ticker)
                    .kind(kind)
                    .strike(row.optDouble("strike", Double.NaN))
                    .expiration(toExpiryDate(expiration))
                    .contractSymbol(row.optString("contractSymbol", ""))
                    .lastPrice(row.optDouble("lastPrice", Double.NaN))
                    .bid(row.optDouble("bid", 0.0))
                    .ask(row.optDouble("ask", 0.0))
                    .impliedVolatility(row.optDouble("impliedVolatility", Double.NaN))
                    .openInterest(nonNegative(row, "openInterest"))
                    .volume(nonNegative(row, "volume"))
                    .build());
        }
    }

    private static long nonNegative(JSONObject row, String key) {
        return Math.max(0L, row.optLong(key, 0L));
    }

    /**
     * Yahoo stamps expirations at 00:00 UTC of the expiry date.
     */
    static LocalDate toExpiryDate(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atZone(ZoneOffset.UTC).toLocalDate();
    }

    private static String encode(String ticker) {
        return URLEncoder.encode(ticker, StandardCharsets.UTF_8);
    }
}
