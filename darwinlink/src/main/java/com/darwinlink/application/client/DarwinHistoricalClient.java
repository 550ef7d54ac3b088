package com.darwinlink.application.client;

import com.darwinlink.config.ClientConfig;
import com.darwinlink.domain.market.Candle;
import com.darwinlink.domain.market.Tick;
import com.darwinlink.domain.session.Session;
import com.darwinlink.infrastructure.connection.DarwinConnectionException;
import com.darwinlink.infrastructure.connection.Endpoint;
import com.darwinlink.infrastructure.connection.NotConnectedException;
import com.darwinlink.infrastructure.metrics.ConnectionMetrics;
import com.darwinlink.infrastructure.metrics.ConnectionMetricsSnapshot;
import com.darwinlink.infrastructure.metrics.PrometheusConnectionMetrics;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.CommandValidationException;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireFormatException;
import com.darwinlink.infrastructure.protocol.WireRecord;
import com.darwinlink.infrastructure.routing.RequestCancelledException;
import com.darwinlink.infrastructure.routing.RequestTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Candles and tick-by-tick data from the daemon's historical socket.
 *
 * Always live: there is no simulated market data.
 */
public class DarwinHistoricalClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DarwinHistoricalClient.class);

    public static final long DAILY_PERIOD_SECONDS = 86_400;

    private final ClientConfig config;
    private final DaemonSession daemon;

    public DarwinHistoricalClient(ClientConfig config) {
        this(config, new PrometheusConnectionMetrics());
    }

    public DarwinHistoricalClient(ClientConfig config, ConnectionMetrics metrics) {
        this.config = config;
        this.daemon = new DaemonSession(Endpoint.historical(config.host(), config.historicalPort()), config, metrics);
    }

    /**
     * Create and connect a client.
     *
     * @throws DarwinConnectionException if the socket cannot be opened
     */
    public static DarwinHistoricalClient open(ClientConfig config) {
        DarwinHistoricalClient client = new DarwinHistoricalClient(config);
        client.daemon.connect();
        return client;
    }

    public ApiResult<Session> connect() {
        try {
            daemon.connect();
            return ApiResult.ofSuccess(daemon.session());
        } catch (DarwinConnectionException e) {
            log.error("[historical] Connect failed: {}", e.getMessage());
            return ApiResult.ofFailure(e.getMessage(), ApiErrorCode.CONNECTION);
        }
    }

    public ApiResult<Session> disconnect() {
        daemon.disconnect();
        return ApiResult.ofSuccess(daemon.session());
    }

    @Override
    public void close() {
        daemon.disconnect();
    }

    public Session session() {
        return daemon.session();
    }

    public ConnectionMetricsSnapshot connectionMetrics() {
        return daemon.metrics();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CANDLES
    // ═══════════════════════════════════════════════════════════════════════

    public ApiResult<MarketSeries<Candle>> getDailyCandles(String symbol, int days) {
        return getIntradayCandles(symbol, days, DAILY_PERIOD_SECONDS);
    }

    /**
     * @param periodSeconds candle width, e.g. 60 for one-minute candles
     */
    public ApiResult<MarketSeries<Candle>> getIntradayCandles(String symbol, int days, long periodSeconds) {
        return series("candles " + symbol, symbol,
            () -> Command.candles(symbol, days, periodSeconds), RecordMapper::toCandle);
    }

    /**
     * Candles between two instants. The after-hours volume mode is sent
     * first and stays in force on this session until changed.
     */
    public ApiResult<MarketSeries<Candle>> getCandleRange(String symbol, LocalDateTime from, LocalDateTime to,
                                                          long periodSeconds, boolean includeAfterHours) {
        return series("candle range " + symbol, symbol, () -> {
            Command range = Command.candleRange(symbol, from, to, periodSeconds);
            List<WireRecord> ack = daemon.execute(Command.afterHours(includeAfterHours), config.requestTimeout());
            if (!ack.isEmpty() && ack.get(0).kind() == RecordKind.ERR) {
                log.warn("[historical] After-hours mode not accepted: {}", ack.get(0));
            }
            return range;
        }, RecordMapper::toCandle);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TICKS
    // ═══════════════════════════════════════════════════════════════════════

    public ApiResult<MarketSeries<Tick>> getTicks(String symbol, int days) {
        return series("ticks " + symbol, symbol, () -> Command.ticks(symbol, days), RecordMapper::toTick);
    }

    public ApiResult<MarketSeries<Tick>> getTickRange(String symbol, LocalDateTime from, LocalDateTime to) {
        return series("tick range " + symbol, symbol, () -> Command.tickRange(symbol, from, to), RecordMapper::toTick);
    }

    private <T> ApiResult<MarketSeries<T>> series(String operation, String symbol, Supplier<Command> command,
                                                 Function<WireRecord, T> mapper) {
        try {
            List<WireRecord> records = daemon.execute(command.get(), config.requestTimeout());
            if (!records.isEmpty() && records.get(0).kind() == RecordKind.ERR) {
                long code = records.get(0).integer("error_code", 0);
                log.warn("[historical] {} answered ERR {}", operation, code);
                return ApiResult.ofFailure("Daemon error " + code + " for " + operation, ApiErrorCode.DAEMON_ERROR);
            }
            log.debug("[historical] {}: {} records", operation, records.size());
            return ApiResult.ofSuccess(new MarketSeries<>(symbol, records, mapper));
        } catch (CommandValidationException e) {
            return failure(operation, e, ApiErrorCode.VALIDATION);
        } catch (NotConnectedException e) {
            return failure(operation, e, ApiErrorCode.NOT_CONNECTED);
        } catch (RequestTimeoutException e) {
            return failure(operation, e, ApiErrorCode.TIMEOUT);
        } catch (RequestCancelledException e) {
            return failure(operation, e, ApiErrorCode.CANCELLED);
        } catch (DarwinConnectionException e) {
            return failure(operation, e, ApiErrorCode.CONNECTION);
        } catch (WireFormatException e) {
            return failure(operation, e, ApiErrorCode.PROTOCOL);
        } catch (RuntimeException e) {
            log.error("[historical] {} failed unexpectedly", operation, e);
            return ApiResult.ofFailure(operation + ": " + e.getMessage(), ApiErrorCode.INTERNAL);
        }
    }

    private static <T> ApiResult<T> failure(String operation, RuntimeException e, ApiErrorCode code) {
        log.warn("[historical] {} failed ({}): {}", operation, code, e.getMessage());
        return ApiResult.ofFailure(e.getMessage(), code);
    }
}
