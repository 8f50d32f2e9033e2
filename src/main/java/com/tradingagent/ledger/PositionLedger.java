package com.tradingagent.ledger;

import com.tradingagent.domain.enums.PositionStatus;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.StrategyPerformanceBreakdown;
import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import com.tradingagent.exception.BusinessException;
import com.tradingagent.exception.ErrorCode;
import com.tradingagent.persistence.PositionFileStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Durable record of every position the agent holds, one row per ticker per universe.
 *
 * <p>Each universe has its own read/write lock. Mutations run under the write lock against a
 * copy of the map; the copy is persisted and only then swapped in, so a failed write leaves the
 * in-memory view exactly as it was. Two strategies racing to open the same ticker are serialized
 * here and only the first succeeds.
 *
 * <p>All returned positions are copies. Callers cannot alter ledger state except through the
 * mutating methods.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final PositionFileStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Map<Universe, UniverseBook> books = new EnumMap<>(Universe.class);

    public PositionLedger(PositionFileStore store, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        for (Universe universe : Universe.values()) {
            books.put(universe, new UniverseBook(store.load(universe)));
        }
    }

    // ========================
    // QUERIES
    // ========================

    public boolean hasOpenPosition(String ticker, Universe universe) {
        return read(universe, positions -> {
            Position position = positions.get(ticker);
            return position != null && position.isOpen();
        });
    }

    public Optional<Position> getPosition(String ticker, Universe universe) {
        return read(universe, positions -> Optional.ofNullable(positions.get(ticker)).map(PositionLedger::copy));
    }

    /** Open positions, optionally restricted to one strategy (null = all). */
    public List<Position> getOpenPositions(String strategy, Universe universe) {
        return select(universe, p -> p.isOpen() && matchesStrategy(p, strategy));
    }

    public List<Position> getAllPositions(Universe universe) {
        return select(universe, p -> true);
    }

    /** Aggregate over closed rows, optionally restricted to one strategy (null = all). */
    public PerformanceSummary getPerformance(String strategy, Universe universe) {
        return read(universe, positions -> summarize(positions.values().stream()
                .filter(p -> matchesStrategy(p, strategy))
                .toList()));
    }

    /** Like {@link #getPerformance} but only counts rows closed on {@code date}. */
    public PerformanceSummary getDailyPerformance(String strategy, Universe universe, LocalDate date) {
        return read(universe, positions -> summarize(positions.values().stream()
                .filter(p -> matchesStrategy(p, strategy))
                .filter(p -> p.isOpen()
                        || (p.getExitTime() != null && p.getExitTime().toLocalDate().equals(date)))
                .toList()));
    }

    /** Real and simulated performance per strategy, for every strategy found in either universe. */
    public List<StrategyPerformanceBreakdown> getAllPerformance() {
        TreeSet<String> strategies = new TreeSet<>();
        for (Universe universe : Universe.values()) {
            read(universe, positions -> {
                positions.values().stream()
                        .map(Position::getStrategy)
                        .filter(Objects::nonNull)
                        .forEach(strategies::add);
                return null;
            });
        }
        List<StrategyPerformanceBreakdown> breakdowns = new ArrayList<>();
        for (String strategy : strategies) {
            PerformanceSummary real = getPerformance(strategy, Universe.REAL);
            PerformanceSummary simulated = getPerformance(strategy, Universe.SIMULATED);
            breakdowns.add(StrategyPerformanceBreakdown.builder()
                    .strategy(strategy)
                    .real(real)
                    .simulated(simulated)
                    .combinedTrades(real.getTotalTrades() + simulated.getTotalTrades())
                    .combinedPnl(real.getTotalPnl().add(simulated.getTotalPnl()))
                    .build());
        }
        return breakdowns;
    }

    /** Logs every strategy's real and simulated results. Runs on {@code agent.ledger.weekly-report-cron}. */
    @Scheduled(cron = "${agent.ledger.weekly-report-cron:0 0 9 * * MON}")
    public void logWeeklyReport() {
        List<StrategyPerformanceBreakdown> breakdowns = getAllPerformance();
        log.info("Weekly report: {} strategies", breakdowns.size());
        for (StrategyPerformanceBreakdown b : breakdowns) {
            log.info("  {}: real {} trades ({} won) ${}, simulated {} trades ({} won) ${}, combined {} trades ${}",
                    b.getStrategy(),
                    b.getReal().getTotalTrades(), b.getReal().getWinningTrades(), b.getReal().getTotalPnl(),
                    b.getSimulated().getTotalTrades(), b.getSimulated().getWinningTrades(),
                    b.getSimulated().getTotalPnl(), b.getCombinedTrades(), b.getCombinedPnl());
        }
    }

    /** Dollars committed across open positions. Seeds the exposure gate at startup. */
    public BigDecimal openNotional(Universe universe) {
        return read(universe, positions -> positions.values().stream()
                .filter(Position::isOpen)
                .map(Position::getNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /** Sum of realized P&L over closed rows. */
    public BigDecimal realizedPnl(Universe universe) {
        return getPerformance(null, universe).getTotalPnl();
    }

    // ========================
    // MUTATIONS
    // ========================

    public Optional<Position> openPosition(
            String ticker, Side side, int contracts, int entryPrice, String strategy, Universe universe,
            String marketTitle) {
        return openPosition(ticker, side, contracts, entryPrice, strategy, universe, marketTitle, true, null);
    }

    /**
     * Records a new open position.
     *
     * <p>With {@code dedupe} set, an already open row for the ticker makes this a no-op that
     * returns empty. Without it, the open row is replaced, which still leaves one open row per
     * ticker. A closed row for the ticker is always replaced.
     *
     * @return the stored row, or empty when deduplicated
     * @throws com.tradingagent.exception.PersistenceException if the ledger file cannot be written
     */
    public Optional<Position> openPosition(
            String ticker, Side side, int contracts, int entryPrice, String strategy, Universe universe,
            String marketTitle, boolean dedupe, LocalDateTime expectedSettlement) {
        validateOpen(ticker, side, contracts, entryPrice);

        UniverseBook book = books.get(universe);
        Position stored;
        book.lock.writeLock().lock();
        try {
            Position existing = book.positions.get(ticker);
            if (existing != null && existing.isOpen()) {
                if (dedupe) {
                    log.info("Skipping duplicate {} position on {} for {} (held by {})",
                            universe, ticker, strategy, existing.getStrategy());
                    return Optional.empty();
                }
                log.warn("Replacing open {} position on {} held by {}", universe, ticker, existing.getStrategy());
            }

            stored = Position.builder()
                    .ticker(ticker)
                    .side(side)
                    .contracts(contracts)
                    .entryPrice(entryPrice)
                    .entryTime(LocalDateTime.now(clock))
                    .strategy(strategy)
                    .simulated(universe.isSimulated())
                    .marketTitle(marketTitle)
                    .status(PositionStatus.OPEN)
                    .expectedSettlement(expectedSettlement)
                    .build();

            Map<String, Position> next = new LinkedHashMap<>(book.positions);
            next.put(ticker, stored);
            commit(universe, book, next);
        } finally {
            book.lock.writeLock().unlock();
        }

        log.info("Opened {} position: {} {} x{} @ {}c ({})",
                universe, ticker, side, contracts, entryPrice, strategy);
        eventPublisher.publishEvent(new PositionEvent(this, copy(stored), universe, PositionEventType.OPENED));
        return Optional.of(copy(stored));
    }

    /**
     * Closes the open row for {@code ticker}.
     *
     * @return the closed row, or empty when the ticker is unknown or already closed
     * @throws com.tradingagent.exception.PersistenceException if the ledger file cannot be written
     */
    public Optional<Position> closePosition(String ticker, int exitPrice, BigDecimal pnl, Universe universe) {
        UniverseBook book = books.get(universe);
        Position closed;
        book.lock.writeLock().lock();
        try {
            Position existing = book.positions.get(ticker);
            if (existing == null || !existing.isOpen()) {
                log.debug("No open {} position to close for {}", universe, ticker);
                return Optional.empty();
            }

            closed = existing.toBuilder()
                    .status(PositionStatus.CLOSED)
                    .exitPrice(exitPrice)
                    .exitTime(LocalDateTime.now(clock))
                    .pnl(pnl)
                    .build();

            Map<String, Position> next = new LinkedHashMap<>(book.positions);
            next.put(ticker, closed);
            commit(universe, book, next);
        } finally {
            book.lock.writeLock().unlock();
        }

        log.info("Closed {} position: {} @ {}c, P&L ${}", universe, ticker, exitPrice, pnl);
        eventPublisher.publishEvent(new PositionEvent(this, copy(closed), universe, PositionEventType.CLOSED));
        return Optional.of(copy(closed));
    }

    /**
     * Empties the simulated universe, used for competition resets.
     *
     * @param backup copy the current simulated file to a dated backup first
     * @return number of rows removed
     */
    public int clearSimulatedPositions(boolean backup) {
        UniverseBook book = books.get(Universe.SIMULATED);
        book.lock.writeLock().lock();
        try {
            if (backup) {
                store.backup(Universe.SIMULATED);
            }
            int removed = book.positions.size();
            commit(Universe.SIMULATED, book, new LinkedHashMap<>());
            log.info("Cleared {} simulated positions", removed);
            return removed;
        } finally {
            book.lock.writeLock().unlock();
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private void commit(Universe universe, UniverseBook book, Map<String, Position> next) {
        store.save(universe, next);
        book.positions = next;
    }

    private <T> T read(Universe universe, Function<Map<String, Position>, T> reader) {
        UniverseBook book = books.get(universe);
        book.lock.readLock().lock();
        try {
            return reader.apply(book.positions);
        } finally {
            book.lock.readLock().unlock();
        }
    }

    private List<Position> select(Universe universe, Predicate<Position> filter) {
        return read(universe, positions -> positions.values().stream()
                .filter(filter)
                .map(PositionLedger::copy)
                .toList());
    }

    private static PerformanceSummary summarize(List<Position> rows) {
        List<Position> closed = rows.stream()
                .filter(p -> p.getStatus() == PositionStatus.CLOSED && p.getPnl() != null)
                .toList();
        int open = (int) rows.stream().filter(Position::isOpen).count();
        if (closed.isEmpty()) {
            PerformanceSummary empty = PerformanceSummary.empty();
            empty.setOpenPositions(open);
            return empty;
        }

        int wins = (int) closed.stream().filter(p -> p.getPnl().signum() > 0).count();
        BigDecimal total = closed.stream().map(Position::getPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        return PerformanceSummary.builder()
                .totalTrades(closed.size())
                .winningTrades(wins)
                .winRate((double) wins / closed.size())
                .totalPnl(total)
                .openPositions(open)
                .avgPnlPerTrade(total.divide(BigDecimal.valueOf(closed.size()), 4, RoundingMode.HALF_UP))
                .build();
    }

    private static boolean matchesStrategy(Position position, String strategy) {
        return strategy == null || strategy.equals(position.getStrategy());
    }

    private static void validateOpen(String ticker, Side side, int contracts, int entryPrice) {
        if (ticker == null || ticker.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_POSITION, "Ticker is required");
        }
        if (side == null) {
            throw new BusinessException(ErrorCode.INVALID_POSITION, "Side is required for " + ticker);
        }
        if (contracts <= 0) {
            throw new BusinessException(ErrorCode.INVALID_POSITION, "Contracts must be positive: " + contracts);
        }
        if (entryPrice < 1 || entryPrice > 99) {
            throw new BusinessException(ErrorCode.INVALID_POSITION, "Entry price must be 1-99 cents: " + entryPrice);
        }
    }

    private static Position copy(Position position) {
        return position.toBuilder().build();
    }

    /** Lock plus the current immutable-by-convention map of one universe. */
    private static final class UniverseBook {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private volatile Map<String, Position> positions;

        private UniverseBook(Map<String, Position> positions) {
            this.positions = positions;
        }
    }
}
