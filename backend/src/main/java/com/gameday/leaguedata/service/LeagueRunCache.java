package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.LeagueResources;
import com.gameday.leaguedata.model.LeagueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Per-run memo of registry resolutions and parsed sheets, keyed by league.
 * <p>
 * Loads are single-flight: the first caller for a key starts the load and every caller
 * shares its future. Failed loads are forgotten so the next caller tries again.
 * {@link #invalidate(String)} drops a league wholesale and is called at the start of a run.
 */
@Component
public class LeagueRunCache {

    private static final Logger log = LoggerFactory.getLogger(LeagueRunCache.class);

    private static final class LeagueEntry {
        final AtomicReference<CompletableFuture<LeagueResources>> resources = new AtomicReference<>();
        final Map<LeagueSource, CompletableFuture<List<List<String>>>> sheets = new ConcurrentHashMap<>();
    }

    private final ConcurrentHashMap<String, LeagueEntry> entries = new ConcurrentHashMap<>();

    public CompletableFuture<LeagueResources> resources(String leagueName,
                                                        Supplier<CompletableFuture<LeagueResources>> loader) {
        String key = key(leagueName);
        LeagueEntry entry = entry(key);
        CompletableFuture<LeagueResources> existing = entry.resources.get();
        if (existing != null) return existing;

        CompletableFuture<LeagueResources> mine = new CompletableFuture<>();
        if (!entry.resources.compareAndSet(null, mine)) {
            return entry.resources.get();
        }
        start(loader, mine, () -> {
            entry.resources.compareAndSet(mine, null);
            discardIfIdle(key, entry);
        });
        return mine;
    }

    public CompletableFuture<List<List<String>>> sheet(String leagueName, LeagueSource source,
                                                       Supplier<CompletableFuture<List<List<String>>>> loader) {
        String key = key(leagueName);
        LeagueEntry entry = entry(key);
        CompletableFuture<List<List<String>>> mine = new CompletableFuture<>();
        CompletableFuture<List<List<String>>> existing = entry.sheets.putIfAbsent(source, mine);
        if (existing != null) return existing;

        start(loader, mine, () -> {
            entry.sheets.remove(source, mine);
            discardIfIdle(key, entry);
        });
        return mine;
    }

    public boolean hasResources(String leagueName) {
        LeagueEntry entry = entries.get(key(leagueName));
        if (entry == null) return false;
        CompletableFuture<LeagueResources> f = entry.resources.get();
        return f != null && f.isDone() && !f.isCompletedExceptionally();
    }

    public void invalidate(String leagueName) {
        if (entries.remove(key(leagueName)) != null) {
            log.debug("[RunCache] Invalidated league '{}'", leagueName);
        }
    }

    public void clear() {
        entries.clear();
    }

    /** Number of leagues currently holding cached or in-flight loads. */
    public int size() {
        return entries.size();
    }

    private LeagueEntry entry(String key) {
        return entries.computeIfAbsent(key, k -> new LeagueEntry());
    }

    // An entry left with nothing after a failed load is dropped, so unknown league names do not pile up.
    private void discardIfIdle(String key, LeagueEntry entry) {
        if (entry.resources.get() == null && entry.sheets.isEmpty()) {
            entries.remove(key, entry);
        }
    }

    private static String key(String leagueName) {
        return leagueName == null ? "" : leagueName.trim().toLowerCase(Locale.ROOT);
    }

    private static <T> void start(Supplier<CompletableFuture<T>> loader, CompletableFuture<T> target, Runnable forget) {
        CompletableFuture<T> load;
        try {
            load = loader.get();
        } catch (RuntimeException e) {
            forget.run();
            target.completeExceptionally(e);
            return;
        }
        load.whenComplete((value, ex) -> {
            if (ex != null) {
                forget.run();
                target.completeExceptionally(ex);
            } else {
                target.complete(value);
            }
        });
    }
}
