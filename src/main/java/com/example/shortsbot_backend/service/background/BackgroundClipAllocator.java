package com.example.shortsbot_backend.service.background;

import com.example.shortsbot_backend.config.BackgroundProperties;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.model.BackgroundClip;
import com.example.shortsbot_backend.model.BackgroundUsage;
import com.example.shortsbot_backend.repository.BackgroundClipRepository;
import com.example.shortsbot_backend.repository.BackgroundUsageRepository;
import com.example.shortsbot_backend.service.Interfaces.BackgroundAcquisitionService;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Picks background clips for a short, least used first and freshest download on ties.
 * <p>
 * Each pick is a compare-and-increment on {@code usage_count}; a pick that lost a race re-reads
 * the pool. When a theme pool is empty the allocator acquires a small batch, then falls back to
 * the default theme, and finally fails with {@link MissingInputException}.
 */
@Service
public class BackgroundClipAllocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundClipAllocator.class);

    private final BackgroundClipRepository clipRepository;
    private final BackgroundUsageRepository usageRepository;
    private final BackgroundAcquisitionService acquisitionService;
    private final StorageService storageService;
    private final BackgroundProperties props;
    private final TransactionOperations tx;
    private final Clock clock;

    public BackgroundClipAllocator(BackgroundClipRepository clipRepository,
                                   BackgroundUsageRepository usageRepository,
                                   BackgroundAcquisitionService acquisitionService,
                                   StorageService storageService,
                                   BackgroundProperties props,
                                   TransactionOperations tx,
                                   Clock clock) {
        this.clipRepository = clipRepository;
        this.usageRepository = usageRepository;
        this.acquisitionService = acquisitionService;
        this.storageService = storageService;
        this.props = props;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * @param theme          requested theme; blank means the default theme.
     * @param durationNeeded seconds of footage required.
     * @param videoId        source video the clips are used for, recorded in the usage log.
     * @throws MissingInputException when no clip is available after the fallback chain.
     */
    public AllocatedBackground allocate(String theme, double durationNeeded, String videoId) {
        String defaultTheme = props.getDefaultTheme().toLowerCase(Locale.ROOT);
        String requested = theme == null || theme.isBlank() ? defaultTheme : theme.trim().toLowerCase(Locale.ROOT);

        AllocatedBackground picked = allocateWithAcquisition(requested, durationNeeded, videoId);
        if (picked == null && !requested.equals(defaultTheme)) {
            LOGGER.info("BackgroundClipAllocator FALLBACK theme={} to={}", requested, defaultTheme);
            picked = allocateWithAcquisition(defaultTheme, durationNeeded, videoId);
        }
        if (picked == null) {
            throw new MissingInputException("No background clip available for theme " + requested
                    + " or default theme " + defaultTheme);
        }
        LOGGER.info("BackgroundClipAllocator ALLOCATED videoId={} theme={} clips={} total={} needed={} looped={}",
                videoId, picked.theme(), picked.clips().size(), picked.totalDuration(), durationNeeded, picked.looped());
        return picked;
    }

    private AllocatedBackground allocateWithAcquisition(String theme, double needed, String videoId) {
        AllocatedBackground picked = pickFromPool(theme, needed, videoId);
        if (picked != null) {
            return picked;
        }
        LOGGER.info("BackgroundClipAllocator POOL_EMPTY theme={} acquiring={}", theme, props.getAcquireBatchSize());
        List<BackgroundClip> acquired = acquisitionService.acquire(theme, props.getAcquireBatchSize());
        if (acquired.isEmpty()) {
            return null;
        }
        return pickFromPool(theme, needed, videoId);
    }

    private AllocatedBackground pickFromPool(String theme, double needed, String videoId) {
        List<Path> paths = new ArrayList<>();
        Set<UUID> taken = new HashSet<>();
        double total = 0.0;
        int conflicts = 0;

        while (paths.size() < Math.max(1, props.getMaxClipsPerShort()) && total < needed) {
            UsableClip next = leastUsed(theme, taken);
            if (next == null) {
                break;
            }
            if (!claim(next.clip(), videoId)) {
                if (++conflicts > props.getMaxIncrementRetries()) {
                    LOGGER.warn("BackgroundClipAllocator CONTENTION theme={} clipId={} retries={}",
                            theme, next.clip().getId(), conflicts - 1);
                    break;
                }
                continue;
            }
            taken.add(next.clip().getId());
            paths.add(next.path());
            total += next.clip().getDuration();
        }
        if (paths.isEmpty()) {
            return null;
        }
        return new AllocatedBackground(theme, paths, total, total < needed);
    }

    private UsableClip leastUsed(String theme, Set<UUID> taken) {
        for (BackgroundClip c : clipRepository.findPoolInSelectionOrder(theme)) {
            if (taken.contains(c.getId())) {
                continue;
            }
            Path p = storageService.resolveBackground(c.getTheme(), c.getFilename());
            if (!Files.isRegularFile(p)) {
                LOGGER.debug("BackgroundClipAllocator SKIP clipId={} reason=file-missing path={}", c.getId(), p);
                continue;
            }
            return new UsableClip(c, p);
        }
        return null;
    }

    /** Increments usage and logs the selection in one transaction; {@code false} when the count moved. */
    private boolean claim(BackgroundClip clip, String videoId) {
        Instant now = clock.instant();
        Boolean claimed = tx.execute(status -> {
            int updated = clipRepository.incrementUsageIfUnchanged(clip.getId(), clip.getUsageCount(), now);
            if (updated == 0) {
                return false;
            }
            usageRepository.save(new BackgroundUsage(clipRepository.getReferenceById(clip.getId()), videoId, now));
            return true;
        });
        return Boolean.TRUE.equals(claimed);
    }

    private record UsableClip(BackgroundClip clip, Path path) {}
}
