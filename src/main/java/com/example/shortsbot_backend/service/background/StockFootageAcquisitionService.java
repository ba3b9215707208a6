package com.example.shortsbot_backend.service.background;

import com.example.shortsbot_backend.config.BackgroundProperties;
import com.example.shortsbot_backend.engine.MediaToolkit;
import com.example.shortsbot_backend.exception.ShortBuildException;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.model.BackgroundClip;
import com.example.shortsbot_backend.repository.BackgroundClipRepository;
import com.example.shortsbot_backend.service.Interfaces.BackgroundAcquisitionService;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import com.example.shortsbot_backend.util.ThemeKeywords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Searches the enabled stock footage providers for a theme, downloads the hits into the
 * background library and registers them in the pool.
 */
@Service
public class StockFootageAcquisitionService implements BackgroundAcquisitionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(StockFootageAcquisitionService.class);

    private final List<StockFootageProvider> providers;
    private final WebClient downloadClient;
    private final BackgroundClipRepository clipRepository;
    private final StorageService storageService;
    private final MediaToolkit mediaToolkit;
    private final Clock clock;
    private final Duration downloadTimeout;

    public StockFootageAcquisitionService(List<StockFootageProvider> providers,
                                          @Qualifier("stockWebClient") WebClient downloadClient,
                                          BackgroundClipRepository clipRepository,
                                          StorageService storageService,
                                          MediaToolkit mediaToolkit,
                                          BackgroundProperties properties,
                                          Clock clock) {
        this.providers = providers;
        this.downloadClient = downloadClient;
        this.clipRepository = clipRepository;
        this.storageService = storageService;
        this.mediaToolkit = mediaToolkit;
        this.clock = clock;
        this.downloadTimeout = Duration.ofSeconds(properties.getDownloadTimeoutSeconds());
    }

    @Override
    public List<BackgroundClip> acquire(String theme, int countPerSource) {
        String normalizedTheme = theme.trim().toLowerCase(Locale.ROOT);
        List<BackgroundClip> acquired = new ArrayList<>();
        for (StockFootageProvider provider : providers) {
            if (!provider.isEnabled()) {
                LOGGER.debug("StockFootageAcquisitionService SKIP provider={} reason=no-api-key", provider.name());
                continue;
            }
            acquired.addAll(acquireFrom(provider, normalizedTheme, countPerSource));
        }
        LOGGER.info("StockFootageAcquisitionService DONE theme={} acquired={}", normalizedTheme, acquired.size());
        return acquired;
    }

    private List<BackgroundClip> acquireFrom(StockFootageProvider provider, String theme, int count) {
        List<BackgroundClip> out = new ArrayList<>();
        for (String keyword : ThemeKeywords.searchTermsFor(theme)) {
            if (out.size() >= count) {
                break;
            }
            List<StockVideo> hits;
            try {
                hits = provider.search(keyword, count);
            } catch (StockFootageAccessException e) {
                LOGGER.warn("StockFootageAcquisitionService SEARCH_FAILED provider={} keyword={} cause={}",
                        provider.name(), keyword, e.getMessage());
                continue;
            }
            for (StockVideo hit : hits) {
                if (out.size() >= count) {
                    break;
                }
                if (clipRepository.existsBySourceAndUrl(hit.source(), hit.downloadUrl())) {
                    continue;
                }
                BackgroundClip clip = download(hit, theme);
                if (clip != null) {
                    out.add(clip);
                }
            }
        }
        return out;
    }

    private BackgroundClip download(StockVideo hit, String theme) {
        String filename = hit.source() + "_" + theme + "_" + hit.externalId() + ".mp4";
        if (clipRepository.existsByFilename(filename)) {
            return null;
        }
        Path target = storageService.resolveBackground(theme, filename);
        try {
            Files.createDirectories(target.getParent());
            Flux<DataBuffer> body = downloadClient.get()
                    .uri(hit.downloadUrl())
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, target).block(downloadTimeout);
            long size = Files.size(target);
            if (size == 0) {
                safeDelete(target);
                return null;
            }
            double duration = probeOr(target, hit.durationSeconds());
            if (duration <= 0) {
                LOGGER.warn("StockFootageAcquisitionService UNUSABLE file={} reason=unknown-duration", filename);
                safeDelete(target);
                return null;
            }
            BackgroundClip saved = clipRepository.save(new BackgroundClip(filename, theme, hit.source(),
                    hit.downloadUrl(), duration, size, clock.instant()));
            LOGGER.info("StockFootageAcquisitionService DOWNLOADED source={} theme={} file={} duration={}",
                    hit.source(), theme, filename, duration);
            return saved;
        } catch (IOException | WebClientException | IllegalStateException e) {
            LOGGER.warn("StockFootageAcquisitionService DOWNLOAD_FAILED url={} cause={}", hit.downloadUrl(), e.toString());
            safeDelete(target);
            return null;
        }
    }

    private double probeOr(Path file, double advertised) {
        try {
            return mediaToolkit.probeDuration(file);
        } catch (ShortBuildException | StorageException e) {
            LOGGER.warn("StockFootageAcquisitionService PROBE_FAILED file={} fallback={} cause={}",
                    file.getFileName(), advertised, e.getMessage());
            return advertised;
        }
    }

    private static void safeDelete(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("StockFootageAcquisitionService cleanup failed path={} cause={}", p, e.toString());
        }
    }
}
