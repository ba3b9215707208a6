package com.example.shortsbot_backend.service.background;

import com.example.shortsbot_backend.config.BackgroundProperties;
import com.example.shortsbot_backend.config.StorageProperties;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.model.BackgroundClip;
import com.example.shortsbot_backend.model.BackgroundUsage;
import com.example.shortsbot_backend.repository.BackgroundClipRepository;
import com.example.shortsbot_backend.repository.BackgroundUsageRepository;
import com.example.shortsbot_backend.service.Interfaces.BackgroundAcquisitionService;
import com.example.shortsbot_backend.service.LocalStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundClipAllocatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private BackgroundClipRepository clipRepository;
    @Mock
    private BackgroundUsageRepository usageRepository;
    @Mock
    private BackgroundAcquisitionService acquisitionService;

    @TempDir
    Path tmp;

    private LocalStorageService storage;
    private BackgroundClipAllocator allocator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        storage = new LocalStorageService(tmp, new StorageProperties(), clock);
        allocator = new BackgroundClipAllocator(clipRepository, usageRepository, acquisitionService, storage,
                new BackgroundProperties(), TransactionOperations.withoutTransaction(), clock);
    }

    @Test
    void picksLeastUsedClipsUntilDurationCovered() throws Exception {
        BackgroundClip a = clip("nature", "a.mp4", 30, 0);
        BackgroundClip b = clip("nature", "b.mp4", 30, 1);
        BackgroundClip c = clip("nature", "c.mp4", 30, 4);
        when(clipRepository.findPoolInSelectionOrder("nature")).thenReturn(List.of(a, b, c));
        when(clipRepository.incrementUsageIfUnchanged(any(), anyInt(), eq(NOW))).thenReturn(1);

        AllocatedBackground result = allocator.allocate("Nature", 50, "vid-1");

        assertThat(result.theme()).isEqualTo("nature");
        assertThat(result.clips()).extracting(p -> p.getFileName().toString()).containsExactly("a.mp4", "b.mp4");
        assertThat(result.totalDuration()).isEqualTo(60.0);
        assertThat(result.looped()).isFalse();
        verify(clipRepository).incrementUsageIfUnchanged(a.getId(), 0, NOW);
        verify(clipRepository).incrementUsageIfUnchanged(b.getId(), 1, NOW);
        verify(clipRepository, never()).incrementUsageIfUnchanged(eq(c.getId()), anyInt(), any());
        verify(usageRepository, times(2)).save(any(BackgroundUsage.class));
    }

    @Test
    void skipsClipsWhoseFileIsMissing() throws Exception {
        BackgroundClip gone = clipWithoutFile("nature", "gone.mp4", 30, 0);
        BackgroundClip ok = clip("nature", "ok.mp4", 90, 2);
        when(clipRepository.findPoolInSelectionOrder("nature")).thenReturn(List.of(gone, ok));
        when(clipRepository.incrementUsageIfUnchanged(ok.getId(), 2, NOW)).thenReturn(1);

        AllocatedBackground result = allocator.allocate("nature", 80, "vid-1");

        assertThat(result.clips()).extracting(p -> p.getFileName().toString()).containsExactly("ok.mp4");
    }

    @Test
    void retriesAfterLostIncrementRace() throws Exception {
        BackgroundClip a = clip("nature", "a.mp4", 90, 0);
        when(clipRepository.findPoolInSelectionOrder("nature")).thenReturn(List.of(a));
        when(clipRepository.incrementUsageIfUnchanged(a.getId(), 0, NOW)).thenReturn(0, 1);

        AllocatedBackground result = allocator.allocate("nature", 80, "vid-1");

        assertThat(result.clips()).hasSize(1);
        verify(clipRepository, times(2)).incrementUsageIfUnchanged(a.getId(), 0, NOW);
        verify(usageRepository, times(1)).save(any(BackgroundUsage.class));
    }

    @Test
    void shortPoolIsMarkedLooped() throws Exception {
        BackgroundClip a = clip("nature", "a.mp4", 20, 0);
        when(clipRepository.findPoolInSelectionOrder("nature")).thenReturn(List.of(a));
        when(clipRepository.incrementUsageIfUnchanged(a.getId(), 0, NOW)).thenReturn(1);

        AllocatedBackground result = allocator.allocate("nature", 70, "vid-1");

        assertThat(result.looped()).isTrue();
        assertThat(result.playlistFor(70)).hasSize(4);
    }

    @Test
    void acquiresWhenPoolEmpty() throws Exception {
        BackgroundClip fresh = clip("nature", "fresh.mp4", 90, 0);
        when(clipRepository.findPoolInSelectionOrder("nature")).thenReturn(List.of(), List.of(fresh));
        when(acquisitionService.acquire("nature", 2)).thenReturn(List.of(fresh));
        when(clipRepository.incrementUsageIfUnchanged(fresh.getId(), 0, NOW)).thenReturn(1);

        AllocatedBackground result = allocator.allocate("nature", 80, "vid-1");

        assertThat(result.theme()).isEqualTo("nature");
        verify(acquisitionService).acquire("nature", 2);
    }

    @Test
    void fallsBackToDefaultTheme() throws Exception {
        BackgroundClip motivation = clip("motivation", "m.mp4", 90, 3);
        when(clipRepository.findPoolInSelectionOrder("space")).thenReturn(List.of());
        when(acquisitionService.acquire("space", 2)).thenReturn(List.of());
        when(clipRepository.findPoolInSelectionOrder("motivation")).thenReturn(List.of(motivation));
        when(clipRepository.incrementUsageIfUnchanged(motivation.getId(), 3, NOW)).thenReturn(1);

        AllocatedBackground result = allocator.allocate("space", 80, "vid-1");

        assertThat(result.theme()).isEqualTo("motivation");
    }

    @Test
    void failsWhenRequestedAndDefaultThemesAreEmpty() {
        when(clipRepository.findPoolInSelectionOrder(any())).thenReturn(List.of());
        when(acquisitionService.acquire(any(), anyInt())).thenReturn(List.of());

        assertThatThrownBy(() -> allocator.allocate("space", 80, "vid-1"))
                .isInstanceOf(MissingInputException.class)
                .hasMessageContaining("space")
                .hasMessageContaining("motivation");
        verify(acquisitionService).acquire("space", 2);
        verify(acquisitionService).acquire("motivation", 2);
    }

    @Test
    void givesUpOnPersistentContention() throws Exception {
        BackgroundClip a = clip("motivation", "a.mp4", 90, 0);
        when(clipRepository.findPoolInSelectionOrder("motivation")).thenReturn(List.of(a));
        when(clipRepository.incrementUsageIfUnchanged(a.getId(), 0, NOW)).thenReturn(0);
        when(acquisitionService.acquire("motivation", 2)).thenReturn(List.of());

        assertThatThrownBy(() -> allocator.allocate(null, 80, "vid-1"))
                .isInstanceOf(MissingInputException.class);
        verify(clipRepository, times(4)).incrementUsageIfUnchanged(a.getId(), 0, NOW);
    }

    private BackgroundClip clip(String theme, String filename, double duration, int usage) throws Exception {
        BackgroundClip c = clipWithoutFile(theme, filename, duration, usage);
        Path file = storage.resolveBackground(theme, filename);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{1});
        return c;
    }

    private static BackgroundClip clipWithoutFile(String theme, String filename, double duration, int usage) {
        BackgroundClip c = new BackgroundClip(filename, theme, "pexels", "https://example.test/" + filename,
                duration, 1L, NOW.minusSeconds(60));
        ReflectionTestUtils.setField(c, "id", UUID.randomUUID());
        ReflectionTestUtils.setField(c, "usageCount", usage);
        return c;
    }
}
