package com.example.shortsbot_backend.segment;

import com.example.shortsbot_backend.dto.TranscriptSegment;
import com.example.shortsbot_backend.dto.Transcription;
import com.example.shortsbot_backend.selector.CandidateWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a transcript into candidate windows for scoring.
 */
@Component
public class TranscriptSegmenter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSegmenter.class);

    /**
     * Uses timed segments when the transcription has them, otherwise falls back to the flat text.
     *
     * @param transcription transcription result; {@code null} yields no windows.
     * @param cfg           window bounds.
     * @return ordered windows, possibly empty.
     */
    public List<CandidateWindow> segment(Transcription transcription, SegmentationConfig cfg) {
        if (transcription == null || transcription.isBlank()) {
            return List.of();
        }
        if (!transcription.segments().isEmpty()) {
            return fromSegments(transcription.segments(), cfg);
        }
        return fromText(transcription.text(), cfg);
    }

    /**
     * Cuts flat text whenever the estimated reading time {@code (chars / charsPerMinute) * 60}
     * reaches the window maximum. Window start times accumulate at {@code words / wordsPerSecond}.
     */
    public List<CandidateWindow> fromText(String text, SegmentationConfig cfg) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        SegmentationConfig c = cfg == null ? SegmentationConfig.defaults() : cfg;
        String[] words = text.trim().split("\\s+");

        List<CandidateWindow> windows = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int chars = 0;
        double cursor = 0.0;
        for (String word : words) {
            current.add(word);
            chars += word.length() + 1;
            double estimated = (chars / c.charsPerMinute()) * 60.0;
            if (estimated >= c.maxWindowSec()) {
                cursor = close(windows, current, cursor, c);
                chars = 0;
            }
        }
        if (!current.isEmpty()) {
            close(windows, current, cursor, c);
        }
        LOGGER.debug("TranscriptSegmenter text words={} windows={}", words.length, windows.size());
        return List.copyOf(windows);
    }

    private static double close(List<CandidateWindow> windows, List<String> words, double start, SegmentationConfig c) {
        double spoken = words.size() / c.wordsPerSecond();
        windows.add(new CandidateWindow(start, start + spoken, String.join(" ", words)));
        words.clear();
        return start + spoken;
    }

    /**
     * Greedily groups consecutive timed segments. A window is closed once adding the next segment
     * would push it past {@code maxWindowSec}, provided it already spans {@code minWindowSec};
     * a window still below the minimum keeps growing. The tail is emitted even when short.
     */
    public List<CandidateWindow> fromSegments(List<TranscriptSegment> segments, SegmentationConfig cfg) {
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }
        SegmentationConfig c = cfg == null ? SegmentationConfig.defaults() : cfg;
        List<TranscriptSegment> ordered = new ArrayList<>(segments);
        ordered.sort(Comparator.comparingDouble(TranscriptSegment::start));

        List<CandidateWindow> windows = new ArrayList<>();
        List<TranscriptSegment> open = new ArrayList<>();
        for (TranscriptSegment seg : ordered) {
            if (!open.isEmpty()) {
                double windowStart = open.get(0).start();
                double current = open.get(open.size() - 1).end() - windowStart;
                boolean overflow = seg.end() - windowStart > c.maxWindowSec();
                if (overflow && current >= c.minWindowSec()) {
                    windows.add(toWindow(open));
                    open.clear();
                }
            }
            open.add(seg);
        }
        if (!open.isEmpty()) {
            windows.add(toWindow(open));
        }
        windows.removeIf(w -> w.text().isBlank());
        LOGGER.debug("TranscriptSegmenter segments={} windows={}", segments.size(), windows.size());
        return List.copyOf(windows);
    }

    private static CandidateWindow toWindow(List<TranscriptSegment> segs) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment s : segs) {
            String t = s.text().trim();
            if (t.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t);
        }
        return new CandidateWindow(segs.get(0).start(), segs.get(segs.size() - 1).end(), sb.toString());
    }
}
