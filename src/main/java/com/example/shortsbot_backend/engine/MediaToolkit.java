package com.example.shortsbot_backend.engine;

import com.example.shortsbot_backend.config.MediaToolProperties;
import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.engine.Interfaces.ProcessRunner;
import com.example.shortsbot_backend.exception.ExternalToolException;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.ffmpeg.AssStyleUtil;
import com.example.shortsbot_backend.util.CaptionFormat;
import com.example.shortsbot_backend.util.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ffmpeg/ffprobe operations used by the assembly pipeline. Every call goes through the
 * {@link ProcessRunner} with a bounded timeout.
 */
@Component
public class MediaToolkit {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaToolkit.class);
    static final double FADE_SECONDS = 0.5;

    private final ProcessRunner runner;
    private final MediaToolProperties props;

    public MediaToolkit(ProcessRunner runner, MediaToolProperties props) {
        this.runner = runner;
        this.props = props;
    }

    /**
     * Container duration in seconds as reported by ffprobe.
     */
    public double probeDuration(Path media) {
        MediaCommand cmd = new MediaCommand("probe", props.getFfprobeBinary(), List.of(
                "-v", "quiet",
                "-show_entries", "format=duration",
                "-of", "csv=p=0",
                media.toAbsolutePath().toString()
        ), Duration.ofSeconds(props.getProbeTimeoutSeconds()));
        ProcessResult result = runner.runChecked(cmd);
        String raw = result.stdout() == null ? "" : result.stdout().trim();
        try {
            double seconds = Double.parseDouble(raw);
            LOGGER.debug("MediaToolkit PROBE file={} duration={}", media.getFileName(), seconds);
            return seconds;
        } catch (NumberFormatException e) {
            throw new ExternalToolException("probe", result.exitCode(), false, "unparsable duration '" + raw + "' for " + media);
        }
    }

    /**
     * Repeats {@code source} {@code loops} times and caps the result at {@code targetSeconds}.
     */
    public Path extendByLoop(Path source, int loops, double targetSeconds, Path listFile, Path out) {
        List<Path> entries = new ArrayList<>(loops);
        for (int i = 0; i < Math.max(1, loops); i++) {
            entries.add(source);
        }
        writeConcatList(listFile, entries);
        List<String> args = new ArrayList<>(List.of(
                "-y",
                "-f", "concat", "-safe", "0",
                "-i", listFile.toAbsolutePath().toString(),
                "-t", seconds(targetSeconds)));
        addVideoCodec(args);
        args.addAll(List.of("-c:a", "aac", out.toAbsolutePath().toString()));
        return stage("extend", args, out);
    }

    public Path trim(Path source, double start, double duration, Path out) {
        List<String> args = new ArrayList<>(List.of(
                "-y",
                "-i", source.toAbsolutePath().toString(),
                "-ss", seconds(start),
                "-t", seconds(duration)));
        addVideoCodec(args);
        args.addAll(List.of(
                "-c:a", "aac",
                "-avoid_negative_ts", "make_zero",
                out.toAbsolutePath().toString()));
        return stage("trim", args, out);
    }

    /**
     * Concatenates the background clips, crops them to the platform canvas and overlays the
     * trimmed source centred on top. The result has no audio track.
     */
    public Path composeBackground(List<Path> backgrounds, Path foreground, double duration,
                                  PlatformProfile profile, Path listFile, Path out) {
        writeConcatList(listFile, backgrounds);
        int w = profile.width();
        int h = profile.height();
        String graph = String.format(Locale.ROOT,
                "[0:v]scale=%1$d:%2$d:force_original_aspect_ratio=increase,crop=%1$d:%2$d,setsar=1[bg];"
                        + "[1:v]scale=%1$d:-2[fg];"
                        + "[bg][fg]overlay=(W-w)/2:(H-h)/2[v]", w, h);
        List<String> args = new ArrayList<>(List.of(
                "-y",
                "-f", "concat", "-safe", "0",
                "-i", listFile.toAbsolutePath().toString(),
                "-i", foreground.toAbsolutePath().toString(),
                "-filter_complex", graph,
                "-map", "[v]",
                "-t", seconds(duration),
                "-an"));
        addVideoCodec(args);
        args.add(out.toAbsolutePath().toString());
        return stage("background", args, out);
    }

    public Path muxNarration(Path video, Path narration, Path out) {
        return stage("mux", List.of(
                "-y",
                "-i", video.toAbsolutePath().toString(),
                "-i", narration.toAbsolutePath().toString(),
                "-map", "0:v:0",
                "-map", "1:a:0",
                "-c:v", "copy",
                "-c:a", "aac",
                out.toAbsolutePath().toString()
        ), out);
    }

    /**
     * Joins audio files end to end with the {@code concat} filter.
     */
    public Path concatAudio(List<Path> parts, Path out) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("no audio parts to concatenate");
        }
        List<String> args = new ArrayList<>();
        args.add("-y");
        StringBuilder graph = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            args.add("-i");
            args.add(parts.get(i).toAbsolutePath().toString());
            graph.append('[').append(i).append(":a]");
        }
        graph.append("concat=n=").append(parts.size()).append(":v=0:a=1[a]");
        args.addAll(List.of(
                "-filter_complex", graph.toString(),
                "-map", "[a]",
                "-c:a", "aac",
                out.toAbsolutePath().toString()));
        return stage("concat-audio", args, out);
    }

    /**
     * Scales and pads to the platform canvas, then burns the caption track. Audio is padded with
     * silence and the output is capped at {@code duration}.
     */
    public Path burnCaptions(Path video, Path captions, CaptionFormat format, PlatformProfile profile,
                             double duration, Path out) {
        String vf = burnFilter(captions, format, profile);
        List<String> args = new ArrayList<>(List.of(
                "-y",
                "-i", video.toAbsolutePath().toString(),
                "-vf", vf,
                "-af", "apad",
                "-t", seconds(duration)));
        addVideoCodec(args);
        args.addAll(List.of("-c:a", "aac", out.toAbsolutePath().toString()));
        return stage("burn", args, out);
    }

    public Path applyEffects(Path video, PlatformProfile profile, double duration, Path out) {
        String vf = effectsFilter(profile, duration);
        List<String> args = new ArrayList<>(List.of(
                "-y",
                "-i", video.toAbsolutePath().toString()));
        if (!vf.isEmpty()) {
            args.add("-vf");
            args.add(vf);
        }
        addVideoCodec(args);
        args.addAll(List.of("-c:a", "copy", out.toAbsolutePath().toString()));
        return stage("effects", args, out);
    }

    public Path extractFrame(Path video, double atSeconds, Path out) {
        MediaCommand cmd = new MediaCommand("thumbnail", props.getFfmpegBinary(), List.of(
                "-y",
                "-ss", seconds(atSeconds),
                "-i", video.toAbsolutePath().toString(),
                "-frames:v", "1",
                "-q:v", "2",
                out.toAbsolutePath().toString()
        ), Duration.ofSeconds(props.getThumbnailTimeoutSeconds()));
        runner.runChecked(cmd);
        return out;
    }

    static String burnFilter(Path captions, CaptionFormat format, PlatformProfile profile) {
        int w = profile.width();
        int h = profile.height();
        String scale = String.format(Locale.ROOT,
                "scale=%1$d:%2$d:force_original_aspect_ratio=decrease,pad=%1$d:%2$d:(ow-iw)/2:(oh-ih)/2", w, h);
        String path = AssStyleUtil.escapeForFilter(captions.toAbsolutePath().toString());
        String subs = format == CaptionFormat.ASS
                ? "subtitles='" + path + "'"
                : "subtitles='" + path + "':force_style='" + AssStyleUtil.buildForceStyle(profile.captionStyle()) + "'";
        return scale + "," + subs;
    }

    /**
     * Duration-preserving filter chain for the platform's effects; empty when none apply.
     */
    static String effectsFilter(PlatformProfile profile, double duration) {
        List<String> filters = new ArrayList<>();
        if (profile.has(Effect.ZOOM)) {
            filters.add(String.format(Locale.ROOT, "scale=iw*1.05:ih*1.05,crop=%d:%d", profile.width(), profile.height()));
        }
        if (profile.has(Effect.FILTERS)) {
            filters.add("eq=contrast=1.1:saturation=1.2");
        }
        if (profile.has(Effect.TRANSITIONS) && duration > 2 * FADE_SECONDS) {
            filters.add("fade=t=in:st=0:d=" + seconds(FADE_SECONDS));
            filters.add("fade=t=out:st=" + seconds(duration - FADE_SECONDS) + ":d=" + seconds(FADE_SECONDS));
        }
        return String.join(",", filters);
    }

    static String seconds(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private void addVideoCodec(List<String> args) {
        args.addAll(List.of(
                "-c:v", "libx264",
                "-preset", props.getPreset(),
                "-crf", String.valueOf(props.getCrf()),
                "-pix_fmt", "yuv420p"));
    }

    private Path stage(String label, List<String> args, Path out) {
        MediaCommand cmd = new MediaCommand(label, props.getFfmpegBinary(), args,
                Duration.ofSeconds(props.getStageTimeoutSeconds()));
        runner.runChecked(cmd);
        LOGGER.debug("MediaToolkit STAGE label={} out={}", label, out.getFileName());
        return out;
    }

    private static void writeConcatList(Path listFile, List<Path> entries) {
        StringBuilder sb = new StringBuilder();
        for (Path p : entries) {
            sb.append("file '")
              .append(p.toAbsolutePath().toString().replace("'", "'\\''"))
              .append("'\n");
        }
        try {
            Files.writeString(listFile, sb.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to write concat list " + listFile, e);
        }
    }
}
