package github.sarthakdev143.reel_factory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * External tool locations, directories and encode policy for the render pipeline.
 */
@ConfigurationProperties(prefix = "reel-factory.render")
public class RenderProperties {

    private String ffmpegPath = "ffmpeg";
    private String ffprobePath = "ffprobe";
    private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "reel-factory", "work");
    private Path outputDir = Path.of(System.getProperty("java.io.tmpdir"), "reel-factory", "output");
    private Duration processTimeout = Duration.ofMinutes(30);
    private Duration statusRetention = Duration.ofHours(1);
    private List<String> videoEncoders = new ArrayList<>(List.of("libx264", "libopenh264"));
    private int videoBitrateKbps = 3500;
    private int audioBitrateKbps = 192;
    private int normalizeFrameRate = 30;
    private int audioSampleRate = 44100;
    private List<String> fontPaths = new ArrayList<>();

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public String getFfprobePath() {
        return ffprobePath;
    }

    public void setFfprobePath(String ffprobePath) {
        this.ffprobePath = ffprobePath;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public void setWorkDir(Path workDir) {
        this.workDir = workDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Duration getProcessTimeout() {
        return processTimeout;
    }

    public void setProcessTimeout(Duration processTimeout) {
        this.processTimeout = processTimeout;
    }

    public Duration getStatusRetention() {
        return statusRetention;
    }

    public void setStatusRetention(Duration statusRetention) {
        this.statusRetention = statusRetention;
    }

    public List<String> getVideoEncoders() {
        return videoEncoders;
    }

    public void setVideoEncoders(List<String> videoEncoders) {
        this.videoEncoders = videoEncoders;
    }

    public int getVideoBitrateKbps() {
        return videoBitrateKbps;
    }

    public void setVideoBitrateKbps(int videoBitrateKbps) {
        this.videoBitrateKbps = videoBitrateKbps;
    }

    public int getAudioBitrateKbps() {
        return audioBitrateKbps;
    }

    public void setAudioBitrateKbps(int audioBitrateKbps) {
        this.audioBitrateKbps = audioBitrateKbps;
    }

    public int getNormalizeFrameRate() {
        return normalizeFrameRate;
    }

    public void setNormalizeFrameRate(int normalizeFrameRate) {
        this.normalizeFrameRate = normalizeFrameRate;
    }

    public int getAudioSampleRate() {
        return audioSampleRate;
    }

    public void setAudioSampleRate(int audioSampleRate) {
        this.audioSampleRate = audioSampleRate;
    }

    public List<String> getFontPaths() {
        return fontPaths;
    }

    public void setFontPaths(List<String> fontPaths) {
        this.fontPaths = fontPaths;
    }
}
