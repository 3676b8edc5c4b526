package com.plotline.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Renders templates with an external command line tool (Quarto by default), invoked as
 * {@code <exe> render <absolute template> --output-dir <absolute dir>}. Success means exit code 0
 * and {@code <dir>/<template base name>.html} on disk. Tool output is captured to a temporary file
 * and logged at debug level.
 */
public final class ProcessReportRenderer implements ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(ProcessReportRenderer.class);

    public static final String DEFAULT_EXECUTABLE = "quarto";
    public static final String OUTPUT_EXTENSION = ".html";
    private static final int TAIL_LINES = 5;

    private final String executable;
    private final Duration timeout;
    private final String pathEnv;

    public ProcessReportRenderer(String executable, Duration timeout) {
        this(executable, timeout, System.getenv("PATH"));
    }

    ProcessReportRenderer(String executable, Duration timeout, String pathEnv) {
        this.executable = executable != null && !executable.isBlank() ? executable.trim() : DEFAULT_EXECUTABLE;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.pathEnv = pathEnv;
    }

    @Override
    public boolean isAvailable() {
        return resolveExecutable() != null;
    }

    @Override
    public String name() {
        return executable;
    }

    /**
     * The executable as an explicit path, or found on {@code PATH}; null when not found.
     */
    Path resolveExecutable() {
        if (executable.contains("/") || executable.contains(File.separator)) {
            Path p = Paths.get(executable);
            return Files.isRegularFile(p) && Files.isExecutable(p) ? p.toAbsolutePath() : null;
        }
        if (pathEnv == null || pathEnv.isBlank()) {
            return null;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            for (String name : List.of(executable, executable + ".exe", executable + ".cmd")) {
                Path candidate = Paths.get(dir, name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    @Override
    public Path render(Path template, Path outputDir) {
        Path exe = resolveExecutable();
        if (exe == null) {
            throw new ReportRenderException("Report tool not found: " + executable, template);
        }
        Path templateAbs = template.toAbsolutePath().normalize();
        if (!Files.isRegularFile(templateAbs)) {
            throw new ReportRenderException("Report template not found: " + templateAbs, template);
        }
        Path outAbs = outputDir.toAbsolutePath().normalize();
        Path expected = outAbs.resolve(baseName(templateAbs) + OUTPUT_EXTENSION);

        Path capture = null;
        try {
            Files.createDirectories(outAbs);
            // a stale file from an earlier run must not count as this run's output
            Files.deleteIfExists(expected);
            capture = Files.createTempFile("plotline-render-", ".log");
            ProcessBuilder pb = new ProcessBuilder(exe.toString(), "render", templateAbs.toString(),
                    "--output-dir", outAbs.toString())
                    .redirectErrorStream(true)
                    .redirectOutput(capture.toFile());
            log.info("Rendering report {} -> {}", templateAbs.getFileName(), outAbs);
            Process process = pb.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ReportRenderException("Rendering " + templateAbs.getFileName() + " timed out after "
                        + timeout.toSeconds() + " s", template);
            }
            List<String> output = new String(Files.readAllBytes(capture), StandardCharsets.UTF_8).lines().toList();
            output.forEach(line -> log.debug("[{}] {}", executable, line));
            int exit = process.exitValue();
            if (exit != 0) {
                throw new ReportRenderException("Rendering " + templateAbs.getFileName() + " exited with code "
                        + exit + tail(output), template);
            }
            if (!Files.isRegularFile(expected)) {
                throw new ReportRenderException("Rendering " + templateAbs.getFileName()
                        + " produced no " + expected.getFileName(), template);
            }
            return expected;
        } catch (IOException e) {
            throw new ReportRenderException("Cannot run " + executable + ": " + e.getMessage(), template, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReportRenderException("Interrupted while rendering " + templateAbs.getFileName(), template, e);
        } finally {
            deleteQuietly(capture);
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String tail(List<String> output) {
        if (output.isEmpty()) return "";
        List<String> last = output.subList(Math.max(0, output.size() - TAIL_LINES), output.size());
        return ": " + String.join(" | ", last);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete render log {}: {}", file, e.getMessage());
        }
    }
}
