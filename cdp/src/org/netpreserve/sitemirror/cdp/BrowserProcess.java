package org.netpreserve.sitemirror.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.cdp.protocol.CDPClosedException;
import org.netpreserve.sitemirror.cdp.protocol.CdpConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static java.lang.ProcessBuilder.Redirect.*;
import static java.util.stream.Collectors.joining;

/**
 * Launches and manages a browser process controlled via CDP.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 *
 * try (BrowserProcess browserProcess = BrowserProcess.start(null, List.of("--headless=new"), null);
 *      BrowserTab tab = browserProcess.newTab()) {
 *     tab.navigate(new Url("http://example.com/"), Duration.ofSeconds(60));
 *     String title = tab.title();
 * }
 * }</pre>
 */
public class BrowserProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium",
            "chromium-browser",
            "google-chrome",
            "google-chrome-stable",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome");
    private static final Path SHELL = Path.of("/bin/sh");

    private final Process process;
    private final CdpConnection cdp;
    private String version;

    private BrowserProcess(Process process, CdpConnection cdp) {
        this.process = process;
        this.cdp = cdp;
    }

    /**
     * Starts a browser in pipe mode.
     *
     * @param executable browser binary, or null to probe the usual locations
     * @param options    extra command-line options (e.g. --headless=new)
     * @param profileDir user data directory, or null for a throwaway one deleted on exit
     */
    public static BrowserProcess start(@Nullable String executable, @Nullable List<String> options,
                                       @Nullable Path profileDir) throws IOException {
        if (!Files.isExecutable(SHELL)) {
            throw new IOException("Pipe mode requires " + SHELL + " to set up the CDP file descriptors");
        }
        boolean deleteProfileOnExit = false;
        if (profileDir == null) {
            profileDir = Path.of(System.getProperty("java.io.tmpdir"), "sitemirror-" + UUID.randomUUID());
            deleteProfileOnExit = true;
        }
        if (executable == null) {
            executable = probeForExecutable();
        }
        var command = new ArrayList<>(List.of(executable,
                "--remote-debugging-pipe",
                "--no-default-browser-check",
                "--no-first-run",
                "--no-startup-window",
                "--disable-background-networking",
                "--disable-background-timer-throttling",
                "--disable-backgrounding-occluded-windows",
                "--disable-renderer-backgrounding",
                "--disable-sync",
                "--use-mock-keychain",
                "--user-data-dir=" + profileDir,
                "--disable-blink-features=AutomationControlled",
                "--window-size=1920,1080"));
        if (options != null) {
            command.addAll(options);
        }

        // In pipe mode the browser reads CDP from FD 3 and writes CDP to FD 4. Java can't redirect
        // arbitrary FDs so we hand the shell our stdin/stdout and let it move them into place.
        String escapedCommand = command.stream().map(BrowserProcess::singleQuote).collect(joining(" "));
        String cleanupTrap = "";
        if (deleteProfileOnExit) {
            if (profileDir.toString().equals("/")) throw new IOException("Refusing to delete /");
            cleanupTrap = "trap " + singleQuote("rm -rf " + singleQuote(profileDir.toString()) + " 2>/dev/null") + " EXIT && ";
        }
        Process process = new ProcessBuilder(SHELL.toString(), "-c",
                cleanupTrap + escapedCommand + " 3<&0 4>&1 0<&- 1>&2")
                .redirectError(INHERIT)
                .redirectOutput(PIPE)
                .redirectInput(PIPE)
                .start();
        log.info("Started browser {} (pid {})", executable, process.pid());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (process.waitFor(1, TimeUnit.SECONDS)) return;
                process.destroy();
                if (process.waitFor(10, TimeUnit.SECONDS)) return;
                process.destroyForcibly();
            } catch (InterruptedException e) {
                // just exit
            }
        }, "browser-shutdown-hook"));
        try {
            return new BrowserProcess(process, new CdpConnection(process.getInputStream(), process.getOutputStream()));
        } catch (RuntimeException e) {
            process.destroy();
            throw e;
        }
    }

    private static String singleQuote(String string) {
        return "'" + string.replace("'", "'\\''") + "'";
    }

    private static String probeForExecutable() throws IOException {
        String probe = BROWSER_EXECUTABLES.stream()
                .map(executable -> "command -v " + singleQuote(executable))
                .collect(joining(" || "));
        var process = new ProcessBuilder(SHELL.toString(), "-c", probe)
                .redirectError(INHERIT)
                .redirectOutput(PIPE)
                .start();
        var output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
        try {
            if (process.waitFor() > 0 || output.isEmpty()) {
                throw new IOException("Couldn't detect browser. Set browser.executable in the config");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while probing for a browser", e);
        }
        return output.lines().findFirst().orElse(output);
    }

    /**
     * Opens a new tab attached in flat session mode.
     */
    public BrowserTab newTab() {
        String targetId = cdp.send("Target.createTarget", Map.of("url", "about:blank"))
                .path("targetId").asText();
        String sessionId = cdp.send("Target.attachToTarget", Map.of("targetId", targetId, "flatten", true))
                .path("sessionId").asText();
        return new BrowserTab(cdp, sessionId, targetId);
    }

    public String version() {
        if (version == null) {
            version = cdp.send("Browser.getVersion", Map.of()).path("product").asText();
        }
        return version;
    }

    public boolean isAlive() {
        return process.isAlive() && !cdp.isClosed();
    }

    /**
     * Closes the connection to the browser and terminates the process.
     */
    @Override
    public void close() {
        // try a graceful close command first
        try {
            cdp.sendAsync(null, "Browser.close", Map.of());
            cdp.waitClose(Duration.ofMillis(1000));
        } catch (CDPClosedException e) {
            // browser's already gone. that's ok.
        } catch (Exception e) {
            log.warn("Error quitting browser", e);
        }
        cdp.close();
        // finally kill the process if it's still running
        process.destroy();
        try {
            process.waitFor(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted closing process", e);
            Thread.currentThread().interrupt();
        } finally {
            process.destroyForcibly();
        }
    }
}
