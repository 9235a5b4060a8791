package org.netpreserve.sitemirror;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import org.netpreserve.sitemirror.cdp.protocol.CdpConnection;
import org.netpreserve.sitemirror.config.ConfigLoader;
import org.netpreserve.sitemirror.config.MirrorConfig;
import org.netpreserve.sitemirror.ui.ConfirmationPrompt;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public class SiteMirror {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(SiteMirror.class);

    public static void main(String[] args) throws Exception {
        Url rootUrl = null;
        Path outputDir = null;
        Integer depth = null;
        Integer workers = null;
        Path configFile = null;
        boolean dryRun = false;
        boolean assumeYes = false;
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> configFile = Path.of(args[++i]);
                case "--depth", "-d" -> depth = Integer.parseInt(args[++i]);
                case "--dry-run" -> dryRun = true;
                case "--dump-config" -> dumpConfig = true;
                case "--output", "-o" -> outputDir = Path.of(args[++i]);
                case "--trace-cdp" -> startCdpTraceFile(args[++i]);
                case "--workers", "-w" -> workers = Integer.parseInt(args[++i]);
                case "--yes", "-y" -> assumeYes = true;
                case "--help", "-h" -> {
                    System.out.println("Usage: sitemirror [options] URL");
                    System.out.println("Options:");
                    System.out.println("      --config FILE        YAML file merged over the defaults");
                    System.out.println("  -d, --depth N            Maximum discovery depth");
                    System.out.println("      --dry-run            Discover and print the tree, but download nothing");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -h, --help");
                    System.out.println("  -o, --output DIR         Directory to write the mirror to");
                    System.out.println("      --trace-cdp <file>   Write CDP trace to file");
                    System.out.println("  -w, --workers N          Number of download workers");
                    System.out.println("  -y, --yes                Don't ask before downloading");
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    if (rootUrl != null) {
                        System.err.println("Only one URL may be given");
                        System.exit(1);
                    }
                    rootUrl = new Url(args[i]);
                }
            }
        }

        var loader = new ConfigLoader();
        MirrorConfig config = loader.load(configFile);
        if (rootUrl != null) config = config.withRootUrl(rootUrl);
        if (outputDir != null) config = config.withOutputDir(outputDir);
        if (depth != null) config = config.withDiscovery(config.discovery().withMaxDepth(depth));
        if (workers != null) config = config.withPool(config.pool().withWorkers(workers));
        if (dumpConfig) {
            System.out.println(loader.dump(config));
            System.exit(0);
        }
        if (config.rootUrl() == null) {
            System.err.println("No URL given. Try --help.");
            System.exit(1);
        }

        int status;
        try (var mirror = new Mirror(config, assumeYes ? null : ConfirmationPrompt.console(), System.out)) {
            MirrorResult result = mirror.run(dryRun);
            status = result.hasFailures() ? 2 : 0;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            status = 1;
        } catch (Exception e) {
            log.error("Mirror failed", e);
            status = 1;
        }
        System.exit(status);
    }

    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("cdp-trace-file");
        fileAppender.setFile(file);
        fileAppender.start();

        var logger = (Logger) LoggerFactory.getLogger(CdpConnection.class);
        logger.addAppender(fileAppender);
        if (logger.getEffectiveLevel().toInt() != Level.TRACE_INT) {
            // keep the console at its previous level while the file gets everything
            var filter = new ThresholdFilter();
            filter.setLevel(logger.getEffectiveLevel().toString());
            filter.start();
            var stderrAppender = (ConsoleAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .getAppender("STDERR");
            if (stderrAppender != null) {
                stderrAppender.stop();
                stderrAppender.addFilter(filter);
                stderrAppender.start();
            }
            logger.setLevel(Level.TRACE);
        }
    }
}
