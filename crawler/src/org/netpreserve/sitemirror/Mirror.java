package org.netpreserve.sitemirror;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.browser.BrowserPageProber;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.config.MirrorConfig;
import org.netpreserve.sitemirror.discovery.Discovery;
import org.netpreserve.sitemirror.discovery.DiscoveryResult;
import org.netpreserve.sitemirror.discovery.PageProber;
import org.netpreserve.sitemirror.discovery.SiteScope;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.ipc.Message;
import org.netpreserve.sitemirror.path.FilesystemResolver;
import org.netpreserve.sitemirror.pool.Execution;
import org.netpreserve.sitemirror.pool.ExecutionPlan;
import org.netpreserve.sitemirror.pool.ExecutionReport;
import org.netpreserve.sitemirror.pool.JvmWorkerLauncher;
import org.netpreserve.sitemirror.pool.WorkerLauncher;
import org.netpreserve.sitemirror.rewrite.AuditReport;
import org.netpreserve.sitemirror.rewrite.IntegrityAuditor;
import org.netpreserve.sitemirror.rewrite.LinkRewriter;
import org.netpreserve.sitemirror.rewrite.RewriteReport;
import org.netpreserve.sitemirror.ui.ConfirmationPrompt;
import org.netpreserve.sitemirror.ui.PageTreeRenderer;
import org.netpreserve.sitemirror.ui.ProgressReporter;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One mirror run: discover the site with a shared browser, let the user confirm the tree, download
 * every page with the worker pool, rewrite the links in the saved pages and audit the result.
 */
public class Mirror implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Mirror.class);
    public static final String GRAPH_FILE = "site-graph.json";
    private final MirrorConfig config;
    private final ProberFactory proberFactory;
    private final WorkerLauncher launcher;
    private final @Nullable ConfirmationPrompt prompt;
    private final PrintStream out;
    private final ProgressReporter progress;
    private @Nullable PageProber prober;

    public interface ProberFactory {
        PageProber open(MirrorConfig config) throws IOException;
    }

    /**
     * Runs against a real browser, with workers in child JVMs.
     *
     * @param prompt asks before downloading, or null to proceed without asking
     */
    public Mirror(MirrorConfig config, @Nullable ConfirmationPrompt prompt, PrintStream out) {
        this(config, c -> BrowserPageProber.start(c.browser(), c.discovery().probeTimeout()),
                new JvmWorkerLauncher(), prompt, out);
    }

    public Mirror(MirrorConfig config, ProberFactory proberFactory, WorkerLauncher launcher,
                  @Nullable ConfirmationPrompt prompt, PrintStream out) {
        if (config.rootUrl() == null) throw new IllegalArgumentException("No root URL configured");
        if (!config.rootUrl().isHttp() || !config.rootUrl().isValid()) {
            throw new IllegalArgumentException("Root URL must be an absolute http(s) URL: " + config.rootUrl());
        }
        this.config = config;
        this.proberFactory = proberFactory;
        this.launcher = launcher;
        this.prompt = prompt;
        this.out = out;
        this.progress = new ProgressReporter(out);
    }

    public MirrorResult run() throws IOException, InterruptedException {
        return run(false);
    }

    /**
     * @param dryRun stop after discovery, having printed the tree and saved the graph
     */
    public MirrorResult run(boolean dryRun) throws IOException, InterruptedException {
        Url rootUrl = config.rootUrl();
        Path outputDir = config.outputDir().toAbsolutePath().normalize();

        log.info("Starting browser for discovery");
        prober = proberFactory.open(config);
        var discovery = new Discovery(prober, new SiteScope(rootUrl, config.scope()), progress);
        DiscoveryResult result = discovery.discover(rootUrl, config.discovery().maxDepth());
        List<Cookie> cookies = prober.cookies();
        closeProber();

        PageGraph graph = result.graph();
        var treeRenderer = new PageTreeRenderer();
        out.print(treeRenderer.render(graph));
        if (result.isEmpty()) {
            log.warn("Nothing to mirror: {} could not be loaded ({})", rootUrl, graph.root().probeError());
            return new MirrorResult(MirrorResult.Outcome.EMPTY, result, null, null, null);
        }

        Files.createDirectories(outputDir);
        graph.write(outputDir.resolve(GRAPH_FILE));
        if (dryRun) {
            log.info("Dry run, wrote {}", outputDir.resolve(GRAPH_FILE));
            return new MirrorResult(MirrorResult.Outcome.DRY_RUN, result, null, null, null);
        }

        if (prompt != null && !prompt.confirm("Download " + graph.size() + " pages to " + outputDir + "?")) {
            log.info("Download declined");
            return new MirrorResult(MirrorResult.Outcome.DECLINED, result, null, null, null);
        }
        result.confirm();

        var filesystem = new FilesystemResolver(outputDir);
        var plan = ExecutionPlan.from(result, filesystem);
        progress.executionStarted(plan.size());
        var execution = new Execution(launcher, config.pool(), this::initMessage, progress);
        ExecutionReport executionReport = execution.run(plan, cookies);

        RewriteReport rewriteReport = new LinkRewriter(graph, filesystem).rewriteAll();
        AuditReport auditReport = new IntegrityAuditor(graph, filesystem).audit(executionReport.completed().keySet());

        out.printf("Saved %d of %d pages to %s (%d failed, %d retries, %d worker crashes), rewrote %d links%n",
                executionReport.completed().size(), plan.size(), outputDir, executionReport.failed().size(),
                executionReport.retries(), executionReport.crashes(), rewriteReport.linksRewritten());
        executionReport.failed().forEach((pageId, error) ->
                out.printf("  failed %s: %s: %s%n", pageId, error.type(), error.message()));
        out.printf("Integrity audit: %d missing documents, %d live site links, %d external stylesheets%n",
                auditReport.missingFiles(), auditReport.residualLiveLinks(), auditReport.externalStylesheets());
        return new MirrorResult(MirrorResult.Outcome.COMPLETED, result, executionReport, rewriteReport, auditReport);
    }

    private Message.Init initMessage(String workerId) {
        return new Message.Init(workerId, config.browser().executable(), config.browser().options(),
                config.discovery().probeTimeout().toMillis());
    }

    private void closeProber() {
        if (prober != null) {
            prober.close();
            prober = null;
        }
    }

    @Override
    public void close() {
        closeProber();
    }
}
