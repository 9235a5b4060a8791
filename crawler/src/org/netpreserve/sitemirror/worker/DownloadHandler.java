package org.netpreserve.sitemirror.worker;

import org.netpreserve.sitemirror.blockid.BlockIdExtractor;
import org.netpreserve.sitemirror.blockid.BlockIdMapper;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.ipc.DownloadReport;
import org.netpreserve.sitemirror.ipc.ErrorInfo;
import org.netpreserve.sitemirror.ipc.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Renders one page and saves it with its block-ID sidecar. Task failures become error results; they
 * never take the worker down.
 */
public class DownloadHandler {
    private static final Logger log = LoggerFactory.getLogger(DownloadHandler.class);
    private final BlockIdExtractor extractor;
    private final BlockIdMapper mapper;

    public DownloadHandler() {
        this(new BlockIdExtractor(), new BlockIdMapper());
    }

    public DownloadHandler(BlockIdExtractor extractor, BlockIdMapper mapper) {
        this.extractor = extractor;
        this.mapper = mapper;
    }

    public Message.Result handle(Message.Download download, PageRenderer renderer, List<Cookie> sessionCookies)
            throws InterruptedException {
        log.atInfo().addKeyValue("taskId", download.taskId()).addKeyValue("pageId", download.pageId())
                .log("Downloading {}", download.url());
        try {
            var cookies = mergeCookies(sessionCookies, download.cookies());
            if (!cookies.isEmpty()) renderer.setCookies(cookies);

            RenderedPage page = renderer.render(download.url());
            Path savePath = Path.of(download.savePath());
            Files.createDirectories(savePath.getParent());
            byte[] bytes = page.html().getBytes(UTF_8);
            Files.write(savePath, bytes);

            Map<String, String> blockIds = extractor.extract(page.html());
            try {
                mapper.save(savePath.getParent(), blockIds);
            } catch (IOException e) {
                log.warn("Failed to save block map for {}: {}", download.pageId(), e.getMessage());
            }

            log.info("Saved {} to {} ({} bytes, {} block IDs)", download.url(), savePath, bytes.length, blockIds.size());
            return Message.Result.success(download.taskId(),
                    new DownloadReport(download.pageId(), savePath.toString(), bytes.length, blockIds.size()));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Download of {} failed", download.url(), e);
            return Message.Result.failure(download.taskId(), ErrorInfo.of(e));
        }
    }

    /**
     * Task cookies override session cookies with the same name, domain and path.
     */
    static List<Cookie> mergeCookies(List<Cookie> session, List<Cookie> task) {
        var merged = new LinkedHashMap<String, Cookie>();
        for (Cookie cookie : session) merged.put(key(cookie), cookie);
        for (Cookie cookie : task) merged.put(key(cookie), cookie);
        return new ArrayList<>(merged.values());
    }

    private static String key(Cookie cookie) {
        return cookie.name() + ";" + cookie.domain() + ";" + cookie.path();
    }
}
