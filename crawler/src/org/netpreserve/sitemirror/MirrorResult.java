package org.netpreserve.sitemirror;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.discovery.DiscoveryResult;
import org.netpreserve.sitemirror.pool.ExecutionReport;
import org.netpreserve.sitemirror.rewrite.AuditReport;
import org.netpreserve.sitemirror.rewrite.RewriteReport;

/**
 * How a run ended and what each phase reported. Phases that didn't run report null.
 */
public record MirrorResult(Outcome outcome, DiscoveryResult discovery, @Nullable ExecutionReport execution,
                           @Nullable RewriteReport rewrite, @Nullable AuditReport audit) {

    public enum Outcome {
        /**
         * The root page couldn't be probed.
         */
        EMPTY,
        DRY_RUN,
        DECLINED,
        COMPLETED
    }

    public boolean hasFailures() {
        return (execution != null && !execution.failed().isEmpty())
               || (rewrite != null && !rewrite.failed().isEmpty());
    }
}
