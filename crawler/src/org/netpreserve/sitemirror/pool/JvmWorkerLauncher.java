package org.netpreserve.sitemirror.pool;

import org.netpreserve.sitemirror.worker.WorkerMain;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs each worker as a child JVM on this JVM's classpath.
 */
public class JvmWorkerLauncher implements WorkerLauncher {
    /**
     * Worker log lines are re-logged by the pool, so workers use a pattern without timestamps.
     */
    static final String WORKER_LOGBACK_CONFIG = "logback-worker.xml";
    private final List<String> jvmOptions;

    public JvmWorkerLauncher() {
        this(List.of());
    }

    public JvmWorkerLauncher(List<String> jvmOptions) {
        this.jvmOptions = List.copyOf(jvmOptions);
    }

    @Override
    public Process launch(String workerId) throws IOException {
        var command = new ArrayList<String>();
        command.add(javaExecutable());
        command.add("-Dlogback.configurationFile=" + WORKER_LOGBACK_CONFIG);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(WorkerMain.class.getName());
        command.add(workerId);
        return new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE)
                .start();
    }

    static String javaExecutable() {
        Path java = Path.of(System.getProperty("java.home"), "bin", "java");
        if (Files.isExecutable(java)) return java.toString();
        return ProcessHandle.current().info().command().orElse("java");
    }
}
