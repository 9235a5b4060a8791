package org.netpreserve.sitemirror.pool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sitemirror.ipc.Message;
import org.netpreserve.sitemirror.util.Url;
import org.netpreserve.sitemirror.worker.ScriptedSite;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class WorkerProxyTest {
    private static final String PAGE = "https://site.test/page";
    private final WorkerProxy.Events events = mock(WorkerProxy.Events.class);
    private WorkerProxy worker;

    @TempDir
    Path outputDir;

    @AfterEach
    public void tearDown() throws InterruptedException {
        if (worker != null) worker.kill();
    }

    private WorkerProxy start(ScriptedSite site) throws Exception {
        worker = new WorkerProxy("w1", new FakeWorkerProcess("w1", site.factory()), events);
        worker.init(new Message.Init("w1", null, List.of(), 5000));
        verify(events, timeout(5000)).onReady(eq(worker), any());
        return worker;
    }

    private DownloadTask task() {
        return new DownloadTask("page", new Url(PAGE), outputDir.resolve("Page/index.html"), 1);
    }

    @Test
    public void testReadyThenIdle() throws Exception {
        start(new ScriptedSite());
        verify(events).onReady(worker, new Message.Ready("w1", "Scripted/1.0"));
        assertEquals(WorkerState.IDLE, worker.state());
    }

    @Test
    public void testDispatchOnlyWhenIdle() throws Exception {
        var process = new FakeWorkerProcess("w1", new ScriptedSite().factory());
        worker = new WorkerProxy("w1", process, events);
        assertEquals(WorkerState.INITIALIZING, worker.state());
        assertThrows(IllegalStateException.class, () -> worker.dispatch(task(), List.of()));
    }

    @Test
    public void testResultReturnsWorkerToIdle() throws Exception {
        start(new ScriptedSite().page(PAGE, ScriptedSite.html("Page", "")));
        var task = task();
        String taskId = worker.dispatch(task, List.of());
        assertTrue(taskId.startsWith("w1-"), taskId);

        verify(events, timeout(5000)).onResult(eq(worker), eq(task), argThat(Message.Result::isSuccess));
        assertEquals(WorkerState.IDLE, worker.state());
        assertNull(worker.currentTask());
        assertEquals(Duration.ZERO, worker.busyFor());

        String secondId = worker.dispatch(task, List.of());
        assertNotEquals(taskId, secondId);
    }

    @Test
    public void testCrashReportedOnceWithLostTask() throws Exception {
        start(new ScriptedSite().page(PAGE, ScriptedSite.crashing(1, "")));
        var task = task();
        worker.dispatch(task, List.of());

        verify(events, timeout(5000)).onCrash(eq(worker), eq(task), any());
        verify(events, after(300).times(1)).onCrash(any(), any(), any());
        assertEquals(WorkerState.CRASHED, worker.state());
        assertThrows(IllegalStateException.class, () -> worker.dispatch(task, List.of()));
    }

    @Test
    public void testWorkerThatHangsUpImmediatelyIsClosedAndReportedOnce() throws Exception {
        var process = mock(Process.class);
        var stdin = spy(new ByteArrayOutputStream());
        when(process.getInputStream()).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(process.getErrorStream()).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(process.getOutputStream()).thenReturn(stdin);
        when(process.onExit()).thenReturn(new CompletableFuture<>());

        var proxy = new WorkerProxy("w9", process, events);

        verify(events, timeout(5000)).onCrash(proxy, null, "worker closed its channel");
        verify(stdin, timeout(5000)).close();
        verify(events, after(300).times(1)).onCrash(any(), any(), any());
        assertEquals(WorkerState.CRASHED, proxy.state());
    }

    @Test
    public void testExplicitCrashKillsProcess() throws Exception {
        start(new ScriptedSite());
        worker.crash("task timed out");

        verify(events).onCrash(worker, null, "task timed out");
        assertTrue(worker.awaitExit(Duration.ofSeconds(5)));
        assertFalse(worker.isAlive());
    }

    @Test
    public void testShutdownIsNotACrash() throws Exception {
        start(new ScriptedSite());
        worker.shutdown();

        assertTrue(worker.awaitExit(Duration.ofSeconds(5)));
        verify(events, after(300).never()).onCrash(any(), any(), any());
    }
}
