package fun.ai.indexer.launcher;

import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.AppLaunchException;
import fun.ai.indexer.support.FakeAppMain;
import fun.ai.indexer.support.TestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ForegroundSupervisorTest {

    @TempDir
    Path tmp;

    private IndexerProperties props;
    private ForegroundSupervisor supervisor;
    private final PortAllocator ports = new PortAllocator();

    @BeforeEach
    void setUp() {
        props = TestSupport.props(tmp);
        supervisor = new ForegroundSupervisor(new AppProcessLauncher(props), new ProcessTerminator(props),
                props, TestSupport.NO_PAUSE);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    @Test
    void testLaunchAndStop() throws Exception {
        int port = ports.allocate();
        Path script = TestSupport.write(tmp.resolve("one/app.py"), TestSupport.flaskApp(port));

        String url = supervisor.launch(script, port);
        assertEquals("http://localhost:" + port, url);
        assertTrue(TestSupport.awaitListening(port, Duration.ofSeconds(20)));
        RunningApp app = supervisor.status().orElseThrow();
        assertEquals(script.toAbsolutePath().normalize(), app.getScriptPath());

        StopResult r = supervisor.stop();
        assertEquals(TerminationOutcome.STOPPED, r.getOutcome());
        assertFalse(app.getProcess().isAlive());
        assertTrue(supervisor.status().isEmpty());
        assertEquals(TerminationOutcome.NOT_RUNNING, supervisor.stop().getOutcome());
    }

    @Test
    void testRelaunchSameAppReusesProcess() throws Exception {
        int port = ports.allocate();
        Path script = TestSupport.write(tmp.resolve("one/app.py"), TestSupport.flaskApp(port));

        supervisor.launch(script, port);
        long pid = supervisor.status().orElseThrow().getProcess().pid();
        supervisor.launch(script, port);
        assertEquals(pid, supervisor.status().orElseThrow().getProcess().pid());
    }

    @Test
    void testLaunchingAnotherAppReplacesTheFirst() throws Exception {
        int port = ports.allocate();
        Path first = TestSupport.write(tmp.resolve("one/app.py"), TestSupport.flaskApp(port));
        Path second = TestSupport.write(tmp.resolve("two/app.py"), TestSupport.flaskApp(port));

        supervisor.launch(first, port);
        assertTrue(TestSupport.awaitListening(port, Duration.ofSeconds(20)));
        Process firstProcess = supervisor.status().orElseThrow().getProcess();

        // 同一端口：第一个进程必须先退出，第二个才能绑定
        supervisor.launch(second, port);
        assertFalse(firstProcess.isAlive());
        assertTrue(TestSupport.awaitListening(port, Duration.ofSeconds(20)));
        RunningApp now = supervisor.status().orElseThrow();
        assertEquals(second.toAbsolutePath().normalize(), now.getScriptPath());
        assertTrue(now.isAlive());
    }

    @Test
    void testMissingFileFailsWithoutTouchingCurrent() throws Exception {
        int port = ports.allocate();
        Path script = TestSupport.write(tmp.resolve("one/app.py"), TestSupport.flaskApp(port));
        supervisor.launch(script, port);

        assertThrows(AppLaunchException.class, () -> supervisor.launch(tmp.resolve("missing.py"), port));
        assertTrue(supervisor.status().isPresent());
    }

    @Test
    void testSpawnFailureLeavesSlotEmpty() throws Exception {
        int port = ports.allocate();
        Path script = TestSupport.write(tmp.resolve("one/app.py"), TestSupport.flaskApp(port));
        supervisor.launch(script, port);
        Process old = supervisor.status().orElseThrow().getProcess();

        props.setInterpreterCommand(java.util.List.of(tmp.resolve("no-such-interpreter").toString()));
        Path other = TestSupport.write(tmp.resolve("two/app.py"), TestSupport.flaskApp(port));
        assertThrows(AppLaunchException.class, () -> supervisor.launch(other, port));

        assertFalse(old.isAlive());
        assertTrue(supervisor.status().isEmpty());
    }

    @Test
    void testLaunchFailsWhenPortIsHeldByAnotherProcess() throws Exception {
        props.setForegroundSettle(Duration.ofSeconds(6));
        ForegroundSupervisor settling = new ForegroundSupervisor(new AppProcessLauncher(props),
                new ProcessTerminator(props), props, Pause.threadSleep());
        int port = ports.allocate();
        Path script = TestSupport.write(tmp.resolve("one/app.py"), TestSupport.flaskApp(port));

        try (ServerSocket holder = new ServerSocket(port, 50, InetAddress.getByName("127.0.0.1"))) {
            AppLaunchException e = assertThrows(AppLaunchException.class, () -> settling.launch(script, port));
            assertTrue(e.getMessage().contains("exited during startup"), e.getMessage());
            assertTrue(settling.status().isEmpty());
        } finally {
            settling.shutdown();
        }
    }

    @Test
    void testEarlyExitReportsExitCodeAndEmptiesSlot() throws Exception {
        props.setForegroundSettle(Duration.ofSeconds(6));
        ForegroundSupervisor settling = new ForegroundSupervisor(new AppProcessLauncher(props),
                new ProcessTerminator(props), props, Pause.threadSleep());
        int port = ports.allocate();
        Path script = TestSupport.write(tmp.resolve("broken/app.py"),
                "# " + FakeAppMain.EXIT_EARLY + "\n" + TestSupport.flaskApp(port));

        try {
            AppLaunchException e = assertThrows(AppLaunchException.class, () -> settling.launch(script, port));
            assertTrue(e.getMessage().contains("exit code 3"), e.getMessage());
            assertTrue(settling.status().isEmpty());
            assertEquals(TerminationOutcome.NOT_RUNNING, settling.stop().getOutcome());
        } finally {
            settling.shutdown();
        }
    }

    @Test
    void testStatusIsNotHeldByReplacementTeardown() throws Exception {
        int firstPort = ports.allocate();
        Path stubborn = TestSupport.write(tmp.resolve("stubborn/app.py"),
                "# " + FakeAppMain.IGNORE_TERM + "\n" + TestSupport.flaskApp(firstPort));
        supervisor.launch(stubborn, firstPort);
        assertTrue(TestSupport.awaitListening(firstPort, Duration.ofSeconds(20)));
        Process old = supervisor.status().orElseThrow().getProcess();

        int secondPort = ports.allocate();
        Path next = TestSupport.write(tmp.resolve("next/app.py"), TestSupport.flaskApp(secondPort));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> replacing = pool.submit(() -> supervisor.launch(next, secondPort));
            Thread.sleep(500);
            assertFalse(replacing.isDone());

            // 旧进程仍在 terminate-grace 窗口内，status() 不应等待
            long start = System.nanoTime();
            supervisor.status();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(elapsedMs < 500, "status() took " + elapsedMs + "ms");

            assertEquals("http://localhost:" + secondPort, replacing.get(30, TimeUnit.SECONDS));
            assertFalse(old.isAlive());
            assertEquals(next.toAbsolutePath().normalize(), supervisor.status().orElseThrow().getScriptPath());
        } finally {
            pool.shutdownNow();
        }
    }
}
