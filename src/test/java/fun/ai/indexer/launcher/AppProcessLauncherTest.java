package fun.ai.indexer.launcher;

import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.AppLaunchException;
import fun.ai.indexer.support.FakeAppMain;
import fun.ai.indexer.support.TestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AppProcessLauncherTest {

    @TempDir
    Path tmp;

    private IndexerProperties props;
    private AppProcessLauncher launcher;

    @BeforeEach
    void setUp() {
        props = TestSupport.props(tmp);
        launcher = new AppProcessLauncher(props);
    }

    @AfterEach
    void tearDown() {
        launcher.shutdown();
    }

    @Test
    void testNoSpawnAfterShutdown() throws Exception {
        Path script = TestSupport.write(tmp.resolve("app.py"), TestSupport.flaskApp(5077));
        launcher.shutdown();

        AppLaunchException e = assertThrows(AppLaunchException.class, () -> launcher.spawnForCapture(script, 5077));
        assertTrue(e.getMessage().contains("shut down"));
        assertThrows(AppLaunchException.class, () -> launcher.spawnForeground(script, 5077));
    }

    @Test
    void testEnvironmentIsReducedToAllowList() {
        props.setInterpreterPath("/opt/libs");
        Map<String, String> env = new HashMap<>();
        env.put("SECRET_TOKEN", "x");
        env.put("PORT", "1");

        launcher.buildEnvironment(env, 5055);

        assertFalse(env.containsKey("SECRET_TOKEN"));
        assertEquals("5055", env.get("PORT"));
        assertEquals("/opt/libs", env.get("PYTHONPATH"));
        assertEquals("0", env.get("FLASK_DEBUG"));
    }

    @Test
    void testCaptureKeepsOutputOfEarlyExit() throws Exception {
        Path script = TestSupport.write(tmp.resolve("apps/broken.py"), "# " + FakeAppMain.EXIT_EARLY + "\napp.run()\n");

        CapturedProcess proc = launcher.spawnForCapture(script, new PortAllocator().allocate());
        assertTrue(proc.getProcess().waitFor(30, TimeUnit.SECONDS));

        assertFalse(proc.isAlive());
        assertEquals(3, proc.getProcess().exitValue());
        assertTrue(proc.drainOutput().contains(FakeAppMain.EARLY_EXIT_MESSAGE));
        // 工作目录固定为 scratch 目录
        assertTrue(Files.isDirectory(tmp.resolve("debris")));
    }

    @Test
    void testMissingScriptIsRejected() {
        AppLaunchException e = assertThrows(AppLaunchException.class,
                () -> launcher.spawnForeground(tmp.resolve("nope.py"), 5000));
        assertEquals("LAUNCH_ERR", e.getErrorCode());
    }
}
