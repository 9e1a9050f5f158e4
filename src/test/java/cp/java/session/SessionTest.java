package cp.java.session;

import cp.java.github.FakeGitHubServer;
import cp.java.github.GitHubClient;
import cp.java.pool.ClientPool;
import cp.java.pool.NoUsableCredentialsException;
import cp.java.pool.PoolStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Session startup against an in-process GitHub API.
 *
 * Focus:
 * - Startup order and worker count resolution
 * - Pool built from validated tokens, skipped in local mode
 * - Fatal startup without usable tokens
 * - CSV sink lifecycle
 */
class SessionTest {

    private static final String GOOD_1 = "ghp_good_one_0000000000000000000000000";
    private static final String GOOD_2 = "ghp_good_two_0000000000000000000000000";
    private static final String REVOKED = "ghp_revoked_00000000000000000000000000";

    @TempDir
    Path tempDir;

    private FakeGitHubServer github;

    @BeforeEach
    void setUp() throws Exception {
        github = new FakeGitHubServer().validToken(GOOD_1).validToken(GOOD_2);
    }

    @AfterEach
    void tearDown() {
        github.close();
    }

    private SessionConfig.Builder remoteConfig(String... tokens) {
        return SessionConfig.builder()
            .githubAccessTokens(List.of(tokens))
            .apiBaseUrl(github.baseUri())
            .requestTimeout(Duration.ofSeconds(5))
            .pollInterval(Duration.ofMillis(50));
    }

    private static Session start(SessionConfig config) throws InterruptedException {
        Session session = Session.builder(config).configureLogging(false).build();
        session.start();
        return session;
    }

    @Test
    void testStart_buildsPoolFromValidTokensOnly() throws Exception {
        SessionConfig config = remoteConfig(GOOD_1, REVOKED, GOOD_2).threads(3).build();

        try (Session session = start(config)) {
            assertEquals(3, session.workerCount());
            ClientPool<GitHubClient> pool = session.pool().orElseThrow();
            // 2 valid tokens x (3 workers + 1)
            assertEquals(new PoolStats(8, 8, 0, 0), pool.stats());
            assertEquals(3, github.userRequests());
        }
    }

    @Test
    void testStart_pooledClientsReachTheApi() throws Exception {
        SessionConfig config = remoteConfig(GOOD_1).threads(2).build();

        try (Session session = start(config)) {
            ClientPool<GitHubClient> pool = session.pool().orElseThrow();

            String login = pool.withClient(GitHubClient::authenticatedUser);

            assertEquals("octocat", login);
            assertEquals("token " + GOOD_1, github.userRequestHeaders().get(1).get("Authorization"));
            assertEquals(Session.userAgent(), github.userRequestHeaders().get(1).get("User-Agent"));
        }
    }

    @Test
    void testStart_noValidTokenIsFatal() {
        SessionConfig config = remoteConfig(REVOKED).threads(2).build();
        Session session = Session.builder(config).configureLogging(false).build();

        assertThrows(NoUsableCredentialsException.class, session::start);
        assertTrue(session.pool().isEmpty());
    }

    @Test
    void testStart_noTokensConfiguredIsFatal() {
        SessionConfig config = remoteConfig().threads(1).build();

        assertThrows(NoUsableCredentialsException.class, () -> start(config));
        assertEquals(0, github.userRequests());
    }

    @Test
    void testStart_localModeSkipsPool() throws Exception {
        SessionConfig config = remoteConfig(REVOKED).threads(2).local(tempDir.toString()).build();

        try (Session session = start(config)) {
            assertTrue(session.pool().isEmpty());
            assertEquals(0, github.userRequests());
            assertEquals(2, session.workerCount());
        }
    }

    @Test
    void testStart_zeroThreadsUsesAvailableProcessors() throws Exception {
        SessionConfig config = remoteConfig(GOOD_1).threads(0).build();

        try (Session session = start(config)) {
            int cpus = Runtime.getRuntime().availableProcessors();
            assertEquals(cpus, session.workerCount());
            assertEquals(cpus + 1, session.pool().orElseThrow().totalHandles());
        }
    }

    @Test
    void testStart_signaturesLoadBeforePool() throws Exception {
        List<Integer> requestsSeenByLoader = new ArrayList<>();
        SessionConfig config = remoteConfig(GOOD_1).threads(1).build();

        Session session = Session.builder(config)
            .configureLogging(false)
            .signatureLoader(c -> {
                requestsSeenByLoader.add(github.userRequests());
                return 42;
            })
            .build();
        session.start();

        assertEquals(List.of(0), requestsSeenByLoader);
        assertEquals(42, session.signatureCount());
        assertEquals(1, github.userRequests());
        session.close();
    }

    @Test
    void testStart_twiceIsRejected() throws Exception {
        SessionConfig config = remoteConfig(GOOD_1).threads(1).build();

        try (Session session = start(config)) {
            assertThrows(IllegalStateException.class, session::start);
        }
    }

    @Test
    void testCsv_headerWrittenOnceAcrossSessions() throws Exception {
        Path csv = tempDir.resolve("results.csv");
        SessionConfig config = remoteConfig(GOOD_1).threads(1).csvPath(csv.toString()).build();

        try (Session session = start(config)) {
            session.writeToCsv("octo/one", "sig", "a.txt", "x");
        }
        try (Session session = start(config)) {
            session.writeToCsv("octo/two", "sig", "b.txt", "y");
        }

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("\"Repository name\""));
        assertTrue(lines.get(1).startsWith("octo/one"));
        assertTrue(lines.get(2).startsWith("octo/two"));
    }

    @Test
    void testCsv_unopenableFileLeavesSinkDisabled() throws Exception {
        Path csv = tempDir.resolve("missing-dir/results.csv");
        SessionConfig config = remoteConfig(GOOD_1).threads(1).csvPath(csv.toString()).build();

        try (Session session = start(config)) {
            assertTrue(session.csvSink().isEmpty());
            session.writeToCsv("ignored", "ignored", "ignored", "ignored");
        }
        assertFalse(Files.exists(csv));
    }

    @Test
    void testCsv_disabledByDefault() throws Exception {
        try (Session session = start(remoteConfig(GOOD_1).threads(1).build())) {
            assertTrue(session.csvSink().isEmpty());
        }
    }

    @Test
    void testRunWorkers_sharePoolAcrossWorkers() throws Exception {
        SessionConfig config = remoteConfig(GOOD_1, GOOD_2).threads(4).build();
        Set<String> threads = ConcurrentHashMap.newKeySet();

        try (Session session = start(config)) {
            ClientPool<GitHubClient> pool = session.pool().orElseThrow();
            session.runWorkers(id -> {
                for (int i = 0; i < 5; i++) {
                    assertEquals("octocat", pool.withClient(GitHubClient::authenticatedUser));
                }
                threads.add(Thread.currentThread().getName());
            });

            assertEquals(4, threads.size());
            assertEquals(2 + 4 * 5, github.userRequests());
            assertEquals(pool.totalHandles(), pool.readyCount());
        }
    }

    @Test
    void testRunWorkers_beforeStartIsRejected() {
        Session session = Session.builder(remoteConfig(GOOD_1).build()).configureLogging(false).build();

        assertThrows(IllegalStateException.class, () -> session.runWorkers(id -> { }));
    }

    @Test
    void testResolveWorkerCount() {
        assertEquals(7, Session.resolveWorkerCount(7));
        assertEquals(Runtime.getRuntime().availableProcessors(), Session.resolveWorkerCount(0));
        assertThrows(IllegalArgumentException.class, () -> Session.resolveWorkerCount(-1));
    }
}
