package uk.sky.pglock;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import uk.sky.pglock.example.LockContender;
import uk.sky.pglock.exception.CannotAcquireLockException;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.Assume.assumeTrue;

/**
 * Runs against the PostgreSQL server described by the {@code DATABASE_*} environment variables.
 * Skipped when {@code DATABASE_HOST} is not set.
 */
public class AdvisoryLockIntegrationTest {

    private static ConnectionConfig connectionConfig;

    private AdvisoryLocks advisoryLocks;
    private String lockName;

    @BeforeClass
    public static void classSetup() {
        assumeTrue("DATABASE_HOST is not set, skipping PostgreSQL tests", System.getenv("DATABASE_HOST") != null);
        connectionConfig = ConnectionConfig.fromEnvironment();
    }

    @Before
    public void setUp() {
        advisoryLocks = AdvisoryLocks.create(connectionConfig);
        // unique per test, leftovers from other runs never collide
        lockName = "gold_leader-" + UUID.randomUUID();
    }

    @Test
    public void shouldRunQueriesOnLockedConnectionAndRejectSecondAttempt() throws Exception {
        //when
        Throwable throwable = catchThrowable(() -> advisoryLocks.withLock(lockName, connection -> {
            assertThat(selectOne(connection)).isEqualTo(1);
            return advisoryLocks.withLock(lockName, AdvisoryLockIntegrationTest::selectOne);
        }));

        //then
        assertThat(throwable).isInstanceOf(CannotAcquireLockException.class);
        String result = advisoryLocks.withLock(lockName, connection -> "released");
        assertThat(result).isEqualTo("released");
    }

    @Test
    public void shouldComputeSameKeyAsServer() throws Exception {
        //when
        long serverKey = advisoryLocks.withLock(lockName, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT ('x'||substr(md5(?),1,16))::bit(64)::bigint")) {
                statement.setString(1, lockName);
                try (ResultSet resultSet = statement.executeQuery()) {
                    resultSet.next();
                    return resultSet.getLong(1);
                }
            }
        });

        //then
        assertThat(serverKey).isEqualTo(LockName.of(lockName).getKey());
    }

    @Test
    public void shouldReportApplicationNameOfLockConnection() throws Exception {
        //when
        try (AdvisoryLock lock = advisoryLocks.acquire(lockName)) {
            String applicationName;
            try (Statement statement = lock.getConnection().createStatement();
                 ResultSet resultSet = statement.executeQuery("SHOW application_name")) {
                resultSet.next();
                applicationName = resultSet.getString(1);
            }

            //then
            assertThat(lock.getApplicationName()).startsWith(applicationName);
        }
    }

    @Test
    public void shouldPreventAccessFromSeparateProcess() throws Exception {
        //given
        try (AdvisoryLock ignored = advisoryLocks.acquire(lockName)) {
            //when
            int exitCode = runContender(lockName);

            //then
            assertThat(exitCode).isEqualTo(LockContender.NOT_ACQUIRED);
        }

        assertThat(runContender(lockName)).isEqualTo(LockContender.ACQUIRED);
    }

    @Test
    public void shouldReleaseLockWhenSessionEndsWithoutUnlock() throws Exception {
        //given
        PostgresConnectionFactory connectionFactory = new PostgresConnectionFactory();
        PostgresAdvisoryLockingMechanism lockingMechanism = new PostgresAdvisoryLockingMechanism();
        Connection abandoned = connectionFactory.connect(connectionConfig, "abandoned-" + lockName);
        assertThat(lockingMechanism.tryAcquire(abandoned, LockName.of(lockName))).isTrue();
        assertThat(catchThrowable(() -> advisoryLocks.acquire(lockName))).isInstanceOf(CannotAcquireLockException.class);

        //when
        abandoned.close();

        //then
        String result = advisoryLocks.withLock(lockName, connection -> "recovered");
        assertThat(result).isEqualTo("recovered");
    }

    @Test
    public void shouldAcquireLockOnceHolderReleasesWhenRetrying() throws Exception {
        //given
        ExecutorService executorService = Executors.newSingleThreadExecutor();
        CountDownLatch acquired = new CountDownLatch(1);
        try {
            Future<?> holder = executorService.submit(() -> advisoryLocks.withLock(lockName, connection -> {
                acquired.countDown();
                TimeUnit.MILLISECONDS.sleep(500);
                return null;
            }));
            assertThat(acquired.await(10, TimeUnit.SECONDS)).isTrue();

            //when
            String result = advisoryLocks.withLockRetrying(lockName, RetryConfig.builder()
                    .withPollingInterval(Duration.ofMillis(100))
                    .withTimeout(Duration.ofSeconds(10))
                    .build(), connection -> "acquired");

            //then
            assertThat(result).isEqualTo("acquired");
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            executorService.shutdownNow();
        }
    }

    private static int runContender(String lockName) throws Exception {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        String classPath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        Process process = new ProcessBuilder(java, "-cp", classPath, LockContender.class.getName(), lockName)
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        assertThat(process.waitFor(60, TimeUnit.SECONDS)).isTrue();
        return process.exitValue();
    }

    private static int selectOne(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT 1")) {
            resultSet.next();
            return resultSet.getInt(1);
        }
    }
}
