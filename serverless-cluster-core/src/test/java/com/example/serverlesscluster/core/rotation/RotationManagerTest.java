package com.example.serverlesscluster.core.rotation;

import static com.example.serverlesscluster.core.TestClusters.ENGINE;
import static com.example.serverlesscluster.core.TestClusters.vpc;
import static org.junit.jupiter.api.Assertions.*;

import com.example.serverlesscluster.core.ClusterError;
import com.example.serverlesscluster.core.ManagedServerlessCluster;
import com.example.serverlesscluster.core.Result;
import com.example.serverlesscluster.core.ServerlessClusterSpec;
import com.example.serverlesscluster.core.TestClusters;
import com.example.serverlesscluster.core.TestClusters.CountingSecretFactory;
import com.example.serverlesscluster.core.TestClusters.RecordingEngine;
import com.example.serverlesscluster.core.secrets.Credentials;
import com.example.serverlesscluster.core.secrets.SecretReference;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.*;

public class RotationManagerTest {

  private RotationManager manager;
  private ManagedServerlessCluster cluster;

  @BeforeEach
  void setUp() {
    manager = new RotationManager();
    cluster = TestClusters.provisioned("Orders");
  }

  private static ManagedServerlessCluster withoutSecret() {
    final var spec =
        ServerlessClusterSpec.builder()
            .engine(ENGINE)
            .vpc(vpc(2))
            .credentials(Credentials.fromPassword("admin", "s3cret"))
            .build();
    return TestClusters.builder(new RecordingEngine(), new CountingSecretFactory())
        .build("Plain", spec)
        .cluster();
  }

  @Nested
  @DisplayName("Single User Rotation")
  class SingleUser {

    @Test
    @DisplayName("Should rotate the cluster secret every 30 days by default")
    void shouldAddWithDefaults() {
      final var job = manager.addSingleUserRotation(cluster).orElseThrow();

      assertEquals(RotationManager.SINGLE_USER_ROTATION_ID, job.id());
      assertEquals(cluster.secret().orElseThrow().secret(), job.secret());
      assertEquals(Optional.empty(), job.masterSecret());
      assertFalse(job.isMultiUser());
      assertEquals(Duration.ofDays(30), job.automaticallyAfter());
      assertEquals(SecretRotationApplication.MYSQL_ROTATION_SINGLE_USER, job.application());
      assertEquals("orders", job.target().targetId());
      assertEquals(cluster.vpc(), job.vpc());
      assertTrue(manager.isRegistered(cluster, RotationManager.SINGLE_USER_ROTATION_ID));
    }

    @Test
    @DisplayName("Should report already-exists on the second call")
    void shouldRejectSecondRotation() {
      assertTrue(manager.addSingleUserRotation(cluster).isOk());

      final var second = manager.addSingleUserRotation(cluster, Duration.ofDays(7));

      final var error = second.error().orElseThrow();
      assertEquals(ClusterError.Kind.ALREADY_EXISTS, error.kind());
      assertEquals("A single user rotation was already added to this cluster.", error.message());
    }

    @Test
    @DisplayName("Should report a precondition error without a secret")
    void shouldRequireSecret() {
      final var result = manager.addSingleUserRotation(withoutSecret());

      final var error = result.error().orElseThrow();
      assertEquals(ClusterError.Kind.PRECONDITION, error.kind());
      assertEquals(
          "Cannot add single user rotation for a cluster without secret.", error.message());
    }

    @Test
    @DisplayName("Should not register a failed precondition")
    void shouldNotRegisterWithoutSecret() {
      final var plain = withoutSecret();
      manager.addSingleUserRotation(plain);

      assertFalse(manager.isRegistered(plain, RotationManager.SINGLE_USER_ROTATION_ID));
    }

    @Test
    @DisplayName("Should keep registries of different clusters apart")
    void shouldKeepClustersApart() {
      assertTrue(manager.addSingleUserRotation(cluster).isOk());
      assertTrue(manager.addSingleUserRotation(TestClusters.provisioned("Billing")).isOk());
    }

    @Test
    @DisplayName("Should reject cadences outside 1 to 1000 days")
    void shouldValidateCadence() {
      assertThrows(
          IllegalArgumentException.class,
          () -> manager.addSingleUserRotation(cluster, Duration.ofHours(12)));
      assertThrows(
          IllegalArgumentException.class,
          () -> manager.addSingleUserRotation(cluster, Duration.ofDays(1001)));
      assertEquals(
          Duration.ofDays(1000),
          manager
              .addSingleUserRotation(cluster, Duration.ofDays(1000))
              .orElseThrow()
              .automaticallyAfter());
    }

    @Test
    @DisplayName("Should reject cadences that are not whole days")
    void shouldRejectPartialDays() {
      final var thrown =
          assertThrows(
              IllegalArgumentException.class,
              () -> manager.addSingleUserRotation(cluster, Duration.ofHours(36)));
      assertEquals(
          "automaticallyAfter must be a whole number of days, got PT36H", thrown.getMessage());
      assertFalse(manager.isRegistered(cluster, RotationManager.SINGLE_USER_ROTATION_ID));
      assertEquals(
          Duration.ofDays(2),
          manager
              .addSingleUserRotation(cluster, Duration.ofHours(48))
              .orElseThrow()
              .automaticallyAfter());
    }

    @Test
    @DisplayName("Should register exactly one job under concurrent calls")
    void shouldRegisterOnceConcurrently() throws Exception {
      final ExecutorService executor = Executors.newFixedThreadPool(8);
      try {
        final var futures =
            IntStream.range(0, 16)
                .mapToObj(i -> executor.submit(() -> manager.addSingleUserRotation(cluster)))
                .collect(Collectors.toList());

        var successes = 0;
        for (final Future<Result<RotationJob>> future : futures) {
          if (future.get().isOk()) successes++;
        }
        assertEquals(1, successes);
      } finally {
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
      }
    }
  }

  @Nested
  @DisplayName("Multi User Rotation")
  class MultiUser {

    private final SecretReference appSecret = new SecretReference("arn:app-user");

    @Test
    @DisplayName("Should use the cluster secret as master secret")
    void shouldAddWithMasterSecret() {
      final var job =
          manager
              .addMultiUserRotation(cluster, "AppUser", MultiUserRotationOptions.of(appSecret))
              .orElseThrow();

      assertEquals("AppUser", job.id());
      assertEquals(appSecret, job.secret());
      assertEquals(Optional.of(cluster.secret().orElseThrow().secret()), job.masterSecret());
      assertTrue(job.isMultiUser());
      assertEquals(SecretRotationApplication.MYSQL_ROTATION_MULTI_USER, job.application());
      assertEquals(Duration.ofDays(30), job.automaticallyAfter());
    }

    @Test
    @DisplayName("Should report already-exists for a reused id")
    void shouldRejectDuplicateId() {
      manager.addMultiUserRotation(cluster, "AppUser", MultiUserRotationOptions.of(appSecret));

      final var error =
          manager
              .addMultiUserRotation(
                  cluster,
                  "AppUser",
                  new MultiUserRotationOptions(appSecret, Duration.ofDays(10)))
              .error()
              .orElseThrow();

      assertEquals(ClusterError.Kind.ALREADY_EXISTS, error.kind());
      assertEquals(
          "A rotation with id AppUser was already added to this cluster.", error.message());
    }

    @Test
    @DisplayName("Should allow distinct ids alongside a single user rotation")
    void shouldAllowDistinctIds() {
      assertTrue(manager.addSingleUserRotation(cluster).isOk());
      assertTrue(
          manager
              .addMultiUserRotation(cluster, "Reporting", MultiUserRotationOptions.of(appSecret))
              .isOk());
      assertTrue(
          manager
              .addMultiUserRotation(cluster, "Etl", MultiUserRotationOptions.of(appSecret))
              .isOk());
    }

    @Test
    @DisplayName("Should report a precondition error without a master secret")
    void shouldRequireMasterSecret() {
      final var error =
          manager
              .addMultiUserRotation(
                  withoutSecret(), "AppUser", MultiUserRotationOptions.of(appSecret))
              .error()
              .orElseThrow();

      assertEquals(ClusterError.Kind.PRECONDITION, error.kind());
      assertEquals("Cannot add multi user rotation for a cluster without secret.", error.message());
    }

    @Test
    @DisplayName("Should reject a blank id")
    void shouldRejectBlankId() {
      assertThrows(
          IllegalArgumentException.class,
          () -> manager.addMultiUserRotation(cluster, "", MultiUserRotationOptions.of(appSecret)));
    }
  }
}
