package com.example.serverlesscluster.core.scaling;

import static org.junit.jupiter.api.Assertions.*;

import com.example.serverlesscluster.core.ClusterConfigurationException;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class ScalingConfigurationRendererTest {

  @Nested
  @DisplayName("Capacity range")
  class CapacityRange {

    @Test
    @DisplayName("Should render capacity values")
    void shouldRenderCapacities() {
      final var rendered =
          ScalingConfigurationRenderer.render(
              ServerlessScalingOptions.builder()
                  .minCapacity(AuroraCapacityUnit.ACU_1)
                  .maxCapacity(AuroraCapacityUnit.ACU_384)
                  .build());

      assertEquals(Optional.of(1), rendered.minCapacity());
      assertEquals(Optional.of(384), rendered.maxCapacity());
    }

    @Test
    @DisplayName("Should accept equal minimum and maximum")
    void shouldAcceptEqualBounds() {
      final var rendered =
          ScalingConfigurationRenderer.render(
              ServerlessScalingOptions.builder()
                  .minCapacity(AuroraCapacityUnit.ACU_8)
                  .maxCapacity(AuroraCapacityUnit.ACU_8)
                  .build());

      assertEquals(rendered.minCapacity(), rendered.maxCapacity());
    }

    @Test
    @DisplayName("Should reject a minimum above the maximum")
    void shouldRejectInvertedRange() {
      final var options =
          ServerlessScalingOptions.builder()
              .minCapacity(AuroraCapacityUnit.ACU_16)
              .maxCapacity(AuroraCapacityUnit.ACU_2)
              .build();

      final var thrown =
          assertThrows(
              ClusterConfigurationException.class,
              () -> ScalingConfigurationRenderer.render(options));
      assertEquals(
          "maximum capacity must be greater than or equal to minimum capacity.",
          thrown.getMessage());
    }

    @Test
    @DisplayName("Should pass absent capacities through")
    void shouldPassAbsentCapacities() {
      final var rendered =
          ScalingConfigurationRenderer.render(
              ServerlessScalingOptions.builder().maxCapacity(AuroraCapacityUnit.ACU_2).build());

      assertEquals(Optional.empty(), rendered.minCapacity());
      assertEquals(Optional.of(2), rendered.maxCapacity());
    }
  }

  @Nested
  @DisplayName("Auto pause")
  class AutoPause {

    @Test
    @DisplayName("Should disable auto pause for a zero duration")
    void shouldDisableForZero() {
      final var rendered =
          ScalingConfigurationRenderer.render(
              ServerlessScalingOptions.builder().autoPause(Duration.ZERO).build());

      assertFalse(rendered.autoPause());
      assertEquals(Optional.empty(), rendered.secondsUntilAutoPause());
    }

    @Test
    @DisplayName("Should render the pause in seconds")
    void shouldRenderSeconds() {
      final var rendered =
          ScalingConfigurationRenderer.render(
              ServerlessScalingOptions.builder().autoPause(Duration.ofMinutes(10)).build());

      assertTrue(rendered.autoPause());
      assertEquals(Optional.of(600L), rendered.secondsUntilAutoPause());
    }

    @Test
    @DisplayName("Should enable auto pause with the provider default when absent")
    void shouldEnableByDefault() {
      final var rendered =
          ScalingConfigurationRenderer.render(ServerlessScalingOptions.builder().build());

      assertTrue(rendered.autoPause());
      assertEquals(Optional.empty(), rendered.secondsUntilAutoPause());
    }

    @Test
    @DisplayName("Should reject a negative auto pause")
    void shouldRejectNegative() {
      assertThrows(
          IllegalArgumentException.class,
          () -> ServerlessScalingOptions.builder().autoPause(Duration.ofSeconds(-1)).build());
    }

    @Test
    @DisplayName("Should reject a pause that is not a whole number of seconds")
    void shouldRejectSubSecondPause() {
      assertThrows(
          IllegalArgumentException.class,
          () -> ServerlessScalingOptions.builder().autoPause(Duration.ofMillis(500)).build());
      assertThrows(
          IllegalArgumentException.class,
          () -> ServerlessScalingOptions.builder().autoPause(Duration.ofMillis(90_500)).build());
    }

    @Test
    @DisplayName("Should keep auto pause enabled for the shortest whole-second pause")
    void shouldRenderOneSecond() {
      final var rendered =
          ScalingConfigurationRenderer.render(
              ServerlessScalingOptions.builder().autoPause(Duration.ofSeconds(1)).build());

      assertTrue(rendered.autoPause());
      assertEquals(Optional.of(1L), rendered.secondsUntilAutoPause());
    }
  }
}
