package com.example.serverlesscluster.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ResultTest {

  @Test
  @DisplayName("Should expose the value of a successful result")
  void shouldExposeValue() {
    final var result = Result.ok("value");

    assertTrue(result.isOk());
    assertEquals(Optional.of("value"), result.value());
    assertEquals(Optional.empty(), result.error());
    assertEquals("value", result.orElseThrow());
  }

  @Test
  @DisplayName("Should throw the carried error from orElseThrow")
  void shouldThrowCarriedError() {
    final var error = ClusterError.precondition("missing");
    final Result<String> result = Result.error(error);

    assertFalse(result.isOk());
    assertEquals(Optional.empty(), result.value());
    final var thrown = assertThrows(ClusterErrorException.class, result::orElseThrow);
    assertEquals(error, thrown.getError());
    assertEquals("missing", thrown.getMessage());
  }

  @Test
  @DisplayName("Should map only successful results")
  void shouldMapValues() {
    assertEquals(Result.ok(4), Result.ok("four").map(String::length));

    final Result<String> failed = Result.error(ClusterError.alreadyExists("dup"));
    assertEquals(failed.error(), failed.map(String::length).error());
  }
}
