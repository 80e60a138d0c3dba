package jobqueue;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NewJobTest {

  @Test
  void rejectsEmptyType() {
    assertThrows(JobValidationException.class, () -> NewJob.builder("").build());
    assertThrows(JobValidationException.class, () -> NewJob.builder(null).build());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(JobValidationException.class, () -> NewJob.builder("email").weight(0).build());
    assertThrows(JobValidationException.class, () -> NewJob.builder("email").maxRetries(-1).build());
  }

  @Test
  void recurrenceFieldsGoTogether() {
    assertThrows(JobValidationException.class, () ->
        NewJob.builder("digest").recurrence("nightly", null).build());
  }

  @Test
  void resolveFillsDefaultsOnly() {
    Instant now = Instant.parse("2026-01-01T00:00:00Z");
    NewJob resolved = NewJob.builder("email").build().resolve(now, 3);

    assertEquals(now, resolved.runAt());
    assertEquals(3, resolved.maxRetries());

    NewJob explicit = NewJob.builder("email").runAt(now.plusSeconds(60)).maxRetries(0).build();
    assertSame(explicit, explicit.resolve(now, 3));
  }

  @Test
  void runAfterCountsFromTheInsertTime() {
    Instant now = Instant.parse("2026-01-01T00:00:00Z");
    NewJob delayed = NewJob.builder("email").runAfter(Duration.ofMinutes(10)).build();

    assertNull(delayed.runAt());
    assertEquals(now.plus(Duration.ofMinutes(10)), delayed.resolve(now, 3).runAt());
    assertNull(delayed.resolve(now, 3).delay());

    NewJob pinned = NewJob.builder("email").runAfter(Duration.ofMinutes(10)).runAt(now).build();
    assertEquals(now, pinned.resolve(now.plusSeconds(30), 3).runAt());
    assertThrows(JobValidationException.class, () ->
        NewJob.builder("email").runAfter(Duration.ofSeconds(-1)));
  }

  @Test
  void payloadIsCopied() {
    byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
    NewJob job = NewJob.builder("email").payload(payload).build();
    payload[0] = 'j';

    assertEquals("hello", new String(job.payload(), StandardCharsets.UTF_8));
  }

  @Test
  void jobUpdateMustChangeSomething() {
    assertThrows(JobValidationException.class, () -> JobUpdate.builder().build());
    assertThrows(JobValidationException.class, () -> JobUpdate.builder().weight(0).build());
  }
}
