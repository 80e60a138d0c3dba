package jobqueue.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void derivesAllTableNamesFromPrefix() {
    assertEquals("jq_job", TableNames.jobs("jq"));
    assertEquals("jq_job_run", TableNames.runs("jq"));
    assertEquals("billing_schedule", TableNames.schedules("billing"));
  }

  @Test
  void acceptsUnderscoresAndDigits() {
    assertEquals("_tenant_2", TableNames.validatePrefix("_tenant_2"));
  }

  @Test
  void rejectsPrefixesThatAreNotIdentifiers() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("2jobs"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("jobs; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix(""));
    assertThrows(NullPointerException.class, () -> TableNames.validatePrefix(null));
  }
}
