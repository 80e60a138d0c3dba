package jobqueue.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsSequentiallyNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("jobqueue-test-");

    Thread t1 = factory.newThread(() -> {
    });
    Thread t2 = factory.newThread(() -> {
    });

    assertTrue(t1.isDaemon());
    assertEquals("jobqueue-test-1", t1.getName());
    assertEquals("jobqueue-test-2", t2.getName());
  }

  @Test
  void escapingExceptionIsHandledByTheFactory() throws Exception {
    DaemonThreadFactory factory = new DaemonThreadFactory("jobqueue-test-");

    Thread thread = factory.newThread(() -> {
      throw new IllegalStateException("boom");
    });
    assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());

    thread.start();
    thread.join(5000);
    assertFalse(thread.isAlive());
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
