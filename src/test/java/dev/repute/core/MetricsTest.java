/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.repute.api.ErrorCode;
import java.lang.management.ManagementFactory;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import org.junit.jupiter.api.Test;

class MetricsTest {

  @Test
  void countersAreExposedThroughJmx() throws Exception {
    try (Metrics metrics = new Metrics()) {
      metrics.recordVoteAdded();
      metrics.recordVoteAdded();
      metrics.recordAdminVotesAdded(3);
      metrics.recordFlush(false, ErrorCode.PERSISTENCE_FAILURE);

      MBeanServer server = ManagementFactory.getPlatformMBeanServer();
      ObjectName name = new ObjectName("dev.repute:type=ReputeMetrics");
      assertEquals(2L, server.getAttribute(name, "VotesAdded"));
      assertEquals(3L, server.getAttribute(name, "AdminVotesAdded"));
      assertEquals(1L, server.getAttribute(name, "FlushFailure"));
      assertEquals("PERSISTENCE_FAILURE", server.getAttribute(name, "LastPersistenceErrorCode"));
    }
  }
}
