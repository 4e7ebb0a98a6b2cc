package com.example.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.orchestrator.notification.channel.ChannelAdapterRegistry;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.scheduler.handler.JobHistoryCleanupJobHandler;
import com.example.orchestrator.scheduler.handler.RateLimitSweepJobHandler;
import com.example.orchestrator.scheduler.repository.JobRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OrchestratorApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ChannelAdapterRegistry adapterRegistry;
  @Autowired private JobRepository jobRepository;

  @Test
  void everyEndpointTypeHasAnAdapter() {
    for (EndpointType type : EndpointType.values()) {
      assertThat(adapterRegistry.find(type)).as(type.key()).isPresent();
    }
  }

  @Test
  void builtInJobsAreRegisteredAtStartup() {
    assertThat(jobRepository.findByName(JobHistoryCleanupJobHandler.NAME)).isPresent();
    assertThat(jobRepository.findByName(RateLimitSweepJobHandler.NAME)).isPresent();
  }
}
