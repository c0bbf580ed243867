package dev.leadtracker;

import dev.leadtracker.ai.NoOpCompletionClient;
import dev.leadtracker.ai.TextCompletionClient;
import dev.leadtracker.store.JobStore;
import dev.leadtracker.store.jdbc.JdbcJobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private JobStore jobStore;

  @Autowired
  private TextCompletionClient textCompletionClient;

  @Test
  void contextLoads() {
    assertThat(jobStore).isInstanceOf(JdbcJobStore.class);
    assertThat(jobStore.username()).isEqualTo("test-user");
    assertThat(textCompletionClient).isInstanceOf(NoOpCompletionClient.class);
  }
}
