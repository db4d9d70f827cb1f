package ca.gc.cra.tether.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.application.port.ClockPort;
import ca.gc.cra.tether.testutil.RecordingMetrics;
import ca.gc.cra.tether.testutil.RecordingTransport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void defaultChainRunsFromSecurityToTransport() {
    CompositionRoot root = new CompositionRoot(PipelineConfig.defaults(), new RecordingMetrics(), ClockPort.SYSTEM);

    List<String> names = root.defaultStages(new RecordingTransport()).stream().map(PipelineStage::name).toList();

    assertEquals(List.of("security-client", "retry", "registration", "connection-state", "transport"), names);
  }

  @Test
  void newPipelineUsesTheConfiguredName() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of("pipelineName", "plant-9"));
    RecordingMetrics metrics = new RecordingMetrics();
    try (CompositionRoot root = new CompositionRoot(config, metrics, ClockPort.SYSTEM);
        Pipeline pipeline = root.newPipeline(new RecordingTransport())) {
      assertEquals("plant-9", pipeline.name());
      assertEquals(5, pipeline.stages().size());
      assertSame(metrics, root.metrics());
    }
  }
}
