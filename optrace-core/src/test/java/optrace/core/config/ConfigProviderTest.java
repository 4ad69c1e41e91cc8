package optrace.core.config;

import static optrace.core.config.ProfilerSettings.PROFILER_EVENT_BLOCK_SIZE;
import static optrace.core.config.ProfilerSettings.PROFILER_RECORD_SHAPES;
import static optrace.core.config.ProfilerSettings.PROFILER_STATE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import optrace.core.ProfilerConfig;
import optrace.core.ProfilerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConfigProviderTest {
  private final Properties properties = new Properties();
  private final Map<String, String> environment = new HashMap<>();
  private final ConfigProvider provider =
      ConfigProvider.withSources(this.properties, this.environment);

  @ParameterizedTest
  @CsvSource({
    "profiler.state, optrace.profiler.state, OPTRACE_PROFILER_STATE",
    "profiler.record-shapes, optrace.profiler.record-shapes, OPTRACE_PROFILER_RECORD_SHAPES",
    "profiler.device.warmup-iterations, optrace.profiler.device.warmup-iterations, "
        + "OPTRACE_PROFILER_DEVICE_WARMUP_ITERATIONS"
  })
  void namesSources(String key, String systemProperty, String envVar) {
    assertEquals(systemProperty, ConfigProvider.toSystemProperty(key));
    assertEquals(envVar, ConfigProvider.toEnvVar(key));
  }

  @Test
  void systemPropertyWinsOverEnvironment() {
    this.environment.put("OPTRACE_PROFILER_STATE", "disabled");
    assertEquals("disabled", this.provider.getString(PROFILER_STATE));
    this.properties.setProperty("optrace.profiler.state", " device-timed ");
    assertEquals("device-timed", this.provider.getString(PROFILER_STATE));
  }

  @Test
  void defaultsApplyWhenUnset() {
    assertNull(this.provider.getString(PROFILER_STATE));
    assertEquals("cpu", this.provider.getString(PROFILER_STATE, "cpu"));
    assertFalse(this.provider.getBoolean(PROFILER_RECORD_SHAPES, false));
    assertEquals(1024, this.provider.getInteger(PROFILER_EVENT_BLOCK_SIZE, 1024));
  }

  @Test
  void invalidIntegerFallsBackToDefault() {
    this.environment.put("OPTRACE_PROFILER_EVENT_BLOCK_SIZE", "large");
    assertEquals(1024, this.provider.getInteger(PROFILER_EVENT_BLOCK_SIZE, 1024));
    this.environment.put("OPTRACE_PROFILER_EVENT_BLOCK_SIZE", "16");
    assertEquals(16, this.provider.getInteger(PROFILER_EVENT_BLOCK_SIZE, 1024));
  }

  @Test
  void buildsProfilerConfig() {
    assertEquals(
        new ProfilerConfig(ProfilerState.CPU, false), ProfilerConfig.fromSettings(this.provider));
    this.properties.setProperty("optrace.profiler.state", "device_markers");
    this.environment.put("OPTRACE_PROFILER_RECORD_SHAPES", "true");
    ProfilerConfig config = ProfilerConfig.fromSettings(this.provider);
    assertEquals(ProfilerState.DEVICE_MARKERS, config.state());
    assertTrue(config.reportInputShapes());
  }
}
