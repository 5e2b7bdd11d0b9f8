package com.gentoro.infotransform;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.infotransform.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path dir;

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(10, config.getInt("batching.batch-size"));
    assertEquals(3, config.subset("batching").getInt("max-concurrent-batches"));
    assertEquals(0.2, config.getDouble("batching.adaptive.step-factor"), 1e-9);
    assertEquals("io", config.getString("conversion.worker-type"));
    assertEquals(52428800L, config.getLong("http.max-upload-bytes"));
  }

  @Test
  void loadsExplicitFile() throws Exception {
    Path file = dir.resolve("custom.yaml");
    Files.writeString(file, "http:\n  port: 9123\nbatching:\n  batch-size: 4\n");
    Configuration config = new ConfigurationProvider(file.toString()).config();
    assertEquals(9123, config.getInt("http.port"));
    assertEquals(4, config.subset("batching").getInt("batch-size"));
  }

  @Test
  void missingFileIsAConfigError() {
    String path = dir.resolve("absent.yaml").toString();
    ConfigException e = assertThrows(ConfigException.class, () -> new ConfigurationProvider(path));
    assertTrue(e.getMessage().startsWith("Configuration file not found"));
  }

  @Test
  void malformedYamlIsAConfigError() throws Exception {
    Path file = dir.resolve("broken.yaml");
    Files.writeString(file, "http: [unclosed\n");
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(file.toString()));
  }
}
