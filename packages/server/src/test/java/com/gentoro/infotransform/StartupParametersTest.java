package com.gentoro.infotransform;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.infotransform.exception.ConfigException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNamedValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(new String[] {"--config= /etc/it.yaml ", "--port=9000", "--dry"});
    assertEquals("/etc/it.yaml", params.configFile());
    assertEquals(9000, params.getParameter("port", Integer.class));
    assertTrue(params.getParameter("dry", Boolean.class));
    assertNull(params.getParameter("missing", String.class));
    assertEquals(3, params.asMap().size());
  }

  @Test
  void blankConfigMeansBundledFile() {
    assertNull(new StartupParameters(new String[] {"--config="}).configFile());
    assertNull(new StartupParameters(null).configFile());
  }

  @Test
  void rejectsPositionalArguments() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"serve"}));
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"--"}));
  }

  @Test
  void rejectsUnsupportedTypes() {
    StartupParameters params = new StartupParameters(new String[] {"--ratio=0.5"});
    assertThrows(ConfigException.class, () -> params.getParameter("ratio", Double.class));
  }
}
