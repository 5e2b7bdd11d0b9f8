package com.gentoro.infotransform;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.infotransform.exception.StateException;
import java.nio.file.Files;
import java.nio.file.Path;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InfoTransformTest {

  @TempDir Path dir;

  @Test
  void configurationRequiresInitialize() {
    InfoTransform app = new InfoTransform(new String[0]);
    assertThrows(StateException.class, app::configuration);
  }

  @Test
  void bootsFromConfigFileAndShutsDown() throws Exception {
    Path config = dir.resolve("app.yaml");
    Files.writeString(
        config,
        String.join(
            "\n",
            "http:",
            "  port: 0",
            "  hostname: 127.0.0.1",
            "files:",
            "  upload-dir: " + dir.resolve("uploads"),
            "llm:",
            "  api-key: sk-test",
            "webhook:",
            "  secret: s3cret",
            "logging:",
            "  level:",
            "    com.gentoro.infotransform: DEBUG",
            ""));

    InfoTransform app = new InfoTransform(new String[] {"--config=" + config});
    app.initialize();
    try {
      assertEquals(0, app.configuration().getInt("http.port"));
      assertNotNull(app.pipeline());
      int port = app.httpServer().getPort();
      assertTrue(port > 0);

      OkHttpClient client = new OkHttpClient();
      Request request =
          new Request.Builder().url("http://127.0.0.1:" + port + "/api/metrics").build();
      try (Response r = client.newCall(request).execute()) {
        assertEquals(200, r.code());
        assertTrue(r.body().string().contains("\"webhooks\""));
      }
    } finally {
      app.shutdown();
      app.shutdown();
    }
    assertTrue(Files.isDirectory(dir.resolve("uploads")));
  }
}
