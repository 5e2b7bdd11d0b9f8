package com.gentoro.infotransform.api.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.jobs.JobStatus;
import com.gentoro.infotransform.jobs.JobTracker;
import com.gentoro.infotransform.jobs.JobView;
import com.gentoro.infotransform.pipeline.ResultBroadcaster;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.time.Instant;
import java.util.Optional;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobsServletTest {

  @Mock JobTracker tracker;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    tester = new ServletTester();
    tester.addServlet(
        new ServletHolder(new JobsServlet(tracker, new ResultBroadcaster())), "/api/jobs/*");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private static JobView view(JobStatus status, int completed, boolean cancelRequested) {
    Instant t = Instant.parse("2024-05-01T10:00:00Z");
    return new JobView(
        "job-1", "batch-1", status, t, t, null, 4, completed, 0, 0, cancelRequested, null);
  }

  private HttpTester.Response call(String method, String uri) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod(method);
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void returnsSnapshotForKnownJob() throws Exception {
    Mockito.when(tracker.view("job-1"))
        .thenReturn(Optional.of(view(JobStatus.PROCESSING, 2, false)));

    HttpTester.Response resp = call("GET", "/api/jobs/job-1");

    assertEquals(200, resp.getStatus());
    JsonNode body = JacksonUtility.readTree(resp.getContent());
    assertEquals("processing", body.path("status").asText());
    assertEquals(4, body.path("totalCount").asInt());
    assertEquals(2, body.path("completedCount").asInt());
    assertEquals(50, body.path("percent").asInt());
    assertEquals("2024-05-01T10:00:00Z", body.path("createdAt").asText());
    assertFalse(body.has("finishedAt"));
  }

  @Test
  void unknownJobIs404() throws Exception {
    Mockito.when(tracker.view(Mockito.anyString())).thenReturn(Optional.empty());
    HttpTester.Response resp = call("GET", "/api/jobs/nope");
    assertEquals(404, resp.getStatus());
    assertTrue(resp.getContent().contains("Unknown jobId"));

    assertEquals(404, call("GET", "/api/jobs/nope/events").getStatus());
  }

  @Test
  void missingIdIs400() throws Exception {
    assertEquals(400, call("GET", "/api/jobs/").getStatus());
  }

  @Test
  void deleteRequestsCancellation() throws Exception {
    Mockito.when(tracker.cancel("job-1")).thenReturn(true);
    Mockito.when(tracker.status("job-1")).thenReturn(view(JobStatus.PROCESSING, 1, true));

    HttpTester.Response resp = call("DELETE", "/api/jobs/job-1");

    assertEquals(202, resp.getStatus());
    assertTrue(JacksonUtility.readTree(resp.getContent()).path("cancelRequested").asBoolean());
    Mockito.verify(tracker).cancel("job-1");
  }
}
