package com.m4brew.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.m4brew.exception.ValidationException;
import com.m4brew.management.jobs.JobManager;
import com.m4brew.management.jobs.JobMode;
import com.m4brew.management.jobs.JobParameters;
import com.m4brew.management.jobs.JobRecord;
import com.m4brew.management.jobs.JobStatus;
import com.m4brew.management.jobs.StartResult;
import com.m4brew.settings.Settings;
import com.m4brew.settings.SettingsService;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class JobServletTest {

  private JobManager jobs;
  private SettingsService settings;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    jobs = mock(JobManager.class);
    settings = mock(SettingsService.class);
    when(settings.load()).thenReturn(new Settings("/audiobooks", "match", 64, null, null));
    tester = ServletTestSupport.start(new JobServlet(jobs, settings), "/api/job");
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private static JobRecord record(String id, JobStatus status) {
    JobRecord r = new JobRecord();
    r.id = id;
    r.status = status;
    r.mode = JobMode.CONVERT;
    return r;
  }

  @Test
  void getWithoutJobReportsNone() throws Exception {
    when(jobs.status()).thenReturn(Optional.empty());

    HttpTester.Response resp = ServletTestSupport.send(tester, "GET", "/api/job", null);

    assertEquals(200, resp.getStatus());
    assertTrue(resp.getContent().contains("\"status\":\"none\""));
  }

  @Test
  void getReturnsJobView() throws Exception {
    when(jobs.status()).thenReturn(Optional.of(record("job-1", JobStatus.RUNNING)));

    HttpTester.Response resp = ServletTestSupport.send(tester, "GET", "/api/job", null);

    assertEquals(200, resp.getStatus());
    assertTrue(resp.getContent().contains("\"id\":\"job-1\""));
    assertTrue(resp.getContent().contains("\"status\":\"running\""));
  }

  @Test
  void postMergesRequestOverSettingsAndRemembersMode() throws Exception {
    when(jobs.start(any(), anyBoolean(), any()))
        .thenReturn(new StartResult(record("job-2", JobStatus.RUNNING), true));

    HttpTester.Response resp =
        ServletTestSupport.send(
            tester,
            "POST",
            "/api/job",
            "{\"mode\":\"correct\",\"dry_run\":true,\"bitrate\":128,\"audio_mode\":\"bogus\"}");

    assertEquals(202, resp.getStatus());
    ArgumentCaptor<JobParameters> params = ArgumentCaptor.forClass(JobParameters.class);
    verify(jobs).start(eq(JobMode.CORRECT), eq(true), params.capture());
    assertEquals("/audiobooks", params.getValue().rootFolder());
    assertEquals("match", params.getValue().audioMode());
    assertEquals(128, params.getValue().bitrate());
    verify(settings).update(new Settings(null, null, null, JobMode.CORRECT, true));
  }

  @Test
  void postWhileActiveIsConflictWithExistingJob() throws Exception {
    when(jobs.start(any(), anyBoolean(), any()))
        .thenReturn(new StartResult(record("job-1", JobStatus.RUNNING), false));

    HttpTester.Response resp =
        ServletTestSupport.send(tester, "POST", "/api/job", "{\"mode\":\"convert\"}");

    assertEquals(409, resp.getStatus());
    assertTrue(resp.getContent().contains("job-1"));
    verify(settings, never()).update(any());
  }

  @Test
  void postWithoutRootFolderIsBadRequest() throws Exception {
    when(jobs.start(any(), anyBoolean(), any()))
        .thenThrow(new ValidationException("root_folder is required to start a job"));

    HttpTester.Response resp = ServletTestSupport.send(tester, "POST", "/api/job", "{}");

    assertEquals(400, resp.getStatus());
    assertTrue(resp.getContent().contains("root_folder"));
    assertTrue(resp.getContent().contains("VALIDATION_ERROR"));
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    HttpTester.Response resp = ServletTestSupport.send(tester, "POST", "/api/job", "[1,2");
    assertEquals(400, resp.getStatus());
    verifyNoInteractions(jobs);
  }

  @Test
  void deleteClearsOrConflicts() throws Exception {
    when(jobs.clear()).thenReturn(true, false);

    assertEquals(204, ServletTestSupport.send(tester, "DELETE", "/api/job", null).getStatus());
    assertEquals(409, ServletTestSupport.send(tester, "DELETE", "/api/job", null).getStatus());
  }

  @Test
  @DisplayName("Start without overrides uses saved settings and remembers the last run")
  void postWithoutOverridesUsesSavedSettings(@TempDir Path temp) throws Exception {
    SettingsService real =
        new SettingsService(
            temp.resolve("settings.json"), new Settings("/audiobooks", "stereo", 96, null, null));
    when(jobs.start(any(), anyBoolean(), any()))
        .thenReturn(new StartResult(record("job-3", JobStatus.RUNNING), true));
    ServletTester own = ServletTestSupport.start(new JobServlet(jobs, real), "/api/job");
    try {
      HttpTester.Response resp =
          ServletTestSupport.send(own, "POST", "/api/job", "{\"mode\":\"convert\",\"dry_run\":true}");

      assertEquals(202, resp.getStatus());
      verify(jobs)
          .start(JobMode.CONVERT, true, new JobParameters("/audiobooks", "stereo", 96));
      Settings saved = real.load();
      assertEquals(JobMode.CONVERT, saved.lastMode());
      assertTrue(saved.lastDryRun());
      assertEquals("stereo", saved.audioMode());
    } finally {
      own.stop();
    }
  }
}
