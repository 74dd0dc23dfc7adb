package com.m4brew.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.m4brew.management.jobs.JobManager;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;

class JobCancelServletTest {

  @Test
  void reportsWhetherAJobWasCanceled() throws Exception {
    JobManager jobs = mock(JobManager.class);
    when(jobs.requestCancel()).thenReturn(true, false);
    ServletTester tester = ServletTestSupport.start(new JobCancelServlet(jobs), "/api/job/cancel");
    try {
      HttpTester.Response first =
          ServletTestSupport.send(tester, "POST", "/api/job/cancel", null);
      assertEquals(202, first.getStatus());
      assertTrue(first.getContent().contains("\"canceled\":true"));

      HttpTester.Response second =
          ServletTestSupport.send(tester, "POST", "/api/job/cancel", null);
      assertEquals(202, second.getStatus());
      assertTrue(second.getContent().contains("\"canceled\":false"));
    } finally {
      tester.stop();
    }
  }
}
