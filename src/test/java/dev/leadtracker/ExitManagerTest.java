package dev.leadtracker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExitManagerTest {

  @Test
  void exit_underTestRunner_doesNotTerminate() {
    ExitManager exitManager = new ExitManager();

    exitManager.exit(0);
    exitManager.exit(1);

    // still running
    assertTrue(exitManager.isTest());
  }

  @Test
  void exit_consultsTestDetectionOnEveryCall() {
    List<Integer> checks = new ArrayList<>();
    ExitManager exitManager = new ExitManager() {
      @Override
      protected boolean isTest() {
        checks.add(checks.size());
        return true;
      }
    };

    exitManager.exit(1);
    exitManager.exit(1);

    assertEquals(2, checks.size());
  }
}
