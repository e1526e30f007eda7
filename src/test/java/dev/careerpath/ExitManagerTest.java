package dev.careerpath;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ExitManagerTest {

  @Test
  void exitIsSkippedUnderTest() {
    ExitManager exitManager = new ExitManager();
    exitManager.exit(0);
    exitManager.exit(1);
    assertTrue(exitManager.isTest());
  }
}
