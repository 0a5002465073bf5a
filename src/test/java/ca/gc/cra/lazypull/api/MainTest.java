package ca.gc.cra.lazypull.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lazypull.testutil.TemplateFixtures;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

  @TempDir Path tempDir;

  private StringWriter stdout;

  @BeforeEach
  void captureStdout() {
    stdout = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(stdout, true));
  }

  @AfterEach
  void restoreStdout() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(stdout.toString().contains("generate"));
    assertTrue(stdout.toString().contains("show"));
  }

  @Test
  void missingAndUnknownCommandsAreInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"mount"}));
  }

  @Test
  void showPrintsRedactedTemplate() throws Exception {
    Path template = TemplateFixtures.write(tempDir, "fscache.json", TemplateFixtures.FSCACHE_REGISTRY);

    ExitCode exit = Main.run(new String[] {"show", "template=" + template, "driver=fscache"});

    assertEquals(ExitCode.SUCCESS, exit);
    String printed = stdout.toString();
    assertTrue(printed.contains("\"domain_id\":\"domain-1\""));
    assertFalse(printed.contains("dGVtcGxhdGU6c2VjcmV0"));
  }

  @Test
  void showWithMissingTemplateIsAConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR,
        Main.run(new String[] {"show", "template=" + tempDir.resolve("missing.json")}));
  }
}
