package p2m;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class CompilerMainTest {

  @TempDir File tempDir;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private File input;

  @BeforeEach
  public void writeInput() throws IOException {
    input = new File(tempDir, "input.json");
    write(input, "{\"logical_not\": {\"indicator\": \"x\"}}");
  }

  private static void write(File file, String content) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
  }

  private int run(String... args) {
    return CompilerMain.run(
        args,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void printsToStdout() {
    assertThat(run("-j", input.getPath())).isEqualTo(0);
    assertThat(out().trim()).isEqualTo("1-x");
    assertThat(err()).startsWith("prog2math");
  }

  @Test
  public void writesOutputFile() throws IOException {
    File output = new File(tempDir, "formula.tex");
    assertThat(run("--jsonfile", input.getPath(), "--output", output.getPath(), "-q"))
        .isEqualTo(0);
    assertThat(Files.asCharSource(output, StandardCharsets.UTF_8).read()).isEqualTo("1-x");
    assertThat(out()).isEmpty();
    assertThat(err()).isEmpty();
  }

  @Test
  public void reportsCompilerErrors() throws IOException {
    write(input, "{\"no_such_op\": {}}");
    assertThat(run("-j", input.getPath())).isEqualTo(1);
    assertThat(err()).contains("ERROR: no_such_op Operation \"no_such_op\" not found");
    assertThat(out()).isEmpty();
  }

  @Test
  public void quietSuppressesErrors() throws IOException {
    write(input, "{\"no_such_op\": {}}");
    assertThat(run("-q", "-j", input.getPath())).isEqualTo(1);
    assertThat(err()).isEmpty();
  }

  @Test
  public void reportsUnreadableInput() throws IOException {
    write(input, "{\"logical_not\": ");
    assertThat(run("-j", input.getPath())).isEqualTo(1);
    assertThat(err()).contains("ERROR: cannot read");

    assertThat(run("-j", new File(tempDir, "missing.json").getPath())).isEqualTo(1);
  }

  @Test
  public void maxDepth() throws IOException {
    write(input, "{\"logical_not\": {\"indicator\": {\"logical_not\": {\"indicator\": \"x\"}}}}");
    assertThat(run("-j", input.getPath(), "--max-depth", "1")).isEqualTo(1);
    assertThat(err()).contains("calls are nested more than 1 deep");
  }

  @Test
  public void usage() {
    assertThat(run()).isEqualTo(1);
    assertThat(run("-o", "-")).isEqualTo(1);
    assertThat(run("-j")).isEqualTo(1);
    assertThat(run("-j", input.getPath(), "--max-depth", "zero")).isEqualTo(1);
    assertThat(run("-j", input.getPath(), "--max-depth", "0")).isEqualTo(1);
    assertThat(run("-j", input.getPath(), "--bogus", "1")).isEqualTo(1);
    assertThat(err()).contains("Usage:");
  }
}
