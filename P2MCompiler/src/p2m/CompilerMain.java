package p2m;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.google.common.io.Files;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

public class CompilerMain {

  private static final String BANNER = "prog2math: turns programming into mathematical formulae";

  private static final String USAGE =
      "Usage: $COMPILER -j json_file [-o output_file|-] [-q] [--max-depth n]";

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Optional<Flags> maybeFlags = Flags.parse(args);
    if (!maybeFlags.isPresent()) {
      err.println(USAGE);
      return 1;
    }

    Flags flags = maybeFlags.get();
    if (!flags.quiet) {
      err.println(BANNER);
    }

    Expression expr;
    try {
      JsonElement input = JsonParser.parseString(read(new File(flags.jsonFile)));
      expr = new CallGraphCompiler(OperationRegistry.standard(), flags.options).compile(input);
    } catch (CompilerException ex) {
      if (!flags.quiet) {
        ex.print(err);
      }
      return 1;
    } catch (IOException | JsonParseException ex) {
      if (!flags.quiet) {
        err.println(String.format("ERROR: cannot read %s: %s", flags.jsonFile, ex.getMessage()));
      }
      return 1;
    }

    if (flags.outputFile.equals("-")) {
      out.println(expr);
      return 0;
    }

    try {
      write(expr.toString(), new File(flags.outputFile));
    } catch (IOException ex) {
      if (!flags.quiet) {
        err.println(String.format("ERROR: cannot write %s: %s", flags.outputFile, ex.getMessage()));
      }
      return 1;
    }
    return 0;
  }

  private static final class Flags {
    private String jsonFile = null;
    private String outputFile = "-";
    private boolean quiet = false;
    private CompilerOptions options = CompilerOptions.defaults();

    private static Optional<Flags> parse(String[] args) {
      Flags flags = new Flags();
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        switch (arg) {
          case "-q":
          case "--quiet":
            flags.quiet = true;
            continue;
          default:
            break;
        }

        // Everything else takes a value.
        if (i + 1 >= args.length) return Optional.empty();
        String value = args[++i];
        switch (arg) {
          case "-j":
          case "--jsonfile":
            flags.jsonFile = value;
            break;
          case "-o":
          case "--output":
            flags.outputFile = value;
            break;
          case "--max-depth":
            try {
              flags.options =
                  CompilerOptions.builder().setMaxDepth(Integer.parseInt(value)).build();
            } catch (IllegalArgumentException ex) {
              // NumberFormatException included.
              return Optional.empty();
            }
            break;
          default:
            return Optional.empty();
        }
      }

      return flags.jsonFile == null ? Optional.empty() : Optional.of(flags);
    }
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
