package dev.hermes;

import dev.hermes.parsing.AstPrinter;
import dev.hermes.parsing.Lexer;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Hermes {
  // exit codes follow sysexits.h
  static final int EX_OK = 0;
  static final int EX_USAGE = 64;
  static final int EX_DATAERR = 65;
  static final int EX_NOINPUT = 66;
  static final int EX_SOFTWARE = 70;
  static final int EX_IOERR = 74;

  private static final String USAGE = ""
      + "Usage: hermes <command> [options]\n"
      + "\n"
      + "Commands:\n"
      + "  run <file> [--debug]            translate and execute with Python\n"
      + "  compile <file> [-o out] [--ast] print or write the translation\n"
      + "  check <file>                    report errors only\n"
      + "  repl                            interactive translation\n"
      + "  help                            show this message\n"
      + "\n"
      + "Options:\n"
      + "  --lenient-indent  accept inconsistent dedents\n"
      + "  --verbose         log pipeline details";

  private final PrintStream out;
  private final PrintStream err;
  private final PythonRunner runner;
  private final Logger logger = LoggerFactory.getLogger(Hermes.class);

  public Hermes(PrintStream out, PrintStream err, PythonRunner runner) {
    this.out = out;
    this.err = err;
    this.runner = runner;
  }

  public static void main(String[] args) {
    // must happen before the first logger is created
    if (List.of(args).contains("--verbose") || Boolean.getBoolean("hermes.debug"))
      System.setProperty("org.slf4j.simpleLogger.log.dev.hermes", "debug");

    Hermes hermes = new Hermes(System.out, System.err, new PythonRunner());
    System.exit(hermes.execute(args));
  }

  // Parsed command line: one command, at most one file, and flags.
  static class Invocation {
    String command;
    String file;
    String output;
    boolean debug = false;
    boolean ast = false;
    boolean lenientIndentation = false;
  }

  // post-condition: returns the process exit code; nothing is thrown for
  // user errors
  public int execute(String... args) {
    Invocation invocation;
    try {
      invocation = parseArguments(args);
    } catch (IllegalArgumentException e) {
      Errors.fail(e.getMessage(), err);
      err.println(USAGE);
      return EX_USAGE;
    }
    logger.debug("command '{}' on {}", invocation.command, invocation.file);

    switch (invocation.command) {
    case "help":
      out.println(USAGE);
      return EX_OK;
    case "repl":
      return runPrompt(invocation);
    default:
      return runFile(invocation);
    }
  }

  static Invocation parseArguments(String[] args) {
    Invocation invocation = new Invocation();
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
      case "--debug":
        invocation.debug = true;
        break;
      case "--ast":
        invocation.ast = true;
        break;
      case "--lenient-indent":
        invocation.lenientIndentation = true;
        break;
      case "--verbose":
        break;
      case "-o":
      case "--output":
        if (i + 1 >= args.length)
          throw new IllegalArgumentException(arg + " needs a file name.");
        invocation.output = args[++i];
        break;
      default:
        if (arg.startsWith("-"))
          throw new IllegalArgumentException("Unknown option " + arg + ".");
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      invocation.command = "help";
      return invocation;
    }

    invocation.command = positional.get(0);
    switch (invocation.command) {
    case "help":
    case "repl":
      if (positional.size() > 1)
        throw new IllegalArgumentException(
            invocation.command + " takes no arguments."
        );
      break;
    case "run":
    case "compile":
    case "check":
      if (positional.size() != 2)
        throw new IllegalArgumentException(
            invocation.command + " needs exactly one file."
        );
      invocation.file = positional.get(1);
      break;
    default:
      throw new IllegalArgumentException(
          "Unknown command " + invocation.command + "."
      );
    }
    return invocation;
  }

  private int runFile(Invocation invocation) {
    Path path = Paths.get(invocation.file);
    String source;
    try {
      source = Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      Errors.fail("File not found: " + invocation.file, err);
      return EX_NOINPUT;
    } catch (IOException e) {
      Errors.fail("Cannot read " + invocation.file + ": " + e.getMessage(), err);
      return EX_IOERR;
    }

    Translator translator = new Translator(
        new Translator.Options().lenientIndentation(invocation.lenientIndentation)
    );
    try {
      switch (invocation.command) {
      case "check":
        translator.check(source);
        out.println("OK: " + invocation.file);
        return EX_OK;
      case "compile":
        return compile(translator, source, invocation);
      default:
        return run(translator.translate(source), invocation);
      }
    } catch (HermesError error) {
      Errors.report(error, err);
      return EX_DATAERR;
    }
  }

  private int compile(Translator translator, String source, Invocation invocation) {
    String result = invocation.ast
        ? new AstPrinter().print(translator.parse(source))
        : translator.translate(source);

    if (invocation.output == null) {
      out.println(result);
      return EX_OK;
    }

    try {
      Files.writeString(
          Paths.get(invocation.output), result + "\n", StandardCharsets.UTF_8
      );
    } catch (IOException e) {
      Errors.fail("Cannot write " + invocation.output + ": " + e.getMessage(), err);
      return EX_IOERR;
    }
    out.println("Compiled to: " + invocation.output);
    return EX_OK;
  }

  private int run(String python, Invocation invocation) {
    if (invocation.debug) {
      out.println("=== Translated Python ===");
      out.println(python);
      out.println("=== Output ===");
    }
    out.flush();

    try {
      return runner.run(python);
    } catch (IOException e) {
      Errors.fail(
          "Cannot start " + runner.interpreter() + ": " + e.getMessage(), err
      );
      return EX_SOFTWARE;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      Errors.fail("Interrupted while running " + runner.interpreter(), err);
      return EX_SOFTWARE;
    }
  }

  private int runPrompt(Invocation invocation) {
    Translator translator = new Translator(
        new Translator.Options().lenientIndentation(invocation.lenientIndentation)
    );

    try (Terminal terminal = TerminalBuilder.builder().build()) {
      showBannerAndHelp(terminal);
      PrintWriter writer = terminal.writer();
      LineReader reader = createReplReader(terminal);

      while (true) {
        String block;
        try {
          block = readBlock(reader);
        } catch (UserInterruptException | EndOfFileException e) {
          break;
        }
        if (block == null)
          break;
        if (block.isBlank())
          continue;

        // if the user makes a mistake, we don't kill the session
        try {
          writer.println(translator.translate(block));
        } catch (HermesError error) {
          writer.println(Errors.format(error));
        }
        writer.println();
        writer.flush();
      }
    } catch (IOException e) {
      Errors.fail("Cannot open a terminal: " + e.getMessage(), err);
      return EX_IOERR;
    }
    return EX_OK;
  }

  // Reads lines until an empty one. Returns null when the user asks to quit.
  private static String readBlock(LineReader reader) {
    StringBuilder block = new StringBuilder();
    String prompt = ">>> ";
    while (true) {
      String line = reader.readLine(prompt);
      if (block.length() == 0 && line.trim().equals("quit"))
        return null;
      if (line.isBlank())
        return block.toString();

      block.append(line).append('\n');
      prompt = "... ";
    }
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String logo =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("Hermes REPL: type code, get Python.")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- End a block with an empty line");
    terminal.writer().println("- Use «tab» for keyword completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(Lexer.keywords.keySet())
    );

    DefaultParser parser = new DefaultParser();
    // the lexer sees quotes and backslashes exactly as typed
    parser.setEscapeChars(new char[0]);
    parser.setQuoteChars(new char[0]);

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(parser)
        .completer(completer)
        // `!=` is an operator, not a history event
        .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
        .build();
  }
}
