package dev.hermes;

import dev.hermes.codegen.Transpiler;
import dev.hermes.parsing.Lexer;
import dev.hermes.parsing.Parser;
import dev.hermes.parsing.Program;
import dev.hermes.parsing.Token;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Runs the whole pipeline (lexer -> parser -> transpiler) on one source text.
// Every call uses fresh stage instances, so a Translator can be shared.
public class Translator {
  private static final Logger logger =
      LoggerFactory.getLogger(Translator.class);

  public static class Options {
    boolean lenientIndentation = false;

    public Options lenientIndentation(boolean lenient) {
      this.lenientIndentation = lenient;
      return this;
    }
  }

  private final Options options;

  public Translator() { this(new Options()); }

  public Translator(Options options) { this.options = options; }

  // pre-condition: none, any text is accepted
  // post-condition: returns Python source, or throws a HermesError and
  // produces no partial output
  public String translate(String source) {
    Program program = parse(source);
    String python = new Transpiler().emit(program);
    logger.debug("emitted {} characters of Python", python.length());
    return python;
  }

  public Program parse(String source) {
    var lexerOptions =
        new Lexer.Options().lenientIndentation(options.lenientIndentation);
    List<Token> tokens = new Lexer(source, lexerOptions).tokenize();
    logger.debug("lexed {} tokens", tokens.size());

    Program program = new Parser(tokens).parse();
    logger.debug("parsed {} top-level statements", program.statements.size());
    return program;
  }

  // Same as translate, discarding the output: only the errors matter.
  public void check(String source) { translate(source); }
}
