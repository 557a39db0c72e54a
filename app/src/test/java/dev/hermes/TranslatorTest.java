package dev.hermes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.hermes.codegen.EmissionFault;
import dev.hermes.parsing.LexicalError;
import dev.hermes.parsing.Program;
import dev.hermes.parsing.SyntaxError;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TranslatorTest {
  private static String resource(String name) throws IOException {
    try (InputStream in = TranslatorTest.class.getResourceAsStream("/examples/" + name)) {
      assertNotNull(in, "missing fixture " + name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static String normalize(String s) {
    String normalized = s.replace("\r\n", "\n");
    if (!normalized.endsWith("\n")) {
      normalized += "\n";
    }
    return normalized;
  }

  @ParameterizedTest
  @ValueSource(strings = {"hello", "classes", "control_flow"})
  void translatesExamplesToExpectedPython(String example) throws IOException {
    String source = resource(example + ".herm");
    String expected = resource(example + ".py");

    String actual = new Translator().translate(source);

    assertThat(normalize(actual), is(normalize(expected)));
  }

  @Test
  void translationIsDeterministic() throws IOException {
    String source = resource("classes.herm");
    Translator translator = new Translator();

    assertThat(translator.translate(source), is(translator.translate(source)));
  }

  @Test
  void emptySourceTranslatesToEmptyOutput() {
    assertThat(new Translator().translate(""), is(""));
    assertThat(new Translator().translate("# nothing to see\n\n"), is(""));
  }

  @Test
  void parseExposesTheTree() {
    Program program = new Translator().parse("a = 1\nb = 2\n");

    assertThat(program.statements, hasSize(2));
  }

  @Test
  void shouldPropagateLexicalErrors() {
    LexicalError error = assertThrows(
        LexicalError.class,
        () -> new Translator().translate("x = 1\nannounce(\"hi\n")
    );

    assertThat(error.line, is(2));
    assertThat(error.kind(), is("Lexical Error"));
  }

  @Test
  void shouldPropagateSyntaxErrors() {
    SyntaxError error = assertThrows(
        SyntaxError.class, () -> new Translator().check("scheme (x):\n    x\n")
    );

    assertThat(error.getMessage(), is("Expected IDENTIFIER, got LPAREN."));
  }

  @Test
  void honoursLenientIndentation() {
    String source = "aahaan x:\n        a = 1\n    b = 2\n";

    assertThrows(LexicalError.class, () -> new Translator().translate(source));

    Translator lenient =
        new Translator(new Translator.Options().lenientIndentation(true));
    assertThat(lenient.translate(source), startsWith("if x:\n    a = 1\n"));
  }

  @Test
  void allErrorsShareOneBase() {
    assertThat(HermesError.class.isAssignableFrom(LexicalError.class), is(true));
    assertThat(HermesError.class.isAssignableFrom(SyntaxError.class), is(true));
    assertThat(HermesError.class.isAssignableFrom(EmissionFault.class), is(true));
  }
}
