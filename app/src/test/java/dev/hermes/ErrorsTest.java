package dev.hermes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import dev.hermes.codegen.EmissionFault;
import dev.hermes.parsing.LexicalError;
import org.junit.jupiter.api.Test;

class ErrorsTest {
  @Test
  void formatsKindPositionAndMessage() {
    assertThat(
        Errors.format(new LexicalError("Unterminated string.", 4, 7)),
        is("Lexical Error: [line 4, column 7] Unterminated string.")
    );
  }

  @Test
  void omitsUnknownColumn() {
    assertThat(
        Errors.format(new EmissionFault("No emission rule.", 2, 0)),
        is("Emission Fault: [line 2] No emission rule.")
    );
  }
}
