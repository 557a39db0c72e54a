package dev.hermes.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class PythonLiteralsTest {
  @Test
  void floatsFollowPythonRepr() {
    assertThat(PythonLiterals.floating(1.0), is("1.0"));
    assertThat(PythonLiterals.floating(0.1), is("0.1"));
    assertThat(PythonLiterals.floating(123.456), is("123.456"));
    assertThat(PythonLiterals.floating(-2.5), is("-2.5"));
    assertThat(PythonLiterals.floating(0.0001), is("0.0001"));
    assertThat(PythonLiterals.floating(1e-5), is("1e-05"));
    assertThat(PythonLiterals.floating(1e15), is("1000000000000000.0"));
    assertThat(PythonLiterals.floating(1e16), is("1e+16"));
    assertThat(PythonLiterals.floating(1.5e300), is("1.5e+300"));
  }

  @Test
  void specialFloatsHaveSpellings() {
    assertThat(PythonLiterals.floating(0.0), is("0.0"));
    assertThat(PythonLiterals.floating(-0.0), is("-0.0"));
    assertThat(PythonLiterals.floating(Double.NaN), is("float('nan')"));
    assertThat(
        PythonLiterals.floating(Double.NEGATIVE_INFINITY), is("float('-inf')")
    );
  }

  @Test
  void integersHaveNoSizeLimit() {
    BigInteger big = new BigInteger("123456789012345678901234567890");

    assertThat(PythonLiterals.integer(big), is("123456789012345678901234567890"));
  }

  @Test
  void stringsAreEscaped() {
    assertThat(
        PythonLiterals.string("a\"b\\c\r\t"), is("\"a\\\"b\\\\c\\r\\t\"")
    );
    assertThat(PythonLiterals.string("it's"), is("\"it's\""));
  }

  @Test
  void controlCharactersAreHexEscaped() {
    assertThat(PythonLiterals.string("a\u0000b"), is("\"a\\x00b\""));
    assertThat(PythonLiterals.string("\u001b[0m\u007f"), is("\"\\x1b[0m\\x7f\""));
    assertThat(PythonLiterals.formattedString("{x}\u0007"), is("f\"{x}\\x07\""));
  }

  @Test
  void formattedStringsPickTheQuoteThatNeedsNoEscape() {
    assertThat(PythonLiterals.formattedString("{x}"), is("f\"{x}\""));
    assertThat(
        PythonLiterals.formattedString("say \"{x}\""), is("f'say \"{x}\"'")
    );
  }

  @Test
  void formattedStringsWithBothQuotesAreTripleQuoted() {
    assertThat(
        PythonLiterals.formattedString("{d[\"k\"]} isn't"),
        is("f\"\"\"{d[\"k\"]} isn't\"\"\"")
    );
    assertThat(
        PythonLiterals.formattedString("it's \"{x}\""),
        is("f\"\"\"it's \"{x}\\\"\"\"\"")
    );
    assertThat(
        PythonLiterals.formattedString("\"\"\" {d['k']}"),
        is("f'''\"\"\" {d['k']}'''")
    );
  }

  @Test
  void formattedStringsKeepDoubledBracesAsText() {
    assertThat(
        PythonLiterals.formattedString("{{\"lit\"}} {x} '"),
        is("f\"\"\"{{\"lit\"}} {x} '\"\"\"")
    );
  }
}
