package dev.hermes.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

class IdentifierMapTest {
  @Test
  void mapsVocabularyNames() {
    assertThat(IdentifierMap.map("myself"), is("self"));
    assertThat(IdentifierMap.map("initialize"), is("__init__"));
    assertThat(IdentifierMap.map("truth"), is("True"));
    assertThat(IdentifierMap.map("falsehood"), is("False"));
    assertThat(IdentifierMap.map("nothing"), is("None"));
  }

  @Test
  void leavesOtherNamesAlone() {
    assertThat(IdentifierMap.map("self"), is("self"));
    assertThat(IdentifierMap.map("myselfish"), is("myselfish"));
    assertThat(IdentifierMap.entries(), aMapWithSize(5));
  }

  @Test
  void remapsInsideReplacementFieldsOnly() {
    assertThat(
        IdentifierMap.mapFormatFields("myself: {myself.name}"),
        is("myself: {self.name}")
    );
    assertThat(
        IdentifierMap.mapFormatFields("{{myself}} {d['myself']} {x:>10}"),
        is("{{myself}} {d['myself']} {x:>10}")
    );
    assertThat(
        IdentifierMap.mapFormatFields("{truth!r} {1e5} {nothing_here}"),
        is("{True!r} {1e5} {nothing_here}")
    );
  }
}
