package com.clinicdocs.search.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    private final NameNormalizer normalizer = new NameNormalizer();

    @ParameterizedTest(name = "[{index}] \"{0}\" -> \"{1}\"")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "garcia lopez, maria            | GARCIA LOPEZ, MARIA",
        "  José   García-López , María  | JOSE GARCIA LOPEZ, MARIA",
        "O'Brien, Seán                  | OBRIEN, SEAN",
        "Núñez,Iñaki                    | NUNEZ, INAKI",
        "PEREZ, JUAN, CARLOS            | PEREZ, JUAN CARLOS",
        ", MARIA                        | MARIA",
        "MARIA GARCIA                   | MARIA GARCIA"
    })
    @DisplayName("Should canonicalize names")
    void shouldNormalize(String raw, String expected) {
        assertThat(normalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Normalizing twice changes nothing")
    void shouldBeIdempotent() {
        String once = normalizer.normalize("  d'Alembert-Ñúñez ,  josé  maría ");

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("Should return empty for null or punctuation only input")
    void shouldReturnEmptyForNothingSearchable() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("  --- ,, ")).isEmpty();
    }

    @Test
    @DisplayName("Should split into whole word tokens")
    void shouldTokenize() {
        assertThat(normalizer.tokens("GARCIA LOPEZ, MARIA")).containsExactly("GARCIA", "LOPEZ", "MARIA");
        assertThat(normalizer.tokens("")).isEmpty();
    }
}
