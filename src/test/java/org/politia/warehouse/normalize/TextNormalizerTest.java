package org.politia.warehouse.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TextNormalizer Unit Tests")
class TextNormalizerTest {

    @ParameterizedTest(name = "[{index}] \"{0}\" -> \"{1}\"")
    @CsvSource(delimiter = '|', value = {
        "PRESIDENTE LI Silvana Andreina | LI SILVANA ANDREINA",
        "On. Giulia   Bianchi          | GIULIA BIANCHI",
        "Senatore D'Alema              | DALEMA",
        "mario\trossi                  | MARIO ROSSI",
        "Minister of Economy           | OF ECONOMY",
        "Niccolò Fabbri                | NICCOLÒ FABBRI",
        "PRESIDENTE                    | ''"
    })
    @DisplayName("Should uppercase, strip punctuation and remove title tokens")
    void shouldNormalizeNames(String raw, String expected) {
        assertThat(TextNormalizer.normalizeName(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should only strip titles matching whole tokens")
    void shouldKeepTitlesInsideLongerTokens() {
        // Given
        String raw = "Ministrone Presidentessa";

        // When
        String normalized = TextNormalizer.normalizeName(raw);

        // Then
        assertThat(normalized).isEqualTo("MINISTRONE PRESIDENTESSA");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "PRESIDENTE LI Silvana Andreina",
        "  on.  Maria-Elena   Boschi ",
        "Sen. Dott. Giuseppe Conte",
        "***",
        "Onorevole ministra Lamorgese"
    })
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent(String raw) {
        String once = TextNormalizer.normalizeName(raw);

        assertThat(TextNormalizer.normalizeName(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n", ".,;"})
    @DisplayName("Should return empty string for blank or punctuation-only names")
    void shouldReturnEmptyForBlankNames(String raw) {
        assertThat(TextNormalizer.normalizeName(raw)).isEmpty();
    }

    @Test
    @DisplayName("Should treat no-break and other Unicode spaces as whitespace in names")
    void shouldSplitNamesOnUnicodeSpaces() {
        assertThat(TextNormalizer.normalizeName("Mario\u00A0Rossi")).isEqualTo("MARIO ROSSI");
        assertThat(TextNormalizer.normalizeName("\u2007On.\u202FGiulia\u00A0\u00A0Bianchi\u3000")).isEqualTo("GIULIA BIANCHI");
    }

    @Test
    @DisplayName("Should treat text made only of Unicode spaces as empty")
    void shouldTrimUnicodeSpacesFromText() {
        assertThat(TextNormalizer.normalizeText("\u00A0\u00A0")).isEmpty();
        assertThat(TextNormalizer.normalizeText("\u00A0 Grazie.\u2009\n")).isEqualTo("Grazie.");
        assertThat(TextNormalizer.normalizeText("Signor\u00A0Presidente")).isEqualTo("Signor\u00A0Presidente");
    }

    @Test
    @DisplayName("Should split raw words on any whitespace")
    void shouldSplitWords() {
        assertThat(TextNormalizer.words(" Carlo\u00A0 Verdi ")).containsExactly("Carlo", "Verdi");
        assertThat(TextNormalizer.words("\u00A0")).isEmpty();
        assertThat(TextNormalizer.words(null)).isEmpty();
    }

    @Test
    @DisplayName("Should trim text and map null to empty")
    void shouldNormalizeText() {
        assertThat(TextNormalizer.normalizeText("  Dichiaro aperta la seduta.\n")).isEqualTo("Dichiaro aperta la seduta.");
        assertThat(TextNormalizer.normalizeText(null)).isEmpty();
        assertThat(TextNormalizer.normalizeText(" \t ")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"2023-05-10", "20230510", "10/05/2023", " 2023-05-10 "})
    @DisplayName("Should parse supported date formats")
    void shouldParseDates(String raw) {
        assertThat(TextNormalizer.parseDate(raw)).isEqualTo(LocalDate.of(2023, 5, 10));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"yesterday", "2023-13-45", "10 maggio 2023"})
    @DisplayName("Should fall back to the unknown date sentinel")
    void shouldFallBackToUnknownDate(String raw) {
        // When
        LocalDate parsed = TextNormalizer.parseDate(raw);

        // Then
        assertThat(parsed).isEqualTo(TextNormalizer.UNKNOWN_DATE);
        assertThat(TextNormalizer.isUnknownDate(parsed)).isTrue();
    }

    @Test
    @DisplayName("Should treat null as an unknown date")
    void shouldTreatNullAsUnknownDate() {
        assertThat(TextNormalizer.isUnknownDate(null)).isTrue();
        assertThat(TextNormalizer.isUnknownDate(LocalDate.of(2023, 5, 10))).isFalse();
    }
}
