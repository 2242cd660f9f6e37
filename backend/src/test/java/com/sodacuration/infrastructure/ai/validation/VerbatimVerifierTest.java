package com.sodacuration.infrastructure.ai.validation;

import com.sodacuration.domain.verification.model.VerificationResult;
import com.sodacuration.infrastructure.ai.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VerbatimVerifierTest {

    private VerbatimVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new VerbatimVerifier(new TextNormalizer());
    }

    @Nested
    @DisplayName("Verbatim extractions")
    class Verbatim {

        @Test
        @DisplayName("caption found inside a longer legend")
        void caption_in_legend() {
            VerificationResult result = verifier.verify(
                    "This is a test caption.",
                    "Figure 1: This is a test caption. Figure 2: another caption follows.");

            assertThat(result.verbatim()).isTrue();
            assertThat(result.detail()).isEqualTo("The extraction is verbatim");
        }

        @Test
        @DisplayName("differences in markup, case, accents and spacing are ignored")
        void normalization_differences_ignored() {
            VerificationResult result = verifier.verify(
                    "Cells were treated with  NAÏVE serum (10 mM).",
                    "<p>Figure 3. <i>Cells</i> were treated with na&iuml;ve serum 10 mM; scale bar 5 um.</p>");

            assertThat(result.verbatim()).isTrue();
        }

        @Test
        @DisplayName("identical texts are verbatim")
        void identical() {
            assertThat(verifier.verify("Panel A shows X.", "Panel A shows X.").verbatim()).isTrue();
        }
    }

    @Nested
    @DisplayName("Non-verbatim extractions")
    class NotVerbatim {

        @Test
        @DisplayName("skipping the middle of a passage is not verbatim")
        void skipped_middle() {
            String original = "Start " + "middle ".repeat(100) + "end.";

            VerificationResult result = verifier.verify("Start ... end.", original);

            assertThat(result.verbatim()).isFalse();
            assertThat(result.detail()).isEqualTo("The extraction is NOT verbatim");
        }

        @Test
        @DisplayName("paraphrased text is not verbatim")
        void paraphrase() {
            VerificationResult result = verifier.verify(
                    "Cells were stained with DAPI.",
                    "Nuclei were counterstained with DAPI.");

            assertThat(result.verbatim()).isFalse();
        }

        @Test
        @DisplayName("reordered words are not verbatim")
        void reordered() {
            assertThat(verifier.verify("B A", "A B C").verbatim()).isFalse();
        }
    }

    @Nested
    @DisplayName("Empty input")
    class EmptyInput {

        @Test
        @DisplayName("empty extraction is reported, not thrown")
        void empty_extraction() {
            VerificationResult result = verifier.verify("", "Figure 1 legend");

            assertThat(result.verbatim()).isFalse();
            assertThat(result.detail()).isEqualTo("One or both texts are empty");
        }

        @Test
        @DisplayName("null source is reported, not thrown")
        void null_source() {
            VerificationResult result = verifier.verify("caption", null);

            assertThat(result.verbatim()).isFalse();
            assertThat(result.detail()).isEqualTo("One or both texts are empty");
        }

        @Test
        @DisplayName("markup-only extraction counts as empty")
        void markup_only() {
            VerificationResult result = verifier.verify("<br/><p></p> ...", "Figure 1 legend");

            assertThat(result.verbatim()).isFalse();
            assertThat(result.detail()).isEqualTo("One or both texts are empty");
        }
    }
}
