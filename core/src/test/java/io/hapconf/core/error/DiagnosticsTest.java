package io.hapconf.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.hapconf.core.model.SourceLocation;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DiagnosticsTest {

    private static final SourceLocation AT = new SourceLocation("t.hap", 4, 2);

    @Nested
    @DisplayName("Exceptions")
    class Exceptions {

        @Test
        void phasesBoundToSubclasses() {
            assertThat(new ParseException("m", ";", AT).phase()).isEqualTo(TranslateException.Phase.PARSE);
            assertThat(new BuildException("m", AT).phase()).isEqualTo(TranslateException.Phase.BUILD);
            assertThat(new InternalTranslationException("m", AT).phase())
                    .isEqualTo(TranslateException.Phase.GENERATE);
            assertThat(new ValidationException(List.of(new ValidationError("m", AT))).phase())
                    .isEqualTo(TranslateException.Phase.VALIDATE);
        }

        @Test
        void missingLocationBecomesUnknown() {
            BuildException e = new BuildException("m", null);
            assertThat(e.location()).isEqualTo(SourceLocation.UNKNOWN);
            assertThat(e.detail()).isEqualTo("m");
        }

        @Test
        void validationSummary() {
            ValidationError first = new ValidationError("Backend 'b' has no servers", AT);
            ValidationError second = new ValidationError("Duplicate frontend name 'f'", AT);

            assertThat(new ValidationException(List.of(first)))
                    .hasMessage("Validation failed: Backend 'b' has no servers");
            assertThat(new ValidationException(List.of(first, second)))
                    .hasMessage("Validation failed with 2 errors; first: Backend 'b' has no servers");
        }

        @Test
        void resolutionCarriesNames() {
            ResolutionException e = new ResolutionException("m", TranslateException.Phase.RESOLVE, List.of("a"), AT);
            assertThat(e.names()).containsExactly("a");
            assertThat(new ResolutionException("m", TranslateException.Phase.UNROLL, AT).names()).isEmpty();
        }
    }

    @Test
    void formatIncludesLocationAndSeverity() {
        assertThat(Diagnostic.error(TranslateException.Phase.PARSE, "boom", AT).format())
                .isEqualTo("t.hap:4:2: error: boom");
        assertThat(Diagnostic.warning("hmm", AT).format()).isEqualTo("t.hap:4:2: warning: hmm");
        assertThat(Diagnostic.warning("hmm", null).location()).isEqualTo(SourceLocation.UNKNOWN);
    }

    @Test
    void singleExceptionBecomesOneError() {
        Diagnostic warning = Diagnostic.warning("w", AT);
        Diagnostics d = Diagnostics.fromException(new ParseException("bad token", ";", AT), List.of(warning));

        assertThat(d.size()).isEqualTo(2);
        assertThat(d.hasErrors()).isTrue();
        assertThat(d.errors()).singleElement().satisfies(e -> {
            assertThat(e.phase()).isEqualTo(TranslateException.Phase.PARSE);
            assertThat(e.message()).isEqualTo("bad token");
        });
        assertThat(d.warnings()).containsExactly(warning);
    }

    @Test
    void validationExceptionExpandsPerViolation() {
        ValidationException e = new ValidationException(List.of(
                new ValidationError("first", AT), new ValidationError("second", AT)));

        Diagnostics d = Diagnostics.fromException(e, List.of());

        assertThat(d.all()).extracting(Diagnostic::message).containsExactly("first", "second");
        assertThat(d.all()).allSatisfy(x -> assertThat(x.phase()).isEqualTo(TranslateException.Phase.VALIDATE));
    }

    @Test
    void emptyIsShared() {
        assertThat(Diagnostics.of(List.of())).isSameAs(Diagnostics.empty());
        assertThat(Diagnostics.empty().isEmpty()).isTrue();
        assertThat(Diagnostics.empty().hasErrors()).isFalse();
    }
}
