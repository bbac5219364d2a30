package io.laminar.core.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.laminar.core.TestSheets;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.template.SheetTable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryingExtractionCollaboratorTest {

    private ExtractionCollaborator delegate;
    private RetryingExtractionCollaborator collaborator;
    private SheetTable sheet;

    @BeforeEach
    void setUp() {
        delegate = mock(ExtractionCollaborator.class);
        collaborator =
                new RetryingExtractionCollaborator(
                        delegate, Duration.ofSeconds(5), 3, Duration.ofMillis(1));
        sheet = TestSheets.orderSheet();
    }

    @AfterEach
    void tearDown() {
        collaborator.close();
    }

    @Test
    void shouldRetryTransientFailures() throws Exception {
        ProcessDocument document = new ProcessDocument("p", "P", List.of(), List.of());
        when(delegate.extract(any()))
                .thenThrow(new CollaboratorException("connection reset", true))
                .thenReturn(document);

        ProcessDocument result = collaborator.extract(sheet);

        assertThat(result).isSameAs(document);
        verify(delegate, times(2)).extract(sheet);
    }

    @Test
    void shouldFailImmediatelyOnPermanentFailure() throws Exception {
        when(delegate.extract(any()))
                .thenThrow(new CollaboratorException("ANTHROPIC_API_KEY is not set", false));

        assertThatThrownBy(() -> collaborator.extract(sheet))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("ANTHROPIC_API_KEY is not set");
        verify(delegate, times(1)).extract(sheet);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() throws Exception {
        when(delegate.extract(any())).thenThrow(new IllegalStateException("bad json"));

        assertThatThrownBy(() -> collaborator.extract(sheet))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageStartingWith("AI extraction failed after 3 attempt(s)")
                .satisfies(e -> assertThat(((CollaboratorException) e).isTransient()).isTrue());
        verify(delegate, times(3)).extract(sheet);
    }

    @Test
    void shouldAbandonAttemptsThatExceedTheTimeout() throws Exception {
        ExtractionCollaborator slow =
                table -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new ProcessDocument("p", null, List.of(), List.of());
                };
        try (RetryingExtractionCollaborator limited =
                new RetryingExtractionCollaborator(
                        slow, Duration.ofMillis(50), 1, Duration.ZERO)) {

            assertThatThrownBy(() -> limited.extract(sheet))
                    .isInstanceOf(CollaboratorException.class)
                    .hasMessageContaining("failed after 1 attempt(s)")
                    .hasRootCauseInstanceOf(TimeoutException.class);
        }
    }
}
