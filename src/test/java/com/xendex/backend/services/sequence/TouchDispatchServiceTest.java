package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.enums.EventType;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.integrations.email.EmailSender;
import com.xendex.backend.integrations.email.SendResult;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadEvent;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.services.EventLogService;
import com.xendex.backend.services.SuppressionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TouchDispatchServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private EmailSender emailSender;

    @Mock
    private SuppressionService suppressionService;

    @Mock
    private EventLogService eventLogService;

    private SimpleMeterRegistry meterRegistry;
    private TouchDispatchService dispatchService;
    private Draft draft;
    private Lead lead;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatchService = new TouchDispatchService(leadRepository, emailSender, suppressionService, eventLogService,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        draft = Draft.builder().id(500L).leadId(10L).sequenceId(1L).touchNumber(1)
                .subjectOptions(List.of("Idea for Acme", "Quick question")).body("Hi Ana")
                .status(DraftStatus.APPROVED).build();
        lead = Lead.builder().id(10L).email("ana@acme.io").status(LeadStatus.QUALIFIED).build();
    }

    @Test
    void dispatch_ApprovedDraft_ShouldSendAndRecordSentEvent() {
        // given
        when(eventLogService.isDraftSent(500L)).thenReturn(false);
        when(leadRepository.findById(10L)).thenReturn(Optional.of(lead));
        when(suppressionService.isSuppressed("ana@acme.io")).thenReturn(false);
        when(emailSender.send("ana@acme.io", "Idea for Acme", "Hi Ana")).thenReturn(SendResult.sent("msg-1"));

        // when
        DispatchResult result = dispatchService.dispatch(draft);

        // then
        assertThat(result.isSent()).isTrue();
        assertThat(result.sentAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));

        ArgumentCaptor<LeadEvent> event = ArgumentCaptor.forClass(LeadEvent.class);
        verify(eventLogService).append(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(EventType.SENT);
        assertThat(event.getValue().getDraftId()).isEqualTo(500L);
        assertThat(event.getValue().getMessageId()).isEqualTo("msg-1");
        assertThat(meterRegistry.counter("sequence.touches.sent", "touch", "1").count()).isEqualTo(1.0);
    }

    @Test
    void dispatch_DraftAlreadySent_ShouldNotCallProvider() {
        // given
        when(eventLogService.isDraftSent(500L)).thenReturn(true);

        // when
        DispatchResult result = dispatchService.dispatch(draft);

        // then
        assertThat(result.status()).isEqualTo(DispatchResult.Status.ALREADY_SENT);
        verifyNoInteractions(emailSender);
        assertThat(meterRegistry.counter("sequence.duplicate_send.detected").count()).isEqualTo(1.0);
    }

    @Test
    void dispatch_SuppressedAddress_ShouldFailPermanently() {
        // given
        when(eventLogService.isDraftSent(500L)).thenReturn(false);
        when(leadRepository.findById(10L)).thenReturn(Optional.of(lead));
        when(suppressionService.isSuppressed("ana@acme.io")).thenReturn(true);

        // when
        DispatchResult result = dispatchService.dispatch(draft);

        // then
        assertThat(result.status()).isEqualTo(DispatchResult.Status.FAILED);
        assertThat(result.retryable()).isFalse();
        verifyNoInteractions(emailSender);
    }

    @Test
    void dispatch_ProviderError_ShouldBeRetryableAndRecordNothing() {
        // given
        when(eventLogService.isDraftSent(500L)).thenReturn(false);
        when(leadRepository.findById(10L)).thenReturn(Optional.of(lead));
        when(suppressionService.isSuppressed("ana@acme.io")).thenReturn(false);
        when(emailSender.send(any(), any(), any())).thenReturn(SendResult.failed("rate limited"));

        // when
        DispatchResult result = dispatchService.dispatch(draft);

        // then
        assertThat(result.retryable()).isTrue();
        assertThat(result.error()).isEqualTo("rate limited");
        verify(eventLogService, never()).append(any());
    }
}
