package com.xendex.backend.services;

import com.xendex.backend.dto.webhook.IngestionResult;
import com.xendex.backend.dto.webhook.ResendWebhookEvent;
import com.xendex.backend.enums.EventType;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadEvent;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadEventRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.sequence.ReplyHandlingService;
import com.xendex.backend.services.sequence.ReplyResult;
import com.xendex.backend.services.sequence.ReplySignal;
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
class EmailEventIngestionServiceTest {

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private LeadEventRepository eventRepository;

    @Mock
    private SequenceMembershipRepository membershipRepository;

    @Mock
    private EventLogService eventLogService;

    @Mock
    private SuppressionService suppressionService;

    @Mock
    private ReplyHandlingService replyHandlingService;

    private EmailEventIngestionService ingestionService;
    private Lead lead;
    private OffsetDateTime createdAt;

    @BeforeEach
    void setUp() {
        ingestionService = new EmailEventIngestionService(leadRepository, eventRepository, membershipRepository,
                eventLogService, suppressionService, replyHandlingService,
                Clock.fixed(Instant.parse("2025-03-02T08:00:00Z"), ZoneOffset.UTC));
        lead = Lead.builder().id(10L).email("ana@acme.io").status(LeadStatus.SEQUENCING).build();
        createdAt = OffsetDateTime.parse("2025-03-02T07:59:00Z");
    }

    @Test
    void ingest_Bounce_ShouldSuppressAddressAndStopMemberships() {
        // given
        LeadEvent sent = LeadEvent.builder().id(1L).leadId(10L).sequenceId(1L).draftId(500L).touchNumber(2)
                .eventType(EventType.SENT).messageId("msg-2").build();
        SequenceMembership membership = SequenceMembership.readyAfterFirstTouch(1L, 10L);
        when(eventLogService.isRecorded("msg-2", EventType.BOUNCED)).thenReturn(false);
        when(eventRepository.findFirstByMessageIdAndEventType("msg-2", EventType.SENT)).thenReturn(Optional.of(sent));
        when(leadRepository.findById(10L)).thenReturn(Optional.of(lead));
        when(membershipRepository.findByLeadIdAndStatusIn(10L, MembershipStatus.IN_FLIGHT))
                .thenReturn(List.of(membership));

        // when
        IngestionResult result = ingestionService.ingest(webhook("email.bounced", "msg-2", null));

        // then
        assertThat(result.status()).isEqualTo("recorded");
        assertThat(result.leadId()).isEqualTo(10L);
        verify(suppressionService).suppress("ana@acme.io", "bounced");
        assertThat(membership.getStatus()).isEqualTo(MembershipStatus.STOPPED);
        assertThat(membership.getStoppedReason()).isEqualTo("bounced");

        ArgumentCaptor<LeadEvent> event = ArgumentCaptor.forClass(LeadEvent.class);
        verify(eventLogService).append(event.capture());
        assertThat(event.getValue().getDraftId()).isEqualTo(500L);
        assertThat(event.getValue().getTouchNumber()).isEqualTo(2);
        assertThat(event.getValue().getOccurredAt()).isEqualTo(createdAt);
    }

    @Test
    void ingest_Opened_ShouldRecordWithoutSuppressing() {
        // given
        when(eventLogService.isRecorded("msg-1", EventType.OPENED)).thenReturn(false);
        when(eventRepository.findFirstByMessageIdAndEventType("msg-1", EventType.SENT)).thenReturn(Optional.empty());
        when(leadRepository.findFirstByEmailIgnoreCase("ana@acme.io")).thenReturn(Optional.of(lead));

        // when
        IngestionResult result = ingestionService.ingest(webhook("email.opened", "msg-1", null));

        // then
        assertThat(result.status()).isEqualTo("recorded");
        verifyNoInteractions(suppressionService, membershipRepository);
    }

    @Test
    void ingest_RepeatedDelivery_ShouldBeDuplicate() {
        // given
        when(eventLogService.isRecorded("msg-1", EventType.DELIVERED)).thenReturn(true);

        // when
        IngestionResult result = ingestionService.ingest(webhook("email.delivered", "msg-1", null));

        // then
        assertThat(result.status()).isEqualTo("duplicate");
        verify(eventLogService, never()).append(any());
    }

    @Test
    void ingest_Reply_ShouldDelegateToReplyHandling() {
        // given
        when(leadRepository.findFirstByEmailIgnoreCase("ana@acme.io")).thenReturn(Optional.of(lead));
        when(replyHandlingService.recordReply(any(ReplySignal.class)))
                .thenReturn(new ReplyResult(10L, 900L, 1, false));

        // when
        IngestionResult result = ingestionService.ingest(webhook("email.replied", "reply-1", "Ana Lima <ana@acme.io>"));

        // then
        assertThat(result.status()).isEqualTo("recorded");
        ArgumentCaptor<ReplySignal> signal = ArgumentCaptor.forClass(ReplySignal.class);
        verify(replyHandlingService).recordReply(signal.capture());
        assertThat(signal.getValue().leadId()).isEqualTo(10L);
        assertThat(signal.getValue().messageId()).isEqualTo("reply-1");
        assertThat(signal.getValue().source()).isEqualTo("webhook");
    }

    @Test
    void ingest_UnknownType_ShouldBeIgnored() {
        // when
        IngestionResult result = ingestionService.ingest(webhook("contact.created", "x", null));

        // then
        assertThat(result.status()).isEqualTo("ignored");
        verifyNoInteractions(eventLogService, leadRepository);
    }

    @Test
    void extractAddress_ShouldHandleDisplayNames() {
        assertThat(EmailEventIngestionService.extractAddress("Ana Lima <ana@acme.io>")).isEqualTo("ana@acme.io");
        assertThat(EmailEventIngestionService.extractAddress(" ana@acme.io ")).isEqualTo("ana@acme.io");
    }

    private ResendWebhookEvent webhook(String type, String emailId, String from) {
        return ResendWebhookEvent.builder()
                .type(type)
                .createdAt(createdAt)
                .data(ResendWebhookEvent.EventData.builder()
                        .emailId(emailId)
                        .from(from)
                        .to(List.of("Ana <ana@acme.io>"))
                        .subject("Quick idea")
                        .text("Sounds interesting")
                        .build())
                .build();
    }
}
