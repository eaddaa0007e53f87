package dev.pekelund.zuvp.processor.notify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.drafts.DraftStatus;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class MailDraftNotifierTest {

    @Mock
    private JavaMailSender mailSender;

    @Test
    void sendsDraftSummaryToClerk() {
        MailDraftNotifier notifier = new MailDraftNotifier(mailSender, "zuvp@municipality.cz", "clerk@municipality.cz");

        notifier.draftCreated(draft());

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage message = captor.getValue();
        assertThat(message.getTo()).containsExactly("clerk@municipality.cz");
        assertThat(message.getFrom()).isEqualTo("zuvp@municipality.cz");
        assertThat(message.getSubject()).isEqualTo("Nový koncept ZUVP - Jan Novák");
        assertThat(message.getText())
            .contains("Žadatel: Jan Novák")
            .contains("Místo: Náměstí Míru 1")
            .contains("Poplatek: 1250 Kč")
            .contains("VS: 8354147304")
            .contains("ID žádosti: req-1");
    }

    @Test
    void deliveryFailuresDoNotPropagate() {
        MailDraftNotifier notifier = new MailDraftNotifier(mailSender, null, "clerk@municipality.cz");
        doThrow(new MailSendException("SMTP unavailable")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatCode(() -> notifier.draftCreated(draft())).doesNotThrowAnyException();
    }

    @Test
    void requiresClerkAddress() {
        assertThatThrownBy(() -> new MailDraftNotifier(mailSender, null, " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void messageUsesPlaceholdersForMissingValues() {
        CanonicalRecord sparse = new CanonicalRecord(null, null, null, "Lešení", null, null, null, null, 7,
            BigDecimal.ZERO, false, 0, null);
        Draft draft = new Draft("req-2", Instant.parse("2025-07-01T08:00:00Z"), sparse, Map.of(),
            DraftStatus.PENDING_APPROVAL, null);

        DraftNotificationMessage message = DraftNotificationMessage.forDraft(draft);

        assertThat(message.subject()).isEqualTo("Nový koncept ZUVP - N/A");
        assertThat(message.body()).contains("Místo: N/A").contains("Účel: Lešení").contains("VS: N/A");
    }

    private static Draft draft() {
        CanonicalRecord record = new CanonicalRecord("Jan Novák", "12345678", null, "Předzahrádka", "Náměstí Míru 1",
            "2025-07-01 - 2025-07-10", LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 10), 10,
            new BigDecimal("12.5"), true, 1250, "8354147304");
        return new Draft("req-1", Instant.parse("2025-07-01T08:00:00Z"), record, Map.of(),
            DraftStatus.PENDING_APPROVAL, null);
    }
}
