package dev.pekelund.zuvp.processor.notify;

import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.notify.DraftNotifier;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.util.StringUtils;

/**
 * Sends the clerk notification by e-mail. Delivery failures are logged and never reach the pipeline.
 */
public class MailDraftNotifier implements DraftNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(MailDraftNotifier.class);

    private final JavaMailSender mailSender;
    private final String from;
    private final String clerkEmail;

    public MailDraftNotifier(JavaMailSender mailSender, String from, String clerkEmail) {
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender");
        if (!StringUtils.hasText(clerkEmail)) {
            throw new IllegalArgumentException("Clerk e-mail address must be configured");
        }
        this.from = from;
        this.clerkEmail = clerkEmail;
    }

    @Override
    public void draftCreated(Draft draft) {
        DraftNotificationMessage content = DraftNotificationMessage.forDraft(draft);
        SimpleMailMessage message = new SimpleMailMessage();
        message.setTo(clerkEmail);
        if (StringUtils.hasText(from)) {
            message.setFrom(from);
        }
        message.setSubject(content.subject());
        message.setText(content.body());
        try {
            mailSender.send(message);
            LOGGER.info("Draft notification for {} sent to {}", draft.id(), clerkEmail);
        } catch (MailException ex) {
            LOGGER.error("Failed to send draft notification for {} to {}", draft.id(), clerkEmail, ex);
        }
    }
}
