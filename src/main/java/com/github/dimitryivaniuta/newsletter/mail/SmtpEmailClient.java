package com.github.dimitryivaniuta.newsletter.mail;

import com.github.dimitryivaniuta.newsletter.config.AppProperties;
import com.github.dimitryivaniuta.newsletter.domain.DeliveryFailureReason;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP implementation of {@link EmailClient} on top of Spring's {@link JavaMailSender}.
 *
 * <p>Connection settings come from {@code spring.mail.*}; the sender from {@code app.email.*}.</p>
 */
@Component
public class SmtpEmailClient implements EmailClient {

    private static final Logger log = LoggerFactory.getLogger(SmtpEmailClient.class);

    private final JavaMailSender mailSender;
    private final AppProperties properties;

    /**
     * Creates the client.
     *
     * @param mailSender mail sender
     * @param properties app properties
     */
    public SmtpEmailClient(JavaMailSender mailSender, AppProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public void send(InternetAddress recipient, String subject, String textContent, String htmlContent) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            AppProperties.Email sender = properties.getEmail();
            helper.setFrom(sender.getSenderEmail(), sender.getSenderName());
            helper.setTo(recipient);
            helper.setSubject(subject);
            message.setContent(alternativeBody(textContent, htmlContent));
        } catch (MessagingException | UnsupportedEncodingException ex) {
            // sender configuration problem, not the recipient's
            throw new TransientDeliveryFailureException("Unable to build newsletter email", ex);
        }

        try {
            mailSender.send(message);
            log.debug("Newsletter email handed to SMTP server. to={}", recipient.getAddress());
        } catch (MailException ex) {
            throw classify(recipient, ex);
        }
    }

    /**
     * Plain text and HTML renderings of the same issue; clients pick the last one they can display.
     */
    private static MimeMultipart alternativeBody(String textContent, String htmlContent) throws MessagingException {
        MimeBodyPart text = new MimeBodyPart();
        text.setText(textContent, StandardCharsets.UTF_8.name(), "plain");
        MimeBodyPart html = new MimeBodyPart();
        html.setText(htmlContent, StandardCharsets.UTF_8.name(), "html");

        MimeMultipart body = new MimeMultipart("alternative");
        body.addBodyPart(text);
        body.addBodyPart(html);
        return body;
    }

    /**
     * Maps a Spring mail exception onto the retry taxonomy.
     *
     * @param recipient recipient address
     * @param ex failure
     * @return classified failure
     */
    static DeliveryFailureException classify(InternetAddress recipient, MailException ex) {
        String target = recipient.getAddress();
        if (ex instanceof MailParseException || ex instanceof MailPreparationException) {
            return new PermanentDeliveryFailureException(DeliveryFailureReason.PERMANENT_FAILURE,
                    "Newsletter email to " + target + " could not be prepared", ex);
        }
        if (ex instanceof MailSendException && rejectsRecipient((MailSendException) ex)) {
            return new PermanentDeliveryFailureException(DeliveryFailureReason.INVALID_ADDRESS,
                    "SMTP server rejected recipient " + target, ex);
        }
        return new TransientDeliveryFailureException("Failed to send newsletter email to " + target, ex);
    }

    private static boolean rejectsRecipient(MailSendException ex) {
        for (Exception failure : ex.getMessageExceptions()) {
            Throwable t = failure;
            while (t != null) {
                if (t instanceof AddressException) {
                    return true;
                }
                if (t instanceof SendFailedException) {
                    Address[] invalid = ((SendFailedException) t).getInvalidAddresses();
                    if (invalid != null && invalid.length > 0) {
                        return true;
                    }
                }
                t = t.getCause();
            }
        }
        return false;
    }
}
