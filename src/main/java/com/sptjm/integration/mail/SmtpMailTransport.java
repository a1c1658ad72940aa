package com.sptjm.integration.mail;

import com.sptjm.config.SmtpSettings;
import com.sptjm.logging.AppLogger;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Sends each letter as a plain-text message with the PDF attached, over SMTP with STARTTLS.
 */
public class SmtpMailTransport implements MailTransport {
    private static final Logger LOGGER = AppLogger.get();
    private static final String PDF_TYPE = "application/pdf";

    private final SmtpSettings settings;
    private final Session session;

    public SmtpMailTransport(SmtpSettings settings) {
        if (!settings.isComplete()) {
            throw new IllegalArgumentException("SMTP host, user and password are required for live dispatch");
        }
        this.settings = settings;
        this.session = Session.getInstance(sessionProperties(settings), new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(settings.user(), settings.password());
            }
        });
        LOGGER.info(() -> "Sending as %s via %s:%d".formatted(settings.fromHeader(), settings.host(), settings.port()));
    }

    static Properties sessionProperties(SmtpSettings settings) {
        String timeout = String.valueOf(settings.timeout().toMillis());
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", settings.host());
        props.put("mail.smtp.port", String.valueOf(settings.port()));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "true");
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);
        return props;
    }

    @Override
    public void send(OutgoingMail mail) throws MessagingException {
        MimeMessage message = compose(mail);
        Transport.send(message);
        LOGGER.fine(() -> "Sent %s to %s".formatted(mail.attachmentName(), mail.to()));
    }

    MimeMessage compose(OutgoingMail mail) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(fromAddress());
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(mail.to(), true));
        message.setSubject(mail.subject(), StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());

        MimeBodyPart text = new MimeBodyPart();
        text.setText(mail.body(), StandardCharsets.UTF_8.name());

        MimeBodyPart attachment = new MimeBodyPart();
        try {
            attachment.attachFile(mail.attachment().toFile(), PDF_TYPE, null);
        } catch (IOException ex) {
            throw new MessagingException("Could not attach " + mail.attachmentName(), ex);
        }
        attachment.setFileName(mail.attachmentName());

        MimeMultipart multipart = new MimeMultipart();
        multipart.addBodyPart(text);
        multipart.addBodyPart(attachment);
        message.setContent(multipart);
        message.saveChanges();
        return message;
    }

    private InternetAddress fromAddress() throws MessagingException {
        String name = settings.fromName();
        if (name == null || name.isBlank()) {
            return new InternetAddress(settings.user());
        }
        try {
            return new InternetAddress(settings.user(), name.trim(), StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException ex) {
            throw new MessagingException("Unsupported sender name encoding", ex);
        }
    }
}
