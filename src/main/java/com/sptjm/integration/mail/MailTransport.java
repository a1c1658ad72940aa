package com.sptjm.integration.mail;

import jakarta.mail.MessagingException;

/**
 * Delivers one prepared message. Implementations do not retry.
 */
@FunctionalInterface
public interface MailTransport {

    void send(OutgoingMail mail) throws MessagingException;
}
