package com.sptjm.integration.mail;

import java.nio.file.Path;
import java.util.Objects;

public record OutgoingMail(String to, String subject, String body, Path attachment) {

    public OutgoingMail {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(attachment, "attachment");
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
    }

    public String attachmentName() {
        return attachment.getFileName().toString();
    }
}
