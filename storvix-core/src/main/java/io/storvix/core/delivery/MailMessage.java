package io.storvix.core.delivery;

import io.storvix.core.artifact.Artifact;
import java.util.List;
import java.util.Optional;

public record MailMessage(
    List<String> to,
    String subject,
    String textBody,
    String htmlBody,
    Artifact attachment
) {
    public MailMessage {
        to = to == null ? List.of() : to.stream().filter(address -> address != null && !address.isBlank()).map(String::trim).toList();
        subject = subject == null ? "" : subject;
        textBody = textBody == null ? "" : textBody;
    }

    public static MailMessage text(String to, String subject, String textBody) {
        return new MailMessage(List.of(to), subject, textBody, null, null);
    }

    public Optional<Artifact> attachmentIfAny() {
        return Optional.ofNullable(attachment);
    }
}
