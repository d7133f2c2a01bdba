package io.storvix.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Contents of a scheduled mail. When {@code attachReport} is set the report described by
 * {@code target}, {@code sections} and {@code format} is rendered and attached on every run.
 * When {@code generateSummary} is set the body is replaced by a fleet summary for {@code companies}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MailPayload(
    List<String> recipients,
    String subject,
    String body,
    boolean attachReport,
    String target,
    List<String> sections,
    ReportFormat format,
    boolean generateSummary,
    List<String> companies
) implements JobPayload {

    public MailPayload {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        subject = subject == null ? "" : subject.trim();
        body = body == null ? "" : body;
        target = target == null ? "" : target.trim();
        sections = sections == null ? List.of() : List.copyOf(sections);
        companies = companies == null ? List.of() : List.copyOf(companies);
    }

    public static MailPayload plain(List<String> recipients, String subject, String body) {
        return new MailPayload(recipients, subject, body, false, "", List.of(), null, false, List.of());
    }

    @Override
    public JobKind kind() {
        return JobKind.MAIL;
    }
}
