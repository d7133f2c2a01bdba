package io.storvix.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ReportPayload.class, name = "report"),
    @JsonSubTypes.Type(value = MailPayload.class, name = "mail")
})
public interface JobPayload {
    @JsonIgnore
    JobKind kind();
}
