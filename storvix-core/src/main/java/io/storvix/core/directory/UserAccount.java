package io.storvix.core.directory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserAccount(
    String id,
    String username,
    String email,
    String company,
    String subscription,
    Instant subscriptionExpires
) {
    public UserAccount {
        id = id == null ? "" : id.trim();
        username = username == null ? "" : username.trim();
        email = email == null ? "" : email.trim();
        company = company == null ? "" : company.trim();
        subscription = subscription == null ? "" : subscription.trim();
    }

    public UserAccount withSubscription(String tier) {
        return new UserAccount(id, username, email, company, tier, subscriptionExpires);
    }
}
