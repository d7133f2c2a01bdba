package io.storvix.core.schedule;

public record JobOwner(
    String userId,
    String username,
    String company
) {
    public JobOwner {
        userId = userId == null ? "" : userId.trim();
        username = username == null ? "" : username.trim();
        company = company == null ? "" : company.trim();
    }
}
