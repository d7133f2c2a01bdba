package io.storvix.core.directory;

import java.io.IOException;
import java.util.Optional;

public final class AccountDirectory implements UserDirectory {
    private final UserAccountStore store;

    public AccountDirectory(UserAccountStore store) {
        this.store = store;
    }

    @Override
    public Optional<String> emailOf(String userId) throws IOException {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return store.load().stream()
            .filter(account -> account.id().equals(userId))
            .map(UserAccount::email)
            .filter(email -> !email.isBlank())
            .findFirst();
    }
}
