package io.storvix.core.subscription;

import io.storvix.core.directory.UserAccount;
import io.storvix.core.directory.UserAccountStore;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops users whose subscription has lapsed back to the {@value #NO_SUBSCRIPTION} tier.
 * Running it again at the same instant changes nothing.
 */
public final class SubscriptionSweeper {
    public static final String NO_SUBSCRIPTION = "None";
    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionSweeper.class);

    private final UserAccountStore store;

    public SubscriptionSweeper(UserAccountStore store) {
        this.store = store;
    }

    /**
     * @return number of accounts moved to the {@value #NO_SUBSCRIPTION} tier
     */
    public synchronized int sweep(Instant now) throws IOException {
        List<UserAccount> accounts = store.load();
        List<UserAccount> updated = new ArrayList<>(accounts.size());
        int expired = 0;
        for (UserAccount account : accounts) {
            if (isLapsed(account, now)) {
                updated.add(account.withSubscription(NO_SUBSCRIPTION));
                expired++;
                LOG.info("Subscription of user {} expired at {}", account.id(), account.subscriptionExpires());
            } else {
                updated.add(account);
            }
        }
        if (expired > 0) {
            store.save(updated);
        }
        return expired;
    }

    private boolean isLapsed(UserAccount account, Instant now) {
        return account.subscriptionExpires() != null
            && !account.subscriptionExpires().isAfter(now)
            && !NO_SUBSCRIPTION.equalsIgnoreCase(account.subscription());
    }
}
