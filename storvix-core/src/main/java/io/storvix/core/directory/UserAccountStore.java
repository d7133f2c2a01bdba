package io.storvix.core.directory;

import java.io.IOException;
import java.util.List;

public interface UserAccountStore {
    List<UserAccount> load() throws IOException;

    void save(List<UserAccount> accounts) throws IOException;
}
