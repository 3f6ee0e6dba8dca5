package io.tabula.core.session;

import java.io.IOException;
import java.util.List;

public interface MessageStore {
    void append(StoredMessage message) throws IOException;

    List<StoredMessage> list(String sessionId) throws IOException;

    PersistenceHook hook(String sessionId);
}
