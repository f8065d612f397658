package com.mooncell.relay.core.session;

import java.util.List;

public interface SessionStore {

    List<StoredSession> findAll();

    void save(String requester, String credential);

    void delete(String requester);
}
