package com.mooncell.relay.core.dao;

import com.mooncell.relay.core.session.SessionStore;
import com.mooncell.relay.core.session.StoredSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class MybatisSessionStore implements SessionStore {

    private final SessionMapper mapper;

    @Override
    public List<StoredSession> findAll() {
        return mapper.findAll();
    }

    @Override
    public void save(String requester, String credential) {
        mapper.upsert(requester, credential, Instant.now());
    }

    @Override
    public void delete(String requester) {
        mapper.delete(requester);
    }
}
