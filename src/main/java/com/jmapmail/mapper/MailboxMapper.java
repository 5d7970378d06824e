package com.jmapmail.mapper;

import com.jmapmail.domain.Mailbox;
import com.jmapmail.domain.MailboxCounts;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface MailboxMapper {

    void insert(Mailbox mailbox);

    void update(Mailbox mailbox);

    void touch(@Param("id") String id, @Param("updatedAt") Instant updatedAt);

    void deleteById(@Param("id") String id);

    Mailbox findById(@Param("accountId") String accountId, @Param("id") String id);

    List<Mailbox> findByAccount(@Param("accountId") String accountId);

    Mailbox findByRole(@Param("accountId") String accountId, @Param("role") String role);

    int countChildren(@Param("id") String id);

    int countMessages(@Param("id") String id);

    List<MailboxCounts> countsByAccount(@Param("accountId") String accountId);
}
