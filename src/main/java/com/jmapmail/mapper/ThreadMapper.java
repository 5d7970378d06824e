package com.jmapmail.mapper;

import com.jmapmail.domain.MailThread;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ThreadMapper {

    void insert(MailThread thread);

    MailThread findById(@Param("accountId") String accountId, @Param("id") String id);

    void updateLatestMessageAt(@Param("id") String id,
                               @Param("latestMessageAt") Instant latestMessageAt,
                               @Param("updatedAt") Instant updatedAt);

    void deleteById(@Param("id") String id);

    int countLiveMessages(@Param("id") String id);

    List<String> findEmailIds(@Param("id") String id);

    /**
     * Thread of a live message of the account with the given Message-ID
     */
    String findThreadIdByMessageId(@Param("accountId") String accountId, @Param("messageId") String messageId);

    /**
     * Thread of the earliest (by internal date) live message among the given Message-IDs
     */
    String findEarliestThreadIdByMessageIds(@Param("accountId") String accountId,
                                            @Param("messageIds") List<String> messageIds);
}
