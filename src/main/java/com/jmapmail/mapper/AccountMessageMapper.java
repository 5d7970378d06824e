package com.jmapmail.mapper;

import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.EmailKeyword;
import com.jmapmail.domain.EmailQueryFilter;
import com.jmapmail.domain.MailboxMembership;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface AccountMessageMapper {

    void insert(AccountMessage message);

    /**
     * Live (not soft-deleted) message of the account
     */
    AccountMessage findById(@Param("accountId") String accountId, @Param("id") String id);

    /**
     * Any row, including soft-deleted ones
     */
    AccountMessage findAnyById(@Param("id") String id);

    List<AccountMessage> findByIds(@Param("accountId") String accountId, @Param("ids") List<String> ids);

    void updateFlags(AccountMessage message);

    void markDeleted(@Param("id") String id, @Param("updatedAt") Instant updatedAt);

    void touch(@Param("id") String id, @Param("updatedAt") Instant updatedAt);

    void deleteById(@Param("id") String id);

    // Mailbox membership

    List<String> findMailboxIds(@Param("accountMessageId") String accountMessageId);

    List<MailboxMembership> findMemberships(@Param("ids") List<String> accountMessageIds);

    List<String> findIdsByMailbox(@Param("mailboxId") String mailboxId);

    void insertMembership(@Param("accountMessageId") String accountMessageId,
                          @Param("mailboxId") String mailboxId,
                          @Param("addedAt") Instant addedAt);

    void deleteMembership(@Param("accountMessageId") String accountMessageId, @Param("mailboxId") String mailboxId);

    void deleteMemberships(@Param("accountMessageId") String accountMessageId);

    void deleteMembershipsByMailbox(@Param("mailboxId") String mailboxId);

    // Custom keywords

    List<String> findKeywords(@Param("accountMessageId") String accountMessageId);

    List<EmailKeyword> findKeywordsFor(@Param("ids") List<String> accountMessageIds);

    void insertKeywordIgnore(@Param("accountMessageId") String accountMessageId, @Param("keyword") String keyword);

    void deleteKeyword(@Param("accountMessageId") String accountMessageId, @Param("keyword") String keyword);

    void deleteKeywords(@Param("accountMessageId") String accountMessageId);

    // Canonical message references

    int countLiveByMessageId(@Param("messageId") String messageId);

    void deleteSoftDeletedByMessageId(@Param("messageId") String messageId);

    /**
     * Canonical messages referenced only by soft-deleted account messages
     */
    List<String> findUnreferencedMessageIds(@Param("limit") int limit);

    // Email/query

    /**
     * Matching messages (id, threadId, internalDate only) in sort order; limit -1 for all
     */
    List<AccountMessage> query(EmailQueryFilter filter);

    int count(EmailQueryFilter filter);
}
