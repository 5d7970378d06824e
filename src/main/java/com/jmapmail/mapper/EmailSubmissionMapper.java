package com.jmapmail.mapper;

import com.jmapmail.domain.EmailSubmission;
import com.jmapmail.domain.SubmissionStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface EmailSubmissionMapper {

    void insert(EmailSubmission submission);

    EmailSubmission findById(@Param("id") String id);

    EmailSubmission findByAccountAndId(@Param("accountId") String accountId, @Param("id") String id);

    List<EmailSubmission> findByAccount(@Param("accountId") String accountId);

    EmailSubmission findByProviderMessageId(@Param("providerMessageId") String providerMessageId);

    /**
     * Pending submissions due at {@code now}, oldest first
     */
    List<String> findDueIds(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Compare-and-swap PENDING -> SENDING
     * @return 1 if this caller won the claim, 0 otherwise
     */
    int markSending(@Param("id") String id, @Param("now") Instant now);

    /**
     * Record the outcome of an attempt (only while SENDING)
     */
    int recordAttempt(EmailSubmission submission);

    /**
     * Terminal failure detected before sending (only while PENDING)
     */
    int markFailedBeforeSend(@Param("id") String id,
                             @Param("deliveryStatusJson") String deliveryStatusJson,
                             @Param("now") Instant now);

    /**
     * PENDING -> CANCELED
     */
    int cancel(@Param("id") String id, @Param("now") Instant now);

    /**
     * Provider notification; ignored once FAILED or CANCELED
     */
    int applyNotification(@Param("id") String id,
                          @Param("status") SubmissionStatus status,
                          @Param("undoStatus") String undoStatus,
                          @Param("deliveryStatusJson") String deliveryStatusJson,
                          @Param("now") Instant now);

    void deleteById(@Param("id") String id);
}
