package com.jmapmail.mapper;

import com.jmapmail.domain.Attachment;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.MessageAddress;
import com.jmapmail.domain.MessageHeader;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface CanonicalMessageMapper {

    /**
     * Insert unless a row with the same ingestId exists
     * @return affected rows (0 when the message was already stored)
     */
    int insertIgnore(CanonicalMessage message);

    CanonicalMessage findById(@Param("id") String id);

    CanonicalMessage findByIngestId(@Param("ingestId") String ingestId);

    List<CanonicalMessage> findByIds(@Param("ids") List<String> ids);

    void insertHeader(MessageHeader header);

    List<MessageHeader> findHeaders(@Param("messageId") String messageId);

    void insertAttachment(Attachment attachment);

    List<Attachment> findAttachments(@Param("messageId") String messageId);

    void insertAddressIgnore(@Param("id") String id, @Param("email") String email, @Param("name") String name);

    String findAddressIdByEmail(@Param("email") String email);

    void insertMessageAddress(MessageAddress address);

    List<MessageAddress> findAddresses(@Param("messageId") String messageId);

    /**
     * Distinct to/cc/bcc addresses in header order
     */
    List<String> findRecipientEmails(@Param("messageId") String messageId);

    void deleteHeaders(@Param("messageId") String messageId);

    void deleteAddresses(@Param("messageId") String messageId);

    void deleteAttachments(@Param("messageId") String messageId);

    void deleteById(@Param("id") String id);
}
