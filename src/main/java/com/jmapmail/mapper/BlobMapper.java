package com.jmapmail.mapper;

import com.jmapmail.domain.Blob;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface BlobMapper {

    /**
     * Insert blob metadata, ignoring an existing row with the same hash
     */
    void insertIgnore(Blob blob);

    Blob findBySha256(@Param("sha256") String sha256);

    void insertAccountBlobIgnore(@Param("accountId") String accountId,
                                 @Param("sha256") String sha256,
                                 @Param("createdAt") Instant createdAt);

    int countAccountBlob(@Param("accountId") String accountId, @Param("sha256") String sha256);

    /**
     * Number of canonical messages and attachments still pointing at the hash
     */
    int countReferences(@Param("sha256") String sha256);

    void deleteAccountBlobs(@Param("sha256") String sha256);

    void deleteBySha256(@Param("sha256") String sha256);

    /**
     * Blobs older than the cutoff that no message, attachment or account grant references
     */
    List<Blob> findOrphans(@Param("createdBefore") Instant createdBefore, @Param("limit") int limit);
}
