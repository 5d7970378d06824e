package com.jmapmail.mapper;

import com.jmapmail.domain.ChangeLogEntry;
import com.jmapmail.domain.JmapType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ChangeLogMapper {

    void insert(ChangeLogEntry entry);

    /**
     * Initialize the counter at 1 or increment it
     */
    void incrementState(@Param("accountId") String accountId, @Param("type") JmapType type);

    Long findState(@Param("accountId") String accountId, @Param("type") JmapType type);

    Long findMaxState(@Param("accountId") String accountId);

    List<ChangeLogEntry> findSince(@Param("accountId") String accountId,
                                   @Param("type") JmapType type,
                                   @Param("sinceModSeq") long sinceModSeq,
                                   @Param("limit") int limit);
}
