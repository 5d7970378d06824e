package com.jmapmail.mapper;

import com.jmapmail.domain.Account;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AccountMapper {

    void insert(Account account);

    Account findById(@Param("id") String id);

    Account findByAddress(@Param("address") String address);

    List<Account> findAll();

    int countByAddress(@Param("address") String address);

    void deleteById(@Param("id") String id);
}
