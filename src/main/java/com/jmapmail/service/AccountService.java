package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Account;
import com.jmapmail.mapper.AccountMapper;
import com.jmapmail.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Account registration and lookup
 * - A new account gets the default role mailboxes in the same transaction
 * - Addresses must belong to the configured domain
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final AccountMapper accountMapper;
    private final MailboxService mailboxService;
    private final ServerProperties properties;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException for a malformed or foreign address
     * @throws IllegalStateException when the address is taken
     */
    @Transactional
    public Account createAccount(String address) {
        String normalized = CryptoUtil.normalizeEmail(address);
        String domain = CryptoUtil.extractDomain(normalized);
        if (normalized == null || domain == null || normalized.startsWith("@")) {
            throw new IllegalArgumentException("Invalid email address: " + address);
        }
        if (!isLocalDomain(domain)) {
            throw new IllegalArgumentException("Domain is not allowed. Allowed domain: " + properties.getDomain());
        }
        if (accountMapper.countByAddress(normalized) > 0) {
            throw new IllegalStateException("Account already exists: " + normalized);
        }

        Account account = Account.builder()
                .id(UUID.randomUUID().toString())
                .address(normalized)
                .createdAt(clock.instant())
                .build();
        accountMapper.insert(account);
        mailboxService.createDefaultMailboxes(account.getId());
        log.info("Account created: {} ({})", normalized, account.getId());
        return account;
    }

    public boolean isLocalDomain(String domain) {
        return domain != null && domain.equalsIgnoreCase(properties.getDomain());
    }

    public Account findById(String accountId) {
        return accountMapper.findById(accountId);
    }

    public Account findByAddress(String address) {
        String normalized = CryptoUtil.normalizeEmail(address);
        return normalized == null ? null : accountMapper.findByAddress(normalized);
    }

    public List<Account> findAll() {
        return accountMapper.findAll();
    }

    /**
     * Remove the account row only; mailboxes and messages stay in place
     * @return false when no such account exists
     */
    @Transactional
    public boolean deleteAccount(String address) {
        Account account = findByAddress(address);
        if (account == null) {
            return false;
        }
        accountMapper.deleteById(account.getId());
        log.info("Account deleted: {} ({})", account.getAddress(), account.getId());
        return true;
    }
}
