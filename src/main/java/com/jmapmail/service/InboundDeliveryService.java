package com.jmapmail.service;

import com.jmapmail.domain.Account;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.Mailbox;
import com.jmapmail.mapper.AccountMapper;
import com.jmapmail.util.CryptoUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Inbound mail delivery
 * - The raw message is ingested once as a canonical message
 * - Every local recipient account gets its own Email in its inbox
 * - Unknown recipients are skipped
 */
@Slf4j
@Service
public class InboundDeliveryService {

    private final IngestionService ingestionService;
    private final AccountMapper accountMapper;
    private final MailboxService mailboxService;
    private final Clock clock;
    private final Counter deliveredCounter;

    public InboundDeliveryService(IngestionService ingestionService,
                                  AccountMapper accountMapper,
                                  MailboxService mailboxService,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.ingestionService = ingestionService;
        this.accountMapper = accountMapper;
        this.mailboxService = mailboxService;
        this.clock = clock;
        this.deliveredCounter = Counter.builder("jmap.inbound.delivered")
                .description("Inbound messages delivered into an account inbox")
                .register(meterRegistry);
    }

    /**
     * @return ids of the created account messages
     */
    @Transactional
    public List<String> deliver(byte[] raw, List<String> recipients) {
        Set<Account> accounts = new LinkedHashSet<>();
        for (String recipient : recipients) {
            String address = CryptoUtil.normalizeEmail(recipient);
            Account account = address == null ? null : accountMapper.findByAddress(address);
            if (account == null) {
                log.debug("Inbound recipient {} is not local, skipped", recipient);
                continue;
            }
            accounts.add(account);
        }
        if (accounts.isEmpty()) {
            log.warn("Inbound message has no local recipient: {}", recipients);
            return List.of();
        }

        IngestionService.PreparedMessage prepared = ingestionService.prepare(raw);
        CanonicalMessage canonical = ingestionService.upsertCanonicalMessage(prepared);

        List<String> delivered = new ArrayList<>();
        for (Account account : accounts) {
            Mailbox inbox = mailboxService.findByRole(account.getId(), "inbox");
            if (inbox == null) {
                inbox = mailboxService.createDefaultMailboxes(account.getId()).stream()
                        .filter(mailbox -> "inbox".equals(mailbox.getRole()))
                        .findFirst()
                        .orElseThrow(() -> new IllegalStateException("No inbox for account " + account.getId()));
            }
            AccountMessage message = ingestionService.ingestForAccount(account.getId(), canonical,
                    List.of(inbox.getId()), KeywordSupport.split(null), clock.instant());
            delivered.add(message.getId());
            deliveredCounter.increment();
            log.info("Inbound mail delivered: account={}, email={}, message={}",
                    account.getAddress(), message.getId(), canonical.getId());
        }
        return delivered;
    }
}
