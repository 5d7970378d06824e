package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Account;
import com.jmapmail.mapper.AccountMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * AccountService unit tests
 */
@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private AccountMapper accountMapper;

    @Mock
    private MailboxService mailboxService;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        ServerProperties properties = new ServerProperties();
        properties.setDomain("example.com");
        accountService = new AccountService(accountMapper, mailboxService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("New account is normalized and gets the default mailboxes")
    void testCreate() {
        when(accountMapper.countByAddress("alice@example.com")).thenReturn(0);

        Account account = accountService.createAccount("<Alice@Example.com>");

        assertThat(account.getAddress()).isEqualTo("alice@example.com");
        assertThat(account.getCreatedAt()).isEqualTo(NOW);
        verify(accountMapper).insert(account);
        verify(mailboxService).createDefaultMailboxes(account.getId());
    }

    @Test
    @DisplayName("Foreign domains and malformed addresses are rejected")
    void testInvalidAddress() {
        assertThatThrownBy(() -> accountService.createAccount("bob@other.org"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("example.com");
        assertThatThrownBy(() -> accountService.createAccount("no-at-sign"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> accountService.createAccount("@example.com"))
                .isInstanceOf(IllegalArgumentException.class);
        verify(accountMapper, never()).insert(any());
    }

    @Test
    @DisplayName("Duplicate address is a conflict")
    void testDuplicate() {
        when(accountMapper.countByAddress("alice@example.com")).thenReturn(1);

        assertThatThrownBy(() -> accountService.createAccount("alice@example.com"))
                .isInstanceOf(IllegalStateException.class);
        verify(mailboxService, never()).createDefaultMailboxes(anyString());
    }

    @Test
    @DisplayName("Delete removes the account row only")
    void testDelete() {
        Account account = Account.builder().id("acc").address("alice@example.com").build();
        when(accountMapper.findByAddress("alice@example.com")).thenReturn(account);
        when(accountMapper.findByAddress("nobody@example.com")).thenReturn(null);

        assertThat(accountService.deleteAccount("ALICE@example.com")).isTrue();
        assertThat(accountService.deleteAccount("nobody@example.com")).isFalse();

        verify(accountMapper).deleteById("acc");
    }
}
