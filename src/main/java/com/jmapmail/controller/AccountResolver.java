package com.jmapmail.controller;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Account;
import com.jmapmail.service.AccountService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Authenticated account of a request, taken from the header set by the auth proxy
 */
@Component
@RequiredArgsConstructor
public class AccountResolver {

    private final ServerProperties properties;
    private final AccountService accountService;

    /**
     * @return null when the header is missing or names no account
     */
    public Account resolve(HttpServletRequest request) {
        String accountId = request.getHeader(properties.getSecurity().getAccountHeader());
        if (accountId == null || accountId.isBlank()) {
            return null;
        }
        return accountService.findById(accountId.trim());
    }
}
