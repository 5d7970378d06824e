package com.jmapmail.controller;

import com.jmapmail.domain.Account;
import com.jmapmail.service.AccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Account management REST API
 * - Create account (POST /api/accounts)
 * - Delete account (DELETE /api/accounts/{address})
 * - List accounts (GET /api/accounts)
 * - Get account (GET /api/accounts/{address})
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    /**
     * Create account
     * Body: { "address": "user1@example.com" }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createAccount(@RequestBody Map<String, String> request) {
        String address = request.get("address");
        if (address == null || address.isBlank()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "address is required.");
        }

        Account account;
        try {
            account = accountService.createAccount(address);
        } catch (IllegalArgumentException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            return errorResponse(HttpStatus.CONFLICT, e.getMessage());
        }

        Map<String, Object> response = toMap(account);
        response.put("status", "success");
        response.put("message", "Account created.");
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{address}")
    public ResponseEntity<Map<String, Object>> deleteAccount(@PathVariable String address) {
        if (!accountService.deleteAccount(address)) {
            return errorResponse(HttpStatus.NOT_FOUND, "Account not found: " + address);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Account deleted.");
        response.put("address", address);
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listAccounts() {
        List<Map<String, Object>> accounts = accountService.findAll().stream()
                .map(AccountController::toMap)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", accounts.size());
        response.put("accounts", accounts);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{address}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable String address) {
        Account account = accountService.findByAddress(address);
        if (account == null) {
            return errorResponse(HttpStatus.NOT_FOUND, "Account not found: " + address);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.putAll(toMap(account));
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> toMap(Account account) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("accountId", account.getId());
        map.put("address", account.getAddress());
        map.put("createdAt", account.getCreatedAt());
        return map;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
