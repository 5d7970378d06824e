package com.jmapmail.controller;

import com.jmapmail.domain.Account;
import com.jmapmail.jmap.JmapMethodDispatcher;
import com.jmapmail.jmap.JmapRequest;
import com.jmapmail.jmap.SessionDocumentBuilder;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JMAP API
 * - POST /jmap: method call batch
 * - GET /.well-known/jmap: session resource
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class JmapController {

    private final JmapMethodDispatcher dispatcher;
    private final SessionDocumentBuilder sessionDocumentBuilder;
    private final AccountResolver accountResolver;

    @PostMapping("/jmap")
    public ResponseEntity<Object> api(@RequestBody JmapRequest request, HttpServletRequest httpRequest) {
        Account account = accountResolver.resolve(httpRequest);
        if (account == null) {
            return unauthorized();
        }
        return ResponseEntity.ok(dispatcher.dispatch(request, account.getId()));
    }

    @GetMapping("/.well-known/jmap")
    public ResponseEntity<Object> session(HttpServletRequest httpRequest) {
        Account account = accountResolver.resolve(httpRequest);
        if (account == null) {
            return unauthorized();
        }
        return ResponseEntity.ok(sessionDocumentBuilder.build(account));
    }

    private ResponseEntity<Object> unauthorized() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", "Unauthorized");
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
    }
}
