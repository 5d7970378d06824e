package com.jmapmail.controller;

import com.jmapmail.domain.Account;
import com.jmapmail.domain.Blob;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.service.BlobService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blob upload and download
 * - POST /blobs/upload/{accountId}/{type}/{subtype}, or /blobs/upload/{accountId} with the type in Content-Type
 * - GET /blobs/download/{accountId}/{blobId}/{name}?type=...; ETag is the quoted blob id
 */
@Slf4j
@RestController
@RequestMapping("/blobs")
@RequiredArgsConstructor
public class BlobController {

    private final BlobService blobService;
    private final AccountResolver accountResolver;

    @PostMapping("/upload/{accountId}/{type}/{subtype}")
    public ResponseEntity<Map<String, Object>> upload(@PathVariable String accountId,
                                                      @PathVariable String type,
                                                      @PathVariable String subtype,
                                                      @RequestBody(required = false) byte[] body,
                                                      HttpServletRequest request) {
        return store(accountId, type + "/" + subtype, body, request);
    }

    @PostMapping("/upload/{accountId}")
    public ResponseEntity<Map<String, Object>> upload(@PathVariable String accountId,
                                                      @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false)
                                                      String contentType,
                                                      @RequestBody(required = false) byte[] body,
                                                      HttpServletRequest request) {
        return store(accountId, contentType == null ? MediaType.APPLICATION_OCTET_STREAM_VALUE : contentType,
                body, request);
    }

    @GetMapping("/download/{accountId}/{blobId}/{name}")
    public ResponseEntity<byte[]> download(@PathVariable String accountId,
                                           @PathVariable String blobId,
                                           @PathVariable String name,
                                           @RequestParam(value = "type", required = false) String type,
                                           @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false)
                                           String ifNoneMatch,
                                           HttpServletRequest request) {
        if (!isAuthorized(accountId, request)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        if (!BlobService.isBlobId(blobId) || !blobService.canRead(accountId, blobId)) {
            return ResponseEntity.notFound().build();
        }
        String etag = "\"" + blobId + "\"";
        if (etag.equals(ifNoneMatch)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
        }
        byte[] data = blobService.readForAccount(accountId, blobId);
        if (data == null) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok()
                .eTag(etag)
                .contentType(parseType(type))
                .contentLength(data.length)
                .header(HttpHeaders.CACHE_CONTROL, "private, immutable, max-age=31536000")
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(name, StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(data);
    }

    private ResponseEntity<Map<String, Object>> store(String accountId, String type, byte[] body,
                                                      HttpServletRequest request) {
        if (!isAuthorized(accountId, request)) {
            return errorResponse(HttpStatus.FORBIDDEN, "Not allowed to upload to account " + accountId);
        }
        try {
            Blob blob = blobService.upload(accountId, body);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("accountId", accountId);
            response.put("blobId", blob.getSha256());
            response.put("type", type);
            response.put("size", blob.getSize());
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (JmapException e) {
            HttpStatus status = e.getType() == JmapErrorType.LIMIT_EXCEEDED
                    ? HttpStatus.PAYLOAD_TOO_LARGE
                    : HttpStatus.BAD_REQUEST;
            return errorResponse(status, e.getMessage());
        }
    }

    private boolean isAuthorized(String accountId, HttpServletRequest request) {
        Account account = accountResolver.resolve(request);
        return account != null && account.getId().equals(accountId);
    }

    private static MediaType parseType(String type) {
        if (type == null || type.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(type);
        } catch (IllegalArgumentException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
