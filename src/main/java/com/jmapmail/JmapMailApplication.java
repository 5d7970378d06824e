package com.jmapmail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * JMAP Mail Server
 *
 * JMAP (RFC 8620/8621) mail backend
 * - Per-account change log and state tracking for incremental sync
 * - Mailbox / Email / Thread mutation engines
 * - MyBatis + SQLite persistence
 * - ActiveMQ inbound and submission queues
 * - Jakarta Mail MIME parsing and SMTP delivery
 * - Retrying outbound submission queue with webhook reconciliation
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.jmapmail.mapper")
@EnableConfigurationProperties
@EnableScheduling
public class JmapMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(JmapMailApplication.class, args);
    }
}
