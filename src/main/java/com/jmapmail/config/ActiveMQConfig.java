package com.jmapmail.config;

import jakarta.jms.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.activemq.ActiveMQConnectionFactory;
import org.apache.activemq.broker.BrokerService;
import org.apache.activemq.command.ActiveMQDestination;
import org.apache.activemq.command.ActiveMQQueue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jms.annotation.EnableJms;
import org.springframework.jms.config.DefaultJmsListenerContainerFactory;
import org.springframework.lang.NonNull;

/**
 * Embedded broker carrying the submission and inbound queues.
 * Queue messages are only wake-ups: the database is the source of truth and the sweep
 * recovers anything lost, so the broker keeps nothing on disk.
 */
@Slf4j
@Configuration
@EnableJms
public class ActiveMQConfig {

    static final String BROKER_NAME = "jmapmail";

    @Bean(initMethod = "start", destroyMethod = "stop")
    public BrokerService brokerService(ServerProperties properties) {
        BrokerService broker = new BrokerService();
        broker.setBrokerName(BROKER_NAME);
        broker.setPersistent(false);
        broker.setUseJmx(false);
        broker.setDestinations(new ActiveMQDestination[]{
                new ActiveMQQueue(properties.getQueue().getSubmissionDestination()),
                new ActiveMQQueue(properties.getQueue().getInboundDestination())
        });
        log.info("Embedded broker {} configured: queues {}, {}", BROKER_NAME,
                properties.getQueue().getSubmissionDestination(), properties.getQueue().getInboundDestination());
        return broker;
    }

    @Bean
    @DependsOn("brokerService")
    public @NonNull ConnectionFactory connectionFactory() {
        ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(brokerUrl());
        // Only text and bytes messages are exchanged
        factory.setTrustAllPackages(false);
        return factory;
    }

    @Bean
    public DefaultJmsListenerContainerFactory jmsListenerContainerFactory(ConnectionFactory connectionFactory,
                                                                          ServerProperties properties) {
        DefaultJmsListenerContainerFactory factory = new DefaultJmsListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setConcurrency(properties.getQueue().getListenerConcurrency());
        factory.setSessionTransacted(true);
        return factory;
    }

    /**
     * In-VM connection to the embedded broker; never auto-creates a second broker
     */
    static String brokerUrl() {
        return "vm://" + BROKER_NAME + "?create=false";
    }
}
